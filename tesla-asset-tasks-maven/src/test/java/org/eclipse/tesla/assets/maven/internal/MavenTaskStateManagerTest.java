package org.eclipse.tesla.assets.maven.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.maven.plugin.MojoExecution;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugin.descriptor.MojoDescriptor;
import org.apache.maven.plugin.descriptor.PluginDescriptor;
import org.apache.maven.project.MavenProject;
import org.eclipse.tesla.assets.AssetTasks;
import org.eclipse.tesla.assets.BuildOutcome;
import org.eclipse.tesla.assets.PathSet;
import org.eclipse.tesla.assets.ProcessOutputHandler;
import org.eclipse.tesla.assets.ProcessResult;
import org.eclipse.tesla.assets.ProcessRunner;
import org.eclipse.tesla.assets.TaskConfiguration;
import org.eclipse.tesla.assets.internal.DefaultAssetTaskEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class MavenTaskStateManagerTest
{

    private static final Logger log = LoggerFactory.getLogger( MavenTaskStateManagerTest.class );

    @TempDir
    File basedir;

    File matc;

    File materials;

    File outputDirectory;

    MavenProject project;

    FakeMatc runner;

    MavenTaskStateManager manager;

    @BeforeEach
    void setUp()
        throws IOException
    {
        matc = write( new File( basedir, "tools/matc" ), "#!/bin/sh" );
        materials = new File( basedir, "src/main/materials" );
        outputDirectory = new File( basedir, "target/generated-assets/materials" );

        project = new MavenProject();
        project.getBuild().setDirectory( new File( basedir, "target" ).getAbsolutePath() );

        runner = new FakeMatc();
        manager = new MavenTaskStateManager( new DefaultAssetTaskEngine( runner, log ), log );
    }

    private static File write( File file, String content )
        throws IOException
    {
        file.getParentFile().mkdirs();
        OutputStream os = new FileOutputStream( file );
        try
        {
            os.write( content.getBytes( StandardCharsets.UTF_8 ) );
        }
        finally
        {
            os.close();
        }
        return file;
    }

    private static MojoExecution execution( String version, String executionId )
    {
        PluginDescriptor plugin = new PluginDescriptor();
        plugin.setGroupId( "org.eclipse.tesla.assets" );
        plugin.setArtifactId( "tesla-asset-maven-plugin" );
        plugin.setVersion( version );

        MojoDescriptor mojo = new MojoDescriptor();
        mojo.setGoal( "compile-materials" );
        mojo.setPluginDescriptor( plugin );

        return new MojoExecution( mojo, executionId );
    }

    private TaskConfiguration.Builder task()
    {
        return AssetTasks.materials( matc, new PathSet( materials, new String[] { "**/*.mat" }, null ),
                                     outputDirectory );
    }

    private File[] stateFiles()
    {
        File[] files = new File( basedir, "target/" + MavenTaskStateManager.STATE_DIRECTORY ).listFiles();
        return ( files != null ) ? files : new File[0];
    }

    @Test
    void stateIsPersistedBetweenExecutions()
        throws Exception
    {
        write( new File( materials, "lit.mat" ), "material lit" );
        write( new File( materials, "unlit.mat" ), "material unlit" );

        BuildOutcome first = manager.execute( task(), project, execution( "1.0", "default" ) );
        assertThat( first.isFullBuild() ).isTrue();
        assertThat( first.getProcessed() ).hasSize( 2 );
        assertThat( stateFiles() ).hasSize( 1 );
        assertThat( stateFiles()[0].getName() ).endsWith( ".ser" );

        write( new File( materials, "lit.mat" ), "material lit, glossier" );
        runner.invocations.clear();
        BuildOutcome second = manager.execute( task(), project, execution( "1.0", "default" ) );

        assertThat( second.isFullBuild() ).isFalse();
        assertThat( second.getProcessed() ).hasSize( 1 );
        assertThat( second.getSkipped() ).isEqualTo( 1 );
        assertThat( runner.invocations ).hasSize( 1 );
    }

    @Test
    void failedInputsFailTheMojo()
        throws IOException
    {
        write( new File( materials, "good.mat" ), "material good" );
        write( new File( materials, "bad.mat" ), "material {" );
        runner.failing = "bad.mat";

        assertThatThrownBy( () -> manager.execute( task(), project, execution( "1.0", "default" ) ) )
            .isInstanceOf( MojoFailureException.class )
            .hasMessageContaining( "1 material input failed" )
            .hasMessageContaining( "bad.mat" )
            .hasMessageContaining( "unexpected token" );

        assertThat( new File( outputDirectory, "good.filamat" ) ).exists();
        assertThat( stateFiles() ).hasSize( 1 );
    }

    @Test
    void missingToolFailsExecutionAndDiscardsState()
        throws Exception
    {
        write( new File( materials, "lit.mat" ), "material lit" );
        manager.execute( task(), project, execution( "1.0", "default" ) );
        assertThat( stateFiles() ).hasSize( 1 );

        assertThat( matc.delete() ).isTrue();

        assertThatThrownBy( () -> manager.execute( task(), project, execution( "1.0", "default" ) ) )
            .isInstanceOf( MojoExecutionException.class )
            .hasMessageContaining( "No material tool found" );
        assertThat( stateFiles() ).isEmpty();
    }

    @Test
    void invalidConfigurationFailsExecution()
    {
        TaskConfiguration.Builder incomplete = AssetTasks.materials( null, new PathSet( materials ), outputDirectory );

        assertThatThrownBy( () -> manager.execute( incomplete, project, execution( "1.0", "default" ) ) )
            .isInstanceOf( MojoExecutionException.class )
            .hasMessageContaining( "tool executable not specified" );
    }

    @Test
    void corruptStateLeadsToFullBuild()
        throws Exception
    {
        write( new File( materials, "lit.mat" ), "material lit" );
        manager.execute( task(), project, execution( "1.0", "default" ) );

        write( stateFiles()[0], "garbage" );
        runner.invocations.clear();
        BuildOutcome outcome = manager.execute( task(), project, execution( "1.0", "default" ) );

        assertThat( outcome.isFullBuild() ).isTrue();
        assertThat( runner.invocations ).hasSize( 1 );
    }

    @Test
    void pluginUpgradeLeadsToFullBuild()
        throws Exception
    {
        write( new File( materials, "lit.mat" ), "material lit" );
        manager.execute( task(), project, execution( "1.0", "default" ) );

        runner.invocations.clear();
        BuildOutcome outcome = manager.execute( task(), project, execution( "1.1", "default" ) );

        assertThat( outcome.isFullBuild() ).isTrue();
        assertThat( runner.invocations ).hasSize( 1 );
        assertThat( stateFiles() ).hasSize( 1 );
    }

    @Test
    void executionsKeepSeparateState()
        throws Exception
    {
        write( new File( materials, "lit.mat" ), "material lit" );
        manager.execute( task(), project, execution( "1.0", "default" ) );
        manager.execute( task(), project, execution( "1.0", "desktop" ) );

        assertThat( stateFiles() ).hasSize( 2 );
        assertThat( MavenTaskStateManager.getBuilderId( execution( "1.0", "desktop" ) ) )
            .isEqualTo( "org.eclipse.tesla.assets:tesla-asset-maven-plugin:compile-materials:desktop" );
    }

    /**
     * Writes the file following {@code -o}, or fails with an error for the configured input.
     */
    static class FakeMatc
        implements ProcessRunner
    {

        final List<List<String>> invocations = Collections.synchronizedList( new ArrayList<List<String>>() );

        String failing;

        public ProcessResult execute( File executable, List<String> arguments, long timeout,
                                      ProcessOutputHandler handler )
        {
            invocations.add( arguments );

            String input = arguments.get( arguments.size() - 1 );
            if ( failing != null && input.endsWith( failing ) )
            {
                handler.stderr( "ERROR: unexpected token '{'" );
                return ProcessResult.exited( 1, Collections.singletonList( "ERROR: unexpected token '{'" ) );
            }

            try
            {
                write( new File( arguments.get( arguments.indexOf( "-o" ) + 1 ) ), "filamat" );
            }
            catch ( IOException e )
            {
                return ProcessResult.aborted( false, null, e );
            }
            return ProcessResult.exited( 0, null );
        }

    }

}
