package org.eclipse.tesla.assets;

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
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class AssetTasksTest
{

    private final File basedir = new File( "project" ).getAbsoluteFile();

    private final File outputDirectory = new File( basedir, "target/assets" );

    private static List<String> expand( TaskConfiguration config, int invocation, File input )
    {
        File output = config.getOutputMapper().getOutputs( input, config.getOutputDirectory() ).get( 0 );
        return config.getInvocations().get( invocation ).expand( input, output, config.getOutputDirectory() );
    }

    @Test
    void materialsRunOptimizingCompilerWithProfile()
    {
        File input = new File( basedir, "materials/lit.mat" );
        TaskConfiguration config =
            AssetTasks.materials( new File( "tools/matc" ), new PathSet( new File( basedir, "materials" ) ),
                                  outputDirectory ).build();

        assertThat( config.getName() ).isEqualTo( "material" );
        assertThat( config.getAction() ).isEqualTo( "Compiling" );
        assertThat( config.getInvocations() ).hasSize( 1 );
        assertThat( expand( config, 0, input ) ).containsExactly( "-O", "-p", "mobile", "-o",
                                                                  new File( outputDirectory, "lit.filamat" ).getPath(),
                                                                  input.getPath() );
        assertThat( config.getCleanPatterns() ).containsExactly( "*.filamat" );
    }

    @Test
    void blankProfileFallsBackToMobile()
    {
        TaskConfiguration config =
            AssetTasks.materials( new File( "tools/matc" ), new PathSet( basedir ), outputDirectory, "" ).build();

        assertThat( config.getInvocations().get( 0 ).getArguments() ).contains( AssetTasks.DEFAULT_MATERIAL_PROFILE );
    }

    @Test
    void iblRunsCubemapGeneratorTwice()
    {
        File input = new File( basedir, "envs/venetian_crossroads.hdr" );
        TaskConfiguration config = AssetTasks.ibl( new File( "tools/cmgen" ), input, outputDirectory ).build();

        assertThat( config.getInvocations() ).hasSize( 2 );
        assertThat( expand( config, 0, input ) ).containsExactly( "-x", outputDirectory.getPath(), input.getPath() );
        assertThat( expand( config, 1, input ) ).containsExactly( "--format=rgbm", "--extract-blur=0.08",
                                                                  "--extract=" + outputDirectory.getPath(),
                                                                  input.getPath() );
        assertThat( config.getOutputMapper().getOutputs( input, outputDirectory ) ).containsExactly( new File( outputDirectory,
                                                                                                               "venetian_crossroads" ) );
        assertThat( config.getCleanPatterns() ).containsExactly( "**" );
    }

    @Test
    void iblSelectsExactlyTheEnvironmentMap()
    {
        File input = new File( basedir, "envs/studio[1].hdr" );
        PathSet inputs = AssetTasks.ibl( new File( "tools/cmgen" ), input, outputDirectory ).build().getInputs();

        assertThat( inputs.getBasedir() ).isEqualTo( new File( basedir, "envs" ) );
        assertThat( inputs.getIncludes() ).containsExactly( "studio[1].hdr" );
    }

    @Test
    void meshPassesInputBeforeOutput()
    {
        File input = new File( basedir, "models/helmet.obj" );
        TaskConfiguration config = AssetTasks.mesh( new File( "tools/filamesh" ), input, outputDirectory ).build();

        assertThat( expand( config, 0, input ) ).isEqualTo( Arrays.asList( input.getPath(),
                                                                           new File( outputDirectory,
                                                                                     "helmet.filamesh" ).getPath() ) );
        assertThat( config.getCleanPatterns() ).containsExactly( "*.filamesh" );
    }

    @Test
    void incompleteConfigurationIsRejected()
    {
        final PathSet inputs = new PathSet( basedir );

        assertThatThrownBy( () -> AssetTasks.materials( null, inputs, outputDirectory ).build() )
            .isInstanceOf( IllegalArgumentException.class )
            .hasMessageContaining( "tool" );
        assertThatThrownBy( () -> AssetTasks.mesh( new File( "filamesh" ), null, outputDirectory ) )
            .isInstanceOf( IllegalArgumentException.class );
        assertThatThrownBy( () -> AssetTasks.mesh( new File( "filamesh" ), new File( "a.obj" ), null ).build() )
            .isInstanceOf( IllegalArgumentException.class )
            .hasMessageContaining( "output directory" );
    }

    @Test
    void threadsAndTimeoutAreValidated()
    {
        final TaskConfiguration.Builder builder =
            AssetTasks.materials( new File( "matc" ), new PathSet( basedir ), outputDirectory );

        assertThatThrownBy( () -> builder.threads( 0 ) ).isInstanceOf( IllegalArgumentException.class );
        assertThatThrownBy( () -> builder.timeout( -1 ) ).isInstanceOf( IllegalArgumentException.class );
        assertThat( builder.threads( 3 ).timeout( 500 ).build().getThreads() ).isEqualTo( 3 );
    }

}
