package org.eclipse.tesla.assets.maven.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.io.IOException;

import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;

import org.apache.maven.plugin.MojoExecution;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugin.descriptor.MojoDescriptor;
import org.apache.maven.plugin.descriptor.PluginDescriptor;
import org.apache.maven.project.MavenProject;
import org.eclipse.tesla.assets.AssetTaskEngine;
import org.eclipse.tesla.assets.BuildException;
import org.eclipse.tesla.assets.BuildOutcome;
import org.eclipse.tesla.assets.BuildState;
import org.eclipse.tesla.assets.InputFailure;
import org.eclipse.tesla.assets.TaskConfiguration;
import org.eclipse.tesla.assets.TaskResult;
import org.eclipse.tesla.assets.internal.DefaultAssetTaskEngine;
import org.eclipse.tesla.assets.internal.Digester;
import org.eclipse.tesla.assets.internal.DigestUtils;
import org.eclipse.tesla.assets.internal.FileUtils;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

/**
 * Runs asset tasks inside a Maven build. Provides
 * <ul>
 * <li>Conventional location of the incremental build state under ${project.build.directory}/incremental, one state
 * file per output directory and mojo execution.</li>
 * <li>Automatic full rebuild when the plugin version changes.</li>
 * <li>Translation of failed inputs into a {@link MojoFailureException} listing every failure.</li>
 * </ul>
 */
@Named
@Singleton
public class MavenTaskStateManager
{

    static final String STATE_DIRECTORY = "incremental";

    static final String PLUGIN_PROPERTY = "maven.plugin";

    private final AssetTaskEngine engine;

    private final Logger log;

    @Inject
    public MavenTaskStateManager( AssetTaskEngine engine, Logger log )
    {
        this.log = ( log != null ) ? log : NOPLogger.NOP_LOGGER;
        this.engine = ( engine != null ) ? engine : new DefaultAssetTaskEngine( null, this.log );
    }

    /**
     * Runs the specified task, reusing the build state of the previous execution of the same mojo.
     *
     * @param task The task to run, must not be {@code null}.
     * @param project The current project, must not be {@code null}.
     * @param execution The current mojo execution, must not be {@code null}.
     * @return The outcome of the successful run, never {@code null}.
     * @throws MojoExecutionException If the task could not be configured or run.
     * @throws MojoFailureException If any input failed.
     */
    public BuildOutcome execute( TaskConfiguration.Builder task, MavenProject project, MojoExecution execution )
        throws MojoExecutionException, MojoFailureException
    {
        String builderId = getBuilderId( execution );

        // plugin artifact defines behaviour, rebuild whenever behaviour changes
        PluginDescriptor plugin = execution.getMojoDescriptor().getPluginDescriptor();
        if ( plugin != null )
        {
            task.property( PLUGIN_PROPERTY, plugin.getGroupId() + ":" + plugin.getArtifactId() + ":"
                + plugin.getVersion() );
        }

        TaskConfiguration configuration;
        try
        {
            configuration = task.build();
        }
        catch ( IllegalArgumentException e )
        {
            throw new MojoExecutionException( "Invalid configuration of " + builderId + ": " + e.getMessage(), e );
        }

        File stateFile = getStateFile( configuration.getOutputDirectory(), getStateDirectory( project ), builderId );

        BuildState previous = loadState( stateFile );

        if ( log.isDebugEnabled() )
        {
            log.debug( "Running " + configuration + " with " + ( ( previous != null ) ? "" : "no " )
                + "incremental build state from " + stateFile );
        }

        TaskResult result;
        try
        {
            result = engine.run( configuration, previous );
        }
        catch ( BuildException e )
        {
            destroy( stateFile );
            throw new MojoExecutionException( e.getMessage(), e );
        }
        catch ( RuntimeException e )
        {
            destroy( stateFile );
            throw e;
        }

        saveState( result.getState(), stateFile );

        BuildOutcome outcome = result.getOutcome();

        if ( outcome.getProcessed().isEmpty() && outcome.getRemoved().isEmpty() && outcome.isSuccessful() )
        {
            log.info( "All " + configuration.getName() + " outputs are up to date" );
        }

        if ( !outcome.isSuccessful() )
        {
            for ( InputFailure failure : outcome.getFailures() )
            {
                log.error( failure.toString(), failure.getCause() );
            }
            throw new MojoFailureException( getFailureMessage( configuration, outcome ) );
        }

        return outcome;
    }

    static String getFailureMessage( TaskConfiguration configuration, BuildOutcome outcome )
    {
        int errors = outcome.getFailures().size();
        StringBuilder sb = new StringBuilder( 256 );
        sb.append( errors ).append( ' ' ).append( configuration.getName() ).append( " input" );
        sb.append( ( errors == 1 ) ? "" : "s" ).append( " failed" );
        for ( InputFailure failure : outcome.getFailures() )
        {
            sb.append( System.lineSeparator() ).append( failure );
        }
        return sb.toString();
    }

    /**
     * Identifies the mojo execution owning a state file. The plugin version is not part of it, a version change
     * is detected as configuration change of the existing state instead.
     */
    static String getBuilderId( MojoExecution execution )
    {
        MojoDescriptor mojo = execution.getMojoDescriptor();
        PluginDescriptor plugin = mojo.getPluginDescriptor();
        StringBuilder sb = new StringBuilder( 128 );
        if ( plugin != null )
        {
            sb.append( plugin.getGroupId() ).append( ':' ).append( plugin.getArtifactId() ).append( ':' );
        }
        sb.append( mojo.getGoal() ).append( ':' ).append( execution.getExecutionId() );
        return sb.toString();
    }

    protected File getStateDirectory( MavenProject project )
    {
        return new File( project.getBuild().getDirectory(), STATE_DIRECTORY );
    }

    protected File getStateFile( File outputDirectory, File stateDirectory, String builderId )
    {
        Digester digester = new Digester();
        String digest1 =
            DigestUtils.toHexString( digester.string( FileUtils.normalize( outputDirectory ).getPath() ).finish() );
        String digest2 = DigestUtils.toHexString( digester.string( builderId ).finish() );
        return new File( stateDirectory.getAbsolutePath(), digest1 + "-" + digest2 + ".ser" );
    }

    private BuildState loadState( File stateFile )
    {
        if ( !stateFile.isFile() )
        {
            return null;
        }
        try
        {
            return BuildState.load( stateFile );
        }
        catch ( IOException e )
        {
            log.warn( "Could not deserialize incremental build state from " + stateFile + ", performing full build",
                      log.isDebugEnabled() ? e : null );
            return null;
        }
    }

    private void saveState( BuildState state, File stateFile )
    {
        try
        {
            state.save( stateFile );
        }
        catch ( IOException e )
        {
            log.warn( "Could not serialize incremental build state to " + stateFile, log.isDebugEnabled() ? e : null );
            destroy( stateFile );
        }
    }

    private void destroy( File stateFile )
    {
        if ( stateFile.exists() && !stateFile.delete() )
        {
            log.warn( "Could not delete incremental build state " + stateFile + ", next build may be inaccurate" );
        }
    }

}
