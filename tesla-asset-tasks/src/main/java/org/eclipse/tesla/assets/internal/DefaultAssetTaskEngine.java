package org.eclipse.tesla.assets.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;

import org.eclipse.tesla.assets.ArgumentTemplate;
import org.eclipse.tesla.assets.AssetTaskEngine;
import org.eclipse.tesla.assets.BuildException;
import org.eclipse.tesla.assets.BuildOutcome;
import org.eclipse.tesla.assets.BuildState;
import org.eclipse.tesla.assets.InputFailure;
import org.eclipse.tesla.assets.PathSet;
import org.eclipse.tesla.assets.ProcessOutputHandler;
import org.eclipse.tesla.assets.ProcessResult;
import org.eclipse.tesla.assets.ProcessRunner;
import org.eclipse.tesla.assets.TaskConfiguration;
import org.eclipse.tesla.assets.TaskResult;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

@Named
@Singleton
public class DefaultAssetTaskEngine
    implements AssetTaskEngine
{

    protected Logger log;

    private final ProcessRunner processRunner;

    public DefaultAssetTaskEngine()
    {
        this( null, null );
    }

    @Inject
    public DefaultAssetTaskEngine( ProcessRunner processRunner, Logger log )
    {
        this.log = ( log != null ) ? log : NOPLogger.NOP_LOGGER;
        this.processRunner = ( processRunner != null ) ? processRunner : new DefaultProcessRunner( this.log );
    }

    public TaskResult run( TaskConfiguration configuration, BuildState previous )
    {
        if ( configuration == null )
        {
            throw new IllegalArgumentException( "task configuration not specified" );
        }

        long start = System.currentTimeMillis();

        File tool = configuration.getTool();
        if ( !tool.isFile() )
        {
            throw new BuildException( "No " + configuration.getName() + " tool found at " + tool
                + ", ensure it has been built/installed before running this task" );
        }

        File outputDirectory = configuration.getOutputDirectory();

        byte[] digest = digestConfiguration( configuration );

        boolean fullBuild = previous == null || previous.isConfigurationChanged( digest );

        if ( fullBuild )
        {
            if ( log.isDebugEnabled() )
            {
                log.debug( "Performing full " + configuration.getName() + " build"
                    + ( ( previous != null ) ? " due to configuration change" : "" ) + ", cleaning "
                    + outputDirectory );
            }
            clean( configuration );
        }

        try
        {
            FileUtils.mkdirs( outputDirectory );
        }
        catch ( IOException e )
        {
            throw new BuildException( e.getMessage(), e );
        }

        BuildState baseline = fullBuild ? new BuildState() : previous;

        InputDelta delta = computeDelta( configuration, baseline, previous );

        BuildState state = new BuildState();
        state.setConfiguration( digest );

        for ( File input : delta.unchanged )
        {
            state.putInput( input, baseline.getFingerprint( input ), baseline.getOutputs( input ) );
        }

        List<InputFailure> failures = new ArrayList<InputFailure>( delta.unreadable );

        Map<File, List<File>> untrustedOutputs = new LinkedHashMap<File, List<File>>();
        for ( InputFailure failure : delta.unreadable )
        {
            untrustedOutputs.put( failure.getInput(), mapOutputs( configuration, failure.getInput() ) );
        }

        List<File> processed = new ArrayList<File>();

        for ( InputOutcome outcome : process( configuration, delta ) )
        {
            if ( outcome.failure != null )
            {
                failures.add( outcome.failure );
                untrustedOutputs.put( outcome.input, outcome.outputs );
            }
            else
            {
                processed.add( outcome.input );
                state.putInput( outcome.input, outcome.fingerprint, outcome.outputs );
            }
        }

        List<File> removed = new ArrayList<File>();

        Set<File> claimedOutputs = new HashSet<File>();
        for ( File input : state.getInputs() )
        {
            claimedOutputs.addAll( state.getOutputs( input ) );
        }

        // outputs are flat, a failed input must not take down the output of a colliding input that succeeded
        for ( Map.Entry<File, List<File>> entry : untrustedOutputs.entrySet() )
        {
            deleteUntrustedOutputs( entry.getKey(), entry.getValue(), claimedOutputs );
        }

        for ( File input : delta.removed )
        {
            InputFailure failure = deleteOrphanedOutputs( configuration, input, previous, claimedOutputs );
            if ( failure != null )
            {
                failures.add( failure );
                state.putInput( input, previous.getFingerprint( input ), previous.getOutputs( input ) );
            }
            else
            {
                removed.add( input );
            }
        }

        BuildOutcome outcome = new BuildOutcome( fullBuild, processed, delta.unchanged.size(), removed, failures );

        if ( log.isDebugEnabled() )
        {
            long millis = System.currentTimeMillis() - start;
            log.debug( configuration.getName() + " " + outcome + ", " + millis + " ms" );
        }

        return new TaskResult( state, outcome );
    }

    /**
     * Computes the fingerprint of everything besides the inputs that affects the outputs. The input location is not
     * part of it, moving inputs is handled as removal plus addition.
     */
    protected byte[] digestConfiguration( TaskConfiguration configuration )
    {
        Digester digester = new Digester();
        digester.string( configuration.getName() );
        digester.file( configuration.getTool() );
        for ( ArgumentTemplate invocation : configuration.getInvocations() )
        {
            digester.strings( invocation.getArguments() );
        }
        digester.string( FileUtils.normalize( configuration.getOutputDirectory() ).getPath() );
        digester.string( configuration.getOutputMapper().toString() );
        for ( Map.Entry<String, String> property : configuration.getProperties().entrySet() )
        {
            digester.strings( property.getKey(), property.getValue() );
        }
        return digester.finish();
    }

    private void clean( TaskConfiguration configuration )
    {
        File outputDirectory = configuration.getOutputDirectory();

        if ( configuration.getCleanPatterns().isEmpty() || !outputDirectory.isDirectory() )
        {
            return;
        }

        final Collection<File> stale = new ArrayList<File>();

        GlobSelector selector = new GlobSelector( configuration.getCleanPatterns(), null );
        DirectoryScan scan = new DirectoryScan( outputDirectory, selector, true, true )
        {
            @Override
            protected void onItem( String pathname, File file )
            {
                stale.add( file );
            }
        };
        scan.run();

        for ( File file : stale )
        {
            try
            {
                if ( FileUtils.delete( file ) )
                {
                    log.debug( "Deleted stale output " + file );
                }
            }
            catch ( IOException e )
            {
                throw new BuildException( "Could not clean output directory " + outputDirectory + ": "
                    + e.getMessage(), e );
            }
        }
    }

    private InputDelta computeDelta( TaskConfiguration configuration, BuildState baseline, BuildState previous )
    {
        final InputDelta delta = new InputDelta();

        PathSet inputs = configuration.getInputs();

        final Collection<File> selectedFiles = new TreeSet<File>();

        DirectoryScan scan = new DirectoryScan( inputs.getBasedir(), new GlobSelector( inputs ), false, true )
        {
            @Override
            protected void onItem( String pathname, File file )
            {
                selectedFiles.add( FileUtils.normalize( file ) );
            }
        };
        scan.run();

        for ( File input : selectedFiles )
        {
            String fingerprint;
            try
            {
                fingerprint = DigestUtils.sha1( input );
            }
            catch ( IOException e )
            {
                delta.unreadable.add( new InputFailure( input, "Could not read input: " + e.getMessage(), null, e ) );
                continue;
            }

            if ( fingerprint.equals( baseline.getFingerprint( input ) ) && outputsExist( baseline.getOutputs( input ) ) )
            {
                delta.unchanged.add( input );
            }
            else
            {
                delta.changed.put( input, fingerprint );
            }
        }

        if ( previous != null )
        {
            for ( File input : previous.getInputs() )
            {
                if ( !selectedFiles.contains( input ) )
                {
                    delta.removed.add( input );
                }
            }
        }

        if ( log.isDebugEnabled() )
        {
            log.debug( selectedFiles.size() + " " + configuration.getName() + " inputs, " + delta.changed.size()
                + " out of date, " + delta.removed.size() + " removed" );
        }

        return delta;
    }

    private static boolean outputsExist( Collection<File> outputs )
    {
        if ( outputs.isEmpty() )
        {
            return false;
        }
        for ( File output : outputs )
        {
            if ( !output.exists() )
            {
                return false;
            }
        }
        return true;
    }

    private List<InputOutcome> process( final TaskConfiguration configuration, final InputDelta delta )
    {
        List<InputOutcome> outcomes = new ArrayList<InputOutcome>();

        int threads = Math.min( configuration.getThreads(), delta.changed.size() );

        if ( threads <= 1 )
        {
            for ( Map.Entry<File, String> entry : delta.changed.entrySet() )
            {
                outcomes.add( process( configuration, entry.getKey(), entry.getValue() ) );
            }
            return outcomes;
        }

        ExecutorService executor = Executors.newFixedThreadPool( threads );
        try
        {
            List<Future<InputOutcome>> futures = new ArrayList<Future<InputOutcome>>();
            for ( final Map.Entry<File, String> entry : delta.changed.entrySet() )
            {
                futures.add( executor.submit( new Callable<InputOutcome>()
                {
                    public InputOutcome call()
                    {
                        return process( configuration, entry.getKey(), entry.getValue() );
                    }
                } ) );
            }

            for ( Future<InputOutcome> future : futures )
            {
                outcomes.add( future.get() );
            }
        }
        catch ( InterruptedException e )
        {
            Thread.currentThread().interrupt();
            throw new BuildException( "Interrupted while processing " + configuration.getName() + " inputs", e );
        }
        catch ( ExecutionException e )
        {
            Throwable cause = e.getCause();
            if ( cause instanceof RuntimeException )
            {
                throw (RuntimeException) cause;
            }
            throw new BuildException( "Failed to process " + configuration.getName() + " inputs", cause );
        }
        finally
        {
            executor.shutdownNow();
        }

        return outcomes;
    }

    private InputOutcome process( TaskConfiguration configuration, File input, String fingerprint )
    {
        log.info( configuration.getAction() + " " + configuration.getName() + " " + input );

        File outputDirectory = configuration.getOutputDirectory();

        List<File> outputs = mapOutputs( configuration, input );
        if ( outputs.isEmpty() )
        {
            return InputOutcome.failed( new InputFailure( input, "No outputs mapped for input", null, null ), outputs );
        }

        ProcessOutputHandler handler = new LoggingOutputHandler( log );

        for ( ArgumentTemplate invocation : configuration.getInvocations() )
        {
            List<String> arguments = invocation.expand( input, outputs.get( 0 ), outputDirectory );

            ProcessResult result =
                processRunner.execute( configuration.getTool(), arguments, configuration.getTimeout(), handler );

            if ( !result.isSuccess() )
            {
                String message = configuration.getTool().getName() + " " + result.getFailureMessage();
                return InputOutcome.failed( new InputFailure( input, message, result.getErrorOutput(),
                                                              result.getCause() ), outputs );
            }
        }

        for ( File output : outputs )
        {
            if ( !output.exists() )
            {
                String message = configuration.getTool().getName() + " did not produce " + output;
                return InputOutcome.failed( new InputFailure( input, message, null, null ), outputs );
            }
        }

        return InputOutcome.succeeded( input, fingerprint, outputs );
    }

    private List<File> mapOutputs( TaskConfiguration configuration, File input )
    {
        return normalize( configuration.getOutputMapper().getOutputs( input, configuration.getOutputDirectory() ) );
    }

    private void deleteUntrustedOutputs( File input, List<File> outputs, Set<File> claimedOutputs )
    {
        for ( File output : outputs )
        {
            if ( claimedOutputs.contains( output ) )
            {
                log.debug( "Keeping " + output + " of failed input " + input + ", it belongs to another input" );
                continue;
            }
            try
            {
                FileUtils.delete( output );
            }
            catch ( IOException e )
            {
                log.warn( "Could not delete untrusted output " + output + " of failed input " + input + ": "
                    + e.getMessage() );
            }
        }
    }

    private InputFailure deleteOrphanedOutputs( TaskConfiguration configuration, File input, BuildState previous,
                                                Set<File> claimedOutputs )
    {
        Collection<File> outputs = new LinkedHashSet<File>( previous.getOutputs( input ) );
        outputs.addAll( mapOutputs( configuration, input ) );

        for ( File output : outputs )
        {
            if ( claimedOutputs.contains( output ) )
            {
                continue;
            }
            try
            {
                if ( FileUtils.delete( output ) )
                {
                    log.debug( "Deleted orphaned output " + output );
                }
            }
            catch ( IOException e )
            {
                return new InputFailure( input, "Could not delete output of removed input: " + e.getMessage(), null,
                                         e );
            }
        }

        return null;
    }

    private static List<File> normalize( List<File> files )
    {
        if ( files == null || files.isEmpty() )
        {
            return Collections.emptyList();
        }
        List<File> normalized = new ArrayList<File>( files.size() );
        for ( File file : files )
        {
            normalized.add( FileUtils.normalize( file ) );
        }
        return normalized;
    }

    static final class InputOutcome
    {

        final File input;

        final String fingerprint;

        final List<File> outputs;

        final InputFailure failure;

        private InputOutcome( File input, String fingerprint, List<File> outputs, InputFailure failure )
        {
            this.input = input;
            this.fingerprint = fingerprint;
            this.outputs = outputs;
            this.failure = failure;
        }

        static InputOutcome succeeded( File input, String fingerprint, List<File> outputs )
        {
            return new InputOutcome( input, fingerprint, outputs, null );
        }

        static InputOutcome failed( InputFailure failure, List<File> outputs )
        {
            return new InputOutcome( failure.getInput(), null, outputs, failure );
        }

    }

}
