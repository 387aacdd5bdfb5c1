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
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;

import org.eclipse.tesla.assets.ProcessOutputHandler;
import org.eclipse.tesla.assets.ProcessResult;
import org.eclipse.tesla.assets.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

@Named
@Singleton
public class DefaultProcessRunner
    implements ProcessRunner
{

    private static final long DESTROY_GRACE_MILLIS = 5000;

    protected Logger log;

    public DefaultProcessRunner()
    {
        this( null );
    }

    @Inject
    public DefaultProcessRunner( Logger log )
    {
        this.log = ( log != null ) ? log : NOPLogger.NOP_LOGGER;
    }

    public ProcessResult execute( File executable, List<String> arguments, long timeout, ProcessOutputHandler handler )
    {
        if ( executable == null )
        {
            throw new IllegalArgumentException( "executable not specified" );
        }
        if ( arguments == null )
        {
            throw new IllegalArgumentException( "arguments not specified" );
        }
        if ( handler == null )
        {
            throw new IllegalArgumentException( "output handler not specified" );
        }

        List<String> command = new ArrayList<String>( arguments.size() + 1 );
        command.add( executable.getPath() );
        command.addAll( arguments );

        if ( log.isDebugEnabled() )
        {
            log.debug( "Executing " + command );
        }

        Process process;
        try
        {
            process = new ProcessBuilder( command ).start();
        }
        catch ( IOException e )
        {
            return ProcessResult.notStarted( e );
        }

        try
        {
            process.getOutputStream().close();
        }
        catch ( IOException e )
        {
            log.debug( "Could not close standard input of " + executable, e );
        }

        List<String> errorOutput = Collections.synchronizedList( new ArrayList<String>() );

        String name = executable.getName();
        StreamPumper stdout = new StreamPumper( name + "-stdout", process.getInputStream(), handler, false, null );
        StreamPumper stderr = new StreamPumper( name + "-stderr", process.getErrorStream(), handler, true, errorOutput );
        stdout.start();
        stderr.start();

        try
        {
            boolean finished;
            if ( timeout > 0 )
            {
                finished = process.waitFor( timeout, TimeUnit.MILLISECONDS );
            }
            else
            {
                process.waitFor();
                finished = true;
            }

            if ( !finished )
            {
                log.warn( "Killing " + executable + " after " + timeout + " ms" );
                process.destroyForcibly();
                process.waitFor( DESTROY_GRACE_MILLIS, TimeUnit.MILLISECONDS );
                stdout.join( DESTROY_GRACE_MILLIS );
                stderr.join( DESTROY_GRACE_MILLIS );
                return ProcessResult.aborted( true, snapshot( errorOutput ), null );
            }

            // a grandchild of the tool may still hold the pipes open
            stdout.join( DESTROY_GRACE_MILLIS );
            stderr.join( DESTROY_GRACE_MILLIS );
            if ( stdout.isAlive() || stderr.isAlive() )
            {
                log.warn( "Output of " + executable + " is still open after it exited, ignoring further output" );
            }
        }
        catch ( InterruptedException e )
        {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return ProcessResult.aborted( false, snapshot( errorOutput ), e );
        }

        if ( stderr.getException() != null && log.isDebugEnabled() )
        {
            log.debug( "Error output of " + executable + " is incomplete", stderr.getException() );
        }

        return ProcessResult.exited( process.exitValue(), snapshot( errorOutput ) );
    }

    private static List<String> snapshot( List<String> lines )
    {
        synchronized ( lines )
        {
            return new ArrayList<String>( lines );
        }
    }

}
