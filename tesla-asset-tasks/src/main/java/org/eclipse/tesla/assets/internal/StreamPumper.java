package org.eclipse.tesla.assets.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.Collection;

import org.eclipse.tesla.assets.ProcessOutputHandler;

/**
 * Forwards the lines of one output stream of a process to a handler as soon as they are written.
 */
class StreamPumper
    extends Thread
{

    private final InputStream stream;

    private final ProcessOutputHandler handler;

    private final boolean error;

    private final Collection<String> captured;

    private volatile IOException exception;

    StreamPumper( String name, InputStream stream, ProcessOutputHandler handler, boolean error,
                  Collection<String> captured )
    {
        super( name );
        setDaemon( true );
        this.stream = stream;
        this.handler = handler;
        this.error = error;
        this.captured = captured;
    }

    @Override
    public void run()
    {
        BufferedReader reader = new BufferedReader( new InputStreamReader( stream, Charset.defaultCharset() ) );
        try
        {
            for ( String line = reader.readLine(); line != null; line = reader.readLine() )
            {
                if ( captured != null )
                {
                    captured.add( line );
                }
                if ( error )
                {
                    handler.stderr( line );
                }
                else
                {
                    handler.stdout( line );
                }
            }
        }
        catch ( IOException e )
        {
            exception = e;
        }
        finally
        {
            try
            {
                reader.close();
            }
            catch ( IOException e )
            {
                if ( exception == null )
                {
                    exception = e;
                }
            }
        }
    }

    /**
     * Gets the error that stopped the pumping, usually because the process was killed.
     *
     * @return The error or {@code null} if the stream was read completely.
     */
    IOException getException()
    {
        return exception;
    }

}
