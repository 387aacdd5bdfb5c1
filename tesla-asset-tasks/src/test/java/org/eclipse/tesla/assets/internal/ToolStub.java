package org.eclipse.tesla.assets.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * A fake command line tool for tests, launched in a separate JVM. Each argument is a {@code command:value} pair:
 * <ul>
 * <li>{@code out:text} prints a line to standard output</li>
 * <li>{@code err:text} prints a line to standard error</li>
 * <li>{@code write:path} creates the file (and its parent directories)</li>
 * <li>{@code sleep:millis} pauses</li>
 * <li>{@code spawn:millis} starts another stub that sleeps, sharing this process' output streams, without waiting
 * for it</li>
 * <li>{@code exit:code} terminates with the exit code</li>
 * </ul>
 */
public class ToolStub
{

    public static void main( String[] args )
        throws IOException, InterruptedException
    {
        for ( String arg : args )
        {
            int colon = arg.indexOf( ':' );
            String command = arg.substring( 0, colon );
            String value = arg.substring( colon + 1 );
            if ( "out".equals( command ) )
            {
                System.out.println( value );
                System.out.flush();
            }
            else if ( "err".equals( command ) )
            {
                System.err.println( value );
                System.err.flush();
            }
            else if ( "write".equals( command ) )
            {
                File file = new File( value );
                file.getParentFile().mkdirs();
                OutputStream os = new FileOutputStream( file );
                try
                {
                    os.write( "compiled".getBytes( StandardCharsets.UTF_8 ) );
                }
                finally
                {
                    os.close();
                }
            }
            else if ( "sleep".equals( command ) )
            {
                Thread.sleep( Long.parseLong( value ) );
            }
            else if ( "spawn".equals( command ) )
            {
                new ProcessBuilder( javaExecutable().getPath(), "-cp", classpath(), ToolStub.class.getName(),
                                    "sleep:" + value ).inheritIO().start();
            }
            else if ( "exit".equals( command ) )
            {
                System.exit( Integer.parseInt( value ) );
            }
            else
            {
                throw new IllegalArgumentException( "unknown command " + arg );
            }
        }
    }

    static File javaExecutable()
    {
        File bin = new File( System.getProperty( "java.home" ), "bin" );
        File java = new File( bin, "java" );
        if ( !java.isFile() )
        {
            java = new File( bin, "java.exe" );
        }
        return java;
    }

    static String classpath()
    {
        return System.getProperty( "java.class.path" );
    }

}
