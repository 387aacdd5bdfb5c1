package org.eclipse.tesla.assets.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import static org.assertj.core.api.Assertions.assertThat;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.eclipse.tesla.assets.ProcessOutputHandler;
import org.eclipse.tesla.assets.ProcessResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class DefaultProcessRunnerTest
{

    @TempDir
    File tempDir;

    DefaultProcessRunner runner;

    RecordingHandler handler;

    @BeforeEach
    void setUp()
    {
        runner = new DefaultProcessRunner( LoggerFactory.getLogger( DefaultProcessRunnerTest.class ) );
        handler = new RecordingHandler();
    }

    private List<String> stub( String... commands )
    {
        List<String> args = new ArrayList<String>();
        args.add( "-cp" );
        args.add( ToolStub.classpath() );
        args.add( ToolStub.class.getName() );
        args.addAll( Arrays.asList( commands ) );
        return args;
    }

    @Test
    void successfulToolStreamsBothOutputsToHandler()
    {
        ProcessResult result =
            runner.execute( ToolStub.javaExecutable(), stub( "out:first", "err:warning", "out:second" ), 0, handler );

        assertThat( result.isSuccess() ).isTrue();
        assertThat( result.getExitCode() ).isZero();
        assertThat( handler.stdout ).containsExactly( "first", "second" );
        // the JVM may print notes like "Picked up JAVA_TOOL_OPTIONS" on its own
        assertThat( handler.stderr ).contains( "warning" );
        assertThat( result.getErrorOutput() ).contains( "warning" );
        assertThat( result.getFailureMessage() ).isNull();
    }

    @Test
    void nonZeroExitIsFailureWithCapturedErrorOutput()
    {
        ProcessResult result =
            runner.execute( ToolStub.javaExecutable(), stub( "err:ERROR: bad.mat:3: syntax error", "exit:3" ), 0,
                            handler );

        assertThat( result.isSuccess() ).isFalse();
        assertThat( result.isStarted() ).isTrue();
        assertThat( result.getExitCode() ).isEqualTo( 3 );
        assertThat( result.getErrorOutput() ).contains( "ERROR: bad.mat:3: syntax error" );
        assertThat( result.getFailureMessage() ).isEqualTo( "exited with code 3" );
    }

    @Test
    void missingExecutableIsReportedAsNotStarted()
    {
        File missing = new File( tempDir, "no-such-tool" );

        ProcessResult result = runner.execute( missing, Collections.<String> emptyList(), 0, handler );

        assertThat( result.isSuccess() ).isFalse();
        assertThat( result.isStarted() ).isFalse();
        assertThat( result.getCause() ).isInstanceOf( IOException.class );
        assertThat( result.getFailureMessage() ).startsWith( "could not be started" );
        assertThat( handler.stdout ).isEmpty();
    }

    @Test
    void hangingToolIsKilledAfterTimeout()
    {
        long start = System.currentTimeMillis();

        ProcessResult result =
            runner.execute( ToolStub.javaExecutable(), stub( "out:started", "sleep:60000" ), 3000, handler );

        assertThat( result.isSuccess() ).isFalse();
        assertThat( result.isTimedOut() ).isTrue();
        assertThat( result.getFailureMessage() ).isEqualTo( "timed out" );
        assertThat( handler.stdout ).containsExactly( "started" );
        assertThat( System.currentTimeMillis() - start ).isLessThan( 30000 );
    }

    @Test
    void outputReachesHandlerWhileToolIsStillRunning()
    {
        ProcessResult result =
            runner.execute( ToolStub.javaExecutable(), stub( "out:hello", "sleep:3000", "out:bye" ), 0, handler );
        long exited = System.currentTimeMillis();

        assertThat( result.isSuccess() ).isTrue();
        assertThat( handler.stdout ).containsExactly( "hello", "bye" );
        assertThat( handler.firstStdout ).isPositive();
        assertThat( exited - handler.firstStdout ).isGreaterThanOrEqualTo( 2000 );
    }

    @Test
    void exitedToolIsNotWaitedForWhileItsChildKeepsOutputOpen()
    {
        long start = System.currentTimeMillis();

        ProcessResult result =
            runner.execute( ToolStub.javaExecutable(), stub( "out:compiled", "spawn:20000" ), 0, handler );

        assertThat( result.isSuccess() ).isTrue();
        assertThat( handler.stdout ).contains( "compiled" );
        assertThat( System.currentTimeMillis() - start ).isLessThan( 15000 );
    }

    static class RecordingHandler
        implements ProcessOutputHandler
    {

        final List<String> stdout = Collections.synchronizedList( new ArrayList<String>() );

        final List<String> stderr = Collections.synchronizedList( new ArrayList<String>() );

        volatile long firstStdout;

        public void stdout( String line )
        {
            if ( firstStdout == 0 )
            {
                firstStdout = System.currentTimeMillis();
            }
            stdout.add( line );
        }

        public void stderr( String line )
        {
            stderr.add( line );
        }

    }

}
