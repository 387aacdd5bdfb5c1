package org.eclipse.tesla.assets;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The result of running an external tool.
 */
public final class ProcessResult
{

    /**
     * The exit code reported for processes that could not be started or did not terminate normally.
     */
    public static final int NO_EXIT_CODE = -1;

    private final boolean started;

    private final boolean timedOut;

    private final int exitCode;

    private final List<String> errorOutput;

    private final Throwable cause;

    private ProcessResult( boolean started, boolean timedOut, int exitCode, List<String> errorOutput, Throwable cause )
    {
        this.started = started;
        this.timedOut = timedOut;
        this.exitCode = exitCode;
        this.errorOutput =
            ( errorOutput != null ) ? Collections.unmodifiableList( new ArrayList<String>( errorOutput ) )
                            : Collections.<String> emptyList();
        this.cause = cause;
    }

    public static ProcessResult exited( int exitCode, List<String> errorOutput )
    {
        return new ProcessResult( true, false, exitCode, errorOutput, null );
    }

    public static ProcessResult notStarted( Throwable cause )
    {
        return new ProcessResult( false, false, NO_EXIT_CODE, null, cause );
    }

    public static ProcessResult aborted( boolean timedOut, List<String> errorOutput, Throwable cause )
    {
        return new ProcessResult( true, timedOut, NO_EXIT_CODE, errorOutput, cause );
    }

    /**
     * Indicates whether the process was started and terminated with exit code zero.
     *
     * @return {@code true} if the tool succeeded, {@code false} otherwise.
     */
    public boolean isSuccess()
    {
        return started && !timedOut && cause == null && exitCode == 0;
    }

    public boolean isStarted()
    {
        return started;
    }

    public boolean isTimedOut()
    {
        return timedOut;
    }

    public int getExitCode()
    {
        return exitCode;
    }

    /**
     * Gets the lines written by the process to its standard error stream.
     *
     * @return The (possibly empty) error output, never {@code null}.
     */
    public List<String> getErrorOutput()
    {
        return errorOutput;
    }

    /**
     * Gets the exception that prevented the process from starting or being waited for.
     *
     * @return The cause or {@code null} if none.
     */
    public Throwable getCause()
    {
        return cause;
    }

    /**
     * Gets a short description of the failure.
     *
     * @return The failure description or {@code null} if the process succeeded.
     */
    public String getFailureMessage()
    {
        if ( isSuccess() )
        {
            return null;
        }
        if ( !started )
        {
            return "could not be started" + ( ( cause != null ) ? ": " + cause.getMessage() : "" );
        }
        if ( timedOut )
        {
            return "timed out";
        }
        if ( cause != null )
        {
            return "was aborted: " + cause;
        }
        return "exited with code " + exitCode;
    }

    @Override
    public String toString()
    {
        return isSuccess() ? "success" : getFailureMessage();
    }

}
