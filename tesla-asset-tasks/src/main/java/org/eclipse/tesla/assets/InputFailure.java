package org.eclipse.tesla.assets;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Describes why a single input could not be processed or its outputs could not be deleted.
 */
public final class InputFailure
{

    private final File input;

    private final String message;

    private final List<String> errorOutput;

    private final Throwable cause;

    public InputFailure( File input, String message, List<String> errorOutput, Throwable cause )
    {
        if ( input == null )
        {
            throw new IllegalArgumentException( "input not specified" );
        }
        this.input = input;
        this.message = ( message != null ) ? message : ( cause != null ) ? String.valueOf( cause ) : "(unknown issue)";
        this.errorOutput =
            ( errorOutput != null ) ? Collections.unmodifiableList( new ArrayList<String>( errorOutput ) )
                            : Collections.<String> emptyList();
        this.cause = cause;
    }

    public File getInput()
    {
        return input;
    }

    public String getMessage()
    {
        return message;
    }

    /**
     * Gets the lines the tool wrote to its standard error stream while processing the input.
     *
     * @return The (possibly empty) error output, never {@code null}.
     */
    public List<String> getErrorOutput()
    {
        return errorOutput;
    }

    public Throwable getCause()
    {
        return cause;
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder( 256 );
        sb.append( input.getAbsolutePath() ).append( ": " ).append( message );
        for ( String line : errorOutput )
        {
            sb.append( System.lineSeparator() ).append( "    " ).append( line );
        }
        return sb.toString();
    }

}
