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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The arguments of one tool invocation. Arguments may refer to the file being processed using the placeholders
 * {@value #INPUT}, {@value #OUTPUT} (the primary output) and {@value #OUTPUT_DIRECTORY}, either as the whole
 * argument or embedded like in {@code --extract=${outputDirectory}}. Placeholders expand to absolute paths.
 */
public final class ArgumentTemplate
{

    public static final String INPUT = "${input}";

    public static final String OUTPUT = "${output}";

    public static final String OUTPUT_DIRECTORY = "${outputDirectory}";

    private final List<String> arguments;

    public ArgumentTemplate( List<String> arguments )
    {
        if ( arguments == null )
        {
            throw new IllegalArgumentException( "arguments not specified" );
        }
        for ( String argument : arguments )
        {
            if ( argument == null )
            {
                throw new IllegalArgumentException( "argument must not be null: " + arguments );
            }
        }
        this.arguments = Collections.unmodifiableList( new ArrayList<String>( arguments ) );
    }

    public static ArgumentTemplate of( String... arguments )
    {
        return new ArgumentTemplate( Arrays.asList( arguments ) );
    }

    public List<String> getArguments()
    {
        return arguments;
    }

    /**
     * Expands the placeholders of this template.
     *
     * @param input The input file, must not be {@code null}.
     * @param output The primary output, must not be {@code null}.
     * @param outputDirectory The output directory, must not be {@code null}.
     * @return The expanded arguments, never {@code null}.
     */
    public List<String> expand( File input, File output, File outputDirectory )
    {
        List<String> expanded = new ArrayList<String>( arguments.size() );
        for ( String argument : arguments )
        {
            String arg = argument;
            if ( arg.indexOf( "${" ) >= 0 )
            {
                arg = arg.replace( INPUT, input.getAbsolutePath() );
                arg = arg.replace( OUTPUT_DIRECTORY, outputDirectory.getAbsolutePath() );
                arg = arg.replace( OUTPUT, output.getAbsolutePath() );
            }
            expanded.add( arg );
        }
        return expanded;
    }

    @Override
    public boolean equals( Object obj )
    {
        if ( this == obj )
        {
            return true;
        }
        if ( !( obj instanceof ArgumentTemplate ) )
        {
            return false;
        }
        return arguments.equals( ( (ArgumentTemplate) obj ).arguments );
    }

    @Override
    public int hashCode()
    {
        return arguments.hashCode();
    }

    @Override
    public String toString()
    {
        return arguments.toString();
    }

}
