package org.eclipse.tesla.assets;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

/**
 * File name helpers shared by all output mappers so that every task strips extensions the same way.
 */
public final class FileNames
{

    private FileNames()
    {
        // hide constructor
    }

    /**
     * Gets the base name of a file name, i.e. the name without its extension. The extension starts at the last dot.
     * A name without a dot or whose only dot is its first character (like {@code .hidden}) has no extension and is
     * returned as is.
     *
     * @param name The file name (not a path), must not be {@code null}.
     * @return The base name, never {@code null}.
     */
    public static String getBaseName( String name )
    {
        if ( name == null )
        {
            throw new IllegalArgumentException( "file name not specified" );
        }
        int dot = name.lastIndexOf( '.' );
        if ( dot <= 0 )
        {
            return name;
        }
        return name.substring( 0, dot );
    }

    /**
     * Gets the extension of a file name without the leading dot.
     *
     * @param name The file name (not a path), must not be {@code null}.
     * @return The extension or an empty string if the name has none, never {@code null}.
     */
    public static String getExtension( String name )
    {
        String base = getBaseName( name );
        if ( base.length() >= name.length() )
        {
            return "";
        }
        return name.substring( base.length() + 1 );
    }

}
