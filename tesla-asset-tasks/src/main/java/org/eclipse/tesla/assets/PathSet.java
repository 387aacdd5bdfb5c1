package org.eclipse.tesla.assets;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Describes a set of files below a base directory, selected by Ant-style include/exclude patterns. The patterns use
 * forward slashes as separators and support the wildcards {@code *}, {@code ?} and {@code **}. An empty include
 * list selects every file below the base directory.
 */
public final class PathSet
    implements Serializable
{

    private static final long serialVersionUID = 3592829341837465208L;

    private final File basedir;

    private final List<String> includes;

    private final List<String> excludes;

    /**
     * Creates a new path set.
     *
     * @param basedir The base directory of the path set, must not be {@code null}.
     * @param includes The include patterns, may be {@code null} or empty to include all files.
     * @param excludes The exclude patterns, may be {@code null}.
     */
    public PathSet( File basedir, Collection<String> includes, Collection<String> excludes )
    {
        if ( basedir == null )
        {
            throw new IllegalArgumentException( "base directory not specified" );
        }
        this.basedir = basedir.getAbsoluteFile();
        this.includes = normalize( includes );
        this.excludes = normalize( excludes );
    }

    private PathSet( File basedir, String escapedName )
    {
        // already a glob, separator conversion would break the escapes
        this.basedir = basedir;
        this.includes = Collections.singletonList( escapedName );
        this.excludes = Collections.emptyList();
    }

    public PathSet( File basedir, String[] includes, String[] excludes )
    {
        this( basedir, ( includes != null ) ? Arrays.asList( includes ) : null,
              ( excludes != null ) ? Arrays.asList( excludes ) : null );
    }

    public PathSet( File basedir )
    {
        this( basedir, (Collection<String>) null, null );
    }

    /**
     * Creates a path set that selects exactly the specified file.
     *
     * @param file The file to select, must not be {@code null}.
     * @return The path set, never {@code null}.
     */
    public static PathSet singleFile( File file )
    {
        if ( file == null )
        {
            throw new IllegalArgumentException( "input file not specified" );
        }
        File absolute = file.getAbsoluteFile();
        return new PathSet( absolute.getParentFile(), escape( absolute.getName() ) );
    }

    private static String escape( String name )
    {
        StringBuilder buffer = new StringBuilder( name.length() + 8 );
        for ( int i = 0; i < name.length(); i++ )
        {
            char c = name.charAt( i );
            if ( c == '*' || c == '?' || c == '\\' )
            {
                buffer.append( '\\' );
            }
            buffer.append( c );
        }
        return buffer.toString();
    }

    private static List<String> normalize( Collection<String> patterns )
    {
        List<String> result = new ArrayList<String>();
        if ( patterns != null )
        {
            for ( String pattern : patterns )
            {
                if ( pattern == null )
                {
                    continue;
                }
                pattern = pattern.trim();
                if ( pattern.length() <= 0 )
                {
                    continue;
                }
                if ( File.separatorChar != '/' )
                {
                    pattern = pattern.replace( File.separatorChar, '/' );
                }
                if ( pattern.endsWith( "/" ) )
                {
                    pattern += "**";
                }
                result.add( pattern );
            }
        }
        return Collections.unmodifiableList( result );
    }

    public File getBasedir()
    {
        return basedir;
    }

    public List<String> getIncludes()
    {
        return includes;
    }

    public List<String> getExcludes()
    {
        return excludes;
    }

    @Override
    public boolean equals( Object obj )
    {
        if ( this == obj )
        {
            return true;
        }
        if ( obj == null || !getClass().equals( obj.getClass() ) )
        {
            return false;
        }
        PathSet that = (PathSet) obj;
        return basedir.equals( that.basedir ) && includes.equals( that.includes ) && excludes.equals( that.excludes );
    }

    @Override
    public int hashCode()
    {
        int hash = 17;
        hash = hash * 31 + basedir.hashCode();
        hash = hash * 31 + includes.hashCode();
        hash = hash * 31 + excludes.hashCode();
        return hash;
    }

    @Override
    public String toString()
    {
        return basedir + " (includes: " + includes + ", excludes: " + excludes + ")";
    }

}
