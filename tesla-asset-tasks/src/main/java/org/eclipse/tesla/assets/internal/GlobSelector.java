package org.eclipse.tesla.assets.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import org.eclipse.tesla.assets.PathSet;

/**
 * Selects paths using Ant-style include/exclude patterns.
 */
class GlobSelector
    implements Selector
{

    private final List<Glob> includes;

    private final List<Glob> excludes;

    public GlobSelector( PathSet pathSet )
    {
        this( pathSet.getIncludes(), pathSet.getExcludes() );
    }

    public GlobSelector( Collection<String> includes, Collection<String> excludes )
    {
        this.includes = compile( ( includes == null || includes.isEmpty() ) ? Collections.singleton( "**" ) : includes );
        this.excludes = compile( excludes );
    }

    private static List<Glob> compile( Collection<String> patterns )
    {
        List<Glob> globs = new ArrayList<Glob>();
        if ( patterns != null )
        {
            for ( String pattern : patterns )
            {
                globs.add( new Glob( pattern ) );
            }
        }
        return globs;
    }

    public boolean isSelected( String pathname )
    {
        return matches( includes, pathname ) && !matches( excludes, pathname );
    }

    public boolean isAncestorOfPotentiallySelected( String pathname )
    {
        for ( Glob include : includes )
        {
            if ( include.isAncestorOfPotentialMatch( pathname ) )
            {
                return true;
            }
        }
        return false;
    }

    private static boolean matches( List<Glob> globs, String pathname )
    {
        for ( Glob glob : globs )
        {
            if ( glob.matches( pathname ) )
            {
                return true;
            }
        }
        return false;
    }

    static final class Glob
    {

        private final String[] segments;

        private final Pattern[] segmentPatterns;

        private final Pattern pattern;

        private final boolean deep;

        Glob( String glob )
        {
            segments = glob.split( "/+" );
            segmentPatterns = new Pattern[segments.length];

            StringBuilder regex = new StringBuilder( glob.length() * 2 );
            boolean deep = false;
            for ( int i = 0; i < segments.length; i++ )
            {
                String segment = segments[i];
                boolean last = i == segments.length - 1;
                if ( "**".equals( segment ) )
                {
                    deep = true;
                    regex.append( last ? ".*" : "(?:[^/]*/)*" );
                }
                else
                {
                    String segmentRegex = toRegex( segment );
                    segmentPatterns[i] = Pattern.compile( segmentRegex );
                    regex.append( segmentRegex );
                    if ( !last )
                    {
                        regex.append( '/' );
                    }
                }
            }
            this.deep = deep;
            this.pattern = Pattern.compile( regex.toString() );
        }

        private static String toRegex( String segment )
        {
            StringBuilder regex = new StringBuilder( segment.length() * 2 );
            for ( int i = 0; i < segment.length(); i++ )
            {
                char c = segment.charAt( i );
                if ( c == '*' )
                {
                    regex.append( "[^/]*" );
                }
                else if ( c == '?' )
                {
                    regex.append( "[^/]" );
                }
                else if ( c == '\\' && i + 1 < segment.length() )
                {
                    regex.append( Pattern.quote( String.valueOf( segment.charAt( ++i ) ) ) );
                }
                else
                {
                    regex.append( Pattern.quote( String.valueOf( c ) ) );
                }
            }
            return regex.toString();
        }

        boolean matches( String pathname )
        {
            return pattern.matcher( pathname ).matches();
        }

        boolean isAncestorOfPotentialMatch( String pathname )
        {
            if ( deep )
            {
                return true;
            }
            String[] dirs = pathname.split( "/+" );
            if ( dirs.length >= segments.length )
            {
                return false;
            }
            for ( int i = 0; i < dirs.length; i++ )
            {
                if ( !segmentPatterns[i].matcher( dirs[i] ).matches() )
                {
                    return false;
                }
            }
            return true;
        }

    }

}
