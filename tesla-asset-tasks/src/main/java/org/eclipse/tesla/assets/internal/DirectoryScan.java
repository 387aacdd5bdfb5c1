package org.eclipse.tesla.assets.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.util.Arrays;

/**
 * Walks a directory tree and reports the items accepted by a selector. Items are reported in sorted order. A missing
 * base directory is treated like an empty one.
 */
abstract class DirectoryScan
    implements Runnable
{

    private final File basedir;

    private final Selector selector;

    private final boolean includingDirectories;

    private final boolean includingFiles;

    public DirectoryScan( File basedir, Selector selector, boolean includingDirectories, boolean includingFiles )
    {
        if ( basedir == null )
        {
            throw new IllegalArgumentException( "base directory not specified" );
        }
        if ( selector == null )
        {
            throw new IllegalArgumentException( "selector not specified" );
        }
        this.basedir = basedir;
        this.selector = selector;
        this.includingDirectories = includingDirectories;
        this.includingFiles = includingFiles;
    }

    public void run()
    {
        scan( basedir, "" );
    }

    private void scan( File dir, String prefix )
    {
        String[] names = dir.list();
        if ( names == null )
        {
            return;
        }
        Arrays.sort( names );

        for ( String name : names )
        {
            String pathname = prefix + name;
            File file = new File( dir, name );

            if ( file.isDirectory() )
            {
                if ( includingDirectories && selector.isSelected( pathname ) )
                {
                    onItem( pathname, file );
                }
                if ( selector.isAncestorOfPotentiallySelected( pathname ) )
                {
                    scan( file, pathname + '/' );
                }
            }
            else if ( includingFiles && file.isFile() && selector.isSelected( pathname ) )
            {
                onItem( pathname, file );
            }
        }
    }

    protected abstract void onItem( String pathname, File file );

}
