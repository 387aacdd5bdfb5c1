package org.eclipse.tesla.assets.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

public final class FileUtils
{

    private FileUtils()
    {
        // hide constructor
    }

    /**
     * Makes the specified file absolute and removes {@code .} and {@code ..} segments. Symbolic links are not
     * resolved.
     *
     * @param file The file to normalize, may be {@code null}.
     * @return The normalized file or {@code null} if the input was {@code null}.
     */
    public static File normalize( File file )
    {
        if ( file == null )
        {
            return null;
        }
        return file.getAbsoluteFile().toPath().normalize().toFile();
    }

    /**
     * Deletes the specified file or directory including its contents.
     *
     * @param file The file or directory to delete, must not be {@code null}.
     * @return {@code true} if something was deleted, {@code false} if the file did not exist.
     * @throws IOException If the file or part of the directory could not be deleted.
     */
    public static boolean delete( File file )
        throws IOException
    {
        if ( !file.exists() )
        {
            return false;
        }

        if ( file.isDirectory() && !isSymbolicLink( file ) )
        {
            File[] children = file.listFiles();
            if ( children != null )
            {
                for ( File child : children )
                {
                    delete( child );
                }
            }
        }

        if ( !file.delete() && file.exists() )
        {
            throw new IOException( "Could not delete " + file );
        }

        return true;
    }

    private static boolean isSymbolicLink( File file )
    {
        return Files.isSymbolicLink( file.toPath() );
    }

    /**
     * Ensures the specified directory exists.
     *
     * @param directory The directory to create, must not be {@code null}.
     * @throws IOException If the directory could not be created.
     */
    public static void mkdirs( File directory )
        throws IOException
    {
        if ( !directory.isDirectory() && !directory.mkdirs() && !directory.isDirectory() )
        {
            throw new IOException( "Could not create directory " + directory );
        }
    }

}
