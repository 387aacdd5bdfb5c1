package org.eclipse.tesla.assets.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class DigestUtils
{

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private DigestUtils()
    {
        // hide constructor
    }

    static MessageDigest newSha1()
    {
        try
        {
            return MessageDigest.getInstance( "SHA-1" );
        }
        catch ( NoSuchAlgorithmException e )
        {
            throw new IllegalStateException( "SHA-1 not supported by the JRE", e );
        }
    }

    public static String toHexString( byte[] bytes )
    {
        if ( bytes == null )
        {
            return null;
        }

        char[] chars = new char[bytes.length * 2];
        for ( int i = 0; i < bytes.length; i++ )
        {
            int b = bytes[i] & 0xFF;
            chars[i * 2] = HEX[b >> 4];
            chars[i * 2 + 1] = HEX[b & 0x0F];
        }
        return new String( chars );
    }

    /**
     * Computes the SHA-1 digest of the contents of a file.
     *
     * @param file The file to digest, must not be {@code null}.
     * @return The hex encoded digest, never {@code null}.
     * @throws IOException If the file could not be read.
     */
    public static String sha1( File file )
        throws IOException
    {
        MessageDigest digest = newSha1();

        InputStream is = new FileInputStream( file );
        try
        {
            byte[] buffer = new byte[1024 * 32];
            for ( int read = is.read( buffer ); read >= 0; read = is.read( buffer ) )
            {
                digest.update( buffer, 0, read );
            }
        }
        finally
        {
            is.close();
        }

        return toHexString( digest.digest() );
    }

}
