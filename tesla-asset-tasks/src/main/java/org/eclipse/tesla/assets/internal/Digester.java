package org.eclipse.tesla.assets.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Computes a fingerprint of configuration values. Each value is terminated by a separator so that the sequences
 * {@code ("ab", "c")} and {@code ("a", "bc")} yield different digests. After {@link #finish()}, the digester is reset
 * and can be reused.
 */
public class Digester
{

    private final MessageDigest digest;

    public Digester()
    {
        digest = DigestUtils.newSha1();
    }

    public Digester string( String value )
    {
        if ( value != null )
        {
            digest.update( value.getBytes( StandardCharsets.UTF_8 ) );
        }
        else
        {
            digest.update( (byte) 1 );
        }
        digest.update( (byte) 0 );
        return this;
    }

    public Digester strings( String... values )
    {
        if ( values != null )
        {
            for ( String value : values )
            {
                string( value );
            }
        }
        return this;
    }

    public Digester strings( Iterable<String> values )
    {
        if ( values != null )
        {
            for ( String value : values )
            {
                string( value );
            }
        }
        return this;
    }

    /**
     * Adds the identity of a file to the digest, i.e. its path, size and timestamp. The contents of the file are not
     * read.
     *
     * @param file The file to add, may be {@code null}.
     * @return This digester for chaining, never {@code null}.
     */
    public Digester file( File file )
    {
        if ( file != null )
        {
            string( FileUtils.normalize( file ).getPath() );
            string( Long.toString( file.length() ) );
            string( Long.toString( file.lastModified() ) );
        }
        else
        {
            string( null );
        }
        return this;
    }

    public byte[] finish()
    {
        return digest.digest();
    }

}
