package org.eclipse.tesla.assets;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.util.Collections;
import java.util.List;

/**
 * The output mappers used by the asset tasks. Outputs are placed directly into the output directory, only the file
 * name of the input is considered.
 */
public final class OutputMappers
{

    private OutputMappers()
    {
        // hide constructor
    }

    /**
     * Maps {@code dir/name.ext} to {@code outputDirectory/name.<extension>}.
     *
     * @param extension The extension of the output file without leading dot, must not be {@code null} or empty.
     * @return The mapper, never {@code null}.
     */
    public static OutputMapper replaceExtension( String extension )
    {
        if ( extension == null || extension.length() <= 0 )
        {
            throw new IllegalArgumentException( "output extension not specified" );
        }
        if ( extension.startsWith( "." ) )
        {
            extension = extension.substring( 1 );
        }
        return new ExtensionMapper( extension );
    }

    /**
     * Maps {@code dir/name.ext} to the directory {@code outputDirectory/name}. The contents of that directory are
     * determined by the tool.
     *
     * @return The mapper, never {@code null}.
     */
    public static OutputMapper baseNameDirectory()
    {
        return BaseNameDirectoryMapper.INSTANCE;
    }

    static final class ExtensionMapper
        implements OutputMapper
    {

        private final String extension;

        ExtensionMapper( String extension )
        {
            this.extension = extension;
        }

        public List<File> getOutputs( File input, File outputDirectory )
        {
            String name = FileNames.getBaseName( input.getName() ) + '.' + extension;
            return Collections.singletonList( new File( outputDirectory, name ) );
        }

        @Override
        public String toString()
        {
            return "*." + extension;
        }

    }

    static final class BaseNameDirectoryMapper
        implements OutputMapper
    {

        static final BaseNameDirectoryMapper INSTANCE = new BaseNameDirectoryMapper();

        public List<File> getOutputs( File input, File outputDirectory )
        {
            return Collections.singletonList( new File( outputDirectory, FileNames.getBaseName( input.getName() ) ) );
        }

        @Override
        public String toString()
        {
            return "*/";
        }

    }

}
