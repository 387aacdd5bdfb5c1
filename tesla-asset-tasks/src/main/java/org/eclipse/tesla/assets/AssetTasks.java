package org.eclipse.tesla.assets;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import static org.eclipse.tesla.assets.ArgumentTemplate.INPUT;
import static org.eclipse.tesla.assets.ArgumentTemplate.OUTPUT;
import static org.eclipse.tesla.assets.ArgumentTemplate.OUTPUT_DIRECTORY;

import java.io.File;

/**
 * The configurations of the Filament asset tasks. Each method returns a builder that is preconfigured with the tool
 * arguments, output mapping and clean patterns of the task, callers may further customize it (e.g. thread count)
 * before building the configuration.
 */
public final class AssetTasks
{

    public static final String MATERIAL_EXTENSION = "filamat";

    public static final String MESH_EXTENSION = "filamesh";

    public static final String DEFAULT_MATERIAL_PROFILE = "mobile";

    public static final String IBL_FORMAT = "rgbm";

    public static final String IBL_EXTRACT_BLUR = "0.08";

    private AssetTasks()
    {
        // hide constructor
    }

    /**
     * Compiles material definitions with {@code matc}, one {@code .filamat} per input.
     *
     * @param matc The material compiler executable, must not be {@code null}.
     * @param inputs The material sources, must not be {@code null}.
     * @param outputDirectory The directory for the compiled materials, must not be {@code null}.
     * @return The preconfigured builder, never {@code null}.
     */
    public static TaskConfiguration.Builder materials( File matc, PathSet inputs, File outputDirectory )
    {
        return materials( matc, inputs, outputDirectory, DEFAULT_MATERIAL_PROFILE );
    }

    public static TaskConfiguration.Builder materials( File matc, PathSet inputs, File outputDirectory,
                                                       String profile )
    {
        if ( profile == null || profile.length() <= 0 )
        {
            profile = DEFAULT_MATERIAL_PROFILE;
        }
        return TaskConfiguration.builder( "material" )
            .action( "Compiling" )
            .tool( matc )
            .inputs( inputs )
            .outputDirectory( outputDirectory )
            .invocation( "-O", "-p", profile, "-o", OUTPUT, INPUT )
            .outputMapper( OutputMappers.replaceExtension( MATERIAL_EXTENSION ) )
            .cleanPattern( "*." + MATERIAL_EXTENSION );
    }

    /**
     * Generates image based lighting data with {@code cmgen}. The tool runs twice per environment map, first to extract
     * the irradiance/specular cube map levels, then to extract a blurred reflection map. Both populate a directory
     * named after the input inside the output directory.
     *
     * @param cmgen The cube map generator executable, must not be {@code null}.
     * @param inputFile The environment map, must not be {@code null}.
     * @param outputDirectory The directory receiving the IBL directory, must not be {@code null}.
     * @return The preconfigured builder, never {@code null}.
     */
    public static TaskConfiguration.Builder ibl( File cmgen, File inputFile, File outputDirectory )
    {
        return TaskConfiguration.builder( "IBL" )
            .action( "Generating" )
            .tool( cmgen )
            .inputs( PathSet.singleFile( inputFile ) )
            .outputDirectory( outputDirectory )
            .invocation( "-x", OUTPUT_DIRECTORY, INPUT )
            .invocation( "--format=" + IBL_FORMAT, "--extract-blur=" + IBL_EXTRACT_BLUR, "--extract=" + OUTPUT_DIRECTORY,
                         INPUT )
            .outputMapper( OutputMappers.baseNameDirectory() )
            .cleanPattern( "**" );
    }

    /**
     * Compiles a mesh with {@code filamesh} into a {@code .filamesh} file.
     *
     * @param filamesh The mesh compiler executable, must not be {@code null}.
     * @param inputFile The mesh source, must not be {@code null}.
     * @param outputDirectory The directory for the compiled mesh, must not be {@code null}.
     * @return The preconfigured builder, never {@code null}.
     */
    public static TaskConfiguration.Builder mesh( File filamesh, File inputFile, File outputDirectory )
    {
        return TaskConfiguration.builder( "mesh" )
            .action( "Compiling" )
            .tool( filamesh )
            .inputs( PathSet.singleFile( inputFile ) )
            .outputDirectory( outputDirectory )
            .invocation( INPUT, OUTPUT )
            .outputMapper( OutputMappers.replaceExtension( MESH_EXTENSION ) )
            .cleanPattern( "*." + MESH_EXTENSION );
    }

}
