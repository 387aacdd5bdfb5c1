package org.eclipse.tesla.assets.maven.plugin;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.eclipse.tesla.assets.AssetTasks;
import org.eclipse.tesla.assets.PathSet;
import org.eclipse.tesla.assets.TaskConfiguration;

/**
 * Compiles Filament material definitions into {@code .filamat} files using {@code matc}. Only materials modified
 * since the previous build are recompiled.
 */
@Mojo( name = "compile-materials", defaultPhase = LifecyclePhase.GENERATE_RESOURCES, threadSafe = true )
public class CompileMaterialsMojo
    extends AbstractAssetMojo
{

    static final String DEFAULT_INCLUDE = "**/*.mat";

    /**
     * The material compiler executable.
     */
    @Parameter( property = "assets.matc", required = true )
    private File matcExecutable;

    @Parameter( defaultValue = "${basedir}/src/main/materials" )
    private File inputDirectory;

    /**
     * The material sources to compile, relative to the input directory. Defaults to {@value #DEFAULT_INCLUDE}.
     */
    @Parameter
    private String[] includes;

    @Parameter
    private String[] excludes;

    /**
     * The target profile passed to the material compiler.
     */
    @Parameter( property = "assets.materialProfile", defaultValue = AssetTasks.DEFAULT_MATERIAL_PROFILE )
    private String profile;

    @Parameter( defaultValue = "${project.build.directory}/generated-assets/materials" )
    private File outputDirectory;

    @Override
    protected TaskConfiguration.Builder newTask()
        throws MojoExecutionException
    {
        if ( matcExecutable == null )
        {
            throw new MojoExecutionException( "matcExecutable not specified" );
        }

        String[] includes = this.includes;
        if ( includes == null || includes.length <= 0 )
        {
            includes = new String[] { DEFAULT_INCLUDE };
        }

        PathSet inputs = new PathSet( inputDirectory, includes, excludes );

        return AssetTasks.materials( matcExecutable, inputs, outputDirectory, profile );
    }

}
