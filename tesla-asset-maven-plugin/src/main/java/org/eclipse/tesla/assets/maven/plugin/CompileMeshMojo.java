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
import org.eclipse.tesla.assets.TaskConfiguration;

/**
 * Compiles a mesh into a {@code .filamesh} file using {@code filamesh}.
 */
@Mojo( name = "compile-mesh", defaultPhase = LifecyclePhase.GENERATE_RESOURCES, threadSafe = true )
public class CompileMeshMojo
    extends AbstractAssetMojo
{

    @Parameter( property = "assets.filamesh", required = true )
    private File filameshExecutable;

    @Parameter( property = "assets.meshInput", required = true )
    private File inputFile;

    @Parameter( defaultValue = "${project.build.directory}/generated-assets/meshes" )
    private File outputDirectory;

    @Override
    protected TaskConfiguration.Builder newTask()
        throws MojoExecutionException
    {
        if ( filameshExecutable == null || inputFile == null )
        {
            throw new MojoExecutionException( "filameshExecutable and inputFile must be specified" );
        }

        return AssetTasks.mesh( filameshExecutable, inputFile, outputDirectory );
    }

}
