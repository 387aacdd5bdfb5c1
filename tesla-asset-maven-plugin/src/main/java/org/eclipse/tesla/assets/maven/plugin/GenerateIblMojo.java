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
 * Generates image based lighting data from an environment map using {@code cmgen}.
 */
@Mojo( name = "generate-ibl", defaultPhase = LifecyclePhase.GENERATE_RESOURCES, threadSafe = true )
public class GenerateIblMojo
    extends AbstractAssetMojo
{

    @Parameter( property = "assets.cmgen", required = true )
    private File cmgenExecutable;

    /**
     * The environment map, e.g. an equirectangular HDR image.
     */
    @Parameter( property = "assets.iblInput", required = true )
    private File inputFile;

    @Parameter( defaultValue = "${project.build.directory}/generated-assets/ibl" )
    private File outputDirectory;

    @Override
    protected TaskConfiguration.Builder newTask()
        throws MojoExecutionException
    {
        if ( cmgenExecutable == null || inputFile == null )
        {
            throw new MojoExecutionException( "cmgenExecutable and inputFile must be specified" );
        }

        return AssetTasks.ibl( cmgenExecutable, inputFile, outputDirectory );
    }

}
