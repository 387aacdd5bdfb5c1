package org.eclipse.tesla.assets.maven.plugin;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecution;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Component;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;
import org.eclipse.tesla.assets.TaskConfiguration;
import org.eclipse.tesla.assets.maven.internal.MavenTaskStateManager;

/**
 * Common parameters and execution of the asset mojos.
 */
public abstract class AbstractAssetMojo
    extends AbstractMojo
{

    // --- usual plugin parameters ----------------------------------

    @Parameter( defaultValue = "${project}", readonly = true, required = true )
    private MavenProject project;

    @Parameter( defaultValue = "${mojoExecution}", readonly = true, required = true )
    private MojoExecution execution;

    /**
     * Skips the execution of this goal.
     */
    @Parameter( property = "assets.skip", defaultValue = "false" )
    private boolean skip;

    /**
     * The number of inputs processed in parallel.
     */
    @Parameter( property = "assets.threads", defaultValue = "1" )
    private int threads;

    /**
     * The time in milliseconds a single tool invocation may take, {@code 0} to wait indefinitely.
     */
    @Parameter( property = "assets.timeout", defaultValue = "0" )
    private long timeout;

    @Component
    private MavenTaskStateManager stateManager;

    // --- mojo logic -----------------------------------------------

    public void execute()
        throws MojoExecutionException, MojoFailureException
    {
        if ( skip )
        {
            getLog().info( "Skipping " + execution.getGoal() );
            return;
        }

        TaskConfiguration.Builder task = newTask();
        try
        {
            task.threads( threads ).timeout( timeout );
        }
        catch ( IllegalArgumentException e )
        {
            throw new MojoExecutionException( e.getMessage(), e );
        }

        stateManager.execute( task, project, execution );
    }

    /**
     * Creates the configuration of the task run by this goal.
     *
     * @return The preconfigured task, never {@code null}.
     * @throws MojoExecutionException If the goal parameters are invalid.
     */
    protected abstract TaskConfiguration.Builder newTask()
        throws MojoExecutionException;

}
