package org.eclipse.tesla.assets;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

/**
 * Runs asset tasks incrementally. The general usage pattern is demonstrated by this simplified example snippet:
 *
 * <pre>
 * TaskConfiguration config = AssetTasks.materials( matc, new PathSet( inputDir, includes, excludes ), outputDir );
 * BuildState previous = stateFile.isFile() ? BuildState.load( stateFile ) : null;
 * TaskResult result = engine.run( config, previous );
 * result.getState().save( stateFile );
 * if ( !result.getOutcome().isSuccessful() )
 * {
 *     // report result.getOutcome().getFailures()
 * }
 * </pre>
 */
public interface AssetTaskEngine
{

    /**
     * Brings the output directory of the task up to date with its inputs. Only inputs that were added or modified
     * since the build described by the previous state are passed to the tool, the outputs of inputs that no longer
     * exist are deleted. Without previous state, or if the task configuration changed since then, a full build is
     * performed, i.e. the output directory is cleaned and every input is processed.
     * <p>
     * A failure of an individual input does not stop the run, it is reported in the outcome of the returned result
     * and the input is left out of the new state so that the next run retries it.
     *
     * @param configuration The task to run, must not be {@code null}.
     * @param previous The state returned by the previous run of this task, may be {@code null} if unknown.
     * @return The new state and the outcome of the run, never {@code null}.
     * @throws BuildException If the task cannot run at all, e.g. because its tool does not exist.
     */
    TaskResult run( TaskConfiguration configuration, BuildState previous );

}
