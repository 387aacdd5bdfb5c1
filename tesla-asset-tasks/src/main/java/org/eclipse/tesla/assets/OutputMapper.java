package org.eclipse.tesla.assets;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.util.List;

/**
 * Derives the output files/directories of a task from one of its input files. Implementations must be pure: the
 * result may only depend on the arguments and no file system access may happen, since the engine recomputes the
 * outputs of inputs that no longer exist in order to delete them.
 *
 * @see OutputMappers
 */
public interface OutputMapper
{

    /**
     * Gets the outputs produced for the specified input.
     *
     * @param input The input file, must not be {@code null}.
     * @param outputDirectory The output directory of the task, must not be {@code null}.
     * @return The (non-empty) list of output files or directories, never {@code null}. The first element is the
     *         primary output substituted for {@code ${output}} in argument templates.
     */
    List<File> getOutputs( File input, File outputDirectory );

}
