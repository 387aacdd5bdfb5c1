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
 * Runs external tools.
 */
public interface ProcessRunner
{

    /**
     * Runs the specified executable and waits for it to terminate. The output of the process is passed to the handler
     * while the process runs. This method does not throw if the process cannot be started, instead the returned
     * result reports the failure.
     *
     * @param executable The executable to run, must not be {@code null}.
     * @param arguments The arguments of the process, must not be {@code null}.
     * @param timeout The time in milliseconds after which the process is killed, {@code 0} to wait indefinitely.
     * @param handler The handler receiving the output of the process, must not be {@code null}.
     * @return The result of the process, never {@code null}.
     */
    ProcessResult execute( File executable, List<String> arguments, long timeout, ProcessOutputHandler handler );

}
