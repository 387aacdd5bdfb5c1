package org.eclipse.tesla.assets;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

/**
 * Receives the output of an external tool line by line while the tool is running. The two methods are called from
 * different threads, each one in the order in which the tool wrote the lines to the respective stream.
 */
public interface ProcessOutputHandler
{

    void stdout( String line );

    void stderr( String line );

}
