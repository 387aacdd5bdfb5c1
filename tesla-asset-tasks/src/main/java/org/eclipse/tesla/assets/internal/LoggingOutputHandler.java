package org.eclipse.tesla.assets.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import org.eclipse.tesla.assets.ProcessOutputHandler;
import org.slf4j.Logger;

/**
 * Sends tool output to the build log, standard output as info and standard error as error messages.
 */
public class LoggingOutputHandler
    implements ProcessOutputHandler
{

    private final Logger log;

    public LoggingOutputHandler( Logger log )
    {
        if ( log == null )
        {
            throw new IllegalArgumentException( "logger not specified" );
        }
        this.log = log;
    }

    public void stdout( String line )
    {
        log.info( line );
    }

    public void stderr( String line )
    {
        log.error( line );
    }

}
