package org.eclipse.tesla.assets;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

/**
 * Signals a problem that prevents a task from running at all, e.g. a missing tool executable. Problems with
 * individual inputs are not reported through this exception but recorded as {@link InputFailure}s.
 */
public class BuildException
    extends RuntimeException
{

    private static final long serialVersionUID = -1486431543093447207L;

    public BuildException( String message )
    {
        super( message );
    }

    public BuildException( String message, Throwable cause )
    {
        super( message, cause );
    }

}
