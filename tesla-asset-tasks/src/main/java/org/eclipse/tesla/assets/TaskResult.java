package org.eclipse.tesla.assets;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

/**
 * The result of a task run: the build state to keep for the next run and the outcome of this run.
 */
public final class TaskResult
{

    private final BuildState state;

    private final BuildOutcome outcome;

    public TaskResult( BuildState state, BuildOutcome outcome )
    {
        if ( state == null )
        {
            throw new IllegalArgumentException( "build state not specified" );
        }
        if ( outcome == null )
        {
            throw new IllegalArgumentException( "build outcome not specified" );
        }
        this.state = state;
        this.outcome = outcome;
    }

    public BuildState getState()
    {
        return state;
    }

    public BuildOutcome getOutcome()
    {
        return outcome;
    }

}
