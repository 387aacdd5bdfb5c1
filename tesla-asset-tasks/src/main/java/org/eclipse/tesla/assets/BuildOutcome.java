package org.eclipse.tesla.assets;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Summarizes what a task run did. The run failed if at least one input failed, the outputs of the other inputs are
 * left in place regardless.
 */
public final class BuildOutcome
{

    private final boolean fullBuild;

    private final List<File> processed;

    private final int skipped;

    private final List<File> removed;

    private final List<InputFailure> failures;

    public BuildOutcome( boolean fullBuild, Collection<File> processed, int skipped, Collection<File> removed,
                         Collection<InputFailure> failures )
    {
        this.fullBuild = fullBuild;
        this.processed = copy( processed );
        this.skipped = skipped;
        this.removed = copy( removed );
        this.failures = copy( failures );
    }

    private static <T> List<T> copy( Collection<T> items )
    {
        if ( items == null || items.isEmpty() )
        {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList( new ArrayList<T>( items ) );
    }

    public boolean isSuccessful()
    {
        return failures.isEmpty();
    }

    public boolean isFullBuild()
    {
        return fullBuild;
    }

    /**
     * Gets the inputs that were successfully processed by the tool during this run.
     *
     * @return The processed inputs, never {@code null}.
     */
    public List<File> getProcessed()
    {
        return processed;
    }

    public int getSkipped()
    {
        return skipped;
    }

    /**
     * Gets the inputs that disappeared since the previous build and whose outputs were deleted.
     *
     * @return The removed inputs, never {@code null}.
     */
    public List<File> getRemoved()
    {
        return removed;
    }

    public List<InputFailure> getFailures()
    {
        return failures;
    }

    @Override
    public String toString()
    {
        return ( fullBuild ? "full" : "incremental" ) + " build: " + processed.size() + " processed, " + skipped
            + " up-to-date, " + removed.size() + " removed, " + failures.size() + " failed";
    }

}
