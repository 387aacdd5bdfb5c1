package org.eclipse.tesla.assets.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

/**
 * Decides which paths of a {@link DirectoryScan} are reported. Paths are relative to the base directory of the scan
 * and use forward slashes.
 */
interface Selector
{

    boolean isSelected( String pathname );

    /**
     * Tells whether the scan needs to descend into the specified directory, i.e. whether any path below it could be
     * selected.
     *
     * @param pathname The relative path of the directory, never {@code null}.
     * @return {@code false} if nothing below the directory can be selected, {@code true} otherwise.
     */
    boolean isAncestorOfPotentiallySelected( String pathname );

}
