package org.eclipse.tesla.assets.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.eclipse.tesla.assets.InputFailure;

/**
 * The difference between the current inputs of a task and the inputs recorded by the previous build.
 */
class InputDelta
{

    /**
     * The added or modified inputs and their current fingerprints, in scan order.
     */
    final Map<File, String> changed = new LinkedHashMap<File, String>();

    final List<File> unchanged = new ArrayList<File>();

    final Set<File> removed = new TreeSet<File>();

    /**
     * Inputs whose fingerprint could not be computed.
     */
    final List<InputFailure> unreadable = new ArrayList<InputFailure>();

}
