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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The immutable configuration of one asset task: which tool to run with which arguments over which inputs and where
 * the outputs go. Instances are created via {@link Builder} or the factory methods in {@link AssetTasks}.
 */
public final class TaskConfiguration
{

    private final String name;

    private final String action;

    private final File tool;

    private final List<ArgumentTemplate> invocations;

    private final PathSet inputs;

    private final File outputDirectory;

    private final OutputMapper outputMapper;

    private final List<String> cleanPatterns;

    private final int threads;

    private final long timeout;

    private final Map<String, String> properties;

    TaskConfiguration( Builder builder )
    {
        this.name = builder.name;
        this.action = builder.action;
        this.tool = builder.tool.getAbsoluteFile();
        this.invocations = Collections.unmodifiableList( new ArrayList<ArgumentTemplate>( builder.invocations ) );
        this.inputs = builder.inputs;
        this.outputDirectory = builder.outputDirectory.getAbsoluteFile();
        this.outputMapper = builder.outputMapper;
        this.cleanPatterns = Collections.unmodifiableList( new ArrayList<String>( builder.cleanPatterns ) );
        this.threads = builder.threads;
        this.timeout = builder.timeout;
        this.properties = Collections.unmodifiableMap( new TreeMap<String, String>( builder.properties ) );
    }

    public static Builder builder( String name )
    {
        return new Builder( name );
    }

    /**
     * Gets the display name of the task, used in log messages like "Compiling material ...".
     *
     * @return The task name, never {@code null}.
     */
    public String getName()
    {
        return name;
    }

    /**
     * Gets the verb describing what the tool does to an input, e.g. "Compiling".
     *
     * @return The action, never {@code null}.
     */
    public String getAction()
    {
        return action;
    }

    public File getTool()
    {
        return tool;
    }

    /**
     * Gets the argument templates, the tool is invoked once per template and input in the given order.
     *
     * @return The argument templates, never {@code null} or empty.
     */
    public List<ArgumentTemplate> getInvocations()
    {
        return invocations;
    }

    public PathSet getInputs()
    {
        return inputs;
    }

    public File getOutputDirectory()
    {
        return outputDirectory;
    }

    public OutputMapper getOutputMapper()
    {
        return outputMapper;
    }

    /**
     * Gets the patterns (relative to the output directory) of the files and directories that are deleted before a
     * full build.
     *
     * @return The clean patterns, never {@code null}.
     */
    public List<String> getCleanPatterns()
    {
        return cleanPatterns;
    }

    /**
     * Gets the number of inputs that may be processed concurrently.
     *
     * @return The thread count, always positive.
     */
    public int getThreads()
    {
        return threads;
    }

    /**
     * Gets the time in milliseconds a single tool invocation may take before it is aborted.
     *
     * @return The timeout or {@code 0} to wait indefinitely.
     */
    public long getTimeout()
    {
        return timeout;
    }

    /**
     * Gets additional configuration values that affect the outputs. A change of any of them since the previous
     * build triggers a full build.
     *
     * @return The (sorted) configuration properties, never {@code null}.
     */
    public Map<String, String> getProperties()
    {
        return properties;
    }

    @Override
    public String toString()
    {
        return name + " " + inputs + " > " + outputDirectory;
    }

    public static final class Builder
    {

        private final String name;

        private String action = "Processing";

        private File tool;

        private final List<ArgumentTemplate> invocations = new ArrayList<ArgumentTemplate>();

        private PathSet inputs;

        private File outputDirectory;

        private OutputMapper outputMapper;

        private final List<String> cleanPatterns = new ArrayList<String>();

        private int threads = 1;

        private long timeout;

        private final Map<String, String> properties = new TreeMap<String, String>();

        Builder( String name )
        {
            if ( name == null || name.length() <= 0 )
            {
                throw new IllegalArgumentException( "task name not specified" );
            }
            this.name = name;
        }

        public Builder action( String action )
        {
            if ( action == null || action.length() <= 0 )
            {
                throw new IllegalArgumentException( "action not specified" );
            }
            this.action = action;
            return this;
        }

        public Builder tool( File tool )
        {
            this.tool = tool;
            return this;
        }

        public Builder invocation( ArgumentTemplate arguments )
        {
            if ( arguments == null )
            {
                throw new IllegalArgumentException( "arguments not specified" );
            }
            invocations.add( arguments );
            return this;
        }

        public Builder invocation( String... arguments )
        {
            return invocation( ArgumentTemplate.of( arguments ) );
        }

        public Builder inputs( PathSet inputs )
        {
            this.inputs = inputs;
            return this;
        }

        public Builder outputDirectory( File outputDirectory )
        {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder outputMapper( OutputMapper outputMapper )
        {
            this.outputMapper = outputMapper;
            return this;
        }

        public Builder cleanPattern( String pattern )
        {
            if ( pattern != null && pattern.length() > 0 )
            {
                cleanPatterns.add( pattern );
            }
            return this;
        }

        public Builder threads( int threads )
        {
            if ( threads < 1 )
            {
                throw new IllegalArgumentException( "thread count must be positive: " + threads );
            }
            this.threads = threads;
            return this;
        }

        public Builder timeout( long timeout )
        {
            if ( timeout < 0 )
            {
                throw new IllegalArgumentException( "timeout must not be negative: " + timeout );
            }
            this.timeout = timeout;
            return this;
        }

        public Builder property( String key, String value )
        {
            if ( key == null )
            {
                throw new IllegalArgumentException( "property key not specified" );
            }
            properties.put( key, value );
            return this;
        }

        public TaskConfiguration build()
        {
            if ( tool == null )
            {
                throw new IllegalArgumentException( "tool executable not specified" );
            }
            if ( invocations.isEmpty() )
            {
                throw new IllegalArgumentException( "tool arguments not specified" );
            }
            if ( inputs == null )
            {
                throw new IllegalArgumentException( "inputs not specified" );
            }
            if ( outputDirectory == null )
            {
                throw new IllegalArgumentException( "output directory not specified" );
            }
            if ( outputMapper == null )
            {
                throw new IllegalArgumentException( "output mapper not specified" );
            }
            return new TaskConfiguration( this );
        }

    }

}
