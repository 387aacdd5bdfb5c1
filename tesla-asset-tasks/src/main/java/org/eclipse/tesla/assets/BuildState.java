package org.eclipse.tesla.assets;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InvalidClassException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The snapshot of a task's inputs as of the last build: the configuration fingerprint and, for every input file, its
 * content fingerprint plus the outputs that were produced from it. The build host is responsible for keeping the
 * snapshot between builds, e.g. via {@link #save(File)} and {@link #load(File)}.
 */
public final class BuildState
    implements Serializable
{

    private static final long serialVersionUID = -7512384723061942518L;

    private byte[] configuration;

    private final Map<File, InputState> inputs;

    public BuildState()
    {
        this.inputs = new TreeMap<File, InputState>();
    }

    /**
     * Creates a copy of the specified build state.
     *
     * @param state The build state to copy, must not be {@code null}.
     */
    public BuildState( BuildState state )
    {
        if ( state == null )
        {
            throw new IllegalArgumentException( "build state not specified" );
        }
        this.configuration = ( state.configuration != null ) ? state.configuration.clone() : null;
        this.inputs = new TreeMap<File, InputState>( state.inputs );
    }

    public static BuildState load( File stateFile )
        throws IOException
    {
        InputStream is = new FileInputStream( stateFile );
        try
        {
            ObjectInputStream ois = new ObjectInputStream( new BufferedInputStream( is ) );
            return (BuildState) ois.readObject();
        }
        catch ( ClassNotFoundException e )
        {
            throw (IOException) new InvalidClassException( "Unknown class in build state " + stateFile ).initCause( e );
        }
        catch ( ClassCastException e )
        {
            throw (IOException) new InvalidClassException( "Not a build state " + stateFile ).initCause( e );
        }
        finally
        {
            is.close();
        }
    }

    public void save( File stateFile )
        throws IOException
    {
        File parent = stateFile.getAbsoluteFile().getParentFile();
        if ( !parent.isDirectory() && !parent.mkdirs() && !parent.isDirectory() )
        {
            throw new IOException( "Could not create directory " + parent );
        }

        ObjectOutputStream oos = new ObjectOutputStream( new BufferedOutputStream( new FileOutputStream( stateFile ) ) );
        try
        {
            oos.writeObject( this );
        }
        finally
        {
            oos.close();
        }
    }

    public byte[] getConfiguration()
    {
        return ( configuration != null ) ? configuration.clone() : null;
    }

    public void setConfiguration( byte[] digest )
    {
        this.configuration = ( digest != null ) ? digest.clone() : null;
    }

    public boolean isConfigurationChanged( byte[] digest )
    {
        return !Arrays.equals( configuration, digest );
    }

    /**
     * Gets the input files recorded in this state.
     *
     * @return The (sorted, read-only) input files, never {@code null}.
     */
    public Set<File> getInputs()
    {
        return Collections.unmodifiableSet( inputs.keySet() );
    }

    public boolean containsInput( File input )
    {
        return inputs.containsKey( input );
    }

    /**
     * Gets the fingerprint recorded for the specified input.
     *
     * @param input The input file, must not be {@code null}.
     * @return The fingerprint or {@code null} if the input is unknown.
     */
    public String getFingerprint( File input )
    {
        InputState state = inputs.get( input );
        return ( state != null ) ? state.fingerprint : null;
    }

    /**
     * Gets the outputs recorded for the specified input.
     *
     * @param input The input file, must not be {@code null}.
     * @return The (read-only) outputs, never {@code null}.
     */
    public List<File> getOutputs( File input )
    {
        InputState state = inputs.get( input );
        if ( state == null )
        {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList( state.outputs );
    }

    /**
     * Records the fingerprint and outputs of an input, replacing any previous record.
     *
     * @param input The input file, must not be {@code null}.
     * @param fingerprint The fingerprint of the input, must not be {@code null}.
     * @param outputs The outputs produced from the input, must not be {@code null}.
     */
    public void putInput( File input, String fingerprint, Collection<File> outputs )
    {
        if ( input == null )
        {
            throw new IllegalArgumentException( "input not specified" );
        }
        if ( fingerprint == null )
        {
            throw new IllegalArgumentException( "fingerprint not specified for " + input );
        }
        if ( outputs == null )
        {
            throw new IllegalArgumentException( "outputs not specified for " + input );
        }
        inputs.put( input, new InputState( fingerprint, new ArrayList<File>( outputs ) ) );
    }

    /**
     * Removes an input from this state.
     *
     * @param input The input file, must not be {@code null}.
     * @return The outputs that were recorded for the input, never {@code null}.
     */
    public List<File> removeInput( File input )
    {
        InputState state = inputs.remove( input );
        if ( state == null )
        {
            return Collections.emptyList();
        }
        return state.outputs;
    }

    public int size()
    {
        return inputs.size();
    }

    @Override
    public boolean equals( Object obj )
    {
        if ( this == obj )
        {
            return true;
        }
        if ( !( obj instanceof BuildState ) )
        {
            return false;
        }
        BuildState that = (BuildState) obj;
        return Arrays.equals( configuration, that.configuration ) && inputs.equals( that.inputs );
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode( configuration ) * 31 + inputs.hashCode();
    }

    @Override
    public String toString()
    {
        return "BuildState" + inputs.keySet();
    }

    static final class InputState
        implements Serializable
    {

        private static final long serialVersionUID = 2208723485472309751L;

        final String fingerprint;

        final List<File> outputs;

        InputState( String fingerprint, List<File> outputs )
        {
            this.fingerprint = fingerprint;
            this.outputs = outputs;
        }

        @Override
        public boolean equals( Object obj )
        {
            if ( this == obj )
            {
                return true;
            }
            if ( !( obj instanceof InputState ) )
            {
                return false;
            }
            InputState that = (InputState) obj;
            return fingerprint.equals( that.fingerprint ) && outputs.equals( that.outputs );
        }

        @Override
        public int hashCode()
        {
            return fingerprint.hashCode() * 31 + outputs.hashCode();
        }

    }

}
