/*-
 * #%L
 * Software for the radiometric calibration and fake-color rendering
 * of hyperspectral scan cubes.
 * %%
 * Copyright (C) 2024 - 2025 Hyperspectral Calibration developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.hyperspectral.process.reference;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.hyperspectral.io.SpectralCubeLoader;
import net.preibisch.hyperspectral.process.CalibrationException;
import net.preibisch.hyperspectral.process.ConfigurationException;

/**
 * Applies a black or white reference to a scan cube.
 * <p>
 * The reference is bound through {@link #setReference(RandomAccessibleInterval)} (or loaded lazily
 * from a reference file). Every setter resets the derived statistics, which are computed once by the
 * first {@link #apply(RandomAccessibleInterval)} afterwards.
 *
 * @param <S> type of the statistics derived from the reference
 */
public abstract class ReferenceMethod< S >
{
	private static final Logger LOG = LoggerFactory.getLogger( ReferenceMethod.class );

	public enum Capability
	{
		/** needs reference data only */
		PLAIN,
		/** needs reference data and an annotation rectangle into it */
		ANNOTATION_BASED
	}

	final ReferenceType type;
	final Capability capability;

	RandomAccessibleInterval< FloatType > reference;
	String referenceFile;
	SpectralCubeLoader loader;

	ReferenceState< S > state = ReferenceState.uninitialized();

	protected ReferenceMethod( final ReferenceType type, final Capability capability )
	{
		this.type = type;
		this.capability = capability;
	}

	public ReferenceType getType() { return type; }
	public Capability getCapability() { return capability; }

	/**
	 * @return the name of the method, e.g. "br-same-size"
	 */
	public String getName() { return type.getPrefix() + "-" + getSuffix(); }

	protected abstract String getSuffix();

	public abstract String getDescription();

	public RandomAccessibleInterval< FloatType > getReference() { return reference; }

	public void setReference( final RandomAccessibleInterval< FloatType > reference )
	{
		this.reference = reference;
		reset();
	}

	/**
	 * The reference file is only loaded if no reference has been bound when the method initializes.
	 *
	 * @param referenceFile - the reference cube to load
	 * @param loader - loader for the file
	 */
	public void setReferenceFile( final String referenceFile, final SpectralCubeLoader loader )
	{
		this.referenceFile = referenceFile;
		this.loader = loader;
		reset();
	}

	public String getReferenceFile() { return referenceFile; }

	public boolean isInitialized() { return state.isInitialized(); }

	protected void reset()
	{
		state = ReferenceState.uninitialized();
	}

	/**
	 * Validates the configuration and derives the statistics from the reference.
	 */
	protected S initialize()
	{
		if ( reference == null && referenceFile != null )
		{
			try
			{
				LOG.info( "Loading {} reference from: {}", type.getLabel(), referenceFile );
				reference = loader.load( referenceFile ).getData();
			}
			catch ( final IOException e )
			{
				throw new CalibrationException( "Failed to load " + type.getLabel() + " reference: " + referenceFile, e );
			}
		}

		if ( reference == null )
			throw new ConfigurationException( "No " + type.getLabel() + " reference set!" );

		return computeStatistics();
	}

	protected abstract S computeStatistics();

	protected abstract Img< FloatType > doApply( final RandomAccessibleInterval< FloatType > scan, final S statistics );

	/**
	 * Applies the reference to the scan.
	 *
	 * @param scan - the scan, not modified
	 * @return the corrected scan
	 */
	public Img< FloatType > apply( final RandomAccessibleInterval< FloatType > scan )
	{
		if ( !state.isInitialized() )
		{
			state = ReferenceState.initialized( initialize() );
			LOG.debug( "{}: initialized {}", getName(), state );
		}

		return doApply( scan, state.get() );
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
