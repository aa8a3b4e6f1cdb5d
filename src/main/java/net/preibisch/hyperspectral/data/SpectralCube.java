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
package net.preibisch.hyperspectral.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;

/**
 * A hyperspectral cube together with its band index to wavelength association.
 * Instances are immutable, derived cubes are created with {@link #copy(RandomAccessibleInterval)}.
 */
public class SpectralCube
{
	final RandomAccessibleInterval< FloatType > data;
	final List< Double > wavelengths;

	public SpectralCube( final RandomAccessibleInterval< FloatType > data )
	{
		this( data, null );
	}

	/**
	 * @param data - the cube (x, y, band)
	 * @param wavelengths - one entry per band, or null/empty if unknown
	 */
	public SpectralCube( final RandomAccessibleInterval< FloatType > data, final List< Double > wavelengths )
	{
		if ( data == null )
			throw new NullPointerException( "data" );

		if ( data.numDimensions() != 3 )
			throw new IllegalArgumentException( "Expected a 3d cube (x, y, band), but got " + data.numDimensions() + " dimensions." );

		this.data = data;

		if ( wavelengths == null )
			this.wavelengths = Collections.emptyList();
		else
			this.wavelengths = Collections.unmodifiableList( new ArrayList<>( wavelengths ) );
	}

	public RandomAccessibleInterval< FloatType > getData() { return data; }
	public List< Double > getWavelengths() { return wavelengths; }
	public boolean hasWavelengths() { return !wavelengths.isEmpty(); }

	public int width() { return (int)data.dimension( Cubes.X ); }
	public int height() { return (int)data.dimension( Cubes.Y ); }
	public int numBands() { return (int)data.dimension( Cubes.BAND ); }

	public RandomAccessibleInterval< FloatType > band( final int band )
	{
		return Cubes.band( data, band );
	}

	public SpectralCube copy( final RandomAccessibleInterval< FloatType > newData )
	{
		return new SpectralCube( newData, wavelengths );
	}

	public SpectralCube copy( final RandomAccessibleInterval< FloatType > newData, final List< Double > newWavelengths )
	{
		return new SpectralCube( newData, newWavelengths );
	}

	@Override
	public String toString()
	{
		return "SpectralCube" + Cubes.printShape( data ) + ", #wavelengths=" + wavelengths.size();
	}
}
