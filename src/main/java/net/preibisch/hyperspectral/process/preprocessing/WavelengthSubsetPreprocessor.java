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
package net.preibisch.hyperspectral.process.preprocessing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.hyperspectral.data.Cubes;
import net.preibisch.hyperspectral.data.SpectralCube;
import net.preibisch.hyperspectral.process.ShapeMismatchException;

/**
 * Keeps a subset of the bands, either explicit indices or an inclusive range.
 */
public class WavelengthSubsetPreprocessor extends Preprocessor
{
	final int[] indices;

	/**
	 * @param indices - the 0-based band indices to keep, in output order
	 */
	public WavelengthSubsetPreprocessor( final int... indices )
	{
		if ( indices.length == 0 )
			throw new IllegalArgumentException( "No wavelength indices specified" );

		this.indices = indices.clone();
	}

	/**
	 * @param from - first 0-based band to keep
	 * @param to - last 0-based band to keep (inclusive)
	 * @return the preprocessor
	 */
	public static WavelengthSubsetPreprocessor range( final int from, final int to )
	{
		if ( to < from )
			throw new IllegalArgumentException( "Invalid range: " + from + " > " + to );

		final int[] indices = new int[ to - from + 1 ];

		for ( int i = 0; i < indices.length; ++i )
			indices[ i ] = from + i;

		return new WavelengthSubsetPreprocessor( indices );
	}

	public int[] getIndices() { return indices.clone(); }

	@Override
	public String getName() { return "wavelength-subset"; }

	@Override
	public String getDescription() { return "Keeps only the specified wavelengths."; }

	@Override
	public List< SpectralCube > apply( final SpectralCube data )
	{
		final RandomAccessibleInterval< FloatType > in = data.getData();

		for ( final int i : indices )
			if ( i < 0 || i >= data.numBands() )
				throw new ShapeMismatchException( "Wavelength index " + i + " is out of range, data has " + data.numBands() + " bands: " + Arrays.toString( indices ) );

		final Img< FloatType > out = Cubes.create( in.dimension( Cubes.X ), in.dimension( Cubes.Y ), indices.length );
		final ArrayList< Double > wavelengths = new ArrayList<>();

		for ( int b = 0; b < indices.length; ++b )
		{
			LoopBuilder.setImages( data.band( indices[ b ] ), Cubes.band( out, b ) ).forEachPixel( ( i, o ) -> o.set( i ) );

			if ( data.hasWavelengths() )
				wavelengths.add( data.getWavelengths().get( indices[ b ] ) );
		}

		return Collections.singletonList( data.copy( out, wavelengths ) );
	}
}
