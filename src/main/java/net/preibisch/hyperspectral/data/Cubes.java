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

import java.util.Arrays;

import net.imglib2.Cursor;
import net.imglib2.Dimensions;
import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.util.RealSum;
import net.imglib2.view.Views;

/**
 * Static helpers for spectral cubes, which are {@code (x = column, y = row, band)} images.
 */
public class Cubes
{
	public static final int X = 0;
	public static final int Y = 1;
	public static final int BAND = 2;

	public static Img< FloatType > create( final long width, final long height, final long numBands )
	{
		return ArrayImgs.floats( width, height, numBands );
	}

	public static Img< FloatType > create( final Dimensions dimensions )
	{
		return ArrayImgs.floats( Intervals.dimensionsAsLongArray( dimensions ) );
	}

	public static Img< FloatType > filled( final long width, final long height, final long numBands, final float value )
	{
		final Img< FloatType > img = create( width, height, numBands );

		for ( final FloatType t : img )
			t.set( value );

		return img;
	}

	/**
	 * @param input - any float cube, need not be zero-min
	 * @return a zero-min copy backed by an array
	 */
	public static Img< FloatType > copy( final RandomAccessibleInterval< FloatType > input )
	{
		final Img< FloatType > output = create( input );
		LoopBuilder.setImages( input, output ).forEachPixel( ( i, o ) -> o.set( i ) );
		return output;
	}

	public static RandomAccessibleInterval< FloatType > band( final RandomAccessibleInterval< FloatType > cube, final long band )
	{
		return Views.hyperSlice( cube, BAND, cube.min( BAND ) + band );
	}

	public static < T extends RealType< T > > double[] minMax( final RandomAccessibleInterval< T > img )
	{
		double min = Double.MAX_VALUE;
		double max = -Double.MAX_VALUE;

		final Cursor< T > c = Views.flatIterable( img ).cursor();

		while ( c.hasNext() )
		{
			final double v = c.next().getRealDouble();

			min = Math.min( min, v );
			max = Math.max( max, v );
		}

		return new double[]{ min, max };
	}

	public static < T extends RealType< T > > double average( final RandomAccessibleInterval< T > img )
	{
		final RealSum sum = new RealSum();
		long count = 0;

		for ( final T t : Views.flatIterable( img ) )
		{
			sum.add( t.getRealDouble() );
			++count;
		}

		return sum.getSum() / count;
	}

	/**
	 * Averages every band of the cube over the given spatial region.
	 *
	 * @param cube - the cube
	 * @param spatial - 2d interval in x/y, null for the whole cube
	 * @return one average per band
	 */
	public static double[] bandAverages( final RandomAccessibleInterval< FloatType > cube, final Interval spatial )
	{
		final int numBands = (int)cube.dimension( BAND );
		final double[] averages = new double[ numBands ];

		for ( int b = 0; b < numBands; ++b )
		{
			final RandomAccessibleInterval< FloatType > band = band( cube, b );
			averages[ b ] = average( spatial == null ? band : Views.interval( band, spatial ) );
		}

		return averages;
	}

	/**
	 * @return the 2d x/y interval of the cube
	 */
	public static Interval spatialInterval( final Interval cube )
	{
		return new FinalInterval(
				new long[]{ cube.min( X ), cube.min( Y ) },
				new long[]{ cube.max( X ), cube.max( Y ) } );
	}

	public static boolean sameShape( final Dimensions a, final Dimensions b )
	{
		return Intervals.equalDimensions( a, b );
	}

	/**
	 * @return the shape as (height, width, bands)
	 */
	public static String printShape( final Dimensions cube )
	{
		if ( cube.numDimensions() != 3 )
			return Arrays.toString( Intervals.dimensionsAsLongArray( cube ) );

		return "(" + cube.dimension( Y ) + ", " + cube.dimension( X ) + ", " + cube.dimension( BAND ) + ")";
	}
}
