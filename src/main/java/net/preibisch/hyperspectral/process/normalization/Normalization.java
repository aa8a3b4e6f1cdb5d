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
package net.preibisch.hyperspectral.process.normalization;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import net.preibisch.hyperspectral.process.ConfigurationException;

/**
 * Maps a single band into [0,1] for display.
 */
public abstract class Normalization
{
	public abstract String getName();

	public abstract String getDescription();

	/**
	 * @return null if the normalization can be applied, otherwise the error message
	 */
	protected String preCheck()
	{
		return null;
	}

	protected abstract Img< FloatType > doNormalize( final RandomAccessibleInterval< FloatType > band, final Channel channel );

	/**
	 * @param normalized - the normalized band
	 * @return null if the result is valid, otherwise the error message
	 */
	protected String postCheck( final Img< FloatType > normalized )
	{
		return null;
	}

	/**
	 * Normalizes the band, the input is not modified.
	 *
	 * @param band - 2d band (x, y)
	 * @param channel - the display channel the band is used for
	 * @return the normalized band
	 * @throws ConfigurationException if the normalization is not set up correctly
	 */
	public Img< FloatType > normalize( final RandomAccessibleInterval< FloatType > band, final Channel channel )
	{
		String msg = preCheck();

		if ( msg != null )
			throw new ConfigurationException( msg );

		final Img< FloatType > result = doNormalize( band, channel );

		if ( result != null )
		{
			msg = postCheck( result );

			if ( msg != null )
				throw new ConfigurationException( msg );
		}

		return result;
	}

	/**
	 * Linearly maps [min, max] to [0, 1]. A range of zero results in an all-zero band.
	 *
	 * @param band - the input
	 * @param min - maps to 0
	 * @param max - maps to 1
	 * @param clip - whether to clip values outside [min, max] first
	 * @return the rescaled band, same dimensions as the input and zero-min
	 */
	public static Img< FloatType > rescale( final RandomAccessibleInterval< FloatType > band, final double min, final double max, final boolean clip )
	{
		final Img< FloatType > result = ArrayImgs.floats( Intervals.dimensionsAsLongArray( band ) );
		final double range = max - min;

		if ( range == 0 )
			return result;

		final Cursor< FloatType > in = Views.flatIterable( band ).cursor();
		final Cursor< FloatType > out = Views.flatIterable( result ).cursor();

		while ( out.hasNext() )
		{
			double v = in.next().getRealDouble();

			if ( clip )
				v = Math.min( max, Math.max( min, v ) );

			out.next().setReal( ( v - min ) / range );
		}

		return result;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
