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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.FinalInterval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import net.preibisch.hyperspectral.data.Cubes;

/**
 * Uses the min/max values of a rectangular region to normalize the band, values below or above get clipped.
 * <p>
 * The region spans the columns [x0, x1) and rows [y0, y1), i.e. the right column and bottom row are
 * not part of it. A negative x1 or y1 counts from the end of the band, e.g. -1 stands for the last column
 * or row (which is therefore excluded as well) and -2 for the one before it.
 */
public class RegionNormalization extends Normalization
{
	private static final Logger LOG = LoggerFactory.getLogger( RegionNormalization.class );

	public static final int EDGE = -1;

	int x0, y0, x1, y1;

	public RegionNormalization()
	{
		this( 0, 0, EDGE, EDGE );
	}

	public RegionNormalization( final int x0, final int y0, final int x1, final int y1 )
	{
		this.x0 = x0;
		this.y0 = y0;
		this.x1 = x1;
		this.y1 = y1;
	}

	public int getX0() { return x0; }
	public int getY0() { return y0; }
	public int getX1() { return x1; }
	public int getY1() { return y1; }

	public void setRegion( final int x0, final int y0, final int x1, final int y1 )
	{
		this.x0 = x0;
		this.y0 = y0;
		this.x1 = x1;
		this.y1 = y1;
	}

	@Override
	public String getName() { return "norm-region"; }

	@Override
	public String getDescription()
	{
		return "Uses the min/max values determined from the specified region to normalize the data. Values below or above get clipped.";
	}

	@Override
	protected String preCheck()
	{
		final String result = super.preCheck();

		if ( result == null && ( x0 < 0 || y0 < 0 ) )
			return "Region start must not be negative: x0=" + x0 + ", y0=" + y0;

		return result;
	}

	/**
	 * @return the region as 2d interval (inclusive max) within the band
	 */
	FinalInterval region( final RandomAccessibleInterval< FloatType > band )
	{
		final long w = band.dimension( Cubes.X );
		final long h = band.dimension( Cubes.Y );

		final long endX = Math.min( w, x1 < 0 ? w + x1 : x1 );
		final long endY = Math.min( h, y1 < 0 ? h + y1 : y1 );

		if ( endX <= x0 || endY <= y0 )
			return null;

		return new FinalInterval(
				new long[]{ band.min( Cubes.X ) + x0, band.min( Cubes.Y ) + y0 },
				new long[]{ band.min( Cubes.X ) + endX - 1, band.min( Cubes.Y ) + endY - 1 } );
	}

	@Override
	protected Img< FloatType > doNormalize( final RandomAccessibleInterval< FloatType > band, final Channel channel )
	{
		final FinalInterval region = region( band );

		if ( region == null )
			throw new IllegalArgumentException(
					"Empty normalization region for band " + Cubes.printShape( band ) + ": x0=" + x0 + ", y0=" + y0 + ", x1=" + x1 + ", y1=" + y1 );

		final double[] minmax = Cubes.minMax( Views.interval( band, region ) );
		LOG.info( "channel={}, min={}, max={}, range={}", channel, minmax[ 0 ], minmax[ 1 ], minmax[ 1 ] - minmax[ 0 ] );

		return rescale( band, minmax[ 0 ], minmax[ 1 ], true );
	}
}
