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

import java.util.EnumMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Uses user-supplied min/max values to normalize the data, values below or above get clipped.
 * Min/max can be overridden per channel.
 */
public class FixedNormalization extends Normalization
{
	private static final Logger LOG = LoggerFactory.getLogger( FixedNormalization.class );

	public static double defaultMin = 0.0;
	public static double defaultMax = 10000.0;

	double min, max;
	final EnumMap< Channel, double[] > perChannel = new EnumMap<>( Channel.class );

	public FixedNormalization()
	{
		this( defaultMin, defaultMax );
	}

	public FixedNormalization( final double min, final double max )
	{
		this.min = min;
		this.max = max;
	}

	public double getMin() { return min; }
	public double getMax() { return max; }

	public void setMinMax( final double min, final double max )
	{
		this.min = min;
		this.max = max;
	}

	public void setMinMax( final Channel channel, final double min, final double max )
	{
		perChannel.put( channel, new double[]{ min, max } );
	}

	/**
	 * @return min and max used for the channel
	 */
	public double[] getMinMax( final Channel channel )
	{
		final double[] minmax = perChannel.get( channel );

		if ( minmax == null )
			return new double[]{ min, max };
		else
			return minmax.clone();
	}

	@Override
	public String getName() { return "norm-fixed"; }

	@Override
	public String getDescription()
	{
		return "Uses the user-supplied min/max values to normalize the data. Values below or above get clipped.";
	}

	@Override
	protected String preCheck()
	{
		final String result = super.preCheck();

		if ( result != null )
			return result;

		for ( final Channel channel : Channel.values() )
		{
			final double[] minmax = getMinMax( channel );

			if ( minmax[ 0 ] > minmax[ 1 ] )
				return "Minimum is larger than maximum for channel " + channel + ": " + minmax[ 0 ] + " > " + minmax[ 1 ];
		}

		return null;
	}

	@Override
	protected Img< FloatType > doNormalize( final RandomAccessibleInterval< FloatType > band, final Channel channel )
	{
		final double[] minmax = getMinMax( channel );
		LOG.info( "channel={}, min={}, max={}, range={}", channel, minmax[ 0 ], minmax[ 1 ], minmax[ 1 ] - minmax[ 0 ] );

		return rescale( band, minmax[ 0 ], minmax[ 1 ], true );
	}
}
