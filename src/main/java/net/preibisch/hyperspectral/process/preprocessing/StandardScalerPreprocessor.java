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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.RealSum;
import net.imglib2.view.Views;
import net.preibisch.hyperspectral.data.Cubes;
import net.preibisch.hyperspectral.data.SpectralCube;
import net.preibisch.hyperspectral.process.CalibrationException;
import net.preibisch.hyperspectral.process.ShapeMismatchException;

/**
 * Scales every band to zero mean and unit variance, using mean and (population) standard deviation
 * per band learned in {@link #fit(SpectralCube)}. A band with zero standard deviation is only centered.
 */
public class StandardScalerPreprocessor extends Preprocessor
{
	private static final Logger LOG = LoggerFactory.getLogger( StandardScalerPreprocessor.class );

	double[] mean, std;

	@Override
	public String getName() { return "std-scaler"; }

	@Override
	public String getDescription() { return "Scales every band to zero mean and unit variance."; }

	public boolean isFitted() { return mean != null; }

	@Override
	public void fit( final SpectralCube data )
	{
		mean = new double[ data.numBands() ];
		std = new double[ data.numBands() ];

		for ( int b = 0; b < data.numBands(); ++b )
		{
			final double[] meanStd = meanStd( Views.flatIterable( data.band( b ) ) );
			mean[ b ] = meanStd[ 0 ];
			std[ b ] = meanStd[ 1 ];
		}

		LOG.debug( "mean={}, std={}", Arrays.toString( mean ), Arrays.toString( std ) );
	}

	@Override
	public List< SpectralCube > apply( final SpectralCube data )
	{
		if ( !isFitted() )
			throw new CalibrationException( "Standard scaler has not been fitted, call fit() first." );

		if ( data.numBands() != mean.length )
			throw new ShapeMismatchException( "Standard scaler was fitted on " + mean.length + " bands, but data has " + data.numBands() );

		final Img< FloatType > out = Cubes.copy( data.getData() );

		for ( int b = 0; b < mean.length; ++b )
		{
			final double m = mean[ b ];
			final double s = std[ b ] == 0 ? 1 : std[ b ];

			for ( final FloatType t : Views.flatIterable( Cubes.band( out, b ) ) )
				t.setReal( ( t.getRealDouble() - m ) / s );
		}

		return Collections.singletonList( data.copy( out ) );
	}

	/**
	 * @return mean and population standard deviation of the values
	 */
	static double[] meanStd( final Iterable< FloatType > values )
	{
		final RealSum sum = new RealSum();
		long count = 0;

		for ( final FloatType t : values )
		{
			sum.add( t.getRealDouble() );
			++count;
		}

		final double mean = sum.getSum() / count;
		final RealSum sumSq = new RealSum();

		for ( final FloatType t : values )
		{
			final double d = t.getRealDouble() - mean;
			sumSq.add( d * d );
		}

		return new double[]{ mean, Math.sqrt( sumSq.getSum() / count ) };
	}
}
