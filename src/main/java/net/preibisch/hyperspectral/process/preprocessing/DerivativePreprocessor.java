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

import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.util.CombinatoricsUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import net.preibisch.hyperspectral.data.Cubes;
import net.preibisch.hyperspectral.data.SpectralCube;
import net.preibisch.hyperspectral.process.ConfigurationException;
import net.preibisch.hyperspectral.process.ShapeMismatchException;

/**
 * Savitzky-Golay filter along the band axis of every spectrum. For each band a polynomial of degree
 * {@link #getPolyOrder()} is fitted (least squares) to the {@link #getWindowLength()} bands around it and
 * its {@link #getDeriv()}-th derivative is evaluated at that band.
 * <p>
 * Near the first and last bands the window cannot be centered, the polynomial fitted to the first (or last)
 * window is evaluated at the band instead.
 */
public class DerivativePreprocessor extends Preprocessor
{
	private static final Logger LOG = LoggerFactory.getLogger( DerivativePreprocessor.class );

	public static int defaultWindowLength = 5;
	public static int defaultPolyOrder = 2;
	public static int defaultDeriv = 1;

	final int windowLength, polyOrder, deriv;

	public DerivativePreprocessor()
	{
		this( defaultWindowLength, defaultPolyOrder, defaultDeriv );
	}

	/**
	 * @param windowLength - number of bands used for each fit, odd
	 * @param polyOrder - degree of the fitted polynomial, smaller than the window length
	 * @param deriv - order of the derivative, 0 only smooths
	 */
	public DerivativePreprocessor( final int windowLength, final int polyOrder, final int deriv )
	{
		if ( windowLength < 1 || windowLength % 2 == 0 )
			throw new ConfigurationException( "Window length must be a positive odd number: " + windowLength );

		if ( polyOrder < 0 || polyOrder >= windowLength )
			throw new ConfigurationException( "Polynomial order must be in [0, " + windowLength + "): " + polyOrder );

		if ( deriv < 0 )
			throw new ConfigurationException( "Derivative order must not be negative: " + deriv );

		this.windowLength = windowLength;
		this.polyOrder = polyOrder;
		this.deriv = deriv;
	}

	public int getWindowLength() { return windowLength; }
	public int getPolyOrder() { return polyOrder; }
	public int getDeriv() { return deriv; }

	@Override
	public String getName() { return "derivative"; }

	@Override
	public String getDescription() { return "Applies Savitzky-Golay to the data."; }

	@Override
	public List< SpectralCube > apply( final SpectralCube data )
	{
		final int numBands = data.numBands();

		if ( numBands < windowLength )
			throw new ShapeMismatchException( "Window length " + windowLength + " exceeds the number of bands: " + numBands );

		LOG.debug( "window={}, polyorder={}, deriv={}, bands={}", windowLength, polyOrder, deriv, numBands );

		final int[] start = new int[ numBands ];
		final double[][] weights = new double[ numBands ][];

		for ( int b = 0; b < numBands; ++b )
		{
			start[ b ] = Math.max( 0, Math.min( b - windowLength / 2, numBands - windowLength ) );
			weights[ b ] = weights( start[ b ] - b );
		}

		final Img< FloatType > out = Cubes.copy( data.getData() );
		final RandomAccess< FloatType > ra = out.randomAccess();
		final Cursor< FloatType > c = Views.flatIterable( Cubes.band( out, 0 ) ).localizingCursor();
		final double[] spectrum = new double[ numBands ];

		while ( c.hasNext() )
		{
			c.fwd();
			ra.setPosition( c.getLongPosition( Cubes.X ), Cubes.X );
			ra.setPosition( c.getLongPosition( Cubes.Y ), Cubes.Y );

			for ( int b = 0; b < numBands; ++b )
			{
				ra.setPosition( b, Cubes.BAND );
				spectrum[ b ] = ra.get().getRealDouble();
			}

			for ( int b = 0; b < numBands; ++b )
			{
				double value = 0;
				for ( int k = 0; k < windowLength; ++k )
					value += weights[ b ][ k ] * spectrum[ start[ b ] + k ];

				ra.setPosition( b, Cubes.BAND );
				ra.get().setReal( value );
			}
		}

		return Collections.singletonList( data.copy( out ) );
	}

	/**
	 * Weights that, applied to the window, give the derivative of the least squares polynomial at
	 * the position 0.
	 *
	 * @param offset - position of the first window element relative to the evaluated band
	 */
	double[] weights( final int offset )
	{
		final double[] w = new double[ windowLength ];

		if ( deriv > polyOrder )
			return w;

		final double[][] vandermonde = new double[ windowLength ][ polyOrder + 1 ];

		for ( int k = 0; k < windowLength; ++k )
			for ( int m = 0; m <= polyOrder; ++m )
				vandermonde[ k ][ m ] = Math.pow( offset + k, m );

		// rows of the pseudo-inverse map the window to the polynomial coefficients
		final RealMatrix pinv = new SingularValueDecomposition( new Array2DRowRealMatrix( vandermonde, false ) ).getSolver().getInverse();
		final double factorial = CombinatoricsUtils.factorialDouble( deriv );

		for ( int k = 0; k < windowLength; ++k )
			w[ k ] = factorial * pinv.getEntry( deriv, k );

		return w;
	}
}
