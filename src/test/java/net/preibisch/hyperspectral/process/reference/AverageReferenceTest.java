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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import net.preibisch.hyperspectral.data.Cubes;
import net.preibisch.hyperspectral.process.ShapeMismatchException;

public class AverageReferenceTest
{
	static Img< FloatType > bands( final long w, final long h, final float... values )
	{
		final Img< FloatType > cube = Cubes.create( w, h, values.length );

		for ( int b = 0; b < values.length; ++b )
			for ( final FloatType t : Views.flatIterable( Cubes.band( cube, b ) ) )
				t.set( values[ b ] );

		return cube;
	}

	@Test
	public void testBlackDifferentSize()
	{
		final AverageReference black = new AverageReference( ReferenceType.BLACK );
		black.setReference( bands( 2, 2, 1, 2, 3 ) );

		final Img< FloatType > result = black.apply( Cubes.filled( 5, 5, 3, 10 ) );

		assertArrayEquals( new double[]{ 1, 2, 3 }, black.state.get().perBand(), 0 );
		assertEquals( 5, result.dimension( 0 ) );
		assertArrayEquals( new double[]{ 9, 9 }, Cubes.minMax( Cubes.band( result, 0 ) ), 0 );
		assertArrayEquals( new double[]{ 8, 8 }, Cubes.minMax( Cubes.band( result, 1 ) ), 0 );
		assertArrayEquals( new double[]{ 7, 7 }, Cubes.minMax( Cubes.band( result, 2 ) ), 0 );
	}

	@Test
	public void testWhiteSkipsUnitAverage()
	{
		final AverageReference white = new AverageReference( ReferenceType.WHITE );
		white.setReference( bands( 3, 1, 1, 2, 4 ) );

		final Img< FloatType > result = white.apply( bands( 2, 2, 7, 8, 8 ) );

		assertArrayEquals( new double[]{ 7, 7 }, Cubes.minMax( Cubes.band( result, 0 ) ), 0 );
		assertArrayEquals( new double[]{ 4, 4 }, Cubes.minMax( Cubes.band( result, 1 ) ), 0 );
		assertArrayEquals( new double[]{ 2, 2 }, Cubes.minMax( Cubes.band( result, 2 ) ), 0 );
	}

	@Test
	public void testBlackDoesNotSkipUnitAverage()
	{
		final AverageReference black = new AverageReference( ReferenceType.BLACK );
		black.setReference( bands( 1, 1, 1 ) );

		assertArrayEquals( new double[]{ 4, 4 }, Cubes.minMax( black.apply( bands( 2, 2, 5 ) ) ), 0 );
	}

	@Test
	public void testStatisticsComputedOnce()
	{
		final AverageReference black = new AverageReference( ReferenceType.BLACK );
		black.setReference( bands( 2, 2, 1 ) );
		black.apply( bands( 2, 2, 5 ) );

		final ReferenceAverages first = black.state.get();
		black.apply( bands( 3, 3, 5 ) );

		assertTrue( first == black.state.get() );
	}

	@Test( expected = ShapeMismatchException.class )
	public void testBandMismatch()
	{
		final AverageReference black = new AverageReference( ReferenceType.BLACK );
		black.setReference( bands( 2, 2, 1, 2 ) );
		black.apply( bands( 2, 2, 1, 2, 3 ) );
	}

	@Test
	public void testName()
	{
		assertEquals( "br-avg", new AverageReference( ReferenceType.BLACK ).getName() );
		assertEquals( "wr-avg", new AverageReference( ReferenceType.WHITE ).getName() );
		assertEquals( "wr-same-size", new SameSizeReference( ReferenceType.WHITE ).getName() );
	}
}
