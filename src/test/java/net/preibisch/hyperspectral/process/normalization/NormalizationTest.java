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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.hyperspectral.data.Cubes;
import net.preibisch.hyperspectral.data.annotations.BBox;
import net.preibisch.hyperspectral.data.annotations.ContoursManager;
import net.preibisch.hyperspectral.data.annotations.ObjectPrediction;
import net.preibisch.hyperspectral.data.annotations.ObjectPredictions;
import net.preibisch.hyperspectral.data.annotations.Polygon;
import net.preibisch.hyperspectral.process.ConfigurationException;

public class NormalizationTest
{
	/**
	 * @return 4x4 band with value x + 4 * y
	 */
	static Img< FloatType > ramp()
	{
		final Img< FloatType > band = ArrayImgs.floats( 4, 4 );
		final Cursor< FloatType > c = band.localizingCursor();

		while ( c.hasNext() )
		{
			c.fwd();
			c.get().set( c.getIntPosition( 0 ) + 4 * c.getIntPosition( 1 ) );
		}

		return band;
	}

	static float get( final RandomAccessibleInterval< FloatType > band, final int x, final int y )
	{
		final RandomAccess< FloatType > ra = band.randomAccess();
		ra.setPosition( new long[]{ x, y } );
		return ra.get().get();
	}

	static ObjectPrediction object( final String label, final int x0, final int y0, final int x1, final int y1 )
	{
		return new ObjectPrediction( label, new BBox( x0, y0, x1, y1 ),
				new Polygon( new int[][]{ { x0, y0 }, { x1, y0 }, { x1, y1 }, { x0, y1 } } ) );
	}

	@Test
	public void testSimple()
	{
		final Img< FloatType > normalized = new SimpleNormalization().normalize( ramp(), Channel.RED );

		assertArrayEquals( new double[]{ 0, 1 }, Cubes.minMax( normalized ), 0 );
		assertEquals( 0, get( normalized, 0, 0 ), 0 );
		assertEquals( 1, get( normalized, 3, 3 ), 0 );
		assertEquals( 5 / 15.0, get( normalized, 1, 1 ), 1e-6 );
	}

	@Test
	public void testZeroRange()
	{
		final Img< FloatType > constant = ArrayImgs.floats( 3, 3 );
		for ( final FloatType t : constant )
			t.set( 42 );

		assertArrayEquals( new double[]{ 0, 0 }, Cubes.minMax( new SimpleNormalization().normalize( constant, Channel.GREEN ) ), 0 );
		assertArrayEquals( new double[]{ 0, 0 }, Cubes.minMax( new FixedNormalization( 5, 5 ).normalize( constant, Channel.GREEN ) ), 0 );
		assertArrayEquals( new double[]{ 0, 0 }, Cubes.minMax( new RegionNormalization().normalize( constant, Channel.GREEN ) ), 0 );
	}

	@Test
	public void testFixed()
	{
		final FixedNormalization fixed = new FixedNormalization( 2, 12 );
		final Img< FloatType > normalized = fixed.normalize( ramp(), Channel.RED );

		assertEquals( 0, get( normalized, 0, 0 ), 0 );
		assertEquals( 0, get( normalized, 2, 0 ), 0 );
		assertEquals( 0.5, get( normalized, 3, 1 ), 1e-6 );
		assertEquals( 1, get( normalized, 0, 3 ), 0 );
		assertEquals( 1, get( normalized, 3, 3 ), 0 );

		fixed.setMinMax( Channel.BLUE, 0, 15 );
		assertEquals( 0, get( fixed.normalize( ramp(), Channel.BLUE ), 0, 0 ), 0 );
		assertEquals( 1, get( fixed.normalize( ramp(), Channel.BLUE ), 3, 3 ), 0 );
		assertArrayEquals( new double[]{ 2, 12 }, fixed.getMinMax( Channel.GREEN ), 0 );
	}

	@Test
	public void testFixedDefaults()
	{
		final FixedNormalization fixed = new FixedNormalization();

		assertEquals( 0, fixed.getMin(), 0 );
		assertEquals( 10000, fixed.getMax(), 0 );
	}

	@Test( expected = ConfigurationException.class )
	public void testFixedInvalidRange()
	{
		new FixedNormalization( 10, 1 ).normalize( ramp(), Channel.RED );
	}

	@Test
	public void testRegionExcludesLastRowAndColumn()
	{
		// default region is [0, 3) x [0, 3), i.e. max value 2 + 4 * 2 = 10
		final Img< FloatType > normalized = new RegionNormalization().normalize( ramp(), Channel.RED );

		assertEquals( 0, get( normalized, 0, 0 ), 0 );
		assertEquals( 0.5, get( normalized, 1, 1 ), 1e-6 );
		assertEquals( 1, get( normalized, 2, 2 ), 0 );
		assertEquals( 1, get( normalized, 3, 3 ), 0 );
	}

	@Test
	public void testRegion()
	{
		// [1, 3) x [1, 3): 5, 6, 9, 10
		final Img< FloatType > normalized = new RegionNormalization( 1, 1, 3, 3 ).normalize( ramp(), Channel.RED );

		assertEquals( 0, get( normalized, 0, 0 ), 0 );
		assertEquals( 0, get( normalized, 1, 1 ), 0 );
		assertEquals( 0.2, get( normalized, 2, 1 ), 1e-6 );
		assertEquals( 1, get( normalized, 2, 2 ), 0 );
	}

	@Test
	public void testRegionNegativeEnd()
	{
		// [0, 4 - 2) x [0, 4 - 2): 0, 1, 4, 5
		final Img< FloatType > normalized = new RegionNormalization( 0, 0, -2, -2 ).normalize( ramp(), Channel.RED );

		assertEquals( 0, get( normalized, 0, 0 ), 0 );
		assertEquals( 0.2, get( normalized, 1, 0 ), 1e-6 );
		assertEquals( 1, get( normalized, 1, 1 ), 0 );
		assertEquals( 1, get( normalized, 2, 2 ), 0 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testRegionNegativeEndBeyondStart()
	{
		new RegionNormalization( 0, 0, -10, -1 ).normalize( ramp(), Channel.RED );
	}

	@Test
	public void testObjectAnnotations()
	{
		final ObjectAnnotationsNormalization norm = new ObjectAnnotationsNormalization();
		norm.setAnnotations( new ObjectPredictions( "id", "ts", Arrays.asList(
				object( ContoursManager.LABEL_WHITEREF, 0, 0, 4, 4 ),
				object( "leaf", 1, 1, 3, 3 ) ) ) );

		// pixels (1..2, 1..2): 5, 6, 9, 10
		final Img< FloatType > normalized = norm.normalize( ramp(), Channel.RED );

		assertEquals( 0, get( normalized, 0, 0 ), 0 );
		assertEquals( 0, get( normalized, 1, 1 ), 0 );
		assertEquals( 0.2, get( normalized, 2, 1 ), 1e-6 );
		assertEquals( 1, get( normalized, 2, 2 ), 0 );
		assertEquals( 1, get( normalized, 3, 3 ), 0 );
	}

	@Test
	public void testObjectAnnotationsLabels()
	{
		final ObjectAnnotationsNormalization norm = new ObjectAnnotationsNormalization( "stem" );
		norm.setAnnotations( new ObjectPredictions( "id", "ts", Arrays.asList(
				object( "leaf", 1, 1, 3, 3 ),
				object( "stem", 0, 0, 1, 4 ) ) ) );

		// column 0: 0, 4, 8, 12
		final Img< FloatType > normalized = norm.normalize( ramp(), Channel.RED );

		assertEquals( 0, get( normalized, 0, 0 ), 0 );
		assertEquals( 4 / 12.0, get( normalized, 0, 1 ), 1e-6 );
		assertEquals( 1, get( normalized, 0, 3 ), 0 );
		assertEquals( 0.5, get( normalized, 2, 1 ), 1e-6 );
	}

	@Test( expected = ConfigurationException.class )
	public void testObjectAnnotationsOnlyReferences()
	{
		final ObjectAnnotationsNormalization norm = new ObjectAnnotationsNormalization();
		norm.setAnnotations( new ObjectPredictions( "id", "ts", Arrays.asList(
				object( ContoursManager.LABEL_WHITEREF, 0, 0, 2, 2 ),
				object( ContoursManager.LABEL_BLACKREF, 2, 2, 4, 4 ) ) ) );

		norm.normalize( ramp(), Channel.RED );
	}

	@Test( expected = ConfigurationException.class )
	public void testObjectAnnotationsMissing()
	{
		new ObjectAnnotationsNormalization().normalize( ramp(), Channel.RED );
	}

	@Test
	public void testNone()
	{
		assertEquals( 15, get( new NoneNormalization().normalize( ramp(), Channel.BLUE ), 3, 3 ), 0 );
	}
}
