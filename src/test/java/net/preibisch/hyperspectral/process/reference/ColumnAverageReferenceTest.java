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

import static org.junit.Assert.assertEquals;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.hyperspectral.data.Cubes;
import net.preibisch.hyperspectral.process.ShapeMismatchException;

public class ColumnAverageReferenceTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	// band 0: x + 1, band 1: 10 * (x + 1), rows alternate +/- 0.5 so averages are exact
	static Img< FloatType > reference( final int w, final int h )
	{
		final Img< FloatType > ref = Cubes.create( w, h, 2 );
		final Cursor< FloatType > c = ref.localizingCursor();

		while ( c.hasNext() )
		{
			c.fwd();
			final int x = c.getIntPosition( 0 );
			final float offset = c.getIntPosition( 1 ) % 2 == 0 ? 0.5f : -0.5f;
			c.get().set( ( c.getIntPosition( 2 ) == 0 ? x + 1 : 10 * ( x + 1 ) ) + offset );
		}

		return ref;
	}

	@Test
	public void testBlack()
	{
		final ColumnAverageReference black = new ColumnAverageReference( ReferenceType.BLACK );
		black.setReference( reference( 3, 2 ) );

		final RandomAccess< FloatType > ra = black.apply( Cubes.filled( 3, 4, 2, 100 ) ).randomAccess();

		for ( int x = 0; x < 3; ++x )
			for ( int y = 0; y < 4; ++y )
			{
				ra.setPosition( new long[]{ x, y, 0 } );
				assertEquals( 100 - ( x + 1 ), ra.get().get(), 0 );
				ra.setPosition( new long[]{ x, y, 1 } );
				assertEquals( 100 - 10 * ( x + 1 ), ra.get().get(), 0 );
			}
	}

	@Test
	public void testWhite()
	{
		final ColumnAverageReference white = new ColumnAverageReference( ReferenceType.WHITE );
		white.setReference( reference( 2, 2 ) );

		final RandomAccess< FloatType > ra = white.apply( Cubes.filled( 2, 1, 2, 40 ) ).randomAccess();

		ra.setPosition( new long[]{ 1, 0, 0 } );
		assertEquals( 20, ra.get().get(), 0 );
		ra.setPosition( new long[]{ 1, 0, 1 } );
		assertEquals( 2, ra.get().get(), 0 );
	}

	@Test( expected = ShapeMismatchException.class )
	public void testColumnMismatch()
	{
		final ColumnAverageReference black = new ColumnAverageReference( ReferenceType.BLACK );
		black.setReference( reference( 3, 2 ) );
		black.apply( Cubes.filled( 4, 3, 2, 100 ) );
	}

	@Test
	public void testAverageFile() throws IOException
	{
		final File csv = new File( folder.getRoot(), "averages.csv" );

		final ColumnAverageReference black = new ColumnAverageReference( ReferenceType.BLACK, csv.getAbsolutePath() );
		black.setReference( reference( 3, 2 ) );
		black.apply( Cubes.filled( 3, 1, 2, 100 ) );

		final List< String > lines = Files.readAllLines( csv.toPath(), StandardCharsets.UTF_8 );

		assertEquals( 4, lines.size() );
		assertEquals( "col,band-0,band-1", lines.get( 0 ) );
		assertEquals( "2,3.0,30.0", lines.get( 3 ) );
	}
}
