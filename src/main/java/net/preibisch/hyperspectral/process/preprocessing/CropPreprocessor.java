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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.hyperspectral.data.Cubes;
import net.preibisch.hyperspectral.data.SpectralCube;

/**
 * Crops the cube to a rectangle. Parts of the rectangle outside the cube are either dropped or,
 * if padding is enabled, filled with the pad value.
 */
public class CropPreprocessor extends Preprocessor
{
	private static final Logger LOG = LoggerFactory.getLogger( CropPreprocessor.class );

	final int x, y, width, height;
	final boolean pad;
	final float padValue;

	public CropPreprocessor( final int x, final int y, final int width, final int height )
	{
		this( x, y, width, height, false, 0 );
	}

	public CropPreprocessor( final int x, final int y, final int width, final int height, final boolean pad, final float padValue )
	{
		if ( x < 0 || y < 0 || width <= 0 || height <= 0 )
			throw new IllegalArgumentException( "Invalid crop rectangle: x=" + x + ", y=" + y + ", width=" + width + ", height=" + height );

		this.x = x;
		this.y = y;
		this.width = width;
		this.height = height;
		this.pad = pad;
		this.padValue = padValue;
	}

	@Override
	public String getName() { return "crop"; }

	@Override
	public String getDescription() { return "Crops the data to the specified rectangle."; }

	@Override
	public List< SpectralCube > apply( final SpectralCube data )
	{
		final RandomAccessibleInterval< FloatType > in = data.getData();

		// the part of the rectangle that is inside the cube
		final long w = Math.max( 0, Math.min( x + width, in.dimension( Cubes.X ) ) - x );
		final long h = Math.max( 0, Math.min( y + height, in.dimension( Cubes.Y ) ) - y );

		final long outW = pad ? Math.max( w, width ) : w;
		final long outH = pad ? Math.max( h, height ) : h;

		if ( outW == 0 || outH == 0 )
			throw new IllegalArgumentException( "Crop rectangle x=" + x + ", y=" + y + " is outside of the data " + Cubes.printShape( in ) );

		final Img< FloatType > out = Cubes.create( outW, outH, in.dimension( Cubes.BAND ) );
		final Cursor< FloatType > c = out.localizingCursor();
		final RandomAccess< FloatType > ra = in.randomAccess();
		final long[] pos = new long[ 3 ];

		while ( c.hasNext() )
		{
			final FloatType t = c.next();
			c.localize( pos );

			if ( pos[ Cubes.X ] < w && pos[ Cubes.Y ] < h )
			{
				ra.setPosition( in.min( Cubes.X ) + x + pos[ Cubes.X ], Cubes.X );
				ra.setPosition( in.min( Cubes.Y ) + y + pos[ Cubes.Y ], Cubes.Y );
				ra.setPosition( in.min( Cubes.BAND ) + pos[ Cubes.BAND ], Cubes.BAND );
				t.set( ra.get() );
			}
			else
			{
				t.set( padValue );
			}
		}

		LOG.info( "cropped {} to {}", Cubes.printShape( in ), Cubes.printShape( out ) );

		return Collections.singletonList( data.copy( out ) );
	}
}
