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
package net.preibisch.hyperspectral.process.export;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;
import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

/**
 * Turns three normalized bands into an 8-bit RGB image (x, y, channel) and writes it through ImageJ.
 */
public class DisplayImage
{
	private static final Logger LOG = LoggerFactory.getLogger( DisplayImage.class );

	public static String defaultFormat = "png";

	/**
	 * Stacks the bands as red, green and blue channel. Values are scaled by 255, floored and clamped to [0, 255].
	 *
	 * @param bands - three 2d bands of identical size, nominally in [0, 1]
	 * @return the display image (x, y, channel)
	 */
	public static Img< UnsignedByteType > toDisplayImage( final List< ? extends RandomAccessibleInterval< FloatType > > bands )
	{
		if ( bands.size() != 3 )
			throw new IllegalArgumentException( "Expected three bands (red, green, blue), got " + bands.size() );

		final RandomAccessibleInterval< FloatType > first = bands.get( 0 );
		final Img< UnsignedByteType > rgb = ArrayImgs.unsignedBytes( first.dimension( 0 ), first.dimension( 1 ), 3 );

		for ( int c = 0; c < 3; ++c )
		{
			final RandomAccessibleInterval< FloatType > band = Views.zeroMin( bands.get( c ) );

			if ( band.dimension( 0 ) != first.dimension( 0 ) || band.dimension( 1 ) != first.dimension( 1 ) )
				throw new IllegalArgumentException( "Bands differ in size" );

			final Cursor< FloatType > in = Views.flatIterable( band ).cursor();
			final Cursor< UnsignedByteType > out = Views.flatIterable( Views.hyperSlice( rgb, 2, c ) ).cursor();

			while ( out.hasNext() )
				out.next().set( toByte( in.next().get() ) );
		}

		return rgb;
	}

	static int toByte( final float v )
	{
		// NaN ends up as 0
		if ( !( v > 0 ) )
			return 0;

		return (int)Math.min( 255, Math.floor( v * 255.0 ) );
	}

	/**
	 * @param rgb - display image (x, y, channel)
	 * @return a color processor of the same size
	 */
	public static ColorProcessor toColorProcessor( final RandomAccessibleInterval< UnsignedByteType > rgb )
	{
		final int w = (int)rgb.dimension( 0 );
		final int h = (int)rgb.dimension( 1 );
		final ColorProcessor cp = new ColorProcessor( w, h );
		final RandomAccess< UnsignedByteType > ra = Views.zeroMin( rgb ).randomAccess();
		final int[] color = new int[ 3 ];

		for ( int y = 0; y < h; ++y )
			for ( int x = 0; x < w; ++x )
			{
				ra.setPosition( x, 0 );
				ra.setPosition( y, 1 );

				for ( int c = 0; c < 3; ++c )
				{
					ra.setPosition( c, 2 );
					color[ c ] = ra.get().get();
				}

				cp.putPixel( x, y, color );
			}

		return cp;
	}

	/**
	 * Writes the display image, the format is determined by the extension (png, jpg/jpeg, tif/tiff; others are written as {@link #defaultFormat}).
	 *
	 * @param rgb - display image (x, y, channel)
	 * @param path - the output file
	 * @param width - the output width, ignored if &lt;= 0
	 * @param height - the output height, ignored if &lt;= 0
	 * @throws IOException if writing fails
	 */
	public static void save( final RandomAccessibleInterval< UnsignedByteType > rgb, final String path, final int width, final int height ) throws IOException
	{
		ImageProcessor ip = toColorProcessor( rgb );

		final int w = width > 0 ? width : ip.getWidth();
		final int h = height > 0 ? height : ip.getHeight();

		if ( w != ip.getWidth() || h != ip.getHeight() )
		{
			ip.setInterpolationMethod( ImageProcessor.BILINEAR );
			ip = ip.resize( w, h );
		}

		final ImagePlus imp = new ImagePlus( new File( path ).getName(), ip );
		final FileSaver saver = new FileSaver( imp );
		final String format = format( path );

		LOG.info( "Writing {}x{} {} image to: {}", w, h, format, path );

		final boolean success;

		if ( format.equals( "jpg" ) )
			success = saver.saveAsJpeg( path );
		else if ( format.equals( "tif" ) )
			success = saver.saveAsTiff( path );
		else
			success = saver.saveAsPng( path );

		if ( !success )
			throw new IOException( "Failed to write image: " + path );
	}

	static String format( final String path )
	{
		final String name = new File( path ).getName().toLowerCase();
		final int dot = name.lastIndexOf( '.' );
		final String ext = dot < 0 ? "" : name.substring( dot + 1 );

		if ( ext.equals( "jpg" ) || ext.equals( "jpeg" ) )
			return "jpg";
		else if ( ext.equals( "tif" ) || ext.equals( "tiff" ) )
			return "tif";
		else if ( ext.equals( "png" ) )
			return "png";
		else
			return defaultFormat;
	}
}
