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
package net.preibisch.hyperspectral.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.janelia.saalfeldlab.n5.DataBlock;
import org.janelia.saalfeldlab.n5.DataType;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.FloatArrayDataBlock;
import org.janelia.saalfeldlab.n5.N5Exception;
import org.janelia.saalfeldlab.n5.N5FSReader;
import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.n5.N5Reader;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.janelia.saalfeldlab.n5.RawCompression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import net.preibisch.hyperspectral.data.Cubes;
import net.preibisch.hyperspectral.data.SpectralCube;

/**
 * Stores spectral cubes in an N5 container: a FLOAT32 dataset of dimensions
 * {@code (width, height, bands)} with one block per band, and the wavelengths as attribute.
 */
public class N5SpectralCubeIO implements SpectralCubeLoader
{
	private static final Logger LOG = LoggerFactory.getLogger( N5SpectralCubeIO.class );

	public static String defaultDataset = "data";
	public static final String WAVELENGTHS_ATTRIBUTE = "wavelengths";
	public static final String VERSION_ATTRIBUTE = "cube version";

	final String dataset;

	public N5SpectralCubeIO() { this( defaultDataset ); }
	public N5SpectralCubeIO( final String dataset ) { this.dataset = dataset; }

	@Override
	public SpectralCube load( final String path ) throws IOException
	{
		if ( !Files.isDirectory( Paths.get( path ) ) )
			throw new NoSuchFileException( path );

		try
		{
			return load( new N5FSReader( path ), dataset );
		}
		catch ( final N5Exception e )
		{
			throw new IOException( "Failed to read cube '" + dataset + "' from " + path + ": " + e.getMessage(), e );
		}
	}

	public void save( final SpectralCube cube, final String path ) throws IOException
	{
		try
		{
			save( cube, new N5FSWriter( path ), dataset );
		}
		catch ( final N5Exception e )
		{
			throw new IOException( "Failed to write cube '" + dataset + "' to " + path + ": " + e.getMessage(), e );
		}
	}

	public static void save( final SpectralCube cube, final N5Writer n5Writer, final String datasetPath )
	{
		if ( n5Writer.exists( datasetPath ) )
			n5Writer.remove( datasetPath );

		final int width = cube.width();
		final int height = cube.height();
		final int numBands = cube.numBands();

		final long[] dimensions = new long[]{ width, height, numBands };
		final int[] blockSize = new int[]{ width, height, 1 };
		final DatasetAttributes attr = new DatasetAttributes( dimensions, blockSize, DataType.FLOAT32, new RawCompression() );
		n5Writer.createDataset( datasetPath, attr );
		n5Writer.setAttribute( datasetPath, VERSION_ATTRIBUTE, "1.0" );

		if ( cube.hasWavelengths() )
		{
			final double[] wl = new double[ cube.getWavelengths().size() ];
			for ( int i = 0; i < wl.length; ++i )
				wl[ i ] = cube.getWavelengths().get( i );

			n5Writer.setAttribute( datasetPath, WAVELENGTHS_ATTRIBUTE, wl );
		}

		final long[] gridPosition = new long[ 3 ];

		for ( int b = 0; b < numBands; ++b )
		{
			final float[] data = new float[ width * height ];
			final Cursor< FloatType > c = Views.flatIterable( cube.band( b ) ).cursor();

			for ( int i = 0; i < data.length; ++i )
				data[ i ] = c.next().get();

			gridPosition[ 2 ] = b;
			n5Writer.writeBlock( datasetPath, attr, new FloatArrayDataBlock( blockSize, gridPosition, data ) );
		}

		LOG.debug( "saved cube {} to '{}'", Cubes.printShape( cube.getData() ), datasetPath );
	}

	public static SpectralCube load( final N5Reader n5Reader, final String datasetPath ) throws IOException
	{
		if ( !n5Reader.datasetExists( datasetPath ) )
			throw new IOException( "Dataset '" + datasetPath + "' does not exist" );

		final DatasetAttributes attr = n5Reader.getDatasetAttributes( datasetPath );

		if ( attr.getNumDimensions() != 3 || attr.getDataType() != DataType.FLOAT32 )
			throw new IOException( "Dataset '" + datasetPath + "' is not a FLOAT32 cube: " + attr.getNumDimensions() + "d " + attr.getDataType() );

		final long[] dimensions = attr.getDimensions();
		final int[] blockSize = attr.getBlockSize();

		if ( blockSize[ 0 ] != dimensions[ 0 ] || blockSize[ 1 ] != dimensions[ 1 ] || blockSize[ 2 ] != 1 )
			throw new IOException( "Dataset '" + datasetPath + "' is not stored as one block per band" );

		final int sliceSize = (int)( dimensions[ 0 ] * dimensions[ 1 ] );
		final ArrayImg< FloatType, FloatArray > img = ArrayImgs.floats( dimensions );
		final float[] storage = img.update( null ).getCurrentStorageArray();

		final long[] gridPosition = new long[ 3 ];

		for ( int b = 0; b < dimensions[ 2 ]; ++b )
		{
			gridPosition[ 2 ] = b;
			final DataBlock< ? > block = n5Reader.readBlock( datasetPath, attr, gridPosition );

			if ( block == null )
				continue; // never written, stays zero

			System.arraycopy( (float[])block.getData(), 0, storage, b * sliceSize, sliceSize );
		}

		final double[] wl = n5Reader.getAttribute( datasetPath, WAVELENGTHS_ATTRIBUTE, double[].class );
		final List< Double > wavelengths = new ArrayList<>();

		if ( wl != null )
			for ( final double w : wl )
				wavelengths.add( w );

		return new SpectralCube( img, wavelengths );
	}
}
