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

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import net.preibisch.hyperspectral.data.Cubes;
import net.preibisch.hyperspectral.process.CalibrationException;
import net.preibisch.hyperspectral.process.ShapeMismatchException;

/**
 * Computes the average per band and column of the reference (averaging over the rows) and
 * subtracts/divides column-wise. Scan and reference must have the same number of columns.
 */
public class ColumnAverageReference extends ReferenceMethod< ReferenceAverages >
{
	private static final Logger LOG = LoggerFactory.getLogger( ColumnAverageReference.class );

	String averageFile;

	public ColumnAverageReference( final ReferenceType type )
	{
		this( type, null );
	}

	/**
	 * @param type - black or white
	 * @param averageFile - CSV file to store the computed averages in, null to skip
	 */
	public ColumnAverageReference( final ReferenceType type, final String averageFile )
	{
		super( type, Capability.PLAIN );
		this.averageFile = averageFile;
	}

	@Override
	protected String getSuffix() { return "col-avg"; }

	@Override
	public String getDescription()
	{
		return "Reference method that computes the average per band, per column. Requires the scan and reference to have the same number of columns.";
	}

	public String getAverageFile() { return averageFile; }

	public void setAverageFile( final String averageFile )
	{
		this.averageFile = averageFile;
		reset();
	}

	@Override
	protected ReferenceAverages computeStatistics()
	{
		final int numBands = (int)reference.dimension( Cubes.BAND );
		final int numColumns = (int)reference.dimension( Cubes.X );
		final double[][] averages = new double[ numBands ][ numColumns ];

		for ( int b = 0; b < numBands; ++b )
		{
			final RandomAccessibleInterval< FloatType > band = Cubes.band( reference, b );

			for ( int x = 0; x < numColumns; ++x )
				averages[ b ][ x ] = Cubes.average( Views.hyperSlice( band, Cubes.X, band.min( Cubes.X ) + x ) );
		}

		final ReferenceAverages result = new ReferenceAverages( averages );

		if ( averageFile != null )
		{
			LOG.info( "Writing averages to: {}", averageFile );

			try
			{
				result.writeCSV( averageFile );
			}
			catch ( final IOException e )
			{
				throw new CalibrationException( "Failed to write averages to: " + averageFile, e );
			}
		}

		return result;
	}

	@Override
	protected Img< FloatType > doApply( final RandomAccessibleInterval< FloatType > scan, final ReferenceAverages averages )
	{
		if ( scan.dimension( Cubes.X ) != averages.numColumns() )
			throw new ShapeMismatchException(
					"The number of columns in the scan differ from the " + type.getLabel() + " reference ones: " + scan.dimension( Cubes.X ) + " != " + averages.numColumns() );

		if ( scan.dimension( Cubes.BAND ) != averages.numBands() )
			throw new ShapeMismatchException(
					"Reference and scan have differing number of bands: " + averages.numBands() + " != " + scan.dimension( Cubes.BAND ) );

		final Img< FloatType > result = Cubes.copy( scan );
		final Cursor< FloatType > c = result.localizingCursor();

		while ( c.hasNext() )
		{
			final FloatType t = c.next();
			final float avg = (float)averages.get( c.getIntPosition( Cubes.BAND ), c.getIntPosition( Cubes.X ) );
			t.set( type.combine( t.get(), avg ) );
		}

		return result;
	}
}
