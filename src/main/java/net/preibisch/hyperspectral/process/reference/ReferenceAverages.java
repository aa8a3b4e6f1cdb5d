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
import java.io.PrintWriter;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;

/**
 * Holds reference averages, one flattened array per band over a field of columns.
 * A per-band average is stored as a field with a single column.
 */
public class ReferenceAverages implements Serializable
{
	private static final long serialVersionUID = 4651837318236781553L;

	/**
	 * {@code averages[b][x]} holds the average of band {@code b} in column {@code x}.
	 */
	final double[][] averages;

	final int numColumns;

	public ReferenceAverages( final double[][] averages )
	{
		if ( averages == null )
			throw new NullPointerException();

		if ( averages.length == 0 )
			throw new IllegalArgumentException( "no bands" );

		numColumns = averages[ 0 ].length;

		for ( final double[] band : averages )
			if ( band.length != numColumns )
				throw new IllegalArgumentException( "number of columns differs between bands" );

		this.averages = new double[ averages.length ][];
		Arrays.setAll( this.averages, b -> averages[ b ].clone() );
	}

	public static ReferenceAverages perBand( final double[] perBand )
	{
		final double[][] averages = new double[ perBand.length ][ 1 ];

		for ( int b = 0; b < perBand.length; ++b )
			averages[ b ][ 0 ] = perBand[ b ];

		return new ReferenceAverages( averages );
	}

	public int numBands() { return averages.length; }
	public int numColumns() { return numColumns; }

	public double get( final int band, final int column )
	{
		return averages[ band ][ column ];
	}

	/**
	 * @return the average of the band, only meaningful for per-band averages
	 */
	public double get( final int band )
	{
		return averages[ band ][ 0 ];
	}

	public double[] perBand()
	{
		final double[] result = new double[ numBands() ];
		Arrays.setAll( result, b -> averages[ b ][ 0 ] );
		return result;
	}

	/**
	 * Writes one row per column: {@code col,band-0,band-1,...}
	 */
	public void writeCSV( final String path ) throws IOException
	{
		try ( final PrintWriter out = new PrintWriter( Files.newBufferedWriter( Paths.get( path ), StandardCharsets.UTF_8 ) ) )
		{
			final StringBuilder header = new StringBuilder( "col" );
			for ( int b = 0; b < numBands(); ++b )
				header.append( ",band-" ).append( b );
			out.println( header );

			for ( int x = 0; x < numColumns; ++x )
			{
				final StringBuilder row = new StringBuilder( Integer.toString( x ) );
				for ( int b = 0; b < numBands(); ++b )
					row.append( ',' ).append( averages[ b ][ x ] );
				out.println( row );
			}
		}
	}

	@Override
	public String toString()
	{
		if ( numColumns == 1 )
			return Arrays.toString( perBand() );

		return "ReferenceAverages(#bands=" + numBands() + ", #columns=" + numColumns + ")";
	}
}
