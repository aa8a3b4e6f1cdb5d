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

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import net.preibisch.hyperspectral.data.Cubes;
import net.preibisch.hyperspectral.data.SpectralCube;

/**
 * Standard normal variate: centers and scales every spectrum by its own mean and standard deviation.
 * Spectra with zero standard deviation become all-zero.
 */
public class SNVPreprocessor extends Preprocessor
{
	@Override
	public String getName() { return "snv"; }

	@Override
	public String getDescription() { return "Standard normal variate"; }

	@Override
	public List< SpectralCube > apply( final SpectralCube data )
	{
		final Img< FloatType > out = Cubes.copy( data.getData() );
		final RandomAccessibleInterval< FloatType > firstBand = Cubes.band( out, 0 );
		final Cursor< FloatType > c = Views.flatIterable( firstBand ).localizingCursor();

		while ( c.hasNext() )
		{
			c.fwd();

			final RandomAccessibleInterval< FloatType > spectrum =
					Views.hyperSlice( Views.hyperSlice( out, Cubes.Y, c.getLongPosition( Cubes.Y ) ), Cubes.X, c.getLongPosition( Cubes.X ) );

			final double[] meanStd = StandardScalerPreprocessor.meanStd( Views.flatIterable( spectrum ) );

			for ( final FloatType t : Views.flatIterable( spectrum ) )
				t.setReal( meanStd[ 1 ] == 0 ? 0 : ( t.getRealDouble() - meanStd[ 0 ] ) / meanStd[ 1 ] );
		}

		return Collections.singletonList( data.copy( out ) );
	}
}
