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

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.hyperspectral.data.Cubes;
import net.preibisch.hyperspectral.process.ShapeMismatchException;

/**
 * Applies per-band reference averages to a scan.
 */
class BandAverages
{
	/**
	 * @param type - subtract (black) or divide (white)
	 * @param scan - the scan, not modified
	 * @param averages - one average per band
	 * @param skipUnitAverage - whether bands with an average of exactly 1.0 are passed through unchanged
	 * @return the corrected copy of the scan
	 */
	static Img< FloatType > apply(
			final ReferenceType type,
			final RandomAccessibleInterval< FloatType > scan,
			final ReferenceAverages averages,
			final boolean skipUnitAverage )
	{
		final int numBands = (int)scan.dimension( Cubes.BAND );

		if ( averages.numBands() != numBands )
			throw new ShapeMismatchException(
					"Reference and scan have differing number of bands: " + averages.numBands() + " != " + numBands );

		final Img< FloatType > result = Cubes.copy( scan );

		for ( int b = 0; b < numBands; ++b )
		{
			final double avg = averages.get( b );

			// literal 1.0, not a near-zero guard
			if ( skipUnitAverage && avg == 1.0 )
				continue;

			final float value = (float)avg;
			LoopBuilder.setImages( Cubes.band( result, b ) ).forEachPixel( t -> t.set( type.combine( t.get(), value ) ) );
		}

		return result;
	}
}
