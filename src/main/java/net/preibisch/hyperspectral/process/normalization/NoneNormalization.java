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

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.hyperspectral.data.Cubes;

/**
 * Dummy normalization, returns a copy of the band.
 */
public class NoneNormalization extends Normalization
{
	@Override
	public String getName() { return "norm-none"; }

	@Override
	public String getDescription()
	{
		return "Dummy, performs no normalization.";
	}

	@Override
	protected Img< FloatType > doNormalize( final RandomAccessibleInterval< FloatType > band, final Channel channel )
	{
		return Cubes.copy( band );
	}
}
