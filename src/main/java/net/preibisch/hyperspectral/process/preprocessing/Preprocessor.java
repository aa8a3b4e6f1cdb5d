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

import java.util.List;

import net.preibisch.hyperspectral.data.SpectralCube;

/**
 * A transform applied to the calibrated cube. Preprocessors may learn parameters in {@link #fit(SpectralCube)}
 * and may produce more than one output per input.
 */
public abstract class Preprocessor
{
	public abstract String getName();

	public abstract String getDescription();

	/**
	 * Learns parameters from the data, does nothing by default.
	 *
	 * @param data - the data to learn from
	 */
	public void fit( final SpectralCube data ) {}

	/**
	 * @param data - the input, not modified
	 * @return the transformed data
	 */
	public abstract List< SpectralCube > apply( final SpectralCube data );

	@Override
	public String toString()
	{
		return getName();
	}
}
