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
package net.preibisch.hyperspectral.process.calibration;

/**
 * The stages of a calibration run that are reported in a {@link CalibrationOutcome}.
 */
public enum CalibrationStage
{
	BLACKDATA_INITIALIZED( "blackdata_initialized" ),
	WHITEDATA_INITIALIZED( "whitedata_initialized" ),
	BLACKREF_APPLIED( "blackref_applied" ),
	WHITEREF_APPLIED( "whiteref_applied" ),
	PREPROCESSORS_APPLIED( "preprocessors_applied" ),
	DIMENSIONS_DIFFER( "dimensions_differ" );

	private final String key;

	private CalibrationStage( final String key )
	{
		this.key = key;
	}

	public String getKey() { return key; }

	@Override
	public String toString() { return key; }
}
