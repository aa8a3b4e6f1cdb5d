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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.hyperspectral.data.SpectralCube;

/**
 * One stage of a calibration run. A step receives the current working cube (null until the scan was
 * seeded) and returns the next one; it records its own outcome.
 */
public abstract class CalibrationStep
{
	private static final Logger LOG = LoggerFactory.getLogger( CalibrationStep.class );

	final String name;

	public CalibrationStep( final String name )
	{
		this.name = name;
	}

	public String getName() { return name; }

	public abstract SpectralCube run( final SpectralCube current, final CalibrationOutcome outcome ) throws Exception;

	/**
	 * Runs the steps in order. The first step that throws ends the run, its exception is logged.
	 *
	 * @param steps - the steps
	 * @param outcome - collects the outcome of the steps
	 * @return the cube produced by the last successful step
	 */
	public static Result runAll( final List< ? extends CalibrationStep > steps, final CalibrationOutcome outcome )
	{
		SpectralCube current = null;

		for ( final CalibrationStep step : steps )
		{
			try
			{
				current = step.run( current, outcome );
			}
			catch ( final Exception e )
			{
				LOG.error( "Calculation: step '" + step.getName() + "' failed with exception: " + e.getMessage(), e );
				return new Result( current, false );
			}
		}

		return new Result( current, true );
	}

	public static class Result
	{
		final SpectralCube cube;
		final boolean success;

		Result( final SpectralCube cube, final boolean success )
		{
			this.cube = cube;
			this.success = success;
		}

		/**
		 * @return the last working cube, null if the run failed before the scan was seeded
		 */
		public SpectralCube getCube() { return cube; }

		public boolean isSuccess() { return success; }
	}
}
