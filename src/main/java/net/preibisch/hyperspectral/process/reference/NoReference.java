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
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.hyperspectral.data.Cubes;

/**
 * Applies no reference, the scan is passed through.
 */
public class NoReference extends ReferenceMethod< Boolean >
{
	public NoReference( final ReferenceType type )
	{
		super( type, Capability.PLAIN );
		state = ReferenceState.initialized( Boolean.TRUE );
	}

	@Override
	protected String getSuffix() { return "none"; }

	@Override
	public String getDescription()
	{
		return "To be used when not applying a " + type.getLabel() + " reference.";
	}

	// no reference required
	@Override
	protected Boolean initialize()
	{
		return computeStatistics();
	}

	@Override
	protected Boolean computeStatistics()
	{
		return Boolean.TRUE;
	}

	@Override
	protected Img< FloatType > doApply( final RandomAccessibleInterval< FloatType > scan, final Boolean statistics )
	{
		return Cubes.copy( scan );
	}
}
