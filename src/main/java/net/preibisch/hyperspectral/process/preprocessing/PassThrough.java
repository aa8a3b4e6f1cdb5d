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

import net.preibisch.hyperspectral.data.SpectralCube;

public class PassThrough extends Preprocessor
{
	@Override
	public String getName() { return "pass-through"; }

	@Override
	public String getDescription() { return "Dummy, just passes through the data"; }

	@Override
	public List< SpectralCube > apply( final SpectralCube data )
	{
		return Collections.singletonList( data );
	}
}
