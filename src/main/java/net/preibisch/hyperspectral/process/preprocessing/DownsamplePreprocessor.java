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

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import net.preibisch.hyperspectral.data.Cubes;
import net.preibisch.hyperspectral.data.SpectralCube;

/**
 * Keeps every n-th pixel on the x and the y axis, starting with the first one.
 */
public class DownsamplePreprocessor extends Preprocessor
{
	public static int defaultStep = 2;

	final int xth, yth;

	public DownsamplePreprocessor()
	{
		this( defaultStep, defaultStep );
	}

	public DownsamplePreprocessor( final int xth, final int yth )
	{
		if ( xth < 1 || yth < 1 )
			throw new IllegalArgumentException( "Steps must be at least 1: xth=" + xth + ", yth=" + yth );

		this.xth = xth;
		this.yth = yth;
	}

	@Override
	public String getName() { return "down-sample"; }

	@Override
	public String getDescription()
	{
		return "Data reduction preprocessor that takes every x-th pixel on the x-axis and y-th pixel on the y-axis.";
	}

	@Override
	public List< SpectralCube > apply( final SpectralCube data )
	{
		final RandomAccessibleInterval< FloatType > sub =
				Views.subsample( Views.zeroMin( data.getData() ), xth, yth, 1 );

		return Collections.singletonList( data.copy( Cubes.copy( sub ) ) );
	}
}
