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
 * Subtracts (black) or divides by (white) the reference element-wise. Scan and reference must have the same shape.
 */
public class SameSizeReference extends ReferenceMethod< RandomAccessibleInterval< FloatType > >
{
	public SameSizeReference( final ReferenceType type )
	{
		super( type, Capability.PLAIN );
	}

	@Override
	protected String getSuffix() { return "same-size"; }

	@Override
	public String getDescription()
	{
		return ( type == ReferenceType.BLACK ? "Simply subtracts the black reference from the scan." : "Simply divides the scan by the white reference." )
				+ " Requires scan and reference to have the same size.";
	}

	@Override
	protected RandomAccessibleInterval< FloatType > computeStatistics()
	{
		return reference;
	}

	@Override
	protected Img< FloatType > doApply( final RandomAccessibleInterval< FloatType > scan, final RandomAccessibleInterval< FloatType > ref )
	{
		if ( !Cubes.sameShape( scan, ref ) )
			throw new ShapeMismatchException(
					"The " + type.getLabel() + " reference dimensions differ from scan: " + Cubes.printShape( ref ) + " != " + Cubes.printShape( scan ) );

		final Img< FloatType > result = Cubes.create( scan );
		LoopBuilder.setImages( scan, ref, result ).forEachPixel( ( s, r, o ) -> o.set( type.combine( s.get(), r.get() ) ) );
		return result;
	}
}
