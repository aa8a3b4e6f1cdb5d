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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.hyperspectral.data.Cubes;

/**
 * Computes one average per band over the whole reference and subtracts/divides by it.
 * Does not require scan and reference to have the same size, only the same number of bands. A white band whose average is exactly 1.0 is left unchanged.
 */
public class AverageReference extends ReferenceMethod< ReferenceAverages >
{
	private static final Logger LOG = LoggerFactory.getLogger( AverageReference.class );

	public AverageReference( final ReferenceType type )
	{
		super( type, Capability.PLAIN );
	}

	@Override
	protected String getSuffix() { return "avg"; }

	@Override
	public String getDescription()
	{
		return "Reference method that computes the average per band. Does not require scan and reference to have the same size.";
	}

	@Override
	protected ReferenceAverages computeStatistics()
	{
		final ReferenceAverages averages = ReferenceAverages.perBand( Cubes.bandAverages( reference, null ) );
		LOG.info( "{} reference averages: {}", type.getLabel(), averages );
		return averages;
	}

	@Override
	protected Img< FloatType > doApply( final RandomAccessibleInterval< FloatType > scan, final ReferenceAverages averages )
	{
		return BandAverages.apply( type, scan, averages, type == ReferenceType.WHITE );
	}
}
