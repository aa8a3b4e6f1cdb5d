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
 * Computes the average per band inside the annotation rectangle of the reference, which is either
 * the scan itself or a separately loaded reference cube. Does not require scan and reference to have
 * the same size. Bands whose annotation average is exactly 1.0 are left unchanged, for black and white alike.
 */
public class AnnotationAverageReference extends AnnotationBasedReferenceMethod< ReferenceAverages >
{
	private static final Logger LOG = LoggerFactory.getLogger( AnnotationAverageReference.class );

	public AnnotationAverageReference( final ReferenceType type )
	{
		super( type );
	}

	@Override
	protected String getSuffix() { return "annotation-avg"; }

	@Override
	public String getDescription()
	{
		return "Reference method that computes the average per band in the annotation rectangle. Does not require scan and reference to have the same size.";
	}

	@Override
	protected ReferenceAverages computeStatistics()
	{
		annotation.check( reference );
		LOG.info( "using annotation: {}", annotation );

		final ReferenceAverages averages = ReferenceAverages.perBand( Cubes.bandAverages( reference, annotation.spatialInterval( reference ) ) );
		LOG.info( "{} reference annotation averages: {}", type.getLabel(), averages );
		return averages;
	}

	@Override
	protected Img< FloatType > doApply( final RandomAccessibleInterval< FloatType > scan, final ReferenceAverages averages )
	{
		return BandAverages.apply( type, scan, averages, true );
	}
}
