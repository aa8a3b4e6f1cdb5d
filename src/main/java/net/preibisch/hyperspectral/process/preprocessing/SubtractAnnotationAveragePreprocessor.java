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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.FinalInterval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import net.preibisch.hyperspectral.data.Cubes;
import net.preibisch.hyperspectral.data.SpectralCube;
import net.preibisch.hyperspectral.data.annotations.BBox;
import net.preibisch.hyperspectral.data.annotations.ObjectPrediction;
import net.preibisch.hyperspectral.data.annotations.ObjectPredictions;
import net.preibisch.hyperspectral.process.ConfigurationException;

/**
 * Computes the average spectrum inside the bounding box of the annotation with the given label
 * (right/bottom inclusive) and subtracts it from every pixel.
 */
public class SubtractAnnotationAveragePreprocessor extends Preprocessor implements AnnotationAware
{
	private static final Logger LOG = LoggerFactory.getLogger( SubtractAnnotationAveragePreprocessor.class );

	final String label;
	ObjectPredictions annotations;

	public SubtractAnnotationAveragePreprocessor( final String label )
	{
		this.label = label;
	}

	public String getLabel() { return label; }

	@Override
	public void setAnnotations( final ObjectPredictions annotations ) { this.annotations = annotations; }

	@Override
	public ObjectPredictions getAnnotations() { return annotations; }

	@Override
	public String getName() { return "subtract-annotation-avg"; }

	@Override
	public String getDescription()
	{
		return "Calculates the average from the specified annotation (uses outer bbox) and subtracts it from the data passing through.";
	}

	@Override
	public List< SpectralCube > apply( final SpectralCube data )
	{
		if ( annotations == null )
		{
			LOG.error( "No annotations, cannot subtract annotation average!" );
			return Collections.singletonList( data );
		}

		if ( label == null )
			throw new ConfigurationException( "No label defined!" );

		final ObjectPrediction obj = annotations.firstWithLabel( label );

		if ( obj == null || obj.getBBox() == null )
		{
			LOG.warn( "Failed to locate label '{}' in annotations!", label );
			return Collections.singletonList( data );
		}

		final RandomAccessibleInterval< FloatType > in = data.getData();
		final BBox bbox = obj.getBBox();
		final FinalInterval box = new FinalInterval(
				new long[]{ in.min( Cubes.X ) + bbox.getLeft(), in.min( Cubes.Y ) + bbox.getTop() },
				new long[]{ in.min( Cubes.X ) + bbox.getRight(), in.min( Cubes.Y ) + bbox.getBottom() } );

		if ( !Intervals.contains( Cubes.spatialInterval( in ), box ) )
			throw new ConfigurationException( "Bounding box of annotation '" + label + "' exceeds the data " + Cubes.printShape( in ) );

		final double[] avg = Cubes.bandAverages( in, box );
		final Img< FloatType > out = Cubes.copy( in );

		for ( int b = 0; b < avg.length; ++b )
		{
			final double a = avg[ b ];

			for ( final FloatType t : Views.flatIterable( Cubes.band( out, b ) ) )
				t.setReal( t.getRealDouble() - a );
		}

		return Collections.singletonList( data.copy( out ) );
	}
}
