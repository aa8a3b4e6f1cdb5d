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
package net.preibisch.hyperspectral.process.normalization;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import net.preibisch.hyperspectral.data.annotations.ContoursManager;
import net.preibisch.hyperspectral.data.annotations.ObjectPrediction;
import net.preibisch.hyperspectral.process.ConfigurationException;

/**
 * Determines min/max only from the pixels inside the annotated objects (white/black references are always
 * skipped), values outside get clipped. A pixel is inside an object if its center is inside the object's polygon.
 */
public class ObjectAnnotationsNormalization extends AnnotationBasedNormalization
{
	private static final Logger LOG = LoggerFactory.getLogger( ObjectAnnotationsNormalization.class );

	final Set< String > labels = new HashSet<>();

	public ObjectAnnotationsNormalization( final String... labels )
	{
		this( Arrays.asList( labels ) );
	}

	/**
	 * @param labels - the labels to restrict the calculation to, empty for all
	 */
	public ObjectAnnotationsNormalization( final Collection< String > labels )
	{
		this.labels.addAll( labels );
	}

	public Set< String > getLabels() { return labels; }

	@Override
	public String getName() { return "norm-object-annotations"; }

	@Override
	public String getDescription()
	{
		return "Normalization that only uses pixels from annotations (white/black references are always skipped) to calculate the min/max/range.";
	}

	protected boolean isUsed( final ObjectPrediction obj )
	{
		if ( ContoursManager.LABEL_WHITEREF.equals( obj.getLabel() ) || ContoursManager.LABEL_BLACKREF.equals( obj.getLabel() ) )
			return false;

		if ( obj.getPolygon() == null || obj.getPolygon().numPoints() < 3 )
			return false;

		return labels.isEmpty() || labels.contains( obj.getLabel() );
	}

	@Override
	protected Img< FloatType > doNormalize( final RandomAccessibleInterval< FloatType > band, final Channel channel )
	{
		final ArrayList< java.awt.Polygon > polygons = new ArrayList<>();

		for ( final ObjectPrediction obj : annotations.getObjects() )
			if ( isUsed( obj ) )
				polygons.add( obj.getPolygon().toAWT() );

		double min = Double.MAX_VALUE;
		double max = -Double.MAX_VALUE;
		long count = 0;

		final Cursor< FloatType > c = Views.flatIterable( band ).localizingCursor();

		while ( c.hasNext() )
		{
			final double v = c.next().getRealDouble();
			final double x = c.getDoublePosition( 0 ) - band.min( 0 ) + 0.5;
			final double y = c.getDoublePosition( 1 ) - band.min( 1 ) + 0.5;

			for ( final java.awt.Polygon polygon : polygons )
			{
				if ( polygon.contains( x, y ) )
				{
					min = Math.min( min, v );
					max = Math.max( max, v );
					++count;
					break;
				}
			}
		}

		if ( count == 0 )
			throw new ConfigurationException( "No annotated pixels to determine min/max from (labels: " + ( labels.isEmpty() ? "all" : labels ) + ")" );

		LOG.info( "channel={}, pixels={}, min={}, max={}, range={}", channel, count, min, max, max - min );

		return rescale( band, min, max, true );
	}
}
