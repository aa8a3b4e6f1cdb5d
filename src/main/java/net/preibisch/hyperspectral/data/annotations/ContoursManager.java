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
package net.preibisch.hyperspectral.data.annotations;

import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds the polygon annotations of the current scan (normalized coordinates) and converts
 * them to and from OPEX annotation sets.
 */
public class ContoursManager
{
	public static final String LABEL_WHITEREF = "whiteref";
	public static final String LABEL_BLACKREF = "blackref";
	public static final String DEFAULT_LABEL = "object";

	final List< Contour > contours = new ArrayList<>();
	final Map< String, String > metadata = new HashMap<>();

	public void add( final Contour contour )
	{
		if ( contour.getPoints().isEmpty() )
			throw new IllegalArgumentException( "Contour without points: " + contour );

		contours.add( contour );
	}

	public void clear()
	{
		contours.clear();
		metadata.clear();
	}

	public boolean hasAnnotations()
	{
		return !contours.isEmpty();
	}

	public List< Contour > getContours()
	{
		return Collections.unmodifiableList( contours );
	}

	public List< Contour > getContours( final String label )
	{
		final ArrayList< Contour > result = new ArrayList<>();

		for ( final Contour c : contours )
			if ( c.getLabel().equals( label ) )
				result.add( c );

		return result;
	}

	public Map< String, String > getMetadata()
	{
		return metadata;
	}

	/**
	 * @param width - the width of the image
	 * @param height - the height of the image
	 * @return the annotations in absolute coordinates, null if there are none
	 */
	public ObjectPredictions toObjectPredictions( final int width, final int height )
	{
		if ( !hasAnnotations() && metadata.isEmpty() )
			return null;

		final ArrayList< ObjectPrediction > objects = new ArrayList<>();

		for ( final Contour contour : contours )
		{
			final Contour absolute = contour.toAbsolute( width, height );
			final String label = absolute.hasLabel() ? absolute.getLabel() : DEFAULT_LABEL;
			objects.add( new ObjectPrediction( label, absolute.bbox(), absolute.polygon(), null, absolute.getMeta() ) );
		}

		final String timestamp = new SimpleDateFormat( "yyyyMMdd_HHmmss.SSSSSS" ).format( new Date() );

		return new ObjectPredictions( timestamp, timestamp, objects, metadata.isEmpty() ? null : new HashMap<>( metadata ) );
	}

	/**
	 * Replaces the current annotations with the ones of the OPEX annotation set.
	 *
	 * @param predictions - the annotations in absolute coordinates
	 * @param width - the width of the image, for normalizing the coordinates
	 * @param height - the height of the image, for normalizing the coordinates
	 */
	public void fromObjectPredictions( final ObjectPredictions predictions, final int width, final int height )
	{
		clear();

		if ( predictions.getMeta() != null )
			metadata.putAll( predictions.getMeta() );

		for ( final ObjectPrediction obj : predictions.getObjects() )
		{
			final ArrayList< double[] > points = new ArrayList<>();

			if ( obj.getPolygon() != null && obj.getPolygon().numPoints() > 0 )
			{
				for ( final int[] p : obj.getPolygon().getPoints() )
					points.add( new double[]{ (double)p[ 0 ] / width, (double)p[ 1 ] / height } );
			}
			else if ( obj.getBBox() != null )
			{
				// no outline, use the corners of the box
				final BBox b = obj.getBBox();
				points.add( new double[]{ (double)b.getLeft() / width, (double)b.getTop() / height } );
				points.add( new double[]{ (double)b.getRight() / width, (double)b.getTop() / height } );
				points.add( new double[]{ (double)b.getRight() / width, (double)b.getBottom() / height } );
				points.add( new double[]{ (double)b.getLeft() / width, (double)b.getBottom() / height } );
			}
			else
			{
				continue;
			}

			add( new Contour( points, obj.getLabel(), true, obj.getMeta() ) );
		}
	}
}
