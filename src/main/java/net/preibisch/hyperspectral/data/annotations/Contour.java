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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A labelled polygon outline. Coordinates are either normalized to [0,1] or absolute pixels.
 */
public class Contour
{
	final List< double[] > points;
	final String label;
	final boolean normalized;
	final Map< String, String > meta;

	public Contour( final List< double[] > points, final String label )
	{
		this( points, label, true, null );
	}

	public Contour( final List< double[] > points, final String label, final boolean normalized, final Map< String, String > meta )
	{
		this.points = new ArrayList<>( points );
		this.label = label == null ? "" : label;
		this.normalized = normalized;
		this.meta = meta == null ? null : new HashMap<>( meta );
	}

	public List< double[] > getPoints() { return Collections.unmodifiableList( points ); }
	public String getLabel() { return label; }
	public boolean isNormalized() { return normalized; }
	public Map< String, String > getMeta() { return meta; }

	public boolean hasLabel()
	{
		return label.length() > 0;
	}

	/**
	 * @param width - image width
	 * @param height - image height
	 * @return the contour in absolute pixel coordinates, truncated towards zero
	 */
	public Contour toAbsolute( final int width, final int height )
	{
		if ( !normalized )
			return this;

		final List< double[] > absolute = new ArrayList<>( points.size() );

		for ( final double[] p : points )
			absolute.add( new double[]{ (int)( p[ 0 ] * width ), (int)( p[ 1 ] * height ) } );

		return new Contour( absolute, label, false, meta );
	}

	/**
	 * @return the bounding box of an absolute contour
	 */
	public BBox bbox()
	{
		if ( normalized )
			throw new IllegalStateException( "Bounding box requires absolute coordinates, call toAbsolute() first" );

		double minX = Double.MAX_VALUE, minY = Double.MAX_VALUE;
		double maxX = -Double.MAX_VALUE, maxY = -Double.MAX_VALUE;

		for ( final double[] p : points )
		{
			minX = Math.min( minX, p[ 0 ] );
			minY = Math.min( minY, p[ 1 ] );
			maxX = Math.max( maxX, p[ 0 ] );
			maxY = Math.max( maxY, p[ 1 ] );
		}

		return new BBox( (int)minX, (int)minY, (int)maxX, (int)maxY );
	}

	public Polygon polygon()
	{
		final int[][] xy = new int[ points.size() ][];

		for ( int i = 0; i < xy.length; ++i )
			xy[ i ] = new int[]{ (int)points.get( i )[ 0 ], (int)points.get( i )[ 1 ] };

		return new Polygon( xy );
	}

	@Override
	public String toString()
	{
		return "Contour(label=" + label + ", #points=" + points.size() + ", normalized=" + normalized + ")";
	}
}
