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

/**
 * Closed polygon, one {@code [x, y]} pair per vertex (OPEX {@code polygon}).
 */
public class Polygon
{
	private int[][] points;

	public Polygon( final int[][] points )
	{
		this.points = points;
	}

	public int[][] getPoints() { return points; }

	public int numPoints() { return points == null ? 0 : points.length; }

	public java.awt.Polygon toAWT()
	{
		final java.awt.Polygon polygon = new java.awt.Polygon();

		for ( int i = 0; i < numPoints(); ++i )
			polygon.addPoint( points[ i ][ 0 ], points[ i ][ 1 ] );

		return polygon;
	}
}
