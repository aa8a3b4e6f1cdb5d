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
package net.preibisch.hyperspectral.data;

import net.imglib2.Dimensions;
import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.preibisch.hyperspectral.data.annotations.BBox;
import net.preibisch.hyperspectral.process.ConfigurationException;

/**
 * Rectangle (top, left, bottom, right) in pixel coordinates marking a reference region.
 * Bottom and right are exclusive, i.e. the region covers rows {@code [top, bottom)} and columns
 * {@code [left, right)}.
 */
public class AnnotationRectangle
{
	final int top, left, bottom, right;

	public AnnotationRectangle( final int top, final int left, final int bottom, final int right )
	{
		this.top = top;
		this.left = left;
		this.bottom = bottom;
		this.right = right;
	}

	public static AnnotationRectangle fromBBox( final BBox bbox )
	{
		return new AnnotationRectangle( bbox.getTop(), bbox.getLeft(), bbox.getBottom(), bbox.getRight() );
	}

	public int getTop() { return top; }
	public int getLeft() { return left; }
	public int getBottom() { return bottom; }
	public int getRight() { return right; }

	/**
	 * Ensures the rectangle selects at least one pixel inside the x/y extent of the cube.
	 *
	 * @param cube - dimensions of the cube the rectangle refers to
	 */
	public void check( final Dimensions cube )
	{
		final long width = cube.dimension( Cubes.X );
		final long height = cube.dimension( Cubes.Y );

		if ( top < 0 || left < 0 || bottom > height || right > width )
			throw new ConfigurationException( "Annotation " + this + " exceeds the image bounds (width=" + width + ", height=" + height + ")" );

		if ( bottom <= top || right <= left )
			throw new ConfigurationException( "Annotation " + this + " does not contain any pixels" );
	}

	/**
	 * @param cube - the cube the rectangle is placed into
	 * @return the x/y interval, offset by the min of the cube
	 */
	public Interval spatialInterval( final Interval cube )
	{
		final long x0 = cube.min( Cubes.X );
		final long y0 = cube.min( Cubes.Y );

		return new FinalInterval(
				new long[]{ x0 + left, y0 + top },
				new long[]{ x0 + right - 1, y0 + bottom - 1 } );
	}

	@Override
	public boolean equals( final Object o )
	{
		if ( this == o )
			return true;

		if ( !( o instanceof AnnotationRectangle ) )
			return false;

		final AnnotationRectangle other = (AnnotationRectangle)o;
		return top == other.top && left == other.left && bottom == other.bottom && right == other.right;
	}

	@Override
	public int hashCode()
	{
		int result = top;
		result = 31 * result + left;
		result = 31 * result + bottom;
		result = 31 * result + right;
		return result;
	}

	@Override
	public String toString()
	{
		return "top=" + top + ", left=" + left + ", bottom=" + bottom + ", right=" + right;
	}
}
