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
 * Axis-aligned bounding box in absolute pixel coordinates (OPEX {@code bbox}).
 */
public class BBox
{
	private int left, top, right, bottom;

	public BBox( final int left, final int top, final int right, final int bottom )
	{
		this.left = left;
		this.top = top;
		this.right = right;
		this.bottom = bottom;
	}

	public int getLeft() { return left; }
	public int getTop() { return top; }
	public int getRight() { return right; }
	public int getBottom() { return bottom; }

	@Override
	public String toString()
	{
		return "BBox(left=" + left + ", top=" + top + ", right=" + right + ", bottom=" + bottom + ")";
	}
}
