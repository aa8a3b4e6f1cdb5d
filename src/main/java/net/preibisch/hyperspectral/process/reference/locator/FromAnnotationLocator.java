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
package net.preibisch.hyperspectral.process.reference.locator;

import net.preibisch.hyperspectral.data.annotations.ObjectPrediction;

/**
 * Uses the first annotation with the given label as reference region, the caller takes its bounding box.
 */
public class FromAnnotationLocator extends AnnotationBasedReferenceLocator
{
	String label;

	public FromAnnotationLocator()
	{
		this( null );
	}

	public FromAnnotationLocator( final String label )
	{
		this.label = label;
	}

	public String getLabel() { return label; }
	public void setLabel( final String label ) { this.label = label; }

	@Override
	public String getName() { return "rl-from-annotation"; }

	@Override
	protected String preCheck()
	{
		String result = super.preCheck();

		if ( result == null && ( label == null || label.length() == 0 ) )
			result = "No label specified to identify reference annotation!";

		return result;
	}

	@Override
	protected ObjectPrediction doLocate()
	{
		return annotations.firstWithLabel( label );
	}
}
