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
import net.preibisch.hyperspectral.data.annotations.ObjectPredictions;

/**
 * Locates the reference region in the OPEX annotations of the scan.
 */
public abstract class AnnotationBasedReferenceLocator extends ReferenceLocator< ObjectPrediction >
{
	ObjectPredictions annotations;

	protected AnnotationBasedReferenceLocator()
	{
		super( Capability.ANNOTATION_BASED );
	}

	public ObjectPredictions getAnnotations() { return annotations; }
	public void setAnnotations( final ObjectPredictions annotations ) { this.annotations = annotations; }

	@Override
	protected String preCheck()
	{
		String result = super.preCheck();

		if ( result == null && annotations == null )
			result = "No annotations set!";

		return result;
	}
}
