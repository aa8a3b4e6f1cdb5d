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

import net.preibisch.hyperspectral.data.AnnotationRectangle;
import net.preibisch.hyperspectral.process.ConfigurationException;

/**
 * A reference method that only looks at the annotated rectangle of the reference.
 */
public abstract class AnnotationBasedReferenceMethod< S > extends ReferenceMethod< S >
{
	AnnotationRectangle annotation;

	protected AnnotationBasedReferenceMethod( final ReferenceType type )
	{
		super( type, Capability.ANNOTATION_BASED );
	}

	public AnnotationRectangle getAnnotation() { return annotation; }

	public void setAnnotation( final AnnotationRectangle annotation )
	{
		this.annotation = annotation;
		reset();
	}

	@Override
	protected S initialize()
	{
		if ( annotation == null )
			throw new ConfigurationException( "No annotation set (top, left, bottom, right)!" );

		return super.initialize();
	}
}
