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
package net.preibisch.hyperspectral.process.calibration;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.hyperspectral.data.AnnotationRectangle;
import net.preibisch.hyperspectral.process.reference.ReferenceMethod;
import net.preibisch.hyperspectral.process.reference.ReferenceType;
import net.preibisch.hyperspectral.process.reference.locator.ReferenceLocator;

/**
 * Everything the calibration knows about the black or the white reference.
 */
public class ReferenceSlot
{
	final ReferenceType type;

	ReferenceLocator< ? > locator;
	ReferenceMethod< ? > method;

	String file;
	RandomAccessibleInterval< FloatType > data;
	AnnotationRectangle annotation;
	boolean annotationInScan = true;

	public ReferenceSlot( final ReferenceType type )
	{
		this.type = type;
	}

	public ReferenceType getType() { return type; }
	public ReferenceLocator< ? > getLocator() { return locator; }
	public ReferenceMethod< ? > getMethod() { return method; }
	public String getFile() { return file; }
	public RandomAccessibleInterval< FloatType > getData() { return data; }
	public AnnotationRectangle getAnnotation() { return annotation; }
	public boolean isAnnotationInScan() { return annotationInScan; }

	public boolean hasData() { return data != null; }

	/**
	 * @return whether the locator needs to run to find the reference data
	 */
	public boolean canInitData()
	{
		return data == null && locator != null;
	}

	void setData( final String file, final RandomAccessibleInterval< FloatType > data )
	{
		this.file = file;
		this.data = data;
		this.annotation = null;
	}

	/**
	 * An annotation inside the scan replaces any reference data, an annotation into separate
	 * reference data keeps it.
	 */
	void setAnnotation( final AnnotationRectangle annotation, final boolean inScan )
	{
		if ( inScan )
		{
			this.file = null;
			this.data = null;
		}

		this.annotation = annotation;
		this.annotationInScan = inScan;
	}

	void clearData()
	{
		this.file = null;
		this.data = null;
	}

	@Override
	public String toString()
	{
		return type.getLabel() + " reference: locator=" + locator + ", method=" + method + ", file=" + file
				+ ", data=" + ( data != null ) + ", annotation=" + annotation + ", inScan=" + annotationInScan;
	}
}
