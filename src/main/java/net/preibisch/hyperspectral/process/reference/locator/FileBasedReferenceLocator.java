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

import java.io.File;

/**
 * Locates a reference file using the scan file as base.
 */
public abstract class FileBasedReferenceLocator extends ReferenceLocator< String >
{
	String baseFile;
	boolean mustExist;

	protected FileBasedReferenceLocator()
	{
		super( Capability.FILE_BASED );
	}

	public String getBaseFile() { return baseFile; }
	public void setBaseFile( final String baseFile ) { this.baseFile = baseFile; }

	public boolean getMustExist() { return mustExist; }
	public void setMustExist( final boolean mustExist ) { this.mustExist = mustExist; }

	@Override
	protected String preCheck()
	{
		String result = super.preCheck();

		if ( result == null && baseFile == null )
			result = "No base file set!";

		return result;
	}

	@Override
	protected String postCheck( final String located )
	{
		String result = super.postCheck( located );

		if ( result == null && mustExist && !new File( located ).exists() )
			result = "Reference file does not exist: " + located;

		return result;
	}
}
