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

/**
 * Always returns the same reference file.
 */
public class FixedLocator extends ReferenceLocator< String >
{
	String referenceFile;

	public FixedLocator()
	{
		this( null );
	}

	public FixedLocator( final String referenceFile )
	{
		super( Capability.GENERIC );
		this.referenceFile = referenceFile;
	}

	public String getReferenceFile() { return referenceFile; }
	public void setReferenceFile( final String referenceFile ) { this.referenceFile = referenceFile; }

	@Override
	public String getName() { return "rl-fixed"; }

	@Override
	protected String preCheck()
	{
		String result = super.preCheck();

		if ( result == null && referenceFile == null )
			result = "No reference file set!";

		return result;
	}

	@Override
	protected String doLocate()
	{
		return referenceFile;
	}
}
