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

import net.preibisch.hyperspectral.process.ConfigurationException;

/**
 * Proposes where the reference data for a scan lives.
 *
 * @param <R> the type of the located reference
 */
public abstract class ReferenceLocator< R >
{
	public enum Capability
	{
		/** locates a reference file relative to the scan file */
		FILE_BASED,
		/** locates a reference region inside the annotations of the scan */
		ANNOTATION_BASED,
		/** locates a reference without any context */
		GENERIC
	}

	final Capability capability;

	protected ReferenceLocator( final Capability capability )
	{
		this.capability = capability;
	}

	public Capability getCapability() { return capability; }

	public abstract String getName();

	/**
	 * @return null if the locator is set up correctly, otherwise the error message
	 */
	protected String preCheck()
	{
		return null;
	}

	protected abstract R doLocate();

	/**
	 * @param located - the located reference, never null
	 * @return null if the reference is valid, otherwise the error message
	 */
	protected String postCheck( final R located )
	{
		return null;
	}

	/**
	 * Attempts to locate the reference.
	 *
	 * @return the located reference, null if none could be found
	 * @throws ConfigurationException if the locator is not set up correctly or the located reference is invalid
	 */
	public R locate()
	{
		String msg = preCheck();

		if ( msg != null )
			throw new ConfigurationException( msg );

		final R result = doLocate();

		if ( result != null )
		{
			msg = postCheck( result );

			if ( msg != null )
				throw new ConfigurationException( msg );
		}

		return result;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
