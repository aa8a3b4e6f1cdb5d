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

/**
 * Black references are subtracted from a scan (dark current), white references divide it (maximum response).
 */
public enum ReferenceType
{
	BLACK( "black", "br" )
	{
		@Override
		public float combine( final float scan, final float reference ) { return scan - reference; }
	},

	WHITE( "white", "wr" )
	{
		@Override
		public float combine( final float scan, final float reference ) { return scan / reference; }
	};

	final String label, prefix;

	private ReferenceType( final String label, final String prefix )
	{
		this.label = label;
		this.prefix = prefix;
	}

	public abstract float combine( final float scan, final float reference );

	public String getLabel() { return label; }

	/**
	 * @return the prefix of the method names, e.g. "br" for "br-same-size"
	 */
	public String getPrefix() { return prefix; }
}
