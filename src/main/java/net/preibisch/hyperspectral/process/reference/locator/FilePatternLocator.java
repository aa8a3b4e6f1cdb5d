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
 * Generates the reference file name by applying a pattern to the scan file name.
 * Supported placeholders: {@link #PH_PATH}, {@link #PH_NAME}, {@link #PH_EXT}.
 */
public class FilePatternLocator extends FileBasedReferenceLocator
{
	/** the directory of the scan file */
	public static final String PH_PATH = "{PATH}";

	/** the name of the scan file without extension */
	public static final String PH_NAME = "{NAME}";

	/** the extension of the scan file, including the dot */
	public static final String PH_EXT = "{EXT}";

	public static String defaultPattern = PH_PATH + "/" + PH_NAME + PH_EXT;

	String pattern;

	public FilePatternLocator()
	{
		this( defaultPattern );
	}

	public FilePatternLocator( final String pattern )
	{
		this.pattern = pattern;
	}

	public String getPattern() { return pattern; }
	public void setPattern( final String pattern ) { this.pattern = pattern; }

	@Override
	public String getName() { return "rl-file-pattern"; }

	@Override
	protected String preCheck()
	{
		String result = super.preCheck();

		if ( result == null && ( pattern == null || pattern.length() == 0 ) )
			result = "No pattern defined!";

		return result;
	}

	@Override
	protected String doLocate()
	{
		final File file = new File( baseFile );
		final String path = file.getParent() == null ? "" : file.getParent();
		final String fileName = file.getName();

		// a leading dot (hidden file) is not an extension
		final int dot = fileName.lastIndexOf( '.' );
		final String name, ext;

		if ( dot > 0 )
		{
			name = fileName.substring( 0, dot );
			ext = fileName.substring( dot );
		}
		else
		{
			name = fileName;
			ext = "";
		}

		return pattern.replace( PH_PATH, path ).replace( PH_NAME, name ).replace( PH_EXT, ext );
	}
}
