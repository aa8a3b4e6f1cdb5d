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

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Reads/writes OPEX annotation sets as JSON.
 */
public class OpexAnnotationsIO
{
	static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

	public static ObjectPredictions load( final String path ) throws IOException
	{
		try ( final Reader reader = Files.newBufferedReader( Paths.get( path ), StandardCharsets.UTF_8 ) )
		{
			return fromJson( reader );
		}
	}

	public static ObjectPredictions fromJson( final Reader reader ) throws IOException
	{
		try
		{
			final ObjectPredictions predictions = GSON.fromJson( reader, ObjectPredictions.class );

			if ( predictions == null )
				throw new IOException( "Empty OPEX document" );

			return predictions;
		}
		catch ( final JsonParseException e )
		{
			throw new IOException( "Failed to parse OPEX annotations: " + e.getMessage(), e );
		}
	}

	public static String toJson( final ObjectPredictions predictions )
	{
		return GSON.toJson( predictions );
	}

	public static void save( final ObjectPredictions predictions, final String path ) throws IOException
	{
		final Path file = Paths.get( path );

		try ( final Writer writer = Files.newBufferedWriter( file, StandardCharsets.UTF_8 ) )
		{
			GSON.toJson( predictions, writer );
		}
	}
}
