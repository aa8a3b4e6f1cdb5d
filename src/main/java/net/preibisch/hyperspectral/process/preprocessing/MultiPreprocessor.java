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
package net.preibisch.hyperspectral.process.preprocessing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.hyperspectral.data.SpectralCube;

/**
 * Applies a list of preprocessors one after the other.
 */
public class MultiPreprocessor extends Preprocessor
{
	private static final Logger LOG = LoggerFactory.getLogger( MultiPreprocessor.class );

	final List< Preprocessor > preprocessors;

	public MultiPreprocessor( final Preprocessor... preprocessors )
	{
		this( Arrays.asList( preprocessors ) );
	}

	public MultiPreprocessor( final List< Preprocessor > preprocessors )
	{
		this.preprocessors = new ArrayList<>( preprocessors );
	}

	public List< Preprocessor > getPreprocessors()
	{
		return Collections.unmodifiableList( preprocessors );
	}

	@Override
	public String getName() { return "multi-pp"; }

	@Override
	public String getDescription() { return "Combines multiple pre-processors."; }

	/**
	 * Fits every preprocessor on the output of its predecessors.
	 */
	@Override
	public void fit( final SpectralCube data )
	{
		List< SpectralCube > current = Collections.singletonList( data );

		for ( final Preprocessor preprocessor : preprocessors )
		{
			LOG.debug( "fitting {}", preprocessor );

			for ( final SpectralCube c : current )
				preprocessor.fit( c );

			current = applyAll( preprocessor, current );
		}
	}

	@Override
	public List< SpectralCube > apply( final SpectralCube data )
	{
		List< SpectralCube > current = Collections.singletonList( data );

		for ( final Preprocessor preprocessor : preprocessors )
			current = applyAll( preprocessor, current );

		return current;
	}

	protected static List< SpectralCube > applyAll( final Preprocessor preprocessor, final List< SpectralCube > data )
	{
		final ArrayList< SpectralCube > result = new ArrayList<>();

		for ( final SpectralCube c : data )
			result.addAll( preprocessor.apply( c ) );

		return result;
	}

	@Override
	public String toString()
	{
		final StringBuilder s = new StringBuilder();

		for ( final Preprocessor p : preprocessors )
		{
			if ( s.length() > 0 )
				s.append( " -> " );

			s.append( p.toString() );
		}

		return s.toString();
	}
}
