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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Which stages of a calibration run were attempted and whether they succeeded.
 * A stage that was not attempted is not contained.
 */
public class CalibrationOutcome
{
	public static final String SUCCESS = "✔";
	public static final String FAILURE = "❌";

	final EnumMap< CalibrationStage, Boolean > stages = new EnumMap<>( CalibrationStage.class );

	void put( final CalibrationStage stage, final boolean value )
	{
		stages.put( stage, value );
	}

	public boolean isEmpty() { return stages.isEmpty(); }

	public boolean contains( final CalibrationStage stage ) { return stages.containsKey( stage ); }

	/**
	 * @return whether the stage succeeded, null if it was not attempted
	 */
	public Boolean get( final CalibrationStage stage ) { return stages.get( stage ); }

	public Map< CalibrationStage, Boolean > asMap() { return Collections.unmodifiableMap( stages ); }

	/**
	 * Compact status like "I:✔ B:✔ W:❌ P:✔ D:✔". "I" succeeds if either reference could be initialized,
	 * "D" succeeds if the dimensions did not change.
	 *
	 * @return the indicator, empty if nothing was attempted
	 */
	public String indicator()
	{
		final StringBuilder s = new StringBuilder();

		if ( contains( CalibrationStage.BLACKDATA_INITIALIZED ) || contains( CalibrationStage.WHITEDATA_INITIALIZED ) )
			append( s, "I", isTrue( CalibrationStage.BLACKDATA_INITIALIZED ) || isTrue( CalibrationStage.WHITEDATA_INITIALIZED ) );

		if ( contains( CalibrationStage.BLACKREF_APPLIED ) )
			append( s, "B", get( CalibrationStage.BLACKREF_APPLIED ) );

		if ( contains( CalibrationStage.WHITEREF_APPLIED ) )
			append( s, "W", get( CalibrationStage.WHITEREF_APPLIED ) );

		if ( contains( CalibrationStage.PREPROCESSORS_APPLIED ) )
			append( s, "P", get( CalibrationStage.PREPROCESSORS_APPLIED ) );

		if ( contains( CalibrationStage.DIMENSIONS_DIFFER ) )
			append( s, "D", !get( CalibrationStage.DIMENSIONS_DIFFER ) );

		return s.toString();
	}

	private boolean isTrue( final CalibrationStage stage )
	{
		return Boolean.TRUE.equals( stages.get( stage ) );
	}

	private static void append( final StringBuilder s, final String key, final boolean success )
	{
		if ( s.length() > 0 )
			s.append( ' ' );

		s.append( key ).append( ':' ).append( success ? SUCCESS : FAILURE );
	}

	@Override
	public String toString()
	{
		return stages.toString();
	}
}
