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
 * Either uninitialized, or initialized with the statistics derived from the bound reference.
 *
 * @param <S> type of the derived statistics
 */
public final class ReferenceState< S >
{
	@SuppressWarnings( "rawtypes" )
	private static final ReferenceState UNINITIALIZED = new ReferenceState<>( null );

	private final S statistics;

	private ReferenceState( final S statistics )
	{
		this.statistics = statistics;
	}

	@SuppressWarnings( "unchecked" )
	public static < S > ReferenceState< S > uninitialized()
	{
		return UNINITIALIZED;
	}

	public static < S > ReferenceState< S > initialized( final S statistics )
	{
		if ( statistics == null )
			throw new NullPointerException( "statistics" );

		return new ReferenceState<>( statistics );
	}

	public boolean isInitialized()
	{
		return statistics != null;
	}

	public S get()
	{
		if ( statistics == null )
			throw new IllegalStateException( "Reference statistics have not been computed yet" );

		return statistics;
	}

	@Override
	public String toString()
	{
		return isInitialized() ? "Initialized(" + statistics + ")" : "Uninitialized";
	}
}
