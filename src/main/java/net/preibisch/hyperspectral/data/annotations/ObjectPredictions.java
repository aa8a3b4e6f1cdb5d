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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * An OPEX annotation set: the objects annotated in one image.
 */
public class ObjectPredictions
{
	private String timestamp;
	private String id;
	private List< ObjectPrediction > objects;
	private Map< String, String > meta;

	public ObjectPredictions( final String id, final String timestamp, final List< ObjectPrediction > objects )
	{
		this( id, timestamp, objects, null );
	}

	public ObjectPredictions( final String id, final String timestamp, final List< ObjectPrediction > objects, final Map< String, String > meta )
	{
		this.id = id;
		this.timestamp = timestamp;
		this.objects = new ArrayList<>( objects );
		this.meta = meta;
	}

	public String getId() { return id; }
	public String getTimestamp() { return timestamp; }
	public Map< String, String > getMeta() { return meta; }

	public List< ObjectPrediction > getObjects()
	{
		if ( objects == null )
			return Collections.emptyList();

		return Collections.unmodifiableList( objects );
	}

	/**
	 * @param label - the label to look for
	 * @return the first object carrying the label, null if none
	 */
	public ObjectPrediction firstWithLabel( final String label )
	{
		for ( final ObjectPrediction obj : getObjects() )
			if ( label.equals( obj.getLabel() ) )
				return obj;

		return null;
	}
}
