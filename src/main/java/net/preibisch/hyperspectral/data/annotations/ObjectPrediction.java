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

import java.util.Map;

/**
 * A single labelled object of an OPEX annotation set.
 */
public class ObjectPrediction
{
	private Double score;
	private String label;
	private BBox bbox;
	private Polygon polygon;
	private Map< String, String > meta;

	public ObjectPrediction( final String label, final BBox bbox, final Polygon polygon )
	{
		this( label, bbox, polygon, null, null );
	}

	public ObjectPrediction( final String label, final BBox bbox, final Polygon polygon, final Double score, final Map< String, String > meta )
	{
		this.label = label;
		this.bbox = bbox;
		this.polygon = polygon;
		this.score = score;
		this.meta = meta;
	}

	public String getLabel() { return label; }
	public BBox getBBox() { return bbox; }
	public Polygon getPolygon() { return polygon; }
	public Double getScore() { return score; }
	public Map< String, String > getMeta() { return meta; }
}
