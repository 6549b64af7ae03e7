/*
 *  This file is part of crimecity.
 *
 *  CrimeCity is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  CrimeCity is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with CrimeCity. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.crimecity.dto;

import com.dedicatedcode.crimecity.model.LatLon;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class GeoJsonGeometry {

    @JsonProperty("type")
    private String type;

    @JsonProperty("coordinates")
    private Object coordinates;

    public GeoJsonGeometry() {}

    public GeoJsonGeometry(String type, Object coordinates) {
        this.type = type;
        this.coordinates = coordinates;
    }

    /**
     * A polygon with one exterior ring, closed, in GeoJSON [lon, lat] order.
     */
    public static GeoJsonGeometry polygon(List<LatLon> vertices) {
        List<List<Double>> ring = new ArrayList<>(vertices.size() + 1);
        for (LatLon vertex : vertices) {
            ring.add(List.of(vertex.lon(), vertex.lat()));
        }
        if (!vertices.isEmpty() && !vertices.get(0).equals(vertices.get(vertices.size() - 1))) {
            ring.add(ring.get(0));
        }
        return new GeoJsonGeometry("Polygon", List.of(ring));
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Object getCoordinates() {
        return coordinates;
    }

    public void setCoordinates(Object coordinates) {
        this.coordinates = coordinates;
    }
}
