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

package com.dedicatedcode.crimecity.service.spatial;

import com.dedicatedcode.crimecity.model.LatLon;
import com.dedicatedcode.crimecity.model.SpatialCell;
import com.google.common.geometry.S2Cell;
import com.google.common.geometry.S2CellId;
import com.google.common.geometry.S2LatLng;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Quad-tree grid backed by S2 cells. The resolution is the S2 level, cells are identified by their token.
 */
public class S2SpatialIndexer implements SpatialIndexer {

    @Override
    public String name() {
        return "s2";
    }

    @Override
    public int minResolution() {
        return 0;
    }

    @Override
    public int maxResolution() {
        return S2CellId.MAX_LEVEL;
    }

    @Override
    public Optional<SpatialCell> cellForPoint(double lat, double lon, int resolution) {
        checkResolution(resolution);
        if (!SpatialIndexer.isValidCoordinate(lat, lon)) {
            return Optional.empty();
        }
        S2CellId cellId = S2CellId.fromLatLng(S2LatLng.fromDegrees(lat, lon)).parent(resolution);
        return Optional.of(new SpatialCell(cellId.toToken(), resolution));
    }

    @Override
    public List<LatLon> boundaryForCell(SpatialCell cell) {
        S2Cell s2Cell = new S2Cell(toCellId(cell));
        List<LatLon> vertices = new ArrayList<>(4);
        // S2 cell vertices are counter-clockwise
        for (int i = 0; i < 4; i++) {
            S2LatLng latLng = new S2LatLng(s2Cell.getVertex(i));
            vertices.add(new LatLon(latLng.latDegrees(), latLng.lngDegrees()));
        }
        return vertices;
    }

    @Override
    public SpatialCell parentOf(SpatialCell cell, int resolution) {
        S2CellId cellId = toCellId(cell);
        if (resolution > cellId.level()) {
            throw new IllegalArgumentException("Parent level " + resolution + " is finer than " + cellId.level());
        }
        return new SpatialCell(cellId.parent(resolution).toToken(), resolution);
    }

    private S2CellId toCellId(SpatialCell cell) {
        S2CellId cellId = S2CellId.fromToken(cell.id());
        if (!cellId.isValid()) {
            throw new IllegalArgumentException("Not a valid S2 cell token: " + cell.id());
        }
        return cellId;
    }
}
