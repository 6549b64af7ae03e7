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
import com.uber.h3core.H3Core;
import com.uber.h3core.util.LatLng;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;

/**
 * Hexagonal grid backed by Uber's H3 library.
 * <p>
 * Resolution 4 has ~25km edges, 5 ~8km and 6 ~3km; each step subdivides a cell into seven children.
 */
public class H3SpatialIndexer implements SpatialIndexer {

    private final H3Core h3;

    public H3SpatialIndexer() {
        try {
            this.h3 = H3Core.newInstance();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize H3Core", e);
        }
    }

    @Override
    public String name() {
        return "h3";
    }

    @Override
    public int minResolution() {
        return 0;
    }

    @Override
    public int maxResolution() {
        return 15;
    }

    @Override
    public Optional<SpatialCell> cellForPoint(double lat, double lon, int resolution) {
        checkResolution(resolution);
        if (!SpatialIndexer.isValidCoordinate(lat, lon)) {
            return Optional.empty();
        }
        return Optional.of(new SpatialCell(h3.latLngToCellAddress(lat, lon, resolution), resolution));
    }

    @Override
    public List<LatLon> boundaryForCell(SpatialCell cell) {
        requireValid(cell);
        return h3.cellToBoundary(cell.id()).stream()
                .map(this::toLatLon)
                .toList();
    }

    @Override
    public SpatialCell parentOf(SpatialCell cell, int resolution) {
        requireValid(cell);
        if (resolution > cell.resolution()) {
            throw new IllegalArgumentException("Parent resolution " + resolution + " is finer than " + cell.resolution());
        }
        return new SpatialCell(h3.cellToParentAddress(cell.id(), resolution), resolution);
    }

    private void requireValid(SpatialCell cell) {
        if (!h3.isValidCell(cell.id())) {
            throw new IllegalArgumentException("Not a valid H3 cell: " + cell.id());
        }
    }

    private LatLon toLatLon(LatLng latLng) {
        return new LatLon(latLng.lat, latLng.lng);
    }
}
