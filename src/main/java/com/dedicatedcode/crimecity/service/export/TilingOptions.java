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

package com.dedicatedcode.crimecity.service.export;

import java.util.List;

/**
 * What the external tiler is asked to produce for one layer.
 *
 * @param layer        layer name inside the tile archive
 * @param minZoom      lowest zoom level generated
 * @param maxZoom      highest zoom level generated
 * @param attributes   feature properties to keep
 * @param featureLimit whether the tiler may drop features to respect its per-tile limits
 */
public record TilingOptions(String layer, int minZoom, int maxZoom, List<String> attributes, boolean featureLimit) {

    public TilingOptions {
        if (minZoom < 0 || maxZoom < minZoom) {
            throw new IllegalArgumentException("Invalid zoom range " + minZoom + "-" + maxZoom);
        }
        attributes = List.copyOf(attributes);
    }

    /**
     * Coarse resolutions are shown zoomed out: r4 at 4-8, r5 at 5-9, r6 at 6-10, otherwise r to r+4.
     * The upper bound never exceeds {@code maxZoomCap}.
     */
    public static TilingOptions forResolution(FeatureSchema schema, int resolution, int maxZoomCap) {
        int minZoom = Math.min(resolution, maxZoomCap);
        int maxZoom = Math.min(resolution + 4, maxZoomCap);
        return new TilingOptions(schema.layer(), minZoom, maxZoom, schema.attributeNames(), true);
    }

    /**
     * Municipalities are few and large, so every polygon is kept at zoom 3-10.
     */
    public static TilingOptions forMunicipalities(FeatureSchema schema, int maxZoomCap) {
        return new TilingOptions(schema.layer(), Math.min(3, maxZoomCap), Math.min(10, maxZoomCap), schema.attributeNames(), false);
    }
}
