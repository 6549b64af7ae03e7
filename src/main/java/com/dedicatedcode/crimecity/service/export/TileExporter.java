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

import com.dedicatedcode.crimecity.model.AggregatedUnit;

import java.io.IOException;
import java.util.stream.Stream;

/**
 * Turns aggregated units into map features.
 * Units are consumed one at a time; implementations must not collect the whole stream.
 */
public interface TileExporter {

    ExportResult export(Stream<AggregatedUnit> units, BoundaryProvider boundaries, FeatureSink sink) throws IOException;
}
