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

package com.dedicatedcode.crimecity.service.aggregation;

import com.dedicatedcode.crimecity.model.IncidentRecord;

import java.util.Optional;

/**
 * Assigns an incident to the spatial unit it is aggregated into.
 * Implementations must be safe to call from several aggregation workers at once.
 */
public interface SpatialKeyResolver {

    /**
     * @return the unit key, or empty if the record cannot be placed in any unit
     */
    Optional<String> keyFor(IncidentRecord record);
}
