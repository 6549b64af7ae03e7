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

package com.dedicatedcode.crimecity.service.pipeline;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * @param resolutions    grid resolutions to build, each one an independent target; repeats are dropped
 * @param municipalities whether the municipality target is built
 * @param force          rebuild every stage even when its output is current
 */
public record BuildRequest(List<Integer> resolutions, boolean municipalities, boolean force) {

    public BuildRequest {
        resolutions = List.copyOf(new LinkedHashSet<>(resolutions));
    }
}
