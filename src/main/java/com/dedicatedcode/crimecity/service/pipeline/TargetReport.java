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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TargetReport(@JsonProperty("target") String target,
                           @JsonProperty("stages") List<StageOutcome> stages,
                           @JsonProperty("error") String error) {

    public TargetReport {
        stages = List.copyOf(stages);
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return error == null;
    }

    public StageOutcome stage(String name) {
        return stages.stream()
                .filter(outcome -> outcome.stage().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No stage " + name + " in target " + target));
    }
}
