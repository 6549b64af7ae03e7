package com.dedicatedcode.crimecity.service.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

record BuildMetadata(
        @JsonProperty("buildTimestamp") String buildTimestamp,
        @JsonProperty("dataVersion") String dataVersion,
        @JsonProperty("file") String file,
        @JsonProperty("gridSystem") String gridSystem,
        @JsonProperty("resolutions") List<Integer> resolutions,
        @JsonProperty("classificationVersion") String classificationVersion,
        @JsonProperty("successful") boolean successful,
        @JsonProperty("crimecityVersion") String crimecityVersion
) {
}
