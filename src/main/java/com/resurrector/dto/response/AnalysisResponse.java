package com.resurrector.dto.response;

import com.resurrector.model.ResourceSchema;
import java.util.List;

/**
 * The successful outcome of an analysis. Always an object with a {@code resources} array.
 *
 * @param resources The normalized resources, in discovery order.
 */
public record AnalysisResponse(List<ResourceSchema> resources) {

    public AnalysisResponse {
        resources = List.copyOf(resources);
    }
}
