package com.factory.edge.ops;

import jakarta.validation.constraints.NotBlank;

public record PointWriteRequest(@NotBlank String nodeId, Object value) {
}
