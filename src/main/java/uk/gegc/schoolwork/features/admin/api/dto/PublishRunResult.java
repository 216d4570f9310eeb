package uk.gegc.schoolwork.features.admin.api.dto;

import java.time.Instant;

public record PublishRunResult(int published, Instant ranAt) {
}
