package uk.gegc.schoolwork.features.assignment.api.dto;

import java.util.UUID;

public record ClassSummaryDto(UUID id, String name) {
}
