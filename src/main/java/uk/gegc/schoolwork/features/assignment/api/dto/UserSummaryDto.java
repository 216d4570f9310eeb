package uk.gegc.schoolwork.features.assignment.api.dto;

import java.util.UUID;

public record UserSummaryDto(UUID id, String username) {
}
