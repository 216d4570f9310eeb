package uk.gegc.schoolwork.features.assignment.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.schoolwork.features.assignment.api.dto.AssignmentDto;
import uk.gegc.schoolwork.features.assignment.api.dto.PronunciationAssignmentRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.ReadingAssignmentRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.VideoAssignmentRequest;
import uk.gegc.schoolwork.features.assignment.application.AssignmentVariantService;
import uk.gegc.schoolwork.shared.api.dto.ApiResponse;
import uk.gegc.schoolwork.shared.security.AuthenticatedUserResolver;

@Tag(name = "Assignment variants", description = "Typed shortcuts for video, reading and pronunciation assignments.")
@RestController
@RequestMapping("/api/assignments")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('TEACHER','ADMIN')")
public class AssignmentVariantController {

    private final AssignmentVariantService variantService;
    private final AuthenticatedUserResolver userResolver;

    @Operation(summary = "Create a video assignment", description = "Requires a valid video URL and at least one question with an answer.")
    @PostMapping("/video")
    public ResponseEntity<ApiResponse<AssignmentDto>> createVideo(@RequestBody @Valid VideoAssignmentRequest request,
                                                                  Authentication authentication) {
        AssignmentDto created = variantService.createVideoAssignment(userResolver.resolve(authentication), request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(created, "Video assignment created successfully"));
    }

    @Operation(summary = "Create a reading assignment", description = "Requires the reading text in context.")
    @PostMapping("/reading")
    public ResponseEntity<ApiResponse<AssignmentDto>> createReading(@RequestBody @Valid ReadingAssignmentRequest request,
                                                                    Authentication authentication) {
        AssignmentDto created = variantService.createReadingAssignment(userResolver.resolve(authentication), request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(created, "Reading assignment created successfully"));
    }

    @Operation(summary = "Create a pronunciation assignment", description = "Requires at least one passage.")
    @PostMapping("/pronunciation")
    public ResponseEntity<ApiResponse<AssignmentDto>> createPronunciation(@RequestBody @Valid PronunciationAssignmentRequest request,
                                                                          Authentication authentication) {
        AssignmentDto created = variantService.createPronunciationAssignment(userResolver.resolve(authentication), request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(created, "Pronunciation assignment created successfully"));
    }
}
