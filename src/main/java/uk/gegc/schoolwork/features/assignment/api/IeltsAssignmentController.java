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
import uk.gegc.schoolwork.features.assignment.api.dto.IeltsPronunciationRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.IeltsQuestionAndAnswerRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.IeltsReadingRequest;
import uk.gegc.schoolwork.features.assignment.application.AssignmentVariantService;
import uk.gegc.schoolwork.shared.api.dto.ApiResponse;
import uk.gegc.schoolwork.shared.security.AuthenticatedUserResolver;

@Tag(name = "IELTS assignments", description = "IELTS speaking, pronunciation and reading assignments.")
@RestController
@RequestMapping("/api/ielts")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('TEACHER','ADMIN')")
public class IeltsAssignmentController {

    private final AssignmentVariantService variantService;
    private final AuthenticatedUserResolver userResolver;

    @Operation(summary = "Create an IELTS question and answer assignment")
    @PostMapping("/question-and-answer")
    public ResponseEntity<ApiResponse<AssignmentDto>> createQuestionAndAnswer(@RequestBody @Valid IeltsQuestionAndAnswerRequest request,
                                                                              Authentication authentication) {
        AssignmentDto created = variantService.createIeltsQuestionAndAnswer(userResolver.resolve(authentication), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(created));
    }

    @Operation(summary = "Create an IELTS pronunciation assignment")
    @PostMapping("/pronunciation")
    public ResponseEntity<ApiResponse<AssignmentDto>> createPronunciation(@RequestBody @Valid IeltsPronunciationRequest request,
                                                                          Authentication authentication) {
        AssignmentDto created = variantService.createIeltsPronunciation(userResolver.resolve(authentication), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(created));
    }

    @Operation(summary = "Create an IELTS reading assignment")
    @PostMapping("/reading")
    public ResponseEntity<ApiResponse<AssignmentDto>> createReading(@RequestBody @Valid IeltsReadingRequest request,
                                                                    Authentication authentication) {
        AssignmentDto created = variantService.createIeltsReading(userResolver.resolve(authentication), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(created));
    }
}
