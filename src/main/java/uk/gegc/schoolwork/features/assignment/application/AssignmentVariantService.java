package uk.gegc.schoolwork.features.assignment.application;

import uk.gegc.schoolwork.features.assignment.api.dto.AssignmentDto;
import uk.gegc.schoolwork.features.assignment.api.dto.IeltsPronunciationRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.IeltsQuestionAndAnswerRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.IeltsReadingRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.PronunciationAssignmentRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.ReadingAssignmentRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.VideoAssignmentRequest;
import uk.gegc.schoolwork.features.user.domain.model.User;

/**
 * Typed factories for the assignment kinds the UI offers. Each one fills in the evaluation settings
 * and defaults of its kind and then goes through {@link AssignmentService#createAssignment}.
 */
public interface AssignmentVariantService {

    AssignmentDto createVideoAssignment(User currentUser, VideoAssignmentRequest request);

    AssignmentDto createReadingAssignment(User currentUser, ReadingAssignmentRequest request);

    AssignmentDto createPronunciationAssignment(User currentUser, PronunciationAssignmentRequest request);

    AssignmentDto createIeltsQuestionAndAnswer(User currentUser, IeltsQuestionAndAnswerRequest request);

    AssignmentDto createIeltsPronunciation(User currentUser, IeltsPronunciationRequest request);

    AssignmentDto createIeltsReading(User currentUser, IeltsReadingRequest request);
}
