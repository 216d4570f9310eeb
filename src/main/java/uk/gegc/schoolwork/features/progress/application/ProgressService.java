package uk.gegc.schoolwork.features.progress.application;

import uk.gegc.schoolwork.features.progress.api.dto.ProgressDto;
import uk.gegc.schoolwork.features.progress.api.dto.ProgressReportDto;
import uk.gegc.schoolwork.features.progress.api.dto.SubmitProgressRequest;
import uk.gegc.schoolwork.features.user.domain.model.User;

import java.util.List;
import java.util.UUID;

public interface ProgressService {

    /**
     * Upserts the student's answer and runs the statistics cascade in the same transaction.
     * Only students in the assignment's scope may submit.
     */
    ProgressDto submitProgress(User currentUser, UUID assignmentId, SubmitProgressRequest request);

    /**
     * Stored answers of one student, in question order. {@code studentId} defaults to the caller;
     * non-staff callers may only read their own rows.
     */
    List<ProgressDto> getAssignmentProgress(User currentUser, UUID assignmentId, UUID studentId);

    ProgressReportDto getProgressReport(User currentUser, UUID assignmentId);
}
