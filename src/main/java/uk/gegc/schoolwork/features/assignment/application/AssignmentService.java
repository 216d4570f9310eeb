package uk.gegc.schoolwork.features.assignment.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.schoolwork.features.assignment.api.dto.AssignmentDto;
import uk.gegc.schoolwork.features.assignment.api.dto.AssignmentSearchCriteria;
import uk.gegc.schoolwork.features.assignment.api.dto.CreateAssignmentRequest;
import uk.gegc.schoolwork.features.assignment.api.dto.UpdateAssignmentRequest;
import uk.gegc.schoolwork.features.user.domain.model.User;

import java.util.List;
import java.util.UUID;

public interface AssignmentService {

    /**
     * Persists the assignment with its questions, evaluation settings and scope links, then
     * seeds the statistics rollups. Teachers and admins only.
     */
    AssignmentDto createAssignment(User currentUser, CreateAssignmentRequest request);

    AssignmentDto getAssignment(User currentUser, UUID assignmentId);

    AssignmentDto updateAssignment(User currentUser, UUID assignmentId, UpdateAssignmentRequest request);

    void deleteAssignment(User currentUser, UUID assignmentId);

    /**
     * Teachers see their own assignments, students the active ones in their scope, admins all of them.
     */
    Page<AssignmentDto> listAssignments(User currentUser, AssignmentSearchCriteria criteria, Pageable pageable);

    /**
     * @param status {@code active} (default), {@code scheduled} or {@code all}
     */
    List<AssignmentDto> getMyAssignments(User currentUser, String status);
}
