package uk.gegc.schoolwork.features.classroom.application;

import uk.gegc.schoolwork.features.classroom.api.dto.ClassDto;
import uk.gegc.schoolwork.features.classroom.api.dto.ClassMembersRequest;
import uk.gegc.schoolwork.features.classroom.api.dto.CreateClassRequest;
import uk.gegc.schoolwork.features.user.domain.model.User;

import java.util.List;
import java.util.UUID;

/**
 * Class administration. Admins manage classes and membership; teachers may read them.
 * Membership changes refresh the affected student, assignment and class rollups.
 */
public interface ClassService {

    ClassDto createClass(User currentUser, CreateClassRequest request);

    ClassDto getClass(User currentUser, UUID classId);

    List<ClassDto> listClasses(User currentUser);

    ClassDto addMembers(User currentUser, UUID classId, ClassMembersRequest request);

    ClassDto removeMembers(User currentUser, UUID classId, ClassMembersRequest request);

    void deleteClass(User currentUser, UUID classId);
}
