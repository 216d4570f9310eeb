package uk.gegc.schoolwork.features.classroom.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.schoolwork.features.activity.application.ActivityLogService;
import uk.gegc.schoolwork.features.activity.domain.model.ActivityLogType;
import uk.gegc.schoolwork.features.assignment.domain.model.Assignment;
import uk.gegc.schoolwork.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.schoolwork.features.classroom.api.dto.ClassDto;
import uk.gegc.schoolwork.features.classroom.api.dto.ClassMembersRequest;
import uk.gegc.schoolwork.features.classroom.api.dto.CreateClassRequest;
import uk.gegc.schoolwork.features.classroom.application.ClassService;
import uk.gegc.schoolwork.features.classroom.domain.model.SchoolClass;
import uk.gegc.schoolwork.features.classroom.domain.repository.SchoolClassRepository;
import uk.gegc.schoolwork.features.classroom.infra.mapping.ClassMapper;
import uk.gegc.schoolwork.features.statistics.application.StatisticsService;
import uk.gegc.schoolwork.features.statistics.domain.repository.ClassStatsRepository;
import uk.gegc.schoolwork.features.user.domain.model.User;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;
import uk.gegc.schoolwork.features.user.domain.repository.UserRepository;
import uk.gegc.schoolwork.shared.exception.ResourceNotFoundException;
import uk.gegc.schoolwork.shared.exception.ValidationException;
import uk.gegc.schoolwork.shared.security.AccessPolicy;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ClassServiceImpl implements ClassService {

    private final SchoolClassRepository schoolClassRepository;
    private final UserRepository userRepository;
    private final AssignmentRepository assignmentRepository;
    private final ClassStatsRepository classStatsRepository;
    private final StatisticsService statisticsService;
    private final ActivityLogService activityLogService;
    private final ClassMapper classMapper;
    private final AccessPolicy accessPolicy;

    @Override
    @Transactional
    public ClassDto createClass(User currentUser, CreateClassRequest request) {
        accessPolicy.requireAnyRole(currentUser, UserRole.ADMIN);

        SchoolClass schoolClass = new SchoolClass();
        schoolClass.setName(request.name().trim());
        schoolClass.setMembers(new HashSet<>(loadUsers(request.memberIds())));
        SchoolClass saved = schoolClassRepository.save(schoolClass);

        activityLogService.record(ActivityLogType.CLASS_CREATED, currentUser.getId(), null, saved.getId(),
                Map.of("name", saved.getName(), "members", saved.getMembers().size()));
        statisticsService.updateClassStatistics(saved.getId());

        log.info("Class {} '{}' created by {} with {} members",
                saved.getId(), saved.getName(), currentUser.getUsername(), saved.getMembers().size());
        return classMapper.toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public ClassDto getClass(User currentUser, UUID classId) {
        accessPolicy.requireStaff(currentUser);
        return classMapper.toDto(findClass(classId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ClassDto> listClasses(User currentUser) {
        accessPolicy.requireStaff(currentUser);
        return classMapper.toDtoList(schoolClassRepository.findAllByOrderByNameAsc());
    }

    @Override
    @Transactional
    public ClassDto addMembers(User currentUser, UUID classId, ClassMembersRequest request) {
        accessPolicy.requireAnyRole(currentUser, UserRole.ADMIN);
        SchoolClass schoolClass = findClass(classId);

        Set<UUID> affectedStudents = new HashSet<>();
        for (User user : loadUsers(request.userIds())) {
            if (schoolClass.getMembers().add(user) && user.isStudent()) {
                affectedStudents.add(user.getId());
            }
        }
        SchoolClass saved = schoolClassRepository.saveAndFlush(schoolClass);
        refreshAfterMembershipChange(classId, affectedStudents);

        log.info("Added {} member(s) to class {}", request.userIds().size(), classId);
        return classMapper.toDto(saved);
    }

    @Override
    @Transactional
    public ClassDto removeMembers(User currentUser, UUID classId, ClassMembersRequest request) {
        accessPolicy.requireAnyRole(currentUser, UserRole.ADMIN);
        SchoolClass schoolClass = findClass(classId);

        Set<UUID> toRemove = new HashSet<>(request.userIds());
        Set<UUID> affectedStudents = schoolClass.getMembers().stream()
                .filter(member -> toRemove.contains(member.getId()) && member.isStudent())
                .map(User::getId)
                .collect(Collectors.toSet());
        schoolClass.getMembers().removeIf(member -> toRemove.contains(member.getId()));

        SchoolClass saved = schoolClassRepository.saveAndFlush(schoolClass);
        refreshAfterMembershipChange(classId, affectedStudents);

        log.info("Removed {} member(s) from class {}", toRemove.size(), classId);
        return classMapper.toDto(saved);
    }

    @Override
    @Transactional
    public void deleteClass(User currentUser, UUID classId) {
        accessPolicy.requireAnyRole(currentUser, UserRole.ADMIN);
        SchoolClass schoolClass = findClass(classId);

        Set<UUID> studentIds = schoolClass.getMembers().stream()
                .filter(User::isStudent)
                .map(User::getId)
                .collect(Collectors.toSet());
        List<UUID> assignmentIds = assignmentRepository.findIdsByClassId(classId);

        for (Assignment assignment : assignmentRepository.findAllById(assignmentIds)) {
            assignment.getClasses().removeIf(c -> c.getId().equals(classId));
        }
        if (classStatsRepository.existsById(classId)) {
            classStatsRepository.deleteById(classId);
        }
        schoolClassRepository.delete(schoolClass);
        schoolClassRepository.flush();

        assignmentIds.forEach(statisticsService::recalculateAssignment);
        statisticsService.refreshScope(studentIds, List.of());

        log.info("Class {} deleted by {} ({} assignments unlinked)", classId, currentUser.getUsername(), assignmentIds.size());
    }

    /**
     * Scope of every assignment linked to the class changed, so its assignment rows and the
     * touched students' rows are rebuilt before the class row.
     */
    private void refreshAfterMembershipChange(UUID classId, Set<UUID> affectedStudents) {
        if (affectedStudents.isEmpty()) {
            statisticsService.updateClassStatistics(classId);
            return;
        }
        assignmentRepository.findIdsByClassId(classId).forEach(statisticsService::recalculateAssignment);
        statisticsService.refreshScope(affectedStudents, List.of(classId));
    }

    private SchoolClass findClass(UUID classId) {
        return schoolClassRepository.findByIdWithMembers(classId)
                .orElseThrow(() -> new ResourceNotFoundException("Class " + classId + " not found"));
    }

    private List<User> loadUsers(List<UUID> ids) {
        Set<UUID> wanted = new HashSet<>(ids);
        if (wanted.isEmpty()) {
            return List.of();
        }
        List<User> users = userRepository.findAllByIdIn(wanted);
        if (users.size() != wanted.size()) {
            throw new ValidationException("One or more users were not found");
        }
        return users;
    }
}
