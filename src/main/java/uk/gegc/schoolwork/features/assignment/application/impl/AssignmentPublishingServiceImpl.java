package uk.gegc.schoolwork.features.assignment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.schoolwork.features.activity.application.ActivityLogService;
import uk.gegc.schoolwork.features.activity.domain.model.ActivityLogType;
import uk.gegc.schoolwork.features.assignment.application.AssignmentPublishingService;
import uk.gegc.schoolwork.features.assignment.application.AssignmentScopeResolver;
import uk.gegc.schoolwork.features.assignment.domain.model.Assignment;
import uk.gegc.schoolwork.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.schoolwork.features.classroom.domain.model.SchoolClass;
import uk.gegc.schoolwork.features.statistics.application.StatisticsService;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AssignmentPublishingServiceImpl implements AssignmentPublishingService {

    private final AssignmentRepository assignmentRepository;
    private final AssignmentScopeResolver scopeResolver;
    private final ActivityLogService activityLogService;
    private final StatisticsService statisticsService;
    private final Clock clock;

    @Override
    @Transactional
    public int publishDueAssignments() {
        Instant now = clock.instant();
        List<Assignment> due = assignmentRepository.findDueForPublishing(now);
        if (due.isEmpty()) {
            return 0;
        }

        Set<UUID> studentIds = new HashSet<>();
        Set<UUID> classIds = new HashSet<>();
        Set<UUID> teacherIds = new HashSet<>();

        for (Assignment assignment : due) {
            assignment.setActive(true);
            assignmentRepository.save(assignment);

            UUID teacherId = assignment.getTeacher() != null ? assignment.getTeacher().getId() : null;
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("topic", assignment.getTopic());
            details.put("scheduledPublishAt", String.valueOf(assignment.getScheduledPublishAt()));
            activityLogService.record(ActivityLogType.ASSIGNMENT_ACTIVATED, teacherId, assignment.getId(), null, details);

            studentIds.addAll(scopeResolver.studentIds(assignment.getId()));
            assignment.getClasses().stream().map(SchoolClass::getId).forEach(classIds::add);
            if (teacherId != null) {
                teacherIds.add(teacherId);
            }
            log.info("Activated scheduled assignment {} '{}' (scheduled for {})",
                    assignment.getId(), assignment.getTopic(), assignment.getScheduledPublishAt());
        }

        statisticsService.refreshScope(studentIds, classIds);
        teacherIds.forEach(statisticsService::updateTeacherStatistics);

        return due.size();
    }
}
