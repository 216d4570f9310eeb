package uk.gegc.schoolwork.features.activity.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.schoolwork.features.activity.api.dto.ActivityLogDto;
import uk.gegc.schoolwork.features.activity.api.dto.ActivityLogFilter;
import uk.gegc.schoolwork.features.activity.domain.model.ActivityLog;
import uk.gegc.schoolwork.features.activity.domain.model.ActivityLogType;
import uk.gegc.schoolwork.features.activity.domain.repository.ActivityLogRepository;
import uk.gegc.schoolwork.features.activity.domain.repository.ActivityLogSpecifications;
import uk.gegc.schoolwork.features.activity.infra.mapping.ActivityLogMapper;
import uk.gegc.schoolwork.features.user.domain.model.User;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;
import uk.gegc.schoolwork.features.user.domain.repository.UserRepository;
import uk.gegc.schoolwork.shared.exception.ValidationException;
import uk.gegc.schoolwork.shared.security.AccessPolicy;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Appends audit entries for assignment, class and user lifecycle events, and lets admins page through them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActivityLogService {

    private final ActivityLogRepository activityLogRepository;
    private final UserRepository userRepository;
    private final ActivityLogMapper activityLogMapper;
    private final AccessPolicy accessPolicy;
    private final ObjectMapper objectMapper;

    static final Sort DEFAULT_SORT = Sort.by(Sort.Order.desc("createdAt"));

    @Transactional
    public ActivityLog record(ActivityLogType type, UUID actorId, UUID assignmentId, UUID classId,
                              Map<String, Object> details) {
        ActivityLog entry = new ActivityLog();
        entry.setType(type);
        entry.setActorId(actorId);
        entry.setAssignmentId(assignmentId);
        entry.setClassId(classId);
        entry.setDetails(toJson(details));
        ActivityLog saved = activityLogRepository.save(entry);
        log.debug("Activity {} recorded (actor={}, assignment={}, class={})", type, actorId, assignmentId, classId);
        return saved;
    }

    @Transactional
    public int deleteForAssignment(UUID assignmentId) {
        return activityLogRepository.deleteByAssignmentId(assignmentId);
    }

    /**
     * Newest first unless the page asks for another order. Admins only.
     */
    @Transactional(readOnly = true)
    public Page<ActivityLogDto> search(User currentUser, ActivityLogFilter filter, Pageable pageable) {
        accessPolicy.requireAnyRole(currentUser, UserRole.ADMIN);
        if (filter.from() != null && filter.to() != null && !filter.from().isBefore(filter.to())) {
            throw new ValidationException("'from' must be before 'to'");
        }
        Pageable sorted = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(),
                pageable.getSort().isSorted() ? pageable.getSort() : DEFAULT_SORT);
        Page<ActivityLog> page = activityLogRepository.findAll(ActivityLogSpecifications.matching(filter), sorted);

        Set<UUID> actorIds = page.getContent().stream()
                .map(ActivityLog::getActorId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Map<UUID, String> usernames = actorIds.isEmpty()
                ? Map.of()
                : userRepository.findAllById(actorIds).stream()
                        .collect(Collectors.toMap(User::getId, User::getUsername));
        return page.map(entry -> activityLogMapper.toDto(entry,
                entry.getActorId() != null ? usernames.get(entry.getActorId()) : null));
    }

    private String toJson(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise activity details", e);
        }
    }
}
