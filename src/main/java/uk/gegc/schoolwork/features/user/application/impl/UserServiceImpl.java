package uk.gegc.schoolwork.features.user.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.schoolwork.features.activity.application.ActivityLogService;
import uk.gegc.schoolwork.features.activity.domain.model.ActivityLogType;
import uk.gegc.schoolwork.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.schoolwork.features.classroom.domain.repository.SchoolClassRepository;
import uk.gegc.schoolwork.features.statistics.application.StatisticsService;
import uk.gegc.schoolwork.features.user.api.dto.CreateUserRequest;
import uk.gegc.schoolwork.features.user.api.dto.UpdateUserRequest;
import uk.gegc.schoolwork.features.user.api.dto.UserDto;
import uk.gegc.schoolwork.features.user.application.UserService;
import uk.gegc.schoolwork.features.user.domain.model.User;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;
import uk.gegc.schoolwork.features.user.domain.repository.UserRepository;
import uk.gegc.schoolwork.features.user.domain.repository.UserSpecifications;
import uk.gegc.schoolwork.features.user.infra.mapping.UserMapper;
import uk.gegc.schoolwork.shared.exception.ResourceNotFoundException;
import uk.gegc.schoolwork.shared.exception.ValidationException;
import uk.gegc.schoolwork.shared.security.AccessPolicy;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserService {

    static final Sort DEFAULT_SORT = Sort.by(Sort.Order.desc("createdAt"));

    private final UserRepository userRepository;
    private final SchoolClassRepository schoolClassRepository;
    private final AssignmentRepository assignmentRepository;
    private final StatisticsService statisticsService;
    private final ActivityLogService activityLogService;
    private final PasswordEncoder passwordEncoder;
    private final UserMapper userMapper;
    private final AccessPolicy accessPolicy;

    @Override
    @Transactional(readOnly = true)
    public Page<UserDto> listUsers(User currentUser, UserRole role, String search, UUID classId, Pageable pageable) {
        accessPolicy.requireStaff(currentUser);
        Pageable sorted = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(),
                pageable.getSort().isSorted() ? pageable.getSort() : DEFAULT_SORT);
        return userRepository.findAll(UserSpecifications.filter(role, search, classId), sorted)
                .map(userMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<UserRole, Long> countByRole(User currentUser) {
        accessPolicy.requireStaff(currentUser);
        Map<UserRole, Long> counts = new EnumMap<>(UserRole.class);
        for (UserRole role : UserRole.values()) {
            counts.put(role, userRepository.countByRole(role));
        }
        return counts;
    }

    @Override
    @Transactional(readOnly = true)
    public UserDto getUser(User currentUser, UUID userId) {
        accessPolicy.requireSelfOrStaff(currentUser, userId);
        return userMapper.toDto(findUser(userId));
    }

    @Override
    @Transactional
    public UserDto createUser(User currentUser, CreateUserRequest request) {
        accessPolicy.requireAnyRole(currentUser, UserRole.ADMIN);

        String username = request.username().trim();
        String email = request.email().trim();
        if (userRepository.existsByUsername(username)) {
            throw new ValidationException("Username already exists");
        }
        if (userRepository.existsByEmail(email)) {
            throw new ValidationException("Email already exists");
        }

        User user = new User();
        user.setUsername(username);
        user.setEmail(email);
        user.setHashedPassword(passwordEncoder.encode(request.password()));
        user.setRole(request.role());
        user.setConfirmed(true);
        User saved = userRepository.save(user);

        activityLogService.record(creationType(saved.getRole()), currentUser.getId(), null, null,
                Map.of("userId", saved.getId().toString(), "username", saved.getUsername(),
                        "role", saved.getRole().name()));

        log.info("User {} ({}) created by {}", saved.getUsername(), saved.getRole(), currentUser.getUsername());
        return userMapper.toDto(saved);
    }

    @Override
    @Transactional
    public UserDto updateUser(User currentUser, UUID userId, UpdateUserRequest request) {
        accessPolicy.requireAnyRole(currentUser, UserRole.ADMIN);
        User user = findUser(userId);
        boolean self = user.getId().equals(currentUser.getId());

        if (request.username() != null) {
            String username = request.username().trim();
            if (userRepository.existsByUsernameAndIdNot(username, userId)) {
                throw new ValidationException("Username already exists");
            }
            user.setUsername(username);
        }
        if (request.email() != null) {
            String email = request.email().trim();
            if (userRepository.existsByEmailAndIdNot(email, userId)) {
                throw new ValidationException("Email already exists");
            }
            user.setEmail(email);
        }
        if (request.password() != null) {
            user.setHashedPassword(passwordEncoder.encode(request.password()));
        }
        if (request.confirmed() != null) {
            user.setConfirmed(request.confirmed());
        }
        if (request.blocked() != null) {
            if (self && request.blocked()) {
                throw new ValidationException("Cannot block your own account");
            }
            user.setBlocked(request.blocked());
        }

        UserRole previousRole = user.getRole();
        boolean roleChanged = request.role() != null && request.role() != previousRole;
        if (roleChanged && self) {
            throw new ValidationException("Cannot change your own role");
        }

        if (!roleChanged) {
            return userMapper.toDto(userRepository.save(user));
        }

        List<UUID> assignmentIds = assignmentRepository.findIdsInScopeOfUser(userId);
        List<UUID> classIds = schoolClassRepository.findClassIdsByMember(userId);
        user.setRole(request.role());
        User saved = userRepository.saveAndFlush(user);

        assignmentIds.forEach(statisticsService::recalculateAssignment);
        if (saved.isStudent()) {
            statisticsService.refreshScope(Set.of(userId), classIds);
        } else {
            if (previousRole == UserRole.STUDENT) {
                statisticsService.deleteStudentStatistics(userId);
            }
            statisticsService.refreshScope(Set.of(), classIds);
        }

        log.info("User {} role changed {} -> {} by {}", saved.getUsername(), previousRole, saved.getRole(),
                currentUser.getUsername());
        return userMapper.toDto(saved);
    }

    @Override
    @Transactional
    public void deleteUser(User currentUser, UUID userId) {
        accessPolicy.requireAnyRole(currentUser, UserRole.ADMIN);
        if (userId.equals(currentUser.getId())) {
            throw new ValidationException("Cannot delete your own account");
        }
        User user = findUser(userId);

        List<UUID> assignmentIds = user.isStudent() ? assignmentRepository.findIdsInScopeOfUser(userId) : List.of();
        List<UUID> classIds = schoolClassRepository.findClassIdsByMember(userId);

        userRepository.delete(user);
        userRepository.flush();

        assignmentIds.forEach(statisticsService::recalculateAssignment);
        statisticsService.refreshScope(Set.of(), classIds);

        log.info("User {} ({}) deleted by {}", user.getUsername(), user.getRole(), currentUser.getUsername());
    }

    private User findUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User " + userId + " not found"));
    }

    private static ActivityLogType creationType(UserRole role) {
        return switch (role) {
            case STUDENT -> ActivityLogType.STUDENT_CREATED;
            case TEACHER -> ActivityLogType.TEACHER_CREATED;
            default -> ActivityLogType.USER_CREATED;
        };
    }
}
