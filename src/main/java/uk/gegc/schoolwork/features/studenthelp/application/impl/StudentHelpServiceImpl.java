package uk.gegc.schoolwork.features.studenthelp.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.schoolwork.features.assignment.domain.model.Assignment;
import uk.gegc.schoolwork.features.assignment.domain.repository.AssignmentRepository;
import uk.gegc.schoolwork.features.assignment.domain.repository.QuestionRepository;
import uk.gegc.schoolwork.features.classroom.domain.repository.SchoolClassRepository;
import uk.gegc.schoolwork.features.progress.domain.repository.StudentAssignmentProgressRepository;
import uk.gegc.schoolwork.features.statistics.domain.model.ProgressScoring.Tally;
import uk.gegc.schoolwork.features.studenthelp.api.dto.StudentNeedingHelpDto;
import uk.gegc.schoolwork.features.studenthelp.api.dto.StudentsNeedingHelpDto;
import uk.gegc.schoolwork.features.studenthelp.application.StudentHelpService;
import uk.gegc.schoolwork.features.studenthelp.config.StudentHelpProperties;
import uk.gegc.schoolwork.features.studenthelp.domain.model.HelpAssessment;
import uk.gegc.schoolwork.features.studenthelp.domain.model.HelpAssessment.AssignmentSnapshot;
import uk.gegc.schoolwork.features.studenthelp.domain.model.HelpSeverity;
import uk.gegc.schoolwork.features.studenthelp.domain.model.StudentNeedingHelp;
import uk.gegc.schoolwork.features.studenthelp.domain.repository.StudentNeedingHelpRepository;
import uk.gegc.schoolwork.features.studenthelp.infra.mapping.StudentHelpMapper;
import uk.gegc.schoolwork.features.user.domain.model.User;
import uk.gegc.schoolwork.features.user.domain.repository.UserRepository;
import uk.gegc.schoolwork.shared.exception.ResourceNotFoundException;
import uk.gegc.schoolwork.shared.exception.ValidationException;
import uk.gegc.schoolwork.shared.security.AccessPolicy;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class StudentHelpServiceImpl implements StudentHelpService {

    private final StudentNeedingHelpRepository helpRepository;
    private final AssignmentRepository assignmentRepository;
    private final QuestionRepository questionRepository;
    private final StudentAssignmentProgressRepository progressRepository;
    private final SchoolClassRepository schoolClassRepository;
    private final UserRepository userRepository;
    private final StudentHelpMapper helpMapper;
    private final StudentHelpProperties properties;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Override
    @Transactional
    public RefreshOutcome refreshStudent(UUID studentId) {
        User student = userRepository.findById(studentId)
                .orElseThrow(() -> new ResourceNotFoundException("User " + studentId + " not found"));
        Instant now = Instant.now(clock);

        List<UUID> assignmentIds = assignmentRepository.findActiveIdsInScopeOfStudent(studentId);
        List<Assignment> assignments = assignmentIds.isEmpty()
                ? List.of()
                : assignmentRepository.findAllById(assignmentIds);
        Instant earliestWrongAnswer = assignmentIds.isEmpty()
                ? null
                : progressRepository.findEarliestIncorrectAnswer(studentId, assignmentIds);

        HelpAssessment assessment = HelpAssessment.assess(
                snapshots(studentId, assignments), earliestWrongAnswer, now, properties);
        List<StudentNeedingHelp> open = helpRepository.findByStudent_IdAndResolvedFalseOrderByCreatedAtDesc(studentId);

        if (!assessment.needsHelp()) {
            if (open.isEmpty()) {
                return RefreshOutcome.UNCHANGED;
            }
            open.forEach(record -> record.resolve(now, null));
            log.info("Student {} no longer needs help; closed {} record(s)", studentId, open.size());
            return RefreshOutcome.CLEARED;
        }

        StudentNeedingHelp record;
        if (open.isEmpty()) {
            record = new StudentNeedingHelp();
            record.setStudent(student);
        } else {
            record = open.get(0);
        }
        apply(record, assessment, assignments, now);
        helpRepository.save(record);
        log.debug("Student {} needs help: {} ({} days, {})", studentId, assessment.reasons(),
                record.getDaysNeedingHelp(), record.getSeverity());
        return RefreshOutcome.FLAGGED;
    }

    @Override
    @Transactional(readOnly = true)
    public StudentsNeedingHelpDto listOpen(User currentUser, HelpSeverity severity, UUID classId) {
        accessPolicy.requireStaff(currentUser);
        List<StudentNeedingHelp> records = helpRepository.findOpenWithStudent().stream()
                .filter(record -> record.getStudent().isStudent())
                .filter(record -> severity == null || record.getSeverity() == severity)
                .filter(record -> classId == null || record.getClassIds().contains(classId))
                .toList();
        return new StudentsNeedingHelpDto(
                records.stream().map(helpMapper::toDto).toList(),
                helpMapper.toSummary(records));
    }

    @Override
    @Transactional
    public StudentNeedingHelpDto resolve(User currentUser, UUID recordId, String teacherNotes) {
        accessPolicy.requireStaff(currentUser);
        StudentNeedingHelp record = loadRecord(recordId);
        if (record.isResolved()) {
            throw new ValidationException("Help record is already resolved");
        }
        if (teacherNotes != null) {
            record.setTeacherNotes(teacherNotes);
        }
        record.resolve(Instant.now(clock), currentUser.getId());
        StudentNeedingHelp saved = helpRepository.saveAndFlush(record);
        log.info("Help record {} for student {} resolved by {}", recordId, record.getStudent().getId(),
                currentUser.getUsername());
        return helpMapper.toDto(saved);
    }

    @Override
    @Transactional
    public StudentNeedingHelpDto updateNotes(User currentUser, UUID recordId, String teacherNotes) {
        accessPolicy.requireStaff(currentUser);
        StudentNeedingHelp record = loadRecord(recordId);
        record.setTeacherNotes(teacherNotes);
        return helpMapper.toDto(helpRepository.saveAndFlush(record));
    }

    private StudentNeedingHelp loadRecord(UUID recordId) {
        return helpRepository.findById(recordId)
                .orElseThrow(() -> new ResourceNotFoundException("Help record " + recordId + " not found"));
    }

    private List<AssignmentSnapshot> snapshots(UUID studentId, List<Assignment> assignments) {
        if (assignments.isEmpty()) {
            return List.of();
        }
        List<UUID> ids = assignments.stream().map(Assignment::getId).toList();
        Map<UUID, Long> questionCounts = new HashMap<>();
        for (Object[] row : questionRepository.countByAssignmentIds(ids)) {
            questionCounts.put((UUID) row[0], ((Number) row[1]).longValue());
        }
        Map<UUID, Tally> tallies = progressRepository.tallyByAssignment(studentId).stream()
                .map(Tally::fromRow)
                .collect(Collectors.toMap(Tally::key, tally -> tally));

        List<AssignmentSnapshot> snapshots = new ArrayList<>(assignments.size());
        for (Assignment assignment : assignments) {
            Tally tally = tallies.get(assignment.getId());
            snapshots.add(new AssignmentSnapshot(
                    assignment.getId(),
                    assignment.getDueDate(),
                    questionCounts.getOrDefault(assignment.getId(), 0L),
                    tally != null ? tally.answered() : 0L,
                    tally != null ? tally.correct() : 0L));
        }
        return snapshots;
    }

    /**
     * An open record keeps its earliest start so that severity only escalates while it stays open.
     */
    private void apply(StudentNeedingHelp record, HelpAssessment assessment, List<Assignment> assignments,
                       Instant now) {
        Instant since = assessment.needsHelpSince();
        if (record.getNeedsHelpSince() != null && record.getNeedsHelpSince().isBefore(since)) {
            since = record.getNeedsHelpSince();
        }
        int days = HelpAssessment.daysNeedingHelp(since, now);

        record.setNeedsHelpSince(since);
        record.setDaysNeedingHelp(days);
        record.setSeverity(HelpAssessment.severity(days, properties));
        record.setOverdueAssignments(assessment.overdueAssignments());
        record.setAverageScore(assessment.averageScore());
        record.setCompletionRate(assessment.completionRate());
        record.getReasons().clear();
        record.getReasons().addAll(assessment.reasons());

        Set<UUID> classIds = new HashSet<>(schoolClassRepository.findClassIdsByMember(record.getStudent().getId()));
        record.getClassIds().retainAll(classIds);
        record.getClassIds().addAll(classIds);

        Set<UUID> teacherIds = assignments.stream()
                .map(Assignment::getTeacher)
                .filter(Objects::nonNull)
                .map(User::getId)
                .collect(Collectors.toSet());
        record.getTeacherIds().retainAll(teacherIds);
        record.getTeacherIds().addAll(teacherIds);
    }
}
