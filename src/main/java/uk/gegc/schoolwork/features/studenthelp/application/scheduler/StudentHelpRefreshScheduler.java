package uk.gegc.schoolwork.features.studenthelp.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.schoolwork.features.studenthelp.api.dto.StudentHelpRefreshResult;
import uk.gegc.schoolwork.features.studenthelp.application.StudentHelpService;
import uk.gegc.schoolwork.features.studenthelp.application.StudentHelpService.RefreshOutcome;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;
import uk.gegc.schoolwork.features.user.domain.repository.UserRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Re-judges every student and keeps their help records current.
 * Each student runs in its own transaction; a failure is logged and skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StudentHelpRefreshScheduler {

    private final StudentHelpService studentHelpService;
    private final UserRepository userRepository;
    private final Clock clock;

    @Scheduled(cron = "${schoolwork.scheduling.student-help-cron:0 30 * * * *}")
    public void refreshStudentsNeedingHelp() {
        log.debug("Running scheduled students-needing-help refresh");
        try {
            refreshAll();
        } catch (Exception e) {
            log.error("Error during scheduled students-needing-help refresh", e);
        }
    }

    public StudentHelpRefreshResult refreshAll() {
        List<UUID> studentIds = userRepository.findIdsByRole(UserRole.STUDENT);
        int flagged = 0;
        int cleared = 0;
        int failed = 0;
        for (UUID studentId : studentIds) {
            try {
                RefreshOutcome outcome = studentHelpService.refreshStudent(studentId);
                if (outcome == RefreshOutcome.FLAGGED) {
                    flagged++;
                } else if (outcome == RefreshOutcome.CLEARED) {
                    cleared++;
                }
            } catch (Exception e) {
                failed++;
                log.warn("Failed to refresh help status for student {}", studentId, e);
            }
        }
        StudentHelpRefreshResult result = new StudentHelpRefreshResult(
                studentIds.size(), flagged, cleared, failed, Instant.now(clock));
        log.info("Students-needing-help refresh finished: {}", result);
        return result;
    }
}
