package uk.gegc.schoolwork.features.statistics.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.schoolwork.features.classroom.domain.repository.SchoolClassRepository;
import uk.gegc.schoolwork.features.statistics.api.dto.StatisticsRefreshResult;
import uk.gegc.schoolwork.features.statistics.application.StatisticsService;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;
import uk.gegc.schoolwork.features.user.domain.repository.UserRepository;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Periodic rebuild of the school, class and teacher rollups, followed by pruning of old school rows.
 * Every class and teacher is refreshed in its own transaction; one failure is logged and skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StatisticsRefreshScheduler {

    private final StatisticsService statisticsService;
    private final SchoolClassRepository schoolClassRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    @Scheduled(cron = "${schoolwork.scheduling.statistics-cron:0 0 * * * *}")
    public void refreshStatistics() {
        log.debug("Running scheduled statistics refresh");
        try {
            refreshAll();
        } catch (Exception e) {
            log.error("Error during scheduled statistics refresh", e);
        }
    }

    public StatisticsRefreshResult refreshAll() {
        LocalDate today = LocalDate.now(clock);
        statisticsService.updateSchoolStatistics(today);

        int classesUpdated = 0;
        int classesFailed = 0;
        for (UUID classId : schoolClassRepository.findAllIds()) {
            try {
                statisticsService.updateClassStatistics(classId);
                classesUpdated++;
            } catch (Exception e) {
                classesFailed++;
                log.warn("Failed to refresh statistics for class {}", classId, e);
            }
        }

        int teachersUpdated = 0;
        int teachersFailed = 0;
        for (UUID teacherId : userRepository.findIdsByRole(UserRole.TEACHER)) {
            try {
                statisticsService.updateTeacherStatistics(teacherId);
                teachersUpdated++;
            } catch (Exception e) {
                teachersFailed++;
                log.warn("Failed to refresh statistics for teacher {}", teacherId, e);
            }
        }

        int pruned = statisticsService.pruneSchoolStatistics();

        StatisticsRefreshResult result = new StatisticsRefreshResult(
                today, classesUpdated, classesFailed, teachersUpdated, teachersFailed, pruned);
        log.info("Statistics refresh finished: {}", result);
        return result;
    }
}
