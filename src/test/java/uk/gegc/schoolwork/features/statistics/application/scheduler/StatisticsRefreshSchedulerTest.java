package uk.gegc.schoolwork.features.statistics.application.scheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.schoolwork.features.classroom.domain.repository.SchoolClassRepository;
import uk.gegc.schoolwork.features.statistics.api.dto.StatisticsRefreshResult;
import uk.gegc.schoolwork.features.statistics.application.StatisticsService;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;
import uk.gegc.schoolwork.features.user.domain.repository.UserRepository;
import uk.gegc.schoolwork.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StatisticsRefreshScheduler")
class StatisticsRefreshSchedulerTest {

    private static final Instant NOW = Instant.parse("2025-03-10T09:00:00Z");

    @Mock
    private StatisticsService statisticsService;

    @Mock
    private SchoolClassRepository schoolClassRepository;

    @Mock
    private UserRepository userRepository;

    private StatisticsRefreshScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new StatisticsRefreshScheduler(statisticsService, schoolClassRepository, userRepository,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("refreshAll: a failing class is counted and the run carries on")
    void refreshAll_failingClass_skipped() {
        UUID okClass = UUID.randomUUID();
        UUID brokenClass = UUID.randomUUID();
        UUID teacher = UUID.randomUUID();
        when(schoolClassRepository.findAllIds()).thenReturn(List.of(brokenClass, okClass));
        when(statisticsService.updateClassStatistics(brokenClass))
                .thenThrow(new ResourceNotFoundException("Class gone"));
        when(userRepository.findIdsByRole(UserRole.TEACHER)).thenReturn(List.of(teacher));
        when(statisticsService.pruneSchoolStatistics()).thenReturn(2);

        StatisticsRefreshResult result = scheduler.refreshAll();

        assertThat(result.schoolDate()).isEqualTo(LocalDate.of(2025, 3, 10));
        assertThat(result.classesUpdated()).isEqualTo(1);
        assertThat(result.classesFailed()).isEqualTo(1);
        assertThat(result.teachersUpdated()).isEqualTo(1);
        assertThat(result.teachersFailed()).isZero();
        assertThat(result.schoolRowsPruned()).isEqualTo(2);

        InOrder order = inOrder(statisticsService);
        order.verify(statisticsService).updateSchoolStatistics(LocalDate.of(2025, 3, 10));
        order.verify(statisticsService).updateClassStatistics(okClass);
        order.verify(statisticsService).updateTeacherStatistics(teacher);
        order.verify(statisticsService).pruneSchoolStatistics();
    }

    @Test
    @DisplayName("refreshStatistics: an error in the school rollup is logged, not thrown")
    void refreshStatistics_schoolFailure_swallowedByJob() {
        LocalDate today = LocalDate.of(2025, 3, 10);
        when(statisticsService.updateSchoolStatistics(today)).thenThrow(new IllegalStateException("db down"));

        assertThatCode(() -> scheduler.refreshStatistics()).doesNotThrowAnyException();
        verify(statisticsService).updateSchoolStatistics(today);
    }
}
