package uk.gegc.schoolwork.features.assignment.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.schoolwork.features.assignment.application.AssignmentPublishingService;

/**
 * Publishes scheduled assignments once their publish time has passed.
 * The cron is configurable via schoolwork.scheduling.publish-cron (default: every minute).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduledAssignmentPublisher {

    private final AssignmentPublishingService publishingService;

    @Scheduled(cron = "${schoolwork.scheduling.publish-cron:0 * * * * *}")
    public void publishScheduledAssignments() {
        log.debug("Checking for scheduled assignments to publish");
        try {
            int activated = publishingService.publishDueAssignments();
            if (activated > 0) {
                log.info("Published {} scheduled assignment(s)", activated);
            }
        } catch (Exception e) {
            log.error("Error while publishing scheduled assignments", e);
        }
    }
}
