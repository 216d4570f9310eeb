package uk.gegc.schoolwork.shared.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the publish and statistics jobs. Disabled with {@code schoolwork.scheduling.enabled=false};
 * the jobs can still be triggered through the admin endpoints.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "schoolwork.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
