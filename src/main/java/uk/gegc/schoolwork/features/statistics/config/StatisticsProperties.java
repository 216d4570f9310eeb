package uk.gegc.schoolwork.features.statistics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Thresholds and retention windows used by the statistics rollups.
 */
@Data
@Component
@ConfigurationProperties(prefix = "schoolwork.statistics")
public class StatisticsProperties {

    /**
     * Students with activity inside this window count as active for class rollups.
     * Default: 7 days
     */
    private int activeWindowDays = 7;

    /**
     * Students below this completion percentage need help.
     */
    private double needsHelpCompletionBelow = 50.0;

    /**
     * Students below this accuracy percentage need help.
     */
    private double needsHelpAccuracyBelow = 60.0;

    /**
     * School snapshots older than this are pruned by the hourly job.
     * Default: 365 days
     */
    private int schoolRetentionDays = 365;

    /**
     * Default window for the school trend endpoint.
     */
    private int defaultTrendDays = 30;
}
