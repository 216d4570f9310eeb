package uk.gegc.schoolwork.shared.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups, one per feature area.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi assignmentsGroup() {
        return GroupedOpenApi.builder()
                .group("assignments")
                .displayName("Assignments & Progress")
                .pathsToMatch("/api/assignments/**", "/api/ielts/**")
                .build();
    }

    @Bean
    public GroupedOpenApi classesGroup() {
        return GroupedOpenApi.builder()
                .group("classes")
                .displayName("Classes")
                .pathsToMatch("/api/classes/**")
                .build();
    }

    @Bean
    public GroupedOpenApi statisticsGroup() {
        return GroupedOpenApi.builder()
                .group("statistics")
                .displayName("Statistics")
                .pathsToMatch("/api/statistics/**", "/api/students-needing-help/**")
                .build();
    }

    @Bean
    public GroupedOpenApi adminGroup() {
        return GroupedOpenApi.builder()
                .group("admin")
                .displayName("Administration")
                .pathsToMatch("/api/admin/**", "/api/activity-logs/**")
                .build();
    }

    @Bean
    public GroupedOpenApi usersGroup() {
        return GroupedOpenApi.builder()
                .group("users")
                .displayName("Users")
                .pathsToMatch("/api/users/**")
                .build();
    }
}
