package uk.gegc.schoolwork.features.user.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * First administrator account, created at startup when no admin exists yet.
 */
@Data
@Component
@ConfigurationProperties(prefix = "schoolwork.bootstrap-admin")
public class BootstrapAdminProperties {

    private boolean enabled = false;

    private String username = "admin";

    private String email = "admin@school.local";

    /**
     * Required when enabled. Supply it through the environment rather than a committed file.
     */
    private String password;
}
