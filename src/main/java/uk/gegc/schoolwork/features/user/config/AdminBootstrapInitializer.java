package uk.gegc.schoolwork.features.user.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.schoolwork.features.user.domain.model.User;
import uk.gegc.schoolwork.features.user.domain.model.UserRole;
import uk.gegc.schoolwork.features.user.domain.repository.UserRepository;

/**
 * Seeds the first admin so a fresh deployment can sign in. Does nothing once any admin exists.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "schoolwork.bootstrap-admin", name = "enabled", havingValue = "true")
public class AdminBootstrapInitializer implements CommandLineRunner {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final BootstrapAdminProperties properties;

    @Override
    @Transactional
    public void run(String... args) {
        if (userRepository.countByRole(UserRole.ADMIN) > 0) {
            log.debug("Admin account already present; skipping bootstrap");
            return;
        }
        if (properties.getPassword() == null || properties.getPassword().isBlank()) {
            throw new IllegalStateException("schoolwork.bootstrap-admin.password must be set to create the first admin");
        }
        if (userRepository.existsByUsername(properties.getUsername())
                || userRepository.existsByEmail(properties.getEmail())) {
            throw new IllegalStateException("Cannot bootstrap admin '" + properties.getUsername()
                    + "': username or e-mail already belongs to a non-admin account");
        }

        User admin = new User();
        admin.setUsername(properties.getUsername());
        admin.setEmail(properties.getEmail());
        admin.setHashedPassword(passwordEncoder.encode(properties.getPassword()));
        admin.setRole(UserRole.ADMIN);
        admin.setConfirmed(true);
        userRepository.save(admin);

        log.info("Bootstrapped admin account '{}'", admin.getUsername());
    }
}
