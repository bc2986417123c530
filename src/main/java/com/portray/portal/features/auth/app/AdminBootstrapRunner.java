package com.portray.portal.features.auth.app;

import com.portray.portal.common.config.PortalProperties;
import com.portray.portal.common.security.UserRole;
import com.portray.portal.features.auth.domain.User;
import com.portray.portal.features.auth.domain.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the configured SystemAdmin account once, if it does not exist yet.
 * An existing account with that email is left untouched.
 */
@Component
public class AdminBootstrapRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminBootstrapRunner.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final PortalProperties.BootstrapAdmin settings;

    public AdminBootstrapRunner(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            PortalProperties properties) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.settings = properties.getBootstrapAdmin();
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (!settings.isConfigured()) {
            log.info("No bootstrap admin configured; skipping seed");
            return;
        }
        if (userRepository.existsByEmail(settings.getEmail())) {
            log.debug("Bootstrap admin {} already present", settings.getEmail());
            return;
        }

        User admin = new User(
                User.newId(),
                settings.getEmail(),
                passwordEncoder.encode(settings.getPassword()),
                settings.getFirstName(),
                settings.getLastName(),
                UserRole.SYSTEM_ADMIN);
        userRepository.save(admin);
        log.info("Seeded bootstrap SystemAdmin {} ({})", admin.getEmail(), admin.getUserId());
    }
}
