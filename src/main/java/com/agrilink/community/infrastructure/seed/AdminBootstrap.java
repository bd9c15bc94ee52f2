package com.agrilink.community.infrastructure.seed;

import com.agrilink.community.domain.model.User;
import com.agrilink.community.domain.model.User.Role;
import com.agrilink.community.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

/**
 * Creates the first administrator account from configuration.
 * Does nothing unless both an email and a password are configured, or when the account exists.
 *
 * @author AgriLink Team
 */
@Component
public class AdminBootstrap implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(AdminBootstrap.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final String email;
    private final String password;
    private final String name;

    public AdminBootstrap(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            @Value("${agrilink.bootstrap.admin.email:}") String email,
            @Value("${agrilink.bootstrap.admin.password:}") String password,
            @Value("${agrilink.bootstrap.admin.name:Administrator}") String name
    ) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.email = email;
        this.password = password;
        this.name = name;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (email.isBlank() || password.isBlank()) {
            return;
        }
        if (userRepository.existsByEmailIgnoreCase(email)) {
            logger.debug("Bootstrap admin {} already exists", email);
            return;
        }
        User admin = userRepository.save(User.builder()
                .name(name)
                .email(email.trim().toLowerCase(Locale.ROOT))
                .password(passwordEncoder.encode(password))
                .role(Role.ADMIN)
                .build());
        logger.info("Created bootstrap admin account {} (id {})", admin.getEmail(), admin.getId());
    }
}
