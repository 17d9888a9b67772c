package com.HRPayMaster.hr_backend.config;

import com.HRPayMaster.hr_backend.enums.Role;
import com.HRPayMaster.hr_backend.model.User;
import com.HRPayMaster.hr_backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class DataInitializer {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final DefaultAdminConfig defaultAdminConfig;

    @Bean
    CommandLineRunner initDatabase() {
        return args -> {
            if (!defaultAdminConfig.isEnabled()) {
                log.info("Default admin bootstrap disabled");
                return;
            }
            createOrUpdateDefaultAdmin();
        };
    }

    private void createOrUpdateDefaultAdmin() {
        String email = defaultAdminConfig.getEmail();
        String rawPassword = defaultAdminConfig.getPassword();

        userRepository.findByEmail(email).ifPresentOrElse(
                existingUser -> {
                    if (!passwordEncoder.matches(rawPassword, existingUser.getPassword())) {
                        existingUser.setPassword(passwordEncoder.encode(rawPassword));
                        existingUser.setActive(true);
                        userRepository.save(existingUser);
                        log.info("Admin password reset for {}", email);
                    } else {
                        log.info("Admin user {} already exists", email);
                    }
                },
                () -> {
                    User admin = User.builder()
                            .name(defaultAdminConfig.getName())
                            .email(email)
                            .password(passwordEncoder.encode(rawPassword))
                            .role(Role.ADMIN)
                            .phone(defaultAdminConfig.getPhone())
                            .active(true)
                            .build();

                    userRepository.save(admin);
                    log.info("Default admin user created: {}", email);
                }
        );
    }
}
