package com.sessiongate.backend.modules.auth.application;

import com.sessiongate.backend.modules.auth.domain.AppUser;
import com.sessiongate.backend.modules.auth.domain.AuthErrorKind;
import com.sessiongate.backend.modules.auth.domain.AuthResult;
import com.sessiongate.backend.modules.auth.domain.UserIdentity;
import com.sessiongate.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * 계정 등록. 새 계정은 비활성/일반/미인증 상태로 만들어진다.
 */
@Service
public class UserAccountService {

    private static final Logger log = LoggerFactory.getLogger(UserAccountService.class);

    private final AppUserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    public UserAccountService(AppUserRepository userRepository, PasswordEncoder passwordEncoder) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
    }

    public AuthResult<UserIdentity> register(String username, String email, String password) {
        String normalizedUsername = username.trim();
        String normalizedEmail = email.trim();
        try {
            if (userRepository.existsByUsernameIgnoreCase(normalizedUsername)
                    || userRepository.existsByEmailIgnoreCase(normalizedEmail)) {
                return AuthResult.failure(AuthErrorKind.CONFLICT);
            }

            AppUser user = new AppUser();
            user.setUsername(normalizedUsername);
            user.setEmail(normalizedEmail);
            user.setPasswordHash(passwordEncoder.encode(password));
            user.setActive(false);
            user.setSuperuser(false);
            user.setVerified(false);

            AppUser saved = userRepository.saveAndFlush(user);
            log.info("Registered user {} ({})", saved.getUsername(), saved.getId());
            return AuthResult.success(UserIdentity.from(saved));
        } catch (DataIntegrityViolationException ex) {
            // lost a race against a concurrent registration with the same username or email
            log.debug("Registration conflict for {}", normalizedUsername);
            return AuthResult.failure(AuthErrorKind.CONFLICT);
        } catch (DataAccessException ex) {
            log.error("Registration failed for {}", normalizedUsername, ex);
            return AuthResult.failure(AuthErrorKind.STORE_UNAVAILABLE);
        }
    }
}
