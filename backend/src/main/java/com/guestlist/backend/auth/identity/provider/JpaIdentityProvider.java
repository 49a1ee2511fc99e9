package com.guestlist.backend.auth.identity.provider;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.guestlist.backend.auth.identity.domain.User;
import com.guestlist.backend.auth.identity.repo.UserRepository;
import com.guestlist.backend.global.ApiException;
import com.guestlist.backend.global.ErrorCode;

import lombok.extern.slf4j.Slf4j;

/**
 * users 테이블 + PasswordEncoder(BCrypt) 기반 IdentityProvider
 */
@Slf4j
@Service
public class JpaIdentityProvider implements IdentityProvider {

    private static final String TIMEOUT = "${app.auth.revocation.timeout-seconds:3}";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    // 없는 이메일로 로그인할 때도 BCrypt 비교 1회를 태워서 응답 시간 차이를 줄인다
    private final String dummyHash;

    public JpaIdentityProvider(UserRepository userRepository, PasswordEncoder passwordEncoder, Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
        this.dummyHash = passwordEncoder.encode("guestlist-dummy-password");
    }

    @Override
    @Transactional(readOnly = true, timeoutString = TIMEOUT)
    public Optional<UserRecord> findById(Long id) {
        if (id == null) return Optional.empty();
        return userRepository.findById(id).map(UserRecord::from);
    }

    @Override
    @Transactional(readOnly = true, timeoutString = TIMEOUT)
    public Optional<UserRecord> validateCredentials(String email, String password) {
        if (email == null || password == null) return Optional.empty();

        Optional<User> user = userRepository.findByEmail(normalizeEmail(email));
        if (user.isEmpty()) {
            passwordEncoder.matches(password, dummyHash);
            return Optional.empty();
        }
        if (!passwordEncoder.matches(password, user.get().getPasswordHash())) {
            return Optional.empty();
        }
        return user.map(UserRecord::from);
    }

    @Override
    @Transactional(timeoutString = TIMEOUT)
    public UserRecord register(String email, String password, String userName) {
        String normalizedEmail = normalizeEmail(email);
        String normalizedName = userName.trim();

        if (userRepository.existsByEmail(normalizedEmail)) {
            throw new ApiException(ErrorCode.EMAIL_ALREADY_EXISTS);
        }
        if (userRepository.existsByUserName(normalizedName)) {
            throw new ApiException(ErrorCode.USERNAME_ALREADY_EXISTS);
        }

        try {
            User saved = userRepository.saveAndFlush(User.create(
                    normalizedEmail,
                    passwordEncoder.encode(password),
                    normalizedName,
                    LocalDateTime.now(clock)));
            log.info("User registered: id={}", saved.getId());
            return UserRecord.from(saved);
        } catch (DataIntegrityViolationException e) {
            // exists 체크와 insert 사이에 다른 가입이 끼어든 경우 (unique 제약 위반)
            log.info("Concurrent signup conflict for email {}", normalizedEmail);
            throw new ApiException(ErrorCode.EMAIL_ALREADY_EXISTS);
        }
    }

    static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
