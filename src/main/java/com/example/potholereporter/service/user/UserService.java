package com.example.potholereporter.service.user;

import com.example.potholereporter.model.api.LoginRequest;
import com.example.potholereporter.model.api.LoginResponse;
import com.example.potholereporter.model.api.SignupRequest;
import com.example.potholereporter.model.api.UserSummary;
import com.example.potholereporter.model.user.Role;
import com.example.potholereporter.model.user.UserAccount;
import com.example.potholereporter.security.IssuedToken;
import com.example.potholereporter.security.JwtTokenService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserStore userStore;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService tokenService;
    private final Clock clock;

    public UserService(UserStore userStore, PasswordEncoder passwordEncoder, JwtTokenService tokenService, Clock clock) {
        this.userStore = userStore;
        this.passwordEncoder = passwordEncoder;
        this.tokenService = tokenService;
        this.clock = clock;
    }

    public UserSummary signup(SignupRequest request) {
        String email = normalizeEmail(request.email());
        Role role = Role.fromLabel(request.role());
        if (userStore.findByEmail(email).isPresent()) {
            throw new EmailAlreadyRegisteredException(email);
        }
        UserAccount account = new UserAccount(
                UUID.randomUUID().toString(),
                request.name().trim(),
                email,
                passwordEncoder.encode(request.password()),
                role,
                Instant.now(clock));
        UserAccount stored = userStore.insert(account);
        log.info("Registered {} account {}", role.label(), stored.id());
        return UserSummary.of(stored);
    }

    public LoginResponse login(LoginRequest request) {
        UserAccount account = userStore.findByEmail(normalizeEmail(request.email()))
                .filter(candidate -> passwordEncoder.matches(request.password(), candidate.passwordHash()))
                .orElseThrow(InvalidCredentialsException::new);
        IssuedToken token = tokenService.issue(account);
        log.debug("Issued token for user {} valid until {}", account.id(), token.expiresAt());
        return new LoginResponse(token.value(), "Bearer", token.expiresAt(), UserSummary.of(account));
    }

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
