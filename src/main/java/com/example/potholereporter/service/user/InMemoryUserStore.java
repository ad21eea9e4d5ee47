package com.example.potholereporter.service.user;

import com.example.potholereporter.model.user.UserAccount;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps accounts keyed by e-mail so uniqueness is enforced by
 * {@link ConcurrentHashMap#putIfAbsent}.
 */
public class InMemoryUserStore implements UserStore {

    private final Map<String, UserAccount> byEmail = new ConcurrentHashMap<>();

    @Override
    public UserAccount insert(UserAccount account) {
        if (byEmail.putIfAbsent(account.email(), account) != null) {
            throw new EmailAlreadyRegisteredException(account.email());
        }
        return account;
    }

    @Override
    public Optional<UserAccount> findByEmail(String email) {
        return Optional.ofNullable(byEmail.get(email));
    }
}
