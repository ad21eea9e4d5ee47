package com.example.potholereporter.service.user;

import com.example.potholereporter.model.user.UserAccount;

import java.util.Optional;

public interface UserStore {

    /**
     * @throws EmailAlreadyRegisteredException if another account uses the same e-mail
     */
    UserAccount insert(UserAccount account);

    Optional<UserAccount> findByEmail(String email);
}
