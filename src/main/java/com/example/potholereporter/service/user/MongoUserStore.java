package com.example.potholereporter.service.user;

import com.example.potholereporter.model.user.UserAccount;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.Optional;

/**
 * Relies on the unique index on {@code users.email} to reject duplicates.
 */
public class MongoUserStore implements UserStore {

    private final MongoTemplate mongoTemplate;

    public MongoUserStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public UserAccount insert(UserAccount account) {
        try {
            return mongoTemplate.insert(account);
        } catch (DuplicateKeyException ex) {
            throw new EmailAlreadyRegisteredException(account.email());
        }
    }

    @Override
    public Optional<UserAccount> findByEmail(String email) {
        Query query = Query.query(Criteria.where(UserAccount.FIELD_EMAIL).is(email));
        return Optional.ofNullable(mongoTemplate.findOne(query, UserAccount.class));
    }
}
