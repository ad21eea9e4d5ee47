package com.example.potholereporter.service.notification;

import com.example.potholereporter.model.notification.Notification;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;

public class MongoNotificationStore implements NotificationStore {

    private final MongoTemplate mongoTemplate;

    public MongoNotificationStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Notification save(Notification notification) {
        return mongoTemplate.insert(notification);
    }

    @Override
    public List<Notification> findLatest(int limit) {
        Query query = new Query()
                .with(Sort.by(Sort.Direction.DESC, Notification.FIELD_CREATED_AT))
                .limit(limit);
        return mongoTemplate.find(query, Notification.class);
    }
}
