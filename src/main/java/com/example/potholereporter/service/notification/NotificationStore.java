package com.example.potholereporter.service.notification;

import com.example.potholereporter.model.notification.Notification;

import java.util.List;

public interface NotificationStore {

    Notification save(Notification notification);

    /**
     * @return newest notifications first, at most {@code limit}
     */
    List<Notification> findLatest(int limit);
}
