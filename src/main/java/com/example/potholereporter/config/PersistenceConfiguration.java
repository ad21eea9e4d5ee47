package com.example.potholereporter.config;

import com.example.potholereporter.service.notification.InMemoryNotificationStore;
import com.example.potholereporter.service.notification.MongoNotificationStore;
import com.example.potholereporter.service.notification.NotificationStore;
import com.example.potholereporter.service.report.InMemoryReportStore;
import com.example.potholereporter.service.report.MongoReportStore;
import com.example.potholereporter.service.report.ReportStore;
import com.example.potholereporter.service.user.InMemoryUserStore;
import com.example.potholereporter.service.user.MongoUserStore;
import com.example.potholereporter.service.user.UserStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Chooses between MongoDB and in-memory stores with
 * {@code pothole.persistence.mode}.
 */
@Configuration
public class PersistenceConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfiguration.class);

    @Configuration
    @ConditionalOnProperty(prefix = "pothole.persistence", name = "mode", havingValue = "mongo", matchIfMissing = true)
    static class MongoStores {

        @Bean
        ReportStore reportStore(MongoTemplate mongoTemplate) {
            log.info("Persisting to MongoDB database {}", mongoTemplate.getDb().getName());
            return new MongoReportStore(mongoTemplate);
        }

        @Bean
        UserStore userStore(MongoTemplate mongoTemplate) {
            return new MongoUserStore(mongoTemplate);
        }

        @Bean
        NotificationStore notificationStore(MongoTemplate mongoTemplate) {
            return new MongoNotificationStore(mongoTemplate);
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "pothole.persistence", name = "mode", havingValue = "memory")
    static class InMemoryStores {

        @Bean
        ReportStore reportStore() {
            log.warn("Using in-memory stores; data is lost on restart");
            return new InMemoryReportStore();
        }

        @Bean
        UserStore userStore() {
            return new InMemoryUserStore();
        }

        @Bean
        NotificationStore notificationStore() {
            return new InMemoryNotificationStore();
        }
    }
}
