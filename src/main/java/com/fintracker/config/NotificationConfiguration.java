package com.fintracker.config;

import com.fintracker.infrastructure.notification.LoggingNotificationScheduler;
import com.fintracker.infrastructure.notification.NotificationScheduler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NotificationConfiguration {

    @Bean
    @ConditionalOnMissingBean(NotificationScheduler.class)
    public NotificationScheduler notificationScheduler() {
        return new LoggingNotificationScheduler();
    }
}
