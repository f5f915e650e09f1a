package com.intelmonitor.notification;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NotificationConfig {

    @Bean
    @ConditionalOnMissingBean(NotificationDispatcher.class)
    public NotificationDispatcher loggingNotificationDispatcher() {
        return new LoggingNotificationDispatcher();
    }
}
