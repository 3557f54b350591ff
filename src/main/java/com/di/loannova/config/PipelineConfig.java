package com.di.loannova.config;

import com.di.loannova.orchestrator.LoggingNotificationSink;
import com.di.loannova.orchestrator.NotificationSink;
import com.di.loannova.resilience.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Infrastructure beans shared by every phase.
 */
@Configuration
public class PipelineConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock pipelineClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(Sleeper.class)
    public Sleeper pipelineSleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    @ConditionalOnMissingBean(NotificationSink.class)
    public NotificationSink notificationSink() {
        return new LoggingNotificationSink();
    }

    /** Mapper for run artifacts: ISO timestamps, pretty-printed, stable key order. */
    public static ObjectMapper artifactMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }
}
