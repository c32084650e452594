package com.summaryplatform.engine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

@Configuration
public class EngineConfig {

    @Value("${summarization.time-zone:UTC}")
    private String timeZone;

    /**
     * Zone in which timestamps are mapped to calendar days (weekday/weekend split,
     * synthetic series).
     */
    @Bean
    public ZoneId summarizationZone() {
        return ZoneId.of(timeZone);
    }

    /**
     * Request bodies may carry fields this service does not know.
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
