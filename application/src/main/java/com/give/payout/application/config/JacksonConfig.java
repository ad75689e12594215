package com.give.payout.application.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.math.BigInteger;

/**
 * Shared ObjectMapper for REST payloads, Kafka messages and share book snapshots
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return create();
    }

    /**
     * Also used directly by components built outside the Spring context (tests)
     */
    public static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper();

        // older vault events may carry fields we no longer read
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        // token amounts exceed the precision of JSON number consumers, write them as strings
        SimpleModule amounts = new SimpleModule("payout-amounts");
        amounts.addSerializer(BigInteger.class, ToStringSerializer.instance);
        mapper.registerModule(amounts);

        return mapper;
    }
}
