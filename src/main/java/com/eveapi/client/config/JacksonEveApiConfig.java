package com.eveapi.client.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

@Configuration
public class JacksonEveApiConfig {

    /**
     * The {@link ObjectMapper} used for REST requests and responses.
     * <p>
     * • Built from Boot's {@link Jackson2ObjectMapperBuilder}, so {@code spring.jackson.*}
     * settings apply and unknown request properties are ignored.<br>
     * • Converted results serialize as plain nested JSON objects.<br>
     * • {@code currentTime} / {@code cachedUntil} are written as ISO strings, not arrays.
     *
     * @param builder Boot's pre-configured builder
     * @return ObjectMapper for the REST facade
     */
    @Bean
    public ObjectMapper eveApiObjectMapper(final Jackson2ObjectMapperBuilder builder) {
        return builder
                .modulesToInstall(new JavaTimeModule())
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

}
