package com.eveapi.client.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.eveapi.client.dto.EveApiRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

class JacksonEveApiConfigTest {

    private final ObjectMapper mapper =
            new JacksonEveApiConfig().eveApiObjectMapper(new Jackson2ObjectMapperBuilder());

    @Test
    void mapper_should_write_iso_dates() throws JsonProcessingException {
        assertThat(mapper.writeValueAsString(LocalDateTime.of(2011, 8, 30, 22, 37, 24)))
                .isEqualTo("\"2011-08-30T22:37:24\"");
    }

    @Test
    void mapper_should_ignore_unknown_properties() throws JsonProcessingException {
        EveApiRequest request = mapper.readValue(
                "{\"parameters\": {\"characterID\": \"1\"}, \"format\": \"json\"}", EveApiRequest.class);

        assertThat(request.parametersOrEmpty()).containsEntry("characterID", "1");
        assertThat(request.rawXmlRequested()).isFalse();
    }
}
