package com.eveapi.client.service.core;

import static org.assertj.core.api.Assertions.assertThat;

import com.eveapi.client.parser.EveApiDocumentConverter;
import com.eveapi.client.parser.ResultValue;
import com.eveapi.client.parser.XmlDocumentReader;
import com.eveapi.client.parser.XmlFixtures;
import java.time.Duration;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class EveApiResponseTest {

    @Test
    void times_should_be_read_from_envelope() {
        ResultValue.Node result = new EveApiDocumentConverter()
                .convert(new XmlDocumentReader().read(XmlFixtures.read("server-status.xml")));
        EveApiResponse response = new EveApiResponse(EveApiMethods.SERVER_STATUS, result, null);

        LocalDateTime current = response.currentTime().orElseThrow();
        LocalDateTime cached = response.cachedUntil().orElseThrow();

        assertThat(Duration.between(current, cached)).isEqualTo(Duration.ofSeconds(70));
        assertThat(response.rawXmlIfPresent()).isEmpty();
    }

    @Test
    void times_should_be_empty_without_envelope() {
        EveApiResponse response = new EveApiResponse(EveApiMethods.SERVER_STATUS, ResultValue.Node.empty(), "<x/>");

        assertThat(response.currentTime()).isEmpty();
        assertThat(response.cachedUntil()).isEmpty();
        assertThat(response.rawXmlIfPresent()).contains("<x/>");
    }

    @Test
    void times_should_be_empty_when_unreadable() {
        ResultValue.Node result = XmlFixtures.node("eveapi", XmlFixtures.node(
                "currentTime", XmlFixtures.node("text", "2011-08-30"),
                "cachedUntil", XmlFixtures.node("text", "soon")));
        EveApiResponse response = new EveApiResponse(EveApiMethods.SERVER_STATUS, result, null);

        assertThat(response.currentTime()).isEmpty();
        assertThat(response.cachedUntil()).isEmpty();
    }
}
