package com.eveapi.client.service.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EveApiMethodTest {

    @Test
    void composeUrl_should_append_query_when_parameters_given() {
        assertThat(EveApiMethods.ACCOUNT_CHARACTERS.composeUrl(Map.of("key", "value")))
                .isEqualTo("/account/Characters.xml.aspx?key=value");
    }

    @Test
    void composeUrl_should_omit_question_mark_without_parameters() {
        assertThat(EveApiMethods.SERVER_STATUS.composeUrl(Map.of()))
                .isEqualTo("/server/ServerStatus.xml.aspx");
        assertThat(EveApiMethods.SERVER_STATUS.composeUrl(null))
                .isEqualTo("/server/ServerStatus.xml.aspx");
    }

    @Test
    void composeUrl_should_keep_parameter_order_and_render_values() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("keyID", 12345);
        params.put("vCode", "67890");
        params.put("characterID", 499939401L);

        assertThat(EveApiMethods.CHAR_WALLET_JOURNAL.composeUrl(params))
                .isEqualTo("/char/WalletJournal.xml.aspx?keyID=12345&vCode=67890&characterID=499939401");
    }

    @Test
    void composeUrl_should_form_encode_names_and_values() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("names", "hcydo fcydo");
        params.put("a&b", "x=y/z");

        assertThat(EveApiMethods.EVE_CHARACTER_ID.composeUrl(params))
                .isEqualTo("/eve/CharacterID.xml.aspx?names=hcydo+fcydo&a%26b=x%3Dy%2Fz");
    }

    @Test
    void requestUri_should_use_scheme_and_host() {
        EveApiMethod custom = new EveApiMethod("/api/CustomMethodName", "example.com");
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("param1", "value1");
        params.put("param2", "value2");

        assertThat(custom.requestUri(params, true)).hasToString(
                "https://example.com/api/CustomMethodName.xml.aspx?param1=value1&param2=value2");
        assertThat(custom.requestUri(Map.of(), false)).hasToString(
                "http://example.com/api/CustomMethodName.xml.aspx");
    }

    @Test
    void withHost_should_keep_method_path() {
        EveApiMethod moved = EveApiMethods.SERVER_STATUS.withHost("api.testeveonline.com");

        assertThat(moved.method()).isEqualTo("/server/ServerStatus");
        assertThat(moved.apiHome()).isEqualTo("api.testeveonline.com");
        assertThat(EveApiMethods.SERVER_STATUS.apiHome()).isEqualTo(EveApiMethod.DEFAULT_API_HOST);
    }

    @Test
    void constructor_should_reject_blank_parts() {
        assertThatThrownBy(() -> new EveApiMethod(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EveApiMethod("/server/ServerStatus", ""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
