package com.eveapi.client.service.core;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class EveApiMethodsTest {

    @Test
    void all_should_list_every_method_in_declaration_order() {
        assertThat(EveApiMethods.all()).hasSize(70);
        assertThat(EveApiMethods.all().keySet()).startsWith("ACCOUNT_CHARACTERS", "ACCOUNT_STATUS");
        assertThat(EveApiMethods.all().keySet()).endsWith("SERVER_STATUS");
        assertThat(EveApiMethods.all()).containsEntry("CORP_STARBASE_DETAILS", EveApiMethods.CORP_STARBASE_DETAILS);
    }

    @Test
    void all_should_bind_every_method_to_default_host() {
        assertThat(EveApiMethods.all().values())
                .allSatisfy(m -> assertThat(m.apiHome()).isEqualTo(EveApiMethod.DEFAULT_API_HOST))
                .allSatisfy(m -> assertThat(m.method()).startsWith("/"));
    }

    @Test
    void byName_should_ignore_case() {
        assertThat(EveApiMethods.byName("server_status")).contains(EveApiMethods.SERVER_STATUS);
        assertThat(EveApiMethods.byName("CHAR_KILL_LOG").map(EveApiMethod::method)).contains("/char/Killlog");
    }

    @Test
    void byName_should_return_empty_for_unknown_names() {
        assertThat(EveApiMethods.byName("NOT_A_METHOD")).isEmpty();
        assertThat(EveApiMethods.byName(null)).isEmpty();
    }
}
