package com.eveapi.client.service.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import org.junit.jupiter.api.Test;

class EveDateTimesTest {

    @Test
    void parse_should_read_eve_timestamp() {
        assertThat(EveDateTimes.parse("2011-08-30 22:37:24"))
                .contains(LocalDateTime.of(2011, 8, 30, 22, 37, 24));
    }

    @Test
    void parse_should_drop_sub_second_precision() {
        assertThat(EveDateTimes.parse("2011-08-30 22:34:41.123456"))
                .contains(LocalDateTime.of(2011, 8, 30, 22, 34, 41));
    }

    @Test
    void parse_should_return_empty_for_missing_input() {
        assertThat(EveDateTimes.parse("")).isEmpty();
        assertThat(EveDateTimes.parse(null)).isEmpty();
    }

    @Test
    void parse_should_fail_on_other_formats() {
        assertThatThrownBy(() -> EveDateTimes.parse("30/08/2011"))
                .isInstanceOf(DateTimeParseException.class);
    }

    @Test
    void parseIfValid_should_treat_other_formats_as_absent() {
        assertThat(EveDateTimes.parseIfValid("2011-08-30")).isEmpty();
        assertThat(EveDateTimes.parseIfValid(null)).isEmpty();
        assertThat(EveDateTimes.parseIfValid("2011-08-30 22:37:24"))
                .contains(LocalDateTime.of(2011, 8, 30, 22, 37, 24));
    }
}
