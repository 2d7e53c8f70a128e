package com.eveapi.client.service.core;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parses the timestamps used throughout EVE API responses.
 */
@Slf4j
public final class EveDateTimes {

    /** Format of every EVE API timestamp, e.g. {@code 2011-08-30 22:37:24}. */
    public static final DateTimeFormatter EVE_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final int EVE_DATE_LENGTH = 19;

    private EveDateTimes() {
    }

    /**
     * <pre>
     * parse("2011-08-30 22:37:24")        → 2011-08-30T22:37:24
     * parse("2011-08-30 22:34:41.123456") → 2011-08-30T22:34:41
     * parse("") / parse(null)             → empty
     * </pre>
     *
     * @param eveDateTime timestamp text; anything past the seconds is ignored
     * @return the parsed time, or empty for {@code null} or empty input
     * @throws java.time.format.DateTimeParseException if the text is not an EVE timestamp
     */
    public static Optional<LocalDateTime> parse(final String eveDateTime) {
        if (StringUtils.isEmpty(eveDateTime)) {
            return Optional.empty();
        }
        return Optional.of(LocalDateTime.parse(StringUtils.left(eveDateTime, EVE_DATE_LENGTH), EVE_DATE_FORMAT));
    }

    /**
     * Like {@link #parse(String)}, but treats text that is not an EVE timestamp as absent.
     *
     * @param eveDateTime timestamp text taken from a response document
     * @return the parsed time, or empty when missing or unreadable
     */
    public static Optional<LocalDateTime> parseIfValid(final String eveDateTime) {
        try {
            return parse(eveDateTime);
        } catch (DateTimeParseException ex) {
            log.debug("Ignoring unreadable EVE timestamp '{}': {}", eveDateTime, ex.getMessage());
            return Optional.empty();
        }
    }
}
