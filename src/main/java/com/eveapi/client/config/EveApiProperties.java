package com.eveapi.client.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection and conversion settings for the EVE API client.
 *
 * <p>Values are bound from properties prefixed with {@code eve.api}:</p>
 * <pre>
 * eve:
 *   api:
 *     host: api.eveonline.com
 *     use-https: true
 *     connect-timeout: 10s
 *     response-timeout: 30s
 *     conversion:
 *       max-depth: 64
 * </pre>
 * <p>{@code application.yml} reads the host and scheme from {@code EVE_API_HOST} and
 * {@code EVE_API_USE_HTTPS}, which may be set in a {@code .env} file.</p>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "eve.api")
public class EveApiProperties {

    /**
     * Hostname of the EVE API server. Overrides the host of catalog methods.
     */
    @NotBlank
    private String host = "api.eveonline.com";

    /** Use HTTPS instead of HTTP unless a request says otherwise. */
    private boolean useHttps = true;

    /** TCP connect timeout. */
    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    /** Blocking timeout for one complete request. */
    @NotNull
    private Duration responseTimeout = Duration.ofSeconds(30);

    /** User-Agent header sent with every request. */
    @NotBlank
    private String userAgent = "eve-api-client/1.1";

    @Valid
    private Conversion conversion = new Conversion();

    @Data
    public static class Conversion {

        /** Deepest element nesting accepted before a response is rejected. */
        @Min(1)
        private int maxDepth = 64;
    }
}
