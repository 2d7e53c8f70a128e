package com.eveapi.client;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The main entry point for the EVE API client service.
 *
 * <p>This Spring Boot application wraps the EVE Online XML API:
 * <ul>
 *   <li>any API method can be called with arbitrary query parameters,</li>
 *   <li>XML responses are converted into schema-free nested maps,</li>
 *   <li>HTTP and HTTPS are supported (HTTPS by default),</li>
 *   <li>the API host is configurable ({@code eve.api.host}, default {@code api.eveonline.com}).</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>{@code
 *   mvn spring-boot:run
 *
 *   curl -X POST localhost:8080/api/eve/methods/SERVER_STATUS
 * }</pre>
 */
@SpringBootApplication
public class EveApiClientApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(EveApiClientApplication.class, args);
    }
}
