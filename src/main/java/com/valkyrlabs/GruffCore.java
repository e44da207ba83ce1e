package com.valkyrlabs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Gruff authorization and versioned-resource core.
 *
 * <p>
 * Configuration root: scanning from here picks up the JPA model in
 * {@code com.valkyrlabs.model}, the repositories in {@code com.valkyrlabs.api} and
 * the services under {@code com.valkyrlabs.gruff}. The request-handling layer
 * that consumes these services lives in the host application.
 * </p>
 */
@SpringBootApplication
public class GruffCore {

    public static void main(String[] args) {
        SpringApplication.run(GruffCore.class, args);
    }
}
