package com.eventor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point wiring the Eventor client for scripts that use it.
 */
@SpringBootApplication
public class EventorClientApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventorClientApplication.class, args);
    }
}
