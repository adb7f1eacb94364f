package com.landregistry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Land Registry engine.
 *
 * The engine takes land applications from submission through review to approval, issuing a
 * verifiable certificate and registering the parcel when an application is approved.
 */
@SpringBootApplication
public class LandRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(LandRegistryApplication.class, args);
    }
}
