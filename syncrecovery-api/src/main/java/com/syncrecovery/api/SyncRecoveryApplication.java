package com.syncrecovery.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the Sync Recovery service.
 */
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.syncrecovery.api",
    "com.syncrecovery.engine",
    "com.syncrecovery.recovery"
})
public class SyncRecoveryApplication {

    public static void main(String[] args) {
        SpringApplication.run(SyncRecoveryApplication.class, args);
    }
}
