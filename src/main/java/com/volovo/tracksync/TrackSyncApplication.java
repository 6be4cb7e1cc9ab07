package com.volovo.tracksync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Fleet track sync: portal ingestion, jump filtering and loading-site trips.
 */
@SpringBootApplication
public class TrackSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrackSyncApplication.class, args);
    }

}
