package com.stationsync.synchronizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Station Synchronizer
 *
 * Polls MLflow for new processing runs, finds each station's processed CSV in S3 and
 * pushes it as telemetry to the station's ThingsBoard device.
 */
@SpringBootApplication
public class SynchronizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SynchronizerApplication.class, args);
    }
}
