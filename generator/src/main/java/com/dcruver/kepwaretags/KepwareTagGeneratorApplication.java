package com.dcruver.kepwaretags;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Kepware tag generator.
 *
 * An interactive shell for arranging folders and tags, saving the hierarchy
 * as JSON and exporting it as a Kepware tag-import CSV.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class KepwareTagGeneratorApplication {

    public static void main(String[] args) {
        log.info("Starting Kepware tag generator...");
        SpringApplication.run(KepwareTagGeneratorApplication.class, args);
    }
}
