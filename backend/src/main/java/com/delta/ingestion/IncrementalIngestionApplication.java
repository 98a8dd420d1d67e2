package com.delta.ingestion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class IncrementalIngestionApplication {

    public static void main(String[] args) {
        SpringApplication.run(IncrementalIngestionApplication.class, args);
    }
}
