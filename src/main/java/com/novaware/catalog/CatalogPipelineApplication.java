package com.novaware.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.util.Arrays;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CatalogPipelineApplication {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(CatalogPipelineApplication.class);
        // a command-line stage run needs no admin server
        if (Arrays.stream(args).anyMatch(a -> a.startsWith("--stage"))) {
            app.setWebApplicationType(WebApplicationType.NONE);
        }
        app.run(args);
    }
}
