package com.frostguard.acoustic;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AcousticMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(AcousticMonitorApplication.class, args);
    }
}
