package com.frostguard.acoustic.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class DetectorConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    /** Single background worker for online model refits. */
    @Bean(destroyMethod = "shutdownNow")
    ExecutorService refitExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "online-refit");
            t.setDaemon(true);
            return t;
        });
    }
}
