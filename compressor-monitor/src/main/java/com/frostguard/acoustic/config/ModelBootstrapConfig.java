package com.frostguard.acoustic.config;

import com.frostguard.acoustic.exception.ModelPersistenceException;
import com.frostguard.acoustic.services.FeatureSource;
import com.frostguard.acoustic.services.ModelRegistryService;
import com.frostguard.acoustic.services.MonitoringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Restores saved detector state on startup and optionally starts monitoring.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "acoustic.bootstrap", name = "load-on-start", havingValue = "true", matchIfMissing = true)
public class ModelBootstrapConfig {

    private final ModelRegistryService modelRegistryService;
    private final MonitoringService monitoringService;
    private final ObjectProvider<FeatureSource> featureSource;
    private final DetectionProperties properties;

    @Bean
    ApplicationRunner loadModelsApplicationRunner() {
        return args -> {
            try {
                modelRegistryService.loadAll();
            } catch (ModelPersistenceException e) {
                log.error("Saved detector state could not be loaded, starting untrained", e);
            }
            if (properties.getMonitoring().isAutoStart()) {
                FeatureSource source = featureSource.getIfAvailable();
                if (source != null) {
                    monitoringService.start(source);
                } else {
                    log.warn("Monitoring auto start requested but no FeatureSource bean is defined");
                }
            }
        };
    }
}
