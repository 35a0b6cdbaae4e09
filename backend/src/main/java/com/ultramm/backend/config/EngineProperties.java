package com.ultramm.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "engine")
@Data
@Validated
public class EngineProperties {

    // Start the per-symbol loops once the context is ready
    private boolean autoStart = true;
}
