package io.b2mash.pivot.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Registers {@link PivotProperties} for the engine beans. */
@Configuration
@EnableConfigurationProperties(PivotProperties.class)
public class PivotEngineConfig {}
