package com.scholary.acquisition.config;

import com.scholary.acquisition.importer.ImporterProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the external importer.
 *
 * <p>Enables the ImporterProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(ImporterProperties.class)
public class ImporterConfig {}
