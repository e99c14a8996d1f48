package com.atasa.audio.processor.config;

import com.atasa.audio.processor.service.RetentionProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the retention sweep.
 *
 * <p>Enables the RetentionProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(RetentionProperties.class)
public class RetentionConfig {}
