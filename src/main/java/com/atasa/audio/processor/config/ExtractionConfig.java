package com.atasa.audio.processor.config;

import com.atasa.audio.processor.extraction.ExtractionProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for yt-dlp extraction.
 *
 * <p>Enables the ExtractionProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(ExtractionProperties.class)
public class ExtractionConfig {}
