package com.scholary.audionotes.config;

import com.scholary.audionotes.recording.CaptureProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for audio capture.
 *
 * <p>Enables the CaptureProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(CaptureProperties.class)
public class CaptureConfig {}
