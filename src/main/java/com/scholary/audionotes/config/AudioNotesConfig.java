package com.scholary.audionotes.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for note-engine beans.
 *
 * <p>Enables the AudioNotesProperties to be loaded from application.yml and exposes the clock the
 * recording session measures offsets with.
 */
@Configuration
@EnableConfigurationProperties(AudioNotesProperties.class)
public class AudioNotesConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
