package com.scholary.audionotes.config;

import com.scholary.audionotes.objectstore.ObjectStoreClient;
import com.scholary.audionotes.objectstore.ObjectStoreProperties;
import com.scholary.audionotes.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Snapshots and uploaded recordings live in one bucket; this wires the client that reaches it.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
