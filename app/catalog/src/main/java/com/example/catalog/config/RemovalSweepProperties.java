/*
 * Where: catalog application configuration binding
 * What: settings for reclaiming image assets of expired REMOVED listings
 * Why: the sweep is optional and disabled unless an environment opts in
 */
package com.example.catalog.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "catalog.sweep")
public record RemovalSweepProperties(
    boolean enabled, Duration interval, Duration grace, int batchSize) {

  public RemovalSweepProperties {
    interval = interval == null ? Duration.ofMinutes(10) : interval;
    grace = grace == null ? Duration.ofHours(24) : grace;
    batchSize = batchSize <= 0 ? 100 : batchSize;
  }
}
