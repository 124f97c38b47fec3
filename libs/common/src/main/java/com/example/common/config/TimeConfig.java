/*
 * Where: shared configuration
 * What: exposes the UTC Clock bean used by every time-dependent service
 * Why: undo windows and audit timestamps are computed against an injectable clock
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
