/*
 * Where: Common configuration
 * What: Exposes the UTC Clock used for cutoffs, archive timestamps and run timing
 * Why: Lets tests pin "now" so retention boundaries are deterministic
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
