package io.chatpad.pilot.config;

import java.time.Clock;
import java.time.ZoneOffset;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Single UTC clock for time-bounded checks (impersonation expiry, invitation TTL). */
@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.system(ZoneOffset.UTC);
  }
}
