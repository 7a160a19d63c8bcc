package dev.beacon.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link Clock} that "today" is read from when classifying dates.
 *
 * <p>The zone is the district's, not the server's, so an event on the local calendar day is still
 * current after UTC midnight.
 */
@Configuration
public class ClockConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock(@Value("${beacon.clock.zone:America/Los_Angeles}") String zone) {
    return Clock.system(ZoneId.of(zone));
  }
}
