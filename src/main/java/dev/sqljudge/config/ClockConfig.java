package dev.sqljudge.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Time source shared by the progress tracker and the CSV exporter, pinned to UTC. */
@Configuration
public class ClockConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock evaluationClock() {
    return Clock.systemUTC();
  }
}
