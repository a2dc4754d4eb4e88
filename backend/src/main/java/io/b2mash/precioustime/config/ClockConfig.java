package io.b2mash.precioustime.config;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TrackerProperties.class)
public class ClockConfig {

  private static final Logger log = LoggerFactory.getLogger(ClockConfig.class);

  @Bean
  Clock clock(TrackerProperties properties) {
    var zone = properties.zoneId();
    log.info("Tracker clock running in zone {}", zone);
    return Clock.system(zone);
  }
}
