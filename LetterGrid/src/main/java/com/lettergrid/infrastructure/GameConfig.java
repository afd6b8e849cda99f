package com.lettergrid.infrastructure;

import com.lettergrid.domain.grid.GridGenerator;
import java.security.SecureRandom;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@EnableScheduling
public class GameConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public GridGenerator gridGenerator() {
    return new GridGenerator(new SecureRandom());
  }

  /** Runs presence grace timers and the lobby janitor. */
  @Bean
  public ThreadPoolTaskScheduler taskScheduler() {
    ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
    s.setPoolSize(2);
    s.setThreadNamePrefix("lettergrid-sched-");
    s.setRemoveOnCancelPolicy(true);
    return s;
  }
}
