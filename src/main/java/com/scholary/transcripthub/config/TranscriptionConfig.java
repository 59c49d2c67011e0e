package com.scholary.transcripthub.config;

import com.scholary.transcripthub.youtube.YouTubeProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Job pipeline settings and the clock used for job and asset timestamps. */
@Configuration
@EnableConfigurationProperties({TranscriptionProperties.class, YouTubeProperties.class})
public class TranscriptionConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
