package com.scholary.transcripthub.config;

import com.scholary.transcripthub.provider.elevenlabs.ElevenLabsProperties;
import com.scholary.transcripthub.provider.gemini.GeminiProperties;
import com.scholary.transcripthub.provider.whisperx.WhisperxProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the provider client settings. The providers themselves are component-scanned. */
@Configuration
@EnableConfigurationProperties({
  ElevenLabsProperties.class,
  WhisperxProperties.class,
  GeminiProperties.class
})
public class ProviderConfig {}
