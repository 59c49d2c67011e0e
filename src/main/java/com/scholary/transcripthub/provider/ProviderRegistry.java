package com.scholary.transcripthub.provider;

import com.scholary.transcripthub.exception.ValidationException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Looks up providers by name. Built once from every {@link TranscriptionProvider} bean. */
@Component
public class ProviderRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProviderRegistry.class);

  private final Map<String, TranscriptionProvider> providers = new TreeMap<>();

  public ProviderRegistry(List<TranscriptionProvider> providers) {
    for (TranscriptionProvider provider : providers) {
      TranscriptionProvider previous = this.providers.put(provider.name(), provider);
      if (previous != null) {
        throw new IllegalStateException("Duplicate provider name: " + provider.name());
      }
    }
    LOGGER.info("Registered transcription providers: {}", this.providers.keySet());
  }

  /**
   * @throws ValidationException if no provider has this name
   */
  public TranscriptionProvider get(String name) {
    TranscriptionProvider provider = name == null ? null : providers.get(name);
    if (provider == null) {
      throw new ValidationException(
          String.format("Unknown provider '%s', expected one of %s", name, providers.keySet()));
    }
    return provider;
  }

  public Set<String> names() {
    return Collections.unmodifiableSet(providers.keySet());
  }
}
