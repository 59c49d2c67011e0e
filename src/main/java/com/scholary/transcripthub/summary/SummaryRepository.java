package com.scholary.transcripthub.summary;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/** In-memory summaries keyed by job id, bounded like the job store. */
@Repository
public class SummaryRepository {

  private final Cache<String, Summary> cache;

  public SummaryRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(Summary summary) {
    cache.put(summary.jobId(), summary);
  }

  public Optional<Summary> findByJobId(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public boolean exists(String jobId) {
    return cache.getIfPresent(jobId) != null;
  }

  /** @return whether a summary was removed */
  public boolean delete(String jobId) {
    return cache.asMap().remove(jobId) != null;
  }
}
