package com.scholary.transcripthub.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.scholary.transcripthub.exception.ConflictException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory job store.
 *
 * <p>Jobs live in a Caffeine cache bounded by size and age. Alongside it, a live-key index maps
 * each {@link DedupKey} to the id of its one non-terminal job. The index is written with {@code
 * putIfAbsent}, so concurrent submissions for the same key cannot both create a job: the loser
 * gets a {@link ConflictException} carrying the winner's id. A key is released when its job
 * reaches a terminal state, is deleted, or is evicted.
 */
@Repository
public class JobRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRepository.class);

  private final Cache<String, TranscriptionJob> cache;
  private final ConcurrentMap<DedupKey, String> liveJobs = new ConcurrentHashMap<>();

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .evictionListener(
                (String jobId, TranscriptionJob job, RemovalCause cause) -> {
                  if (job != null) {
                    liveJobs.remove(job.dedupKey(), jobId);
                    LOGGER.info("Evicted job {} ({}), status={}", jobId, cause, job.getStatus());
                  }
                })
            .build();
  }

  /**
   * Store a new PENDING job, claiming its dedup key.
   *
   * @throws ConflictException if another live job already holds the key
   */
  public void insertUnique(TranscriptionJob job) {
    cache.put(job.getId(), job);
    String existing = liveJobs.putIfAbsent(job.dedupKey(), job.getId());
    if (existing != null) {
      cache.invalidate(job.getId());
      throw new ConflictException(
          String.format("A live job already exists for %s", job.dedupKey()), existing);
    }
  }

  /**
   * Apply a state transition atomically with respect to other transitions and deletion of the same
   * job. Terminal transitions release the dedup key.
   *
   * @return the updated job, or empty if the job no longer exists
   */
  public Optional<TranscriptionJob> update(String jobId, Consumer<TranscriptionJob> transition) {
    return Optional.ofNullable(
        cache
            .asMap()
            .computeIfPresent(
                jobId,
                (id, job) -> {
                  transition.accept(job);
                  if (job.getStatus().isTerminal()) {
                    liveJobs.remove(job.dedupKey(), id);
                  }
                  return job;
                }));
  }

  public Optional<TranscriptionJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public Optional<TranscriptionJob> findLive(DedupKey key) {
    String jobId = liveJobs.get(key);
    return jobId == null ? Optional.empty() : findById(jobId);
  }

  /** The most recently completed job for {@code key}. */
  public Optional<TranscriptionJob> findLatestCompleted(DedupKey key) {
    return cache.asMap().values().stream()
        .filter(job -> job.getStatus() == JobStatus.COMPLETED)
        .filter(job -> job.dedupKey().equals(key))
        .max(Comparator.comparing(TranscriptionJob::getUpdatedAt));
  }

  /** Snapshot of every stored job, in no particular order. */
  public List<TranscriptionJob> findAll() {
    return new ArrayList<>(cache.asMap().values());
  }

  public List<TranscriptionJob> findByAssetId(String assetId) {
    return cache.asMap().values().stream()
        .filter(job -> job.getAssetId().equals(assetId))
        .collect(Collectors.toList());
  }

  /** @return the removed job, or empty if it did not exist */
  public Optional<TranscriptionJob> delete(String jobId) {
    TranscriptionJob removed = cache.asMap().remove(jobId);
    if (removed != null) {
      liveJobs.remove(removed.dedupKey(), jobId);
    }
    return Optional.ofNullable(removed);
  }
}
