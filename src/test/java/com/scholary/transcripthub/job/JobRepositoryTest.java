package com.scholary.transcripthub.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.transcripthub.exception.ConflictException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JobRepositoryTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private JobRepository repository;

  @BeforeEach
  void setUp() {
    repository = new JobRepository(100, 60);
  }

  @Test
  void insertUnique_shouldRejectSecondLiveJobForSameKey() {
    TranscriptionJob first = job("job-1", "asset-1");
    repository.insertUnique(first);

    assertThatThrownBy(() -> repository.insertUnique(job("job-2", "asset-1")))
        .isInstanceOf(ConflictException.class)
        .extracting(e -> ((ConflictException) e).getExistingId())
        .isEqualTo("job-1");
    assertThat(repository.findById("job-2")).isEmpty();
    assertThat(repository.findLive(first.dedupKey())).contains(first);
  }

  @Test
  void insertUnique_shouldAllowDifferentLanguagesForSameAsset() {
    repository.insertUnique(job("job-1", "asset-1"));
    repository.insertUnique(new TranscriptionJob("job-2", "asset-1", "elevenlabs", "fr", T0));

    assertThat(repository.findByAssetId("asset-1")).hasSize(2);
  }

  @Test
  void update_shouldReleaseKeyWhenJobTerminates() {
    TranscriptionJob first = job("job-1", "asset-1");
    repository.insertUnique(first);

    repository.update("job-1", job -> job.markProcessing(T0.plusSeconds(1)));
    assertThat(repository.findLive(first.dedupKey())).contains(first);

    repository.update("job-1", job -> job.fail("boom", T0.plusSeconds(2)));
    assertThat(repository.findLive(first.dedupKey())).isEmpty();

    repository.insertUnique(job("job-2", "asset-1"));
    assertThat(repository.findLive(first.dedupKey()).map(TranscriptionJob::getId))
        .contains("job-2");
  }

  @Test
  void update_shouldReturnEmptyForDeletedJob() {
    repository.insertUnique(job("job-1", "asset-1"));
    repository.delete("job-1");

    assertThat(repository.update("job-1", job -> job.markProcessing(T0))).isEmpty();
  }

  @Test
  void update_shouldPropagateIllegalTransitions() {
    repository.insertUnique(job("job-1", "asset-1"));

    assertThatThrownBy(() -> repository.update("job-1", job -> job.complete(List.of(), "en", T0)))
        .isInstanceOf(IllegalStateException.class);
    assertThat(repository.findById("job-1").map(TranscriptionJob::getStatus))
        .contains(JobStatus.PENDING);
  }

  @Test
  void findLatestCompleted_shouldPickMostRecentlyUpdated() {
    repository.insertUnique(job("old", "asset-1"));
    complete("old", T0.plusSeconds(10));
    repository.insertUnique(job("new", "asset-1"));
    complete("new", T0.plusSeconds(20));

    assertThat(repository.findLatestCompleted(new DedupKey("asset-1", "elevenlabs", "en")))
        .map(TranscriptionJob::getId)
        .contains("new");
  }

  @Test
  void delete_shouldReleaseKey() {
    TranscriptionJob first = job("job-1", "asset-1");
    repository.insertUnique(first);

    assertThat(repository.delete("job-1")).contains(first);
    assertThat(repository.findLive(first.dedupKey())).isEmpty();
    assertThat(repository.delete("job-1")).isEmpty();
  }

  private void complete(String jobId, Instant at) {
    repository.update(jobId, job -> job.markProcessing(at.minusSeconds(1)));
    repository.update(jobId, job -> job.complete(List.of(), "en", at));
  }

  private static TranscriptionJob job(String id, String assetId) {
    return new TranscriptionJob(id, assetId, "elevenlabs", "en", T0);
  }
}
