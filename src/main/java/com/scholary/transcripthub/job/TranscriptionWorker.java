package com.scholary.transcripthub.job;

import com.scholary.transcripthub.exception.NotFoundException;
import com.scholary.transcripthub.logging.StructuredLogger;
import com.scholary.transcripthub.media.Asset;
import com.scholary.transcripthub.media.MediaRegistry;
import com.scholary.transcripthub.media.MediaStorage;
import com.scholary.transcripthub.media.ScopedTempFile;
import com.scholary.transcripthub.provider.ProviderRegistry;
import com.scholary.transcripthub.provider.ProviderResult;
import com.scholary.transcripthub.provider.RecognitionResult;
import com.scholary.transcripthub.segment.Segment;
import com.scholary.transcripthub.segment.SegmentBuilder;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Executes one job on an executor thread: claim, materialize the asset, call the provider,
 * re-segment, record the outcome.
 *
 * <p>Every failure ends up on the job as FAILED with its message; nothing is thrown back to the
 * executor. A job deleted while running is not recreated.
 */
@Component
public class TranscriptionWorker {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionWorker.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final JobRepository jobRepository;
  private final MediaRegistry mediaRegistry;
  private final MediaStorage mediaStorage;
  private final ProviderRegistry providerRegistry;
  private final SegmentBuilder segmentBuilder;
  private final Clock clock;

  public TranscriptionWorker(
      JobRepository jobRepository,
      MediaRegistry mediaRegistry,
      MediaStorage mediaStorage,
      ProviderRegistry providerRegistry,
      SegmentBuilder segmentBuilder,
      Clock clock) {
    this.jobRepository = jobRepository;
    this.mediaRegistry = mediaRegistry;
    this.mediaStorage = mediaStorage;
    this.providerRegistry = providerRegistry;
    this.segmentBuilder = segmentBuilder;
    this.clock = clock;
  }

  public void process(String jobId) {
    AtomicBoolean claimed = new AtomicBoolean();
    Optional<TranscriptionJob> existing =
        jobRepository.update(
            jobId,
            candidate -> {
              if (candidate.getStatus() == JobStatus.PENDING) {
                candidate.markProcessing(clock.instant());
                claimed.set(true);
              }
            });
    if (existing.isEmpty()) {
      LOGGER.info("Job {} was deleted before it started", jobId);
      return;
    }
    if (!claimed.get()) {
      LOGGER.warn("Job {} is {}, not processing it", jobId, existing.get().getStatus());
      return;
    }

    TranscriptionJob job = existing.get();
    long startMs = clock.millis();
    StructuredLogger.setJobContext(job.getId(), job.getAssetId(), job.getProvider());
    try {
      STRUCTURED_LOGGER.logJobStarted(jobId);
      RecognitionResult recognition = transcribe(job);
      List<Segment> segments = segmentBuilder.rebuild(recognition.segments());

      Optional<TranscriptionJob> completed =
          jobRepository.update(
              jobId,
              current ->
                  current.complete(segments, recognition.detectedLanguage(), clock.instant()));
      if (completed.isPresent()) {
        STRUCTURED_LOGGER.logJobCompleted(
            jobId, segments.size(), recognition.detectedLanguage(), clock.millis() - startMs);
      } else {
        LOGGER.info("Job {} was deleted while processing; result discarded", jobId);
      }
    } catch (Exception e) {
      STRUCTURED_LOGGER.logJobFailed(
          jobId, e.getClass().getSimpleName(), e.getMessage(), clock.millis() - startMs);
      LOGGER.debug("Job {} failure cause", jobId, e);
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      jobRepository.update(jobId, current -> current.fail(message, clock.instant()));
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private RecognitionResult transcribe(TranscriptionJob job) throws IOException {
    Asset asset =
        mediaRegistry
            .findById(job.getAssetId())
            .orElseThrow(() -> NotFoundException.asset(job.getAssetId()));

    try (ScopedTempFile audio = mediaStorage.materialize(asset)) {
      ProviderResult result =
          providerRegistry.get(job.getProvider()).transcribe(audio.path(), job.getLanguage());
      return result.orElseThrow();
    }
  }
}
