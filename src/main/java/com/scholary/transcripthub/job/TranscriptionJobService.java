package com.scholary.transcripthub.job;

import com.scholary.transcripthub.config.TranscriptionProperties;
import com.scholary.transcripthub.exception.ConflictException;
import com.scholary.transcripthub.exception.NotFoundException;
import com.scholary.transcripthub.exception.PermissionDeniedException;
import com.scholary.transcripthub.exception.ProviderException;
import com.scholary.transcripthub.exception.ValidationException;
import com.scholary.transcripthub.logging.StructuredLogger;
import com.scholary.transcripthub.media.Asset;
import com.scholary.transcripthub.media.AssetMetadata;
import com.scholary.transcripthub.media.ContentHasher;
import com.scholary.transcripthub.media.ContentNamespace;
import com.scholary.transcripthub.media.MediaLink;
import com.scholary.transcripthub.media.MediaRegistry;
import com.scholary.transcripthub.media.MediaStorage;
import com.scholary.transcripthub.media.MediaTypes;
import com.scholary.transcripthub.media.ScopedTempFile;
import com.scholary.transcripthub.provider.ProviderRegistry;
import com.scholary.transcripthub.summary.SummaryRepository;
import com.scholary.transcripthub.youtube.DownloadedAudio;
import com.scholary.transcripthub.youtube.YouTubeAudioDownloader;
import com.scholary.transcripthub.youtube.YouTubeUrlParser;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

/**
 * Entry point of the job pipeline.
 *
 * <p>Submission is deduplicated on (asset, provider, language): a completed job is returned as is,
 * a live job is returned as in progress, and only otherwise is a new job created and handed to the
 * executor. There is no lock around the check; {@link JobRepository#insertUnique} rejects the
 * loser of a race and the loser collapses onto the winner.
 */
@Service
public class TranscriptionJobService {

  public static final String AUTO_LANGUAGE = "auto";
  static final String YOUTUBE_SOURCE = "youtube";

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionJobService.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final JobRepository jobRepository;
  private final MediaRegistry mediaRegistry;
  private final MediaStorage mediaStorage;
  private final ProviderRegistry providerRegistry;
  private final SummaryRepository summaryRepository;
  private final TranscriptionWorker worker;
  private final Executor executor;
  private final ContentHasher contentHasher;
  private final YouTubeAudioDownloader youTubeAudioDownloader;
  private final TranscriptionProperties properties;
  private final Clock clock;

  public TranscriptionJobService(
      JobRepository jobRepository,
      MediaRegistry mediaRegistry,
      MediaStorage mediaStorage,
      ProviderRegistry providerRegistry,
      SummaryRepository summaryRepository,
      TranscriptionWorker worker,
      @Qualifier("transcriptionExecutor") Executor executor,
      ContentHasher contentHasher,
      YouTubeAudioDownloader youTubeAudioDownloader,
      TranscriptionProperties properties,
      Clock clock) {
    this.jobRepository = jobRepository;
    this.mediaRegistry = mediaRegistry;
    this.mediaStorage = mediaStorage;
    this.providerRegistry = providerRegistry;
    this.summaryRepository = summaryRepository;
    this.worker = worker;
    this.executor = executor;
    this.contentHasher = contentHasher;
    this.youTubeAudioDownloader = youTubeAudioDownloader;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Request a transcription of an asset.
   *
   * @return a COMPLETED job when one exists, otherwise the live job for the request
   * @throws ValidationException if the provider is unknown
   */
  public TranscriptionJob submit(Asset asset, String provider, String language) {
    providerRegistry.get(provider);
    DedupKey key = new DedupKey(asset.id(), provider, normalizeLanguage(language));

    Optional<TranscriptionJob> completed = jobRepository.findLatestCompleted(key);
    if (completed.isPresent()) {
      logSubmission(completed.get(), "cached");
      return completed.get();
    }

    Optional<TranscriptionJob> live = jobRepository.findLive(key);
    if (live.isPresent()) {
      logSubmission(live.get(), "in_progress");
      return live.get();
    }

    return createAndDispatch(key);
  }

  /**
   * Ingest uploaded bytes and submit them.
   *
   * <p>Identical bytes map to the same asset however they are named.
   */
  public TranscriptionJob submitUpload(
      InputStream content,
      String fileName,
      String mimeType,
      String provider,
      String language,
      String principal)
      throws IOException {
    providerRegistry.get(provider);
    String displayName = fileName == null || fileName.isBlank() ? "upload" : fileName;
    String contentType =
        mimeType == null || mimeType.isBlank() ? MediaTypes.forFileName(displayName) : mimeType;

    Asset asset;
    String suffix = MediaTypes.suffixFor(contentType);
    try (ScopedTempFile upload = ScopedTempFile.create(mediaStorage.tempDir(), "upload-", suffix)) {
      Files.copy(content, upload.path(), StandardCopyOption.REPLACE_EXISTING);
      long size = Files.size(upload.path());
      if (size == 0) {
        throw new ValidationException("Uploaded file is empty");
      }
      if (size > properties.maxUploadBytes()) {
        throw new ValidationException(
            String.format(
                "Uploaded file is %d bytes, above the limit of %d",
                size, properties.maxUploadBytes()));
      }

      String contentKey = contentHasher.sha256(upload.path());
      asset =
          ingest(
              contentKey,
              ContentNamespace.CONTENT_HASH,
              new AssetMetadata(displayName, contentType, principal),
              upload.path());
    }
    return submit(asset, provider, language);
  }

  /**
   * Ingest the audio of a YouTube video and submit it.
   *
   * <p>A video already registered is not downloaded again.
   *
   * @throws ValidationException if {@code url} is not a YouTube video URL
   * @throws ProviderException if the audio cannot be downloaded
   */
  public TranscriptionJob submitYouTube(
      String url, String provider, String language, String principal) throws IOException {
    providerRegistry.get(provider);
    String videoId = YouTubeUrlParser.videoId(url);

    Asset asset;
    try {
      asset = mediaRegistry.resolve(videoId, ContentNamespace.EXTERNAL_ID);
    } catch (NotFoundException notFound) {
      Path downloadDir = mediaStorage.tempDir().resolve("youtube-" + UUID.randomUUID());
      try {
        asset = downloadAndIngest(videoId, downloadDir, principal);
      } finally {
        deleteQuietly(downloadDir);
      }
    }
    return submit(asset, provider, language);
  }

  /**
   * @throws NotFoundException if the job does not exist
   */
  public TranscriptionJob status(String jobId) {
    return jobRepository.findById(jobId).orElseThrow(() -> NotFoundException.job(jobId));
  }

  /**
   * Transcribe a job's asset again, ignoring any completed result.
   *
   * <p>Returns the live job instead when one is already running for the same request.
   *
   * @param provider provider to use, {@code null} to keep the job's
   * @param language language to use, {@code null} to keep the job's
   */
  public TranscriptionJob regenerate(
      String jobId, String provider, String language, String principal) {
    TranscriptionJob original = status(jobId);
    Asset asset = requireAccessibleAsset(original, principal);

    String effectiveProvider =
        provider == null || provider.isBlank() ? original.getProvider() : provider;
    providerRegistry.get(effectiveProvider);
    String effectiveLanguage =
        language == null || language.isBlank()
            ? original.getLanguage()
            : normalizeLanguage(language);

    LOGGER.info(
        "Regenerating job {}: provider={}, language={}",
        jobId,
        effectiveProvider,
        effectiveLanguage);
    return createAndDispatch(new DedupKey(asset.id(), effectiveProvider, effectiveLanguage));
  }

  /**
   * Jobs on assets owned by {@code principal}, newest first. Without a principal, jobs on assets
   * nobody owns.
   *
   * @param statuses statuses to include, {@code null} or empty for all
   */
  public List<JobListing> list(String principal, Collection<JobStatus> statuses) {
    Set<JobStatus> wanted =
        statuses == null || statuses.isEmpty()
            ? EnumSet.allOf(JobStatus.class)
            : EnumSet.copyOf(statuses);

    List<JobListing> listings = new ArrayList<>();
    for (TranscriptionJob job : jobRepository.findAll()) {
      if (!wanted.contains(job.getStatus())) {
        continue;
      }
      Optional<Asset> asset = mediaRegistry.findById(job.getAssetId());
      if (asset.isPresent() && Objects.equals(asset.get().owner(), principal)) {
        listings.add(new JobListing(job, asset.get(), summaryRepository.exists(job.getId())));
      }
    }
    listings.sort(
        Comparator.comparing((JobListing listing) -> listing.job().getCreatedAt()).reversed());
    return listings;
  }

  /**
   * Delete the summary of a job, keeping the job.
   *
   * @throws NotFoundException if the job, its asset or its summary does not exist
   * @throws PermissionDeniedException if the asset belongs to another user
   */
  public void deleteSummary(String jobId, String principal) {
    requireAccessibleAsset(status(jobId), principal);
    if (!summaryRepository.delete(jobId)) {
      throw new NotFoundException("No summary for job " + jobId);
    }
    LOGGER.info("Deleted summary of job {}", jobId);
  }

  /**
   * Playback link for the media behind a job.
   *
   * @throws NotFoundException if the job or its asset does not exist
   * @throws PermissionDeniedException if the asset belongs to another user
   */
  public MediaLink mediaLink(String jobId, String principal) {
    Asset asset = requireAccessibleAsset(status(jobId), principal);
    return MediaLink.of(asset, mediaStorage.playbackUrl(asset));
  }

  /**
   * Delete a job and its summary. The asset and its stored bytes go too when no other job
   * references it.
   */
  public void delete(String jobId, String principal) {
    TranscriptionJob job = status(jobId);
    Optional<Asset> asset = mediaRegistry.findById(job.getAssetId());
    if (asset.isPresent()) {
      checkAccess(asset.get(), principal);
    }

    jobRepository.delete(jobId);
    summaryRepository.delete(jobId);
    LOGGER.info("Deleted job {} (status was {})", jobId, job.getStatus());

    if (asset.isPresent() && jobRepository.findByAssetId(job.getAssetId()).isEmpty()) {
      mediaRegistry.delete(asset.get());
      mediaStorage.delete(asset.get());
      LOGGER.info("Deleted orphaned asset {}", asset.get().id());
    }
  }

  private Asset downloadAndIngest(String videoId, Path downloadDir, String principal)
      throws IOException {
    DownloadedAudio audio;
    try {
      audio = youTubeAudioDownloader.download(videoId, downloadDir);
    } catch (IOException e) {
      throw new ProviderException(
          YOUTUBE_SOURCE, "Failed to download YouTube audio: " + e.getMessage(), e);
    }
    try (ScopedTempFile file = audio.file()) {
      return ingest(
          videoId,
          ContentNamespace.EXTERNAL_ID,
          new AssetMetadata(audio.title(), audio.mimeType(), principal),
          file.path());
    }
  }

  /** Store bytes first, then register, so a visible asset always has its bytes. */
  private Asset ingest(
      String contentKey, ContentNamespace namespace, AssetMetadata metadata, Path file)
      throws IOException {
    try {
      return mediaRegistry.resolve(contentKey, namespace);
    } catch (NotFoundException notFound) {
      mediaStorage.store(namespace, contentKey, metadata.mimeType(), file);
      return mediaRegistry.resolveOrRegister(contentKey, namespace, metadata).asset();
    }
  }

  private static void deleteQuietly(Path directory) {
    try {
      FileSystemUtils.deleteRecursively(directory);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp directory {}", directory, e);
    }
  }

  private TranscriptionJob createAndDispatch(DedupKey key) {
    TranscriptionJob job =
        new TranscriptionJob(
            UUID.randomUUID().toString(),
            key.assetId(),
            key.provider(),
            key.language(),
            clock.instant());
    try {
      jobRepository.insertUnique(job);
    } catch (ConflictException conflict) {
      TranscriptionJob existing =
          jobRepository
              .findById(conflict.getExistingId())
              .orElseThrow(() -> NotFoundException.job(conflict.getExistingId()));
      logSubmission(existing, "in_progress");
      return existing;
    }

    logSubmission(job, "created");
    try {
      executor.execute(() -> worker.process(job.getId()));
    } catch (RejectedExecutionException e) {
      LOGGER.error("Executor rejected job {}", job.getId(), e);
      jobRepository.update(
          job.getId(), current -> current.fail("Job queue is full, retry later", clock.instant()));
    }
    return job;
  }

  private Asset requireAccessibleAsset(TranscriptionJob job, String principal) {
    Asset asset =
        mediaRegistry
            .findById(job.getAssetId())
            .orElseThrow(() -> NotFoundException.asset(job.getAssetId()));
    checkAccess(asset, principal);
    return asset;
  }

  private static void checkAccess(Asset asset, String principal) {
    if (!asset.isAccessibleBy(principal)) {
      throw new PermissionDeniedException(
          String.format("User %s may not access asset %s", principal, asset.id()));
    }
  }

  static String normalizeLanguage(String language) {
    if (language == null || language.isBlank()) {
      return AUTO_LANGUAGE;
    }
    return language.strip().toLowerCase(Locale.ROOT);
  }

  private static void logSubmission(TranscriptionJob job, String outcome) {
    STRUCTURED_LOGGER.logJobSubmitted(
        job.getId(), job.getAssetId(), job.getProvider(), job.getLanguage(), outcome);
  }
}
