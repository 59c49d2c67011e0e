package com.scholary.transcripthub.api;

import com.scholary.transcripthub.job.JobStatus;
import com.scholary.transcripthub.job.TranscriptionJob;
import com.scholary.transcripthub.job.TranscriptionJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Submission endpoints.
 *
 * <p>Both return {@code 200} with the transcript when an identical request has already completed,
 * and {@code 202} with the job to poll otherwise.
 */
@RestController
@Tag(name = "Transcription", description = "Submit audio for transcription")
public class TranscriptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionController.class);

  private final TranscriptionJobService jobService;

  public TranscriptionController(TranscriptionJobService jobService) {
    this.jobService = jobService;
  }

  @PostMapping(value = "/api/transcriptions", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Transcribe an uploaded file",
      description = "Deduplicates on file content, provider and language")
  public ResponseEntity<JobResponse> upload(
      @RequestPart("file") MultipartFile file,
      @RequestParam("provider") String provider,
      @RequestParam(value = "language", required = false) String language,
      @RequestHeader(value = "X-User", required = false) String principal)
      throws IOException {
    LOGGER.info(
        "Upload submission: file={}, size={}, provider={}, language={}",
        file.getOriginalFilename(),
        file.getSize(),
        provider,
        language);
    try (InputStream content = file.getInputStream()) {
      TranscriptionJob job =
          jobService.submitUpload(
              content,
              file.getOriginalFilename(),
              file.getContentType(),
              provider,
              language,
              principal);
      return respond(job);
    }
  }

  @PostMapping("/api/transcriptions/youtube")
  @Operation(
      summary = "Transcribe a YouTube video",
      description = "Deduplicates on video id, provider and language")
  public ResponseEntity<JobResponse> youtube(
      @Valid @RequestBody YouTubeTranscriptionRequest request,
      @RequestHeader(value = "X-User", required = false) String principal)
      throws IOException {
    LOGGER.info(
        "YouTube submission: url={}, provider={}, language={}",
        request.url(),
        request.provider(),
        request.language());
    TranscriptionJob job =
        jobService.submitYouTube(
            request.url(), request.provider(), request.language(), principal);
    return respond(job);
  }

  static ResponseEntity<JobResponse> respond(TranscriptionJob job) {
    HttpStatus status =
        job.getStatus() == JobStatus.COMPLETED ? HttpStatus.OK : HttpStatus.ACCEPTED;
    return ResponseEntity.status(status).body(JobResponse.from(job));
  }
}
