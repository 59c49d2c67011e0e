package com.scholary.transcripthub.api;

import com.scholary.transcripthub.exception.NotFoundException;
import com.scholary.transcripthub.job.JobStatus;
import com.scholary.transcripthub.job.TranscriptionJob;
import com.scholary.transcripthub.job.TranscriptionJobService;
import com.scholary.transcripthub.media.MediaLink;
import com.scholary.transcripthub.summary.Summary;
import com.scholary.transcripthub.summary.SummaryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Job history, status, regeneration, deletion and summaries. */
@RestController
@Tag(name = "Jobs", description = "Inspect and manage transcription jobs")
public class JobController {

  private final TranscriptionJobService jobService;
  private final SummaryService summaryService;

  public JobController(TranscriptionJobService jobService, SummaryService summaryService) {
    this.jobService = jobService;
    this.summaryService = summaryService;
  }

  @GetMapping("/api/jobs")
  @Operation(
      summary = "List the caller's jobs",
      description = "Newest first; repeat or comma-separate status to filter")
  public List<JobListItem> list(
      @RequestParam(value = "status", required = false) List<JobStatus> statuses,
      @RequestHeader(value = "X-User", required = false) String principal) {
    return jobService.list(principal, statuses).stream()
        .map(JobListItem::from)
        .collect(Collectors.toList());
  }

  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Includes segments once completed")
  public JobResponse status(@PathVariable String id) {
    return JobResponse.from(jobService.status(id));
  }

  @PostMapping("/api/jobs/{id}/regenerate")
  @Operation(
      summary = "Regenerate a transcript",
      description = "Always transcribes again, optionally with another provider or language")
  public ResponseEntity<JobResponse> regenerate(
      @PathVariable String id,
      @RequestBody(required = false) RegenerateRequest request,
      @RequestHeader(value = "X-User", required = false) String principal) {
    RegenerateRequest overrides = request == null ? new RegenerateRequest(null, null) : request;
    TranscriptionJob job =
        jobService.regenerate(id, overrides.provider(), overrides.language(), principal);
    return ResponseEntity.accepted().body(JobResponse.from(job));
  }

  @DeleteMapping("/api/jobs/{id}")
  @Operation(
      summary = "Delete a job",
      description = "Also deletes the media when no other job uses it")
  public ResponseEntity<Void> delete(
      @PathVariable String id,
      @RequestHeader(value = "X-User", required = false) String principal) {
    jobService.delete(id, principal);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/api/jobs/{id}/media")
  @Operation(summary = "Get a playback link for the job's media")
  public MediaLink media(
      @PathVariable String id,
      @RequestHeader(value = "X-User", required = false) String principal) {
    return jobService.mediaLink(id, principal);
  }

  @PostMapping("/api/jobs/{id}/summary")
  @Operation(summary = "Summarize a completed job")
  public Summary summarize(@PathVariable String id) {
    return summaryService.summarize(id);
  }

  @GetMapping("/api/jobs/{id}/summary")
  @Operation(summary = "Get the stored summary of a job")
  public Summary summary(@PathVariable String id) {
    return summaryService
        .find(id)
        .orElseThrow(() -> new NotFoundException("No summary for job " + id));
  }

  @DeleteMapping("/api/jobs/{id}/summary")
  @Operation(summary = "Delete the summary of a job", description = "The job itself is kept")
  public ResponseEntity<Void> deleteSummary(
      @PathVariable String id,
      @RequestHeader(value = "X-User", required = false) String principal) {
    jobService.deleteSummary(id, principal);
    return ResponseEntity.noContent().build();
  }
}
