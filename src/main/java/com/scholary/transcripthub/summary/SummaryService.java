package com.scholary.transcripthub.summary;

import com.scholary.transcripthub.exception.NotFoundException;
import com.scholary.transcripthub.exception.ValidationException;
import com.scholary.transcripthub.job.JobRepository;
import com.scholary.transcripthub.job.JobStatus;
import com.scholary.transcripthub.job.TranscriptionJob;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Summarizes completed jobs and keeps one summary per job. */
@Service
public class SummaryService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SummaryService.class);

  private final JobRepository jobRepository;
  private final SummaryRepository summaryRepository;
  private final Summarizer summarizer;
  private final Clock clock;

  public SummaryService(
      JobRepository jobRepository,
      SummaryRepository summaryRepository,
      Summarizer summarizer,
      Clock clock) {
    this.jobRepository = jobRepository;
    this.summaryRepository = summaryRepository;
    this.summarizer = summarizer;
    this.clock = clock;
  }

  /**
   * Summarize a job, replacing any earlier summary.
   *
   * @throws NotFoundException if the job does not exist
   * @throws ValidationException if the job has not completed
   */
  public Summary summarize(String jobId) {
    TranscriptionJob job =
        jobRepository.findById(jobId).orElseThrow(() -> NotFoundException.job(jobId));
    if (job.getStatus() != JobStatus.COMPLETED) {
      throw new ValidationException(
          String.format(
              "Job %s is %s; only completed jobs can be summarized", jobId, job.getStatus()));
    }

    SummaryContent content = summarizer.summarize(job.getSegments());
    Summary summary = new Summary(jobId, content.overview(), content.points(), clock.instant());
    summaryRepository.save(summary);
    LOGGER.info("Stored summary for job {}: {} points", jobId, summary.points().size());
    return summary;
  }

  public Optional<Summary> find(String jobId) {
    return summaryRepository.findByJobId(jobId);
  }
}
