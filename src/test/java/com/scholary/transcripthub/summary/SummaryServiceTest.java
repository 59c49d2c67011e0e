package com.scholary.transcripthub.summary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.transcripthub.exception.NotFoundException;
import com.scholary.transcripthub.exception.ValidationException;
import com.scholary.transcripthub.job.JobRepository;
import com.scholary.transcripthub.job.JobStatus;
import com.scholary.transcripthub.job.TranscriptionJob;
import com.scholary.transcripthub.segment.Segment;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SummaryServiceTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  @Mock private JobRepository jobRepository;
  @Mock private Summarizer summarizer;
  @Mock private TranscriptionJob job;

  private SummaryService service;

  @BeforeEach
  void setUp() {
    service =
        new SummaryService(
            jobRepository,
            new SummaryRepository(100, 60),
            summarizer,
            Clock.fixed(T0, ZoneOffset.UTC));
  }

  @Test
  void summarize_shouldStoreSummaryOfCompletedJob() {
    List<Segment> segments = List.of(new Segment(0.0, 1.0, "Hello.", "A", null));
    when(jobRepository.findById("job-1")).thenReturn(Optional.of(job));
    when(job.getStatus()).thenReturn(JobStatus.COMPLETED);
    when(job.getSegments()).thenReturn(segments);
    when(summarizer.summarize(segments))
        .thenReturn(new SummaryContent("Greeting.", List.of(new SummaryPoint("Hello", 0.0))));

    Summary summary = service.summarize("job-1");

    assertThat(summary.jobId()).isEqualTo("job-1");
    assertThat(summary.overview()).isEqualTo("Greeting.");
    assertThat(summary.createdAt()).isEqualTo(T0);
    assertThat(service.find("job-1")).contains(summary);
  }

  @Test
  void summarize_shouldRejectJobStillRunning() {
    when(jobRepository.findById("job-1")).thenReturn(Optional.of(job));
    when(job.getStatus()).thenReturn(JobStatus.PROCESSING);

    assertThatThrownBy(() -> service.summarize("job-1"))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("PROCESSING");
    verifyNoInteractions(summarizer);
    assertThat(service.find("job-1")).isEmpty();
  }

  @Test
  void summarize_shouldReportMissingJob() {
    when(jobRepository.findById("nope")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.summarize("nope")).isInstanceOf(NotFoundException.class);
  }

  @Test
  void summarize_shouldNotStoreWhenSummarizerFails() {
    when(jobRepository.findById("job-1")).thenReturn(Optional.of(job));
    when(job.getStatus()).thenReturn(JobStatus.COMPLETED);
    when(job.getSegments()).thenReturn(List.of());
    when(summarizer.summarize(List.of())).thenThrow(new IllegalStateException("quota"));

    assertThatThrownBy(() -> service.summarize("job-1")).hasMessage("quota");
    assertThat(service.find("job-1")).isEmpty();
  }
}
