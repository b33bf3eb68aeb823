package com.scholary.poster.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.scholary.poster.api.PosterRequest;
import com.scholary.poster.api.PosterSize;
import com.scholary.poster.config.PosterStorageProperties;
import com.scholary.poster.gallery.GalleryStore;
import com.scholary.poster.job.JobSnapshot;
import com.scholary.poster.job.JobStatus;
import com.scholary.poster.job.JobStore;
import com.scholary.poster.job.JobUpdate;
import com.scholary.poster.notification.EventStreamProperties;
import com.scholary.poster.notification.JobNotificationHub;
import com.scholary.poster.notification.JobSubscription;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PosterJobServiceTest {

  private static final PosterRequest REQUEST =
      PosterRequest.of("Testville", "Nowhere", "noir", PosterSize.AUTO);

  @Mock private RenderOrchestrator orchestrator;
  @Mock private GalleryStore galleryStore;

  @TempDir Path tempDir;

  private JobNotificationHub hub;
  private JobStore store;
  private PosterStorageProperties storageProperties;

  @BeforeEach
  void setUp() {
    hub = new JobNotificationHub(new EventStreamProperties(16, 30, 30, 4));
    store = new JobStore(hub, 100, 60);
    storageProperties = new PosterStorageProperties(tempDir.toString(), tempDir.toString());
  }

  @Test
  void submit_shouldCreatePendingJobAndScheduleRender() {
    PosterJobService service = service(Runnable::run);

    JobSnapshot job = service.submit(REQUEST);

    assertThat(job.status()).isEqualTo(JobStatus.PENDING);
    assertThat(job.request()).isEqualTo(REQUEST);
    verify(orchestrator).run(job.jobId(), REQUEST);
  }

  @Test
  void submit_shouldLeaveJobPendingUntilWorkerPicksItUp() {
    PosterJobService service = service(task -> {});

    JobSnapshot job = service.submit(REQUEST);

    assertThat(service.find(job.jobId()).orElseThrow().status()).isEqualTo(JobStatus.PENDING);
    verify(orchestrator, never()).run(any(), any());
  }

  @Test
  void submit_shouldFailJobWhenRenderThrows() {
    doThrow(new IllegalStateException("renderer exploded")).when(orchestrator).run(any(), any());
    PosterJobService service = service(Runnable::run);

    JobSnapshot job = service.submit(REQUEST);

    JobSnapshot stored = service.find(job.jobId()).orElseThrow();
    assertThat(stored.status()).isEqualTo(JobStatus.FAILED);
    assertThat(stored.error()).isEqualTo("renderer exploded");
  }

  @Test
  void submit_shouldUseExceptionTypeWhenFailureMessageIsBlank() {
    doThrow(new IllegalStateException("")).when(orchestrator).run(any(), any());
    PosterJobService service = service(Runnable::run);

    JobSnapshot job = service.submit(REQUEST);

    JobSnapshot stored = service.find(job.jobId()).orElseThrow();
    assertThat(stored.status()).isEqualTo(JobStatus.FAILED);
    assertThat(stored.error()).isEqualTo("IllegalStateException");
  }

  @Test
  void submit_shouldUseRootCauseMessageOfWrappedFailure() {
    doThrow(new IllegalStateException("wrapper", new IOException("disk full")))
        .when(orchestrator)
        .run(any(), any());
    PosterJobService service = service(Runnable::run);

    JobSnapshot job = service.submit(REQUEST);

    assertThat(service.find(job.jobId()).orElseThrow().error()).isEqualTo("disk full");
  }

  @Test
  void submit_shouldFailJobWhenExecutorIsSaturated() {
    PosterJobService service =
        service(
            task -> {
              throw new RejectedExecutionException("queue full");
            });

    JobSnapshot job = service.submit(REQUEST);

    assertThat(job.status()).isEqualTo(JobStatus.FAILED);
    assertThat(job.error()).isEqualTo(PosterJobService.BUSY_MESSAGE);
  }

  @Test
  void subscribe_shouldReturnEmptyForUnknownJob() {
    PosterJobService service = service(task -> {});

    assertThat(service.subscribe("missing")).isEmpty();
    assertThat(hub.subscriberCount("missing")).isZero();
  }

  @Test
  void subscribe_shouldReceiveTerminalUpdate() throws Exception {
    PosterJobService service = service(task -> {});
    JobSnapshot job = service.submit(REQUEST);

    JobSubscription subscription = service.subscribe(job.jobId()).orElseThrow();
    store.update(job.jobId(), JobUpdate.completed("done"));

    assertThat(subscription.poll(Duration.ofSeconds(2)))
        .map(JobSnapshot::status)
        .contains(JobStatus.COMPLETED);
    service.unsubscribe(subscription);
    assertThat(subscription.isFinished()).isTrue();
  }

  @Test
  void subscribe_shouldYieldTerminalSnapshotOnceForFinishedJob() throws Exception {
    PosterJobService service = service(task -> {});
    JobSnapshot job = service.submit(REQUEST);
    store.update(job.jobId(), JobUpdate.completed("done"));

    JobSubscription late = service.subscribe(job.jobId()).orElseThrow();

    assertThat(late.poll(Duration.ofSeconds(2)))
        .map(JobSnapshot::status)
        .contains(JobStatus.COMPLETED);
    assertThat(late.poll(Duration.ofMillis(50))).isEmpty();
    assertThat(late.isFinished()).isTrue();
    assertThat(hub.subscriberCount(job.jobId())).isZero();
  }

  @Test
  void subscribe_shouldYieldFailureOfFinishedJob() throws Exception {
    PosterJobService service = service(task -> {});
    JobSnapshot job = service.submit(REQUEST);
    store.update(job.jobId(), JobUpdate.failed("renderer crashed"));

    JobSubscription late = service.subscribe(job.jobId()).orElseThrow();

    assertThat(late.poll(Duration.ofSeconds(2)))
        .map(JobSnapshot::error)
        .contains("renderer crashed");
    assertThat(late.isFinished()).isTrue();
  }

  @Test
  void subscribe_shouldNotYieldAnythingForRunningJobUntilItChanges() throws Exception {
    PosterJobService service = service(task -> {});
    JobSnapshot job = service.submit(REQUEST);
    store.update(job.jobId(), JobUpdate.processing(15, "Fetching map data..."));

    JobSubscription subscription = service.subscribe(job.jobId()).orElseThrow();

    assertThat(subscription.poll(Duration.ofMillis(50))).isEmpty();
    assertThat(subscription.isFinished()).isFalse();
    assertThat(hub.subscriberCount(job.jobId())).isEqualTo(1);
    service.unsubscribe(subscription);
  }

  @Test
  void delete_shouldRemoveJobImageAndGalleryEntry() throws Exception {
    PosterJobService service = service(task -> {});
    JobSnapshot job = service.submit(REQUEST);
    Path image = storageProperties.posterFile(job.jobId());
    Files.write(image, new byte[] {1, 2, 3});

    assertThat(service.delete(job.jobId())).isTrue();

    assertThat(service.find(job.jobId())).isEmpty();
    assertThat(image).doesNotExist();
    verify(galleryStore).remove(job.jobId());
  }

  @Test
  void delete_shouldReturnFalseForUnknownJob() {
    PosterJobService service = service(task -> {});

    assertThat(service.delete("missing")).isFalse();
    verify(galleryStore, never()).remove(any());
  }

  private PosterJobService service(Executor executor) {
    return new PosterJobService(store, hub, orchestrator, galleryStore, storageProperties, executor);
  }
}
