package com.scholary.poster.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.scholary.poster.api.PosterRequest;
import com.scholary.poster.notification.JobNotificationHub;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory store for poster jobs.
 *
 * <p>Uses a Caffeine cache so that finished jobs are eventually evicted and memory stays bounded.
 * Job state is ephemeral: nothing survives a restart.
 *
 * <p>Records are immutable {@link JobSnapshot}s. Every mutation goes through {@link #update},
 * which merges atomically per key using {@link ConcurrentMap#computeIfPresent}. Concurrent updates
 * for the same job are therefore applied one at a time in arrival order, while reads are served
 * from whatever snapshot is current and never wait for a writer.
 *
 * <p>Each applied update is published to the {@link JobNotificationHub} from inside the per-key
 * critical section, so observers see updates in exactly the order they were applied. Publishing
 * only enqueues and never blocks.
 */
@Repository
public class JobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobStore.class);

  private final ConcurrentMap<String, JobSnapshot> jobs;
  private final JobNotificationHub notificationHub;

  public JobStore(
      JobNotificationHub notificationHub,
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.notificationHub = notificationHub;

    Cache<String, JobSnapshot> cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .removalListener(
                (String jobId, JobSnapshot job, RemovalCause cause) -> {
                  if (cause.wasEvicted()) {
                    LOGGER.info("Evicted job: jobId={}, cause={}", jobId, cause);
                    notificationHub.forget(jobId);
                  }
                })
            .build();
    this.jobs = cache.asMap();
  }

  /**
   * Create a new PENDING job.
   *
   * @param request the validated poster request
   * @return the new job ID
   */
  public String create(PosterRequest request) {
    Objects.requireNonNull(request, "request");

    while (true) {
      String jobId = UUID.randomUUID().toString();
      JobSnapshot job = JobSnapshot.pending(jobId, request, Instant.now());
      if (jobs.putIfAbsent(jobId, job) == null) {
        LOGGER.debug("Created job: jobId={}", jobId);
        return jobId;
      }
      LOGGER.warn("Job ID collision on {}, generating a new one", jobId);
    }
  }

  public Optional<JobSnapshot> get(String jobId) {
    if (jobId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(jobs.get(jobId));
  }

  /**
   * Merge fields into an existing job and notify observers.
   *
   * @param jobId the job to update
   * @param update the fields to merge
   * @return whether the update was applied, ignored, or the job was not found
   * @throws IllegalJobUpdateException if the update would break a record invariant
   */
  public UpdateResult update(String jobId, JobUpdate update) {
    Objects.requireNonNull(update, "update");
    if (jobId == null) {
      return UpdateResult.NOT_FOUND;
    }

    AtomicReference<UpdateResult> result = new AtomicReference<>(UpdateResult.NOT_FOUND);
    jobs.computeIfPresent(
        jobId,
        (id, current) -> {
          Optional<JobSnapshot> merged = JobStateMachine.apply(current, update);
          if (merged.isEmpty()) {
            result.set(UpdateResult.IGNORED);
            return current;
          }
          result.set(UpdateResult.APPLIED);
          notificationHub.publish(id, merged.get());
          return merged.get();
        });

    if (result.get() == UpdateResult.NOT_FOUND) {
      LOGGER.debug("Update for unknown job ignored: jobId={}", jobId);
    }
    return result.get();
  }

  /**
   * Remove a job. Live subscriptions for it are closed.
   *
   * @return true if a record was removed
   */
  public boolean delete(String jobId) {
    if (jobId == null) {
      return false;
    }
    boolean removed = jobs.remove(jobId) != null;
    if (removed) {
      notificationHub.forget(jobId);
      LOGGER.info("Deleted job: jobId={}", jobId);
    }
    return removed;
  }

  /** Number of records currently held. */
  public int size() {
    return jobs.size();
  }
}
