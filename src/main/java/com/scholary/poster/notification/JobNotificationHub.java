package com.scholary.poster.notification;

import com.scholary.poster.job.JobSnapshot;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory fan-out of job updates to per-job observers.
 *
 * <p>Every observer owns a {@link JobSubscription} with its own bounded queue. Publishing only
 * offers the snapshot to each queue, so a slow or vanished observer can neither delay the caller
 * (the {@code JobStore} update path) nor other observers.
 *
 * <p>The hub keeps no job state of its own. A subscriber to a job that may already be finished
 * gets the terminal snapshot from the store through {@link #catchUp}. Intermediate snapshots are
 * never replayed.
 */
@Component
public class JobNotificationHub {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobNotificationHub.class);

  /** Live subscriptions keyed by job ID. */
  private final ConcurrentHashMap<String, Set<JobSubscription>> subscriptions =
      new ConcurrentHashMap<>();

  private final int queueCapacity;

  public JobNotificationHub(EventStreamProperties properties) {
    this.queueCapacity = properties.subscriberQueueCapacity();
  }

  /**
   * Register interest in a job's future updates.
   *
   * @param jobId the job to observe
   * @return a subscription handle
   */
  public JobSubscription subscribe(String jobId) {
    JobSubscription subscription = new JobSubscription(jobId, queueCapacity);
    subscriptions.compute(
        jobId,
        (id, current) -> {
          Set<JobSubscription> set = current != null ? current : new CopyOnWriteArraySet<>();
          set.add(subscription);
          return set;
        });
    LOGGER.debug("Subscribed to job {}", jobId);
    return subscription;
  }

  /**
   * Hand a subscription the job's current snapshot if it is terminal.
   *
   * <p>Call after {@link #subscribe(String)} with a snapshot read after registering: a terminal
   * publish racing with the registration is then either delivered through it or seen here. The
   * subscription accepts only one terminal snapshot, so both paths together still yield it once.
   */
  public void catchUp(JobSubscription subscription, JobSnapshot current) {
    if (current == null || !current.isTerminal()) {
      return;
    }
    subscription.offer(current);
    detach(subscription);
    LOGGER.debug("Caught up subscription for finished job {}", subscription.jobId());
  }

  /** Deregister and close a subscription. Safe to call repeatedly and during a publish. */
  public void unsubscribe(JobSubscription subscription) {
    if (subscription == null) {
      return;
    }
    detach(subscription);
    if (!subscription.isClosed()) {
      subscription.close();
      LOGGER.debug("Unsubscribed from job {}", subscription.jobId());
    }
  }

  /**
   * Deliver a snapshot to every current observer of the job.
   *
   * <p>Never throws and never blocks. A terminal snapshot also completes and deregisters all
   * observers of the job.
   */
  public void publish(String jobId, JobSnapshot snapshot) {
    Set<JobSubscription> observers = subscriptions.get(jobId);
    if (observers != null) {
      for (JobSubscription observer : observers) {
        deliverSafely(observer, snapshot);
      }
      LOGGER.debug(
          "Published job update: jobId={}, status={}, progress={}, observers={}",
          jobId,
          snapshot.status(),
          snapshot.progress(),
          observers.size());
    }

    if (snapshot.isTerminal()) {
      subscriptions.remove(jobId);
    }
  }

  /** Close and deregister every subscription of a job. */
  public void forget(String jobId) {
    Set<JobSubscription> observers = subscriptions.remove(jobId);
    if (observers != null) {
      observers.forEach(JobSubscription::close);
      LOGGER.debug("Closed {} subscriptions for forgotten job {}", observers.size(), jobId);
    }
  }

  /** Number of registered observers for a job. */
  public int subscriberCount(String jobId) {
    Set<JobSubscription> observers = subscriptions.get(jobId);
    return observers == null ? 0 : observers.size();
  }

  private void detach(JobSubscription subscription) {
    subscriptions.computeIfPresent(
        subscription.jobId(),
        (id, set) -> {
          set.remove(subscription);
          return set.isEmpty() ? null : set;
        });
  }

  private void deliverSafely(JobSubscription observer, JobSnapshot snapshot) {
    try {
      observer.offer(snapshot);
    } catch (RuntimeException e) {
      LOGGER.warn(
          "Observer failed for job {}, removing it: {}", observer.jobId(), e.getMessage(), e);
      unsubscribe(observer);
    }
  }
}
