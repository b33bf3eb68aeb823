package com.scholary.poster.api;

import com.scholary.poster.job.JobSnapshot;
import com.scholary.poster.notification.EventStreamProperties;
import com.scholary.poster.notification.JobSubscription;
import com.scholary.poster.service.PosterJobService;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Bridges job subscriptions to Server-Sent Event connections.
 *
 * <p>Each connection gets its own subscription and one task on the event stream executor that
 * drains it into the emitter. An idle connection receives a comment every heartbeat interval so
 * proxies keep it open and a vanished client is noticed. The stream completes after the terminal
 * update.
 */
@Component
public class JobEventStreamer {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobEventStreamer.class);

  static final String EVENT_NAME = "job-update";

  private final PosterJobService jobService;
  private final Executor executor;
  private final Duration heartbeat;
  private final long emitterTimeoutMs;
  private final AtomicInteger activeStreams = new AtomicInteger();

  public JobEventStreamer(
      PosterJobService jobService,
      EventStreamProperties properties,
      @Qualifier("eventStreamExecutor") Executor executor) {
    this.jobService = jobService;
    this.executor = executor;
    this.heartbeat = Duration.ofSeconds(properties.heartbeatSeconds());
    this.emitterTimeoutMs = Duration.ofMinutes(properties.emitterTimeoutMinutes()).toMillis();
  }

  /**
   * Open an event stream for a job.
   *
   * @return the emitter, or empty if the job is unknown
   */
  public Optional<SseEmitter> open(String jobId) {
    Optional<JobSnapshot> current = jobService.find(jobId);
    if (current.isEmpty()) {
      return Optional.empty();
    }

    SseEmitter emitter = newEmitter(emitterTimeoutMs);

    // Already finished: the stored record is the whole story.
    if (current.get().isTerminal()) {
      try {
        send(emitter, current.get());
        emitter.complete();
      } catch (IOException e) {
        emitter.completeWithError(e);
      }
      return Optional.of(emitter);
    }

    Optional<JobSubscription> subscribed = jobService.subscribe(jobId);
    if (subscribed.isEmpty()) {
      return Optional.empty();
    }
    JobSubscription subscription = subscribed.get();

    AtomicBoolean closed = new AtomicBoolean(false);
    Runnable cleanup =
        () -> {
          if (closed.compareAndSet(false, true)) {
            jobService.unsubscribe(subscription);
            activeStreams.decrementAndGet();
            LOGGER.debug("Event stream closed for job {}", jobId);
          }
        };
    emitter.onCompletion(cleanup);
    emitter.onTimeout(cleanup);
    emitter.onError(error -> cleanup.run());

    activeStreams.incrementAndGet();
    try {
      executor.execute(() -> pump(emitter, subscription, closed));
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Too many event streams, refusing stream for job {}", jobId);
      cleanup.run();
      emitter.completeWithError(e);
    }
    return Optional.of(emitter);
  }

  SseEmitter newEmitter(long timeoutMs) {
    return new SseEmitter(timeoutMs);
  }

  /** Number of connections currently being served. */
  public int activeStreamCount() {
    return activeStreams.get();
  }

  private void pump(SseEmitter emitter, JobSubscription subscription, AtomicBoolean closed) {
    try {
      while (!closed.get() && !subscription.isFinished()) {
        Optional<JobSnapshot> next = subscription.poll(heartbeat);
        if (next.isPresent()) {
          send(emitter, next.get());
        } else if (!subscription.isFinished()) {
          emitter.send(SseEmitter.event().comment("heartbeat"));
        }
      }
      if (!closed.get()) {
        emitter.complete();
      }
    } catch (IOException | IllegalStateException e) {
      LOGGER.debug(
          "Event stream for job {} ended by client: {}", subscription.jobId(), e.getMessage());
      emitter.completeWithError(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      emitter.complete();
    }
  }

  private static void send(SseEmitter emitter, JobSnapshot snapshot) throws IOException {
    emitter.send(
        SseEmitter.event()
            .name(EVENT_NAME)
            .data(JobStatusResponse.from(snapshot), MediaType.APPLICATION_JSON));
  }
}
