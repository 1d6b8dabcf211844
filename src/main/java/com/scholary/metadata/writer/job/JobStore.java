package com.scholary.metadata.writer.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory registry of metadata jobs.
 *
 * <p>Backed by a Caffeine cache. Eviction is off unless {@code jobstore.maxSize} or {@code
 * jobstore.expireAfterMinutes} is positive, so by default a job lives as long as the process.
 *
 * <p>A read/write lock guards the whole map: creation and updates take the write lock, polling
 * takes the read lock. Updates are applied as functions over the current snapshot, with two rules
 * enforced here rather than in every caller:
 *
 * <ul>
 *   <li>progress never goes down
 *   <li>a job that reports {@code done} is frozen
 * </ul>
 */
@Repository
public class JobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobStore.class);

  private final Cache<String, MetadataJob> cache;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  public JobStore(
      @Value("${jobstore.maxSize:0}") long maxSize,
      @Value("${jobstore.expireAfterMinutes:0}") long expireAfterMinutes) {

    Caffeine<Object, Object> builder = Caffeine.newBuilder();
    if (maxSize > 0) {
      builder.maximumSize(maxSize);
    }
    if (expireAfterMinutes > 0) {
      builder.expireAfterWrite(Duration.ofMinutes(expireAfterMinutes));
    }
    this.cache = builder.build();
  }

  /**
   * Register a new job in the {@link JobStage#QUEUED} stage.
   *
   * @throws IllegalStateException if the id is already taken
   */
  public MetadataJob create(String jobId) {
    lock.writeLock().lock();
    try {
      if (cache.getIfPresent(jobId) != null) {
        throw new IllegalStateException("Job already exists: " + jobId);
      }
      MetadataJob job = MetadataJob.queued(jobId);
      cache.put(jobId, job);
      return job;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Apply a change to a job.
   *
   * @param jobId the job to change
   * @param change derives the next snapshot from the current one
   * @return the stored snapshot after the change, or empty if the job is unknown
   */
  public Optional<MetadataJob> update(String jobId, UnaryOperator<MetadataJob> change) {
    lock.writeLock().lock();
    try {
      MetadataJob current = cache.getIfPresent(jobId);
      if (current == null) {
        return Optional.empty();
      }
      if (current.done()) {
        LOGGER.debug("Ignoring update to finished job {}", jobId);
        return Optional.of(current);
      }
      MetadataJob next = change.apply(current);
      if (next.progress() < current.progress()) {
        next = next.withProgress(current.progress());
      }
      cache.put(jobId, next);
      return Optional.of(next);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Optional<MetadataJob> findById(String jobId) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(cache.getIfPresent(jobId));
    } finally {
      lock.readLock().unlock();
    }
  }

  public long size() {
    lock.readLock().lock();
    try {
      return cache.estimatedSize();
    } finally {
      lock.readLock().unlock();
    }
  }
}
