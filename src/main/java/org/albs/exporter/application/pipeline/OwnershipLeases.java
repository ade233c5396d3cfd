package org.albs.exporter.application.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import org.albs.exporter.application.port.OwnershipPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Grants exclusive, time-bounded ownership of exported directories to the operator.
 * <p><strong>Why:</strong> Exported trees belong to the repository service account; post-export tooling
 * runs as the operator and must hand the tree back afterwards, whatever happens in between.</p>
 * <p><strong>Guarantees:</strong>
 * <ul>
 *   <li>At most one lease per directory exists at a time; other workers block until it is closed.</li>
 *   <li>Closing a lease returns ownership to the service account even when the worker is interrupted.</li>
 *   <li>A {@link DirectoryGuard} takes the same lock without changing ownership, for workers that only read
 *       a sibling tree.</li>
 * </ul>
 * <p>Lock order: a worker holding a lease on a secondary architecture may guard its primary sibling; a
 * primary architecture never waits for a secondary one.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class OwnershipLeases {
  private static final Logger log = LoggerFactory.getLogger(OwnershipLeases.class);

  private final OwnershipPort ownership;
  private final String operator;
  private final String serviceOwner;
  private final ConcurrentMap<Path, ReentrantLock> locks = new ConcurrentHashMap<>();

  public OwnershipLeases(OwnershipPort ownership, String operator, String serviceOwner) {
    this.ownership = Objects.requireNonNull(ownership, "ownership");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.serviceOwner = Objects.requireNonNull(serviceOwner, "serviceOwner");
  }

  /**
   * Locks {@code directory} and transfers it to the operator.
   *
   * @param directory repository directory
   * @return lease that must be closed
   * @throws IOException when ownership cannot be transferred; the lock is released and the tree is
   *     handed back to the service account
   * @throws InterruptedException when interrupted while waiting for the lock
   */
  public OwnershipLease acquire(Path directory) throws IOException, InterruptedException {
    Path key = key(directory);
    ReentrantLock lock = lockFor(key);
    lock.lockInterruptibly();
    OwnershipLease lease = new OwnershipLease(key, lock);
    try {
      ownership.chown(key, operator, true);
    } catch (IOException | InterruptedException | RuntimeException ex) {
      lease.closeAfterFailure(ex);
      throw ex;
    }
    log.debug("Ownership of {} leased to {}", key, operator);
    return lease;
  }

  /**
   * Waits until no lease is held on {@code directory} and keeps it locked until the guard is closed.
   *
   * @param directory repository directory to read
   * @return guard that must be closed
   * @throws InterruptedException when interrupted while waiting for the lock
   */
  public DirectoryGuard guard(Path directory) throws InterruptedException {
    Path key = key(directory);
    ReentrantLock lock = lockFor(key);
    lock.lockInterruptibly();
    log.debug("Guarding {} for reading", key);
    return new DirectoryGuard(lock);
  }

  boolean isLocked(Path directory) {
    ReentrantLock lock = locks.get(key(directory));
    return lock != null && lock.isLocked();
  }

  private ReentrantLock lockFor(Path key) {
    return locks.computeIfAbsent(key, ignored -> new ReentrantLock());
  }

  private static Path key(Path directory) {
    return directory.toAbsolutePath().normalize();
  }

  /** Read access to a directory no lease currently holds. */
  public static final class DirectoryGuard implements AutoCloseable {
    private final ReentrantLock lock;
    private boolean closed;

    private DirectoryGuard(ReentrantLock lock) {
      this.lock = lock;
    }

    @Override
    public void close() {
      if (!closed) {
        closed = true;
        lock.unlock();
      }
    }
  }

  /** Exclusive ownership of one directory; closing it hands the tree back. */
  public final class OwnershipLease implements AutoCloseable {
    private final Path directory;
    private final ReentrantLock lock;
    private boolean closed;

    private OwnershipLease(Path directory, ReentrantLock lock) {
      this.directory = directory;
      this.lock = lock;
    }

    public Path directory() {
      return directory;
    }

    /**
     * Returns the tree to the service account and unlocks the directory.
     *
     * @throws IOException when ownership cannot be returned; the directory is unlocked regardless
     */
    @Override
    public void close() throws IOException {
      if (closed) {
        return;
      }
      closed = true;
      // run the release even if this worker was interrupted; restore the flag afterwards
      boolean interrupted = Thread.interrupted();
      try {
        ownership.chown(directory, serviceOwner, true);
        log.debug("Ownership of {} returned to {}", directory, serviceOwner);
      } catch (InterruptedException ex) {
        interrupted = true;
        throw new IOException("interrupted while returning ownership of " + directory, ex);
      } finally {
        lock.unlock();
        if (interrupted) {
          Thread.currentThread().interrupt();
        }
      }
    }

    private void closeAfterFailure(Exception cause) {
      try {
        close();
      } catch (IOException ex) {
        cause.addSuppressed(ex);
      }
    }
  }
}
