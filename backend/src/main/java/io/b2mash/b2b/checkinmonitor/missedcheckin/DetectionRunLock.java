package io.b2mash.b2b.checkinmonitor.missedcheckin;

/**
 * Guards a detection pass so at most one runs at a time. A second caller does not wait; it gets
 * {@code false} from {@link #tryAcquire()} and skips.
 */
public interface DetectionRunLock {

  boolean tryAcquire();

  void release();
}
