package io.b2mash.b2b.checkinmonitor.missedcheckin;

import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.stereotype.Component;

/**
 * Process-local run lock. Only prevents overlap within one JVM; multi-instance deployments need a
 * shared implementation of {@link DetectionRunLock} registered as {@code @Primary}.
 */
@Component
public class InMemoryDetectionRunLock implements DetectionRunLock {

  private final AtomicBoolean running = new AtomicBoolean(false);

  @Override
  public boolean tryAcquire() {
    return running.compareAndSet(false, true);
  }

  @Override
  public void release() {
    running.set(false);
  }
}
