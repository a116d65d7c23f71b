package io.b2mash.b2b.checkinmonitor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings for the missed check-in detection pass.
 *
 * @param enabled whether the scheduled trigger runs the pass
 * @param windowBufferMinutes grace period after a check-in window closes before a miss is recorded
 * @param historyLookbackDays trailing window for holiday sets and snapshot history
 * @param readinessLookbackDays trailing window for the recent readiness average
 */
@ConfigurationProperties(prefix = "missed-check-in.detection")
public record DetectionProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("2") int windowBufferMinutes,
    @DefaultValue("90") int historyLookbackDays,
    @DefaultValue("7") int readinessLookbackDays) {

  public static DetectionProperties defaults() {
    return new DetectionProperties(true, 2, 90, 7);
  }
}
