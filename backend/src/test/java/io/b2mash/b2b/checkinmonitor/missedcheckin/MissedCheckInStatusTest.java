package io.b2mash.b2b.checkinmonitor.missedcheckin;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MissedCheckInStatusTest {

  @Test
  void open_canMoveToAnyOtherStatus() {
    assertThat(MissedCheckInStatus.OPEN.allowedTransitions())
        .containsExactlyInAnyOrder(
            MissedCheckInStatus.INVESTIGATING,
            MissedCheckInStatus.EXCUSED,
            MissedCheckInStatus.RESOLVED);
  }

  @Test
  void investigating_canOnlyBeClosed() {
    assertThat(MissedCheckInStatus.INVESTIGATING.canTransitionTo(MissedCheckInStatus.EXCUSED))
        .isTrue();
    assertThat(MissedCheckInStatus.INVESTIGATING.canTransitionTo(MissedCheckInStatus.RESOLVED))
        .isTrue();
    assertThat(MissedCheckInStatus.INVESTIGATING.canTransitionTo(MissedCheckInStatus.OPEN))
        .isFalse();
  }

  @Test
  void terminalStatuses_haveNoTransitions() {
    assertThat(MissedCheckInStatus.EXCUSED.isTerminal()).isTrue();
    assertThat(MissedCheckInStatus.RESOLVED.isTerminal()).isTrue();
    assertThat(MissedCheckInStatus.EXCUSED.allowedTransitions()).isEmpty();
    assertThat(MissedCheckInStatus.RESOLVED.allowedTransitions()).isEmpty();
    assertThat(MissedCheckInStatus.OPEN.isTerminal()).isFalse();
  }

  @Test
  void noStatus_transitionsToItself() {
    for (var status : MissedCheckInStatus.values()) {
      assertThat(status.canTransitionTo(status)).as(status.name()).isFalse();
    }
  }
}
