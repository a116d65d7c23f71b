package io.b2mash.b2b.checkinmonitor.missedcheckin;

import io.b2mash.b2b.checkinmonitor.notification.NotificationIntent;
import io.b2mash.b2b.checkinmonitor.notification.NotificationService;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Turns newly detected misses into notification intents: one per worker, plus one aggregated
 * alert per team leader and missed date so a leader with N missing workers gets a single message.
 */
@Component
public class MissedCheckInNotificationBatcher {

  static final String WORKER_TITLE = "Missed Check-in";
  static final String LEADER_TITLE = "Team Missed Check-ins";

  public List<NotificationIntent> buildIntents(List<DetectedMiss> misses) {
    var intents = new ArrayList<NotificationIntent>();
    var countByLeaderDay = new LinkedHashMap<LeaderDay, Integer>();

    for (var miss : misses) {
      intents.add(
          new NotificationIntent(
              miss.personId(),
              NotificationService.TYPE_MISSED_CHECK_IN,
              WORKER_TITLE,
              "You missed your check-in for "
                  + miss.missedDate()
                  + ". Please contact your team lead if needed."));
      if (miss.leaderId() != null) {
        countByLeaderDay.merge(new LeaderDay(miss.leaderId(), miss.missedDate()), 1, Integer::sum);
      }
    }

    countByLeaderDay.forEach(
        (leaderDay, count) ->
            intents.add(
                new NotificationIntent(
                    leaderDay.leaderId(),
                    NotificationService.TYPE_MISSED_CHECK_IN,
                    LEADER_TITLE,
                    count
                        + (count > 1 ? " workers" : " worker")
                        + " missed their check-in for "
                        + leaderDay.date()
                        + ".")));
    return intents;
  }

  private record LeaderDay(UUID leaderId, LocalDate date) {}
}
