package io.b2mash.b2b.checkinmonitor.notification;

import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class NotificationService {

  private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

  public static final String TYPE_MISSED_CHECK_IN = "MISSED_CHECK_IN";

  private final NotificationRepository notificationRepository;

  public NotificationService(NotificationRepository notificationRepository) {
    this.notificationRepository = notificationRepository;
  }

  /**
   * Persists in-app notifications for a tenant in their own transaction, so a failure here never
   * affects the caller's already-committed work.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public int sendNotifications(UUID companyId, List<NotificationIntent> intents) {
    if (intents.isEmpty()) {
      return 0;
    }
    var notifications =
        intents.stream()
            .map(
                i ->
                    new Notification(
                        companyId, i.recipientId(), i.type(), i.title(), i.message()))
            .toList();
    notificationRepository.saveAll(notifications);
    log.debug("Created {} notifications for company {}", notifications.size(), companyId);
    return notifications.size();
  }

  @Transactional(readOnly = true)
  public List<Notification> listNotifications(UUID companyId, UUID personId) {
    return notificationRepository.findByCompanyIdAndRecipientPersonIdOrderByCreatedAtDesc(
        companyId, personId);
  }
}
