package io.b2mash.b2b.checkinmonitor.notification;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

  List<Notification> findByCompanyIdAndRecipientPersonIdOrderByCreatedAtDesc(
      UUID companyId, UUID recipientPersonId);
}
