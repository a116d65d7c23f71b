package io.b2mash.b2b.checkinmonitor.holiday;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface HolidayRepository extends JpaRepository<Holiday, UUID> {

  boolean existsByCompanyIdAndHolidayDateAndRecurringFalse(UUID companyId, LocalDate date);

  List<Holiday> findByCompanyIdAndRecurringTrue(UUID companyId);

  List<Holiday> findByCompanyId(UUID companyId);
}
