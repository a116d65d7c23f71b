package io.b2mash.b2b.checkinmonitor.holiday;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Answers holiday questions for a tenant. Dates are tenant-local calendar dates, so the company
 * timezone has already been applied by the caller when it derived {@code date}.
 *
 * <p>Repository failures propagate. A failed lookup must never be read as "not a holiday".
 */
@Service
public class HolidayService {

  private final HolidayRepository holidayRepository;

  public HolidayService(HolidayRepository holidayRepository) {
    this.holidayRepository = holidayRepository;
  }

  @Transactional(readOnly = true)
  public boolean isHoliday(UUID companyId, LocalDate date) {
    if (holidayRepository.existsByCompanyIdAndHolidayDateAndRecurringFalse(companyId, date)) {
      return true;
    }
    return holidayRepository.findByCompanyIdAndRecurringTrue(companyId).stream()
        .anyMatch(h -> h.matches(date));
  }

  /**
   * Returns every holiday date in [from, to], both ends inclusive. Loads the tenant's holidays once
   * and expands recurring entries over the range.
   */
  @Transactional(readOnly = true)
  public Set<LocalDate> holidaySet(UUID companyId, LocalDate from, LocalDate to) {
    var holidays = holidayRepository.findByCompanyId(companyId);
    var result = new HashSet<LocalDate>();
    if (holidays.isEmpty()) {
      return result;
    }
    for (var day = from; !day.isAfter(to); day = day.plusDays(1)) {
      for (var holiday : holidays) {
        if (holiday.matches(day)) {
          result.add(day);
          break;
        }
      }
    }
    return result;
  }
}
