package io.b2mash.b2b.checkinmonitor.holiday;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Company holiday. A recurring holiday matches the same month and day in every year; a one-off
 * holiday matches its exact date only.
 */
@Entity
@Table(name = "holidays")
public class Holiday {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "company_id", nullable = false)
  private UUID companyId;

  @Column(name = "name", nullable = false)
  private String name;

  @Column(name = "holiday_date", nullable = false)
  private LocalDate holidayDate;

  @Column(name = "is_recurring", nullable = false)
  private boolean recurring;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Holiday() {}

  public Holiday(UUID companyId, String name, LocalDate holidayDate, boolean recurring) {
    this.companyId = companyId;
    this.name = name;
    this.holidayDate = holidayDate;
    this.recurring = recurring;
    this.createdAt = Instant.now();
  }

  public boolean matches(LocalDate date) {
    if (recurring) {
      return holidayDate.getMonth() == date.getMonth()
          && holidayDate.getDayOfMonth() == date.getDayOfMonth();
    }
    return holidayDate.equals(date);
  }

  public UUID getId() {
    return id;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public String getName() {
    return name;
  }

  public LocalDate getHolidayDate() {
    return holidayDate;
  }

  public boolean isRecurring() {
    return recurring;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
