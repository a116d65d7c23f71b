package io.b2mash.b2b.checkinmonitor.checkin;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CheckInRepository extends JpaRepository<CheckIn, UUID> {

  /** Lightweight projection used by the snapshot history loader. */
  interface CheckInFact {
    UUID getPersonId();

    LocalDate getCheckInDate();

    int getReadinessScore();
  }

  @Query(
      """
      SELECT c.personId FROM CheckIn c
      WHERE c.companyId = :companyId
        AND c.personId IN :personIds
        AND c.checkInDate = :date
      """)
  List<UUID> findPersonIdsCheckedInOn(
      @Param("companyId") UUID companyId,
      @Param("personIds") Collection<UUID> personIds,
      @Param("date") LocalDate date);

  /** Check-ins in [from, to) for all given workers, newest first. */
  @Query(
      """
      SELECT c.personId AS personId, c.checkInDate AS checkInDate,
             c.readinessScore AS readinessScore
      FROM CheckIn c
      WHERE c.companyId = :companyId
        AND c.personId IN :personIds
        AND c.checkInDate >= :from
        AND c.checkInDate < :to
      ORDER BY c.checkInDate DESC
      """)
  List<CheckInFact> findFactsInRange(
      @Param("companyId") UUID companyId,
      @Param("personIds") Collection<UUID> personIds,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);
}
