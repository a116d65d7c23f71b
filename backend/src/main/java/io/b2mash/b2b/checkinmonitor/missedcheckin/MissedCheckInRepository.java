package io.b2mash.b2b.checkinmonitor.missedcheckin;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MissedCheckInRepository extends JpaRepository<MissedCheckIn, UUID> {

  /** Projection for prior misses consumed by the snapshot history loader. */
  interface MissFact {
    UUID getPersonId();

    LocalDate getMissedDate();
  }

  /** Projection for GROUP BY status count queries. */
  interface StatusCount {
    MissedCheckInStatus getStatus();

    Long getCount();
  }

  Optional<MissedCheckIn> findOneByIdAndCompanyId(UUID id, UUID companyId);

  @Query(
      """
      SELECT m.personId FROM MissedCheckIn m
      WHERE m.companyId = :companyId
        AND m.missedDate = :date
        AND m.personId IN :personIds
      """)
  List<UUID> findPersonIdsRecordedOn(
      @Param("companyId") UUID companyId,
      @Param("date") LocalDate date,
      @Param("personIds") Collection<UUID> personIds);

  /** Misses in [from, to) for all given workers, newest first. */
  @Query(
      """
      SELECT m.personId AS personId, m.missedDate AS missedDate
      FROM MissedCheckIn m
      WHERE m.companyId = :companyId
        AND m.personId IN :personIds
        AND m.missedDate >= :from
        AND m.missedDate < :to
      ORDER BY m.missedDate DESC
      """)
  List<MissFact> findMissFactsInRange(
      @Param("companyId") UUID companyId,
      @Param("personIds") Collection<UUID> personIds,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to);

  @Query(
      value =
          """
          SELECT m FROM MissedCheckIn m
          WHERE m.companyId = :companyId
            AND (:status IS NULL OR m.status = :status)
            AND (:personId IS NULL OR m.personId = :personId)
            AND (CAST(:fromDate AS date) IS NULL OR m.missedDate >= :fromDate)
            AND (CAST(:toDate AS date) IS NULL OR m.missedDate <= :toDate)
          ORDER BY m.missedDate DESC, m.createdAt DESC
          """,
      countQuery =
          """
          SELECT COUNT(m) FROM MissedCheckIn m
          WHERE m.companyId = :companyId
            AND (:status IS NULL OR m.status = :status)
            AND (:personId IS NULL OR m.personId = :personId)
            AND (CAST(:fromDate AS date) IS NULL OR m.missedDate >= :fromDate)
            AND (CAST(:toDate AS date) IS NULL OR m.missedDate <= :toDate)
          """)
  Page<MissedCheckIn> findFiltered(
      @Param("companyId") UUID companyId,
      @Param("status") MissedCheckInStatus status,
      @Param("personId") UUID personId,
      @Param("fromDate") LocalDate fromDate,
      @Param("toDate") LocalDate toDate,
      Pageable pageable);

  /** Same as {@link #findFiltered} restricted to a non-empty set of teams. */
  @Query(
      value =
          """
          SELECT m FROM MissedCheckIn m
          WHERE m.companyId = :companyId
            AND m.teamId IN :teamIds
            AND (:status IS NULL OR m.status = :status)
            AND (:personId IS NULL OR m.personId = :personId)
            AND (CAST(:fromDate AS date) IS NULL OR m.missedDate >= :fromDate)
            AND (CAST(:toDate AS date) IS NULL OR m.missedDate <= :toDate)
          ORDER BY m.missedDate DESC, m.createdAt DESC
          """,
      countQuery =
          """
          SELECT COUNT(m) FROM MissedCheckIn m
          WHERE m.companyId = :companyId
            AND m.teamId IN :teamIds
            AND (:status IS NULL OR m.status = :status)
            AND (:personId IS NULL OR m.personId = :personId)
            AND (CAST(:fromDate AS date) IS NULL OR m.missedDate >= :fromDate)
            AND (CAST(:toDate AS date) IS NULL OR m.missedDate <= :toDate)
          """)
  Page<MissedCheckIn> findFilteredOnTeams(
      @Param("companyId") UUID companyId,
      @Param("teamIds") Collection<UUID> teamIds,
      @Param("status") MissedCheckInStatus status,
      @Param("personId") UUID personId,
      @Param("fromDate") LocalDate fromDate,
      @Param("toDate") LocalDate toDate,
      Pageable pageable);

  @Query(
      """
      SELECT m.status AS status, COUNT(m) AS count FROM MissedCheckIn m
      WHERE m.companyId = :companyId
      GROUP BY m.status
      """)
  List<StatusCount> countByStatus(@Param("companyId") UUID companyId);

  @Query(
      """
      SELECT m.status AS status, COUNT(m) AS count FROM MissedCheckIn m
      WHERE m.companyId = :companyId
        AND m.teamId IN :teamIds
      GROUP BY m.status
      """)
  List<StatusCount> countByStatusOnTeams(
      @Param("companyId") UUID companyId, @Param("teamIds") Collection<UUID> teamIds);
}
