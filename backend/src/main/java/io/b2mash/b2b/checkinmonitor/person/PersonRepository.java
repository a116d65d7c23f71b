package io.b2mash.b2b.checkinmonitor.person;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PersonRepository extends JpaRepository<Person, UUID> {

  /** Active workers on the given teams that have an assignment timestamp. */
  @Query(
      """
      SELECT p FROM Person p
      WHERE p.companyId = :companyId
        AND p.role = io.b2mash.b2b.checkinmonitor.person.Role.WORKER
        AND p.active = true
        AND p.teamId IN :teamIds
        AND p.teamAssignedAt IS NOT NULL
      """)
  List<Person> findActiveWorkersOnTeams(
      @Param("companyId") UUID companyId, @Param("teamIds") Collection<UUID> teamIds);

  List<Person> findByCompanyIdAndIdIn(UUID companyId, Collection<UUID> ids);
}
