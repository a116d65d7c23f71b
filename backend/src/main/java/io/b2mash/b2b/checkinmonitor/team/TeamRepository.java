package io.b2mash.b2b.checkinmonitor.team;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TeamRepository extends JpaRepository<Team, UUID> {

  List<Team> findByCompanyIdAndActiveTrue(UUID companyId);

  List<Team> findByCompanyIdAndIdIn(UUID companyId, List<UUID> ids);
}
