package io.confhub.backend.cfp;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CfpRepository extends JpaRepository<Cfp, UUID> {

  List<Cfp> findByProgramId(UUID programId);
}
