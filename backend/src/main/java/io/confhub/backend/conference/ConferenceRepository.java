package io.confhub.backend.conference;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ConferenceRepository extends JpaRepository<Conference, UUID> {}
