package io.confhub.backend.conference;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EmailSettingsRepository extends JpaRepository<EmailSettings, UUID> {

  /** At most one row per conference. */
  Optional<EmailSettings> findByConferenceId(UUID conferenceId);
}
