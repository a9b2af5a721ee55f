package io.confhub.backend.conference;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SubscriptionRepository extends JpaRepository<Subscription, UUID> {

  List<Subscription> findByConferenceId(UUID conferenceId);
}
