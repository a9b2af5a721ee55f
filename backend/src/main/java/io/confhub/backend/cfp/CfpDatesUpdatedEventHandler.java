package io.confhub.backend.cfp;

import io.confhub.backend.conference.EmailSettingsRepository;
import io.confhub.backend.conference.SubscriptionRepository;
import io.confhub.backend.email.EmailMessage;
import io.confhub.backend.email.EmailProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Mails the conference's configured date-change announcement to every subscriber once the cfp
 * update has committed. Settings are read again here; if the announcement was switched off in the
 * meantime nothing is sent.
 */
@Component
public class CfpDatesUpdatedEventHandler {

  private static final Logger log = LoggerFactory.getLogger(CfpDatesUpdatedEventHandler.class);

  private final EmailSettingsRepository emailSettingsRepository;
  private final SubscriptionRepository subscriptionRepository;
  private final EmailProvider emailProvider;

  public CfpDatesUpdatedEventHandler(
      EmailSettingsRepository emailSettingsRepository,
      SubscriptionRepository subscriptionRepository,
      EmailProvider emailProvider) {
    this.emailSettingsRepository = emailSettingsRepository;
    this.subscriptionRepository = subscriptionRepository;
    this.emailProvider = emailProvider;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onCfpDatesUpdated(CfpDatesUpdatedEvent event) {
    try {
      var settings = emailSettingsRepository.findByConferenceId(event.conferenceId()).orElse(null);
      if (settings == null || !settings.isCfpDatesUpdatedMailConfigured()) {
        log.info(
            "Cfp date update announcement disabled for conference {}, skipping cfp {}",
            event.conferenceId(),
            event.cfpId());
        return;
      }

      var subscriptions = subscriptionRepository.findByConferenceId(event.conferenceId());
      int sent = 0;
      for (var subscription : subscriptions) {
        var message =
            EmailMessage.withTracking(
                subscription.getEmail(),
                settings.getCfpDatesUpdatedSubject(),
                settings.getCfpDatesUpdatedBody(),
                "CFP",
                event.cfpId().toString());
        try {
          var result = emailProvider.sendEmail(message);
          if (result.success()) {
            sent++;
          } else {
            log.warn(
                "Provider {} rejected cfp date update mail to {}: {}",
                emailProvider.providerId(),
                subscription.getEmail(),
                result.errorMessage());
          }
        } catch (RuntimeException e) {
          log.error(
              "Failed to send cfp date update mail to {} for cfp {}",
              subscription.getEmail(),
              event.cfpId(),
              e);
        }
      }

      log.info(
          "Cfp date update announcement for cfp {} sent to {} of {} subscribers",
          event.cfpId(),
          sent,
          subscriptions.size());
    } catch (Exception e) {
      log.error("Failed to process cfp date update announcement for cfp {}", event.cfpId(), e);
    }
  }
}
