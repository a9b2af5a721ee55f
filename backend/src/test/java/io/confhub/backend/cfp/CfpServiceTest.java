package io.confhub.backend.cfp;

import static io.confhub.backend.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.confhub.backend.conference.Conference;
import io.confhub.backend.conference.ConferenceRepository;
import io.confhub.backend.conference.EmailSettings;
import io.confhub.backend.conference.EmailSettingsRepository;
import io.confhub.backend.conference.Program;
import io.confhub.backend.conference.ProgramRepository;
import io.confhub.backend.exception.CfpValidationException;
import io.confhub.backend.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class CfpServiceTest {

  private static final LocalDate TODAY = LocalDate.of(2024, 6, 15);

  @Mock private CfpRepository cfpRepository;
  @Mock private ProgramRepository programRepository;
  @Mock private ConferenceRepository conferenceRepository;
  @Mock private EmailSettingsRepository emailSettingsRepository;
  @Mock private ApplicationEventPublisher eventPublisher;

  private CfpService service;
  private Conference conference;
  private Program program;
  private Cfp cfp;

  @BeforeEach
  void setUp() {
    var clock = Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);
    service =
        new CfpService(
            cfpRepository,
            programRepository,
            conferenceRepository,
            emailSettingsRepository,
            new CfpPolicy(clock),
            eventPublisher);

    conference =
        withId(new Conference("conf24", TODAY.minusDays(2), TODAY, "UTC"), UUID.randomUUID());
    program = withId(new Program(conference.getId()), UUID.randomUUID());
    cfp =
        withId(
            new Cfp(program.getId(), "events", TODAY.minusDays(2), TODAY.minusDays(1)),
            UUID.randomUUID());
  }

  private void stubHierarchy() {
    when(programRepository.findById(program.getId())).thenReturn(Optional.of(program));
    when(conferenceRepository.findById(conference.getId())).thenReturn(Optional.of(conference));
  }

  private void stubExistingCfp() {
    when(cfpRepository.findById(cfp.getId())).thenReturn(Optional.of(cfp));
    stubHierarchy();
    when(cfpRepository.findByProgramId(program.getId())).thenReturn(List.of(cfp));
  }

  private EmailSettings announcingSettings() {
    var settings = new EmailSettings(conference.getId());
    settings.setSendOnCfpDatesUpdated(true);
    settings.setCfpDatesUpdatedSubject("CfP dates changed");
    settings.setCfpDatesUpdatedBody("The call for papers has new dates.");
    return settings;
  }

  @Test
  void create_savesValidCfp() {
    stubHierarchy();
    when(cfpRepository.findByProgramId(program.getId())).thenReturn(List.of(cfp));
    when(cfpRepository.saveAndFlush(any(Cfp.class))).thenAnswer(inv -> inv.getArgument(0));

    var created =
        service.create(
            program.getId(), new CfpCommand("tracks", TODAY.minusDays(5), TODAY, "Track ideas"));

    assertThat(created.getCfpType()).isEqualTo("tracks");
    assertThat(created.getProgramId()).isEqualTo(program.getId());
    assertThat(created.getDescription()).isEqualTo("Track ideas");
    verify(cfpRepository).saveAndFlush(created);
  }

  @Test
  void create_rejectsDuplicateTypeIgnoringCase() {
    stubHierarchy();
    when(cfpRepository.findByProgramId(program.getId())).thenReturn(List.of(cfp));

    assertThatThrownBy(
            () ->
                service.create(
                    program.getId(),
                    new CfpCommand("EVENTS", TODAY.minusDays(5), TODAY, null)))
        .isInstanceOf(CfpValidationException.class)
        .satisfies(
            e -> {
              var ex = (CfpValidationException) e;
              assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
              assertThat(ex.getErrors())
                  .extracting(CfpValidationResult.FieldError::reason)
                  .contains("taken", "inclusion");
              assertThat(ex.getBody().getProperties()).containsKey("errors");
            });
    verify(cfpRepository, never()).saveAndFlush(any());
  }

  @Test
  void create_concurrentDuplicateCaughtByUniqueIndexIsReportedAsTaken() {
    stubHierarchy();
    when(cfpRepository.findByProgramId(program.getId())).thenReturn(List.of());
    when(cfpRepository.saveAndFlush(any(Cfp.class)))
        .thenThrow(new DataIntegrityViolationException("uq_cfps_program_type"));

    assertThatThrownBy(
            () ->
                service.create(
                    program.getId(), new CfpCommand("events", TODAY.minusDays(5), TODAY, null)))
        .isInstanceOf(CfpValidationException.class)
        .satisfies(
            e -> {
              var ex = (CfpValidationException) e;
              assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
              assertThat(ex.getErrors())
                  .singleElement()
                  .satisfies(
                      error -> {
                        assertThat(error.field()).isEqualTo("cfp_type");
                        assertThat(error.reason()).isEqualTo("taken");
                      });
            });
  }

  @Test
  void update_typeTakenAtFlushIsReportedAsTakenWithoutEvent() {
    stubExistingCfp();
    when(cfpRepository.saveAndFlush(cfp))
        .thenThrow(new DataIntegrityViolationException("uq_cfps_program_type"));

    assertThatThrownBy(
            () ->
                service.update(
                    cfp.getId(), new CfpCommand("tracks", TODAY.minusDays(2), TODAY, null)))
        .isInstanceOf(CfpValidationException.class)
        .satisfies(
            e ->
                assertThat(((CfpValidationException) e).getErrors())
                    .extracting(CfpValidationResult.FieldError::reason)
                    .containsExactly("taken"));
    verify(eventPublisher, never()).publishEvent(any());
  }

  @Test
  void create_unknownProgramIsNotFound() {
    var programId = UUID.randomUUID();
    when(programRepository.findById(programId)).thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> service.create(programId, new CfpCommand("events", TODAY, TODAY, null)))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void update_publishesEventWhenDatesChangeAndAnnouncementConfigured() {
    stubExistingCfp();
    when(cfpRepository.saveAndFlush(cfp)).thenReturn(cfp);
    when(emailSettingsRepository.findByConferenceId(conference.getId()))
        .thenReturn(Optional.of(announcingSettings()));

    service.update(cfp.getId(), new CfpCommand("events", TODAY.minusDays(2), TODAY, null));

    var captor = ArgumentCaptor.forClass(CfpDatesUpdatedEvent.class);
    verify(eventPublisher).publishEvent(captor.capture());
    var event = captor.getValue();
    assertThat(event.cfpId()).isEqualTo(cfp.getId());
    assertThat(event.conferenceId()).isEqualTo(conference.getId());
    assertThat(event.cfpType()).isEqualTo("events");
    assertThat(event.endDate()).isEqualTo(TODAY);
  }

  @Test
  void update_noEventWhenDatesUnchanged() {
    stubExistingCfp();
    when(cfpRepository.saveAndFlush(cfp)).thenReturn(cfp);
    when(emailSettingsRepository.findByConferenceId(conference.getId()))
        .thenReturn(Optional.of(announcingSettings()));

    service.update(
        cfp.getId(),
        new CfpCommand("events", TODAY.minusDays(2), TODAY.minusDays(1), "New description"));

    assertThat(cfp.getDescription()).isEqualTo("New description");
    verify(eventPublisher, never()).publishEvent(any());
  }

  @Test
  void update_noEventWhenConferenceHasNoEmailSettings() {
    stubExistingCfp();
    when(cfpRepository.saveAndFlush(cfp)).thenReturn(cfp);
    when(emailSettingsRepository.findByConferenceId(conference.getId()))
        .thenReturn(Optional.empty());

    service.update(cfp.getId(), new CfpCommand("events", TODAY.minusDays(2), TODAY, null));

    verify(eventPublisher, never()).publishEvent(any());
  }

  @Test
  void update_rejectsEndDateAfterConferenceEnd() {
    stubExistingCfp();

    assertThatThrownBy(
            () ->
                service.update(
                    cfp.getId(),
                    new CfpCommand("events", TODAY.minusDays(2), TODAY.plusDays(1), null)))
        .isInstanceOf(CfpValidationException.class);
    verify(cfpRepository, never()).saveAndFlush(any());
    verify(eventPublisher, never()).publishEvent(any());
  }

  @Test
  void update_unknownCfpIsNotFound() {
    var cfpId = UUID.randomUUID();
    when(cfpRepository.findById(cfpId)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.update(cfpId, new CfpCommand("events", TODAY, TODAY, null)))
        .isInstanceOf(ResourceNotFoundException.class)
        .hasMessageContaining(cfpId.toString());
  }

  @Test
  void delete_removesCfpSoLookupsNoLongerFindIt() {
    when(cfpRepository.findById(cfp.getId())).thenReturn(Optional.of(cfp));

    service.delete(cfp.getId());

    verify(cfpRepository).delete(cfp);

    when(programRepository.findById(program.getId())).thenReturn(Optional.of(program));
    when(cfpRepository.findByProgramId(program.getId())).thenReturn(List.of());
    assertThat(service.findForProgram(program.getId(), CfpType.EVENTS)).isEmpty();
  }

  @Test
  void findForProgram_returnsMatchingType() {
    when(programRepository.findById(program.getId())).thenReturn(Optional.of(program));
    when(cfpRepository.findByProgramId(program.getId())).thenReturn(List.of(cfp));

    assertThat(service.findForProgram(program.getId(), CfpType.EVENTS)).containsSame(cfp);
    assertThat(service.findForProgram(program.getId(), CfpType.TRACKS)).isEmpty();
  }

  @Test
  void isOpen_usesConferenceCalendarDay() {
    when(cfpRepository.findById(cfp.getId())).thenReturn(Optional.of(cfp));
    stubHierarchy();
    cfp.setStartDate(TODAY);
    cfp.setEndDate(TODAY.plusDays(1));

    assertThat(service.isOpen(cfp.getId())).isTrue();
  }

  @Test
  void summarize_combinesOpenStateWeeksAndRemainingDaysInConferenceZone() {
    when(cfpRepository.findById(cfp.getId())).thenReturn(Optional.of(cfp));
    stubHierarchy();
    // 2024-06-15 is a Saturday: the window touches this week and the next.
    cfp.setStartDate(TODAY.minusDays(1));
    cfp.setEndDate(TODAY.plusDays(3));

    var summary = service.summarize(cfp.getId());

    assertThat(summary.cfpId()).isEqualTo(cfp.getId());
    assertThat(summary.open()).isTrue();
    assertThat(summary.weeks()).isEqualTo(2);
    assertThat(summary.remainingDays()).isEqualTo(3);
  }

  @Test
  void summarize_closedWindowHasNoRemainingDays() {
    when(cfpRepository.findById(cfp.getId())).thenReturn(Optional.of(cfp));
    stubHierarchy();

    var summary = service.summarize(cfp.getId());

    assertThat(summary.open()).isFalse();
    assertThat(summary.weeks()).isEqualTo(1);
    assertThat(summary.remainingDays()).isZero();
  }
}
