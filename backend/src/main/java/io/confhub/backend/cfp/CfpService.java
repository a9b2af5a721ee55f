package io.confhub.backend.cfp;

import io.confhub.backend.cfp.CfpValidationResult.FieldError;
import io.confhub.backend.conference.Conference;
import io.confhub.backend.conference.ConferenceRepository;
import io.confhub.backend.conference.EmailSettingsRepository;
import io.confhub.backend.conference.Program;
import io.confhub.backend.conference.ProgramRepository;
import io.confhub.backend.exception.CfpValidationException;
import io.confhub.backend.exception.ResourceNotFoundException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CfpService {

  private static final Logger log = LoggerFactory.getLogger(CfpService.class);

  private final CfpRepository cfpRepository;
  private final ProgramRepository programRepository;
  private final ConferenceRepository conferenceRepository;
  private final EmailSettingsRepository emailSettingsRepository;
  private final CfpPolicy cfpPolicy;
  private final ApplicationEventPublisher eventPublisher;

  public CfpService(
      CfpRepository cfpRepository,
      ProgramRepository programRepository,
      ConferenceRepository conferenceRepository,
      EmailSettingsRepository emailSettingsRepository,
      CfpPolicy cfpPolicy,
      ApplicationEventPublisher eventPublisher) {
    this.cfpRepository = cfpRepository;
    this.programRepository = programRepository;
    this.conferenceRepository = conferenceRepository;
    this.emailSettingsRepository = emailSettingsRepository;
    this.cfpPolicy = cfpPolicy;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public Cfp create(UUID programId, CfpCommand command) {
    var program = requireProgram(programId);
    var conference = requireConference(program);
    var programCfps = cfpRepository.findByProgramId(programId);

    var cfp = new Cfp(programId, command.cfpType(), command.startDate(), command.endDate());
    cfp.setDescription(command.description());
    requireValid(cfp, conference, programCfps);

    var saved = saveChecked(cfp);
    log.info(
        "Created cfp {} of type {} for program {} ({} to {})",
        saved.getId(),
        saved.getCfpType(),
        programId,
        saved.getStartDate(),
        saved.getEndDate());
    return saved;
  }

  /**
   * Applies {@code command} to an existing call. When the window changed and the conference
   * announces date changes, a {@link CfpDatesUpdatedEvent} is published for after-commit mailing.
   */
  @Transactional
  public Cfp update(UUID cfpId, CfpCommand command) {
    var cfp = requireCfp(cfpId);
    var program = requireProgram(cfp.getProgramId());
    var conference = requireConference(program);
    // Siblings are loaded before the entity is touched so no query flushes an unvalidated change.
    var programCfps = cfpRepository.findByProgramId(program.getId());
    var previousDates = CfpDates.of(cfp);

    cfp.setCfpType(command.cfpType());
    cfp.setStartDate(command.startDate());
    cfp.setEndDate(command.endDate());
    cfp.setDescription(command.description());
    requireValid(cfp, conference, programCfps);

    var saved = saveChecked(cfp);
    var currentDates = CfpDates.of(saved);
    var emailSettings = emailSettingsRepository.findByConferenceId(conference.getId()).orElse(null);

    if (cfpPolicy.shouldNotifyOnDateUpdate(previousDates, currentDates, emailSettings)) {
      eventPublisher.publishEvent(
          new CfpDatesUpdatedEvent(
              saved.getId(),
              conference.getId(),
              saved.getCfpType(),
              saved.getStartDate(),
              saved.getEndDate()));
      log.info("Cfp {} dates changed, date update announcement queued", saved.getId());
    }

    log.info("Updated cfp {} of program {}", saved.getId(), program.getId());
    return saved;
  }

  @Transactional
  public void delete(UUID cfpId) {
    var cfp = requireCfp(cfpId);
    cfpRepository.delete(cfp);
    log.info(
        "Deleted cfp {} of type {} from program {}", cfpId, cfp.getCfpType(), cfp.getProgramId());
  }

  @Transactional(readOnly = true)
  public List<Cfp> listForProgram(UUID programId) {
    requireProgram(programId);
    return cfpRepository.findByProgramId(programId);
  }

  @Transactional(readOnly = true)
  public Optional<Cfp> findForProgram(UUID programId, CfpType type) {
    return CfpLookup.forType(listForProgram(programId), type);
  }

  @Transactional(readOnly = true)
  public boolean isOpen(UUID cfpId) {
    var cfp = requireCfp(cfpId);
    var conference = requireConference(requireProgram(cfp.getProgramId()));
    return cfpPolicy.isOpen(cfp, conference);
  }

  /**
   * Open state, week span and days left for a call, with "today" taken in the conference's
   * timezone.
   */
  @Transactional(readOnly = true)
  public CfpWindowSummary summarize(UUID cfpId) {
    var cfp = requireCfp(cfpId);
    var conference = requireConference(requireProgram(cfp.getProgramId()));
    var today = cfpPolicy.today(conference);
    return new CfpWindowSummary(
        cfp.getId(), cfpPolicy.isOpenOn(cfp, today), cfp.weeks(), cfp.remainingDays(today));
  }

  // --- Private helpers ---

  /**
   * Flushes so the unique (program, lower(type)) index is checked here. A concurrent save of the
   * same type that slipped past validation is reported like any other duplicate.
   */
  private Cfp saveChecked(Cfp cfp) {
    try {
      return cfpRepository.saveAndFlush(cfp);
    } catch (DataIntegrityViolationException ex) {
      log.warn(
          "Rejected cfp {} for program {}: type {} already taken",
          cfp.getId(),
          cfp.getProgramId(),
          cfp.getCfpType());
      throw new CfpValidationException(
          List.of(
              new FieldError(
                  CfpPolicy.FIELD_CFP_TYPE, CfpPolicy.REASON_TAKEN, "has already been taken")));
    }
  }

  private void requireValid(Cfp cfp, Conference conference, Collection<Cfp> programCfps) {
    var result = cfpPolicy.validate(cfp, conference, programCfps);
    if (!result.isValid()) {
      log.warn(
          "Rejected cfp {} for program {}: {}", cfp.getId(), cfp.getProgramId(), result.errors());
      throw new CfpValidationException(result.errors());
    }
  }

  private Cfp requireCfp(UUID cfpId) {
    return cfpRepository
        .findById(cfpId)
        .orElseThrow(() -> new ResourceNotFoundException("Cfp", cfpId));
  }

  private Program requireProgram(UUID programId) {
    return programRepository
        .findById(programId)
        .orElseThrow(() -> new ResourceNotFoundException("Program", programId));
  }

  private Conference requireConference(Program program) {
    return conferenceRepository
        .findById(program.getConferenceId())
        .orElseThrow(() -> new ResourceNotFoundException("Conference", program.getConferenceId()));
  }
}
