package io.livclinic.clinic.procedure;

import io.livclinic.clinic.activity.ActivityEvent;
import io.livclinic.clinic.activity.EntityKind;
import io.livclinic.clinic.activity.EventAction;
import io.livclinic.clinic.exception.ResourceNotFoundException;
import io.livclinic.clinic.note.NoteCandidate;
import io.livclinic.clinic.note.NoteMerger;
import io.livclinic.clinic.note.NoteRequester;
import io.livclinic.clinic.patient.PatientService;
import io.livclinic.clinic.security.ActorResolver;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProcedureService {

  private static final Logger log = LoggerFactory.getLogger(ProcedureService.class);

  static final String DEFAULT_STATUS = "scheduled";

  private final ProcedureRepository repository;
  private final PatientService patientService;
  private final NoteMerger noteMerger;
  private final ApplicationEventPublisher eventPublisher;
  private final ActorResolver actorResolver;
  private final Clock clock;

  public ProcedureService(
      ProcedureRepository repository,
      PatientService patientService,
      NoteMerger noteMerger,
      ApplicationEventPublisher eventPublisher,
      ActorResolver actorResolver,
      Clock clock) {
    this.repository = repository;
    this.patientService = patientService;
    this.noteMerger = noteMerger;
    this.eventPublisher = eventPublisher;
    this.actorResolver = actorResolver;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public Procedure getProcedure(UUID id) {
    return repository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Procedure", id));
  }

  @Transactional(readOnly = true)
  public List<Procedure> listForPatient(UUID patientId) {
    patientService.getPatient(patientId);
    return repository.findByPatientIdOrderByProcedureDateAsc(patientId);
  }

  /** Creates a procedure; any initial notes are merged against an empty list. */
  @Transactional
  public Procedure createProcedure(
      UUID patientId,
      LocalDate procedureDate,
      String procedureType,
      String status,
      List<NoteCandidate> initialNotes,
      NoteRequester requester) {
    var patient = patientService.getPatient(patientId);
    var notes = noteMerger.merge(List.of(), initialNotes, requester);
    var procedure =
        repository.save(
            new Procedure(
                patient.getId(),
                procedureDate,
                procedureType.strip(),
                status != null && !status.isBlank() ? status.strip() : DEFAULT_STATUS,
                notes,
                clock.instant()));
    log.info("Created procedure {} for patient {}", procedure.getId(), patientId);
    publish(
        EventAction.CREATED,
        procedure,
        "Scheduled "
            + procedure.getProcedureType()
            + " for "
            + patient.getFullName()
            + " on "
            + procedure.getProcedureDate());
    return procedure;
  }

  /**
   * Merges a client's note list into the stored one. A forbidden deletion throws before anything
   * is written or published.
   */
  @Transactional
  public Procedure updateNotes(UUID id, List<NoteCandidate> incoming, NoteRequester requester) {
    var procedure = getProcedure(id);
    var merged = noteMerger.merge(procedure.getNotes(), incoming, requester);
    procedure.replaceNotes(merged, clock.instant());
    log.debug("Merged {} notes into procedure {}", merged.size(), id);
    publish(
        EventAction.UPDATED, procedure, "Updated notes for " + procedure.getProcedureType());
    return procedure;
  }

  @Transactional
  public void deleteProcedure(UUID id) {
    var procedure = getProcedure(id);
    repository.delete(procedure);
    log.info("Deleted procedure {}", id);
    publish(EventAction.DELETED, procedure, "Removed " + procedure.getProcedureType());
  }

  private void publish(EventAction action, Procedure procedure, String summary) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("patientId", procedure.getPatientId().toString());
    data.put("procedureDate", procedure.getProcedureDate().toString());
    data.put("procedureType", procedure.getProcedureType());
    data.put("status", procedure.getStatus());
    data.put("notes", procedure.getNotes());
    eventPublisher.publishEvent(
        ActivityEvent.of(
            EntityKind.PROCEDURE,
            action,
            procedure.getId(),
            summary,
            data,
            actorResolver.resolve(),
            clock));
  }
}
