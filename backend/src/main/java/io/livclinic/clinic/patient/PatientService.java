package io.livclinic.clinic.patient;

import io.livclinic.clinic.activity.ActivityEvent;
import io.livclinic.clinic.activity.EntityKind;
import io.livclinic.clinic.activity.EventAction;
import io.livclinic.clinic.exception.ResourceNotFoundException;
import io.livclinic.clinic.security.ActorResolver;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PatientService {

  private static final Logger log = LoggerFactory.getLogger(PatientService.class);

  private final PatientRepository repository;
  private final ApplicationEventPublisher eventPublisher;
  private final ActorResolver actorResolver;
  private final Clock clock;

  public PatientService(
      PatientRepository repository,
      ApplicationEventPublisher eventPublisher,
      ActorResolver actorResolver,
      Clock clock) {
    this.repository = repository;
    this.eventPublisher = eventPublisher;
    this.actorResolver = actorResolver;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public Patient getPatient(UUID id) {
    return repository
        .findByIdAndDeletedFalse(id)
        .orElseThrow(() -> new ResourceNotFoundException("Patient", id));
  }

  @Transactional
  public Patient createPatient(String firstName, String lastName, String email, String phone) {
    var patient =
        repository.save(
            new Patient(firstName.strip(), lastName.strip(), email, phone, clock.instant()));
    log.info("Created patient {}", patient.getId());
    publish(EventAction.CREATED, patient, "Added patient " + patient.getFullName());
    return patient;
  }

  @Transactional
  public Patient updatePatient(
      UUID id, String firstName, String lastName, String email, String phone) {
    var patient = getPatient(id);
    patient.update(firstName.strip(), lastName.strip(), email, phone, clock.instant());
    publish(EventAction.UPDATED, patient, "Updated patient " + patient.getFullName());
    return patient;
  }

  @Transactional
  public void deletePatient(UUID id) {
    var patient = getPatient(id);
    patient.markDeleted(clock.instant());
    log.info("Deleted patient {}", id);
    publish(EventAction.DELETED, patient, "Removed patient " + patient.getFullName());
  }

  private void publish(EventAction action, Patient patient, String summary) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("firstName", patient.getFirstName());
    data.put("lastName", patient.getLastName());
    data.put("email", patient.getEmail());
    data.put("phone", patient.getPhone());
    eventPublisher.publishEvent(
        ActivityEvent.of(
            EntityKind.PATIENT,
            action,
            patient.getId(),
            summary,
            data,
            actorResolver.resolve(),
            clock));
  }
}
