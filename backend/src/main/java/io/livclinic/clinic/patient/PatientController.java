package io.livclinic.clinic.patient;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/patients")
public class PatientController {

  private final PatientService patientService;

  public PatientController(PatientService patientService) {
    this.patientService = patientService;
  }

  @GetMapping("/{id}")
  public ResponseEntity<PatientResponse> getPatient(@PathVariable UUID id) {
    return ResponseEntity.ok(PatientResponse.from(patientService.getPatient(id)));
  }

  @PostMapping
  public ResponseEntity<PatientResponse> createPatient(
      @Valid @RequestBody PatientRequest request) {
    var patient =
        patientService.createPatient(
            request.firstName(), request.lastName(), request.email(), request.phone());
    return ResponseEntity.created(URI.create("/api/patients/" + patient.getId()))
        .body(PatientResponse.from(patient));
  }

  @PutMapping("/{id}")
  public ResponseEntity<PatientResponse> updatePatient(
      @PathVariable UUID id, @Valid @RequestBody PatientRequest request) {
    var patient =
        patientService.updatePatient(
            id, request.firstName(), request.lastName(), request.email(), request.phone());
    return ResponseEntity.ok(PatientResponse.from(patient));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deletePatient(@PathVariable UUID id) {
    patientService.deletePatient(id);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record PatientRequest(
      @NotBlank(message = "firstName is required")
          @Size(max = 100, message = "firstName must be at most 100 characters")
          String firstName,
      @NotBlank(message = "lastName is required")
          @Size(max = 100, message = "lastName must be at most 100 characters")
          String lastName,
      @Email(message = "email must be a valid email address")
          @Size(max = 255, message = "email must be at most 255 characters")
          String email,
      @Size(max = 50, message = "phone must be at most 50 characters") String phone) {}

  public record PatientResponse(
      UUID id,
      String firstName,
      String lastName,
      String email,
      String phone,
      Instant createdAt,
      Instant updatedAt) {

    public static PatientResponse from(Patient patient) {
      return new PatientResponse(
          patient.getId(),
          patient.getFirstName(),
          patient.getLastName(),
          patient.getEmail(),
          patient.getPhone(),
          patient.getCreatedAt(),
          patient.getUpdatedAt());
    }
  }
}
