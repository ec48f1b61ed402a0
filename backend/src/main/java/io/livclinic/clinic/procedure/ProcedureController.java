package io.livclinic.clinic.procedure;

import com.fasterxml.jackson.databind.JsonNode;
import io.livclinic.clinic.note.Note;
import io.livclinic.clinic.note.NoteCandidate;
import io.livclinic.clinic.security.CurrentUser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/procedures")
public class ProcedureController {

  private final ProcedureService procedureService;

  public ProcedureController(ProcedureService procedureService) {
    this.procedureService = procedureService;
  }

  @GetMapping
  public ResponseEntity<List<ProcedureResponse>> listProcedures(@RequestParam UUID patientId) {
    return ResponseEntity.ok(
        procedureService.listForPatient(patientId).stream().map(ProcedureResponse::from).toList());
  }

  @GetMapping("/{id}")
  public ResponseEntity<ProcedureResponse> getProcedure(@PathVariable UUID id) {
    return ResponseEntity.ok(ProcedureResponse.from(procedureService.getProcedure(id)));
  }

  @PostMapping
  public ResponseEntity<ProcedureResponse> createProcedure(
      @Valid @RequestBody CreateProcedureRequest request) {
    var procedure =
        procedureService.createProcedure(
            request.patientId(),
            request.procedureDate(),
            request.procedureType(),
            request.status(),
            NoteCandidate.fromJson(request.notes()),
            CurrentUser.require().asNoteRequester());
    return ResponseEntity.created(URI.create("/api/procedures/" + procedure.getId()))
        .body(ProcedureResponse.from(procedure));
  }

  /**
   * Replaces the procedure's notes with the merge of the stored list and the submitted one.
   * Responds with the merged list.
   */
  @PutMapping("/{id}/notes")
  public ResponseEntity<List<Note>> updateNotes(
      @PathVariable UUID id, @Valid @RequestBody UpdateNotesRequest request) {
    var procedure =
        procedureService.updateNotes(
            id,
            NoteCandidate.fromJson(request.notes()),
            CurrentUser.require().asNoteRequester());
    return ResponseEntity.ok(procedure.getNotes());
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteProcedure(@PathVariable UUID id) {
    procedureService.deleteProcedure(id);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record CreateProcedureRequest(
      @NotNull(message = "patientId is required") UUID patientId,
      @NotNull(message = "procedureDate is required") LocalDate procedureDate,
      @NotBlank(message = "procedureType is required")
          @Size(max = 100, message = "procedureType must be at most 100 characters")
          String procedureType,
      @Size(max = 30, message = "status must be at most 30 characters") String status,
      List<JsonNode> notes) {}

  /** Entries may be note objects or plain strings. */
  public record UpdateNotesRequest(@NotNull(message = "notes is required") List<JsonNode> notes) {}

  public record ProcedureResponse(
      UUID id,
      UUID patientId,
      LocalDate procedureDate,
      String procedureType,
      String status,
      List<Note> notes,
      Instant createdAt,
      Instant updatedAt) {

    public static ProcedureResponse from(Procedure procedure) {
      return new ProcedureResponse(
          procedure.getId(),
          procedure.getPatientId(),
          procedure.getProcedureDate(),
          procedure.getProcedureType(),
          procedure.getStatus(),
          procedure.getNotes(),
          procedure.getCreatedAt(),
          procedure.getUpdatedAt());
    }
  }
}
