package io.livclinic.clinic.procedure;

import io.livclinic.clinic.note.Note;
import io.livclinic.clinic.note.NoteListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "procedures")
public class Procedure {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "patient_id", nullable = false)
  private UUID patientId;

  @Column(name = "procedure_date", nullable = false)
  private LocalDate procedureDate;

  @Column(name = "procedure_type", nullable = false, length = 100)
  private String procedureType;

  @Column(name = "status", nullable = false, length = 30)
  private String status;

  @Convert(converter = NoteListConverter.class)
  @Column(name = "notes", nullable = false, columnDefinition = "TEXT")
  private List<Note> notes = List.of();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Procedure() {}

  public Procedure(
      UUID patientId,
      LocalDate procedureDate,
      String procedureType,
      String status,
      List<Note> notes,
      Instant now) {
    this.patientId = patientId;
    this.procedureDate = procedureDate;
    this.procedureType = procedureType;
    this.status = status;
    this.notes = List.copyOf(notes);
    this.createdAt = now;
    this.updatedAt = now;
  }

  /** Replaces the whole note list with the result of a merge. */
  public void replaceNotes(List<Note> merged, Instant now) {
    this.notes = List.copyOf(merged);
    this.updatedAt = now;
  }

  public UUID getId() {
    return id;
  }

  public UUID getPatientId() {
    return patientId;
  }

  public LocalDate getProcedureDate() {
    return procedureDate;
  }

  public String getProcedureType() {
    return procedureType;
  }

  public String getStatus() {
    return status;
  }

  public List<Note> getNotes() {
    return notes != null ? notes : List.of();
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
