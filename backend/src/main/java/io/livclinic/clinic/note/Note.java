package io.livclinic.clinic.note;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a procedure's collaboratively edited note list. Only {@code text} and {@code
 * completed} change after creation; the author fields and {@code createdAt} are fixed by the first
 * merge that saw the note.
 */
public record Note(
    String id,
    String text,
    boolean completed,
    @JsonProperty("user_id") Long authorUserId,
    String author,
    @JsonProperty("created_at") Instant createdAt) {

  public Note {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(text, "text");
  }

  /** Same note with new content; identity and authorship are kept. */
  public Note withContent(String newText, boolean newCompleted) {
    return new Note(id, newText, newCompleted, authorUserId, author, createdAt);
  }
}
