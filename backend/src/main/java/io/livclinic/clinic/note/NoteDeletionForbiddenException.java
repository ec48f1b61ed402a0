package io.livclinic.clinic.note;

import io.livclinic.clinic.exception.ForbiddenException;
import java.util.List;

public class NoteDeletionForbiddenException extends ForbiddenException {

  private final List<String> noteIds;

  public NoteDeletionForbiddenException(List<String> noteIds) {
    super("Note removal not permitted", "You can only remove your own notes");
    this.noteIds = List.copyOf(noteIds);
    getBody().setProperty("noteIds", this.noteIds);
  }

  public List<String> getNoteIds() {
    return noteIds;
  }
}
