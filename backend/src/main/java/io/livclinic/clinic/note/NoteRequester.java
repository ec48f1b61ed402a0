package io.livclinic.clinic.note;

/** Who is submitting a note list. API-token callers have no user id and are never admins. */
public record NoteRequester(Long userId, String displayName, boolean admin) {

  /** Notes without a recorded author may be removed by anyone. */
  public boolean mayRemove(Note note) {
    return admin || note.authorUserId() == null || note.authorUserId().equals(userId);
  }
}
