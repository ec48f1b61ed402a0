package io.livclinic.clinic.note;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reconciles a client's full note list with the stored one.
 *
 * <p>Incoming entries whose id matches a stored note are edits: only text and completion change.
 * Matching is one to one, so when the stored list holds several notes with the same id each
 * incoming entry claims the next unclaimed copy. Everything else with non-blank text is a new note
 * owned by the requester. Stored notes missing
 * from the incoming list are deletions, and every deletion is checked before any output is built,
 * so a single forbidden removal rejects the whole list. The result lists edited notes in stored
 * order followed by new notes in submitted order.
 *
 * <p>The merger keeps no state. Two concurrent merges against the same stored list both succeed
 * and the later write wins.
 */
@Component
public class NoteMerger {

  private static final SecureRandom RANDOM = new SecureRandom();

  private final Clock clock;
  private final Supplier<String> idGenerator;

  @Autowired
  public NoteMerger(Clock clock) {
    this(clock, NoteMerger::randomNoteId);
  }

  NoteMerger(Clock clock, Supplier<String> idGenerator) {
    this.clock = clock;
    this.idGenerator = idGenerator;
  }

  public List<Note> merge(
      List<Note> existing, List<NoteCandidate> incoming, NoteRequester requester) {
    Map<String, Deque<Integer>> unmatchedById = new HashMap<>();
    for (int i = 0; i < existing.size(); i++) {
      unmatchedById.computeIfAbsent(existing.get(i).id(), id -> new ArrayDeque<>()).addLast(i);
    }

    Note[] edits = new Note[existing.size()];
    List<NoteCandidate> additions = new ArrayList<>();
    for (NoteCandidate candidate : incoming) {
      if (candidate == null || candidate.text() == null) {
        continue;
      }
      String text = candidate.text().strip();
      if (text.isEmpty()) {
        continue;
      }
      Deque<Integer> slots = candidate.id() != null ? unmatchedById.get(candidate.id()) : null;
      if (slots == null) {
        additions.add(new NoteCandidate(null, text, candidate.completed()));
        continue;
      }
      // each stored copy of an id absorbs at most one edit; surplus duplicates are dropped
      Integer slot = slots.pollFirst();
      if (slot != null) {
        Note original = existing.get(slot);
        boolean completed =
            candidate.completed() != null ? candidate.completed() : original.completed();
        edits[slot] = original.withContent(text, completed);
      }
    }

    List<String> forbidden = new ArrayList<>();
    for (int i = 0; i < existing.size(); i++) {
      Note note = existing.get(i);
      if (edits[i] == null && !requester.mayRemove(note) && !forbidden.contains(note.id())) {
        forbidden.add(note.id());
      }
    }
    if (!forbidden.isEmpty()) {
      throw new NoteDeletionForbiddenException(forbidden);
    }

    List<Note> merged = new ArrayList<>(existing.size() + additions.size());
    for (Note edited : edits) {
      if (edited != null) {
        merged.add(edited);
      }
    }

    Instant now = clock.instant();
    Set<String> taken = new HashSet<>(unmatchedById.keySet());
    for (NoteCandidate addition : additions) {
      String id = freshId(taken);
      taken.add(id);
      merged.add(
          new Note(
              id,
              addition.text(),
              Boolean.TRUE.equals(addition.completed()),
              requester.userId(),
              requester.displayName(),
              now));
    }
    return merged;
  }

  private String freshId(Set<String> taken) {
    String id = idGenerator.get();
    while (taken.contains(id)) {
      id = idGenerator.get();
    }
    return id;
  }

  static String randomNoteId() {
    byte[] bytes = new byte[8];
    RANDOM.nextBytes(bytes);
    return HexFormat.of().formatHex(bytes);
  }
}
