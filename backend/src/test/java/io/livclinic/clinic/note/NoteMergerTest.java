package io.livclinic.clinic.note;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.tuple;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NoteMergerTest {

  private static final Instant NOW = Instant.parse("2026-05-02T14:30:00Z");
  private static final Instant EARLIER = Instant.parse("2026-05-01T09:00:00Z");

  private static final NoteRequester ALICE = new NoteRequester(1L, "alice", false);
  private static final NoteRequester BOB = new NoteRequester(2L, "bob", false);
  private static final NoteRequester ADMIN = new NoteRequester(3L, "admin", true);

  private final AtomicInteger ids = new AtomicInteger();
  private NoteMerger merger;

  @BeforeEach
  void setUp() {
    merger = new NoteMerger(Clock.fixed(NOW, ZoneOffset.UTC), () -> "n" + ids.incrementAndGet());
  }

  @Test
  void newNote_isStampedWithRequesterAndTime() {
    var merged = merger.merge(List.of(), List.of(NoteCandidate.ofText("  Prep kit  ")), ALICE);

    assertThat(merged).containsExactly(new Note("n1", "Prep kit", false, 1L, "alice", NOW));
  }

  @Test
  void newNote_withCompletedFlag_keepsIt() {
    var merged =
        merger.merge(List.of(), List.of(new NoteCandidate(null, "Done already", true)), ALICE);

    assertThat(merged.get(0).completed()).isTrue();
  }

  @Test
  void unknownIncomingId_isTreatedAsNewNoteWithFreshId() {
    var merged =
        merger.merge(List.of(), List.of(new NoteCandidate("client-42", "Call lab", null)), BOB);

    assertThat(merged).hasSize(1);
    assertThat(merged.get(0).id()).isEqualTo("n1");
    assertThat(merged.get(0).authorUserId()).isEqualTo(2L);
  }

  @Test
  void edit_changesOnlyTextAndCompleted() {
    var original = new Note("a", "Old text", false, 1L, "alice", EARLIER);

    var merged =
        merger.merge(List.of(original), List.of(new NoteCandidate("a", " New text ", true)), BOB);

    assertThat(merged).containsExactly(new Note("a", "New text", true, 1L, "alice", EARLIER));
  }

  @Test
  void edit_withoutCompletedFlag_keepsStoredValue() {
    var original = new Note("a", "Sterilize", true, 1L, "alice", EARLIER);

    var merged =
        merger.merge(List.of(original), List.of(new NoteCandidate("a", "Sterilize", null)), ALICE);

    assertThat(merged.get(0).completed()).isTrue();
  }

  @Test
  void removingAnotherUsersNote_failsWholeMerge() {
    var alices = new Note("a", "Alice note", false, 1L, "alice", EARLIER);
    var bobs = new Note("b", "Bob note", false, 2L, "bob", EARLIER);

    var thrown =
        catchThrowableOfType(
            () ->
                merger.merge(
                    List.of(alices, bobs),
                    List.of(new NoteCandidate("a", "Alice edit", null), NoteCandidate.ofText("x")),
                    ALICE),
            NoteDeletionForbiddenException.class);

    assertThat(thrown.getNoteIds()).containsExactly("b");
    assertThat(thrown.getBody().getDetail()).isEqualTo("You can only remove your own notes");
    assertThat(thrown.getStatusCode().value()).isEqualTo(403);
  }

  @Test
  void removingOwnNote_isAllowed() {
    var alices = new Note("a", "Alice note", false, 1L, "alice", EARLIER);
    var bobs = new Note("b", "Bob note", false, 2L, "bob", EARLIER);

    var merged =
        merger.merge(List.of(alices, bobs), List.of(new NoteCandidate("b", "Bob note", null)), BOB);

    assertThat(merged).containsExactly(bobs);
  }

  @Test
  void adminMayRemoveAnyNote() {
    var alices = new Note("a", "Alice note", false, 1L, "alice", EARLIER);

    assertThat(merger.merge(List.of(alices), List.of(), ADMIN)).isEmpty();
  }

  @Test
  void noteWithoutAuthor_mayBeRemovedByAnyone() {
    var legacy = new Note("legacy", "Imported", false, null, null, EARLIER);

    assertThat(merger.merge(List.of(legacy), List.of(), BOB)).isEmpty();
  }

  @Test
  void apiTokenCaller_cannotRemoveUserNotes() {
    var alices = new Note("a", "Alice note", false, 1L, "alice", EARLIER);
    var kiosk = new NoteRequester(null, "Front desk kiosk", false);

    assertThatThrownBy(() -> merger.merge(List.of(alices), List.of(), kiosk))
        .isInstanceOf(NoteDeletionForbiddenException.class);
  }

  @Test
  void blankIncomingText_countsAsRemoval() {
    var bobs = new Note("b", "Bob note", false, 2L, "bob", EARLIER);

    assertThatThrownBy(
            () -> merger.merge(List.of(bobs), List.of(new NoteCandidate("b", "   ", null)), ALICE))
        .isInstanceOf(NoteDeletionForbiddenException.class);
    assertThat(merger.merge(List.of(bobs), List.of(new NoteCandidate("b", "", null)), BOB))
        .isEmpty();
  }

  @Test
  void output_listsEditsInStoredOrderThenNewNotesInSubmittedOrder() {
    var first = new Note("a", "First", false, 1L, "alice", EARLIER);
    var second = new Note("b", "Second", false, 1L, "alice", EARLIER);

    var merged =
        merger.merge(
            List.of(first, second),
            List.of(
                NoteCandidate.ofText("New one"),
                new NoteCandidate("b", "Second", null),
                NoteCandidate.ofText("New two"),
                new NoteCandidate("a", "First", null)),
            ALICE);

    assertThat(merged)
        .extracting(Note::id, Note::text)
        .containsExactly(
            tuple("a", "First"),
            tuple("b", "Second"),
            tuple("n1", "New one"),
            tuple("n2", "New two"));
  }

  @Test
  void duplicateIncomingId_firstOccurrenceWins() {
    var original = new Note("a", "Original", false, 1L, "alice", EARLIER);

    var merged =
        merger.merge(
            List.of(original),
            List.of(
                new NoteCandidate("a", "First edit", null), new NoteCandidate("a", "Second", true)),
            ALICE);

    assertThat(merged).containsExactly(original.withContent("First edit", false));
  }

  @Test
  void storedDuplicateIds_eachCopyNeedsItsOwnEntry() {
    var bobOne = new Note("x", "Bob one", false, 2L, "bob", EARLIER);
    var bobTwo = new Note("x", "Bob two", false, 2L, "bob", EARLIER);

    var thrown =
        catchThrowableOfType(
            () ->
                merger.merge(
                    List.of(bobOne, bobTwo),
                    List.of(new NoteCandidate("x", "Bob one", null)),
                    ALICE),
            NoteDeletionForbiddenException.class);

    assertThat(thrown).isNotNull();
    assertThat(thrown.getNoteIds()).containsExactly("x");
  }

  @Test
  void storedDuplicateIds_arePairedInOrder() {
    var bobOne = new Note("x", "Bob one", false, 2L, "bob", EARLIER);
    var bobTwo = new Note("x", "Bob two", false, 2L, "bob", EARLIER);

    var merged =
        merger.merge(
            List.of(bobOne, bobTwo),
            List.of(new NoteCandidate("x", "Bob one", null), new NoteCandidate("x", "Bob 2", true)),
            ALICE);

    assertThat(merged)
        .containsExactly(bobOne, new Note("x", "Bob 2", true, 2L, "bob", EARLIER));
  }

  @Test
  void storedDuplicateIds_ownerMayDropOneCopy() {
    var bobOne = new Note("x", "Bob one", false, 2L, "bob", EARLIER);
    var bobTwo = new Note("x", "Bob two", false, 2L, "bob", EARLIER);

    var merged =
        merger.merge(
            List.of(bobOne, bobTwo), List.of(new NoteCandidate("x", "Bob one", null)), BOB);

    assertThat(merged).containsExactly(bobOne);
  }

  @Test
  void echoingMergedList_isIdempotent() {
    var first =
        merger.merge(
            List.of(),
            List.of(NoteCandidate.ofText("Prep kit"), new NoteCandidate(null, "Call lab", true)),
            ALICE);
    var echoed =
        first.stream().map(note -> new NoteCandidate(note.id(), note.text(), note.completed()));

    var second = merger.merge(first, echoed.toList(), BOB);

    assertThat(second).isEqualTo(first);
  }

  @Test
  void freshId_skipsIdsAlreadyInUse() {
    Deque<String> generated = new ArrayDeque<>(List.of("a", "n1", "z"));
    var collidingMerger = new NoteMerger(Clock.fixed(NOW, ZoneOffset.UTC), generated::pop);
    var existing = new Note("a", "Existing", false, 1L, "alice", EARLIER);

    var merged =
        collidingMerger.merge(
            List.of(existing),
            List.of(
                new NoteCandidate("a", "Existing", null),
                NoteCandidate.ofText("one"),
                NoteCandidate.ofText("two")),
            ALICE);

    assertThat(merged).extracting(Note::id).containsExactly("a", "n1", "z");
  }

  @Test
  void randomNoteId_isSixteenHexCharacters() {
    assertThat(NoteMerger.randomNoteId()).matches("[0-9a-f]{16}");
  }
}
