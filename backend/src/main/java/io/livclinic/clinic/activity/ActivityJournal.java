package io.livclinic.clinic.activity;

import java.util.List;

/**
 * Durable, idempotent, size-bounded log of {@link ActivityEvent}s. Implementations keep at most the
 * configured number of rows visible to any reader, regardless of concurrent appenders.
 */
public interface ActivityJournal {

  /** Actor label recorded when an event arrives without one. */
  String UNKNOWN_ACTOR = "Another user";

  /** Smallest and largest number of events a single {@link #list(int)} call may return. */
  int MIN_LIST_LIMIT = 1;

  int MAX_LIST_LIMIT = 50;

  /**
   * Records the event, then trims the journal to its most recent rows. Appending an event whose id
   * is already journaled is a no-op, not an error.
   *
   * @param event the event to record
   */
  void append(ActivityEvent event);

  /**
   * Returns the most recent events, newest first. {@code limit} is clamped to [{@value
   * #MIN_LIST_LIMIT}, {@value #MAX_LIST_LIMIT}] and never exceeds the journal size.
   *
   * @param limit requested number of events
   * @return at most {@code limit} events ordered by timestamp descending
   */
  List<ActivityEvent> list(int limit);

  /** Number of journaled rows. */
  long size();

  static int clampLimit(int limit) {
    return Math.max(MIN_LIST_LIMIT, Math.min(limit, MAX_LIST_LIMIT));
  }
}
