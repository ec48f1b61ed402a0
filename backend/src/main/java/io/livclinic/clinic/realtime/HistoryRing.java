package io.livclinic.clinic.realtime;

import io.livclinic.clinic.activity.ActivityEvent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * In-memory buffer of the most recent events, replayed to newly connected clients. Holds at most
 * {@code capacity} events; pushing onto a full ring evicts the oldest.
 */
public final class HistoryRing {

  private final Deque<ActivityEvent> events = new ArrayDeque<>();
  private final int capacity;

  public HistoryRing(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("History capacity must be at least 1");
    }
    this.capacity = capacity;
  }

  public synchronized void push(ActivityEvent event) {
    events.addLast(event);
    while (events.size() > capacity) {
      events.removeFirst();
    }
  }

  /** Buffered events, oldest first. */
  public synchronized List<ActivityEvent> snapshot() {
    return new ArrayList<>(events);
  }

  public synchronized int size() {
    return events.size();
  }

  public int capacity() {
    return capacity;
  }
}
