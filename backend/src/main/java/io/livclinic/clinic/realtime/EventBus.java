package io.livclinic.clinic.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.livclinic.clinic.activity.ActivityEvent;
import io.livclinic.clinic.activity.ActivityJournal;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Process-wide activity hub. A published event is journaled in the {@link ActivityJournal}, then
 * buffered in the {@link HistoryRing} and sent to every registered {@link LiveConnection}.
 *
 * <p>A journal failure is logged and the broadcast still happens. A connection that cannot accept
 * an event is evicted after the fan-out pass; the publisher never sees delivery errors. The
 * registry monitor is only held for in-memory work, never for I/O.
 */
@Service
public class EventBus {

  private static final Logger log = LoggerFactory.getLogger(EventBus.class);

  private final ActivityJournal activityJournal;
  private final ObjectMapper objectMapper;
  private final HistoryRing history;
  private final ConnectionRegistry registry = new ConnectionRegistry();

  public EventBus(
      ActivityJournal activityJournal, ObjectMapper objectMapper, RealtimeProperties properties) {
    this.activityJournal = activityJournal;
    this.objectMapper = objectMapper;
    this.history = new HistoryRing(properties.historySize());
  }

  /**
   * Registers a new client and queues the history replay as its first message. The replay snapshot
   * is taken in the same critical section as the registration, so each event reaches the client
   * exactly once: in the replay if it was published before, live otherwise.
   */
  public void connect(LiveConnection connection) {
    connection.onFailure(this::disconnect);
    List<ActivityEvent> replay = registry.register(connection, history::snapshot);
    String envelope;
    try {
      envelope = objectMapper.writeValueAsString(SyncEnvelope.of(replay));
    } catch (JsonProcessingException e) {
      log.warn("Could not serialize history replay for connection {}", connection.getId(), e);
      disconnect(connection);
      return;
    }
    connection.open(envelope);
    log.debug(
        "Live connection {} opened, replaying {} events, {} connections registered",
        connection.getId(),
        replay.size(),
        registry.size());
  }

  /** Removes the connection and closes it. Safe to call repeatedly or for unknown connections. */
  public void disconnect(LiveConnection connection) {
    connection.beginClosing();
    boolean removed = registry.remove(connection);
    connection.close();
    if (removed) {
      log.debug(
          "Live connection {} closed, {} connections registered",
          connection.getId(),
          registry.size());
    }
  }

  /**
   * Journals, buffers and broadcasts the event. Never throws because of a journal or client
   * failure; only an event that cannot be serialized is rejected, before anything is recorded.
   */
  public void publish(ActivityEvent event) {
    String payload;
    try {
      payload = objectMapper.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Activity event " + event.id() + " is not serializable", e);
    }

    try {
      activityJournal.append(event);
    } catch (RuntimeException e) {
      log.warn(
          "Failed to journal activity event {} ({}), broadcasting anyway",
          event.id(),
          event.type(),
          e);
    }

    List<LiveConnection> targets = registry.snapshot(() -> history.push(event));
    List<LiveConnection> stale = new ArrayList<>();
    for (LiveConnection connection : targets) {
      try {
        connection.send(payload);
      } catch (Exception e) {
        log.debug("Dropping live connection {}: {}", connection.getId(), e.getMessage());
        stale.add(connection);
      }
    }
    stale.forEach(this::disconnect);

    log.debug(
        "Published {} event {} to {} connections ({} evicted)",
        event.type(),
        event.id(),
        targets.size() - stale.size(),
        stale.size());
  }

  /** Events currently held for replay, oldest first. */
  public List<ActivityEvent> recentHistory() {
    return history.snapshot();
  }

  public int connectionCount() {
    return registry.size();
  }

  public boolean isConnected(LiveConnection connection) {
    return registry.contains(connection);
  }
}
