package io.livclinic.clinic.activity;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;

/**
 * Journal row for one {@link ActivityEvent}, persisted to the {@code activity_feed} table. Rows are
 * never updated. {@code eventId} carries a unique constraint so re-publication cannot create a
 * second row; {@code id} is the storage sequence used to break timestamp ties.
 */
@Entity
@Table(name = "activity_feed")
public class ActivityFeedEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "event_id", nullable = false, unique = true, updatable = false, length = 64)
  private String eventId;

  @Column(name = "entity", nullable = false, updatable = false, length = 20)
  private String entity;

  @Column(name = "action", nullable = false, updatable = false, length = 20)
  private String action;

  @Column(name = "entity_identifier", updatable = false, length = 64)
  private String entityIdentifier;

  @Column(name = "summary", nullable = false, updatable = false)
  private String summary;

  @Convert(converter = ActivityDataConverter.class)
  @Column(name = "data", nullable = false, updatable = false)
  private Map<String, Object> data;

  @Column(name = "actor", nullable = false, updatable = false, length = 200)
  private String actor;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  protected ActivityFeedEntry() {}

  public ActivityFeedEntry(ActivityEvent event) {
    this.eventId = event.id();
    this.entity = event.entity().value();
    this.action = event.action().value();
    this.entityIdentifier = event.entityId();
    this.summary = event.summary() != null ? event.summary() : "";
    this.data = event.data();
    this.actor = event.actor() != null ? event.actor() : ActivityJournal.UNKNOWN_ACTOR;
    this.occurredAt = event.timestamp();
  }

  /** Rebuilds the event exactly as it was published. */
  public ActivityEvent toEvent() {
    return new ActivityEvent(
        eventId,
        EntityKind.fromValue(entity),
        EventAction.fromValue(action),
        entityIdentifier,
        summary,
        data,
        actor,
        occurredAt);
  }

  public Long getId() {
    return id;
  }

  public String getEventId() {
    return eventId;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }
}
