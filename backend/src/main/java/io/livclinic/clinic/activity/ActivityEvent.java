package io.livclinic.clinic.activity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A single change notification for a patient or procedure. The same shape is sent to live clients,
 * stored in the activity journal and returned by the activity read API.
 *
 * <p>Events carry plain values only (no JPA entities) so they remain valid after the publishing
 * transaction has committed. {@code data} is never null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActivityEvent(
    String id,
    EntityKind entity,
    EventAction action,
    String entityId,
    String summary,
    Map<String, Object> data,
    String actor,
    Instant timestamp) {

  public ActivityEvent {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(entity, "entity");
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(timestamp, "timestamp");
    data = data != null ? data : Map.of();
  }

  /**
   * Builds a fresh event with a random id, stamped with the clock's current instant.
   *
   * @param entityId identifier of the changed record; stored in its string form
   * @param actor display label of whoever triggered the change, see {@code ActorResolver}
   */
  public static ActivityEvent of(
      EntityKind entity,
      EventAction action,
      Object entityId,
      String summary,
      Map<String, Object> data,
      String actor,
      Clock clock) {
    return new ActivityEvent(
        UUID.randomUUID().toString(),
        entity,
        action,
        entityId != null ? entityId.toString() : null,
        summary,
        data,
        actor,
        clock.instant());
  }

  /** Dotted event type as seen by clients, e.g. {@code procedure.updated}. */
  @JsonProperty("type")
  public String type() {
    return entity.value() + "." + action.value();
  }
}
