package io.livclinic.clinic.realtime;

import io.livclinic.clinic.activity.ActivityEvent;
import java.util.List;

/** First message on every live connection: recent history, oldest first. */
public record SyncEnvelope(String type, List<ActivityEvent> items) {

  public static final String TYPE = "activity.sync";

  public static SyncEnvelope of(List<ActivityEvent> items) {
    return new SyncEnvelope(TYPE, List.copyOf(items));
  }
}
