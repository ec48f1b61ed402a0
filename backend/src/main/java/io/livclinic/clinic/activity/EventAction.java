package io.livclinic.clinic.activity;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum EventAction {
  CREATED,
  UPDATED,
  DELETED;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static EventAction fromValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
