package io.livclinic.clinic.activity;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Tracked record types whose changes are broadcast to live clients. */
public enum EntityKind {
  PATIENT,
  PROCEDURE;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static EntityKind fromValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
