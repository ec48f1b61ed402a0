package io.livclinic.clinic.activity;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for the activity journal.
 *
 * @param journalSize maximum number of journal rows kept; older rows are trimmed on every append
 */
@ConfigurationProperties(prefix = "clinic.activity")
public record ActivityJournalProperties(@DefaultValue("10") int journalSize) {

  public ActivityJournalProperties {
    if (journalSize < 1) {
      throw new IllegalArgumentException("clinic.activity.journal-size must be at least 1");
    }
  }
}
