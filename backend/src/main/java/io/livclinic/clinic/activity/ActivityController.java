package io.livclinic.clinic.activity;

import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Read-only access to the activity journal for clients that missed the live stream. */
@RestController
@RequestMapping("/api/activity")
public class ActivityController {

  private final ActivityJournal activityJournal;

  public ActivityController(ActivityJournal activityJournal) {
    this.activityJournal = activityJournal;
  }

  /**
   * Returns the most recent journaled events, newest first.
   *
   * @param limit requested number of events (default 10, clamped to 1..50)
   * @return events in the same shape as the live channel payload
   */
  @GetMapping
  public ResponseEntity<List<ActivityEvent>> listRecentActivity(
      @RequestParam(defaultValue = "10") int limit) {
    return ResponseEntity.ok(activityJournal.list(limit));
  }
}
