package io.livclinic.clinic.activity;

import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface ActivityFeedEntryRepository extends JpaRepository<ActivityFeedEntry, Long> {

  boolean existsByEventId(String eventId);

  /** Newest first, storage sequence breaking timestamp ties. */
  @Query("SELECT e FROM ActivityFeedEntry e ORDER BY e.occurredAt DESC, e.id DESC")
  List<ActivityFeedEntry> findNewest(Pageable pageable);

  /** Row ids in retention order; everything past the journal size is trimmed. */
  @Query("SELECT e.id FROM ActivityFeedEntry e ORDER BY e.occurredAt DESC, e.id DESC")
  List<Long> findIdsNewestFirst();
}
