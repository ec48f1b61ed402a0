package io.livclinic.clinic.activity;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Database-backed implementation of {@link ActivityJournal} over the {@code activity_feed} table.
 *
 * <p>Append and trim run in one {@code REQUIRES_NEW} transaction while holding a local lock. The
 * transaction commits before the lock is released, so concurrent appenders in this process never
 * observe more than {@code journalSize} rows. Callers may be after-commit listeners, where the
 * surrounding transaction can no longer commit.
 */
@Service
@EnableConfigurationProperties(ActivityJournalProperties.class)
public class DatabaseActivityJournal implements ActivityJournal {

  private static final Logger log = LoggerFactory.getLogger(DatabaseActivityJournal.class);

  private final ActivityFeedEntryRepository repository;
  private final TransactionTemplate txTemplate;
  private final int journalSize;
  private final ReentrantLock appendLock = new ReentrantLock();

  public DatabaseActivityJournal(
      ActivityFeedEntryRepository repository,
      PlatformTransactionManager txManager,
      ActivityJournalProperties properties) {
    this.repository = repository;
    this.txTemplate = new TransactionTemplate(txManager);
    this.txTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.journalSize = properties.journalSize();
  }

  @Override
  public void append(ActivityEvent event) {
    appendLock.lock();
    try {
      txTemplate.executeWithoutResult(
          status -> {
            if (repository.existsByEventId(event.id())) {
              log.debug("Activity event {} already journaled, skipping insert", event.id());
            } else {
              repository.save(new ActivityFeedEntry(event));
              log.debug("Journaled activity event: id={}, type={}", event.id(), event.type());
            }
            trim();
          });
    } catch (DataIntegrityViolationException e) {
      // another process inserted the same event id between the existence check and the insert
      log.debug("Activity event {} was journaled concurrently, treating as duplicate", event.id());
    } finally {
      appendLock.unlock();
    }
  }

  private void trim() {
    List<Long> ids = repository.findIdsNewestFirst();
    if (ids.size() > journalSize) {
      var expired = ids.subList(journalSize, ids.size());
      repository.deleteAllByIdInBatch(expired);
      log.debug("Trimmed {} activity journal rows", expired.size());
    }
  }

  @Override
  @Transactional(readOnly = true)
  public List<ActivityEvent> list(int limit) {
    int effective = Math.min(ActivityJournal.clampLimit(limit), journalSize);
    return repository.findNewest(PageRequest.of(0, effective)).stream()
        .map(ActivityFeedEntry::toEvent)
        .toList();
  }

  @Override
  @Transactional(readOnly = true)
  public long size() {
    return repository.count();
  }
}
