package io.livclinic.clinic.realtime;

import io.livclinic.clinic.activity.ActivityEvent;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands {@link ActivityEvent}s published through Spring's {@code ApplicationEventPublisher} to the
 * {@link EventBus} once the mutating transaction has committed, so clients never hear about a
 * change that was rolled back. Events published outside a transaction are relayed immediately.
 */
@Component
public class ActivityEventRelay {

  private final EventBus eventBus;

  public ActivityEventRelay(EventBus eventBus) {
    this.eventBus = eventBus;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onActivity(ActivityEvent event) {
    eventBus.publish(event);
  }
}
