package io.chatpad.pilot.dispatch;

import io.chatpad.pilot.config.AsyncConfig;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands committed row changes to {@link RowChangeDispatcher} off the request thread. Events from
 * rolled-back transactions are never delivered.
 */
@Component
public class RowChangeDispatchListener {

  private final RowChangeDispatcher dispatcher;

  public RowChangeDispatchListener(RowChangeDispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  @Async(AsyncConfig.DISPATCH_EXECUTOR)
  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onRowChange(RowChangeEvent event) {
    dispatcher.dispatch(event);
  }
}
