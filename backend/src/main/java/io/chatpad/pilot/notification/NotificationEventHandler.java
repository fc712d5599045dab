package io.chatpad.pilot.notification;

import io.chatpad.pilot.dispatch.RowChangeEvent;
import io.chatpad.pilot.team.TeamMemberJoinedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Turns committed row changes and team joins into in-app notifications. Notification failures
 * are logged and do not affect the already-committed change.
 */
@Component
public class NotificationEventHandler {

  private static final Logger log = LoggerFactory.getLogger(NotificationEventHandler.class);

  private final NotificationService notificationService;

  public NotificationEventHandler(NotificationService notificationService) {
    this.notificationService = notificationService;
  }

  @TransactionalEventListener(
      phase = TransactionPhase.AFTER_COMMIT,
      fallbackExecution = true,
      condition = "#event.table() == 'leads' and #event.type() == 'insert'")
  public void onLeadInserted(RowChangeEvent event) {
    try {
      notificationService.notifyNewLead(event.accountId(), event.record());
    } catch (Exception e) {
      log.warn(
          "Failed to create new_lead notifications for account={}, lead={}",
          event.accountId(),
          event.record() != null ? event.record().get("id") : null,
          e);
    }
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onTeamMemberJoined(TeamMemberJoinedEvent event) {
    try {
      notificationService.notifyMemberJoined(event);
    } catch (Exception e) {
      log.warn(
          "Failed to create team join notification for account={}, member={}",
          event.ownerId(),
          event.memberId(),
          e);
    }
  }
}
