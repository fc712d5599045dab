package io.chatpad.pilot.notification;

import io.chatpad.pilot.exception.ResourceNotFoundException;
import io.chatpad.pilot.team.TeamMember;
import io.chatpad.pilot.team.TeamMemberJoinedEvent;
import io.chatpad.pilot.team.TeamMemberRepository;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class NotificationService {

  private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

  private final NotificationRepository notificationRepository;
  private final TeamMemberRepository teamMemberRepository;

  public NotificationService(
      NotificationRepository notificationRepository, TeamMemberRepository teamMemberRepository) {
    this.notificationRepository = notificationRepository;
    this.teamMemberRepository = teamMemberRepository;
  }

  @Transactional(readOnly = true)
  public Page<Notification> list(UUID principalId, boolean unreadOnly, Pageable pageable) {
    return unreadOnly
        ? notificationRepository.findUnreadByUserId(principalId, pageable)
        : notificationRepository.findByUserId(principalId, pageable);
  }

  @Transactional(readOnly = true)
  public long unreadCount(UUID principalId) {
    return notificationRepository.countUnreadByUserId(principalId);
  }

  /** Another principal's notification is reported as not found. */
  @Transactional
  public void markRead(UUID notificationId, UUID principalId) {
    var notification =
        notificationRepository
            .findById(notificationId)
            .filter(n -> n.getUserId().equals(principalId))
            .orElseThrow(() -> new ResourceNotFoundException("Notification", notificationId));
    notification.markAsRead();
  }

  @Transactional
  public int markAllRead(UUID principalId) {
    return notificationRepository.markAllAsRead(principalId);
  }

  /**
   * Creates a {@code new_lead} notification for the account owner and every team member of the
   * account. Runs in its own transaction because it is called after the lead's transaction has
   * committed.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public List<Notification> notifyNewLead(UUID accountId, Map<String, Object> lead) {
    var recipients = new LinkedHashSet<UUID>();
    recipients.add(accountId);
    teamMemberRepository.findByOwnerIdOrderByCreatedAtAsc(accountId).stream()
        .map(TeamMember::getMemberId)
        .forEach(recipients::add);

    Object leadName = lead.get("name");
    Object leadEmail = lead.get("email");
    String who =
        leadName != null ? leadName.toString() : leadEmail != null ? leadEmail.toString() : null;
    String message = who != null ? who + " left their details" : "A visitor left their details";

    var data = new HashMap<String, Object>();
    data.put("lead_id", String.valueOf(lead.get("id")));
    if (lead.get("agent_id") != null) {
      data.put("agent_id", lead.get("agent_id").toString());
    }

    var created = new ArrayList<Notification>();
    for (UUID recipient : recipients) {
      created.add(
          notificationRepository.save(
              new Notification(recipient, Notification.TYPE_NEW_LEAD, "New lead", message, data)));
    }
    log.debug("Created {} new_lead notifications for account {}", created.size(), accountId);
    return created;
  }

  /**
   * Tells the account owner, and the inviter when that is someone else, that an invitation was
   * accepted.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public List<Notification> notifyMemberJoined(TeamMemberJoinedEvent event) {
    var recipients = new LinkedHashSet<UUID>();
    recipients.add(event.ownerId());
    if (event.invitedBy() != null) {
      recipients.add(event.invitedBy());
    }

    String who = event.email() != null ? event.email() : "A new member";
    var data = new HashMap<String, Object>();
    data.put("member_id", event.memberId().toString());
    data.put("role", event.role());
    if (event.email() != null) {
      data.put("email", event.email());
    }

    var created = new ArrayList<Notification>();
    for (UUID recipient : recipients) {
      created.add(
          notificationRepository.save(
              new Notification(
                  recipient,
                  Notification.TYPE_TEAM,
                  "Team Member Joined",
                  who + " accepted your invitation and joined the team",
                  data)));
    }
    return created;
  }
}
