package io.chatpad.pilot.notification;

import io.chatpad.pilot.context.RequestScopes;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

  private final NotificationService notificationService;

  public NotificationController(NotificationService notificationService) {
    this.notificationService = notificationService;
  }

  @GetMapping
  public ResponseEntity<Page<NotificationResponse>> list(
      @RequestParam(defaultValue = "false") boolean unreadOnly,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {
    var pageable = PageRequest.of(page, Math.min(size, 100));
    var notifications =
        notificationService.list(RequestScopes.requirePrincipalId(), unreadOnly, pageable);
    return ResponseEntity.ok(notifications.map(NotificationResponse::from));
  }

  @GetMapping("/unread-count")
  public ResponseEntity<UnreadCountResponse> unreadCount() {
    return ResponseEntity.ok(
        new UnreadCountResponse(
            notificationService.unreadCount(RequestScopes.requirePrincipalId())));
  }

  @PutMapping("/{id}/read")
  public ResponseEntity<Void> markRead(@PathVariable UUID id) {
    notificationService.markRead(id, RequestScopes.requirePrincipalId());
    return ResponseEntity.noContent().build();
  }

  @PutMapping("/read-all")
  public ResponseEntity<Void> markAllRead() {
    notificationService.markAllRead(RequestScopes.requirePrincipalId());
    return ResponseEntity.noContent().build();
  }

  public record NotificationResponse(
      UUID id,
      String type,
      String title,
      String message,
      Map<String, Object> data,
      boolean read,
      Instant createdAt) {

    public static NotificationResponse from(Notification notification) {
      return new NotificationResponse(
          notification.getId(),
          notification.getType(),
          notification.getTitle(),
          notification.getMessage(),
          notification.getData(),
          notification.isRead(),
          notification.getCreatedAt());
    }
  }

  public record UnreadCountResponse(long count) {}
}
