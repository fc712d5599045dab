package io.chatpad.pilot.account;

import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Service-to-service account lifecycle. Authenticated by {@code X-API-KEY}. */
@RestController
@RequestMapping("/internal/accounts")
public class InternalAccountController {

  private final AccountDeletionService accountDeletionService;

  public InternalAccountController(AccountDeletionService accountDeletionService) {
    this.accountDeletionService = accountDeletionService;
  }

  @DeleteMapping("/{accountId}")
  public ResponseEntity<Void> deleteAccount(@PathVariable UUID accountId) {
    accountDeletionService.deleteAccount(accountId, null);
    return ResponseEntity.noContent().build();
  }
}
