package io.chatpad.pilot.account;

import io.chatpad.pilot.context.RequestScopes;
import io.chatpad.pilot.platform.PlatformAccessService;
import io.chatpad.pilot.platform.UserRole;
import io.chatpad.pilot.platform.UserRoleRepository;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class AccountController {

  private final AccountResolver accountResolver;
  private final AccountAccessService accountAccessService;
  private final AccountDeletionService accountDeletionService;
  private final PlatformAccessService platformAccessService;
  private final UserRoleRepository userRoleRepository;

  public AccountController(
      AccountResolver accountResolver,
      AccountAccessService accountAccessService,
      AccountDeletionService accountDeletionService,
      PlatformAccessService platformAccessService,
      UserRoleRepository userRoleRepository) {
    this.accountResolver = accountResolver;
    this.accountAccessService = accountAccessService;
    this.accountDeletionService = accountDeletionService;
    this.platformAccessService = platformAccessService;
    this.userRoleRepository = userRoleRepository;
  }

  @GetMapping("/me")
  public ResponseEntity<MeResponse> me() {
    UUID principalId = RequestScopes.requirePrincipalId();
    var resolution = accountResolver.resolve(principalId);
    List<String> permissions =
        userRoleRepository
            .findByUserId(principalId)
            .map(UserRole::getAdminPermissions)
            .orElse(List.of());
    return ResponseEntity.ok(
        new MeResponse(
            principalId,
            resolution.accountId(),
            resolution.source().name(),
            accountAccessService.teamRoleIn(resolution.accountId(), principalId),
            platformAccessService.platformRoleOf(principalId),
            permissions));
  }

  @DeleteMapping("/accounts/{accountId}")
  public ResponseEntity<Void> deleteAccount(@PathVariable UUID accountId) {
    accountDeletionService.deleteAccount(accountId, RequestScopes.requirePrincipalId());
    return ResponseEntity.noContent().build();
  }

  public record MeResponse(
      UUID principalId,
      UUID accountId,
      String source,
      String teamRole,
      String platformRole,
      List<String> adminPermissions) {}
}
