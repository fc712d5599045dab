package io.chatpad.pilot.platform;

import io.chatpad.pilot.context.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/roles")
public class PlatformRoleController {

  private final PlatformRoleService platformRoleService;

  public PlatformRoleController(PlatformRoleService platformRoleService) {
    this.platformRoleService = platformRoleService;
  }

  @GetMapping
  public ResponseEntity<List<UserRoleResponse>> listPilotTeam() {
    var team =
        platformRoleService.listPilotTeam(RequestScopes.requirePrincipalId()).stream()
            .map(UserRoleResponse::from)
            .toList();
    return ResponseEntity.ok(team);
  }

  @PutMapping("/{userId}")
  public ResponseEntity<UserRoleResponse> assignRole(
      @PathVariable UUID userId, @Valid @RequestBody AssignRoleRequest request) {
    var role =
        platformRoleService.assignRole(
            userId, request.role(), request.adminPermissions(), RequestScopes.requirePrincipalId());
    return ResponseEntity.ok(UserRoleResponse.from(role));
  }

  public record AssignRoleRequest(@NotBlank String role, List<String> adminPermissions) {}

  public record UserRoleResponse(
      UUID userId, String role, List<String> adminPermissions, Instant updatedAt) {

    public static UserRoleResponse from(UserRole role) {
      return new UserRoleResponse(
          role.getUserId(),
          role.getRole(),
          List.copyOf(role.getAdminPermissions()),
          role.getUpdatedAt());
    }
  }
}
