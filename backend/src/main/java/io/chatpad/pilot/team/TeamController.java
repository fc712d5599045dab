package io.chatpad.pilot.team;

import io.chatpad.pilot.account.AccountResolver;
import io.chatpad.pilot.context.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Team management for the caller's resolved account. Platform operators may target another account
 * with {@code ?accountId=}.
 */
@RestController
@RequestMapping("/api/team")
public class TeamController {

  private final TeamMemberService teamMemberService;
  private final TeamInvitationService invitationService;
  private final AccountResolver accountResolver;

  public TeamController(
      TeamMemberService teamMemberService,
      TeamInvitationService invitationService,
      AccountResolver accountResolver) {
    this.teamMemberService = teamMemberService;
    this.invitationService = invitationService;
    this.accountResolver = accountResolver;
  }

  @GetMapping("/members")
  public ResponseEntity<List<TeamMemberResponse>> listMembers(
      @RequestParam(required = false) UUID accountId) {
    UUID principalId = RequestScopes.requirePrincipalId();
    var members =
        teamMemberService.listMembers(targetAccount(accountId, principalId), principalId).stream()
            .map(TeamMemberResponse::from)
            .toList();
    return ResponseEntity.ok(members);
  }

  @PostMapping("/members")
  public ResponseEntity<TeamMemberResponse> addMember(
      @RequestParam(required = false) UUID accountId,
      @Valid @RequestBody AddMemberRequest request) {
    UUID principalId = RequestScopes.requirePrincipalId();
    var member =
        teamMemberService.addMember(
            targetAccount(accountId, principalId), request.memberId(), request.role(), principalId);
    return ResponseEntity.created(URI.create("/api/team/members/" + member.getMemberId()))
        .body(TeamMemberResponse.from(member));
  }

  @PutMapping("/members/{memberId}/role")
  public ResponseEntity<TeamMemberResponse> changeRole(
      @PathVariable UUID memberId,
      @RequestParam(required = false) UUID accountId,
      @Valid @RequestBody ChangeRoleRequest request) {
    UUID principalId = RequestScopes.requirePrincipalId();
    var member =
        teamMemberService.changeRole(
            targetAccount(accountId, principalId), memberId, request.role(), principalId);
    return ResponseEntity.ok(TeamMemberResponse.from(member));
  }

  @DeleteMapping("/members/{memberId}")
  public ResponseEntity<Void> removeMember(
      @PathVariable UUID memberId, @RequestParam(required = false) UUID accountId) {
    UUID principalId = RequestScopes.requirePrincipalId();
    teamMemberService.removeMember(targetAccount(accountId, principalId), memberId, principalId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/invitations")
  public ResponseEntity<List<InvitationResponse>> listInvitations(
      @RequestParam(required = false) UUID accountId) {
    UUID principalId = RequestScopes.requirePrincipalId();
    var invitations =
        invitationService.listPending(targetAccount(accountId, principalId), principalId).stream()
            .map(InvitationResponse::from)
            .toList();
    return ResponseEntity.ok(invitations);
  }

  /** The response carries the one-time token; it is not shown again. */
  @PostMapping("/invitations")
  public ResponseEntity<InvitationCreatedResponse> invite(
      @RequestParam(required = false) UUID accountId,
      @Valid @RequestBody InviteRequest request) {
    UUID principalId = RequestScopes.requirePrincipalId();
    var invitation =
        invitationService.invite(
            targetAccount(accountId, principalId), request.email(), request.role(), principalId);
    return ResponseEntity.created(URI.create("/api/team/invitations/" + invitation.getId()))
        .body(
            new InvitationCreatedResponse(
                InvitationResponse.from(invitation), invitation.getToken()));
  }

  @PostMapping("/invitations/accept")
  public ResponseEntity<TeamMemberResponse> accept(@Valid @RequestBody AcceptRequest request) {
    var member = invitationService.accept(request.token(), RequestScopes.requirePrincipalId());
    return ResponseEntity.ok(TeamMemberResponse.from(member));
  }

  @DeleteMapping("/invitations/{invitationId}")
  public ResponseEntity<Void> revoke(@PathVariable UUID invitationId) {
    invitationService.revoke(invitationId, RequestScopes.requirePrincipalId());
    return ResponseEntity.noContent().build();
  }

  private UUID targetAccount(UUID requested, UUID principalId) {
    return requested != null ? requested : accountResolver.requireAccountId(principalId);
  }

  // --- DTOs ---

  public record AddMemberRequest(@NotNull UUID memberId, @NotBlank String role) {}

  public record ChangeRoleRequest(@NotBlank String role) {}

  public record InviteRequest(@NotBlank @Email String email, @NotBlank String role) {}

  public record AcceptRequest(@NotBlank String token) {}

  public record TeamMemberResponse(
      UUID id, UUID ownerId, UUID memberId, String role, Instant createdAt) {

    public static TeamMemberResponse from(TeamMember member) {
      return new TeamMemberResponse(
          member.getId(),
          member.getOwnerId(),
          member.getMemberId(),
          member.getRole(),
          member.getCreatedAt());
    }
  }

  public record InvitationResponse(
      UUID id, String email, String role, String status, Instant expiresAt, Instant createdAt) {

    public static InvitationResponse from(TeamInvitation invitation) {
      return new InvitationResponse(
          invitation.getId(),
          invitation.getEmail(),
          invitation.getRole(),
          invitation.getStatus(),
          invitation.getExpiresAt(),
          invitation.getCreatedAt());
    }
  }

  public record InvitationCreatedResponse(InvitationResponse invitation, String token) {}
}
