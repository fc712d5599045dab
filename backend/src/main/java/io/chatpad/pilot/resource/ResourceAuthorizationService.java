package io.chatpad.pilot.resource;

import io.chatpad.pilot.account.AccountAccessService;
import io.chatpad.pilot.account.AccountResolution;
import io.chatpad.pilot.account.AccountResolver;
import io.chatpad.pilot.exception.ForbiddenException;
import io.chatpad.pilot.exception.ResourceNotFoundException;
import io.chatpad.pilot.platform.AdminPermission;
import io.chatpad.pilot.platform.PlatformAccessService;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Application-level replacement for per-table row security. Every tenant resource service asks
 * this class before touching a row.
 *
 * <p>Precedence: a {@code super_admin} gets everything. Otherwise the team relationship grants
 * access per {@link ResourceType} policy, {@code manage_accounts} tops it up to full access, and
 * {@code view_accounts} alone grants read. A live impersonation session of the target account
 * counts as platform access.
 */
@Service
public class ResourceAuthorizationService {

  private final AccountAccessService accountAccessService;
  private final PlatformAccessService platformAccessService;
  private final AccountResolver accountResolver;

  public ResourceAuthorizationService(
      AccountAccessService accountAccessService,
      PlatformAccessService platformAccessService,
      AccountResolver accountResolver) {
    this.accountAccessService = accountAccessService;
    this.platformAccessService = platformAccessService;
    this.accountResolver = accountResolver;
  }

  @Transactional(readOnly = true)
  public ResourceAccess checkAccess(ResourceType type, UUID ownerAccountId, UUID principalId) {
    if (platformAccessService.isSuperAdmin(principalId)) {
      return ResourceAccess.full(ResourceAccess.GrantedBy.PLATFORM);
    }

    ResourceAccess teamAccess = teamAccess(type, ownerAccountId, principalId);
    if (teamAccess.isFull()) {
      return teamAccess;
    }
    if (platformAccessService.hasAdminPermission(principalId, AdminPermission.MANAGE_ACCOUNTS)
        || isImpersonating(principalId, ownerAccountId)) {
      return ResourceAccess.full(ResourceAccess.GrantedBy.PLATFORM);
    }
    if (teamAccess.canView()) {
      return teamAccess;
    }
    if (platformAccessService.hasAdminPermission(principalId, AdminPermission.VIEW_ACCOUNTS)) {
      return ResourceAccess.viewOnly(ResourceAccess.GrantedBy.PLATFORM);
    }
    return ResourceAccess.none();
  }

  /**
   * Returns the account a new resource will belong to. A null request means the caller's own
   * resolved account. Creating for any other account needs {@code manage_accounts}.
   */
  @Transactional(readOnly = true)
  public UUID requireCreateAccount(ResourceType type, UUID requestedAccountId, UUID principalId) {
    if (requestedAccountId == null) {
      return accountResolver.requireAccountId(principalId);
    }
    Optional<UUID> resolved = accountResolver.resolveAccountId(principalId);
    if (resolved.isPresent() && resolved.get().equals(requestedAccountId)) {
      return requestedAccountId;
    }
    if (platformAccessService.hasAdminPermission(principalId, AdminPermission.MANAGE_ACCOUNTS)) {
      return requestedAccountId;
    }
    throw new ForbiddenException(
        "Cannot create " + type.displayName().toLowerCase(Locale.ROOT),
        "You cannot create resources for account " + requestedAccountId);
  }

  /** Throws not-found rather than forbidden so the row's existence does not leak. */
  @Transactional(readOnly = true)
  public ResourceAccess requireViewAccess(
      ResourceType type, AccountOwned resource, UUID principalId) {
    var access = checkAccess(type, resource.getUserId(), principalId);
    if (!access.canView()) {
      throw new ResourceNotFoundException(type.displayName(), resource.getId());
    }
    return access;
  }

  @Transactional(readOnly = true)
  public ResourceAccess requireEditAccess(
      ResourceType type, AccountOwned resource, UUID principalId) {
    return require(type, resource, principalId, ResourceOperation.UPDATE);
  }

  @Transactional(readOnly = true)
  public ResourceAccess requireDeleteAccess(
      ResourceType type, AccountOwned resource, UUID principalId) {
    return require(type, resource, principalId, ResourceOperation.DELETE);
  }

  @Transactional(readOnly = true)
  public ResourceAccess requireSensitiveAccess(
      ResourceType type, AccountOwned resource, UUID principalId) {
    return require(type, resource, principalId, ResourceOperation.SENSITIVE_UPDATE);
  }

  /**
   * Account whose rows a list call may return. Empty means "return nothing": lists mirror row
   * filtering and never fail for an account the caller cannot see.
   */
  @Transactional(readOnly = true)
  public Optional<UUID> listableAccountId(UUID principalId, UUID requestedAccountId) {
    if (requestedAccountId == null) {
      return accountResolver.resolveAccountId(principalId);
    }
    // Viewing does not depend on the resource type
    if (checkAccess(ResourceType.LEAD, requestedAccountId, principalId).canView()) {
      return Optional.of(requestedAccountId);
    }
    return Optional.empty();
  }

  private ResourceAccess require(
      ResourceType type, AccountOwned resource, UUID principalId, ResourceOperation operation) {
    var access = requireViewAccess(type, resource, principalId);
    if (!access.permits(operation)) {
      String verb = operation.name().toLowerCase(Locale.ROOT).replace('_', ' ');
      throw new ForbiddenException(
          "Cannot " + verb + " " + type.displayName().toLowerCase(Locale.ROOT),
          "Only the account owner or a team admin may do this");
    }
    return access;
  }

  private ResourceAccess teamAccess(ResourceType type, UUID ownerAccountId, UUID principalId) {
    if (!accountAccessService.hasAccountAccess(ownerAccountId, principalId)) {
      return ResourceAccess.none();
    }
    ResourceAccess.GrantedBy grantedBy;
    boolean isAdmin;
    if (principalId.equals(ownerAccountId)) {
      grantedBy = ResourceAccess.GrantedBy.OWNER;
      isAdmin = true;
    } else if (accountAccessService.isAccountAdmin(ownerAccountId, principalId)) {
      grantedBy = ResourceAccess.GrantedBy.TEAM_ADMIN;
      isAdmin = true;
    } else {
      grantedBy = ResourceAccess.GrantedBy.TEAM_MEMBER;
      isAdmin = false;
    }
    return new ResourceAccess(
        true,
        true,
        type.predicateFor(ResourceOperation.DELETE).satisfiedBy(true, isAdmin),
        type.predicateFor(ResourceOperation.SENSITIVE_UPDATE).satisfiedBy(true, isAdmin),
        grantedBy);
  }

  private boolean isImpersonating(UUID principalId, UUID ownerAccountId) {
    var resolution = accountResolver.resolve(principalId);
    return resolution.source() == AccountResolution.Source.IMPERSONATION
        && ownerAccountId.equals(resolution.accountId());
  }
}
