package io.chatpad.pilot.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.chatpad.pilot.account.AccountAccessService;
import io.chatpad.pilot.account.AccountResolution;
import io.chatpad.pilot.account.AccountResolver;
import io.chatpad.pilot.apikey.ApiKey;
import io.chatpad.pilot.exception.ForbiddenException;
import io.chatpad.pilot.exception.NoAccountContextException;
import io.chatpad.pilot.exception.ResourceNotFoundException;
import io.chatpad.pilot.platform.AdminPermission;
import io.chatpad.pilot.platform.PlatformAccessService;
import io.chatpad.pilot.testutil.TestEntities;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ResourceAuthorizationServiceTest {

  private static final UUID OWNER = UUID.randomUUID();
  private static final UUID PRINCIPAL = UUID.randomUUID();

  @Mock private AccountAccessService accountAccessService;
  @Mock private PlatformAccessService platformAccessService;
  @Mock private AccountResolver accountResolver;
  @InjectMocks private ResourceAuthorizationService service;

  @Test
  void superAdminBypassesTeamChecksEntirely() {
    when(platformAccessService.isSuperAdmin(PRINCIPAL)).thenReturn(true);

    var access = service.checkAccess(ResourceType.LEAD, OWNER, PRINCIPAL);

    assertThat(access.isFull()).isTrue();
    assertThat(access.grantedBy()).isEqualTo(ResourceAccess.GrantedBy.PLATFORM);
    verify(accountAccessService, never()).hasAccountAccess(any(), any());
  }

  @Test
  void ownerHasFullAccess() {
    when(platformAccessService.isSuperAdmin(OWNER)).thenReturn(false);
    when(accountAccessService.hasAccountAccess(OWNER, OWNER)).thenReturn(true);

    var access = service.checkAccess(ResourceType.API_KEY, OWNER, OWNER);

    assertThat(access.isFull()).isTrue();
    assertThat(access.grantedBy()).isEqualTo(ResourceAccess.GrantedBy.OWNER);
  }

  @Test
  void plainMemberCanReadAndEditApiKeyButNotRevoke() {
    var apiKey = apiKeyOf(OWNER);
    plainMember();
    when(accountResolver.resolve(PRINCIPAL))
        .thenReturn(
            new AccountResolution(PRINCIPAL, OWNER, AccountResolution.Source.TEAM_MEMBERSHIP));

    assertThat(service.requireViewAccess(ResourceType.API_KEY, apiKey, PRINCIPAL).canView())
        .isTrue();
    assertThat(service.requireEditAccess(ResourceType.API_KEY, apiKey, PRINCIPAL).canEdit())
        .isTrue();
    assertThatThrownBy(() -> service.requireDeleteAccess(ResourceType.API_KEY, apiKey, PRINCIPAL))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void plainMemberHasFullAccessToLeads() {
    plainMember();

    var access = service.checkAccess(ResourceType.LEAD, OWNER, PRINCIPAL);

    assertThat(access.isFull()).isTrue();
    assertThat(access.grantedBy()).isEqualTo(ResourceAccess.GrantedBy.TEAM_MEMBER);
  }

  @Test
  void outsiderGetsNotFoundRatherThanForbidden() {
    var apiKey = apiKeyOf(OWNER);
    outsider();
    when(platformAccessService.hasAdminPermission(PRINCIPAL, AdminPermission.VIEW_ACCOUNTS))
        .thenReturn(false);

    assertThatThrownBy(() -> service.requireEditAccess(ResourceType.API_KEY, apiKey, PRINCIPAL))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void viewAccountsOperatorMayReadButNotEdit() {
    var apiKey = apiKeyOf(OWNER);
    outsider();
    when(platformAccessService.hasAdminPermission(PRINCIPAL, AdminPermission.VIEW_ACCOUNTS))
        .thenReturn(true);

    var access = service.requireViewAccess(ResourceType.API_KEY, apiKey, PRINCIPAL);

    assertThat(access.grantedBy()).isEqualTo(ResourceAccess.GrantedBy.PLATFORM);
    assertThatThrownBy(() -> service.requireEditAccess(ResourceType.API_KEY, apiKey, PRINCIPAL))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void impersonatingAdminActsWithFullAccessOnTargetAccount() {
    when(platformAccessService.isSuperAdmin(PRINCIPAL)).thenReturn(false);
    when(accountAccessService.hasAccountAccess(OWNER, PRINCIPAL)).thenReturn(false);
    when(platformAccessService.hasAdminPermission(PRINCIPAL, AdminPermission.MANAGE_ACCOUNTS))
        .thenReturn(false);
    when(accountResolver.resolve(PRINCIPAL))
        .thenReturn(
            new AccountResolution(PRINCIPAL, OWNER, AccountResolution.Source.IMPERSONATION));

    var access = service.checkAccess(ResourceType.WEBHOOK, OWNER, PRINCIPAL);

    assertThat(access.isFull()).isTrue();
  }

  @Test
  void creatingForAnotherAccountNeedsManageAccounts() {
    var other = UUID.randomUUID();
    when(accountResolver.resolveAccountId(PRINCIPAL)).thenReturn(Optional.of(OWNER));
    when(platformAccessService.hasAdminPermission(PRINCIPAL, AdminPermission.MANAGE_ACCOUNTS))
        .thenReturn(false);

    assertThatThrownBy(() -> service.requireCreateAccount(ResourceType.AGENT, other, PRINCIPAL))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void creatingWithoutAccountContextFails() {
    when(accountResolver.requireAccountId(PRINCIPAL))
        .thenThrow(new NoAccountContextException(PRINCIPAL));

    assertThatThrownBy(() -> service.requireCreateAccount(ResourceType.AGENT, null, PRINCIPAL))
        .isInstanceOf(NoAccountContextException.class);
  }

  @Test
  void creatingDefaultsToResolvedAccount() {
    when(accountResolver.requireAccountId(PRINCIPAL)).thenReturn(OWNER);

    assertThat(service.requireCreateAccount(ResourceType.LEAD, null, PRINCIPAL)).isEqualTo(OWNER);
  }

  @Test
  void listingAnUnreadableAccountReturnsNothing() {
    outsider();
    when(platformAccessService.hasAdminPermission(PRINCIPAL, AdminPermission.VIEW_ACCOUNTS))
        .thenReturn(false);

    assertThat(service.listableAccountId(PRINCIPAL, OWNER)).isEmpty();
  }

  private void plainMember() {
    when(platformAccessService.isSuperAdmin(PRINCIPAL)).thenReturn(false);
    when(accountAccessService.hasAccountAccess(OWNER, PRINCIPAL)).thenReturn(true);
    when(accountAccessService.isAccountAdmin(OWNER, PRINCIPAL)).thenReturn(false);
  }

  private void outsider() {
    when(platformAccessService.isSuperAdmin(PRINCIPAL)).thenReturn(false);
    when(accountAccessService.hasAccountAccess(OWNER, PRINCIPAL)).thenReturn(false);
    when(platformAccessService.hasAdminPermission(PRINCIPAL, AdminPermission.MANAGE_ACCOUNTS))
        .thenReturn(false);
    when(accountResolver.resolve(PRINCIPAL)).thenReturn(AccountResolution.none(PRINCIPAL));
  }

  private static ApiKey apiKeyOf(UUID accountId) {
    return TestEntities.withId(
        new ApiKey(accountId, null, "CI key", "pk_live_abcd", "hash", accountId),
        UUID.randomUUID());
  }
}
