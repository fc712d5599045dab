package io.chatpad.pilot.account;

import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of resolving a principal to the account whose resources it works on by default.
 *
 * @param principalId the authenticated principal
 * @param accountId the owning account's id; null when {@code source} is {@link Source#NONE}
 * @param source which rule produced the account
 */
public record AccountResolution(UUID principalId, UUID accountId, Source source) {

  public enum Source {
    IMPERSONATION,
    SUBSCRIPTION_OWNER,
    TEAM_MEMBERSHIP,
    NONE
  }

  public static AccountResolution none(UUID principalId) {
    return new AccountResolution(principalId, null, Source.NONE);
  }

  public boolean hasAccount() {
    return accountId != null;
  }

  public Optional<UUID> account() {
    return Optional.ofNullable(accountId);
  }
}
