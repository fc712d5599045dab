package io.chatpad.pilot.resource;

/** Which per-account predicate gates an operation. */
public enum AccessPredicate {
  /** Owner or any team member. */
  ACCOUNT_ACCESS,
  /** Owner or a team member with the {@code admin} role. */
  ACCOUNT_ADMIN;

  boolean satisfiedBy(boolean hasAccess, boolean isAdmin) {
    return this == ACCOUNT_ACCESS ? hasAccess : isAdmin;
  }
}
