package io.chatpad.pilot.context;

import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Request-scoped principal identity. Bound by {@code PrincipalFilter} for the duration of a request
 * and read by controllers and the audit builder.
 *
 * <p>Services never read this directly; they receive the principal id as a parameter so that every
 * authorization decision is explicit and testable.
 */
public final class RequestScopes {

  private static final ThreadLocal<UUID> PRINCIPAL_ID = new ThreadLocal<>();

  /** Returns the authenticated principal's UUID. Throws if not bound by the filter chain. */
  public static UUID requirePrincipalId() {
    UUID principalId = PRINCIPAL_ID.get();
    if (principalId == null) {
      throw new PrincipalContextNotBoundException();
    }
    return principalId;
  }

  /** Returns the authenticated principal's UUID, or null if not bound. */
  public static UUID getPrincipalIdOrNull() {
    return PRINCIPAL_ID.get();
  }

  public static boolean isPrincipalBound() {
    return PRINCIPAL_ID.get() != null;
  }

  /**
   * Runs {@code action} with {@code principalId} bound, restoring the previous binding afterwards
   * (including when the action throws).
   */
  public static <T> T callAs(UUID principalId, Callable<T> action) throws Exception {
    UUID previous = PRINCIPAL_ID.get();
    PRINCIPAL_ID.set(principalId);
    try {
      return action.call();
    } finally {
      if (previous == null) {
        PRINCIPAL_ID.remove();
      } else {
        PRINCIPAL_ID.set(previous);
      }
    }
  }

  /** Runnable variant of {@link #callAs(UUID, Callable)}. */
  public static void runAs(UUID principalId, Runnable action) {
    UUID previous = PRINCIPAL_ID.get();
    PRINCIPAL_ID.set(principalId);
    try {
      action.run();
    } finally {
      if (previous == null) {
        PRINCIPAL_ID.remove();
      } else {
        PRINCIPAL_ID.set(previous);
      }
    }
  }

  private RequestScopes() {}
}
