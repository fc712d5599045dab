package io.chatpad.pilot.platform;

/**
 * Platform-level role stored in {@code user_roles.role}. Orthogonal to the intra-account team role:
 * a tenant's team "admin" has no platform powers, and a platform operator needs no team
 * membership to see an account.
 */
public final class PlatformRole {

  public static final String MEMBER = "member";
  public static final String ADMIN = "admin";
  public static final String SUPER_ADMIN = "super_admin";
  public static final String PILOT_SUPPORT = "pilot_support";

  public static boolean isValid(String role) {
    return MEMBER.equals(role)
        || ADMIN.equals(role)
        || SUPER_ADMIN.equals(role)
        || PILOT_SUPPORT.equals(role);
  }

  /** Roles that make a principal part of the platform operations team. */
  public static boolean isPilotTeam(String role) {
    return SUPER_ADMIN.equals(role) || PILOT_SUPPORT.equals(role);
  }

  private PlatformRole() {}
}
