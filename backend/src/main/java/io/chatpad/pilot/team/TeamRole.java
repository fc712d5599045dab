package io.chatpad.pilot.team;

/** Intra-account role of a team member. Owners have no row; they are the account itself. */
public final class TeamRole {

  public static final String ADMIN = "admin";
  public static final String MEMBER = "member";

  /** Role reported for the account owner in views; never stored in {@code team_members}. */
  public static final String OWNER = "owner";

  public static boolean isValid(String role) {
    return ADMIN.equals(role) || MEMBER.equals(role);
  }

  private TeamRole() {}
}
