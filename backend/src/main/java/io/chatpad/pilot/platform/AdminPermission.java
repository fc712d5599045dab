package io.chatpad.pilot.platform;

import java.util.Set;

/** Fine-grained capabilities held in {@code user_roles.admin_permissions}. */
public final class AdminPermission {

  public static final String VIEW_ACCOUNTS = "view_accounts";
  public static final String MANAGE_ACCOUNTS = "manage_accounts";
  public static final String VIEW_CONTENT = "view_content";
  public static final String MANAGE_CONTENT = "manage_content";
  public static final String VIEW_TEAM = "view_team";
  public static final String MANAGE_TEAM = "manage_team";
  public static final String VIEW_REVENUE = "view_revenue";
  public static final String MANAGE_REVENUE = "manage_revenue";
  public static final String VIEW_SETTINGS = "view_settings";
  public static final String MANAGE_SETTINGS = "manage_settings";
  public static final String IMPERSONATE_USERS = "impersonate_users";

  public static final Set<String> ALL =
      Set.of(
          VIEW_ACCOUNTS,
          MANAGE_ACCOUNTS,
          VIEW_CONTENT,
          MANAGE_CONTENT,
          VIEW_TEAM,
          MANAGE_TEAM,
          VIEW_REVENUE,
          MANAGE_REVENUE,
          VIEW_SETTINGS,
          MANAGE_SETTINGS,
          IMPERSONATE_USERS);

  private AdminPermission() {}
}
