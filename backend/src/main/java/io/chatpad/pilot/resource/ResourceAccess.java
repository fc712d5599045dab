package io.chatpad.pilot.resource;

/**
 * Effective permissions of a principal on one account's resources of a given type.
 *
 * @param canView read the resource
 * @param canEdit ordinary updates
 * @param canDelete delete the resource
 * @param canManageSensitive sensitive updates such as secret rotation or key revocation
 * @param grantedBy the relationship that produced these permissions
 */
public record ResourceAccess(
    boolean canView,
    boolean canEdit,
    boolean canDelete,
    boolean canManageSensitive,
    GrantedBy grantedBy) {

  public enum GrantedBy {
    OWNER,
    TEAM_ADMIN,
    TEAM_MEMBER,
    PLATFORM,
    NONE
  }

  public static ResourceAccess full(GrantedBy grantedBy) {
    return new ResourceAccess(true, true, true, true, grantedBy);
  }

  public static ResourceAccess viewOnly(GrantedBy grantedBy) {
    return new ResourceAccess(true, false, false, false, grantedBy);
  }

  public static ResourceAccess none() {
    return new ResourceAccess(false, false, false, false, GrantedBy.NONE);
  }

  public boolean isFull() {
    return canView && canEdit && canDelete && canManageSensitive;
  }

  public boolean permits(ResourceOperation operation) {
    return switch (operation) {
      case READ -> canView;
      case CREATE, UPDATE -> canEdit;
      case DELETE -> canDelete;
      case SENSITIVE_UPDATE -> canManageSensitive;
    };
  }
}
