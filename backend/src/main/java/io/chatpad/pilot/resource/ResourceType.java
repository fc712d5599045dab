package io.chatpad.pilot.resource;

import static io.chatpad.pilot.resource.AccessPredicate.ACCOUNT_ACCESS;
import static io.chatpad.pilot.resource.AccessPredicate.ACCOUNT_ADMIN;

/**
 * Tenant resource tables and their authorization matrix. Read and ordinary update always need
 * account access; delete and sensitive updates (secret rotation, key revocation, billing) are
 * admin-only for some types.
 */
public enum ResourceType {
  AGENT("agents", "Agent", ACCOUNT_ADMIN, ACCOUNT_ADMIN),
  KNOWLEDGE_SOURCE("knowledge_sources", "Knowledge source", ACCOUNT_ACCESS, ACCOUNT_ACCESS),
  CONVERSATION("conversations", "Conversation", ACCOUNT_ADMIN, ACCOUNT_ADMIN),
  MESSAGE("messages", "Message", ACCOUNT_ACCESS, ACCOUNT_ACCESS),
  LEAD("leads", "Lead", ACCOUNT_ACCESS, ACCOUNT_ACCESS),
  WEBHOOK("webhooks", "Webhook", ACCOUNT_ADMIN, ACCOUNT_ADMIN),
  API_KEY("api_keys", "API key", ACCOUNT_ADMIN, ACCOUNT_ADMIN),
  SCHEDULED_REPORT("scheduled_reports", "Scheduled report", ACCOUNT_ACCESS, ACCOUNT_ACCESS),
  CUSTOM_DOMAIN("custom_domains", "Custom domain", ACCOUNT_ADMIN, ACCOUNT_ADMIN),
  LOCATION("locations", "Location", ACCOUNT_ACCESS, ACCOUNT_ACCESS),
  PROPERTY("properties", "Property", ACCOUNT_ACCESS, ACCOUNT_ACCESS),
  AUTOMATION("automations", "Automation", ACCOUNT_ADMIN, ACCOUNT_ADMIN),
  SUBSCRIPTION("subscriptions", "Subscription", ACCOUNT_ADMIN, ACCOUNT_ADMIN);

  private final String table;
  private final String displayName;
  private final AccessPredicate deletePredicate;
  private final AccessPredicate sensitiveUpdatePredicate;

  ResourceType(
      String table,
      String displayName,
      AccessPredicate deletePredicate,
      AccessPredicate sensitiveUpdatePredicate) {
    this.table = table;
    this.displayName = displayName;
    this.deletePredicate = deletePredicate;
    this.sensitiveUpdatePredicate = sensitiveUpdatePredicate;
  }

  public String table() {
    return table;
  }

  public String displayName() {
    return displayName;
  }

  /** The predicate gating {@code operation}. Create, read and update use account access. */
  public AccessPredicate predicateFor(ResourceOperation operation) {
    return switch (operation) {
      case CREATE, READ, UPDATE -> ACCOUNT_ACCESS;
      case DELETE -> deletePredicate;
      case SENSITIVE_UPDATE -> sensitiveUpdatePredicate;
    };
  }
}
