package io.chatpad.pilot.dispatch;

import java.util.Map;
import java.util.UUID;

/**
 * A committed change to a dispatched table. Published inside the mutating transaction and
 * delivered to downstream receivers only after commit.
 *
 * @param type {@code insert}, {@code update} or {@code delete}
 * @param table source table name
 * @param schema always {@code public}
 * @param record the row after the change; null for deletes
 * @param oldRecord the row before the change; null for inserts
 * @param accountId owning account of the row
 */
public record RowChangeEvent(
    String type,
    String table,
    String schema,
    Map<String, Object> record,
    Map<String, Object> oldRecord,
    UUID accountId) {

  public static final String INSERT = "insert";
  public static final String UPDATE = "update";
  public static final String DELETE = "delete";

  private static final String SCHEMA = "public";

  public static RowChangeEvent insert(String table, UUID accountId, Map<String, Object> record) {
    return new RowChangeEvent(INSERT, table, SCHEMA, record, null, accountId);
  }

  public static RowChangeEvent update(
      String table, UUID accountId, Map<String, Object> record, Map<String, Object> oldRecord) {
    return new RowChangeEvent(UPDATE, table, SCHEMA, record, oldRecord, accountId);
  }

  public static RowChangeEvent delete(String table, UUID accountId, Map<String, Object> oldRecord) {
    return new RowChangeEvent(DELETE, table, SCHEMA, null, oldRecord, accountId);
  }
}
