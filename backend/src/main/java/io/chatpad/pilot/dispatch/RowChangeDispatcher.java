package io.chatpad.pilot.dispatch;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * POSTs row-change payloads to the configured receivers. Delivery is best effort: every failure
 * is logged and dropped, and receivers must tolerate duplicates and reordering.
 */
@Component
public class RowChangeDispatcher {

  private static final Logger log = LoggerFactory.getLogger(RowChangeDispatcher.class);

  static final String SECRET_HEADER = "X-Internal-Secret";

  private final RestClient restClient;
  private final DispatchProperties properties;

  public RowChangeDispatcher(RestClient dispatchRestClient, DispatchProperties properties) {
    this.restClient = dispatchRestClient;
    this.properties = properties;
  }

  /** Sends {@code event} to every endpoint. Never throws. */
  public void dispatch(RowChangeEvent event) {
    if (!properties.isActive()) {
      log.debug("Dispatch disabled, skipping {} on {}", event.type(), event.table());
      return;
    }
    var payload = toPayload(event);
    for (String endpoint : properties.endpoints()) {
      try {
        var request =
            restClient.post().uri(endpoint).contentType(MediaType.APPLICATION_JSON).body(payload);
        if (properties.secret() != null) {
          request = request.header(SECRET_HEADER, properties.secret());
        }
        request.retrieve().toBodilessEntity();
        log.debug("Dispatched {} on {} to {}", event.type(), event.table(), endpoint);
      } catch (Exception e) {
        log.warn(
            "Row-change dispatch failed: type={}, table={}, endpoint={}, error={}",
            event.type(),
            event.table(),
            endpoint,
            e.getMessage());
      }
    }
  }

  static Map<String, Object> toPayload(RowChangeEvent event) {
    var payload = new LinkedHashMap<String, Object>();
    payload.put("type", event.type());
    payload.put("table", event.table());
    payload.put("schema", event.schema());
    payload.put("record", event.record());
    if (event.oldRecord() != null) {
      payload.put("old_record", event.oldRecord());
    }
    return payload;
  }
}
