package io.chatpad.pilot.dispatch;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Outbound row-change dispatch under {@code pilot.dispatch}.
 *
 * @param enabled master switch
 * @param endpoints receiver URLs; each gets every event
 * @param secret shared secret sent as {@code X-Internal-Secret}
 * @param connectTimeout connect timeout per call
 * @param readTimeout read timeout per call
 */
@ConfigurationProperties(prefix = "pilot.dispatch")
public record DispatchProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue List<String> endpoints,
    String secret,
    @DefaultValue("2s") Duration connectTimeout,
    @DefaultValue("5s") Duration readTimeout) {

  public boolean isActive() {
    return enabled && endpoints != null && !endpoints.isEmpty();
  }
}
