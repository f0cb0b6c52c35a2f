package ca.gc.cra.subconv.domain.proxy;

import java.util.Map;

/**
 * WebSocket transport options ({@code ws-opts}).
 *
 * @param path request path; {@code null} or empty is normalized to {@code "/"}
 * @param headers extra handshake headers (typically {@code Host}); defensively copied
 * @since 0.1.0
 */
public record WsOptions(String path, Map<String, String> headers) {
  public WsOptions {
    path = path == null || path.isEmpty() ? "/" : path;
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  /**
   * Creates options for {@code path} with an optional {@code Host} header.
   *
   * @param path request path
   * @param host host header value; blank or {@code null} omits the header
   * @return websocket options
   */
  public static WsOptions of(String path, String host) {
    if (host == null || host.isEmpty()) {
      return new WsOptions(path, Map.of());
    }
    return new WsOptions(path, Map.of("Host", host));
  }

  /**
   * @return the {@code Host} header value, or {@code null} when none was supplied
   */
  public String host() {
    return headers.get("Host");
  }
}
