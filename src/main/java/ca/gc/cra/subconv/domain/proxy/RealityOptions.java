package ca.gc.cra.subconv.domain.proxy;

/**
 * Reality TLS-camouflage options ({@code reality-opts}). A node carrying these always has TLS enabled.
 *
 * @param publicKey server public key ({@code pbk}); {@code null} becomes empty
 * @param shortId short id ({@code sid}); {@code null} becomes empty
 * @since 0.1.0
 */
public record RealityOptions(String publicKey, String shortId) {
  public RealityOptions {
    publicKey = publicKey == null ? "" : publicKey;
    shortId = shortId == null ? "" : shortId;
  }
}
