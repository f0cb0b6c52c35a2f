package ca.gc.cra.subconv.application.convert;

import ca.gc.cra.subconv.application.port.ProxyUriCodec;
import ca.gc.cra.subconv.domain.proxy.InvalidFormatException;
import ca.gc.cra.subconv.domain.proxy.ProtocolType;
import ca.gc.cra.subconv.domain.proxy.ProxyConversionException;
import ca.gc.cra.subconv.domain.proxy.ProxyNode;
import ca.gc.cra.subconv.domain.proxy.UnsupportedProtocolException;
import ca.gc.cra.subconv.infrastructure.protocol.Hysteria2Codec;
import ca.gc.cra.subconv.infrastructure.protocol.HysteriaCodec;
import ca.gc.cra.subconv.infrastructure.protocol.ShadowsocksCodec;
import ca.gc.cra.subconv.infrastructure.protocol.ShadowsocksRCodec;
import ca.gc.cra.subconv.infrastructure.protocol.TrojanCodec;
import ca.gc.cra.subconv.infrastructure.protocol.TuicCodec;
import ca.gc.cra.subconv.infrastructure.protocol.VlessCodec;
import ca.gc.cra.subconv.infrastructure.protocol.VmessCodec;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Front door that routes share links and nodes to the matching protocol codec.
 * <p><strong>Why:</strong> Callers hand over arbitrary links without knowing the dialect; the scheme picks the codec.</p>
 * <p><strong>Role:</strong> Application-layer use case over the {@link ProxyUriCodec} port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Extract and normalize the scheme token, including the {@code hy2} alias.</li>
 *   <li>Dispatch decode by scheme and encode by node type.</li>
 *   <li>Reject decoded nodes that carry no server.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class ProxyLinkConverter {
  private static final Logger log = LoggerFactory.getLogger(ProxyLinkConverter.class);

  private final Map<ProtocolType, ProxyUriCodec> codecs;

  /**
   * Creates a converter over the given codecs.
   *
   * @param codecs one codec per protocol; must not be {@code null}
   * @throws IllegalArgumentException when two codecs serve the same protocol
   */
  public ProxyLinkConverter(List<? extends ProxyUriCodec> codecs) {
    Objects.requireNonNull(codecs, "codecs");
    Map<ProtocolType, ProxyUriCodec> byType = new EnumMap<>(ProtocolType.class);
    for (ProxyUriCodec codec : codecs) {
      ProxyUriCodec previous = byType.put(codec.type(), codec);
      if (previous != null) {
        throw new IllegalArgumentException("duplicate codec for protocol " + codec.type().tag());
      }
    }
    this.codecs = byType;
  }

  /**
   * Creates a converter wired with the built-in codecs for all supported protocols.
   *
   * @return converter instance
   */
  public static ProxyLinkConverter withDefaultCodecs() {
    return new ProxyLinkConverter(List.of(
        new ShadowsocksCodec(),
        new ShadowsocksRCodec(),
        new VmessCodec(),
        new VlessCodec(),
        new TrojanCodec(),
        new HysteriaCodec(),
        new Hysteria2Codec(),
        new TuicCodec()));
  }

  /**
   * Decodes one share link.
   *
   * @param uri share link; must not be {@code null}
   * @return decoded node
   * @throws InvalidFormatException when the link has no {@code ://}, is malformed, or names no server
   * @throws UnsupportedProtocolException when no codec serves the scheme
   * @throws ProxyConversionException for other codec failures
   */
  public ProxyNode decode(String uri) throws ProxyConversionException {
    Objects.requireNonNull(uri, "uri");
    String trimmed = uri.trim();
    int sep = trimmed.indexOf("://");
    if (sep < 0) {
      throw new InvalidFormatException("missing '://' separator");
    }
    String scheme = trimmed.substring(0, sep);
    ProxyUriCodec codec = ProtocolType.fromScheme(scheme)
        .map(codecs::get)
        .orElseThrow(() -> new UnsupportedProtocolException(scheme));
    ProxyNode node = codec.decode(trimmed);
    if (node.server().isBlank()) {
      throw new InvalidFormatException(codec.type().tag() + " link has no server");
    }
    log.debug("Decoded {} node {}:{}", node.type(), node.server(), node.port());
    return node;
  }

  /**
   * Encodes a node into a share link of its own protocol.
   *
   * @param node node to encode; must not be {@code null}
   * @return share link
   * @throws UnsupportedProtocolException when no codec serves the node type
   * @throws ProxyConversionException for other codec failures
   */
  public String encode(ProxyNode node) throws ProxyConversionException {
    Objects.requireNonNull(node, "node");
    ProxyUriCodec codec = ProtocolType.fromTag(node.type())
        .map(codecs::get)
        .orElseThrow(() -> new UnsupportedProtocolException(node.type()));
    return codec.encode(node);
  }
}
