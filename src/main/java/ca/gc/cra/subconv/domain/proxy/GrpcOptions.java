package ca.gc.cra.subconv.domain.proxy;

/**
 * gRPC transport options ({@code grpc-opts}).
 *
 * @param serviceName gRPC service name; {@code null} is normalized to an empty string
 * @since 0.1.0
 */
public record GrpcOptions(String serviceName) {
  public GrpcOptions {
    serviceName = serviceName == null ? "" : serviceName;
  }
}
