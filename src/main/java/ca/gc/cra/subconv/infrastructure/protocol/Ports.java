package ca.gc.cra.subconv.infrastructure.protocol;

final class Ports {
  private Ports() {}

  /** Parses a port, returning {@code 0} for anything that is not an int. */
  static int parse(String text) {
    try {
      return Integer.parseInt(text.trim());
    } catch (NumberFormatException ex) {
      return 0;
    }
  }
}
