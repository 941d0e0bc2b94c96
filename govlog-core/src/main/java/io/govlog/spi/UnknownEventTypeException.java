package io.govlog.spi;

/**
 * Thrown when a stored event carries a type name this kernel cannot decode.
 */
public final class UnknownEventTypeException extends EventLogException {
  private final String typeName;

  public UnknownEventTypeException(String typeName) {
    super("Unknown event type: " + typeName);
    this.typeName = typeName;
  }

  public String typeName() {
    return typeName;
  }
}
