package io.govlog.event;

import io.govlog.spi.EventLogException;
import io.govlog.spi.UnknownEventTypeException;
import io.govlog.util.JsonCodec;

/**
 * Converts typed payloads to and from the {@code (event_type, payload)} column pair.
 *
 * @see DefaultPayloadCodec
 */
public interface PayloadCodec {

  /**
   * Returns the codec that stores payload fields as a flat JSON object via
   * {@link JsonCodec#getDefault()}.
   */
  static PayloadCodec getDefault() {
    return DefaultPayloadCodec.INSTANCE;
  }

  /**
   * Returns the stored type name for {@code payload}.
   */
  default String typeName(EventPayload payload) {
    return payload.type().wireName();
  }

  /**
   * Encodes the payload's fields.
   *
   * @param payload the payload
   * @return the stored representation
   */
  String encode(EventPayload payload);

  /**
   * Decodes a stored payload.
   *
   * @param typeName stored type name
   * @param encoded  stored representation
   * @return the typed payload
   * @throws UnknownEventTypeException if {@code typeName} is not a known kind
   * @throws EventLogException         if the stored representation is malformed
   */
  EventPayload decode(String typeName, String encoded);
}
