package org.waabox.fanout.relay;

import java.util.Objects;

/**
 * A message received from the relay.
 *
 * <p>Data messages carry an envelope in their body. Control messages
 * (subscription acknowledgements, tombstones, keep-alives) carry no
 * envelope and are skipped by the dispatch loop.
 *
 * @param type the kind of message, never null
 * @param body the message text, null for control messages
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RelayMessage(Type type, String body) {

  /** The kind of relay message. */
  public enum Type {

    /** Carries an envelope. */
    DATA,

    /** Transport bookkeeping, no envelope. */
    CONTROL
  }

  /** Validates the message. */
  public RelayMessage {
    Objects.requireNonNull(type, "type must not be null");
    if (type == Type.DATA) {
      Objects.requireNonNull(body, "body must not be null for data");
    }
  }

  /**
   * Creates a data message.
   *
   * @param body the envelope text, never null
   * @return the message, never null
   */
  public static RelayMessage data(final String body) {
    return new RelayMessage(Type.DATA, body);
  }

  /**
   * Creates a control message.
   *
   * @param body an optional description, may be null
   * @return the message, never null
   */
  public static RelayMessage control(final String body) {
    return new RelayMessage(Type.CONTROL, body);
  }

  /**
   * Whether this message carries an envelope.
   *
   * @return true for data messages
   */
  public boolean isData() {
    return type == Type.DATA;
  }
}
