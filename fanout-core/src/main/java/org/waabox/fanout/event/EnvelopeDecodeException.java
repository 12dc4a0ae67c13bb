package org.waabox.fanout.event;

import org.waabox.fanout.FanoutException;

/**
 * Thrown when a change payload or a relay envelope is not valid JSON, or
 * lacks its channel.
 *
 * <p>Always caught where the message is received and logged; a bad message
 * never stops a receive loop.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class EnvelopeDecodeException extends FanoutException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception with the given message.
   *
   * @param message the detail message, never null
   */
  public EnvelopeDecodeException(final String message) {
    super(message);
  }

  /**
   * Creates a new exception with the given message and cause.
   *
   * @param message the detail message, never null
   * @param cause   the parse failure, never null
   */
  public EnvelopeDecodeException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
