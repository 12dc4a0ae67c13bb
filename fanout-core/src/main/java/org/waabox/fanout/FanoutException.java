package org.waabox.fanout;

/**
 * Base exception for all fanout-related errors.
 *
 * <p>This is an unchecked exception intended to wrap transport and
 * decoding failures. Subclasses tell callers whether the failure is a
 * connectivity problem ({@link NotifierConnectionException}) or a bad
 * payload ({@link org.waabox.fanout.event.EnvelopeDecodeException}).</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class FanoutException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public FanoutException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public FanoutException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
