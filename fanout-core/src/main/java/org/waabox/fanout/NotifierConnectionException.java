package org.waabox.fanout;

/**
 * Thrown when a transport (the source store or the relay) cannot be
 * reached, or when an established connection fails.
 *
 * <p>The {@link ConnectionManager} never lets this exception escape from
 * {@link ConnectionManager#startup()}; it is turned into a state transition
 * instead.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NotifierConnectionException extends FanoutException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception with the given message.
   *
   * @param message the detail message, never null
   */
  public NotifierConnectionException(final String message) {
    super(message);
  }

  /**
   * Creates a new exception with the given message and cause.
   *
   * @param message the detail message, never null
   * @param cause   the underlying transport failure, never null
   */
  public NotifierConnectionException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
