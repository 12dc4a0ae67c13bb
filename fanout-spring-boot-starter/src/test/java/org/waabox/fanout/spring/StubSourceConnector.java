package org.waabox.fanout.spring;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.waabox.fanout.source.SourceConnection;
import org.waabox.fanout.source.SourceConnector;
import org.waabox.fanout.source.SourceNotification;

/** A source connector whose single queue feeds every connection.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class StubSourceConnector implements SourceConnector {

  /** Notifications waiting to be polled. */
  private final BlockingQueue<SourceNotification> queue =
      new LinkedBlockingQueue<>();

  /** Queues a notification.
   *
   * @param channel the channel, never null
   * @param payload the raw payload, never null
   */
  void notify(final String channel, final String payload) {
    queue.offer(new SourceNotification(channel, payload));
  }

  @Override
  public SourceConnection connect() {
    return new SourceConnection() {

      @Override
      public void listen(final String channel) {
      }

      @Override
      public void unlisten(final String channel) {
      }

      @Override
      public List<SourceNotification> poll(final Duration timeout) {
        final List<SourceNotification> result = new ArrayList<>();
        try {
          final SourceNotification first = queue.poll(timeout.toMillis(),
              TimeUnit.MILLISECONDS);
          if (first != null) {
            result.add(first);
          }
        } catch (final InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        return result;
      }

      @Override
      public boolean isValid() {
        return true;
      }

      @Override
      public void close() {
      }
    };
  }
}
