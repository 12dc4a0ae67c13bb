package org.waabox.fanout.source;

/**
 * A raw notification delivered by the source store.
 *
 * @param channel the channel the notification was raised on, never null
 * @param payload the raw payload text, may be empty or null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SourceNotification(String channel, String payload) {
}
