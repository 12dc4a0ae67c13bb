package org.waabox.fanout.event;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives decoded change payloads for a channel.
 *
 * <p>Handlers are supplied by the surrounding service, typically to push the
 * payload to connected live clients. They are mode-agnostic: the same
 * handler is called whether the change came through the relay or straight
 * from the source store. A handler may throw; the caller logs the failure
 * and moves on to the next message. Handlers must return promptly since
 * they run on the delivery thread.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ChangeHandler {

  /**
   * Called once per change received on the channel.
   *
   * @param channel the channel the change was raised on, never null
   * @param payload the decoded payload, never null
   */
  void onChange(String channel, JsonNode payload);
}
