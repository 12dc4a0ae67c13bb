package org.waabox.fanout.event;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * A change raised by the source store on a named channel.
 *
 * <p>The payload is whatever the producer serialized. Only the channel is
 * interpreted by the notification layer; the payload is carried as an
 * opaque JSON tree.
 *
 * @param channel the channel the change was raised on, never null
 * @param payload the decoded JSON payload, never null ({@code null} input
 *                is normalized to a JSON null node)
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ChangeEvent(String channel, JsonNode payload) {

  /** Validates the channel and normalizes a missing payload. */
  public ChangeEvent {
    Objects.requireNonNull(channel, "channel must not be null");
    if (payload == null) {
      payload = NullNode.getInstance();
    }
  }
}
