package org.waabox.fanout.event;

import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Static utility class for the JSON forms of a {@link ChangeEvent}: the
 * relay envelope and the raw payload text of a source notification.
 *
 * <p>The envelope is {@code {"channel": <string>, "payload": <any>}}. Extra
 * fields are ignored on decode so the format can grow additively. A missing
 * or null payload decodes to a JSON null node.
 *
 * <p>Uses Jackson's tree model ({@link JsonNode}) so the payload stays an
 * opaque structure and survives the round trip unchanged.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RelayEnvelopeCodec {

  /** The envelope field holding the channel name. */
  static final String CHANNEL_FIELD = "channel";

  /** The envelope field holding the payload. */
  static final String PAYLOAD_FIELD = "payload";

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

  /** Private constructor to prevent instantiation. */
  private RelayEnvelopeCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a {@link ChangeEvent} into its relay envelope.
   *
   * @param event the event to serialize, never null.
   * @return the JSON envelope, never null.
   */
  public static String encode(final ChangeEvent event) {
    Objects.requireNonNull(event, "event must not be null");

    final ObjectNode node = MAPPER.createObjectNode();
    node.put(CHANNEL_FIELD, event.channel());
    node.set(PAYLOAD_FIELD, event.payload());

    return node.toString();
  }

  /**
   * Deserializes a relay envelope into a {@link ChangeEvent}.
   *
   * @param json the JSON envelope, never null.
   * @return the decoded event, never null.
   * @throws EnvelopeDecodeException if the text is not a JSON object or has
   *     no textual, non-empty channel.
   */
  public static ChangeEvent decode(final String json) {
    Objects.requireNonNull(json, "json must not be null");

    final JsonNode node = readTree(json);
    if (!node.isObject()) {
      throw new EnvelopeDecodeException(
          "Relay envelope is not a JSON object: " + abbreviate(json));
    }

    final JsonNode channel = node.get(CHANNEL_FIELD);
    if (channel == null || !channel.isTextual()
        || channel.asText().isEmpty()) {
      throw new EnvelopeDecodeException(
          "Relay envelope has no channel: " + abbreviate(json));
    }

    final JsonNode payload = node.get(PAYLOAD_FIELD);
    return new ChangeEvent(channel.asText(),
        payload == null ? NullNode.getInstance() : payload);
  }

  /**
   * Parses the raw text of a source notification payload.
   *
   * @param raw the payload text, never null.
   * @return the JSON tree, never null.
   * @throws EnvelopeDecodeException if the text is blank or not valid JSON.
   */
  public static JsonNode parsePayload(final String raw) {
    Objects.requireNonNull(raw, "raw must not be null");
    if (raw.isBlank()) {
      throw new EnvelopeDecodeException("Payload is blank");
    }
    return readTree(raw.strip());
  }

  /** Reads a JSON tree, translating Jackson failures.
   *
   * @param json the JSON text, never null.
   * @return the parsed tree, never null.
   * @throws EnvelopeDecodeException if the text is not valid JSON.
   */
  private static JsonNode readTree(final String json) {
    try {
      final JsonNode node = MAPPER.readTree(json);
      if (node == null || node.isMissingNode()) {
        throw new EnvelopeDecodeException("No JSON content");
      }
      return node;
    } catch (final JsonProcessingException e) {
      throw new EnvelopeDecodeException(
          "Malformed JSON: " + e.getOriginalMessage(), e);
    }
  }

  /** Shortens a message for logging.
   *
   * @param text the text, never null.
   * @return at most the first 100 characters of text, never null.
   */
  private static String abbreviate(final String text) {
    return text.length() <= 100 ? text : text.substring(0, 100) + "...";
  }
}
