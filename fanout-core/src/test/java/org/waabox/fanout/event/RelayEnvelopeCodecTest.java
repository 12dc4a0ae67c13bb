package org.waabox.fanout.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.Test;

/** Tests for {@link RelayEnvelopeCodec}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RelayEnvelopeCodecTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void whenEncoding_givenObjectPayload_shouldProduceChannelAndPayload()
      throws Exception {
    final ObjectNode payload = mapper.createObjectNode();
    payload.put("match_id", 42);
    payload.put("home", 2);

    final String json = RelayEnvelopeCodec.encode(
        new ChangeEvent("matchdata_change", payload));

    final JsonNode tree = mapper.readTree(json);
    assertEquals("matchdata_change", tree.get("channel").asText());
    assertEquals(42, tree.get("payload").get("match_id").asInt());
  }

  @Test
  void whenDecoding_givenEncodedEvent_shouldRestoreChannelAndPayload() {
    final ObjectNode payload = mapper.createObjectNode();
    payload.putArray("ids").add(1).add(2);

    final ChangeEvent event = RelayEnvelopeCodec.decode(
        RelayEnvelopeCodec.encode(new ChangeEvent("match_change", payload)));

    assertEquals("match_change", event.channel());
    assertEquals(payload, event.payload());
  }

  @Test
  void whenDecoding_givenMissingPayload_shouldUseNullNode() {
    final ChangeEvent event = RelayEnvelopeCodec.decode(
        "{\"channel\":\"match_change\"}");

    assertTrue(event.payload().isNull());
  }

  @Test
  void whenDecoding_givenMalformedJson_shouldThrowDecodeException() {
    assertThrows(EnvelopeDecodeException.class,
        () -> RelayEnvelopeCodec.decode("{\"channel\":"));
  }

  @Test
  void whenDecoding_givenTrailingGarbage_shouldThrowDecodeException() {
    assertThrows(EnvelopeDecodeException.class,
        () -> RelayEnvelopeCodec.decode(
            "{\"channel\":\"a\",\"payload\":1} extra"));
  }

  @Test
  void whenDecoding_givenNonObject_shouldThrowDecodeException() {
    assertThrows(EnvelopeDecodeException.class,
        () -> RelayEnvelopeCodec.decode("[1,2]"));
  }

  @Test
  void whenDecoding_givenMissingOrEmptyChannel_shouldThrowDecodeException() {
    assertThrows(EnvelopeDecodeException.class,
        () -> RelayEnvelopeCodec.decode("{\"payload\":{}}"));
    assertThrows(EnvelopeDecodeException.class,
        () -> RelayEnvelopeCodec.decode("{\"channel\":\"\"}"));
    assertThrows(EnvelopeDecodeException.class,
        () -> RelayEnvelopeCodec.decode("{\"channel\":5}"));
  }

  @Test
  void whenParsingPayload_givenScalar_shouldAcceptIt() {
    assertEquals(7, RelayEnvelopeCodec.parsePayload(" 7 ").asInt());
  }

  @Test
  void whenParsingPayload_givenBlank_shouldThrowDecodeException() {
    assertThrows(EnvelopeDecodeException.class,
        () -> RelayEnvelopeCodec.parsePayload("   "));
  }
}
