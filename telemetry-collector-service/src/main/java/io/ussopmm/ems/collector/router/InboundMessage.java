package io.ussopmm.ems.collector.router;

/**
 * A device message as delivered by the transport bridge.
 *
 * @param topic   MQTT topic the device published to, e.g. {@code ems/hvac}
 * @param payload raw JSON payload
 */
public record InboundMessage(String topic, String payload) {
}
