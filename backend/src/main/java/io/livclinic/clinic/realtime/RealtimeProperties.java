package io.livclinic.clinic.realtime;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

/**
 * Configuration for the live update channel.
 *
 * @param historySize number of recent events replayed to a newly connected client
 * @param outboundQueueCapacity payloads a connection may have waiting before it is evicted
 * @param fanoutThreads threads writing queued payloads to clients
 * @param sendTimeLimit longest a single WebSocket write may block other sends to the same session
 * @param sendBufferSizeLimit bytes a WebSocket session may buffer while a write is in progress
 * @param allowedOrigins origin patterns accepted on the WebSocket handshake
 */
@ConfigurationProperties(prefix = "clinic.realtime")
public record RealtimeProperties(
    @DefaultValue("50") int historySize,
    @DefaultValue("256") int outboundQueueCapacity,
    @DefaultValue("8") int fanoutThreads,
    @DefaultValue("5s") Duration sendTimeLimit,
    @DefaultValue("512KB") DataSize sendBufferSizeLimit,
    @DefaultValue("*") List<String> allowedOrigins) {}
