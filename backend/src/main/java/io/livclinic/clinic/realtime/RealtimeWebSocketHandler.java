package io.livclinic.clinic.realtime;

import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Broadcast-only WebSocket endpoint. Each session is registered with the {@link EventBus} on
 * handshake and removed on close or transport error. Inbound frames only serve to detect closure:
 * their content is discarded, and a frame that cannot be handled is ignored instead of closing the
 * session.
 *
 * <p>Partial messages are accepted so the container hands over oversized frames in fragments
 * rather than closing the session with 1009.
 */
@Component
public class RealtimeWebSocketHandler extends TextWebSocketHandler {

  static final String CONNECTION_ATTRIBUTE = "clinic.liveConnection";

  private static final Logger log = LoggerFactory.getLogger(RealtimeWebSocketHandler.class);

  private final EventBus eventBus;
  private final Executor fanoutExecutor;
  private final RealtimeProperties properties;

  public RealtimeWebSocketHandler(
      EventBus eventBus,
      @Qualifier(RealtimeFanoutConfig.FANOUT_EXECUTOR) Executor fanoutExecutor,
      RealtimeProperties properties) {
    this.eventBus = eventBus;
    this.fanoutExecutor = fanoutExecutor;
    this.properties = properties;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    var decorated =
        new ConcurrentWebSocketSessionDecorator(
            session,
            (int) properties.sendTimeLimit().toMillis(),
            (int) properties.sendBufferSizeLimit().toBytes());
    var connection =
        new WebSocketLiveConnection(
            decorated, fanoutExecutor, properties.outboundQueueCapacity());
    session.getAttributes().put(CONNECTION_ATTRIBUTE, connection);
    eventBus.connect(connection);
  }

  @Override
  public boolean supportsPartialMessages() {
    return true;
  }

  @Override
  public void handleMessage(WebSocketSession session, WebSocketMessage<?> message) {
    try {
      super.handleMessage(session, message);
    } catch (Exception e) {
      log.debug("Ignoring unreadable frame on session {}: {}", session.getId(), e.getMessage());
    }
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    log.trace(
        "Discarding {} byte client frame on session {} (last={})",
        message.getPayloadLength(),
        session.getId(),
        message.isLast());
  }

  @Override
  protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
    log.trace(
        "Discarding {} byte binary frame on session {}",
        message.getPayloadLength(),
        session.getId());
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.debug("Transport error on session {}: {}", session.getId(), exception.getMessage());
    release(session);
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    log.debug("Session {} closed with {}", session.getId(), status);
    release(session);
  }

  private void release(WebSocketSession session) {
    if (session.getAttributes().get(CONNECTION_ATTRIBUTE) instanceof LiveConnection connection) {
      eventBus.disconnect(connection);
    }
  }
}
