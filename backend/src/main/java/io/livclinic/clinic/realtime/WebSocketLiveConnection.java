package io.livclinic.clinic.realtime;

import java.io.IOException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/** {@link LiveConnection} backed by a Spring WebSocket session. */
public class WebSocketLiveConnection extends QueuedLiveConnection {

  private static final Logger log = LoggerFactory.getLogger(WebSocketLiveConnection.class);

  private final WebSocketSession session;

  public WebSocketLiveConnection(WebSocketSession session, Executor executor, int capacity) {
    super(executor, capacity);
    this.session = session;
  }

  @Override
  protected void write(String payload) throws IOException {
    session.sendMessage(new TextMessage(payload));
  }

  @Override
  protected void closeTransport() {
    if (!session.isOpen()) {
      return;
    }
    try {
      session.close(CloseStatus.GOING_AWAY);
    } catch (IOException e) {
      log.debug("Error closing WebSocket session {}: {}", session.getId(), e.getMessage());
    }
  }

  public String getSessionId() {
    return session.getId();
  }
}
