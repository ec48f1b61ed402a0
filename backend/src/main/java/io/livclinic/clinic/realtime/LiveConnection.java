package io.livclinic.clinic.realtime;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * A client connection receiving broadcast activity. Owned by the {@link ConnectionRegistry} while
 * registered. Implementations must never block the caller of {@link #send(String)} on network I/O.
 */
public interface LiveConnection {

  String getId();

  ConnectionState getState();

  /**
   * Queues a payload for delivery. Payloads queued while {@link ConnectionState#CONNECTING} are
   * held until {@link #open(String)}.
   *
   * @throws IOException if the connection is closing or cannot accept more payloads
   */
  void send(String payload) throws IOException;

  /**
   * Moves the connection to {@link ConnectionState#OPEN}, delivering {@code replayPayload} ahead of
   * anything queued while connecting.
   */
  void open(String replayPayload);

  /** Stops accepting payloads and discards anything not yet written. */
  void beginClosing();

  /** Closes the underlying transport; ends in {@link ConnectionState#CLOSED}. Idempotent. */
  void close();

  /** Registers the callback invoked when an asynchronous write fails. */
  void onFailure(Consumer<LiveConnection> listener);
}
