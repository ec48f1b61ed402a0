package io.livclinic.clinic.realtime;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base {@link LiveConnection} with a bounded outbound queue drained serially on a shared executor.
 * {@link #send(String)} only enqueues, so a slow or stalled client costs its own queue and at most
 * one executor thread, never the publisher's time. Payload order per connection is preserved.
 *
 * <p>Subclasses implement the actual transport write in {@link #write(String)}, which is never
 * called concurrently for the same connection.
 */
public abstract class QueuedLiveConnection implements LiveConnection {

  private static final Logger log = LoggerFactory.getLogger(QueuedLiveConnection.class);

  private final String id;
  private final Executor executor;
  private final int capacity;
  private final Deque<String> outbound = new ArrayDeque<>();

  private ConnectionState state = ConnectionState.CONNECTING;
  private boolean draining;
  private volatile Consumer<LiveConnection> failureListener = connection -> {};

  protected QueuedLiveConnection(Executor executor, int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Outbound queue capacity must be at least 1");
    }
    this.id = UUID.randomUUID().toString();
    this.executor = executor;
    this.capacity = capacity;
  }

  /** Writes one payload to the client. */
  protected abstract void write(String payload) throws IOException;

  /** Closes the client transport. */
  protected abstract void closeTransport();

  @Override
  public String getId() {
    return id;
  }

  @Override
  public synchronized ConnectionState getState() {
    return state;
  }

  @Override
  public void send(String payload) throws IOException {
    synchronized (this) {
      if (state == ConnectionState.CLOSING || state == ConnectionState.CLOSED) {
        throw new IOException("Connection " + id + " is " + state);
      }
      if (outbound.size() >= capacity) {
        throw new IOException("Outbound queue full for connection " + id);
      }
      outbound.addLast(payload);
      if (state != ConnectionState.OPEN || draining) {
        return;
      }
      draining = true;
    }
    scheduleDrain();
  }

  @Override
  public void open(String replayPayload) {
    synchronized (this) {
      if (state != ConnectionState.CONNECTING) {
        return;
      }
      outbound.addFirst(replayPayload);
      state = ConnectionState.OPEN;
      draining = true;
    }
    scheduleDrain();
  }

  @Override
  public synchronized void beginClosing() {
    if (state == ConnectionState.CONNECTING || state == ConnectionState.OPEN) {
      state = ConnectionState.CLOSING;
    }
    outbound.clear();
  }

  @Override
  public void close() {
    synchronized (this) {
      if (state == ConnectionState.CLOSED) {
        return;
      }
      state = ConnectionState.CLOSED;
      outbound.clear();
    }
    closeTransport();
  }

  @Override
  public void onFailure(Consumer<LiveConnection> listener) {
    this.failureListener = listener;
  }

  /** Number of payloads waiting to be written. */
  public synchronized int pendingCount() {
    return outbound.size();
  }

  private void scheduleDrain() {
    try {
      executor.execute(this::drain);
    } catch (RejectedExecutionException e) {
      synchronized (this) {
        draining = false;
      }
      fail(e);
    }
  }

  private void drain() {
    while (true) {
      String next;
      synchronized (this) {
        next = state == ConnectionState.OPEN ? outbound.pollFirst() : null;
        if (next == null) {
          draining = false;
          return;
        }
      }
      try {
        write(next);
      } catch (IOException | RuntimeException e) {
        synchronized (this) {
          draining = false;
        }
        fail(e);
        return;
      }
    }
  }

  private void fail(Exception cause) {
    log.debug("Delivery to live connection {} failed: {}", id, cause.getMessage());
    beginClosing();
    failureListener.accept(this);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + id + "]";
  }
}
