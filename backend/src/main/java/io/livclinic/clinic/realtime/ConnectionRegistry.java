package io.livclinic.clinic.realtime;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Membership set of live connections. A single monitor guards set mutation and snapshotting; it is
 * never held while talking to a client. The {@code inLock} hooks let the hub pair a history update
 * or read with the membership change in one critical section.
 */
public final class ConnectionRegistry {

  private final Object lock = new Object();
  private final Set<LiveConnection> connections = new LinkedHashSet<>();

  /**
   * Adds {@code connection} and evaluates {@code inLock} in the same critical section.
   *
   * @return the value computed by {@code inLock}
   */
  public <T> T register(LiveConnection connection, Supplier<T> inLock) {
    synchronized (lock) {
      connections.add(connection);
      return inLock.get();
    }
  }

  /** Removes {@code connection}; returns false when it was not registered. */
  public boolean remove(LiveConnection connection) {
    synchronized (lock) {
      return connections.remove(connection);
    }
  }

  /** Runs {@code inLock}, then copies the current membership, both under the monitor. */
  public List<LiveConnection> snapshot(Runnable inLock) {
    synchronized (lock) {
      inLock.run();
      return List.copyOf(connections);
    }
  }

  public List<LiveConnection> snapshot() {
    return snapshot(() -> {});
  }

  public boolean contains(LiveConnection connection) {
    synchronized (lock) {
      return connections.contains(connection);
    }
  }

  public int size() {
    synchronized (lock) {
      return connections.size();
    }
  }
}
