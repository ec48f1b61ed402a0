package io.livclinic.clinic.realtime;

/**
 * Lifecycle of a live connection: {@code CONNECTING -> OPEN -> CLOSING -> CLOSED}. A connection
 * only ever moves forward; a reconnecting client gets a new connection.
 */
public enum ConnectionState {
  /** Registered with the hub, replay snapshot not yet queued. Live events are held back. */
  CONNECTING,
  /** Replay snapshot queued; live events flow. */
  OPEN,
  /** Read error, EOF, send failure or explicit close observed; no further sends accepted. */
  CLOSING,
  /** Removed from the registry and transport closed. */
  CLOSED
}
