package io.livclinic.clinic.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.livclinic.clinic.activity.ActivityEvent;
import io.livclinic.clinic.activity.ActivityJournal;
import io.livclinic.clinic.activity.EntityKind;
import io.livclinic.clinic.activity.EventAction;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.util.unit.DataSize;

class EventBusTest {

  private static final Instant BASE = Instant.parse("2026-03-01T09:00:00Z");

  private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();

  private ActivityJournal journal;
  private EventBus eventBus;
  private final AtomicInteger sequence = new AtomicInteger();

  @BeforeEach
  void setUp() {
    journal = mock(ActivityJournal.class);
    eventBus = new EventBus(journal, objectMapper, properties(50));
  }

  @Test
  void connect_replaysHistoryOldestFirstInOneSyncEnvelope() throws Exception {
    for (int i = 1; i <= 5; i++) {
      eventBus.publish(event("e" + i));
    }
    var connection = new RecordingConnection();

    eventBus.connect(connection);

    assertThat(connection.written).hasSize(1);
    JsonNode envelope = objectMapper.readTree(connection.written.get(0));
    assertThat(envelope.get("type").asText()).isEqualTo("activity.sync");
    assertThat(ids(envelope.get("items"))).containsExactly("e1", "e2", "e3", "e4", "e5");
    assertThat(connection.getState()).isEqualTo(ConnectionState.OPEN);
  }

  @Test
  void connect_withNoHistory_sendsEmptySync() throws Exception {
    var connection = new RecordingConnection();

    eventBus.connect(connection);

    JsonNode envelope = objectMapper.readTree(connection.written.get(0));
    assertThat(envelope.get("items")).isEmpty();
    assertThat(eventBus.isConnected(connection)).isTrue();
  }

  @Test
  void connect_whenReplayCannotBeDelivered_leavesConnectionUnregistered() {
    var connection = new RecordingConnection();
    connection.failWrites = true;

    eventBus.connect(connection);

    assertThat(eventBus.isConnected(connection)).isFalse();
    assertThat(connection.getState()).isEqualTo(ConnectionState.CLOSED);
  }

  @Test
  void publish_sendsEventPayloadToEveryConnection() throws Exception {
    var first = new RecordingConnection();
    var second = new RecordingConnection();
    eventBus.connect(first);
    eventBus.connect(second);

    eventBus.publish(event("e1"));

    for (var connection : List.of(first, second)) {
      assertThat(connection.written).hasSize(2);
      JsonNode payload = objectMapper.readTree(connection.written.get(1));
      assertThat(payload.get("id").asText()).isEqualTo("e1");
      assertThat(payload.get("type").asText()).isEqualTo("procedure.updated");
      assertThat(payload.get("entity").asText()).isEqualTo("procedure");
      assertThat(payload.get("action").asText()).isEqualTo("updated");
      assertThat(payload.get("actor").asText()).isEqualTo("alice");
      assertThat(payload.get("timestamp").asText()).endsWith("Z");
    }
  }

  @Test
  void publish_appendsToJournal() {
    var event = event("e1");

    eventBus.publish(event);

    verify(journal).append(event);
  }

  @Test
  void publish_whenJournalFails_stillBroadcasts() {
    doThrow(new IllegalStateException("database unavailable")).when(journal).append(any());
    var connection = new RecordingConnection();
    eventBus.connect(connection);

    eventBus.publish(event("e1"));

    assertThat(connection.written).hasSize(2);
    assertThat(eventBus.recentHistory()).extracting(ActivityEvent::id).containsExactly("e1");
  }

  @Test
  void publish_evictsFailingConnectionAndKeepsOthers() {
    var healthy = new RecordingConnection();
    var broken = new RecordingConnection();
    eventBus.connect(healthy);
    eventBus.connect(broken);
    broken.failWrites = true;

    eventBus.publish(event("e1"));
    eventBus.publish(event("e2"));

    assertThat(eventBus.isConnected(broken)).isFalse();
    assertThat(broken.getState()).isEqualTo(ConnectionState.CLOSED);
    assertThat(healthy.written).hasSize(3);
    assertThat(eventBus.connectionCount()).isEqualTo(1);
  }

  @Test
  void publish_stalledConnectionDoesNotHoldUpOthersAndIsEvictedWhenItsQueueFills() {
    List<RecordingConnection> healthy = new ArrayList<>();
    for (int i = 0; i < 99; i++) {
      var connection = new RecordingConnection();
      healthy.add(connection);
      eventBus.connect(connection);
    }
    var stalled = new RecordingConnection(new ParkedExecutor(), 4);
    eventBus.connect(stalled);

    for (int i = 1; i <= 10; i++) {
      eventBus.publish(event("e" + i));
    }

    assertThat(healthy).allSatisfy(connection -> assertThat(connection.written).hasSize(11));
    assertThat(eventBus.isConnected(stalled)).isFalse();
    assertThat(stalled.written).isEmpty();
    assertThat(eventBus.connectionCount()).isEqualTo(99);
  }

  @Test
  void publish_unserializableEvent_isRejectedBeforeAnySideEffect() {
    var data = Map.<String, Object>of("bad", new Object());
    var event =
        new ActivityEvent(
            "bad", EntityKind.PATIENT, EventAction.CREATED, "p1", "x", data, "alice", BASE);

    assertThatThrownBy(() -> eventBus.publish(event)).isInstanceOf(IllegalArgumentException.class);
    assertThat(eventBus.recentHistory()).isEmpty();
  }

  @Test
  void history_keepsOnlyConfiguredNumberOfEvents() {
    eventBus = new EventBus(journal, objectMapper, properties(3));

    for (int i = 1; i <= 5; i++) {
      eventBus.publish(event("e" + i));
    }

    assertThat(eventBus.recentHistory())
        .extracting(ActivityEvent::id)
        .containsExactly("e3", "e4", "e5");
  }

  @Test
  void disconnect_isIdempotentAndSafeForUnknownConnections() {
    var connection = new RecordingConnection();
    eventBus.connect(connection);

    eventBus.disconnect(connection);
    eventBus.disconnect(connection);
    eventBus.disconnect(new RecordingConnection());

    assertThat(eventBus.connectionCount()).isZero();
    assertThat(connection.transportCloses).hasValue(1);
  }

  @Test
  void concurrentConnectAndPublish_deliversEachEventExactlyOncePerConnection() throws Exception {
    int publishers = 4;
    int eventsPerPublisher = 10;
    int connectors = 20;
    ExecutorService pool = Executors.newFixedThreadPool(publishers + connectors);
    var start = new CountDownLatch(1);
    List<RecordingConnection> connections = new ArrayList<>();
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int p = 0; p < publishers; p++) {
        int publisher = p;
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < eventsPerPublisher; i++) {
                    eventBus.publish(event("p" + publisher + "-" + i));
                  }
                  return null;
                }));
      }
      for (int c = 0; c < connectors; c++) {
        var connection = new RecordingConnection();
        connections.add(connection);
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  eventBus.connect(connection);
                  return null;
                }));
      }
      start.countDown();
      for (var future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    int total = publishers * eventsPerPublisher;
    for (var connection : connections) {
      List<String> received = new ArrayList<>();
      JsonNode envelope = objectMapper.readTree(connection.written.get(0));
      assertThat(envelope.get("type").asText()).isEqualTo("activity.sync");
      received.addAll(ids(envelope.get("items")));
      for (String payload : connection.written.subList(1, connection.written.size())) {
        received.add(objectMapper.readTree(payload).get("id").asText());
      }
      Set<String> unique = new HashSet<>(received);
      assertThat(received).hasSize(total);
      assertThat(unique).hasSize(total);
    }
  }

  private static List<String> ids(JsonNode items) {
    List<String> ids = new ArrayList<>();
    items.forEach(item -> ids.add(item.get("id").asText()));
    return ids;
  }

  private ActivityEvent event(String id) {
    return new ActivityEvent(
        id,
        EntityKind.PROCEDURE,
        EventAction.UPDATED,
        "proc-1",
        "Updated notes",
        Map.of("notes", List.of()),
        "alice",
        BASE.plusSeconds(sequence.getAndIncrement()));
  }

  private static RealtimeProperties properties(int historySize) {
    return new RealtimeProperties(
        historySize, 256, 2, Duration.ofSeconds(5), DataSize.ofKilobytes(512), List.of("*"));
  }
}
