package tenantdb.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static tenantdb.event.LifecycleEvent.payload;

class EventPublisherTest {

  private final EventPublisher publisher = new EventPublisher("TestSource");

  @Test
  void deliversToTypedAndWildcardListeners() {
    List<String> typed = new ArrayList<>();
    List<String> all = new ArrayList<>();
    publisher.addListener("initialized", event -> typed.add(event.type()));
    publisher.addListener(EventSource.ALL_EVENTS, event -> all.add(event.type()));

    publisher.publish("initialized");
    publisher.publish("shutdown-completed");

    assertEquals(List.of("initialized"), typed);
    assertEquals(List.of("initialized", "shutdown-completed"), all);
  }

  @Test
  void eventCarriesSourceAndAttributes() {
    List<LifecycleEvent> received = new ArrayList<>();
    publisher.addListener("app-registered", received::add);

    publisher.publish("app-registered", payload("appName", "billing", "shared", true));

    LifecycleEvent event = received.get(0);
    assertEquals("TestSource", event.source());
    assertEquals("billing", event.attribute("appName"));
    assertEquals(true, event.attribute("shared"));
    assertNotNull(event.timestamp());
  }

  @Test
  void failingListenerDoesNotStopDelivery() {
    List<String> received = new ArrayList<>();
    publisher.addListener("x", event -> {
      throw new IllegalStateException("listener bug");
    });
    publisher.addListener("x", event -> received.add("second"));

    publisher.publish("x");

    assertEquals(List.of("second"), received);
  }

  @Test
  void removedListenerStopsReceiving() {
    List<String> received = new ArrayList<>();
    LifecycleListener listener = event -> received.add(event.type());
    publisher.addListener("x", listener);
    publisher.addListener(EventSource.ALL_EVENTS, listener);

    publisher.removeListener(listener);
    publisher.publish("x");

    assertTrue(received.isEmpty());
  }

  @Test
  void errorAndWarningNotificationsCarryPhaseAndMessage() {
    List<LifecycleEvent> received = new ArrayList<>();
    publisher.addListener("error", received::add);
    publisher.addListener("warning", received::add);

    publisher.error("initialize", new IllegalStateException("boom"), Map.of("connectionName", "t1"));
    publisher.warning("use-connection", "fell back", null);

    assertEquals("initialize", received.get(0).attribute("phase"));
    assertEquals("boom", received.get(0).attribute("message"));
    assertEquals("t1", received.get(0).attribute("connectionName"));
    assertNotNull(received.get(0).attribute("timestamp"));
    assertEquals("fell back", received.get(1).attribute("message"));
  }

  @Test
  void payloadKeepsOrderAndAllowsNulls() {
    Map<String, Object> map = payload("b", 1, "a", null);

    assertEquals(List.of("b", "a"), new ArrayList<>(map.keySet()));
    assertNull(map.get("a"));
    assertThrows(IllegalArgumentException.class, () -> payload("odd"));
  }
}
