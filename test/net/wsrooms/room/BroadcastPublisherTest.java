package net.wsrooms.room;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.wsrooms.api.Connection;
import net.wsrooms.api.MessageKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static net.wsrooms.room.TestSupport.WAIT;
import static net.wsrooms.room.TestSupport.awaitCondition;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(10)
public class BroadcastPublisherTest {

    private MemberRegistry members;
    private BroadcastPublisher publisher;
    private List<Connection> failed;

    @BeforeEach
    public void setUp() {
        members = new MemberRegistry();
        publisher = new BroadcastPublisher("pub", members,
            new TimedExecutor("pub-test"), 1000);
        failed = Collections.synchronizedList(new ArrayList<Connection>());
        publisher.setHook((conn, exc) -> {
            failed.add(conn);
            members.remove(conn);
        });
    }

    private TestConnection member(String name) {
        TestConnection c = new TestConnection(name);
        c.accept();
        members.add(c);
        return c;
    }

    @Test
    public void startAndStopAreIdempotent() throws Exception {
        assertFalse(publisher.isRunning());
        assertTrue(publisher.start());
        assertFalse(publisher.start());
        assertTrue(publisher.isRunning());
        assertTrue(publisher.stop());
        assertFalse(publisher.stop());
        assertFalse(publisher.isRunning());
        assertTrue(publisher.awaitStopped(WAIT));
    }

    @Test
    public void failuresDoNotStopDeliveryToTheRest() throws Exception {
        TestConnection a = member("a");
        TestConnection b = member("b");
        TestConnection c = member("c");
        b.setFailSends(true);
        publisher.start();

        publisher.submit(new Broadcast("one", MessageKind.TEXT));
        publisher.submit(new Broadcast("two", MessageKind.TEXT));

        assertEquals(2, a.awaitSent(2, WAIT).size());
        assertEquals(2, c.awaitSent(2, WAIT).size());
        assertEquals(List.of("one", "two"), a.getSentPayloads());
        assertEquals(List.of("one", "two"), c.getSentPayloads());
        assertEquals(List.of(b), failed);
        publisher.stop();
    }

    @Test
    public void latecomersOnlyGetLaterMessages() throws Exception {
        TestConnection early = member("early");
        publisher.start();
        publisher.submit(new Broadcast("before", MessageKind.TEXT));
        early.awaitSent(1, WAIT);

        TestConnection late = member("late");
        publisher.submit(new Broadcast("after", MessageKind.TEXT));

        assertEquals(2, early.awaitSent(2, WAIT).size());
        assertEquals(1, late.awaitSent(1, WAIT).size());
        assertEquals(List.of("after"), late.getSentPayloads());
        publisher.stop();
    }

    @Test
    public void backlogSurvivesARestart() throws Exception {
        publisher.start();
        publisher.stop();
        assertTrue(publisher.awaitStopped(WAIT));
        publisher.submit(new Broadcast("queued", MessageKind.TEXT));
        assertEquals(1, publisher.getBacklog());

        TestConnection c = member("c");
        publisher.start();

        assertEquals(1, c.awaitSent(1, WAIT).size());
        awaitCondition("empty outbox", () -> publisher.getBacklog() == 0);
        publisher.stop();
    }

    @Test
    public void broadcastsCheckTheirPayloadType() {
        assertThrows(IllegalArgumentException.class,
                     () -> new Broadcast(new byte[0], MessageKind.TEXT));
        assertThrows(IllegalArgumentException.class,
                     () -> new Broadcast("text", MessageKind.BYTES));
        assertThrows(NullPointerException.class,
                     () -> new Broadcast("text", null));
    }

}
