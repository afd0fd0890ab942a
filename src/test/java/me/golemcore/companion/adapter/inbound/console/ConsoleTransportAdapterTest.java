package me.golemcore.companion.adapter.inbound.console;

import me.golemcore.companion.domain.model.InboundMessage;
import me.golemcore.companion.infrastructure.config.CompanionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleTransportAdapterTest {

    private static final Instant FIXED_TIME = Instant.parse("2026-01-01T12:00:00Z");
    private static final long READ_TIMEOUT_MS = 5000;

    private CompanionProperties properties;
    private ByteArrayOutputStream output;

    @BeforeEach
    void setUp() {
        properties = new CompanionProperties();
        output = new ByteArrayOutputStream();
    }

    private ConsoleTransportAdapter adapter(String input) {
        return new ConsoleTransportAdapter(properties, Clock.fixed(FIXED_TIME, ZoneOffset.UTC),
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private static void awaitReaderDone(ConsoleTransportAdapter adapter) throws InterruptedException {
        long deadline = System.currentTimeMillis() + READ_TIMEOUT_MS;
        while (adapter.isRunning() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(adapter.isRunning());
    }

    @Test
    void readsTrimmedNonBlankLinesAsMessages() throws Exception {
        ConsoleTransportAdapter adapter = adapter("  hello  \n\n   \nhow are you?\n");

        adapter.start();
        awaitReaderDone(adapter);

        List<InboundMessage> messages = adapter.receiveNewMessages(10);
        assertEquals(List.of(
                new InboundMessage("console", "hello", FIXED_TIME),
                new InboundMessage("console", "how are you?", FIXED_TIME)), messages);
        assertFalse(adapter.isStopRequested());
    }

    @Test
    void receiveNewMessages_respectsBatchSize() throws Exception {
        ConsoleTransportAdapter adapter = adapter("one\ntwo\nthree\n");
        adapter.start();
        awaitReaderDone(adapter);

        assertEquals(2, adapter.receiveNewMessages(2).size());
        assertEquals(1, adapter.receiveNewMessages(2).size());
        assertTrue(adapter.receiveNewMessages(2).isEmpty());
    }

    @Test
    void shutdownKeywordRequestsStop() throws Exception {
        ConsoleTransportAdapter adapter = adapter("hello\nQuit\nignored\n");

        adapter.start();
        awaitReaderDone(adapter);

        assertTrue(adapter.isStopRequested());
        assertEquals(1, adapter.receiveNewMessages(10).size());
    }

    @Test
    void disabledTransportDoesNotRead() {
        properties.getTransport().getConsole().setEnabled(false);
        ConsoleTransportAdapter adapter = adapter("hello\n");

        adapter.start();

        assertFalse(adapter.isRunning());
        assertTrue(adapter.receiveNewMessages(10).isEmpty());
    }

    @Test
    void send_printsLine() {
        ConsoleTransportAdapter adapter = adapter("");

        assertTrue(adapter.send("console", "Hello! I'm Lira."));

        assertEquals("Hello! I'm Lira." + System.lineSeparator(), output.toString(StandardCharsets.UTF_8));
    }
}
