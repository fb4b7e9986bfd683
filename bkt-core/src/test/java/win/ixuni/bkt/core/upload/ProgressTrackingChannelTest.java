package win.ixuni.bkt.core.upload;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Flux;
import win.ixuni.bkt.core.util.ChannelFluxes;

import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 进度跟踪通道测试
 */
public class ProgressTrackingChannelTest {

    @TempDir
    Path tempDir;

    /**
     * Clock that advances by a fixed step on every read
     */
    private static final class SteppingClock extends Clock {
        private long millis;
        private final long step;

        SteppingClock(long step) {
            this.step = step;
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis());
        }

        @Override
        public long millis() {
            millis += step;
            return millis;
        }
    }

    private Path file(int size) throws Exception {
        Path path = tempDir.resolve("data.bin");
        byte[] data = new byte[size];
        for (int i = 0; i < size; i++) {
            data[i] = (byte) i;
        }
        Files.write(path, data);
        return path;
    }

    @Test
    @DisplayName("Counts every byte and reports monotonically")
    void testCountsBytes() throws Exception {
        Path path = file(10_000);
        List<Long> reports = new CopyOnWriteArrayList<>();

        try (ProgressTrackingChannel channel = new ProgressTrackingChannel(
                FileChannel.open(path, StandardOpenOption.READ), reports::add,
                Duration.ofMillis(500), new SteppingClock(200))) {
            ByteBuffer buffer = ByteBuffer.allocate(1000);
            while (channel.read(buffer) > 0) {
                buffer.clear();
            }
            channel.flush();
            assertEquals(10_000, channel.getBytesRead());
        }

        assertFalse(reports.isEmpty());
        assertEquals(10_000L, reports.get(reports.size() - 1));
        for (int i = 1; i < reports.size(); i++) {
            assertTrue(reports.get(i) >= reports.get(i - 1), "progress went backwards: " + reports);
        }
    }

    @Test
    @DisplayName("上报频率受间隔限制")
    void testThrottled() throws Exception {
        Path path = file(10_000);
        List<Long> reports = new CopyOnWriteArrayList<>();

        // clock advances 100ms per read, interval 500ms: at most one report per five reads
        try (ProgressTrackingChannel channel = new ProgressTrackingChannel(
                FileChannel.open(path, StandardOpenOption.READ), reports::add,
                Duration.ofMillis(500), new SteppingClock(100))) {
            ByteBuffer buffer = ByteBuffer.allocate(100);
            int reads = 0;
            while (channel.read(buffer) > 0) {
                buffer.clear();
                reads++;
            }
            assertEquals(100, reads);
        }

        assertTrue(reports.size() <= 20, "too many reports: " + reports.size());
        assertTrue(reports.size() >= 10, "too few reports: " + reports.size());
    }

    @Test
    @DisplayName("Seek resets the count to the new offset")
    void testSeekResetsCount() throws Exception {
        Path path = file(4096);
        List<Long> reports = new CopyOnWriteArrayList<>();

        try (ProgressTrackingChannel channel = new ProgressTrackingChannel(
                FileChannel.open(path, StandardOpenOption.READ), reports::add)) {
            channel.read(ByteBuffer.allocate(3000));
            assertEquals(3000, channel.getBytesRead());

            channel.position(0);
            assertEquals(0, channel.getBytesRead());

            channel.position(1024);
            assertEquals(1024, channel.getBytesRead());
            channel.read(ByteBuffer.allocate(100));
            assertEquals(1124, channel.getBytesRead());
        }
    }

    @Test
    @DisplayName("Re-subscribing the channel flux reads from the start again")
    void testResubscribeRestarts() throws Exception {
        Path path = file(5000);

        try (ProgressTrackingChannel channel = new ProgressTrackingChannel(
                FileChannel.open(path, StandardOpenOption.READ), bytes -> {
                })) {
            Flux<ByteBuffer> flux = ChannelFluxes.readFromStart(channel, 1024);

            Long first = flux.map(buffer -> (long) buffer.remaining()).reduce(0L, Long::sum).block();
            assertEquals(5000L, first);
            assertEquals(5000, channel.getBytesRead());

            Long second = flux.map(buffer -> (long) buffer.remaining()).reduce(0L, Long::sum).block();
            assertEquals(5000L, second);
            assertEquals(5000, channel.getBytesRead());
        }
    }

    @Test
    void testReadOnly() throws Exception {
        Path path = file(10);
        try (ProgressTrackingChannel channel = new ProgressTrackingChannel(
                FileChannel.open(path, StandardOpenOption.READ), bytes -> {
                })) {
            assertThrows(java.nio.channels.NonWritableChannelException.class,
                    () -> channel.write(ByteBuffer.allocate(1)));
        }
    }
}
