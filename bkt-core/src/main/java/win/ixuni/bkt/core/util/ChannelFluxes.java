package win.ixuni.bkt.core.util;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.util.concurrent.Callable;

/**
 * Channel 到 Flux 的转换
 */
@Slf4j
public final class ChannelFluxes {

    public static final int DEFAULT_BUFFER_SIZE = 64 * 1024;

    private ChannelFluxes() {
    }

    /**
     * Stream a channel the caller keeps ownership of.
     * <p>
     * Every subscription seeks back to offset 0 first, so a client that retries by
     * re-subscribing reads the content again from the start. The channel is not closed.
     */
    public static Flux<ByteBuffer> readFromStart(SeekableByteChannel channel, int bufferSize) {
        return Flux.defer(() -> {
            try {
                channel.position(0);
            } catch (IOException e) {
                return Flux.error(new UncheckedIOException(e));
            }
            return Flux.generate(sink -> {
                try {
                    ByteBuffer buffer = ByteBuffer.allocate(bufferSize);
                    int read = channel.read(buffer);
                    if (read < 0) {
                        sink.complete();
                    } else {
                        buffer.flip();
                        sink.next(buffer);
                    }
                } catch (IOException e) {
                    sink.error(new UncheckedIOException(e));
                }
            });
        });
    }

    /**
     * Open a channel per subscription, stream it and close it on termination or cancel
     */
    public static Flux<ByteBuffer> read(Callable<? extends SeekableByteChannel> opener, int bufferSize) {
        return Flux.using(opener, channel -> readFromStart(channel, bufferSize), channel -> {
            try {
                channel.close();
            } catch (IOException e) {
                log.warn("Failed to close channel: {}", e.getMessage());
            }
        });
    }
}
