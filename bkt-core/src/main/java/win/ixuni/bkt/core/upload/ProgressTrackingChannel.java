package win.ixuni.bkt.core.upload;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.SeekableByteChannel;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 进度跟踪读通道
 * <p>
 * Counts the bytes read through a delegate channel and reports the running total to a
 * {@link ProgressListener}, at most once per report interval. Repositioning sets the count to
 * the new offset, so a retrying reader that seeks back to zero restarts the count. The counter
 * is guarded by a lock; the listener is always called outside of it.
 * <p>
 * Read-only: writes throw {@link NonWritableChannelException}.
 */
public class ProgressTrackingChannel implements SeekableByteChannel {

    public static final Duration DEFAULT_REPORT_INTERVAL = Duration.ofMillis(500);

    private final SeekableByteChannel delegate;
    private final ProgressListener listener;
    private final Duration reportInterval;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private long bytesRead;
    private long lastReportMillis;

    public ProgressTrackingChannel(SeekableByteChannel delegate, ProgressListener listener) {
        this(delegate, listener, DEFAULT_REPORT_INTERVAL, Clock.systemUTC());
    }

    public ProgressTrackingChannel(SeekableByteChannel delegate, ProgressListener listener,
                                   Duration reportInterval, Clock clock) {
        this.delegate = delegate;
        this.listener = listener;
        this.reportInterval = reportInterval;
        this.clock = clock;
        this.lastReportMillis = clock.millis();
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        int n = delegate.read(dst);
        if (n <= 0) {
            return n;
        }

        long snapshot = -1;
        lock.lock();
        try {
            bytesRead += n;
            long now = clock.millis();
            if (now - lastReportMillis >= reportInterval.toMillis()) {
                lastReportMillis = now;
                snapshot = bytesRead;
            }
        } finally {
            lock.unlock();
        }

        if (snapshot >= 0) {
            listener.onProgress(snapshot);
        }
        return n;
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        delegate.position(newPosition);
        lock.lock();
        try {
            bytesRead = newPosition;
        } finally {
            lock.unlock();
        }
        return this;
    }

    /**
     * Bytes counted so far
     */
    public long getBytesRead() {
        lock.lock();
        try {
            return bytesRead;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Report the current count regardless of the interval
     */
    public void flush() {
        listener.onProgress(getBytesRead());
    }

    @Override
    public int write(ByteBuffer src) {
        throw new NonWritableChannelException();
    }

    @Override
    public long position() throws IOException {
        return delegate.position();
    }

    @Override
    public long size() throws IOException {
        return delegate.size();
    }

    @Override
    public SeekableByteChannel truncate(long size) {
        throw new NonWritableChannelException();
    }

    @Override
    public boolean isOpen() {
        return delegate.isOpen();
    }

    @Override
    public void close() throws IOException {
        delegate.close();
    }
}
