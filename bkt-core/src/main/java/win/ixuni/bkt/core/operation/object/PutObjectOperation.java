package win.ixuni.bkt.core.operation.object;

import lombok.Builder;
import lombok.Value;
import reactor.core.publisher.Flux;
import win.ixuni.bkt.core.operation.Operation;

import java.nio.ByteBuffer;

/**
 * Put object operation
 * <p>
 * The content is streamed; backends never hold the whole object in memory.
 */
@Value
@Builder
public class PutObjectOperation implements Operation<Void> {

    String bucketName;

    String key;

    /**
     * 对象内容流
     */
    Flux<ByteBuffer> content;

    /**
     * Declared size in bytes, -1 when unknown
     */
    long size;

    String contentType;
}
