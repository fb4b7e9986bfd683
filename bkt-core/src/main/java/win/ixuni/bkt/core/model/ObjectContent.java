package win.ixuni.bkt.core.model;

import lombok.Builder;
import lombok.Data;
import reactor.core.publisher.Flux;

import java.nio.ByteBuffer;

/**
 * 对象数据（包含元数据和内容流）
 */
@Data
@Builder
public class ObjectContent {

    private ObjectInfo info;

    /**
     * Object content stream, read lazily on subscription
     */
    private Flux<ByteBuffer> content;
}
