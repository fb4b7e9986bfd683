package win.ixuni.bkt.server.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import org.reactivestreams.Publisher;
import org.springframework.core.ResolvableType;
import org.springframework.core.codec.AbstractEncoder;
import org.springframework.core.codec.EncodingException;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.lang.Nullable;
import org.springframework.util.MimeType;
import reactor.core.publisher.Flux;

import java.util.Map;

/**
 * S3 XML 响应编码器
 * <p>
 * Only encodes types annotated with {@link JacksonXmlRootElement}, so the JSON management API
 * keeps the default Jackson JSON codec whatever the client sends in {@code Accept}.
 */
public class S3XmlEncoder extends AbstractEncoder<Object> {

    private final XmlMapper mapper;

    public S3XmlEncoder(XmlMapper mapper, MimeType... mimeTypes) {
        super(mimeTypes);
        this.mapper = mapper;
    }

    @Override
    public boolean canEncode(ResolvableType elementType, @Nullable MimeType mimeType) {
        Class<?> type = elementType.toClass();
        return super.canEncode(elementType, mimeType)
                && type.isAnnotationPresent(JacksonXmlRootElement.class);
    }

    @Override
    public Flux<DataBuffer> encode(Publisher<?> inputStream, DataBufferFactory bufferFactory,
                                   ResolvableType elementType, @Nullable MimeType mimeType,
                                   @Nullable Map<String, Object> hints) {
        return Flux.from(inputStream)
                .map(value -> encodeValue(value, bufferFactory, elementType, mimeType, hints));
    }

    @Override
    public DataBuffer encodeValue(Object value, DataBufferFactory bufferFactory,
                                  ResolvableType valueType, @Nullable MimeType mimeType,
                                  @Nullable Map<String, Object> hints) {
        try {
            byte[] bytes = mapper.writeValueAsBytes(value);
            DataBuffer buffer = bufferFactory.allocateBuffer(bytes.length);
            buffer.write(bytes);
            return buffer;
        } catch (JsonProcessingException e) {
            throw new EncodingException("XML encoding error: " + e.getOriginalMessage(), e);
        }
    }
}
