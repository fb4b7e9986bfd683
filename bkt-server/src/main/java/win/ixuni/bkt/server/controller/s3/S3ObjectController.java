package win.ixuni.bkt.server.controller.s3;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.BucketNotFoundException;
import win.ixuni.bkt.core.exception.GatewayException;
import win.ixuni.bkt.core.exception.ObjectNotFoundException;
import win.ixuni.bkt.core.model.ObjectInfo;
import win.ixuni.bkt.core.policy.Identity;
import win.ixuni.bkt.server.security.IdentityFilter;
import win.ixuni.bkt.server.service.ObjectService;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Object 操作控制器 (S3 XML)
 */
@Slf4j
@RestController
@RequestMapping("/s3")
@RequiredArgsConstructor
public class S3ObjectController {

    static final DateTimeFormatter HTTP_DATE_FORMATTER = DateTimeFormatter
            .ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US)
            .withZone(ZoneOffset.UTC);

    private final ObjectService objectService;

    /**
     * 上传对象
     * PUT /s3/{bucket}/{key}
     */
    @PutMapping("/{bucket}/{*key}")
    public Mono<ResponseEntity<Void>> putObject(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @PathVariable String bucket,
            @PathVariable String key,
            @RequestHeader HttpHeaders headers,
            @RequestBody(required = false) Flux<DataBuffer> body) {
        long size = headers.getContentLength();
        if (size < 0) {
            return Mono.error(new GatewayException("MissingContentLength",
                    "You must provide the Content-Length HTTP header.", 411));
        }
        return objectService.upload(identity, bucket, normalizeKey(key), toByteBuffers(body), size)
                .map(object -> ResponseEntity.ok()
                        .header(HttpHeaders.ETAG, quote(object.getEtag()))
                        .<Void>build());
    }

    /**
     * 获取对象
     */
    @GetMapping("/{bucket}/{*key}")
    public Mono<ResponseEntity<Flux<DataBuffer>>> getObject(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @PathVariable String bucket,
            @PathVariable String key) {
        return objectService.getObject(identity, bucket, normalizeKey(key))
                .map(object -> {
                    ObjectInfo info = object.getInfo();
                    Flux<DataBuffer> content = object.getContent()
                            .map(byteBuffer -> DefaultDataBufferFactory.sharedInstance.wrap(byteBuffer));
                    return ResponseEntity.ok()
                            .headers(infoHeaders(info))
                            .body(content);
                });
    }

    /**
     * 获取对象元数据
     */
    @RequestMapping(value = "/{bucket}/{*key}", method = RequestMethod.HEAD)
    public Mono<ResponseEntity<Void>> headObject(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @PathVariable String bucket,
            @PathVariable String key) {
        return objectService.headObject(identity, bucket, normalizeKey(key))
                .map(info -> ResponseEntity.ok()
                        .headers(infoHeaders(info))
                        .<Void>build());
    }

    /**
     * 删除对象, a missing bucket or key answers 204 as well
     */
    @DeleteMapping("/{bucket}/{*key}")
    public Mono<ResponseEntity<Void>> deleteObject(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @PathVariable String bucket,
            @PathVariable String key) {
        return objectService.deleteObject(identity, bucket, normalizeKey(key))
                .onErrorResume(e -> e instanceof BucketNotFoundException || e instanceof ObjectNotFoundException,
                        e -> Mono.empty())
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    static HttpHeaders infoHeaders(ObjectInfo info) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.CONTENT_TYPE, info.getContentType() != null
                ? info.getContentType() : "application/octet-stream");
        headers.setContentLength(info.getSize());
        if (info.getEtag() != null && !info.getEtag().isEmpty()) {
            headers.set(HttpHeaders.ETAG, quote(info.getEtag()));
        }
        Instant lastModified = info.getLastModified() != null ? info.getLastModified() : Instant.now();
        headers.set(HttpHeaders.LAST_MODIFIED, HTTP_DATE_FORMATTER.format(lastModified));
        return headers;
    }

    static Flux<ByteBuffer> toByteBuffers(Flux<DataBuffer> body) {
        Flux<DataBuffer> safeBody = body != null ? body : Flux.empty();
        return safeBody.map(dataBuffer -> {
            byte[] bytes = new byte[dataBuffer.readableByteCount()];
            dataBuffer.read(bytes);
            DataBufferUtils.release(dataBuffer);
            return ByteBuffer.wrap(bytes);
        });
    }

    static String quote(String etag) {
        return "\"" + (etag == null ? "" : etag) + "\"";
    }

    /**
     * 规范化对象Key（去除开头的斜杠）
     */
    static String normalizeKey(String key) {
        if (key != null && key.startsWith("/")) {
            return key.substring(1);
        }
        return key;
    }
}
