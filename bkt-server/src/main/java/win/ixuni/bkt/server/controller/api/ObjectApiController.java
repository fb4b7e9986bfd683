package win.ixuni.bkt.server.controller.api;

import lombok.RequiredArgsConstructor;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.GatewayException;
import win.ixuni.bkt.core.exception.ValidationException;
import win.ixuni.bkt.core.model.ObjectInfo;
import win.ixuni.bkt.core.model.StoredObject;
import win.ixuni.bkt.core.model.Upload;
import win.ixuni.bkt.core.policy.Identity;
import win.ixuni.bkt.server.controller.api.dto.MoveFolderRequest;
import win.ixuni.bkt.server.controller.api.dto.MoveObjectRequest;
import win.ixuni.bkt.server.controller.api.dto.ObjectListResponse;
import win.ixuni.bkt.server.controller.api.dto.RenameObjectRequest;
import win.ixuni.bkt.server.security.IdentityFilter;
import win.ixuni.bkt.server.service.AsyncUploadService;
import win.ixuni.bkt.server.service.ObjectMetadataCoordinator;
import win.ixuni.bkt.server.service.ObjectService;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * 对象管理接口
 * <p>
 * Uploads take the raw request body; the object key travels in the {@code key} query parameter.
 */
@RestController
@RequestMapping("/api/buckets/{bucket}/objects")
@RequiredArgsConstructor
public class ObjectApiController {

    private static final DateTimeFormatter HTTP_DATE_FORMATTER = DateTimeFormatter
            .ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US)
            .withZone(ZoneOffset.UTC);

    private final ObjectService objectService;
    private final AsyncUploadService asyncUploadService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ObjectListResponse> listObjects(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @PathVariable String bucket,
            @RequestParam(required = false) String prefix,
            @RequestParam(name = "max-keys", required = false) String maxKeys) {
        int limit = ObjectService.normalizeMaxKeys(maxKeys);
        return objectService.listObjects(identity, bucket, prefix, limit)
                .map(objects -> new ObjectListResponse(bucket, prefix == null ? "" : prefix, limit,
                        objects.size(), objects));
    }

    /**
     * 同步上传, waits for the backend write up to the configured timeout
     */
    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<StoredObject>> upload(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @PathVariable String bucket,
            @RequestParam String key,
            @RequestHeader HttpHeaders headers,
            @RequestBody(required = false) Flux<DataBuffer> body) {
        long size = headers.getContentLength();
        if (size < 0) {
            return Mono.error(new GatewayException("MissingContentLength", "Content-Length is required", 411));
        }
        Flux<ByteBuffer> content = (body != null ? body : Flux.<DataBuffer>empty())
                .map(dataBuffer -> {
                    byte[] bytes = new byte[dataBuffer.readableByteCount()];
                    dataBuffer.read(bytes);
                    DataBufferUtils.release(dataBuffer);
                    return ByteBuffer.wrap(bytes);
                });
        return objectService.upload(identity, bucket, key, content, size)
                .map(object -> ResponseEntity.status(HttpStatus.CREATED).body(object));
    }

    /**
     * 异步上传, answers 202 with the pending upload record
     */
    @PostMapping(value = "/async", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Upload>> uploadAsync(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @PathVariable String bucket,
            @RequestParam String key,
            @RequestParam(required = false) String filename,
            @RequestHeader HttpHeaders headers,
            @RequestBody(required = false) Flux<DataBuffer> body) {
        return asyncUploadService.accept(identity, bucket, key, filename,
                        body != null ? body : Flux.empty(), headers.getContentLength())
                .map(upload -> ResponseEntity.status(HttpStatus.ACCEPTED).body(upload));
    }

    @GetMapping("/{*key}")
    public Mono<ResponseEntity<Flux<DataBuffer>>> download(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @PathVariable String bucket,
            @PathVariable String key) {
        String objectKey = stripSlash(key);
        return objectService.getObject(identity, bucket, objectKey)
                .map(object -> ResponseEntity.ok()
                        .headers(headersOf(object.getInfo()))
                        .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                                .filename(objectKey.substring(objectKey.lastIndexOf('/') + 1), StandardCharsets.UTF_8)
                                .build()
                                .toString())
                        .body(object.getContent()
                                .map(byteBuffer -> DefaultDataBufferFactory.sharedInstance.wrap(byteBuffer))));
    }

    @RequestMapping(value = "/{*key}", method = RequestMethod.HEAD)
    public Mono<ResponseEntity<Void>> head(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @PathVariable String bucket,
            @PathVariable String key) {
        return objectService.headObject(identity, bucket, stripSlash(key))
                .map(info -> ResponseEntity.ok().headers(headersOf(info)).<Void>build());
    }

    @DeleteMapping("/{*key}")
    public Mono<ResponseEntity<Void>> delete(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @PathVariable String bucket,
            @PathVariable String key) {
        return objectService.deleteObject(identity, bucket, stripSlash(key))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @PostMapping(value = "/move", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<StoredObject> move(@RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
                                   @PathVariable String bucket,
                                   @RequestBody MoveObjectRequest request) {
        if (request.sourceKey() == null || request.destinationKey() == null) {
            return Mono.error(new ValidationException("source_key and destination_key are required"));
        }
        return objectService.moveObject(identity, bucket, request.sourceKey(), request.destinationKey());
    }

    @PostMapping(value = "/rename", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<StoredObject> rename(@RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
                                     @PathVariable String bucket,
                                     @RequestBody RenameObjectRequest request) {
        if (request.key() == null) {
            return Mono.error(new ValidationException("key is required"));
        }
        return objectService.renameObject(identity, bucket, request.key(), request.newName());
    }

    @PostMapping(value = "/move-folder", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ObjectMetadataCoordinator.FolderMoveResult> moveFolder(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @PathVariable String bucket,
            @RequestBody MoveFolderRequest request) {
        return objectService.moveFolder(identity, bucket, request.sourcePrefix(), request.destinationPrefix());
    }

    private static HttpHeaders headersOf(ObjectInfo info) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.CONTENT_TYPE, info.getContentType() != null
                ? info.getContentType() : MediaType.APPLICATION_OCTET_STREAM_VALUE);
        headers.setContentLength(info.getSize());
        if (info.getEtag() != null && !info.getEtag().isEmpty()) {
            headers.set(HttpHeaders.ETAG, "\"" + info.getEtag() + "\"");
        }
        if (info.getLastModified() != null) {
            headers.set(HttpHeaders.LAST_MODIFIED, HTTP_DATE_FORMATTER.format(info.getLastModified()));
        }
        return headers;
    }

    private static String stripSlash(String key) {
        return key != null && key.startsWith("/") ? key.substring(1) : key;
    }
}
