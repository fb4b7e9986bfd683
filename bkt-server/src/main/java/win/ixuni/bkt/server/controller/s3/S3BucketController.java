package win.ixuni.bkt.server.controller.s3;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.AccessDeniedException;
import win.ixuni.bkt.core.exception.BucketNotFoundException;
import win.ixuni.bkt.core.model.StoredObject;
import win.ixuni.bkt.core.policy.Identity;
import win.ixuni.bkt.server.controller.s3.model.ListAllMyBucketsResult;
import win.ixuni.bkt.server.controller.s3.model.ListBucketResult;
import win.ixuni.bkt.server.security.IdentityFilter;
import win.ixuni.bkt.server.service.BucketService;
import win.ixuni.bkt.server.service.ObjectService;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Bucket 操作控制器 (S3 XML)
 */
@Slf4j
@RestController
@RequestMapping("/s3")
@RequiredArgsConstructor
public class S3BucketController {

    static final String APPLICATION_XML = "application/xml";

    static final String FOLDER_MARKER = ".keep";

    private final BucketService bucketService;
    private final ObjectService objectService;

    /**
     * List all buckets
     * GET /s3
     */
    @GetMapping(value = {"", "/"}, produces = APPLICATION_XML)
    public Mono<ResponseEntity<ListAllMyBucketsResult>> listBuckets(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity) {
        return bucketService.listBuckets(identity)
                .map(bucket -> new ListAllMyBucketsResult.BucketEntry(bucket.getName(), bucket.getCreatedAt()))
                .collectList()
                .map(buckets -> {
                    String ownerId = identity.getUserId() != null ? identity.getUserId() : "anonymous";
                    String displayName = identity.getUsername() != null ? identity.getUsername() : "anonymous";
                    return ResponseEntity.ok(new ListAllMyBucketsResult(
                            new ListAllMyBucketsResult.Owner(ownerId, displayName), buckets));
                });
    }

    /**
     * 检查Bucket是否存在 (HEAD)
     */
    @RequestMapping(value = "/{bucket}", method = RequestMethod.HEAD)
    public Mono<ResponseEntity<Void>> headBucket(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @PathVariable String bucket) {
        return bucketService.headBucket(identity, bucket)
                .map(b -> ResponseEntity.ok()
                        .header("x-amz-bucket-region", b.getRegion())
                        .<Void>build());
    }

    /**
     * Buckets are created through the management API only
     */
    @PutMapping("/{bucket}")
    public Mono<ResponseEntity<Void>> createBucket(@PathVariable String bucket) {
        return Mono.error(new AccessDeniedException(
                "Bucket creation via S3 API is not supported. Use web UI."));
    }

    /**
     * 删除Bucket, a missing bucket answers 204 as well
     */
    @DeleteMapping("/{bucket}")
    public Mono<ResponseEntity<Void>> deleteBucket(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @PathVariable String bucket) {
        return bucketService.deleteBucket(identity, bucket)
                .onErrorResume(BucketNotFoundException.class, e -> Mono.empty())
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    /**
     * 列出Bucket中的对象 (V1)
     */
    @GetMapping(value = "/{bucket}", produces = APPLICATION_XML)
    public Mono<ResponseEntity<ListBucketResult>> listObjects(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @PathVariable String bucket,
            @RequestParam(required = false) String prefix,
            @RequestParam(required = false) String delimiter,
            @RequestParam(name = "max-keys", required = false) String maxKeys) {
        int limit = ObjectService.normalizeMaxKeys(maxKeys);
        return objectService.listObjects(identity, bucket, prefix, limit)
                .map(objects -> ResponseEntity.ok(toListBucketResult(bucket, prefix, delimiter, limit, objects)));
    }

    /**
     * Group keys below the delimiter into common prefixes, then hide folder markers
     */
    static ListBucketResult toListBucketResult(String bucket, String prefix, String delimiter, int maxKeys,
                                               List<StoredObject> objects) {
        String normalizedPrefix = prefix == null ? "" : prefix;
        boolean grouping = delimiter != null && !delimiter.isEmpty();
        Set<String> commonPrefixes = new LinkedHashSet<>();
        List<ListBucketResult.Content> contents = new ArrayList<>();
        for (StoredObject object : objects) {
            String key = object.getKey();
            if (grouping) {
                String rest = key.substring(Math.min(normalizedPrefix.length(), key.length()));
                int index = rest.indexOf(delimiter);
                if (index >= 0) {
                    commonPrefixes.add(normalizedPrefix + rest.substring(0, index + delimiter.length()));
                    continue;
                }
            }
            if (key.equals(FOLDER_MARKER) || key.endsWith("/" + FOLDER_MARKER)) {
                continue;
            }
            contents.add(ListBucketResult.Content.builder()
                    .key(key)
                    .lastModified(object.getUpdatedAt() != null ? object.getUpdatedAt() : object.getCreatedAt())
                    .etag("\"" + (object.getEtag() == null ? "" : object.getEtag()) + "\"")
                    .size(object.getSize())
                    .storageClass("STANDARD")
                    .build());
        }
        return ListBucketResult.builder()
                .name(bucket)
                .prefix(normalizedPrefix)
                .delimiter(grouping ? delimiter : null)
                .maxKeys(maxKeys)
                .isTruncated(false)
                .contents(contents)
                .commonPrefixes(commonPrefixes.stream().map(ListBucketResult.CommonPrefix::new).toList())
                .build();
    }
}
