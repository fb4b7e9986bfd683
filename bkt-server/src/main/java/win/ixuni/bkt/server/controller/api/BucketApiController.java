package win.ixuni.bkt.server.controller.api;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.model.Bucket;
import win.ixuni.bkt.core.model.BucketPolicy;
import win.ixuni.bkt.core.policy.Identity;
import win.ixuni.bkt.server.controller.api.dto.CreateBucketRequest;
import win.ixuni.bkt.server.security.IdentityFilter;
import win.ixuni.bkt.server.service.BucketService;

import java.util.List;

/**
 * Bucket 管理接口
 */
@RestController
@RequestMapping(value = "/api/buckets", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class BucketApiController {

    private final BucketService bucketService;

    @PostMapping
    public Mono<ResponseEntity<Bucket>> createBucket(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @RequestBody CreateBucketRequest request) {
        return bucketService.createBucket(identity, request.name(), request.region(),
                        Boolean.TRUE.equals(request.isPublic()), request.storageBackend(), request.s3ConfigId())
                .map(bucket -> ResponseEntity.status(HttpStatus.CREATED).body(bucket));
    }

    @GetMapping
    public Mono<List<Bucket>> listBuckets(@RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity) {
        return bucketService.listBuckets(identity).collectList();
    }

    @GetMapping("/{name}")
    public Mono<Bucket> getBucket(@RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
                                  @PathVariable String name) {
        return bucketService.getBucket(identity, name);
    }

    @DeleteMapping("/{name}")
    public Mono<ResponseEntity<Void>> deleteBucket(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @PathVariable String name) {
        return bucketService.deleteBucket(identity, name)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @GetMapping("/{name}/policy")
    public Mono<BucketPolicy> getBucketPolicy(@RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
                                              @PathVariable String name) {
        return bucketService.getBucketPolicy(identity, name);
    }

    /**
     * The body is the policy document itself
     */
    @PutMapping(value = "/{name}/policy", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<BucketPolicy> putBucketPolicy(@RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
                                              @PathVariable String name,
                                              @RequestBody String document) {
        return bucketService.putBucketPolicy(identity, name, document);
    }

    @DeleteMapping("/{name}/policy")
    public Mono<ResponseEntity<Void>> deleteBucketPolicy(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @PathVariable String name) {
        return bucketService.deleteBucketPolicy(identity, name)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }
}
