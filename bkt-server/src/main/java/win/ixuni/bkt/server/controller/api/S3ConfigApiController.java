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
import win.ixuni.bkt.core.model.S3Configuration;
import win.ixuni.bkt.core.policy.Identity;
import win.ixuni.bkt.server.controller.api.dto.S3ConfigRequest;
import win.ixuni.bkt.server.security.IdentityFilter;
import win.ixuni.bkt.server.service.S3ConfigService;

import java.util.List;

/**
 * S3 配置管理接口, credentials are write-only
 */
@RestController
@RequestMapping(value = "/api/s3-configs", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class S3ConfigApiController {

    private final S3ConfigService s3ConfigService;

    @GetMapping
    public Mono<List<S3Configuration>> list(@RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity) {
        return s3ConfigService.list(identity).collectList();
    }

    @GetMapping("/{id}")
    public Mono<S3Configuration> get(@RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
                                     @PathVariable String id) {
        return s3ConfigService.get(identity, id);
    }

    @PostMapping
    public Mono<ResponseEntity<S3Configuration>> create(
            @RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
            @RequestBody S3ConfigRequest request) {
        return s3ConfigService.create(identity, request.toChanges())
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @PutMapping("/{id}")
    public Mono<S3Configuration> update(@RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
                                        @PathVariable String id,
                                        @RequestBody S3ConfigRequest request) {
        return s3ConfigService.update(identity, id, request.toChanges());
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> delete(@RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
                                             @PathVariable String id) {
        return s3ConfigService.delete(identity, id)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }
}
