package win.ixuni.bkt.server.controller.api;

import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.exception.ValidationException;
import win.ixuni.bkt.core.model.Upload;
import win.ixuni.bkt.core.model.UploadStatus;
import win.ixuni.bkt.core.policy.Identity;
import win.ixuni.bkt.server.security.IdentityFilter;
import win.ixuni.bkt.server.service.AsyncUploadService;

import java.util.List;

/**
 * 上传状态接口
 */
@RestController
@RequestMapping(value = "/api/uploads", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class UploadApiController {

    private final AsyncUploadService asyncUploadService;

    @GetMapping("/{id}")
    public Mono<Upload> getUpload(@RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
                                  @PathVariable String id) {
        return asyncUploadService.getStatus(identity, id);
    }

    @GetMapping
    public Mono<List<Upload>> listUploads(@RequestAttribute(IdentityFilter.IDENTITY_ATTRIBUTE) Identity identity,
                                          @RequestParam(required = false) String status,
                                          @RequestParam(required = false, defaultValue = "0") int limit) {
        UploadStatus filter;
        try {
            filter = status == null || status.isBlank() ? null : UploadStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            return Mono.error(new ValidationException("Unknown upload status: " + status));
        }
        return asyncUploadService.listUploads(identity, filter, limit).collectList();
    }
}
