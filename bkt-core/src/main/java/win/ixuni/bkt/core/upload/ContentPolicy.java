package win.ixuni.bkt.core.upload;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import win.ixuni.bkt.core.exception.EntityTooLargeException;
import win.ixuni.bkt.core.exception.UnsupportedContentTypeException;
import win.ixuni.bkt.core.exception.ValidationException;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 上传内容策略 (size limits and sniffed type allow-list)
 * <p>
 * An empty allow-list admits every type that is not blocked.
 */
@Slf4j
@Getter
public class ContentPolicy {

    public static final long DEFAULT_MAX_SIZE = 5L * 1024 * 1024 * 1024;
    public static final long DEFAULT_WARN_SIZE = 1024L * 1024 * 1024;

    public static final List<String> DEFAULT_BLOCKED_TYPES = List.of(
            "application/x-msdownload",
            "application/x-msdos-program",
            "application/x-executable",
            "application/x-sharedlib",
            "application/x-mach-binary",
            "application/vnd.microsoft.portable-executable");

    private final long maxSize;
    private final long warnSize;
    private final Set<String> allowedTypes;
    private final Set<String> blockedTypes;

    public ContentPolicy(long maxSize, long warnSize, Collection<String> allowedTypes,
                         Collection<String> blockedTypes) {
        this.maxSize = maxSize;
        this.warnSize = warnSize;
        this.allowedTypes = normalize(allowedTypes);
        this.blockedTypes = normalize(blockedTypes);
    }

    public static ContentPolicy defaults() {
        return new ContentPolicy(DEFAULT_MAX_SIZE, DEFAULT_WARN_SIZE, List.of(), DEFAULT_BLOCKED_TYPES);
    }

    /**
     * Declared size must be known, non-negative and within the maximum
     */
    public void checkSize(long size) {
        if (size < 0) {
            throw new ValidationException("Content-Length must be a non-negative size, got " + size);
        }
        if (size > maxSize) {
            throw new EntityTooLargeException(size, maxSize);
        }
        if (size > warnSize) {
            log.warn("Large upload accepted: {} bytes (warning threshold {} bytes)", size, warnSize);
        }
    }

    public boolean isAllowed(String contentType) {
        String base = ContentSniffer.baseType(contentType);
        if (blockedTypes.contains(base)) {
            return false;
        }
        return allowedTypes.isEmpty() || allowedTypes.contains(base);
    }

    /**
     * @throws UnsupportedContentTypeException when the sniffed type is not admitted
     */
    public void checkContentType(String contentType) {
        if (!isAllowed(contentType)) {
            throw new UnsupportedContentTypeException(ContentSniffer.baseType(contentType));
        }
    }

    private static Set<String> normalize(Collection<String> types) {
        if (types == null) {
            return Set.of();
        }
        return types.stream()
                .map(ContentSniffer::baseType)
                .filter(type -> !type.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }
}
