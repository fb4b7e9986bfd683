package win.ixuni.bkt.core.upload;

import org.junit.jupiter.api.*;
import win.ixuni.bkt.core.exception.EntityTooLargeException;
import win.ixuni.bkt.core.exception.UnsupportedContentTypeException;
import win.ixuni.bkt.core.exception.ValidationException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ContentPolicyTest {

    @Test
    @DisplayName("Size must be non-negative and within the maximum")
    void testSizeLimits() {
        ContentPolicy policy = new ContentPolicy(1000, 500, List.of(), ContentPolicy.DEFAULT_BLOCKED_TYPES);

        assertDoesNotThrow(() -> policy.checkSize(0));
        assertDoesNotThrow(() -> policy.checkSize(1000));
        assertDoesNotThrow(() -> policy.checkSize(700));
        assertThrows(ValidationException.class, () -> policy.checkSize(-1));
        EntityTooLargeException e = assertThrows(EntityTooLargeException.class, () -> policy.checkSize(1001));
        assertEquals(413, e.getHttpStatus());
    }

    @Test
    @DisplayName("默认阻止可执行类型")
    void testDefaultBlocklist() {
        ContentPolicy policy = ContentPolicy.defaults();

        assertTrue(policy.isAllowed("image/png"));
        assertTrue(policy.isAllowed("text/plain; charset=utf-8"));
        assertFalse(policy.isAllowed("application/x-msdownload"));
        assertFalse(policy.isAllowed("Application/X-Executable"));
        assertThrows(UnsupportedContentTypeException.class,
                () -> policy.checkContentType("application/x-sharedlib"));
        assertEquals(5L * 1024 * 1024 * 1024, policy.getMaxSize());
    }

    @Test
    @DisplayName("A non-empty allow-list admits only its members")
    void testAllowList() {
        ContentPolicy policy = new ContentPolicy(10, 10, List.of("image/png", "image/jpeg"), List.of());

        assertTrue(policy.isAllowed("image/png"));
        assertFalse(policy.isAllowed("application/pdf"));
    }
}
