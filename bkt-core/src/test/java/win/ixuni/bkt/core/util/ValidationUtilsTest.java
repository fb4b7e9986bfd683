package win.ixuni.bkt.core.util;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import win.ixuni.bkt.core.exception.ValidationException;

import static org.junit.jupiter.api.Assertions.*;

public class ValidationUtilsTest {

    @ParameterizedTest
    @ValueSource(strings = {"abc", "my-bucket-1", "0123456789", "a1b"})
    @DisplayName("Legal bucket names")
    void testValidBucketNames(String name) {
        assertDoesNotThrow(() -> ValidationUtils.validateBucketName(name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"ab", "-abc", "abc-", "ABC", "my_bucket", "192.168.1.1", "a--b",
            "xn--abc", "data-s3alias"})
    @DisplayName("非法 bucket 名称")
    void testInvalidBucketNames(String name) {
        ValidationException e = assertThrows(ValidationException.class,
                () -> ValidationUtils.validateBucketName(name));
        assertEquals("InvalidBucketName", e.getErrorCode());
    }

    @Test
    @DisplayName("Bucket name length limits")
    void testBucketNameLength() {
        assertDoesNotThrow(() -> ValidationUtils.validateBucketName("a".repeat(63)));
        assertThrows(ValidationException.class, () -> ValidationUtils.validateBucketName("a".repeat(64)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "../etc/passwd", "a/../b", "/abs", "nul\0byte", "back\\slash"})
    @DisplayName("非法对象 key")
    void testInvalidKeys(String key) {
        ValidationException e = assertThrows(ValidationException.class,
                () -> ValidationUtils.validateObjectKey(key));
        assertEquals("InvalidKey", e.getErrorCode());
    }

    @Test
    @DisplayName("Key length limit is 1024")
    void testKeyLength() {
        assertDoesNotThrow(() -> ValidationUtils.validateObjectKey("k".repeat(1024)));
        assertThrows(ValidationException.class, () -> ValidationUtils.validateObjectKey("k".repeat(1025)));
        assertDoesNotThrow(() -> ValidationUtils.validateObjectKey("folder/sub/file.txt"));
    }

    @Test
    @DisplayName("Region defaults and format")
    void testRegion() {
        assertEquals("us-east-1", ValidationUtils.normalizeRegion(null));
        assertEquals("us-east-1", ValidationUtils.normalizeRegion(""));
        assertEquals("eu-west-2", ValidationUtils.normalizeRegion("eu-west-2"));
        assertEquals("ap-southeast-1", ValidationUtils.normalizeRegion("ap-southeast-1"));
        assertThrows(ValidationException.class, () -> ValidationUtils.normalizeRegion("moon"));
        assertThrows(ValidationException.class, () -> ValidationUtils.normalizeRegion("US-EAST-1"));
    }

    @Test
    @DisplayName("LIKE wildcard escaping")
    void testEscapeLikeWildcards() {
        assertEquals("100\\%\\_done\\\\x", ValidationUtils.escapeLikeWildcards("100%_done\\x"));
        assertEquals("plain/prefix", ValidationUtils.escapeLikeWildcards("plain/prefix"));
        assertEquals("", ValidationUtils.escapeLikeWildcards(null));
    }

    @Test
    void testNormalizeFolder() {
        assertEquals("", ValidationUtils.normalizeFolder(""));
        assertEquals("a/", ValidationUtils.normalizeFolder("a"));
        assertEquals("a/b/", ValidationUtils.normalizeFolder("a/b/"));
    }
}
