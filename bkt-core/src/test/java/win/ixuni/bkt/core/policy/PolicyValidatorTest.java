package win.ixuni.bkt.core.policy;

import org.junit.jupiter.api.*;
import win.ixuni.bkt.core.exception.ValidationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 策略文档校验测试
 */
public class PolicyValidatorTest {

    private final PolicyValidator validator = new PolicyValidator();

    private String rejectMessage(String json) {
        ValidationException e = assertThrows(ValidationException.class, () -> validator.parse(json));
        assertEquals("MalformedPolicy", e.getErrorCode());
        assertEquals(400, e.getHttpStatus());
        return e.getMessage();
    }

    @Test
    @DisplayName("Empty version defaults to 2012-10-17")
    void testVersionDefaulted() {
        PolicyDocument document = validator.parse("""
                {"Statement":[{"Sid":"Read_1","Effect":"Allow","Action":"s3:GetObject","Resource":"*"}]}""");

        assertEquals(PolicyDocument.VERSION, document.getVersion());
        assertEquals(1, document.getStatements().size());
        assertEquals("Read_1", document.getStatements().get(0).getSid());
    }

    @Test
    @DisplayName("Canonical JSON is re-serialized, never the raw input")
    void testCanonicalJson() {
        PolicyDocument document = validator.parse("""
                {   "statement" : [ {"effect":"Deny","action":"*","resource":"*", "Extra": 1} ] }""");
        String json = validator.toJson(document);

        assertEquals("{\"Version\":\"2012-10-17\",\"Statement\":[{\"Effect\":\"Deny\",\"Action\":[\"*\"],"
                + "\"Resource\":[\"*\"]}]}", json);
        assertEquals(document, PolicyValidator.readStored(json));
    }

    @Test
    @DisplayName("拒绝非法文档")
    void testRejections() {
        assertTrue(rejectMessage("{not json").startsWith("invalid JSON"));
        assertEquals("unsupported policy version: 2008-10-17",
                rejectMessage("{\"Version\":\"2008-10-17\",\"Statement\":[]}"));
        assertEquals("policy must contain at least one statement", rejectMessage("{\"Statement\":[]}"));
        assertEquals("statement 0: effect must be 'Allow' or 'Deny', got: allow",
                rejectMessage("{\"Statement\":[{\"Effect\":\"allow\",\"Action\":\"*\",\"Resource\":\"*\"}]}"));
        assertEquals("statement 0: statement must have at least one action",
                rejectMessage("{\"Statement\":[{\"Effect\":\"Allow\",\"Action\":[],\"Resource\":\"*\"}]}"));
        assertEquals("statement 0: invalid action 'GetObject': action must be in format 'service:action'",
                rejectMessage("{\"Statement\":[{\"Effect\":\"Allow\",\"Action\":\"GetObject\",\"Resource\":\"*\"}]}"));
        assertEquals("statement 0: statement must have at least one resource",
                rejectMessage("{\"Statement\":[{\"Effect\":\"Allow\",\"Action\":\"s3:*\",\"Resource\":[]}]}"));
        assertEquals("statement 0: invalid resource 'arn:aws:s3': invalid ARN format",
                rejectMessage("{\"Statement\":[{\"Effect\":\"Allow\",\"Action\":\"s3:*\",\"Resource\":\"arn:aws:s3\"}]}"));
        assertEquals("statement 0: invalid resource 'bucket/../etc': resource cannot contain '..'",
                rejectMessage("{\"Statement\":[{\"Effect\":\"Allow\",\"Action\":\"s3:*\",\"Resource\":\"bucket/../etc\"}]}"));
        assertTrue(rejectMessage("{\"Statement\":[{\"Sid\":\"has space\",\"Effect\":\"Allow\","
                + "\"Action\":\"s3:*\",\"Resource\":\"*\"}]}").startsWith("statement 0: invalid Sid"));
    }

    @Test
    @DisplayName("Statement index is reported for the failing statement")
    void testStatementIndex() {
        String json = "{\"Statement\":["
                + "{\"Effect\":\"Allow\",\"Action\":\"s3:GetObject\",\"Resource\":\"*\"},"
                + "{\"Effect\":\"Allow\",\"Action\":\"s3:Get:Object\",\"Resource\":\"*\"}]}";
        assertTrue(rejectMessage(json).startsWith("statement 1: invalid action 's3:Get:Object'"));
    }

    @Test
    @DisplayName("Size and statement count limits")
    void testLimits() {
        StringBuilder many = new StringBuilder("{\"Statement\":[");
        for (int i = 0; i < 21; i++) {
            if (i > 0) {
                many.append(',');
            }
            many.append("{\"Effect\":\"Allow\",\"Action\":\"s3:GetObject\",\"Resource\":\"*\"}");
        }
        many.append("]}");
        assertEquals("policy cannot contain more than 20 statements", rejectMessage(many.toString()));

        String huge = "{\"Statement\":[{\"Effect\":\"Allow\",\"Action\":\"s3:GetObject\",\"Resource\":\""
                + "a".repeat(11 * 1024) + "\"}]}";
        assertEquals("policy document too large (max 10KB)", rejectMessage(huge));
    }
}
