package win.ixuni.bkt.core.policy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import win.ixuni.bkt.core.exception.ValidationException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 策略文档校验
 * <p>
 * Parses a raw JSON document, checks it and returns the normalized form. Failures are
 * {@link ValidationException}s with code {@code MalformedPolicy}; statement level problems
 * read "statement N: reason" with N counted from zero.
 */
public class PolicyValidator {

    public static final int MAX_DOCUMENT_BYTES = 10 * 1024;
    public static final int MAX_STATEMENTS = 20;
    private static final int MAX_SID_LENGTH = 100;

    private static final Pattern SID_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+$");
    private static final Pattern SERVICE_PATTERN = Pattern.compile("^[a-zA-Z0-9]+$");
    private static final Pattern ACTION_NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9*]+$");

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    /**
     * Parse and validate
     *
     * @param documentJson raw document
     * @return normalized document (version defaulted)
     * @throws ValidationException when the document is rejected
     */
    public PolicyDocument parse(String documentJson) {
        if (documentJson == null || documentJson.isBlank()) {
            throw ValidationException.malformedPolicy("policy document is required");
        }
        if (documentJson.getBytes(StandardCharsets.UTF_8).length > MAX_DOCUMENT_BYTES) {
            throw ValidationException.malformedPolicy("policy document too large (max 10KB)");
        }

        PolicyDocument document;
        try {
            document = MAPPER.readValue(documentJson, PolicyDocument.class);
        } catch (JsonProcessingException e) {
            throw ValidationException.malformedPolicy("invalid JSON: " + e.getOriginalMessage());
        }
        if (document == null) {
            throw ValidationException.malformedPolicy("invalid JSON: empty document");
        }
        validate(document);
        return document;
    }

    /**
     * Validate an already parsed document, defaulting an empty version in place
     */
    public void validate(PolicyDocument document) {
        if (document.getVersion() == null || document.getVersion().isEmpty()) {
            document.setVersion(PolicyDocument.VERSION);
        }
        if (!PolicyDocument.VERSION.equals(document.getVersion())) {
            throw ValidationException.malformedPolicy("unsupported policy version: " + document.getVersion());
        }

        List<Statement> statements = document.getStatements();
        if (statements == null || statements.isEmpty()) {
            throw ValidationException.malformedPolicy("policy must contain at least one statement");
        }
        if (statements.size() > MAX_STATEMENTS) {
            throw ValidationException.malformedPolicy("policy cannot contain more than 20 statements");
        }

        for (int i = 0; i < statements.size(); i++) {
            String problem = checkStatement(statements.get(i));
            if (problem != null) {
                throw ValidationException.malformedPolicy("statement " + i + ": " + problem);
            }
        }
    }

    /**
     * Canonical JSON of a validated document; this, never the raw input, is what gets stored.
     */
    public String toJson(PolicyDocument document) {
        try {
            return MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize policy document", e);
        }
    }

    /**
     * Parse a document that was stored after validation
     */
    public static PolicyDocument readStored(String documentJson) {
        try {
            return MAPPER.readValue(documentJson, PolicyDocument.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored policy document is not valid JSON", e);
        }
    }

    private static String checkStatement(Statement statement) {
        if (statement == null) {
            return "statement cannot be null";
        }
        if (statement.getEffectType() == null) {
            return "effect must be 'Allow' or 'Deny', got: " + statement.getEffect();
        }

        if (statement.getActions() == null || statement.getActions().isEmpty()) {
            return "statement must have at least one action";
        }
        for (String action : statement.getActions()) {
            String problem = checkAction(action);
            if (problem != null) {
                return "invalid action '" + action + "': " + problem;
            }
        }

        if (statement.getResources() == null || statement.getResources().isEmpty()) {
            return "statement must have at least one resource";
        }
        for (String resource : statement.getResources()) {
            String problem = checkResource(resource);
            if (problem != null) {
                return "invalid resource '" + resource + "': " + problem;
            }
        }

        String sid = statement.getSid();
        if (sid != null && !sid.isEmpty()) {
            if (!SID_PATTERN.matcher(sid).matches()) {
                return "invalid Sid: Sid must contain only alphanumeric characters, hyphens, and underscores";
            }
            if (sid.length() > MAX_SID_LENGTH) {
                return "invalid Sid: Sid too long (max 100 characters)";
            }
        }
        return null;
    }

    private static String checkAction(String action) {
        if (action == null || action.isEmpty()) {
            return "action cannot be empty";
        }
        if ("*".equals(action)) {
            return null;
        }
        String[] parts = action.split(":", -1);
        if (parts.length != 2) {
            return "action must be in format 'service:action'";
        }
        if (!"*".equals(parts[0]) && !SERVICE_PATTERN.matcher(parts[0]).matches()) {
            return "invalid service name";
        }
        if (!ACTION_NAME_PATTERN.matcher(parts[1]).matches()) {
            return "invalid action name";
        }
        return null;
    }

    private static String checkResource(String resource) {
        if (resource == null || resource.isEmpty()) {
            return "resource cannot be empty";
        }
        if ("*".equals(resource)) {
            return null;
        }
        if (resource.contains("..")) {
            return "resource cannot contain '..'";
        }
        if (resource.startsWith("arn:") && resource.split(":", -1).length < 6) {
            return "invalid ARN format";
        }
        return null;
    }
}
