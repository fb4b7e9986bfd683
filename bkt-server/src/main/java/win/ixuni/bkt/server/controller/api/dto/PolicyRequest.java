package win.ixuni.bkt.server.controller.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param document the policy document as a JSON object
 */
public record PolicyRequest(String name, String description, JsonNode document) {

    public String documentJson() {
        return document == null || document.isNull() ? null : document.toString();
    }
}
