package win.ixuni.bkt.server.controller.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param newName file name only, the object stays in its folder
 */
public record RenameObjectRequest(String key, @JsonProperty("new_name") String newName) {
}
