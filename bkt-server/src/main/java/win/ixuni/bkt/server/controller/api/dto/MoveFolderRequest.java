package win.ixuni.bkt.server.controller.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MoveFolderRequest(@JsonProperty("source_prefix") String sourcePrefix,
                                @JsonProperty("destination_prefix") String destinationPrefix) {
}
