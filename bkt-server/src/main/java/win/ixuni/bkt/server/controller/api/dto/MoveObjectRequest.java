package win.ixuni.bkt.server.controller.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MoveObjectRequest(@JsonProperty("source_key") String sourceKey,
                                @JsonProperty("destination_key") String destinationKey) {
}
