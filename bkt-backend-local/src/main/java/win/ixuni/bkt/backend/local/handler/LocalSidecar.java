package win.ixuni.bkt.backend.local.handler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sidecar metadata file structure
 * <p>
 * Keeps what the filesystem cannot: the MD5 computed while writing and the content type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class LocalSidecar {

    private String etag;

    private String contentType;

    private long size;

    /**
     * epoch millis
     */
    private long lastModified;
}
