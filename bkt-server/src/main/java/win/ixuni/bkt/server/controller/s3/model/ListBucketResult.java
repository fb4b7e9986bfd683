package win.ixuni.bkt.server.controller.s3.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 列出对象返回结果 (ListObjects V1)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JacksonXmlRootElement(localName = "ListBucketResult", namespace = ListBucketResult.S3_NAMESPACE)
public class ListBucketResult {

    public static final String S3_NAMESPACE = "http://s3.amazonaws.com/doc/2006-03-01/";

    /**
     * Millisecond ISO 8601 in UTC, the form SDK date parsers expect
     */
    public static final String S3_TIMESTAMP = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'";

    @JacksonXmlProperty(localName = "Name")
    private String name;

    @JacksonXmlProperty(localName = "Prefix")
    private String prefix;

    @JacksonXmlProperty(localName = "Delimiter")
    private String delimiter;

    @JacksonXmlProperty(localName = "MaxKeys")
    private Integer maxKeys;

    /**
     * Always false, listings are a single page
     */
    @JacksonXmlProperty(localName = "IsTruncated")
    private Boolean isTruncated;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "Contents")
    private List<Content> contents;

    /**
     * Folders one level below the prefix, only with a delimiter
     */
    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "CommonPrefixes")
    private List<CommonPrefix> commonPrefixes;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Content {

        @JacksonXmlProperty(localName = "Key")
        private String key;

        @JacksonXmlProperty(localName = "LastModified")
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = S3_TIMESTAMP, timezone = "UTC")
        private Instant lastModified;

        /**
         * Quoted
         */
        @JacksonXmlProperty(localName = "ETag")
        private String etag;

        @JacksonXmlProperty(localName = "Size")
        private long size;

        @JacksonXmlProperty(localName = "StorageClass")
        private String storageClass;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CommonPrefix {

        @JacksonXmlProperty(localName = "Prefix")
        private String prefix;
    }
}
