package win.ixuni.bkt.server.controller.s3.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.time.Instant;
import java.util.List;

/**
 * ListBuckets 响应, limited to the buckets the caller may see
 */
@JacksonXmlRootElement(localName = "ListAllMyBucketsResult", namespace = ListBucketResult.S3_NAMESPACE)
public record ListAllMyBucketsResult(
        @JacksonXmlProperty(localName = "Owner") Owner owner,
        @JacksonXmlElementWrapper(localName = "Buckets")
        @JacksonXmlProperty(localName = "Bucket") List<BucketEntry> buckets) {

    public record Owner(
            @JacksonXmlProperty(localName = "ID") String id,
            @JacksonXmlProperty(localName = "DisplayName") String displayName) {
    }

    public record BucketEntry(
            @JacksonXmlProperty(localName = "Name") String name,
            @JacksonXmlProperty(localName = "CreationDate")
            @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = ListBucketResult.S3_TIMESTAMP, timezone = "UTC")
            Instant creationDate) {
    }
}
