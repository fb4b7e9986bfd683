package win.ixuni.bkt.server.controller.s3.model;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

/**
 * {@code <Error>} body of every failed {@code /s3} request
 *
 * @param resource  request path, e.g. {@code /s3/photos/a.jpg}
 * @param requestId same value as the {@code x-amz-request-id} header
 */
@JacksonXmlRootElement(localName = "Error")
public record S3ErrorResponse(
        @JacksonXmlProperty(localName = "Code") String code,
        @JacksonXmlProperty(localName = "Message") String message,
        @JacksonXmlProperty(localName = "Resource") String resource,
        @JacksonXmlProperty(localName = "RequestId") String requestId) {
}
