package win.ixuni.bkt.server.config;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import win.ixuni.bkt.server.codec.S3XmlEncoder;

/**
 * S3 响应的 XML 编码
 * <p>
 * The XML mapper is local to the encoder; the JSON mapper of {@code /api} stays Spring Boot's.
 */
@Configuration
public class WebFluxConfig implements WebFluxConfigurer {

    @Override
    public void configureHttpMessageCodecs(ServerCodecConfigurer configurer) {
        XmlMapper s3Mapper = XmlMapper.builder()
                .enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .addModule(new JavaTimeModule())
                .build();
        configurer.customCodecs().register(
                new S3XmlEncoder(s3Mapper, MediaType.APPLICATION_XML, MediaType.TEXT_XML));
    }
}
