package win.ixuni.bkt.server;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsResponse;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import win.ixuni.bkt.core.model.User;
import win.ixuni.bkt.core.store.UserStore;
import win.ixuni.bkt.core.util.Digests;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full server on a random port: management API plus the S3 surface, driven over HTTP
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "bkt.security.bootstrap-admins=root")
@ActiveProfiles("test")
public class GatewayIntegrationTest {

    private static final String IDENTITY_HEADER = "X-Authenticated-User";

    @LocalServerPort
    int port;

    @Autowired
    WebTestClient client;

    @Autowired
    UserStore userStore;

    private String bucket;
    private S3Client s3;

    @BeforeEach
    void setUp() {
        client = client.mutate().responseTimeout(Duration.ofSeconds(30)).build();
        userStore.findByUsername("alice")
                .switchIfEmpty(Mono.defer(() -> userStore.save(User.builder().username("alice").isAdmin(false).build())))
                .block(Duration.ofSeconds(10));

        bucket = "it-" + UUID.randomUUID().toString().substring(0, 8);
        client.post().uri("/api/buckets")
                .header(IDENTITY_HEADER, "root")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", bucket, "storage_backend", "local"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.name").isEqualTo(bucket)
                .jsonPath("$.storage_backend").isEqualTo("local");

        s3 = S3Client.builder()
                .endpointOverride(URI.create("http://localhost:" + port + "/s3"))
                .region(Region.US_EAST_1)
                .credentialsProvider(StaticCredentialsProvider.create(AwsBasicCredentials.create("test", "test")))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(true)
                        .chunkedEncodingEnabled(false)
                        .build())
                .overrideConfiguration(config -> config.putHeader(IDENTITY_HEADER, "root"))
                .httpClient(UrlConnectionHttpClient.builder().build())
                .build();
    }

    @AfterEach
    void tearDown() {
        s3.close();
    }

    @Test
    @DisplayName("S3 client: put, get, head, list and delete through the gateway")
    void testS3ClientRoundTrip() {
        String body = "hello from the s3 client";

        PutObjectResponse put = s3.putObject(b -> b.bucket(bucket).key("docs/hello.txt"),
                RequestBody.fromString(body));
        assertEquals("\"" + Digests.md5Hex(body.getBytes(StandardCharsets.UTF_8)) + "\"", put.eTag());

        ResponseBytes<GetObjectResponse> got = s3.getObjectAsBytes(b -> b.bucket(bucket).key("docs/hello.txt"));
        assertEquals(body, got.asUtf8String());
        assertTrue(got.response().contentType().startsWith("text/plain"));

        HeadObjectResponse head = s3.headObject(b -> b.bucket(bucket).key("docs/hello.txt"));
        assertEquals(body.length(), head.contentLength());

        ListObjectsResponse listing = s3.listObjects(b -> b.bucket(bucket).prefix("docs/"));
        assertEquals(1, listing.contents().size());
        S3Object entry = listing.contents().get(0);
        assertEquals("docs/hello.txt", entry.key());
        assertEquals(body.length(), entry.size());

        s3.deleteObject(b -> b.bucket(bucket).key("docs/hello.txt"));
        S3Exception missing = assertThrows(S3Exception.class,
                () -> s3.getObjectAsBytes(b -> b.bucket(bucket).key("docs/hello.txt")));
        assertEquals(404, missing.statusCode());
    }

    @Test
    @DisplayName("S3 client: bucket creation is refused")
    void testS3CreateBucketRefused() {
        S3Exception error = assertThrows(S3Exception.class, () -> s3.createBucket(b -> b.bucket("made-by-s3")));
        assertEquals(403, error.statusCode());
    }

    @Test
    @DisplayName("S3 XML listing groups folders and answers errors as XML")
    void testS3XmlSurface() {
        putS3("a/one.txt", "one");
        putS3("a/two.txt", "two");
        putS3("top.txt", "top");

        client.get().uri("/s3/{bucket}?delimiter=/", bucket)
                .header(IDENTITY_HEADER, "root")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().exists("x-amz-request-id")
                .expectBody(String.class)
                .value(xml -> {
                    assertTrue(xml.contains("<Key>top.txt</Key>"), xml);
                    assertTrue(xml.contains("<Prefix>a/</Prefix>"), xml);
                    assertFalse(xml.contains("<Key>a/one.txt</Key>"), xml);
                });

        client.get().uri("/s3/{bucket}/missing.txt", bucket)
                .header(IDENTITY_HEADER, "root")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody(String.class)
                .value(xml -> assertTrue(xml.contains("<Code>NoSuchKey</Code>"), xml));

        client.delete().uri("/s3/{bucket}/never-existed.txt", bucket)
                .header(IDENTITY_HEADER, "root")
                .exchange()
                .expectStatus().isNoContent();
    }

    @Test
    @DisplayName("Anonymous and unauthorized callers are denied")
    void testAccessDenied() {
        putS3("private.txt", "secret");

        client.get().uri("/s3/{bucket}/private.txt", bucket)
                .exchange()
                .expectStatus().isForbidden();

        client.get().uri("/s3/{bucket}/private.txt", bucket)
                .header(IDENTITY_HEADER, "alice")
                .exchange()
                .expectStatus().isForbidden();

        client.get().uri("/api/policies")
                .header(IDENTITY_HEADER, "alice")
                .exchange()
                .expectStatus().isOk()
                .expectBody().json("[]");

        client.get().uri("/api/s3-configs")
                .header(IDENTITY_HEADER, "alice")
                .exchange()
                .expectStatus().isForbidden()
                .expectBody().jsonPath("$.error").isEqualTo("AccessDenied");
    }

    @Test
    @DisplayName("An attached read-only policy lets a user read but not write")
    void testAttachedPolicy() {
        putS3("shared.txt", "shared content");
        String aliceId = userStore.findByUsername("alice").map(User::getId).block(Duration.ofSeconds(10));
        String policyName = "read-" + bucket;
        String document = "{\"Version\":\"2012-10-17\",\"Statement\":[{\"Effect\":\"Allow\","
                + "\"Action\":[\"s3:GetObject\",\"s3:ListBucket\"],"
                + "\"Resource\":[\"arn:aws:s3:::" + bucket + "\",\"arn:aws:s3:::" + bucket + "/*\"]}]}";

        String policyId = client.post().uri("/api/policies")
                .header(IDENTITY_HEADER, "root")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"name\":\"" + policyName + "\",\"document\":" + document + "}")
                .exchange()
                .expectStatus().isCreated()
                .expectBody(Map.class)
                .returnResult()
                .getResponseBody()
                .get("id")
                .toString();

        client.post().uri("/api/policies/users/{userId}/attach", aliceId)
                .header(IDENTITY_HEADER, "root")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("policy_id", policyId))
                .exchange()
                .expectStatus().is2xxSuccessful();

        client.get().uri("/s3/{bucket}/shared.txt", bucket)
                .header(IDENTITY_HEADER, "alice")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).isEqualTo("shared content");

        client.put().uri("/s3/{bucket}/alice.txt", bucket)
                .header(IDENTITY_HEADER, "alice")
                .contentType(MediaType.TEXT_PLAIN)
                .bodyValue("not allowed".getBytes(StandardCharsets.UTF_8))
                .exchange()
                .expectStatus().isForbidden()
                .expectBody(String.class)
                .value(xml -> assertTrue(xml.contains("<Code>AccessDenied</Code>"), xml));

        client.delete().uri("/api/policies/users/{userId}/detach/{policyId}", aliceId, policyId)
                .header(IDENTITY_HEADER, "root")
                .exchange()
                .expectStatus().isNoContent();

        client.get().uri("/s3/{bucket}/shared.txt", bucket)
                .header(IDENTITY_HEADER, "alice")
                .exchange()
                .expectStatus().isForbidden();
    }

    @Test
    @DisplayName("Executable bodies are refused with 415 whatever their declared type")
    void testExecutableRefused() {
        byte[] executable = {'M', 'Z', (byte) 0x90, 0, 3, 0, 0, 0};

        client.put().uri("/s3/{bucket}/image.png", bucket)
                .header(IDENTITY_HEADER, "root")
                .contentType(MediaType.IMAGE_PNG)
                .bodyValue(executable)
                .exchange()
                .expectStatus().isEqualTo(415);

        client.head().uri("/s3/{bucket}/image.png", bucket)
                .header(IDENTITY_HEADER, "root")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("Management API: upload, move, rename, list and download")
    void testObjectManagement() {
        client.post().uri("/api/buckets/{bucket}/objects?key=inbox/report.txt", bucket)
                .header(IDENTITY_HEADER, "root")
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue("quarterly numbers".getBytes(StandardCharsets.UTF_8))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.key").isEqualTo("inbox/report.txt")
                .jsonPath("$.size").isEqualTo(17);

        client.post().uri("/api/buckets/{bucket}/objects/move", bucket)
                .header(IDENTITY_HEADER, "root")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("source_key", "inbox/report.txt", "destination_key", "archive/report.txt"))
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.key").isEqualTo("archive/report.txt");

        client.post().uri("/api/buckets/{bucket}/objects/rename", bucket)
                .header(IDENTITY_HEADER, "root")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("key", "archive/report.txt", "new_name", "q3.txt"))
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.key").isEqualTo("archive/q3.txt");

        client.get().uri("/api/buckets/{bucket}/objects?prefix=archive/", bucket)
                .header(IDENTITY_HEADER, "root")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(1)
                .jsonPath("$.objects[0].key").isEqualTo("archive/q3.txt");

        client.get().uri("/api/buckets/{bucket}/objects/archive/q3.txt", bucket)
                .header(IDENTITY_HEADER, "root")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().value(HttpHeaders.CONTENT_DISPOSITION, value -> assertTrue(value.contains("q3.txt")))
                .expectBody(String.class).isEqualTo("quarterly numbers");

        client.get().uri("/s3/{bucket}/inbox/report.txt", bucket)
                .header(IDENTITY_HEADER, "root")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("A non-empty bucket cannot be deleted")
    void testDeleteBucket() {
        putS3("keep.txt", "data");

        client.delete().uri("/api/buckets/{bucket}", bucket)
                .header(IDENTITY_HEADER, "root")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody().jsonPath("$.error").isEqualTo("BucketNotEmpty");

        client.delete().uri("/s3/{bucket}/keep.txt", bucket)
                .header(IDENTITY_HEADER, "root")
                .exchange()
                .expectStatus().isNoContent();

        client.delete().uri("/api/buckets/{bucket}", bucket)
                .header(IDENTITY_HEADER, "root")
                .exchange()
                .expectStatus().isNoContent();

        client.get().uri("/api/buckets/{bucket}", bucket)
                .header(IDENTITY_HEADER, "root")
                .exchange()
                .expectStatus().isNotFound();
    }

    private void putS3(String key, String content) {
        client.put().uri("/s3/" + bucket + "/" + key)
                .header(IDENTITY_HEADER, "root")
                .contentType(MediaType.TEXT_PLAIN)
                .bodyValue(content.getBytes(StandardCharsets.UTF_8))
                .exchange()
                .expectStatus().isOk()
                .expectHeader().exists(HttpHeaders.ETAG);
    }
}
