package dev.totis.s3sim.client;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.Lists;
import dev.totis.s3sim.exception.AlreadyExistsException;
import dev.totis.s3sim.exception.AuthenticationException;
import dev.totis.s3sim.exception.BucketNotEmptyException;
import dev.totis.s3sim.exception.NotFoundException;
import io.minio.MinioClient;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.containers.MinIOContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class MinioObjectStorageClientTest {
  @Container
  private static final MinIOContainer minio =
      new MinIOContainer("minio/minio:RELEASE.2023-09-04T19-57-37Z");

  @TempDir Path tempDir;

  private MinioObjectStorageClient client;
  private String bucket;

  @BeforeEach
  void setup() throws Exception {
    client =
        new MinioObjectStorageClient(
            MinioClient.builder()
                .endpoint(minio.getS3URL())
                .credentials(minio.getUserName(), minio.getPassword())
                .build());
    bucket = "s3sim-" + UUID.randomUUID();
    client.createBucket(bucket);
  }

  @Test
  void bucketLifecycle() throws Exception {
    assertTrue(client.bucketExists(bucket));
    assertTrue(client.listBuckets().contains(bucket));

    AlreadyExistsException e =
        assertThrows(AlreadyExistsException.class, () -> client.createBucket(bucket));
    assertTrue(e.isOwnedByCaller());

    client.deleteBucket(bucket);
    assertFalse(client.bucketExists(bucket));
  }

  @Test
  void objectRoundTrip() throws Exception {
    Path source = tempDir.resolve("a.txt");
    Files.writeString(source, "hello minio");

    client.putObject(bucket, "docs/a.txt", source, Map.of("owner", "alice"));

    ObjectInfo info = client.statObject(bucket, "docs/a.txt");
    assertEquals(11, info.size());
    assertEquals("alice", info.userMetadata().get("owner"));
    try (InputStream in = client.getObject(bucket, "docs/a.txt")) {
      assertEquals("hello minio", new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }

    client.deleteObject(bucket, "docs/a.txt");
    assertThrows(NotFoundException.class, () -> client.statObject(bucket, "docs/a.txt"));
  }

  @Test
  void listAndBatchDelete() throws Exception {
    Path source = tempDir.resolve("x.bin");
    Files.write(source, new byte[] {1, 2, 3});
    for (String key : List.of("b/2", "a/1", "b/1", "c")) {
      client.putObject(bucket, key, source, Map.of());
    }

    Iterable<String> listing = client.listObjects(bucket, "b/");
    assertEquals(List.of("b/1", "b/2"), Lists.newArrayList(listing));
    assertEquals(List.of("b/1", "b/2"), Lists.newArrayList(listing));

    assertThrows(BucketNotEmptyException.class, () -> client.deleteBucket(bucket));

    List<String> all = Lists.newArrayList(client.listObjects(bucket, null));
    assertEquals(List.of("a/1", "b/1", "b/2", "c"), all);
    assertTrue(client.deleteObjects(bucket, all).isEmpty());
    client.deleteBucket(bucket);
  }

  @Test
  void missingObjectIsNotFound() {
    assertThrows(NotFoundException.class, () -> client.getObject(bucket, "absent"));
  }

  @Test
  void wrongCredentialsFailTheProbe() {
    MinioObjectStorageClient intruder =
        new MinioObjectStorageClient(
            MinioClient.builder()
                .endpoint(minio.getS3URL())
                .credentials("intruder", "not-the-password")
                .build());

    assertThrows(AuthenticationException.class, intruder::probeIdentity);
  }
}
