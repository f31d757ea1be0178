package dev.totis.s3sim.commands;

import static org.junit.jupiter.api.Assertions.*;

import dev.totis.s3sim.Application;
import dev.totis.s3sim.StorageFacade;
import dev.totis.s3sim.StorageMode;
import dev.totis.s3sim.client.InMemoryObjectStorageClient;
import dev.totis.s3sim.exception.ConfigurationException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class S3SimCommandTest {
  @TempDir Path tempDir;

  private InMemoryObjectStorageClient backend;
  private List<StorageMode> openedModes;
  private StringWriter out;
  private StringWriter err;

  @BeforeEach
  void setup() {
    backend = new InMemoryObjectStorageClient();
    openedModes = new ArrayList<>();
  }

  private int run(String... args) {
    out = new StringWriter();
    err = new StringWriter();
    // no keys and no readable profile file: detection has nothing to try
    Map<String, String> environment =
        Map.of("AWS_SHARED_CREDENTIALS_FILE", tempDir.resolve("no-credentials").toString());
    S3SimCommand root =
        new S3SimCommand(
            environment,
            settings -> {
              openedModes.add(settings.mode());
              return StorageFacade.create(settings, backend);
            });
    CommandLine commandLine = Application.commandLine(root);
    commandLine.setOut(new PrintWriter(out, true));
    commandLine.setErr(new PrintWriter(err, true));

    List<String> all = new ArrayList<>(List.of("--mirror-root", tempDir.toString()));
    all.addAll(List.of(args));
    return commandLine.execute(all.toArray(new String[0]));
  }

  @Test
  void createBucketIsIdempotent() {
    assertEquals(0, run("create-bucket", "docs"));
    assertTrue(out.toString().contains("Bucket 'docs' created successfully"));

    assertEquals(0, run("create-bucket", "docs"));
    assertTrue(out.toString().contains("already exists and is owned by you"));
  }

  @Test
  void uploadThenReadAndList() {
    run("create-bucket", "docs");

    assertEquals(0, run("upload", "docs", "notes/a.txt", "hello world"));
    assertTrue(out.toString().contains("File 'notes/a.txt' uploaded to bucket 'docs'"));
    assertTrue(Files.isRegularFile(tempDir.resolve("mock/docs/notes/a.txt")));

    assertEquals(0, run("read-file", "docs", "notes/a.txt"));
    assertEquals("hello world", out.toString().trim());

    assertEquals(0, run("list", "docs", "--prefix", "notes/"));
    assertTrue(out.toString().contains("Objects in bucket 'docs':"));
    assertTrue(out.toString().contains("  notes/a.txt"));

    assertEquals(0, run("list", "docs", "--prefix", "other/"));
    assertTrue(out.toString().contains("No objects found in bucket 'docs'"));

    assertEquals(0, run("list"));
    assertTrue(out.toString().contains("  docs"));
  }

  @Test
  void uploadFileAndDownload() throws Exception {
    Path source = tempDir.resolve("report.csv");
    Files.writeString(source, "a,b\n1,2\n");
    Path target = tempDir.resolve("out/report.csv");
    run("create-bucket", "data");

    assertEquals(
        0,
        run("upload-file", "data", source.toString(), "report.csv", "--metadata", "{\"k\":\"v\"}"));
    assertEquals(0, run("metadata", "data", "report.csv"));
    assertTrue(out.toString().contains("k: v"));

    assertEquals(0, run("download-file", "data", "report.csv", target.toString()));
    assertEquals("a,b\n1,2\n", Files.readString(target));
  }

  @Test
  void invalidMetadataFails() {
    run("create-bucket", "docs");

    assertEquals(1, run("upload", "docs", "a.txt", "x", "--metadata", "{not json"));
    assertTrue(err.toString().contains("Error: metadata must be valid JSON"));
  }

  @Test
  void readingMissingObjectFails() {
    run("create-bucket", "docs");

    assertEquals(1, run("read-file", "docs", "missing.txt"));
    assertTrue(err.toString().contains("Error: "));
  }

  @Test
  void deleteFileReportsAbsence() {
    run("create-bucket", "docs");
    run("upload", "docs", "a.txt", "x");

    assertEquals(0, run("delete-file", "docs", "a.txt"));
    assertTrue(out.toString().contains("deleted from bucket 'docs'"));
    assertEquals(0, run("delete-file", "docs", "a.txt"));
    assertTrue(out.toString().contains("already absent"));
  }

  @Test
  void bucketDeletionIsRefusedOnRealBackend() throws Exception {
    backend.createBucket("docs");

    assertEquals(1, run("--mode", "real", "delete-bucket", "docs", "--force"));
    assertTrue(err.toString().contains("not allowed on the real backend"));
    assertTrue(backend.bucketExists("docs"));
    assertEquals(List.of(StorageMode.REAL), openedModes);
  }

  @Test
  void mockBackendDeletesBucketWithForce() {
    run("create-bucket", "docs");
    run("upload", "docs", "a.txt", "x");

    assertEquals(1, run("delete-bucket", "docs"));
    assertEquals(0, run("delete-bucket", "docs", "--force"));
    assertFalse(backend.bucketExists("docs"));
  }

  @Test
  void cleanupRemovesMirrorAndBucket() {
    run("create-bucket", "docs");
    run("upload", "docs", "a.txt", "x");

    assertEquals(0, run("cleanup", "docs", "--local", "--bucket"));
    assertTrue(out.toString().contains("Bucket 'docs' deleted with 1 object(s)"));
    assertFalse(Files.exists(tempDir.resolve("mock/docs")));
    assertFalse(backend.bucketExists("docs"));
  }

  @Test
  void autoModeWithoutCredentialsUsesMock() {
    assertEquals(0, run("--mode", "auto", "create-bucket", "docs"));
    assertEquals(List.of(StorageMode.MOCK), openedModes);

    assertEquals(0, run("--mode", "auto", "delete-bucket", "docs"));
    assertFalse(backend.bucketExists("docs"));
  }

  @Test
  void unknownModeFails() {
    assertEquals(1, run("--mode", "staging", "list"));
    assertTrue(err.toString().contains("Error: "));
    assertTrue(openedModes.isEmpty());
  }

  @Test
  void missingConfigFileFails() {
    assertEquals(1, run("--config", tempDir.resolve("absent.json").toString(), "list"));
    assertTrue(err.toString().contains("Config file not found"));
  }

  @Test
  void missingArgumentIsUsageError() {
    assertEquals(2, run("create-bucket"));
  }

  @Test
  void metadataParsing() throws Exception {
    assertEquals(Map.of(), BaseCommand.parseMetadata(null));
    assertEquals(Map.of("a", "1"), BaseCommand.parseMetadata("{\"a\":\"1\"}"));
    assertThrows(ConfigurationException.class, () -> BaseCommand.parseMetadata("[1, 2]"));
  }
}
