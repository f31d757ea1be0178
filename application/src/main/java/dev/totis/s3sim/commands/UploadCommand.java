package dev.totis.s3sim.commands;

import dev.totis.s3sim.StorageFacade;
import dev.totis.s3sim.exception.StorageException;
import dev.totis.s3sim.response.TransferResult;
import java.nio.file.Path;
import java.util.Map;
import picocli.CommandLine;

@CommandLine.Command(name = "upload", description = "Upload inline text content.")
public class UploadCommand extends BaseCommand {

  @CommandLine.Parameters(index = "0", description = "Target bucket")
  private String bucket;

  @CommandLine.Parameters(index = "1", description = "Object key in the bucket")
  private String objectName;

  @CommandLine.Parameters(
      index = "2",
      description = "Content to upload, or a file path when --file is given")
  private String content;

  @CommandLine.Option(
      names = {"--file"},
      description = "Treat the content argument as a file path.")
  private boolean file;

  @CommandLine.Option(
      names = {"--metadata"},
      description = "Metadata as a JSON object of strings.")
  private String metadata;

  @Override
  protected int execute(StorageFacade facade) throws StorageException {
    Map<String, String> parsed = parseMetadata(metadata);
    TransferResult result =
        file
            ? facade.uploadFile(bucket, objectName, Path.of(content), parsed, userId())
            : facade.uploadContent(bucket, objectName, content, parsed, userId());
    out().printf("File '%s' uploaded to bucket '%s' successfully%n", objectName, bucket);
    reportMirror(result);
    return 0;
  }
}
