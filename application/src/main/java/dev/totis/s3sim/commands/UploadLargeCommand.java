package dev.totis.s3sim.commands;

import dev.totis.s3sim.StorageFacade;
import dev.totis.s3sim.exception.StorageException;
import dev.totis.s3sim.response.TransferResult;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "upload-large", description = "Upload a large file in parts.")
public class UploadLargeCommand extends BaseCommand {

  @CommandLine.Parameters(index = "0", description = "Target bucket")
  private String bucket;

  @CommandLine.Parameters(index = "1", description = "Object key in the bucket")
  private String objectName;

  @CommandLine.Parameters(index = "2", description = "Local file to upload")
  private Path filePath;

  @CommandLine.Option(
      names = {"--part-size"},
      description = "Size of each part in bytes. Default: 5 MiB.")
  private long partSize = StorageFacade.DEFAULT_PART_SIZE;

  @CommandLine.Option(
      names = {"--metadata"},
      description = "Metadata as a JSON object of strings.")
  private String metadata;

  @Override
  protected int execute(StorageFacade facade) throws StorageException {
    TransferResult result =
        facade.uploadLargeFile(
            bucket, objectName, filePath, partSize, parseMetadata(metadata), userId());
    out().printf(
        "Large file '%s' uploaded to bucket '%s' successfully (%d bytes)%n",
        objectName, bucket, result.size());
    reportMirror(result);
    return 0;
  }
}
