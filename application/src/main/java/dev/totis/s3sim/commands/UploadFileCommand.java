package dev.totis.s3sim.commands;

import dev.totis.s3sim.StorageFacade;
import dev.totis.s3sim.exception.StorageException;
import dev.totis.s3sim.response.TransferResult;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "upload-file", description = "Upload a local file.")
public class UploadFileCommand extends BaseCommand {

  @CommandLine.Parameters(index = "0", description = "Target bucket")
  private String bucket;

  @CommandLine.Parameters(index = "1", description = "Local file to upload")
  private Path filePath;

  @CommandLine.Parameters(index = "2", description = "Object key in the bucket")
  private String objectName;

  @CommandLine.Option(
      names = {"--metadata"},
      description = "Metadata as a JSON object of strings.")
  private String metadata;

  @Override
  protected int execute(StorageFacade facade) throws StorageException {
    TransferResult result =
        facade.uploadFile(bucket, objectName, filePath, parseMetadata(metadata), userId());
    out().printf("File '%s' uploaded to bucket '%s' successfully%n", objectName, bucket);
    reportMirror(result);
    return 0;
  }
}
