package dev.totis.s3sim.commands;

import dev.totis.s3sim.StorageFacade;
import dev.totis.s3sim.exception.StorageException;
import dev.totis.s3sim.response.TransferResult;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "download-file", description = "Download an object to a local file.")
public class DownloadFileCommand extends BaseCommand {

  @CommandLine.Parameters(index = "0", description = "Source bucket")
  private String bucket;

  @CommandLine.Parameters(index = "1", description = "Object key in the bucket")
  private String objectName;

  @CommandLine.Parameters(index = "2", description = "Local destination path")
  private Path downloadPath;

  @Override
  protected int execute(StorageFacade facade) throws StorageException {
    TransferResult result = facade.downloadFile(bucket, objectName, downloadPath, userId());
    out().printf("File '%s' downloaded to '%s'%n", objectName, downloadPath);
    reportMirror(result);
    return 0;
  }
}
