package dev.totis.s3sim.commands;

import dev.totis.s3sim.StorageFacade;
import dev.totis.s3sim.exception.StorageException;
import picocli.CommandLine;

@CommandLine.Command(name = "read-file", description = "Print an object's text content.")
public class ReadFileCommand extends BaseCommand {

  @CommandLine.Parameters(index = "0", description = "Source bucket")
  private String bucket;

  @CommandLine.Parameters(index = "1", description = "Object key in the bucket")
  private String objectName;

  @Override
  protected int execute(StorageFacade facade) throws StorageException {
    out().println(facade.readFile(bucket, objectName, userId()));
    return 0;
  }
}
