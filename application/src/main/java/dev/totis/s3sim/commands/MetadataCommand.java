package dev.totis.s3sim.commands;

import dev.totis.s3sim.StorageFacade;
import dev.totis.s3sim.exception.StorageException;
import java.util.Map;
import java.util.TreeMap;
import picocli.CommandLine;

@CommandLine.Command(name = "metadata", description = "Print the metadata attached to an object.")
public class MetadataCommand extends BaseCommand {

  @CommandLine.Parameters(index = "0", description = "Bucket")
  private String bucket;

  @CommandLine.Parameters(index = "1", description = "Object key in the bucket")
  private String objectName;

  @Override
  protected int execute(StorageFacade facade) throws StorageException {
    Map<String, String> metadata =
        new TreeMap<>(facade.getObjectMetadata(bucket, objectName, userId()));
    if (metadata.isEmpty()) {
      out().printf("No metadata on '%s'%n", objectName);
    }
    metadata.forEach((key, value) -> out().printf("%s: %s%n", key, value));
    return 0;
  }
}
