package dev.totis.s3sim.commands;

import dev.totis.s3sim.StorageFacade;
import dev.totis.s3sim.exception.StorageException;
import dev.totis.s3sim.exception.UncheckedStorageException;
import picocli.CommandLine;

@CommandLine.Command(
    name = "list",
    description = "List the objects of a bucket, or all buckets when no bucket is given.")
public class ListCommand extends BaseCommand {

  @CommandLine.Parameters(index = "0", arity = "0..1", description = "Bucket")
  private String bucket;

  @CommandLine.Option(
      names = {"--prefix"},
      defaultValue = "",
      description = "Key prefix to filter by.")
  private String prefix;

  @Override
  protected int execute(StorageFacade facade) throws StorageException {
    if (bucket == null) {
      printBuckets(facade.listBuckets());
      return 0;
    }

    boolean any = false;
    try {
      for (String key : facade.listFiles(bucket, prefix, userId())) {
        if (!any) {
          out().printf("Objects in bucket '%s':%n", bucket);
          any = true;
        }
        out().println("  " + key);
      }
    } catch (UncheckedStorageException e) {
      throw e.getCause();
    }
    if (!any) {
      out().printf("No objects found in bucket '%s'%n", bucket);
    }
    return 0;
  }
}
