package dev.totis.s3sim.commands;

import dev.totis.s3sim.StorageFacade;
import dev.totis.s3sim.exception.StorageException;
import picocli.CommandLine;

@CommandLine.Command(name = "list-buckets", description = "List all buckets.")
public class ListBucketsCommand extends BaseCommand {

  @Override
  protected int execute(StorageFacade facade) throws StorageException {
    printBuckets(facade.listBuckets());
    return 0;
  }
}
