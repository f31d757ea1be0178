package dev.totis.s3sim.commands;

import dev.totis.s3sim.StorageFacade;
import dev.totis.s3sim.exception.StorageException;
import dev.totis.s3sim.response.BucketDeletion;
import picocli.CommandLine;

@CommandLine.Command(
    name = "delete-bucket",
    description = "Delete a bucket. Only allowed on the mock backend.")
public class DeleteBucketCommand extends BaseCommand {

  @CommandLine.Parameters(index = "0", description = "Name of the bucket to delete")
  private String bucket;

  @CommandLine.Option(
      names = {"--force"},
      description = "Remove all objects first.")
  private boolean force;

  @Override
  protected int execute(StorageFacade facade) throws StorageException {
    if (facade.deleteBucket(bucket, force) == BucketDeletion.REFUSED_BY_POLICY) {
      err().printf("Bucket deletion is not allowed on the %s backend%n", facade.mode().id());
      return 1;
    }
    out().printf("Bucket '%s' deleted successfully%n", bucket);
    return 0;
  }
}
