package dev.totis.s3sim.commands;

import dev.totis.s3sim.StorageFacade;
import dev.totis.s3sim.exception.StorageException;
import dev.totis.s3sim.response.BucketCreation;
import picocli.CommandLine;

@CommandLine.Command(name = "create-bucket", description = "Create a bucket.")
public class CreateBucketCommand extends BaseCommand {

  @CommandLine.Parameters(index = "0", description = "Name of the bucket to create")
  private String bucket;

  @Override
  protected int execute(StorageFacade facade) throws StorageException {
    BucketCreation outcome = facade.createBucket(bucket, userId());
    if (outcome == BucketCreation.ALREADY_OWNED) {
      out().printf("Bucket '%s' already exists and is owned by you%n", bucket);
    } else {
      out().printf("Bucket '%s' created successfully%n", bucket);
    }
    return 0;
  }
}
