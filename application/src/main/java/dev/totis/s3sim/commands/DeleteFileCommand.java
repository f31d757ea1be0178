package dev.totis.s3sim.commands;

import dev.totis.s3sim.StorageFacade;
import dev.totis.s3sim.exception.StorageException;
import dev.totis.s3sim.response.Deletion;
import picocli.CommandLine;

@CommandLine.Command(name = "delete-file", description = "Delete an object and its mirror copies.")
public class DeleteFileCommand extends BaseCommand {

  @CommandLine.Parameters(index = "0", description = "Bucket")
  private String bucket;

  @CommandLine.Parameters(index = "1", description = "Object key in the bucket")
  private String objectName;

  @Override
  protected int execute(StorageFacade facade) throws StorageException {
    if (facade.deleteFile(bucket, objectName, userId()) == Deletion.ALREADY_ABSENT) {
      out().printf("File '%s' is already absent from bucket '%s'%n", objectName, bucket);
    } else {
      out().printf("File '%s' deleted from bucket '%s' successfully%n", objectName, bucket);
    }
    return 0;
  }
}
