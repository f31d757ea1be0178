package dev.totis.s3sim.commands;

import dev.totis.s3sim.StorageFacade;
import dev.totis.s3sim.exception.StorageException;
import dev.totis.s3sim.response.BucketDeletion;
import dev.totis.s3sim.response.CleanupReport;
import picocli.CommandLine;

@CommandLine.Command(
    name = "cleanup",
    description = "Remove local mirror trees and, on the mock backend, a bucket and its objects.")
public class CleanupCommand extends BaseCommand {

  @CommandLine.Parameters(index = "0", arity = "0..1", description = "Bucket")
  private String bucket;

  @CommandLine.Option(
      names = {"--local"},
      description = "Delete the local mirror (of the bucket, or all of it).")
  private boolean removeLocal;

  @CommandLine.Option(
      names = {"--bucket"},
      description = "Empty and delete the bucket. Ignored on the real backend.")
  private boolean removeBucket;

  @Override
  protected int execute(StorageFacade facade) throws StorageException {
    CleanupReport report = facade.cleanup(bucket, removeLocal, removeBucket);
    report.removedMirrorPaths().forEach(path -> out().println("Removed " + path));
    if (report.bucketDeletion() == BucketDeletion.DELETED) {
      out().printf(
          "Bucket '%s' deleted with %d object(s)%n", bucket, report.objectsDeleted());
    } else if (report.bucketDeletion() == BucketDeletion.REFUSED_BY_POLICY) {
      out().printf("Bucket '%s' kept: deletion is not allowed on the real backend%n", bucket);
    }
    return 0;
  }
}
