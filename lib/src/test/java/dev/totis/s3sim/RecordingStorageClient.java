package dev.totis.s3sim;

import dev.totis.s3sim.client.InMemoryObjectStorageClient;
import dev.totis.s3sim.exception.StorageException;
import java.util.ArrayList;
import java.util.List;

/** In-memory backend that records the bulk calls made against it. */
class RecordingStorageClient extends InMemoryObjectStorageClient {
  final List<Integer> deleteBatchSizes = new ArrayList<>();
  final List<String> deletedBuckets = new ArrayList<>();
  final List<String> calls = new ArrayList<>();

  @Override
  public List<String> deleteObjects(String bucket, List<String> keys) throws StorageException {
    deleteBatchSizes.add(keys.size());
    calls.add("deleteObjects");
    return super.deleteObjects(bucket, keys);
  }

  @Override
  public void deleteBucket(String bucket) throws StorageException {
    deletedBuckets.add(bucket);
    calls.add("deleteBucket");
    super.deleteBucket(bucket);
  }
}
