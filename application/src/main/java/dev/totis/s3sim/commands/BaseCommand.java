package dev.totis.s3sim.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.totis.s3sim.StorageFacade;
import dev.totis.s3sim.exception.ConfigurationException;
import dev.totis.s3sim.exception.StorageException;
import dev.totis.s3sim.response.TransferResult;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;

public abstract class BaseCommand implements Callable<Integer> {

  private static final ObjectMapper jsonReader = new ObjectMapper();

  @CommandLine.ParentCommand protected S3SimCommand root;

  @CommandLine.Spec protected CommandLine.Model.CommandSpec command;

  @Override
  public Integer call() throws StorageException {
    try (StorageFacade facade = root.openFacade()) {
      return execute(facade);
    }
  }

  protected abstract int execute(StorageFacade facade) throws StorageException;

  protected PrintWriter out() {
    return command.commandLine().getOut();
  }

  protected PrintWriter err() {
    return command.commandLine().getErr();
  }

  protected String userId() {
    return root.userId();
  }

  protected void reportMirror(TransferResult result) {
    result.warning().ifPresent(w -> err().println("Warning: local mirror not updated: " + w));
  }

  protected void printBuckets(List<String> buckets) {
    if (buckets.isEmpty()) {
      out().println("No buckets found");
      return;
    }
    out().println("Buckets:");
    buckets.forEach(name -> out().println("  " + name));
  }

  protected static Map<String, String> parseMetadata(String json) throws ConfigurationException {
    if (json == null) {
      return Map.of();
    }
    try {
      Map<String, String> metadata =
          jsonReader.readValue(json, new TypeReference<Map<String, String>>() {});
      return metadata == null ? Map.of() : metadata;
    } catch (JsonProcessingException e) {
      throw new ConfigurationException("metadata must be valid JSON", e);
    }
  }
}
