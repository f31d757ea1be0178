package dev.totis.s3sim.commands;

import dev.totis.s3sim.ModeDetector;
import dev.totis.s3sim.StorageClientFactory;
import dev.totis.s3sim.StorageFacade;
import dev.totis.s3sim.StorageMode;
import dev.totis.s3sim.auth.CredentialsResolver;
import dev.totis.s3sim.config.ConfigFile;
import dev.totis.s3sim.config.ConfigLoader;
import dev.totis.s3sim.config.StorageSettings;
import dev.totis.s3sim.exception.ConfigurationException;
import dev.totis.s3sim.exception.StorageException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import picocli.CommandLine;

@CommandLine.Command(
    name = "s3sim",
    mixinStandardHelpOptions = true,
    description = "Bucket and object operations against a mock or real S3 backend.",
    subcommands = {
      CreateBucketCommand.class,
      ListBucketsCommand.class,
      DeleteBucketCommand.class,
      UploadFileCommand.class,
      UploadCommand.class,
      UploadLargeCommand.class,
      DownloadFileCommand.class,
      ReadFileCommand.class,
      MetadataCommand.class,
      DeleteFileCommand.class,
      ListCommand.class,
      CleanupCommand.class
    })
public class S3SimCommand {

  @CommandLine.Option(
      names = {"--mode"},
      defaultValue = "mock",
      description = "Backend to use: mock, real or auto. Default: ${DEFAULT-VALUE}.")
  private String mode;

  @CommandLine.Option(
      names = {"--endpoint"},
      description = "S3 endpoint URL (overrides S3_ENDPOINT_URL and the config file).")
  private String endpoint;

  @CommandLine.Option(
      names = {"--profile"},
      description = "AWS profile name for authentication.")
  private String profile;

  @CommandLine.Option(
      names = {"--region"},
      description = "AWS region.")
  private String region;

  @CommandLine.Option(
      names = {"--config"},
      description = "Path to the JSON config file. Default: " + ConfigLoader.DEFAULT_CONFIG_FILE)
  private Path configPath;

  @CommandLine.Option(
      names = {"--mirror-root"},
      description = "Directory holding the local mirror.")
  private Path mirrorRoot;

  @CommandLine.Option(
      names = {"--user"},
      description = "User id for permission checks.")
  private String userId;

  @CommandLine.Option(
      names = {"-v", "--verbose"},
      description = "Verbose logging.")
  private boolean verbose;

  private final Map<String, String> environment;
  private final FacadeFactory facadeFactory;

  public S3SimCommand() {
    this(System.getenv(), StorageFacade::create);
  }

  public S3SimCommand(Map<String, String> environment, FacadeFactory facadeFactory) {
    this.environment = environment;
    this.facadeFactory = facadeFactory;
  }

  String userId() {
    return userId;
  }

  StorageFacade openFacade() throws StorageException {
    return facadeFactory.open(resolveSettings());
  }

  StorageSettings resolveSettings() throws StorageException {
    StorageSettings settings =
        StorageSettings.builder()
            .withConfigFile(loadConfig())
            .withEnvironment(environment)
            .withEndpoint(endpoint)
            .withRegion(region)
            .withProfile(profile)
            .withMirrorBase(mirrorRoot)
            .withDefaultUserId(userId)
            .build();

    if ("auto".equalsIgnoreCase(mode)) {
      StorageClientFactory clientFactory =
          new StorageClientFactory(new CredentialsResolver(environment));
      return new ModeDetector(clientFactory).detect(settings);
    }
    return settings.toBuilder().withMode(StorageMode.parse(mode)).build();
  }

  private ConfigFile loadConfig() throws ConfigurationException {
    if (configPath != null && !Files.exists(configPath)) {
      throw new ConfigurationException("Config file not found: " + configPath);
    }
    return ConfigLoader.load(
        configPath != null ? configPath : Paths.get(ConfigLoader.DEFAULT_CONFIG_FILE));
  }
}
