package de.ialistannen.glancesync;

import ch.qos.logback.classic.Level;
import com.google.common.base.Throwables;
import de.ialistannen.glancesync.cache.DownloadCache;
import de.ialistannen.glancesync.cache.ScratchCleaner;
import de.ialistannen.glancesync.cli.CliArguments;
import de.ialistannen.glancesync.cli.CliArgumentsParser;
import de.ialistannen.glancesync.config.ConfigException;
import de.ialistannen.glancesync.config.RunSettings;
import de.ialistannen.glancesync.config.RunSettings.NamedServer;
import de.ialistannen.glancesync.config.RunSettings.Overrides;
import de.ialistannen.glancesync.config.ServerConfig;
import de.ialistannen.glancesync.config.SyncConfig;
import de.ialistannen.glancesync.selection.CatalogSelector;
import de.ialistannen.glancesync.store.ImageStore;
import de.ialistannen.glancesync.store.StoreUnavailableException;
import de.ialistannen.glancesync.store.glance.GlanceImageStore;
import de.ialistannen.glancesync.store.glance.KeystoneAuthenticator;
import de.ialistannen.glancesync.store.glance.KeystoneAuthenticator.KeystoneCredentials;
import de.ialistannen.glancesync.sync.Reconciler;
import de.ialistannen.glancesync.sync.ReplaceJournal;
import de.ialistannen.glancesync.sync.SlaveReport;
import de.ialistannen.glancesync.sync.SyncReport;
import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {

  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  private static final Path DEFAULT_CONFIG = Path.of("glance-sync.json");
  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);

  public static void main(String[] args) {
    CliArguments arguments = new CliArgumentsParser().parseOrExit(args);
    if (arguments.verbose()) {
      enableDebugLogging();
    }

    RunSettings settings = loadSettings(arguments);

    HttpClient httpClient = HttpClient.newBuilder()
      .connectTimeout(CONNECT_TIMEOUT)
      .followRedirects(HttpClient.Redirect.NORMAL)
      .build();

    ImageStore master = buildStore(httpClient, settings.master());
    List<ImageStore> slaves = settings.slaves().stream()
      .map(it -> buildStore(httpClient, it))
      .toList();

    Reconciler reconciler = new Reconciler(
      new CatalogSelector(),
      new DownloadCache(),
      new ReplaceJournal(settings.journal()),
      settings.parallelSlaves()
    );

    SyncReport report;
    try {
      report = reconciler.reconcile(master, slaves, settings.selection(), settings.scratchDir());
    } catch (StoreUnavailableException e) {
      LOGGER.error("Could not list images of master '{}'", master.name(), e);
      throw die("Master unavailable, nothing was synced");
    }

    if (settings.clean()) {
      int deleted = new ScratchCleaner().clean(settings.scratchDir());
      LOGGER.info("Removed {} file(s) from {}", deleted, settings.scratchDir());
    }

    for (SlaveReport slave : report.slaves()) {
      slave.failure().ifPresent(e -> LOGGER.error(
        "Slave '{}' failed: {} (caused by: {})",
        slave.slave(),
        e.getMessage(),
        Throwables.getRootCause(e).toString()
      ));
    }
    if (!report.succeeded()) {
      throw die("Sync finished with errors");
    }
  }

  private static RunSettings loadSettings(CliArguments arguments) {
    Path configPath = arguments.configPath().map(Path::of).orElse(DEFAULT_CONFIG);
    if (!Files.isRegularFile(configPath)) {
      throw die("Didn't find config file: " + configPath);
    }

    try {
      LOGGER.info("Loading config from '{}'", configPath);
      SyncConfig config = SyncConfig.load(configPath);
      return RunSettings.resolve(config, toOverrides(arguments));
    } catch (IOException e) {
      LOGGER.error("Failed to read config file {}", configPath, e);
      throw die("Failed to read config file");
    } catch (ConfigException e) {
      LOGGER.error(
        "Failed during read configuration, probably you missed something in the config or arguments: {}",
        e.getMessage()
      );
      throw die("Invalid configuration");
    }
  }

  private static Overrides toOverrides(CliArguments arguments) {
    return new Overrides(
      arguments.master(),
      arguments.slaves(),
      arguments.images(),
      arguments.pattern(),
      arguments.tmpdir(),
      arguments.clean(),
      arguments.parallelSlaves()
    );
  }

  private static ImageStore buildStore(HttpClient httpClient, NamedServer server) {
    ServerConfig config = server.config();
    LOGGER.debug("Using {} as '{}'", config, server.name());

    KeystoneAuthenticator authenticator = new KeystoneAuthenticator(
      httpClient,
      config.identityEndpoint(),
      new KeystoneCredentials(config.username(), config.password(), config.tenant(), config.domain()),
      config.timeout()
    );
    return new GlanceImageStore(
      server.name(),
      config.imageEndpoint(),
      authenticator,
      httpClient,
      config.timeout(),
      config.transferTimeout()
    );
  }

  private static void enableDebugLogging() {
    Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
      logbackRoot.setLevel(Level.DEBUG);
    }
  }

  private static RuntimeException die(String msg) {
    LOGGER.error(msg);
    System.exit(1);

    return new RuntimeException();
  }
}
