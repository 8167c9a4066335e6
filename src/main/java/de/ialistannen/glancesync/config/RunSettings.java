package de.ialistannen.glancesync.config;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import de.ialistannen.glancesync.model.SyncSelection;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.PatternSyntaxException;

/**
 * The settings of one run: the configuration file with command line overrides applied.
 *
 * @param master the master store
 * @param slaves the slave stores in the order they are synced
 * @param selection the images to sync
 * @param scratchDir the directory downloaded images are cached in
 * @param clean whether to empty the scratch directory afterwards
 * @param journal the file unfinished replacements are recorded in
 * @param parallelSlaves how many slaves to sync at the same time
 */
public record RunSettings(
  NamedServer master,
  List<NamedServer> slaves,
  SyncSelection selection,
  Path scratchDir,
  boolean clean,
  Path journal,
  int parallelSlaves
) {

  public static final Path DEFAULT_SCRATCH_DIR = Path.of(System.getProperty("java.io.tmpdir"), "glance-sync");
  public static final Path DEFAULT_JOURNAL = Path.of("data/replace-journal.json");

  private static final Splitter LIST_SPLITTER = Splitter.on(CharMatcher.anyOf(", ")).trimResults().omitEmptyStrings();

  /**
   * Merges the configuration with the overrides. Every override that is present wins over the file.
   *
   * @param config the configuration file
   * @param overrides the command line overrides
   * @return the settings for the run
   * @throws ConfigException if master or slaves are missing or unknown
   */
  public static RunSettings resolve(SyncConfig config, Overrides overrides) {
    Map<String, ServerConfig> servers = config.glanceServers();

    String masterName = overrides.master()
      .or(() -> Optional.ofNullable(config.base().master()))
      .orElseThrow(() -> new ConfigException("No master given, pass --master or set base.master"));

    List<String> slaveNames = split(overrides.slaves().isEmpty() ? config.base().slaves() : overrides.slaves());
    if (slaveNames.isEmpty()) {
      throw new ConfigException("No slaves given, pass --slaves or set base.slaves");
    }
    if (slaveNames.contains(masterName)) {
      throw new ConfigException("'" + masterName + "' can not be master and slave at the same time");
    }

    NamedServer master = lookup(servers, masterName, "master");
    List<NamedServer> slaves = new ArrayList<>();
    for (String slaveName : slaveNames) {
      slaves.add(lookup(servers, slaveName, "slave"));
    }

    List<String> imageNames = split(
      overrides.images().isEmpty() ? config.images().syncList() : overrides.images()
    );
    String pattern = overrides.pattern().orElse(config.images().pattern());
    SyncSelection selection;
    try {
      selection = SyncSelection.of(new LinkedHashSet<>(imageNames), pattern);
    } catch (PatternSyntaxException e) {
      throw new ConfigException("Invalid image pattern '" + pattern + "'", e);
    }

    Path scratchDir = overrides.tmpdir()
      .or(() -> Optional.ofNullable(config.base().tmpdir()))
      .map(Path::of)
      .orElse(DEFAULT_SCRATCH_DIR);
    boolean clean = overrides.clean() || Boolean.TRUE.equals(config.base().clean());
    Path journal = Optional.ofNullable(config.base().journal()).map(Path::of).orElse(DEFAULT_JOURNAL);

    int parallelSlaves = overrides.parallelSlaves()
      .or(() -> Optional.ofNullable(config.base().parallelSlaves()))
      .orElse(1);
    if (parallelSlaves < 1) {
      throw new ConfigException("parallel_slaves must be at least 1, got " + parallelSlaves);
    }

    return new RunSettings(master, slaves, selection, scratchDir, clean, journal, parallelSlaves);
  }

  private static NamedServer lookup(Map<String, ServerConfig> servers, String name, String role) {
    ServerConfig server = servers.get(name);
    if (server == null) {
      throw new ConfigException("Couldn't find " + role + " '" + name + "' in glance_servers");
    }
    return new NamedServer(name, server);
  }

  private static List<String> split(List<String> values) {
    return values.stream()
      .flatMap(LIST_SPLITTER::splitToStream)
      .distinct()
      .toList();
  }

  /**
   * A configured server together with the name it is configured under.
   *
   * @param name the name of the server
   * @param config its settings
   */
  public record NamedServer(String name, ServerConfig config) {

  }

  /**
   * Values given on the command line. Empty values fall back to the configuration file.
   *
   * @param master the master name
   * @param slaves the slave names, possibly comma separated
   * @param images the image names, possibly comma separated
   * @param pattern the image pattern
   * @param tmpdir the scratch directory
   * @param clean whether to clean the scratch directory
   * @param parallelSlaves how many slaves to sync at the same time
   */
  public record Overrides(
    Optional<String> master,
    List<String> slaves,
    List<String> images,
    Optional<String> pattern,
    Optional<String> tmpdir,
    boolean clean,
    Optional<Integer> parallelSlaves
  ) {

    public static Overrides none() {
      return new Overrides(
        Optional.empty(),
        List.of(),
        List.of(),
        Optional.empty(),
        Optional.empty(),
        false,
        Optional.empty()
      );
    }
  }
}
