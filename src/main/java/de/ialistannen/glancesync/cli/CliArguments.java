package de.ialistannen.glancesync.cli;

import java.util.List;
import java.util.Optional;
import net.jbock.Command;
import net.jbock.Option;

@Command(name = "glance-sync", description = "Syncs images from a master glance server to slaves", publicParser = true)
public interface CliArguments {

  @Option(
    names = "--config",
    description = "Path to the config file. Default: 'glance-sync.json'",
    paramLabel = "PATH"
  )
  Optional<String> configPath();

  @Option(
    names = {"--tmpdir", "-t"},
    description = "Directory for storing downloaded images. Default: '<java.io.tmpdir>/glance-sync'",
    paramLabel = "DIR"
  )
  Optional<String> tmpdir();

  @Option(names = {"--pattern", "-p"}, description = "Pattern matching the start of images to sync", paramLabel = "REGEX")
  Optional<String> pattern();

  @Option(
    names = {"--images", "-i"},
    description = "Images to sync, repeatable or separated with commas",
    paramLabel = "NAME"
  )
  List<String> images();

  @Option(names = {"--master", "-m"}, description = "Name of the master server from 'glance_servers'", paramLabel = "NAME")
  Optional<String> master();

  @Option(
    names = {"--slaves", "-s"},
    description = "Names of the servers from 'glance_servers' to sync to, repeatable or separated with commas",
    paramLabel = "NAME"
  )
  List<String> slaves();

  @Option(names = {"--verbose", "-v"}, description = "Log debug output")
  boolean verbose();

  @Option(names = {"--clean", "-c"}, description = "Clean the tmpdir after syncing images")
  boolean clean();

  @Option(
    names = "--parallel-slaves",
    description = "How many slaves to sync at the same time. Default: 1",
    paramLabel = "COUNT"
  )
  Optional<Integer> parallelSlaves();
}
