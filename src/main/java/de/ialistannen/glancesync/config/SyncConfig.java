package de.ialistannen.glancesync.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.google.common.base.Throwables;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The contents of the configuration file.
 * <pre>{@code
 * {
 *   "base": { "master": "region-a", "slaves": ["region-b"], "tmpdir": "/var/tmp/glance-sync", "clean": true },
 *   "glance_servers": {
 *     "region-a": { "url": "http://glance-a", "password": "secret" },
 *     "region-b": { "url": "http://glance-b", "password": "secret", "auth_url": "http://keystone-b" }
 *   },
 *   "images": { "sync_list": ["ubuntu-22.04"], "pattern": "centos-" }
 * }
 * }</pre>
 *
 * @param base the run settings
 * @param glanceServers all known stores by name
 * @param images the image selection
 */
public record SyncConfig(BaseSection base, Map<String, ServerConfig> glanceServers, ImagesSection images) {

  public SyncConfig {
    base = base == null ? new BaseSection(null, null, null, null, null, null) : base;
    glanceServers = glanceServers == null ? Map.of() : Map.copyOf(glanceServers);
    images = images == null ? new ImagesSection(null, null) : images;
  }

  /**
   * Reads a configuration file. Unknown keys are rejected.
   *
   * @param path the path to the file
   * @return the read configuration
   * @throws IOException if the file could not be read or is malformed
   * @throws ConfigException if a value in the file is invalid
   */
  public static SyncConfig load(Path path) throws IOException {
    try {
      return objectMapper().readValue(Files.readString(path), SyncConfig.class);
    } catch (JsonMappingException e) {
      // Jackson wraps exceptions thrown by record constructors
      Optional<ConfigException> invalidValue = Throwables.getCausalChain(e).stream()
        .filter(ConfigException.class::isInstance)
        .map(ConfigException.class::cast)
        .findFirst();
      if (invalidValue.isPresent()) {
        throw new ConfigException(invalidValue.get().getMessage() + " (at " + e.getPathReference() + ")", e);
      }
      throw e;
    }
  }

  static ObjectMapper objectMapper() {
    return new ObjectMapper()
      .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
      .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
      .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /**
   * @param master the name of the master store
   * @param slaves the names of the slave stores
   * @param tmpdir the scratch directory for downloaded images
   * @param clean whether to empty the scratch directory after the run
   * @param journal the file unfinished replacements are recorded in
   * @param parallelSlaves how many slaves to sync at the same time
   */
  public record BaseSection(
    String master,
    List<String> slaves,
    String tmpdir,
    Boolean clean,
    String journal,
    Integer parallelSlaves
  ) {

    public BaseSection {
      slaves = slaves == null ? List.of() : List.copyOf(slaves);
    }
  }

  /**
   * @param syncList the names of the images to sync
   * @param pattern a pattern matching the names of further images to sync
   */
  public record ImagesSection(List<String> syncList, String pattern) {

    public ImagesSection {
      syncList = syncList == null ? List.of() : List.copyOf(syncList);
    }
  }
}
