package de.ialistannen.glancesync.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remembers how far each running replacement got, so a later run can finish or undo a replacement that was
 * interrupted. Every change is written to disk immediately.
 */
public class ReplaceJournal {

  private static final Logger LOGGER = LoggerFactory.getLogger(ReplaceJournal.class);

  private final Path storagePath;
  private final ObjectMapper objectMapper;
  private JournalDatabase currentDatabase;

  public ReplaceJournal(Path storagePath) {
    this.storagePath = storagePath;
    this.objectMapper = new ObjectMapper()
      .findAndRegisterModules()
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  /**
   * @param slave the name of the slave
   * @return all unfinished replacements on that slave
   */
  public synchronized List<Entry> entriesFor(String slave) {
    return database().entries().stream()
      .filter(it -> it.slave().equals(slave))
      .toList();
  }

  /**
   * @param slave the name of the slave
   * @param imageName the name of the image
   * @return the unfinished replacement of that image, if any
   */
  public synchronized Optional<Entry> find(String slave, String imageName) {
    return database().entries().stream()
      .filter(it -> it.slave().equals(slave) && it.imageName().equals(imageName))
      .findFirst();
  }

  /**
   * Adds the entry, replacing any previous entry for the same slave and image.
   *
   * @param entry the entry to store
   */
  public synchronized void record(Entry entry) {
    List<Entry> entries = new ArrayList<>(database().entries());
    entries.removeIf(it -> it.slave().equals(entry.slave()) && it.imageName().equals(entry.imageName()));
    entries.add(entry);
    save(new JournalDatabase(entries));
    LOGGER.debug("Journaled {} of '{}' on '{}'", entry.lastStep(), entry.imageName(), entry.slave());
  }

  /**
   * @param slave the name of the slave
   * @param imageName the name of the image
   */
  public synchronized void remove(String slave, String imageName) {
    List<Entry> entries = new ArrayList<>(database().entries());
    if (entries.removeIf(it -> it.slave().equals(slave) && it.imageName().equals(imageName))) {
      save(new JournalDatabase(entries));
    }
  }

  private JournalDatabase database() {
    if (currentDatabase == null) {
      currentDatabase = load();
      LOGGER.debug("Loaded {} unfinished replacement(s) from {}", currentDatabase.entries().size(), storagePath);
    }
    return currentDatabase;
  }

  private JournalDatabase load() {
    if (Files.notExists(storagePath)) {
      return new JournalDatabase(List.of());
    }
    try {
      return objectMapper.readValue(Files.readString(storagePath), JournalDatabase.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load replace journal from " + storagePath, e);
    }
  }

  private void save(JournalDatabase database) {
    try {
      Path parent = storagePath.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(storagePath, objectMapper.writeValueAsString(database));
      currentDatabase = database;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to save replace journal to " + storagePath, e);
    }
  }

  /**
   * One unfinished replacement.
   *
   * @param slave the name of the slave store
   * @param imageName the name of the replaced image
   * @param oldImageId the id of the stale copy on the slave
   * @param newImageId the id of the replacement or null if none was created yet
   * @param lastStep the last completed step
   * @param updated when the entry was last written
   */
  @JsonSerialize
  @JsonDeserialize
  public record Entry(
    String slave,
    String imageName,
    String oldImageId,
    String newImageId,
    ReplaceStep lastStep,
    Instant updated
  ) {

    public Entry advance(ReplaceStep step) {
      return new Entry(slave, imageName, oldImageId, newImageId, step, Instant.now());
    }

    public Entry withNewImage(String id, ReplaceStep step) {
      return new Entry(slave, imageName, oldImageId, id, step, Instant.now());
    }
  }

  @JsonSerialize
  @JsonDeserialize
  record JournalDatabase(List<Entry> entries) {

    JournalDatabase {
      entries = entries == null ? List.of() : List.copyOf(entries);
    }
  }
}
