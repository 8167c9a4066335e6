package de.ialistannen.glancesync.sync;

import de.ialistannen.glancesync.model.ImageProperties;
import de.ialistannen.glancesync.model.ImageRecord;
import de.ialistannen.glancesync.store.ImageStore;
import java.nio.file.Path;
import java.time.Instant;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces a stale image on a slave without ever leaving the slave without a copy of it:
 * <ol>
 *   <li>fetch the master's data</li>
 *   <li>rename the stale copy to its backup name</li>
 *   <li>create a new image with the original name</li>
 *   <li>upload the data</li>
 *   <li>delete the backup</li>
 * </ol>
 * Every completed step is written to the {@link ReplaceJournal}. If a step fails, the image created by this sequence
 * is deleted and the journal entry is kept for {@link JournalRecovery}.
 */
class ReplaceSequence {

  private static final Logger LOGGER = LoggerFactory.getLogger(ReplaceSequence.class);

  static final String BACKUP_SUFFIX = "_sync_bak";

  private final ImageStore slave;
  private final ReplaceJournal journal;
  private final ImageRecord masterImage;
  private final ImageRecord staleImage;

  private ReplaceJournal.Entry entry;

  ReplaceSequence(ImageStore slave, ReplaceJournal journal, ImageRecord masterImage, ImageRecord staleImage) {
    this.slave = slave;
    this.journal = journal;
    this.masterImage = masterImage;
    this.staleImage = staleImage;
  }

  /**
   * @param name the name of an image
   * @return the name a stale copy carries while it is being replaced
   */
  static String backupName(String name) {
    return name + BACKUP_SUFFIX;
  }

  /**
   * Runs the sequence.
   *
   * @param localCopy provides the verified local copy of the master's data
   * @throws ReplaceSequenceException if any step failed
   */
  void run(Supplier<Path> localCopy) {
    String name = masterImage.name();
    entry = new ReplaceJournal.Entry(slave.name(), name, staleImage.id(), null, ReplaceStep.STALE, Instant.now());

    try {
      Path file = localCopy.get();
      journal.record(entry);

      slave.renameImage(staleImage.id(), backupName(name));
      advance(ReplaceStep.RENAMED_TO_BACKUP);

      ImageRecord created = slave.createImage(ImageProperties.from(masterImage));
      entry = entry.withNewImage(created.id(), ReplaceStep.CREATED);
      journal.record(entry);

      slave.uploadImage(created.id(), file);
      advance(ReplaceStep.UPLOADED);

      slave.deleteImage(staleImage.id());
      journal.remove(slave.name(), name);
      LOGGER.info("Replaced image '{}' on '{}' ({} -> {})", name, slave.name(), staleImage.id(), created.id());
    } catch (RuntimeException e) {
      LOGGER.error(
        "Error when replacing image '{}' on '{}' after step {}: {}",
        name,
        slave.name(),
        entry.lastStep(),
        e.getMessage()
      );
      ReplaceSequenceException failure = new ReplaceSequenceException(
        name,
        entry.lastStep(),
        "Replacing image '" + name + "' on '" + slave.name() + "' failed after step " + entry.lastStep(),
        e
      );
      rollback(failure);
      throw failure;
    }
  }

  private void advance(ReplaceStep step) {
    entry = entry.advance(step);
    journal.record(entry);
  }

  /**
   * Deletes the image this sequence created, if it got that far. Nothing else is touched: the stale copy keeps its
   * backup name until the next run recovers it, and other images sharing the name were never ours to delete.
   * <p>
   * If only deleting the backup failed, the replacement is complete and is kept.
   */
  private void rollback(ReplaceSequenceException failure) {
    if (entry.lastStep() == ReplaceStep.UPLOADED) {
      LOGGER.warn(
        "Replacement of '{}' on '{}' is complete, backup {} is left for the next run",
        masterImage.name(),
        slave.name(),
        staleImage.id()
      );
      return;
    }
    if (entry.newImageId() == null) {
      LOGGER.debug("Nothing was created for '{}' on '{}', nothing to roll back", masterImage.name(), slave.name());
      return;
    }
    try {
      LOGGER.info("Deleting partial image '{}' ({}) on '{}'", masterImage.name(), entry.newImageId(), slave.name());
      slave.deleteImage(entry.newImageId());
    } catch (RuntimeException e) {
      LOGGER.error("Cleanup after failed replacement of '{}' on '{}' failed", masterImage.name(), slave.name(), e);
      failure.addSuppressed(e);
    }
  }
}
