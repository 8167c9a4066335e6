package de.ialistannen.glancesync.sync;

import de.ialistannen.glancesync.model.ImageRecord;
import de.ialistannen.glancesync.store.ImageStore;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finishes or undoes replacements a previous run could not complete, based on the {@link ReplaceJournal}.
 * <ul>
 *   <li>If the stale copy is gone, there is nothing left to do.</li>
 *   <li>If the stale copy still carries its original name, the rename never happened. A journaled replacement is
 *   deleted.</li>
 *   <li>If the stale copy carries the backup name and the journaled replacement is active, the replacement made it and
 *   the backup is deleted.</li>
 *   <li>Otherwise the journaled replacement is deleted and the backup is renamed back to the original name.</li>
 * </ul>
 * Only the image the journal names as replacement is ever deleted besides the backup. Other images sharing the name
 * are left alone.
 */
class JournalRecovery {

  private static final Logger LOGGER = LoggerFactory.getLogger(JournalRecovery.class);

  private final ReplaceJournal journal;

  JournalRecovery(ReplaceJournal journal) {
    this.journal = journal;
  }

  /**
   * Recovers all journaled replacements of the slave.
   *
   * @param slave the slave to recover
   * @return the names of the recovered images
   * @throws ReplaceSequenceException if a replacement could not be recovered. Its journal entry is kept
   */
  List<String> recover(ImageStore slave) {
    List<ReplaceJournal.Entry> entries = journal.entriesFor(slave.name());
    if (entries.isEmpty()) {
      return List.of();
    }
    LOGGER.info("Recovering {} unfinished replacement(s) on '{}'", entries.size(), slave.name());

    for (ReplaceJournal.Entry entry : entries) {
      try {
        recover(slave, entry, slave.listImages());
        journal.remove(slave.name(), entry.imageName());
      } catch (RuntimeException e) {
        LOGGER.error(
          "Could not recover replacement of '{}' on '{}' (last step {})",
          entry.imageName(),
          slave.name(),
          entry.lastStep(),
          e
        );
        throw new ReplaceSequenceException(
          entry.imageName(),
          entry.lastStep(),
          "Recovering replacement of '" + entry.imageName() + "' on '" + slave.name() + "' failed",
          e
        );
      }
    }

    return entries.stream().map(ReplaceJournal.Entry::imageName).toList();
  }

  private void recover(ImageStore slave, ReplaceJournal.Entry entry, List<ImageRecord> images) {
    String name = entry.imageName();
    Optional<ImageRecord> staleImage = findById(images, entry.oldImageId());

    if (staleImage.isEmpty()) {
      LOGGER.info("Stale copy of '{}' on '{}' is already gone", name, slave.name());
      return;
    }

    Optional<ImageRecord> replacement = Optional.ofNullable(entry.newImageId())
      .flatMap(id -> findById(images, id));

    if (name.equals(staleImage.get().name())) {
      LOGGER.info("Stale copy of '{}' on '{}' was never renamed", name, slave.name());
      replacement.ifPresent(it -> deletePartial(slave, it));
      return;
    }

    if (replacement.isPresent() && replacement.get().isActive() && name.equals(replacement.get().name())) {
      LOGGER.info(
        "Replacement {} of '{}' on '{}' is complete, deleting backup {}",
        replacement.get().id(),
        name,
        slave.name(),
        entry.oldImageId()
      );
      slave.deleteImage(entry.oldImageId());
      return;
    }

    replacement.ifPresent(it -> deletePartial(slave, it));
    LOGGER.info("Restoring backup {} of '{}' on '{}'", entry.oldImageId(), name, slave.name());
    slave.renameImage(entry.oldImageId(), name);
  }

  private static Optional<ImageRecord> findById(List<ImageRecord> images, String id) {
    return images.stream()
      .filter(it -> it.id().equals(id))
      .findFirst();
  }

  private void deletePartial(ImageStore slave, ImageRecord image) {
    LOGGER.info("Deleting partial image '{}' ({}) on '{}'", image.name(), image.id(), slave.name());
    slave.deleteImage(image.id());
  }
}
