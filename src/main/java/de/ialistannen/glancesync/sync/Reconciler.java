package de.ialistannen.glancesync.sync;

import de.ialistannen.glancesync.cache.DownloadCache;
import de.ialistannen.glancesync.model.Catalog;
import de.ialistannen.glancesync.model.ImageProperties;
import de.ialistannen.glancesync.model.ImageRecord;
import de.ialistannen.glancesync.model.SyncSelection;
import de.ialistannen.glancesync.selection.CatalogSelector;
import de.ialistannen.glancesync.store.ImageStore;
import de.ialistannen.glancesync.store.StoreUnavailableException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings slaves in line with the master for the selected images. Missing images are created, stale ones are replaced
 * using a {@link ReplaceSequence}. Nothing is ever deleted from a slave unless it was replaced.
 * <p>
 * A failure on one slave aborts the remaining images of that slave only. Slaves may be processed in parallel, but the
 * images of one slave are always handled one after another.
 */
public class Reconciler {

  private static final Logger LOGGER = LoggerFactory.getLogger(Reconciler.class);

  private final CatalogSelector selector;
  private final DownloadCache downloadCache;
  private final ReplaceJournal journal;
  private final JournalRecovery recovery;
  private final int parallelSlaves;

  /**
   * @param selector the selector to build catalogs with
   * @param downloadCache the cache to fetch master images through
   * @param journal the journal to record replacements in
   * @param parallelSlaves how many slaves to process at the same time
   */
  public Reconciler(
    CatalogSelector selector,
    DownloadCache downloadCache,
    ReplaceJournal journal,
    int parallelSlaves
  ) {
    if (parallelSlaves < 1) {
      throw new IllegalArgumentException("Need to process at least one slave at a time, got " + parallelSlaves);
    }
    this.selector = selector;
    this.downloadCache = downloadCache;
    this.journal = journal;
    this.recovery = new JournalRecovery(journal);
    this.parallelSlaves = parallelSlaves;
  }

  /**
   * Syncs the selected images from the master to every slave.
   *
   * @param master the master store
   * @param slaves the slave stores
   * @param selection the images to sync
   * @param scratchDir the directory to cache downloaded images in
   * @return what happened on every slave
   * @throws StoreUnavailableException if the master could not be listed. No slave is touched in that case
   */
  public SyncReport reconcile(ImageStore master, List<ImageStore> slaves, SyncSelection selection, Path scratchDir) {
    Catalog masterCatalog = withData(selector.select(master, selection));
    LOGGER.info("Syncing {} image(s) from '{}' to {} slave(s)", masterCatalog.size(), master.name(), slaves.size());

    List<SlaveReport> reports;
    if (parallelSlaves == 1 || slaves.size() <= 1) {
      reports = new ArrayList<>();
      for (ImageStore slave : slaves) {
        reports.add(reconcileSlave(master, masterCatalog, slave, selection, scratchDir));
      }
    } else {
      reports = reconcileParallel(master, masterCatalog, slaves, selection, scratchDir);
    }

    SyncReport report = new SyncReport(master.name(), reports);
    LOGGER.info(
      "Finished sync from '{}': {} image(s) changed, {} of {} slave(s) failed",
      master.name(),
      report.changedCount(),
      reports.stream().filter(it -> !it.succeeded()).count(),
      reports.size()
    );
    return report;
  }

  /**
   * Drops master images that have no data to transfer, e.g. {@code queued} or {@code killed} ones. They can not be
   * downloaded and would otherwise abort every slave on every run.
   */
  private static Catalog withData(Catalog masterCatalog) {
    Map<String, ImageRecord> active = new LinkedHashMap<>();
    for (ImageRecord image : masterCatalog.images()) {
      if (!image.isActive()) {
        LOGGER.warn(
          "Skipping image '{}' ({}) on master '{}', its status is '{}'",
          image.name(),
          image.id(),
          masterCatalog.storeName(),
          image.status()
        );
        continue;
      }
      active.put(image.name(), image);
    }
    return new Catalog(masterCatalog.storeName(), active);
  }

  private List<SlaveReport> reconcileParallel(
    ImageStore master,
    Catalog masterCatalog,
    List<ImageStore> slaves,
    SyncSelection selection,
    Path scratchDir
  ) {
    ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelSlaves, slaves.size()));
    try {
      List<Future<SlaveReport>> futures = new ArrayList<>();
      for (ImageStore slave : slaves) {
        futures.add(executor.submit(() -> reconcileSlave(master, masterCatalog, slave, selection, scratchDir)));
      }

      List<SlaveReport> reports = new ArrayList<>();
      for (Future<SlaveReport> future : futures) {
        reports.add(future.get());
      }
      return reports;
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new IllegalStateException("Slave sync failed unexpectedly", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for slaves", e);
    } finally {
      executor.shutdownNow();
    }
  }

  private SlaveReport reconcileSlave(
    ImageStore master,
    Catalog masterCatalog,
    ImageStore slave,
    SyncSelection selection,
    Path scratchDir
  ) {
    LOGGER.info("Syncing slave '{}'", slave.name());

    List<String> recovered = new ArrayList<>();
    List<String> created = new ArrayList<>();
    List<String> replaced = new ArrayList<>();
    List<String> inSync = new ArrayList<>();

    try {
      recovered.addAll(recovery.recover(slave));

      Catalog slaveCatalog = selector.select(slave, selection);

      for (ImageRecord masterImage : masterCatalog.images()) {
        Optional<ImageRecord> slaveImage = slaveCatalog.get(masterImage.name());

        if (slaveImage.isEmpty()) {
          LOGGER.info("Image '{}' is missing on '{}', creating it", masterImage.name(), slave.name());
          createImage(master, slave, masterImage, scratchDir);
          created.add(masterImage.name());
          continue;
        }

        if (isInSync(masterImage, slaveImage.get())) {
          LOGGER.debug("Image '{}' is up to date on '{}'", masterImage.name(), slave.name());
          inSync.add(masterImage.name());
          continue;
        }

        LOGGER.info("Image '{}' is out of date on '{}', replacing it", masterImage.name(), slave.name());
        new ReplaceSequence(slave, journal, masterImage, slaveImage.get())
          .run(() -> fetch(master, masterImage, scratchDir));
        replaced.add(masterImage.name());
      }
    } catch (StoreUnavailableException e) {
      LOGGER.error("Could not list images of slave '{}', skipping it", slave.name(), e);
      return new SlaveReport(slave.name(), recovered, created, replaced, inSync, Optional.of(e));
    } catch (UncheckedIOException e) {
      LOGGER.error("Could not read replace journal for slave '{}', skipping it", slave.name(), e);
      return new SlaveReport(slave.name(), recovered, created, replaced, inSync, Optional.of(e));
    } catch (CreateFailedException | ReplaceSequenceException e) {
      LOGGER.error("Aborting sync of slave '{}'", slave.name(), e);
      return new SlaveReport(slave.name(), recovered, created, replaced, inSync, Optional.of(e));
    }

    LOGGER.info(
      "Slave '{}' done: {} created, {} replaced, {} up to date",
      slave.name(),
      created.size(),
      replaced.size(),
      inSync.size()
    );
    return new SlaveReport(slave.name(), recovered, created, replaced, inSync, Optional.empty());
  }

  private void createImage(ImageStore master, ImageStore slave, ImageRecord masterImage, Path scratchDir) {
    ImageRecord createdImage = null;
    try {
      Path file = fetch(master, masterImage, scratchDir);
      createdImage = slave.createImage(ImageProperties.from(masterImage));
      slave.uploadImage(createdImage.id(), file);
      LOGGER.info("Created image '{}' on '{}' ({})", masterImage.name(), slave.name(), createdImage.id());
    } catch (RuntimeException e) {
      LOGGER.error("Error when creating image '{}' on '{}': {}", masterImage.name(), slave.name(), e.getMessage());
      CreateFailedException failure = new CreateFailedException(
        masterImage.name(),
        "Creating image '" + masterImage.name() + "' on '" + slave.name() + "' failed",
        e
      );
      if (createdImage != null) {
        deletePartialImage(slave, createdImage, failure);
      }
      throw failure;
    }
  }

  private void deletePartialImage(ImageStore slave, ImageRecord image, CreateFailedException failure) {
    try {
      LOGGER.info("Deleting partial image '{}' ({}) on '{}'", image.name(), image.id(), slave.name());
      slave.deleteImage(image.id());
    } catch (RuntimeException e) {
      LOGGER.error("Could not delete partial image '{}' ({}) on '{}'", image.name(), image.id(), slave.name(), e);
      failure.addSuppressed(e);
    }
  }

  private Path fetch(ImageStore master, ImageRecord masterImage, Path scratchDir) {
    Path file = downloadCache.ensureLocal(master, masterImage.id(), masterImage.size(), scratchDir);
    DownloadCache.verifyComplete(file, masterImage.size());
    return file;
  }

  /**
   * Compares by checksum if both sides know theirs and by size otherwise. Two images of equal size without checksums
   * are therefore considered equal.
   *
   * @param masterImage the master's image
   * @param slaveImage the slave's image of the same name
   * @return true if the slave's image does not need to be replaced
   */
  static boolean isInSync(ImageRecord masterImage, ImageRecord slaveImage) {
    if (masterImage.hasChecksum() && slaveImage.hasChecksum()) {
      return masterImage.checksum().equals(slaveImage.checksum());
    }
    return Objects.equals(masterImage.size(), slaveImage.size());
  }
}
