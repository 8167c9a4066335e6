package de.ialistannen.glancesync.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.ialistannen.glancesync.cache.DownloadCache;
import de.ialistannen.glancesync.model.ImageRecord;
import de.ialistannen.glancesync.model.SyncSelection;
import de.ialistannen.glancesync.selection.CatalogSelector;
import de.ialistannen.glancesync.store.InMemoryImageStore;
import de.ialistannen.glancesync.store.InMemoryImageStore.Operation;
import de.ialistannen.glancesync.store.StoreUnavailableException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReconcilerTest {

  @TempDir
  Path tempDir;

  private InMemoryImageStore master;
  private InMemoryImageStore slaveB;
  private InMemoryImageStore slaveC;
  private ReplaceJournal journal;
  private Reconciler reconciler;

  @BeforeEach
  void setUp() {
    master = new InMemoryImageStore("master");
    slaveB = new InMemoryImageStore("slave-b");
    slaveC = new InMemoryImageStore("slave-c");
    journal = new ReplaceJournal(tempDir.resolve("journal.json"));
    reconciler = newReconciler(1);
  }

  @Test
  void createsMissingImage() {
    ImageRecord ubuntu = master.add("ubuntu-20", new byte[100]);

    SyncReport report = sync(slaveB);

    List<ImageRecord> onSlave = slaveB.imagesNamed("ubuntu-20");
    assertEquals(1, onSlave.size());
    ImageRecord created = onSlave.get(0);
    assertEquals(100L, created.size());
    assertEquals(ubuntu.checksum(), created.checksum());
    assertEquals(ubuntu.diskFormat(), created.diskFormat());
    assertEquals(ubuntu.containerFormat(), created.containerFormat());
    assertEquals(ubuntu.minRam(), created.minRam());
    assertEquals(ubuntu.tags(), created.tags());
    assertFalse(created.id().equals(ubuntu.id()));
    assertEquals(List.of("ubuntu-20"), report.slaves().get(0).created());
    assertTrue(report.succeeded());
  }

  @Test
  void replacesStaleImageWithoutLeavingBackup() {
    ImageRecord centos = master.add("centos-8", bytes("centos 8, current build"));
    ImageRecord stale = slaveB.add("centos-8", bytes("centos 8, old build"));

    SyncReport report = sync(slaveB);

    List<ImageRecord> onSlave = slaveB.imagesNamed("centos-8");
    assertEquals(1, onSlave.size());
    assertEquals(centos.checksum(), onSlave.get(0).checksum());
    assertFalse(onSlave.get(0).id().equals(stale.id()));
    assertTrue(slaveB.imagesNamed("centos-8_sync_bak").isEmpty());
    assertTrue(journal.entriesFor("slave-b").isEmpty());
    assertEquals(List.of("centos-8"), report.slaves().get(0).replaced());
  }

  @Test
  void renamesBeforeCreatingAndDeletesLast() {
    master.add("centos-8", bytes("new"));
    slaveB.add("centos-8", bytes("old"));

    sync(slaveB);

    assertEquals(
      List.of(
        "LIST ",
        "RENAME centos-8",
        "CREATE centos-8",
        "UPLOAD centos-8",
        "DELETE centos-8_sync_bak"
      ),
      slaveB.operations()
    );
  }

  @Test
  void secondRunChangesNothing() {
    master.add("ubuntu-20", bytes("ubuntu"));
    master.add("centos-8", bytes("centos new"));
    slaveB.add("centos-8", bytes("centos old"));
    sync(slaveB);
    int operationsAfterFirstRun = slaveB.operations().size();

    SyncReport second = sync(slaveB);

    assertEquals(0, second.changedCount());
    assertEquals(Set.of("ubuntu-20", "centos-8"), Set.copyOf(second.slaves().get(0).inSync()));
    assertEquals(List.of("LIST "), slaveB.operations().subList(operationsAfterFirstRun, slaveB.operations().size()));
  }

  @Test
  void downloadsOnceForAllSlaves() {
    master.add("ubuntu-20", bytes("ubuntu"));

    reconciler.reconcile(master, List.of(slaveB, slaveC), SyncSelection.all(), scratchDir());

    assertEquals(1, master.count(Operation.DOWNLOAD));
    assertEquals(1, slaveB.imagesNamed("ubuntu-20").size());
    assertEquals(1, slaveC.imagesNamed("ubuntu-20").size());
  }

  @Test
  void failedReplacementAbortsOnlyThatSlave() {
    master.add("a", bytes("a"));
    ImageRecord x = master.add("x", bytes("x new"));
    master.add("z", bytes("z"));
    ImageRecord staleX = slaveB.add("x", bytes("x old"));
    slaveB.failOn(Operation.UPLOAD, "x");

    SyncReport report = reconciler.reconcile(master, List.of(slaveB, slaveC), SyncSelection.all(), scratchDir());

    SlaveReport reportB = report.slaves().get(0);
    assertFalse(reportB.succeeded());
    ReplaceSequenceException failure = assertInstanceOf(
      ReplaceSequenceException.class,
      reportB.failure().orElseThrow()
    );
    assertEquals("x", failure.imageName());
    assertEquals(ReplaceStep.CREATED, failure.lastCompletedStep());
    assertEquals(List.of("a"), reportB.created());
    assertTrue(slaveB.operations().stream().noneMatch(it -> it.endsWith(" z")), "z must not be attempted");

    // The stale copy survives under its backup name, the partial replacement is gone
    assertTrue(slaveB.imagesNamed("x").isEmpty());
    List<ImageRecord> backups = slaveB.imagesNamed("x_sync_bak");
    assertEquals(1, backups.size());
    assertEquals(staleX.id(), backups.get(0).id());
    assertEquals(ReplaceStep.CREATED, journal.find("slave-b", "x").orElseThrow().lastStep());

    SlaveReport reportC = report.slaves().get(1);
    assertTrue(reportC.succeeded());
    assertEquals(List.of("a", "x", "z"), reportC.created());
    assertEquals(x.checksum(), slaveC.imagesNamed("x").get(0).checksum());
    assertFalse(report.succeeded());
  }

  @Test
  void nextRunRestoresBackupAndRetries() {
    ImageRecord x = master.add("x", bytes("x new"));
    slaveB.add("x", bytes("x old"));
    slaveB.failOn(Operation.UPLOAD, "x");
    sync(slaveB);
    slaveB.clearFailures();

    SyncReport report = sync(slaveB);

    SlaveReport reportB = report.slaves().get(0);
    assertTrue(reportB.succeeded());
    assertEquals(List.of("x"), reportB.recovered());
    assertEquals(List.of("x"), reportB.replaced());
    assertEquals(1, slaveB.imagesNamed("x").size());
    assertEquals(x.checksum(), slaveB.imagesNamed("x").get(0).checksum());
    assertTrue(slaveB.imagesNamed("x_sync_bak").isEmpty());
    assertTrue(journal.entriesFor("slave-b").isEmpty());
  }

  @Test
  void failedBackupDeletionKeepsReplacementAndIsFinishedLater() {
    ImageRecord x = master.add("x", bytes("x new"));
    ImageRecord staleX = slaveB.add("x", bytes("x old"));
    slaveB.failOn(Operation.DELETE, "x_sync_bak");

    SyncReport first = sync(slaveB);

    assertFalse(first.succeeded());
    assertEquals(x.checksum(), slaveB.imagesNamed("x").get(0).checksum());
    assertEquals(staleX.id(), slaveB.imagesNamed("x_sync_bak").get(0).id());

    slaveB.clearFailures();
    SyncReport second = sync(slaveB);

    assertEquals(List.of("x"), second.slaves().get(0).recovered());
    assertEquals(List.of("x"), second.slaves().get(0).inSync());
    assertTrue(slaveB.imagesNamed("x_sync_bak").isEmpty());
    assertEquals(1, slaveB.imagesNamed("x").size());
  }

  @Test
  void failedRenameNeverDeletesStaleCopy() {
    master.add("x", bytes("x new"));
    ImageRecord staleX = slaveB.add("x", bytes("x old"));
    slaveB.failOn(Operation.RENAME, "x");

    SyncReport report = sync(slaveB);

    assertFalse(report.succeeded());
    assertEquals(List.of(staleX), slaveB.imagesNamed("x"));
    assertEquals(0, slaveB.count(Operation.DELETE));
    assertEquals(0, slaveB.count(Operation.CREATE));
  }

  @Test
  void brokenDownloadAbortsBeforeTouchingSlave() {
    ImageRecord x = master.add("x", bytes("x new, long enough to be cut in half"));
    ImageRecord staleX = slaveB.add("x", bytes("x old"));
    master.truncateDownloads(x.id());

    SyncReport report = sync(slaveB);

    assertFalse(report.succeeded());
    assertEquals(List.of(staleX), slaveB.imagesNamed("x"));
    assertEquals(0, slaveB.count(Operation.RENAME));
    assertTrue(journal.entriesFor("slave-b").isEmpty());
  }

  @Test
  void brokenDownloadLeavesSameNamedImagesAlone() {
    ImageRecord x = master.add("x", bytes("x new, long enough to be cut in half"));
    ImageRecord first = slaveB.add("x", bytes("x old"));
    ImageRecord second = slaveB.add("x", bytes("x older"));
    master.truncateDownloads(x.id());

    SyncReport report = sync(slaveB);

    assertFalse(report.succeeded());
    assertEquals(List.of(first, second), slaveB.imagesNamed("x"));
    assertEquals(0, slaveB.count(Operation.DELETE));
  }

  @Test
  void failedReplacementDeletesOnlyItsOwnImage() {
    master.add("x", bytes("x new"));
    ImageRecord first = slaveB.add("x", bytes("x old"));
    ImageRecord stale = slaveB.add("x", bytes("x older"));
    slaveB.failOn(Operation.UPLOAD, "x");

    sync(slaveB);

    assertEquals(List.of(first), slaveB.imagesNamed("x"));
    assertEquals(stale.id(), slaveB.imagesNamed("x_sync_bak").get(0).id());
    assertEquals(1, slaveB.count(Operation.DELETE));
  }

  @Test
  void recoveryWithoutRenameLeavesSameNamedImagesAlone() {
    ImageRecord x = master.add("x", bytes("x new"));
    ImageRecord other = slaveB.add("x", bytes("another x"));
    ImageRecord stale = slaveB.add("x", bytes("x old"));
    journal.record(new ReplaceJournal.Entry("slave-b", "x", stale.id(), null, ReplaceStep.STALE, Instant.now()));

    SyncReport report = sync(slaveB);

    assertEquals(List.of("x"), report.slaves().get(0).recovered());
    List<ImageRecord> onSlave = slaveB.imagesNamed("x");
    assertEquals(2, onSlave.size());
    assertEquals(other, onSlave.get(0));
    assertEquals(x.checksum(), onSlave.get(1).checksum());
    assertEquals(List.of("DELETE x_sync_bak"), deletes(slaveB));
  }

  @Test
  void sameNamedImageIsNotMistakenForFinishedReplacement() {
    master.add("x", bytes("x new"));
    ImageRecord backup = slaveB.add("x_sync_bak", bytes("x old"));
    slaveB.add("x", bytes("x new"));
    journal.record(
      new ReplaceJournal.Entry("slave-b", "x", backup.id(), null, ReplaceStep.RENAMED_TO_BACKUP, Instant.now())
    );

    SyncReport report = sync(slaveB);

    assertEquals(List.of("x"), report.slaves().get(0).recovered());
    assertEquals(List.of("x"), report.slaves().get(0).inSync());
    assertEquals(0, slaveB.count(Operation.DELETE));
    assertTrue(slaveB.imagesNamed("x_sync_bak").isEmpty());
    assertEquals(2, slaveB.imagesNamed("x").size());
  }

  @Test
  void masterImagesWithoutDataAreSkipped() {
    master.add(new ImageRecord(
      "master-queued", "aaa", null, null, "bare", "qcow2", "private", false, 0, 0, List.of(), "queued"
    ));
    master.add("zzz", bytes("zzz"));

    SyncReport first = sync(slaveB);

    assertTrue(first.succeeded());
    assertEquals(List.of("zzz"), first.slaves().get(0).created());
    assertTrue(slaveB.imagesNamed("aaa").isEmpty());
    assertEquals(1, master.count(Operation.DOWNLOAD));

    SyncReport second = sync(slaveB);

    assertTrue(second.succeeded());
    assertEquals(0, second.changedCount());
  }

  @Test
  void unreadableJournalFailsSlavesWithoutAbortingRun() throws Exception {
    master.add("a", bytes("a"));
    Files.writeString(tempDir.resolve("journal.json"), "{ not json");

    SyncReport report = reconciler.reconcile(master, List.of(slaveB, slaveC), SyncSelection.all(), scratchDir());

    assertFalse(report.succeeded());
    for (SlaveReport slave : report.slaves()) {
      assertInstanceOf(UncheckedIOException.class, slave.failure().orElseThrow());
    }
    assertEquals(0, slaveB.count(Operation.CREATE));
    assertEquals(0, slaveC.count(Operation.CREATE));
  }

  @Test
  void failedCreateDeletesPartialImage() {
    master.add("a", bytes("a"));
    master.add("b", bytes("b"));
    slaveB.failOn(Operation.UPLOAD, "a");

    SyncReport report = sync(slaveB);

    SlaveReport reportB = report.slaves().get(0);
    CreateFailedException failure = assertInstanceOf(CreateFailedException.class, reportB.failure().orElseThrow());
    assertEquals("a", failure.imageName());
    assertTrue(slaveB.images().isEmpty());
    assertEquals(0, slaveB.operations().stream().filter(it -> it.endsWith(" b")).count());
  }

  @Test
  void unavailableMasterAbortsRun() {
    master.add("a", bytes("a"));
    master.failOn(Operation.LIST, it -> true);

    assertThrows(
      StoreUnavailableException.class,
      () -> reconciler.reconcile(master, List.of(slaveB, slaveC), SyncSelection.all(), scratchDir())
    );
    assertTrue(slaveB.operations().isEmpty());
    assertTrue(slaveC.operations().isEmpty());
  }

  @Test
  void unavailableSlaveIsSkipped() {
    master.add("a", bytes("a"));
    slaveB.failOn(Operation.LIST, it -> true);

    SyncReport report = reconciler.reconcile(master, List.of(slaveB, slaveC), SyncSelection.all(), scratchDir());

    assertInstanceOf(StoreUnavailableException.class, report.slaves().get(0).failure().orElseThrow());
    assertTrue(report.slaves().get(1).succeeded());
    assertEquals(1, slaveC.imagesNamed("a").size());
  }

  @Test
  void equalSizeWithoutChecksumsCountsAsInSync() {
    master.add("img", bytes("0123456789"), null);
    ImageRecord onSlave = slaveB.add("img", bytes("9876543210"), "");

    SyncReport report = sync(slaveB);

    assertEquals(List.of("img"), report.slaves().get(0).inSync());
    assertEquals(List.of(onSlave), slaveB.imagesNamed("img"));
  }

  @Test
  void missingChecksumFallsBackToSize() {
    master.add("img", bytes("new and longer"));
    slaveB.add("img", bytes("old"), null);

    SyncReport report = sync(slaveB);

    assertEquals(List.of("img"), report.slaves().get(0).replaced());
  }

  @Test
  void comparesChecksumsWhenBothArePresent() {
    ImageRecord masterImage = record("abc", 100L);

    assertTrue(Reconciler.isInSync(masterImage, record("abc", 5L)));
    assertFalse(Reconciler.isInSync(masterImage, record("def", 100L)));
    assertTrue(Reconciler.isInSync(masterImage, record(null, 100L)));
    assertFalse(Reconciler.isInSync(record(null, null), record(null, 100L)));
  }

  @Test
  void onlySelectedImagesAreSynced() {
    master.add("ubuntu-20", bytes("ubuntu"));
    master.add("centos-8", bytes("centos"));
    slaveB.add("unrelated", bytes("stays"));

    reconciler.reconcile(master, List.of(slaveB), SyncSelection.of(Set.of(), "cent"), scratchDir());

    assertTrue(slaveB.imagesNamed("ubuntu-20").isEmpty());
    assertEquals(1, slaveB.imagesNamed("centos-8").size());
    assertEquals(1, slaveB.imagesNamed("unrelated").size());
  }

  @Test
  void journaledReplacementThatNeverRenamedIsDropped() {
    ImageRecord x = master.add("x", bytes("x"));
    ImageRecord onSlave = slaveB.add("x", bytes("x"));
    journal.record(new ReplaceJournal.Entry("slave-b", "x", onSlave.id(), null, ReplaceStep.STALE, Instant.now()));

    SyncReport report = sync(slaveB);

    assertEquals(List.of("x"), report.slaves().get(0).recovered());
    assertEquals(List.of("x"), report.slaves().get(0).inSync());
    assertEquals(x.checksum(), slaveB.imagesNamed("x").get(0).checksum());
    assertTrue(journal.entriesFor("slave-b").isEmpty());
  }

  @Test
  void failedRecoveryAbortsSlave() {
    master.add("x", bytes("x new"));
    ImageRecord backup = slaveB.add("x_sync_bak", bytes("x old"));
    journal.record(
      new ReplaceJournal.Entry("slave-b", "x", backup.id(), null, ReplaceStep.RENAMED_TO_BACKUP, Instant.now())
    );
    slaveB.failOn(Operation.RENAME, "x_sync_bak");

    SyncReport report = sync(slaveB);

    assertInstanceOf(ReplaceSequenceException.class, report.slaves().get(0).failure().orElseThrow());
    assertEquals(0, slaveB.count(Operation.CREATE));
    assertTrue(journal.find("slave-b", "x").isPresent());
  }

  @Test
  void parallelSlavesReportInGivenOrder() {
    master.add("a", bytes("a"));
    master.add("b", bytes("b"));
    Reconciler parallel = newReconciler(2);

    SyncReport report = parallel.reconcile(master, List.of(slaveB, slaveC), SyncSelection.all(), scratchDir());

    assertEquals(List.of("slave-b", "slave-c"), report.slaves().stream().map(SlaveReport::slave).toList());
    assertEquals(List.of("a", "b"), report.slaves().get(0).created());
    assertEquals(List.of("a", "b"), report.slaves().get(1).created());
    assertEquals(2, master.count(Operation.DOWNLOAD));
  }

  @Test
  void rejectsZeroParallelism() {
    assertThrows(IllegalArgumentException.class, () -> newReconciler(0));
  }

  private static List<String> deletes(InMemoryImageStore store) {
    return store.operations().stream().filter(it -> it.startsWith("DELETE ")).toList();
  }

  private Reconciler newReconciler(int parallelSlaves) {
    return new Reconciler(new CatalogSelector(), new DownloadCache(), journal, parallelSlaves);
  }

  private SyncReport sync(InMemoryImageStore slave) {
    return reconciler.reconcile(master, List.of(slave), SyncSelection.all(), scratchDir());
  }

  private Path scratchDir() {
    return tempDir.resolve("scratch");
  }

  private static ImageRecord record(String checksum, Long size) {
    return new ImageRecord("id", "img", size, checksum, null, null, null, false, 0, 0, List.of(), "active");
  }

  private static byte[] bytes(String content) {
    return content.getBytes(StandardCharsets.UTF_8);
  }
}
