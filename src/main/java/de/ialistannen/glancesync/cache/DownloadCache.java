package de.ialistannen.glancesync.cache;

import de.ialistannen.glancesync.store.ImageContent;
import de.ialistannen.glancesync.store.ImageStore;
import de.ialistannen.glancesync.store.TransferException;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps downloaded images in a scratch directory, named after their id in the store they came from. A file is reused as
 * long as its size matches the size the store reports.
 * <p>
 * Requests for the same image id are serialized within one instance. Separate processes sharing a scratch directory are
 * not coordinated.
 */
public class DownloadCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadCache.class);

  private final ConcurrentMap<String, Object> locks;

  public DownloadCache() {
    this.locks = new ConcurrentHashMap<>();
  }

  /**
   * Makes sure the data of an image is available locally.
   * <p>
   * A failed transfer is logged and the partially written file is kept, so the next run detects the size mismatch.
   * Callers must use {@link #verifyComplete(Path, Long)} before trusting the returned file.
   *
   * @param store the store to download from
   * @param imageId the id of the image in that store
   * @param expectedSize the size the store reported for the image. A {@code null} size never matches
   * @param scratchDir the directory to keep the files in
   * @return the path of the local file
   * @throws UncheckedIOException if the scratch directory or a stale file could not be handled
   */
  public Path ensureLocal(ImageStore store, String imageId, Long expectedSize, Path scratchDir) {
    synchronized (locks.computeIfAbsent(imageId, ignored -> new Object())) {
      try {
        return ensureLocalLocked(store, imageId, expectedSize, scratchDir);
      } catch (IOException e) {
        throw new UncheckedIOException("Could not prepare cache file for image " + imageId, e);
      }
    }
  }

  private Path ensureLocalLocked(ImageStore store, String imageId, Long expectedSize, Path scratchDir)
    throws IOException {
    Files.createDirectories(scratchDir);
    Path file = scratchDir.resolve(imageId);

    if (Files.isRegularFile(file)) {
      long localSize = Files.size(file);
      if (expectedSize != null && localSize == expectedSize) {
        LOGGER.info("Using cached copy of image {} ({} bytes)", imageId, localSize);
        return file;
      }
      LOGGER.info("Cached copy of image {} has {} bytes but expected {}, discarding it", imageId, localSize, expectedSize);
      Files.delete(file);
    }

    LOGGER.info("Downloading image {} from '{}' to {}", imageId, store.name(), file);
    try (ImageContent content = store.downloadImage(imageId); OutputStream out = Files.newOutputStream(file)) {
      long written = content.writeTo(out);
      LOGGER.info("Downloaded image {} ({} bytes)", imageId, written);
    } catch (IOException e) {
      LOGGER.error("Error when downloading image {}, keeping partial file {}", imageId, file, e);
    }

    return file;
  }

  /**
   * Verifies a file returned by {@link #ensureLocal(ImageStore, String, Long, Path)} holds the whole image.
   *
   * @param file the local file
   * @param expectedSize the size reported by the store or null if unknown
   * @throws TransferException if the file is missing or has the wrong size
   */
  public static void verifyComplete(Path file, Long expectedSize) {
    if (!Files.isRegularFile(file)) {
      throw new TransferException("Image data " + file + " is missing");
    }
    long actualSize;
    try {
      actualSize = Files.size(file);
    } catch (IOException e) {
      throw new TransferException("Could not read size of " + file, e);
    }
    if (expectedSize != null && !Objects.equals(actualSize, expectedSize)) {
      throw new TransferException(
        "Image data " + file + " is incomplete, has " + actualSize + " of " + expectedSize + " bytes"
      );
    }
  }
}
