package de.ialistannen.glancesync.cache;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Empties the scratch directory after a run.
 */
public class ScratchCleaner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScratchCleaner.class);

  /**
   * Deletes every regular file directly inside the directory. Subdirectories are left alone. A file that can not be
   * deleted is logged and skipped.
   *
   * @param scratchDir the directory to clean
   * @return the number of deleted files
   * @throws UncheckedIOException if the directory could not be listed
   */
  public int clean(Path scratchDir) {
    LOGGER.info("Cleaning scratch dir {}", scratchDir);
    if (!Files.isDirectory(scratchDir)) {
      LOGGER.debug("Scratch dir {} does not exist", scratchDir);
      return 0;
    }

    int deleted = 0;
    try (DirectoryStream<Path> files = Files.newDirectoryStream(scratchDir, Files::isRegularFile)) {
      for (Path file : files) {
        LOGGER.debug("Removing file: {}", file);
        try {
          Files.delete(file);
          deleted++;
        } catch (IOException e) {
          LOGGER.warn("Could not remove {}", file, e);
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Could not list scratch dir " + scratchDir, e);
    }
    return deleted;
  }
}
