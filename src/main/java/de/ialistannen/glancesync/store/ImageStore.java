package de.ialistannen.glancesync.store;

import de.ialistannen.glancesync.model.ImageProperties;
import de.ialistannen.glancesync.model.ImageRecord;
import java.nio.file.Path;
import java.util.List;

/**
 * A single named image store. All methods block until the store answered and throw a {@link StoreException} if it did
 * not answer successfully. Nothing is retried.
 */
public interface ImageStore {

  /**
   * @return the configured name of this store, used for logging and bookkeeping
   */
  String name();

  /**
   * Lists all images in the store.
   *
   * @return all images, in the order the store returned them
   * @throws StoreUnavailableException if the listing or authentication failed
   */
  List<ImageRecord> listImages();

  /**
   * @param id the image id
   * @return the current metadata of the image
   */
  ImageRecord getImage(String id);

  /**
   * Opens the content of an image. The returned content must be consumed or closed exactly once.
   *
   * @param id the image id
   * @return the content of the image
   */
  ImageContent downloadImage(String id);

  /**
   * Creates a new image without any data.
   *
   * @param properties the metadata of the image
   * @return the created image, carrying the id the store assigned
   */
  ImageRecord createImage(ImageProperties properties);

  /**
   * Replaces the data of a previously created image with the content of a local file.
   *
   * @param id the image id
   * @param file the file to upload
   * @throws TransferException if the file could not be read
   */
  void uploadImage(String id, Path file);

  /**
   * @param id the image id
   * @param newName the new name of the image
   */
  void renameImage(String id, String newName);

  /**
   * @param id the image id
   */
  void deleteImage(String id);
}
