package de.ialistannen.glancesync.model;

import java.util.List;
import java.util.Objects;

/**
 * The metadata used when creating an image. Identifier, checksum, size and status are assigned by the store and can
 * not be expressed here.
 * <p>
 * A {@code null} container format, disk format or visibility means "use the store default".
 *
 * @param name the image name
 * @param tags the tags, empty by default
 * @param containerFormat the container format
 * @param diskFormat the disk format
 * @param minRam the minimum ram in MB, 0 by default
 * @param minDisk the minimum disk in GB, 0 by default
 * @param visibility the visibility
 * @param isProtected whether the image is protected, false by default
 */
public record ImageProperties(
  String name,
  List<String> tags,
  String containerFormat,
  String diskFormat,
  int minRam,
  int minDisk,
  String visibility,
  boolean isProtected
) {

  public ImageProperties {
    Objects.requireNonNull(name, "name");
    tags = tags == null ? List.of() : List.copyOf(tags);
    if (minRam < 0 || minDisk < 0) {
      throw new IllegalArgumentException("min_ram and min_disk must not be negative");
    }
  }

  /**
   * @param name the image name
   * @return properties with only a name and defaults for everything else
   */
  public static ImageProperties named(String name) {
    return new ImageProperties(name, List.of(), null, null, 0, 0, null, false);
  }

  /**
   * Copies the transferable metadata of an existing image.
   *
   * @param record the image to copy from
   * @return the properties to create an identical image elsewhere
   */
  public static ImageProperties from(ImageRecord record) {
    return new ImageProperties(
      record.name(),
      record.tags(),
      record.containerFormat(),
      record.diskFormat(),
      record.minRam(),
      record.minDisk(),
      record.visibility(),
      record.isProtected()
    );
  }
}
