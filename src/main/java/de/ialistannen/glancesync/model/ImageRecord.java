package de.ialistannen.glancesync.model;

import java.util.List;

/**
 * Remote metadata for one image, as reported by a single store.
 *
 * @param id the store-assigned identifier. Only meaningful within the store that reported it
 * @param name the name, used to correlate the same logical image across stores
 * @param size the size in bytes, null if the store has no data for the image yet
 * @param checksum the store-computed checksum, null or empty if unknown
 * @param containerFormat the container format (e.g. {@code bare})
 * @param diskFormat the disk format (e.g. {@code qcow2})
 * @param visibility the visibility (e.g. {@code private})
 * @param isProtected whether the image is protected from deletion
 * @param minRam the minimum ram in MB
 * @param minDisk the minimum disk in GB
 * @param tags the tags
 * @param status the lifecycle status (e.g. {@code active}, {@code queued})
 */
public record ImageRecord(
  String id,
  String name,
  Long size,
  String checksum,
  String containerFormat,
  String diskFormat,
  String visibility,
  boolean isProtected,
  int minRam,
  int minDisk,
  List<String> tags,
  String status
) {

  public static final String STATUS_ACTIVE = "active";

  public ImageRecord {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public boolean hasChecksum() {
    return checksum != null && !checksum.isEmpty();
  }

  public boolean isActive() {
    return STATUS_ACTIVE.equals(status);
  }
}
