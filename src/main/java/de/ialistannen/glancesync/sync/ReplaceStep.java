package de.ialistannen.glancesync.sync;

/**
 * The last completed step of replacing a stale image on a slave.
 */
public enum ReplaceStep {
  /**
   * The slave copy was found to be stale, nothing was changed yet.
   */
  STALE,
  /**
   * The stale copy now carries the backup name.
   */
  RENAMED_TO_BACKUP,
  /**
   * An empty image with the original name was created.
   */
  CREATED,
  /**
   * The data was uploaded into the new image.
   */
  UPLOADED
}
