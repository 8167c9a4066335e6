package de.ialistannen.glancesync.selection;

import de.ialistannen.glancesync.model.Catalog;
import de.ialistannen.glancesync.model.ImageRecord;
import de.ialistannen.glancesync.model.SyncSelection;
import de.ialistannen.glancesync.store.ImageStore;
import de.ialistannen.glancesync.store.StoreUnavailableException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link Catalog} of images in a store that a {@link SyncSelection} is concerned with.
 */
public class CatalogSelector {

  private static final Logger LOGGER = LoggerFactory.getLogger(CatalogSelector.class);

  /**
   * Lists the store and keeps every image the selection matches. Names are unique in the result: if the store reports
   * multiple images with the same name, the one listed last wins.
   *
   * @param store the store to list
   * @param selection the selection to apply
   * @return the selected images keyed by name
   * @throws StoreUnavailableException if the store could not be listed
   */
  public Catalog select(ImageStore store, SyncSelection selection) {
    Map<String, ImageRecord> selected = new LinkedHashMap<>();

    for (ImageRecord image : store.listImages()) {
      if (image.name() == null) {
        LOGGER.debug("Ignoring unnamed image {} on '{}'", image.id(), store.name());
        continue;
      }
      if (!selection.matches(image.name())) {
        continue;
      }

      ImageRecord previous = selected.put(image.name(), image);
      if (previous != null) {
        LOGGER.warn(
          "Store '{}' has multiple images named '{}' ({} and {}), using the latter",
          store.name(),
          image.name(),
          previous.id(),
          image.id()
        );
      }
    }

    LOGGER.info("Selected {} image(s) on '{}'", selected.size(), store.name());
    return new Catalog(store.name(), selected);
  }
}
