package de.ialistannen.glancesync.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The images of one store at one point in time, keyed by name and ordered like the store listed them.
 */
public class Catalog {

  private final String storeName;
  private final Map<String, ImageRecord> images;

  public Catalog(String storeName, Map<String, ImageRecord> images) {
    this.storeName = storeName;
    this.images = Collections.unmodifiableMap(new LinkedHashMap<>(images));
  }

  public String storeName() {
    return storeName;
  }

  public Optional<ImageRecord> get(String name) {
    return Optional.ofNullable(images.get(name));
  }

  public boolean contains(String name) {
    return images.containsKey(name);
  }

  public Collection<ImageRecord> images() {
    return images.values();
  }

  public int size() {
    return images.size();
  }

  @Override
  public String toString() {
    return "Catalog{" + storeName + ": " + images.keySet() + "}";
  }
}
