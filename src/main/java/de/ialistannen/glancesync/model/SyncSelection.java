package de.ialistannen.glancesync.model;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The images a run is concerned with. An image is selected if its name is listed or matches the pattern. If neither
 * names nor a pattern are given, every image is selected.
 *
 * @param names the explicitly selected names
 * @param pattern a regular expression anchored at the start of the name
 */
public record SyncSelection(Set<String> names, Optional<Pattern> pattern) {

  public SyncSelection {
    names = names == null ? Set.of() : Set.copyOf(names);
    pattern = pattern == null ? Optional.empty() : pattern;
  }

  public static SyncSelection all() {
    return new SyncSelection(Set.of(), Optional.empty());
  }

  public static SyncSelection of(Set<String> names, String pattern) {
    return new SyncSelection(names, Optional.ofNullable(pattern).filter(it -> !it.isEmpty()).map(Pattern::compile));
  }

  public boolean selectsAll() {
    return names.isEmpty() && pattern.isEmpty();
  }

  public boolean matches(String name) {
    if (selectsAll()) {
      return true;
    }
    if (names.contains(name)) {
      return true;
    }
    return pattern.map(it -> it.matcher(name).lookingAt()).orElse(false);
  }
}
