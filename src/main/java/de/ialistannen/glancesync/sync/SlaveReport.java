package de.ialistannen.glancesync.sync;

import java.util.List;
import java.util.Optional;

/**
 * What happened on one slave during a run.
 *
 * @param slave the name of the slave
 * @param recovered images whose unfinished replacement from an earlier run was recovered
 * @param created images that were missing and were created
 * @param replaced images that were stale and were replaced
 * @param inSync images that were already up to date
 * @param failure the error that aborted the slave, if any
 */
public record SlaveReport(
  String slave,
  List<String> recovered,
  List<String> created,
  List<String> replaced,
  List<String> inSync,
  Optional<RuntimeException> failure
) {

  public SlaveReport {
    recovered = List.copyOf(recovered);
    created = List.copyOf(created);
    replaced = List.copyOf(replaced);
    inSync = List.copyOf(inSync);
  }

  public boolean succeeded() {
    return failure.isEmpty();
  }

  /**
   * @return the number of images that were created or replaced
   */
  public int changedCount() {
    return created.size() + replaced.size();
  }
}
