package de.ialistannen.glancesync.sync;

import java.util.List;

/**
 * The outcome of a run.
 *
 * @param master the name of the master
 * @param slaves the outcome for each slave, in the order they were given
 */
public record SyncReport(String master, List<SlaveReport> slaves) {

  public SyncReport {
    slaves = List.copyOf(slaves);
  }

  public boolean succeeded() {
    return slaves.stream().allMatch(SlaveReport::succeeded);
  }

  public int changedCount() {
    return slaves.stream().mapToInt(SlaveReport::changedCount).sum();
  }
}
