// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid.snapshot;

/// The outcome of checking a snapshot run.
///
/// @param complete     Whether every node finished its part of the cut.
/// @param nodeTotal    The sum of the recorded node states.
/// @param messageTotal The sum of the adjustments of the recorded in-flight messages.
/// @param totalAtCut   The true global total when the initiator took its snapshot.
public record SnapshotVerdict(boolean complete, long nodeTotal, long messageTotal, long totalAtCut) {

  public long recoveredTotal() {
    return nodeTotal + messageTotal;
  }

  /// @return true if the snapshot recovered the total of the system at the cut.
  public boolean consistent() {
    return complete && recoveredTotal() == totalAtCut;
  }

  @Override
  public String toString() {
    if (!complete) {
      return "Snapshot did not complete.";
    }
    return "Node total: " + nodeTotal + ", Message total: " + messageTotal + ", Total at cut: " + totalAtCut;
  }
}
