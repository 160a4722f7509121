// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid;

/// The algorithms that can be run over a [NodeGrid].
public enum SelectedAlgorithm {
  CHANDY_LAMPORT("Chandy-Lamport", "snapshot"),
  LAI_YANG("Lai-Yang", "snapshot"),
  CHANG_ROBERTS("Chang-Roberts", "election");

  private final String displayName;
  private final String kind;

  SelectedAlgorithm(String displayName, String kind) {
    this.displayName = displayName;
    this.kind = kind;
  }

  public String displayName() {
    return displayName;
  }

  /// @return the trace line written when a run of this algorithm starts.
  public String startedLine(int nodeCount) {
    return "Started " + displayName + " " + kind + " with " + nodeCount + " nodes.";
  }

  @Override
  public String toString() {
    return displayName;
  }
}
