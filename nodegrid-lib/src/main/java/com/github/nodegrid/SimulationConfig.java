// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid;

import java.util.Optional;

/// How much random background traffic the snapshot algorithms inject to make sure there are messages crossing the
/// cut.
///
/// @param preSnapshotTraffic  Messages sent before the initiator takes its snapshot.
/// @param postSnapshotTraffic Messages sent straight after the initiator takes its snapshot.
/// @param trafficPerResponse  Messages sent each time a handler sends something while the queue is drained.
public record SimulationConfig(int preSnapshotTraffic, int postSnapshotTraffic, int trafficPerResponse) {
  public static final SimulationConfig DEFAULT = new SimulationConfig(5, 5, 3);

  /// No background traffic at all. Useful to check a snapshot of a quiet system.
  public static final SimulationConfig QUIET = new SimulationConfig(0, 0, 0);

  public static final String PRE_SNAPSHOT_PROPERTY = "nodegrid.traffic.pre";
  public static final String POST_SNAPSHOT_PROPERTY = "nodegrid.traffic.post";
  public static final String PER_RESPONSE_PROPERTY = "nodegrid.traffic.response";

  public SimulationConfig {
    if (preSnapshotTraffic < 0 || postSnapshotTraffic < 0 || trafficPerResponse < 0) {
      throw new IllegalArgumentException("background traffic must not be negative: pre=" + preSnapshotTraffic
          + ", post=" + postSnapshotTraffic + ", response=" + trafficPerResponse);
    }
  }

  /// Read the traffic settings from system properties falling back to [#DEFAULT] for any that are not set.
  public static SimulationConfig fromSystemProperties() {
    return new SimulationConfig(
        intProperty(PRE_SNAPSHOT_PROPERTY, DEFAULT.preSnapshotTraffic),
        intProperty(POST_SNAPSHOT_PROPERTY, DEFAULT.postSnapshotTraffic),
        intProperty(PER_RESPONSE_PROPERTY, DEFAULT.trafficPerResponse)
    );
  }

  private static int intProperty(String key, int fallback) {
    return Optional.ofNullable(System.getProperty(key))
        .map(String::trim)
        .map(value -> {
          try {
            return Integer.parseInt(value);
          } catch (NumberFormatException e) {
            throw new IllegalArgumentException("system property " + key + " is not an integer: " + value, e);
          }
        })
        .orElse(fallback);
  }
}
