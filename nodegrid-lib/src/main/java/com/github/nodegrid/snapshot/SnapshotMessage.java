// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid.snapshot;

import com.github.nodegrid.SimMessage;

/// A message of a snapshot algorithm. Apart from the control markers these carry one unit of the diffusing
/// computation whose total the snapshot must recover.
public interface SnapshotMessage extends SimMessage {
  /// @return the Lamport time of the sender when it sent this message.
  long time();

  /// @return `+1` for an increment, `-1` for a decrement and `0` for a control message.
  int adjustment();

  boolean isMarker();

  /// @return true if a recorded copy of this message is part of the in-flight state of the cut.
  default boolean countsTowardsCut() {
    return !isMarker();
  }
}
