// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/// The local snapshot of one node. The state and the time are fixed when it is taken. The recorded messages are the
/// traffic the node decided was crossing the cut and are only ever appended to.
///
/// @param <M> the message type of the algorithm.
public class Snapshot<M extends SimMessage> {
  private final int state;
  private final long time;
  private final List<M> messages = new ArrayList<>();

  public Snapshot(int state, long time) {
    this.state = state;
    this.time = time;
  }

  public int state() {
    return state;
  }

  /// @return the Lamport time of the node when it took the snapshot.
  public long time() {
    return time;
  }

  public void record(M message) {
    messages.add(message);
  }

  public List<M> messages() {
    return Collections.unmodifiableList(messages);
  }

  @Override
  public String toString() {
    if (messages.isEmpty()) {
      return "Snapshot(" + state + ", [])";
    }
    return "Snapshot(" + state + ", [\n" + messages.stream()
        .map(m -> "    " + m)
        .collect(Collectors.joining("\n")) + "\n])";
  }
}
