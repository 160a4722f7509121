// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid.snapshot;

import com.github.nodegrid.SimNode;
import com.github.nodegrid.Snapshot;

import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;

/// A node taking part in a snapshot algorithm. It holds an abstract account balance that background traffic moves
/// around the graph.
public interface SnapshotNode<M extends SnapshotMessage> extends SimNode<M> {
  int state();

  Optional<Snapshot<M>> snapshot();

  /// Record the local state and return the control messages announcing it.
  List<M> takeSnapshot(List<String> log);

  /// Send one random increment or decrement on a random outgoing connection. The sender moves its own balance by the
  /// opposite sign so that the total of the system is conserved while the message is in flight.
  M sendRandom(RandomGenerator rng, List<String> log);

  default boolean hasConnections() {
    return node().hasConnections();
  }

  /// @return true once this node knows its part of the cut is final.
  default boolean isComplete() {
    return snapshot().isPresent();
  }
}
