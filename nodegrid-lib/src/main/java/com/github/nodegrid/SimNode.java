// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid;

import java.util.List;

/// The per-algorithm state of a simulated node. Implementations embed their own copy of the [GraphNode] so that a
/// run can mutate simulation state without touching the graph being edited. The handler is the only place where node
/// state changes and new messages are created.
///
/// @param <M> the message type of the algorithm.
public interface SimNode<M extends SimMessage> {
  GraphNode node();

  default String name() {
    return node().name();
  }

  /// Consume one delivered message.
  ///
  /// @param message the message addressed to this node.
  /// @param log     the trace of the run that the handler appends to.
  /// @return a possibly empty list of messages to send out.
  List<M> handle(M message, List<String> log);
}
