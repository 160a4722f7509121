// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/// A node of the graph supplied by the editor. The name is the identity of the node. The engine only ever reads these
/// and each simulation embeds its own copy.
///
/// @param name        The unique name of the node.
/// @param id          A numeric identifier. Chang-Roberts compares these so they should be unique for an election.
/// @param connections The ordered outgoing connections. Chang-Roberts forwards on the first one.
public record GraphNode(String name, long id, List<Connection> connections) {
  public GraphNode {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("GraphNode name must not be blank");
    }
    connections = List.copyOf(connections);
  }

  public GraphNode(String name, long id) {
    this(name, id, List.of());
  }

  /// Replace any existing connection to the same peer else append a new one.
  /// Java may get withers so that we can retire this method.
  public GraphNode withConnection(Connection connection) {
    final var updated = new ArrayList<>(connections);
    final var index = indexConnection(connection.other());
    if (index >= 0) {
      updated.set(index, connection);
    } else {
      updated.add(connection);
    }
    return new GraphNode(name, id, updated);
  }

  /// @return the position of the connection to `other` or -1 if there is none.
  public int indexConnection(String other) {
    return IntStream.range(0, connections.size())
        .filter(i -> connections.get(i).other().equals(other))
        .findFirst()
        .orElse(-1);
  }

  public boolean hasConnections() {
    return !connections.isEmpty();
  }
}
