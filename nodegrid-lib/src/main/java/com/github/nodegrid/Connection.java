// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid;

import java.util.Objects;

/// An outgoing edge of a [GraphNode].
///
/// @param other  The name of the node at the far end of the connection.
/// @param weight The weight the editor attached to the edge. The algorithms here do not read it.
public record Connection(String other, double weight) {
  public Connection {
    Objects.requireNonNull(other, "other");
  }

  public Connection(String other) {
    this(other, 1.0);
  }
}
