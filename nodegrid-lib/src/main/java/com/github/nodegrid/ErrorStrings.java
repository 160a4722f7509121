// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid;

/// Messages shared between the exceptions we throw and the lines we append to the trace.
public final class ErrorStrings {
  public static final String EMPTY_GRID = "No nodes in grid.";
  public static final String UNKNOWN_PEER = "Connection to a node that does not exist: ";
  public static final String DUPLICATE_NAME = "Name not unique: ";
  public static final String NO_RING_SUCCESSOR = "Node has no outgoing connection to forward on: ";
  public static final String NO_SUCH_NODE = "FATAL no simulation node named: ";
  public static final String CLOCK_OVERFLOW = "FATAL logical clock overflow at node: ";

  private ErrorStrings() {
  }
}
