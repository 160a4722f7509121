// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid;

/// SimMessage is the base interface for the messages of every simulated algorithm. Messages are routed by name.
public interface SimMessage {
  /// @return the name of the node that sent this message.
  String sender();

  /// @return the name of the node that this message is intended for.
  String destination();
}
