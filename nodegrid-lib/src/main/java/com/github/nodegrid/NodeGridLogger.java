// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid;

import java.util.logging.Logger;

/// We are using JUL logging to reduce dependencies. You can configure JUL logging to bridge to your chosen logging
/// framework. The per-run trace that callers display goes to the caller's log list, not here. This logger carries the
/// operational events: runs starting and finishing, per-message detail at FINE and invariant violations at SEVERE.
public final class NodeGridLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.nodegrid");

  private NodeGridLogger() {
  }
}
