// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid;

import java.util.random.RandomGenerator;

/// The delivery policy of the channels of an algorithm. All channels of a run share one pending queue and messages are
/// always delivered from the front of it. The policies only differ in where a newly sent message lands.
///
/// Each algorithm message type declares its discipline as a constant that is handed to the [Simulation] so that the
/// policy of a message type cannot be mixed up at the call site.
public enum ChannelDiscipline {
  /// Messages are received in the same order they were sent. Chandy-Lamport needs this so that a marker on a channel
  /// arrives before anything sent after it on that channel.
  FIFO {
    @Override
    int insertionIndex(int size, RandomGenerator rng) {
      return size;
    }
  },
  /// Messages may be received in any order irrespective of the order they were sent. A new message lands at an index
  /// drawn uniformly from `[0, size]` so it may end up at the front or at the back.
  NON_FIFO {
    @Override
    int insertionIndex(int size, RandomGenerator rng) {
      return rng.nextInt(size + 1);
    }
  };

  /// @param size the current number of pending messages.
  /// @param rng  the source of randomness of the run.
  /// @return the index at which a new message is inserted.
  abstract int insertionIndex(int size, RandomGenerator rng);
}
