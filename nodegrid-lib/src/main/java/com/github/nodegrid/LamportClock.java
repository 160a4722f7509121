// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid;

/// A Lamport logical clock as described in the paper Time, Clocks, and the Ordering of Events in a Distributed System.
/// Each simulated node owns one. It is not thread safe as a simulation run is single threaded.
///
/// Overflow is treated as fatal. We use [Math#addExact(long, long)] so that an overflow throws an
/// [ArithmeticException] that stops the run rather than wrapping around and silently breaking causality.
public class LamportClock {
  private long time = 0L;

  /// Advance the clock for a local event such as sending a message.
  ///
  /// @return the new time which should be stamped on the outbound message.
  public long tick() {
    time = Math.addExact(time, 1L);
    return time;
  }

  /// Merge the time of a received message. This must be the first thing done when handling a timestamped message.
  ///
  /// @param other the time stamped on the received message.
  /// @return the new time which is `max(this, other) + 1`.
  public long receive(long other) {
    time = Math.addExact(Math.max(time, other), 1L);
    return time;
  }

  public long time() {
    return time;
  }

  @Override
  public String toString() {
    return "LC(" + time + ")";
  }
}
