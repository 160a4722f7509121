// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid.snapshot;

import com.github.nodegrid.ChannelDiscipline;

import java.util.Objects;

/// A Lai-Yang message. Application messages are coloured by the `postSnapshot` flag: white (false) when the sender had
/// not yet taken its snapshot, red (true) after. The marker carries how many white messages the sender sent on the
/// channel so the receiver knows how many to wait for. None of this needs FIFO channels.
///
/// @param sender      The node that sent the message.
/// @param destination The node the message is for.
/// @param payload     What the message carries.
/// @param time        The Lamport time of the sender when it sent this.
public record LaiYangMessage(String sender, String destination, Payload payload, long time)
    implements SnapshotMessage {

  public static final ChannelDiscipline DISCIPLINE = ChannelDiscipline.NON_FIFO;

  public sealed interface Payload permits Mark, Increment, Decrement {
  }

  /// @param count the number of white messages the sender sent to the destination before its snapshot.
  public record Mark(int count) implements Payload {
    @Override
    public String toString() {
      return "mark=" + count;
    }
  }

  public record Increment(boolean postSnapshot) implements Payload {
    @Override
    public String toString() {
      return "increment=" + postSnapshot;
    }
  }

  public record Decrement(boolean postSnapshot) implements Payload {
    @Override
    public String toString() {
      return "decrement=" + postSnapshot;
    }
  }

  public LaiYangMessage {
    Objects.requireNonNull(sender, "sender");
    Objects.requireNonNull(destination, "destination");
    Objects.requireNonNull(payload, "payload");
  }

  @Override
  public int adjustment() {
    if (payload instanceof Increment) {
      return 1;
    } else if (payload instanceof Decrement) {
      return -1;
    }
    return 0;
  }

  @Override
  public boolean isMarker() {
    return payload instanceof Mark;
  }

  /// Markers are sent as part of taking a snapshot so they count as red.
  public boolean postSnapshot() {
    if (payload instanceof Increment increment) {
      return increment.postSnapshot();
    } else if (payload instanceof Decrement decrement) {
      return decrement.postSnapshot();
    }
    return true;
  }

  /// Only white application messages can be in flight across the cut.
  @Override
  public boolean countsTowardsCut() {
    return !isMarker() && !postSnapshot();
  }

  @Override
  public String toString() {
    return "<" + payload + "> " + sender + "->" + destination;
  }
}
