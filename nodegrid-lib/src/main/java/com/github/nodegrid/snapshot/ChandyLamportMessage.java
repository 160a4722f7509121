// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid.snapshot;

import com.github.nodegrid.ChannelDiscipline;

import java.util.Locale;
import java.util.Objects;

/// A Chandy-Lamport message. Markers are only correct over FIFO channels.
///
/// @param sender      The node that sent the message.
/// @param destination The node the message is for.
/// @param kind        A marker or one unit of the diffusing computation.
/// @param time        The Lamport time of the sender when it sent this.
public record ChandyLamportMessage(String sender, String destination, Kind kind, long time)
    implements SnapshotMessage {

  public static final ChannelDiscipline DISCIPLINE = ChannelDiscipline.FIFO;

  public enum Kind {
    MARK, INCREMENT, DECREMENT;

    @Override
    public String toString() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  public ChandyLamportMessage {
    Objects.requireNonNull(sender, "sender");
    Objects.requireNonNull(destination, "destination");
    Objects.requireNonNull(kind, "kind");
  }

  @Override
  public int adjustment() {
    return switch (kind) {
      case MARK -> 0;
      case INCREMENT -> 1;
      case DECREMENT -> -1;
    };
  }

  @Override
  public boolean isMarker() {
    return kind == Kind.MARK;
  }

  @Override
  public String toString() {
    return "<" + kind + "> " + sender + "->" + destination;
  }
}
