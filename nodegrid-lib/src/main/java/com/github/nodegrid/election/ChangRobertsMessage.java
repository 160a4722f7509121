// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid.election;

import com.github.nodegrid.ChannelDiscipline;
import com.github.nodegrid.SimMessage;

import java.util.Objects;

/// A Chang-Roberts candidacy. The election does not depend on the order of delivery so it runs over non-FIFO channels.
///
/// @param sender      The node that sent or relayed the candidacy.
/// @param destination The ring successor of the sender.
/// @param candidateId The id of the node that started the candidacy.
public record ChangRobertsMessage(String sender, String destination, long candidateId) implements SimMessage {

  public static final ChannelDiscipline DISCIPLINE = ChannelDiscipline.NON_FIFO;

  public ChangRobertsMessage {
    Objects.requireNonNull(sender, "sender");
    Objects.requireNonNull(destination, "destination");
  }

  /// @return the same candidacy sent on by a relaying node.
  public ChangRobertsMessage passOn(String from, String to) {
    return new ChangRobertsMessage(from, to, candidateId);
  }

  @Override
  public String toString() {
    return "<leader=" + candidateId + "> " + sender + "->" + destination;
  }
}
