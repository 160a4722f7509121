// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid.election;

import com.github.nodegrid.ErrorStrings;
import com.github.nodegrid.GraphNode;
import com.github.nodegrid.SimNode;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/// The state of one node in a Chang-Roberts election. A node only ever forwards to its ring successor which is its
/// first connection. The transitions are `ACTIVE -> PASSIVE` on relaying a larger id and `ACTIVE -> LEADER` on
/// receiving its own id back. Nothing leaves `PASSIVE` or `LEADER`.
public class ChangRobertsNode implements SimNode<ChangRobertsMessage> {

  public enum NodeState {ACTIVE, PASSIVE, LEADER}

  private final GraphNode node;
  private NodeState state = NodeState.ACTIVE;

  /// On a ring a candidacy passes each node at most once. We remember what we relayed so that a candidacy going
  /// round a cycle that does not contain its origin is dropped the second time rather than circling forever.
  private final Set<Long> relayed = new HashSet<>();

  public ChangRobertsNode(GraphNode node) {
    if (!node.hasConnections()) {
      throw new IllegalArgumentException(ErrorStrings.NO_RING_SUCCESSOR + node.name());
    }
    this.node = node;
  }

  /// @return this node's own candidacy sent to its successor.
  public ChangRobertsMessage initiate() {
    return new ChangRobertsMessage(name(), successor(), node.id());
  }

  @Override
  public List<ChangRobertsMessage> handle(ChangRobertsMessage message, List<String> log) {
    log.add(name() + "=" + (state == NodeState.PASSIVE ? "passive" : Long.toString(node.id())) + " received " + message);
    final long candidate = message.candidateId();
    final long self = node.id();
    switch (state) {
      case PASSIVE -> {
        return relay(message, log);
      }
      case ACTIVE -> {
        if (candidate < self) {
          log.add(candidate + "<" + self + " so the message is dismissed.");
          return List.of();
        } else if (candidate > self) {
          log.add(candidate + ">" + self + " so " + name() + " is now passive.");
          state = NodeState.PASSIVE;
          return relay(message, log);
        } else {
          log.add(candidate + "=" + self + " so " + name() + " declares itself the leader.");
          state = NodeState.LEADER;
          return List.of();
        }
      }
      default -> {
        return List.of();
      }
    }
  }

  private List<ChangRobertsMessage> relay(ChangRobertsMessage message, List<String> log) {
    if (!relayed.add(message.candidateId())) {
      log.add(name() + " has already relayed " + message.candidateId() + " so the ring is malformed and it is dropped.");
      return List.of();
    }
    return List.of(message.passOn(name(), successor()));
  }

  private String successor() {
    return node.connections().get(0).other();
  }

  @Override
  public GraphNode node() {
    return node;
  }

  public NodeState state() {
    return state;
  }

  public boolean isLeader() {
    return state == NodeState.LEADER;
  }
}
