// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid.snapshot;

import com.github.nodegrid.GraphNode;
import com.github.nodegrid.LamportClock;
import com.github.nodegrid.Snapshot;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.random.RandomGenerator;

import static com.github.nodegrid.snapshot.ChandyLamportMessage.Kind.DECREMENT;
import static com.github.nodegrid.snapshot.ChandyLamportMessage.Kind.INCREMENT;
import static com.github.nodegrid.snapshot.ChandyLamportMessage.Kind.MARK;

/// The state of one node in a Chandy-Lamport snapshot.
///
/// - On the first marker the node records its state and sends a marker on every outgoing connection.
/// - Every marker sender is remembered.
/// - After the snapshot any increment or decrement from a sender whose marker has not arrived yet was in flight
///   across the cut on that channel and is recorded.
public class ChandyLamportNode implements SnapshotNode<ChandyLamportMessage> {
  private final GraphNode node;
  private final LamportClock clock = new LamportClock();
  private final Set<String> received = new LinkedHashSet<>();
  private int state = 0;
  private Snapshot<ChandyLamportMessage> snapshot = null;

  public ChandyLamportNode(GraphNode node) {
    this.node = node;
  }

  @Override
  public List<ChandyLamportMessage> takeSnapshot(List<String> log) {
    snapshot = new Snapshot<>(state, clock.time());
    log.add(name() + " took " + snapshot);
    final var outgoing = new ArrayList<ChandyLamportMessage>();
    for (var connection : node.connections()) {
      outgoing.add(new ChandyLamportMessage(name(), connection.other(), MARK, clock.tick()));
    }
    outgoing.forEach(m -> log.add("Sent " + m + "."));
    return outgoing;
  }

  @Override
  public List<ChandyLamportMessage> handle(ChandyLamportMessage message, List<String> log) {
    clock.receive(message.time());
    log.add(name() + " received " + message);
    switch (message.kind()) {
      case MARK -> {
        final List<ChandyLamportMessage> output = snapshot == null ? takeSnapshot(log) : List.of();
        received.add(message.sender());
        log.add(name() + " notes it has received <mark> from " + message.sender() + ".");
        return output;
      }
      case INCREMENT, DECREMENT -> {
        recordIfInFlight(message, log);
        state += message.adjustment();
        return List.of();
      }
      default -> throw new IllegalStateException("unknown kind " + message.kind());
    }
  }

  private void recordIfInFlight(ChandyLamportMessage message, List<String> log) {
    if (snapshot != null && !received.contains(message.sender())) {
      log.add(name() + " saves " + message + " in snapshot.");
      snapshot.record(message);
    }
  }

  @Override
  public ChandyLamportMessage sendRandom(RandomGenerator rng, List<String> log) {
    final var connections = node.connections();
    final var destination = connections.get(rng.nextInt(connections.size())).other();
    final var kind = rng.nextBoolean() ? INCREMENT : DECREMENT;
    final var message = new ChandyLamportMessage(name(), destination, kind, clock.tick());
    state -= message.adjustment();
    log.add(name() + "=" + state + " and send " + message);
    return message;
  }

  @Override
  public GraphNode node() {
    return node;
  }

  @Override
  public int state() {
    return state;
  }

  @Override
  public Optional<Snapshot<ChandyLamportMessage>> snapshot() {
    return Optional.ofNullable(snapshot);
  }

  public Set<String> receivedMarkersFrom() {
    return Set.copyOf(received);
  }

  public LamportClock clock() {
    return clock;
  }
}
