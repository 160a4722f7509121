// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid.snapshot;

import com.github.nodegrid.GraphNode;
import com.github.nodegrid.LamportClock;
import com.github.nodegrid.Snapshot;
import com.github.nodegrid.snapshot.LaiYangMessage.Decrement;
import com.github.nodegrid.snapshot.LaiYangMessage.Increment;
import com.github.nodegrid.snapshot.LaiYangMessage.Mark;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.random.RandomGenerator;

/// The state of one node in a Lai-Yang snapshot. The rules are:
///
/// - White messages sent before the snapshot are counted per destination.
/// - The snapshot is taken on the first marker or the first red message, before the red message is applied.
/// - Taking the snapshot sends `Mark(count)` on every outgoing connection where `count` is the white messages sent
///   on that connection.
/// - White messages received are counted per sender. One that arrives after our snapshot crossed the cut and is
///   recorded.
/// - The node is done once it has a marker from every incoming neighbour and has received as many white messages
///   from each as that neighbour says it sent.
public class LaiYangNode implements SnapshotNode<LaiYangMessage> {
  private final GraphNode node;
  private final Set<String> incoming;
  private final LamportClock clock = new LamportClock();

  /// White messages sent per neighbour.
  private final Map<String, Integer> sent = new LinkedHashMap<>();
  /// White messages received per neighbour.
  private final Map<String, Integer> received = new LinkedHashMap<>();
  /// The white messages each incoming neighbour says it sent us before its snapshot.
  private final Map<String, Integer> preSnapshot = new LinkedHashMap<>();

  private int state = 0;
  private Snapshot<LaiYangMessage> snapshot = null;
  private boolean done = false;

  /// @param node     the graph node to wrap.
  /// @param incoming the names of the nodes that have a connection to this one.
  public LaiYangNode(GraphNode node, Set<String> incoming) {
    this.node = node;
    this.incoming = Set.copyOf(incoming);
    node.connections().forEach(c -> sent.putIfAbsent(c.other(), 0));
  }

  @Override
  public List<LaiYangMessage> takeSnapshot(List<String> log) {
    snapshot = new Snapshot<>(state, clock.time());
    log.add(name() + " took " + snapshot);
    final var outgoing = new ArrayList<LaiYangMessage>();
    for (var connection : node.connections()) {
      final var mark = new Mark(sent.getOrDefault(connection.other(), 0));
      outgoing.add(new LaiYangMessage(name(), connection.other(), mark, clock.tick()));
    }
    outgoing.forEach(m -> log.add("Sent " + m + "."));
    checkDone(log);
    return outgoing;
  }

  @Override
  public List<LaiYangMessage> handle(LaiYangMessage message, List<String> log) {
    clock.receive(message.time());
    log.add(name() + " received " + message);
    List<LaiYangMessage> output = List.of();
    if (message.payload() instanceof Mark mark) {
      if (snapshot == null) {
        output = takeSnapshot(log);
      }
      preSnapshot.put(message.sender(), mark.count());
      log.add(name() + " notes " + message.sender() + " sent it " + mark.count() + " messages before its snapshot.");
    } else if (message.postSnapshot()) {
      if (snapshot == null) {
        log.add(name() + " takes a snapshot, because the received message is post snapshot.");
        output = takeSnapshot(log);
      }
      state += message.adjustment();
    } else {
      received.merge(message.sender(), 1, Integer::sum);
      if (snapshot != null) {
        log.add(name() + " saves " + message + " in snapshot.");
        snapshot.record(message);
      }
      state += message.adjustment();
    }
    checkDone(log);
    return output;
  }

  private void checkDone(List<String> log) {
    if (done || snapshot == null || !preSnapshot.keySet().containsAll(incoming)) {
      return;
    }
    final boolean allArrived = incoming.stream()
        .allMatch(n -> received.getOrDefault(n, 0).equals(preSnapshot.get(n)));
    if (allArrived) {
      done = true;
      log.add(name() + " has received every message sent before the cut.");
    }
  }

  @Override
  public LaiYangMessage sendRandom(RandomGenerator rng, List<String> log) {
    final var connections = node.connections();
    final var destination = connections.get(rng.nextInt(connections.size())).other();
    final boolean postSnapshot = snapshot != null;
    final LaiYangMessage.Payload payload = rng.nextBoolean() ? new Increment(postSnapshot) : new Decrement(postSnapshot);
    if (!postSnapshot) {
      sent.merge(destination, 1, Integer::sum);
    }
    final var message = new LaiYangMessage(name(), destination, payload, clock.tick());
    state -= message.adjustment();
    log.add(name() + "=" + state + " and send " + message);
    return message;
  }

  @Override
  public boolean isComplete() {
    return done;
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
  public Optional<Snapshot<LaiYangMessage>> snapshot() {
    return Optional.ofNullable(snapshot);
  }

  public boolean isDone() {
    return done;
  }

  public Map<String, Integer> sentCounts() {
    return Map.copyOf(sent);
  }

  public Map<String, Integer> receivedCounts() {
    return Map.copyOf(received);
  }

  public Set<String> incoming() {
    return incoming;
  }
}
