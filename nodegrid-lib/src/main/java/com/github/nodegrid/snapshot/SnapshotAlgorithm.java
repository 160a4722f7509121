// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid.snapshot;

import com.github.nodegrid.ChannelDiscipline;
import com.github.nodegrid.GraphNode;
import com.github.nodegrid.RunResult;
import com.github.nodegrid.SelectedAlgorithm;
import com.github.nodegrid.Simulation;
import com.github.nodegrid.SimulationConfig;
import com.github.nodegrid.Snapshot;
import org.jetbrains.annotations.TestOnly;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.random.RandomGenerator;

import static com.github.nodegrid.NodeGridLogger.LOGGER;

/// The driver shared by the snapshot algorithms. A run goes:
///
/// 1. Choose one initiator uniformly at random.
/// 2. Send some background increments and decrements so that there is traffic in flight when the cut is taken.
/// 3. The initiator takes its snapshot. We note the true global total at this instant.
/// 4. Send some more background traffic that is after the cut at the initiator.
/// 5. Drain the queue. Each time a handler sends something we inject more background traffic to keep the system live.
/// 6. Check that every node finished its part of the cut and that the recorded states plus the recorded in-flight
///    messages add up to the total at the cut.
///
/// Subclasses provide the node factory and the channel discipline of their message type.
public abstract class SnapshotAlgorithm<N extends SnapshotNode<M>, M extends SnapshotMessage> {
  protected final SelectedAlgorithm algorithm;
  protected final Simulation<N, M> simulation;
  protected final SimulationConfig config;
  protected final List<String> log;

  private long totalAtCut = 0L;
  private SnapshotVerdict verdict = null;

  protected SnapshotAlgorithm(SelectedAlgorithm algorithm,
                              List<GraphNode> graph,
                              Function<GraphNode, N> factory,
                              ChannelDiscipline discipline,
                              RandomGenerator rng,
                              SimulationConfig config,
                              List<String> log) {
    this.algorithm = algorithm;
    this.config = config;
    this.log = log;
    this.simulation = new Simulation<>(graph, factory, discipline, rng, log);
  }

  public RunResult run() {
    log.add(algorithm.startedLine(simulation.size()));
    final var initiator = simulation.chooseInitiator();
    LOGGER.fine(() -> algorithm + " initiator is " + initiator.name());

    sendBackgroundTraffic(config.preSnapshotTraffic());

    final var markers = initiator.takeSnapshot(log);
    totalAtCut = globalTotal();
    simulation.sendAll(markers);

    sendBackgroundTraffic(config.postSnapshotTraffic());

    simulation.dispatchLoop(() -> false, sent -> {
      if (!sent.isEmpty()) {
        sendBackgroundTraffic(config.trafficPerResponse());
      }
    });

    verdict = verify();
    if (!verdict.complete()) {
      return RunResult.incomplete(algorithm, verdict.toString());
    }
    if (!verdict.consistent()) {
      // A complete cut that does not add up means the handlers are broken.
      throw new IllegalStateException("FATAL inconsistent snapshot " + verdict);
    }
    return RunResult.completed(algorithm, verdict.toString());
  }

  /// Inject up to `count` random messages. Nodes without outgoing connections cannot send so if there are none that
  /// can then nothing is sent.
  protected void sendBackgroundTraffic(int count) {
    for (int i = 0; i < count; i++) {
      final Optional<N> sender = simulation.pickRandomNode(SnapshotNode::hasConnections);
      if (sender.isEmpty()) {
        LOGGER.fine(() -> "no node has a connection to send background traffic on");
        return;
      }
      simulation.send(sender.get().sendRandom(simulation.random(), log));
    }
  }

  /// The sum of every node balance plus the adjustments still in flight. Background traffic conserves this.
  public long globalTotal() {
    final long states = simulation.nodes().stream().mapToLong(SnapshotNode::state).sum();
    final long inFlight = simulation.pending().stream().mapToLong(SnapshotMessage::adjustment).sum();
    return states + inFlight;
  }

  SnapshotVerdict verify() {
    final var nodes = simulation.nodes();
    log.add("");
    final boolean complete = nodes.stream().allMatch(SnapshotNode::isComplete);
    final long nodeTotal = nodes.stream()
        .flatMap(n -> n.snapshot().stream())
        .mapToLong(Snapshot::state)
        .sum();
    final long messageTotal = nodes.stream()
        .flatMap(n -> n.snapshot().stream())
        .flatMap(s -> s.messages().stream())
        .filter(SnapshotMessage::countsTowardsCut)
        .mapToLong(SnapshotMessage::adjustment)
        .sum();
    if (complete) {
      log.add("Snapshot completed.");
      log.add("Node total: " + nodeTotal);
      log.add("Message total: " + messageTotal);
      log.add("Total at cut: " + totalAtCut);
    } else {
      log.add("Snapshot did not complete.");
    }
    for (var node : nodes) {
      log.add(node.name() + ": " + node.snapshot().map(Snapshot::toString).orElse("None"));
    }
    log.add("");
    final var result = new SnapshotVerdict(complete, nodeTotal, messageTotal, totalAtCut);
    LOGGER.info(() -> algorithm + " " + result);
    return result;
  }

  public Simulation<N, M> simulation() {
    return simulation;
  }

  /// @return the true global total when the initiator took its snapshot.
  public long totalAtCut() {
    return totalAtCut;
  }

  /// @return the verdict of the last run or null if it has not been run.
  @TestOnly
  public SnapshotVerdict verdict() {
    return verdict;
  }
}
