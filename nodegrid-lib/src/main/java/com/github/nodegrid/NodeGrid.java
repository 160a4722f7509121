// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid;

import com.github.nodegrid.election.ChangRoberts;
import com.github.nodegrid.snapshot.ChandyLamport;
import com.github.nodegrid.snapshot.LaiYang;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

import static com.github.nodegrid.NodeGridLogger.LOGGER;

/// The entry point of the engine. It holds a read-only copy of the graph handed over by the editor and runs one
/// algorithm at a time over it. The only output is the trace appended to the caller's log and the returned
/// [RunResult].
///
/// Errors are sorted as follows:
///
/// 1. An empty graph is reported straight away and nothing is simulated.
/// 2. A connection to a node that is not in the graph, a duplicate name, or a Chang-Roberts node with no successor
///    is a topology error. It is found before the run starts, named in the trace and reported as failed.
/// 3. An incomplete snapshot or a failed election is a normal outcome of a run.
/// 4. An invariant violation inside the engine stops the run. It is logged to JUL as SEVERE and reported as failed.
///
/// This class is not thread safe. Do not start a second run while one is in progress.
public class NodeGrid {
  private final List<GraphNode> nodes;
  private final RandomGenerator rng;
  private final SimulationConfig config;

  public NodeGrid(List<GraphNode> nodes) {
    this(nodes, RandomGeneratorFactory.of("L64X128MixRandom").create(), SimulationConfig.fromSystemProperties());
  }

  /// @param nodes  The graph. It is copied and never modified.
  /// @param rng    The source of every random choice. Pass a seeded generator for a repeatable trace.
  /// @param config How much background traffic the snapshot algorithms inject.
  public NodeGrid(List<GraphNode> nodes, RandomGenerator rng, SimulationConfig config) {
    this.nodes = List.copyOf(nodes);
    this.rng = Objects.requireNonNull(rng, "rng");
    this.config = Objects.requireNonNull(config, "config");
  }

  /// Build a generator that gives the same trace for the same seed.
  public static RandomGenerator repeatableRandomGenerator(long seed) {
    final RandomGenerator generator = RandomGeneratorFactory.of("L64X128MixRandom").create(seed);
    LOGGER.fine(() -> "NodeGrid using seed: " + seed);
    return generator;
  }

  public List<GraphNode> nodes() {
    return nodes;
  }

  /// Run an algorithm over the graph appending the trace to `log`.
  ///
  /// @param algorithm The algorithm to run.
  /// @param log       The trace that lines are appended to. Lines written before a failure are left in place.
  /// @return the verdict of the run or the reason it failed.
  public RunResult runAlgorithm(SelectedAlgorithm algorithm, List<String> log) {
    LOGGER.info(() -> "running " + algorithm + " over " + nodes.size() + " nodes");
    RunResult result;
    try {
      checkNotEmpty();
      validateTopology(algorithm);
      result = switch (algorithm) {
        case CHANDY_LAMPORT -> new ChandyLamport(nodes, rng, config, log).run();
        case LAI_YANG -> new LaiYang(nodes, rng, config, log).run();
        case CHANG_ROBERTS -> new ChangRoberts(nodes, rng, log).run();
      };
    } catch (IllegalArgumentException e) {
      LOGGER.warning(() -> algorithm + " refused to run: " + e.getMessage());
      log.add(e.getMessage());
      result = RunResult.failed(algorithm, e.getMessage());
    } catch (IllegalStateException | ArithmeticException e) {
      // The engine is broken so we stop and do not try to salvage the run.
      LOGGER.log(Level.SEVERE, algorithm + " stopped: " + e.getMessage(), e);
      log.add(algorithm + " stopped: " + e.getMessage());
      result = RunResult.failed(algorithm, e.getMessage());
    }
    if (!result.isSuccess()) {
      log.add(algorithm + " did not complete.");
    }
    final var finalResult = result;
    LOGGER.info(() -> algorithm + " finished " + finalResult.outcome());
    return result;
  }

  void checkNotEmpty() {
    if (nodes.isEmpty()) {
      throw new IllegalArgumentException(ErrorStrings.EMPTY_GRID);
    }
  }

  /// @throws IllegalArgumentException naming the first offending node.
  void validateTopology(SelectedAlgorithm algorithm) {
    final var names = new HashSet<String>();
    for (var node : nodes) {
      if (!names.add(node.name())) {
        throw new IllegalArgumentException(ErrorStrings.DUPLICATE_NAME + node.name());
      }
    }
    for (var node : nodes) {
      for (var connection : node.connections()) {
        if (!names.contains(connection.other())) {
          throw new IllegalArgumentException(ErrorStrings.UNKNOWN_PEER + node.name() + "->" + connection.other());
        }
      }
      if (algorithm == SelectedAlgorithm.CHANG_ROBERTS && !node.hasConnections()) {
        throw new IllegalArgumentException(ErrorStrings.NO_RING_SUCCESSOR + node.name());
      }
    }
  }

  /// Return a copy of the graph with a connection from `from` to `to` added, mirroring how the editor connects a
  /// node. An existing connection to the same peer is replaced.
  ///
  /// @throws IllegalArgumentException if either node is not in the graph.
  public static List<GraphNode> connect(List<GraphNode> graph, String from, String to, double weight) {
    if (graph.stream().noneMatch(n -> n.name().equals(to))) {
      throw new IllegalArgumentException(ErrorStrings.UNKNOWN_PEER + from + "->" + to);
    }
    if (graph.stream().noneMatch(n -> n.name().equals(from))) {
      throw new IllegalArgumentException(ErrorStrings.UNKNOWN_PEER + to + "<-" + from);
    }
    return graph.stream()
        .map(n -> n.name().equals(from) ? n.withConnection(new Connection(to, weight)) : n)
        .toList();
  }

  /// Connect both ways with the same weight.
  public static List<GraphNode> connectBothWays(List<GraphNode> graph, String a, String b, double weight) {
    return connect(connect(graph, a, b, weight), b, a, weight);
  }
}
