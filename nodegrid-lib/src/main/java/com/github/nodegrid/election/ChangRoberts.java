// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid.election;

import com.github.nodegrid.GraphNode;
import com.github.nodegrid.RunResult;
import com.github.nodegrid.SelectedAlgorithm;
import com.github.nodegrid.Simulation;

import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;

import static com.github.nodegrid.NodeGridLogger.LOGGER;

/// The Chang-Roberts election from the paper An improved algorithm for decentralized extrema-finding in circular
/// configurations of processes. Every node is an initiator. Only the node with the largest id gets its candidacy all
/// the way round the ring so it is the one that becomes the leader.
public class ChangRoberts {
  private final Simulation<ChangRobertsNode, ChangRobertsMessage> simulation;
  private final List<String> log;

  public ChangRoberts(List<GraphNode> graph, RandomGenerator rng, List<String> log) {
    this.log = log;
    this.simulation = new Simulation<>(graph, ChangRobertsNode::new, ChangRobertsMessage.DISCIPLINE, rng, log);
  }

  public RunResult run() {
    final var algorithm = SelectedAlgorithm.CHANG_ROBERTS;
    log.add(algorithm.startedLine(simulation.size()));
    for (var node : simulation.nodes()) {
      simulation.send(node.initiate());
    }

    simulation.dispatchLoop(() -> leader().isPresent(), sent -> {
    });

    final var leader = leader();
    if (leader.isPresent()) {
      final var line = "Node " + leader.get().name() + " was chosen as leader.";
      log.add(line);
      LOGGER.info(() -> algorithm + " " + line);
      return RunResult.completed(algorithm, line);
    }
    final var line = "Leader election failed.";
    log.add(line);
    LOGGER.info(() -> algorithm + " " + line);
    return RunResult.incomplete(algorithm, line);
  }

  public Optional<ChangRobertsNode> leader() {
    return simulation.nodes().stream().filter(ChangRobertsNode::isLeader).findFirst();
  }

  public Simulation<ChangRobertsNode, ChangRobertsMessage> simulation() {
    return simulation;
  }
}
