// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid.snapshot;

import com.github.nodegrid.GraphNode;
import com.github.nodegrid.SelectedAlgorithm;
import com.github.nodegrid.SimulationConfig;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.random.RandomGenerator;

/// The Lai-Yang snapshot from the paper On Distributed Snapshots. Messages are coloured by whether the sender had
/// taken its snapshot and markers carry message counts so channels need not be FIFO. Delivery here is randomised to
/// show that the cut does not depend on the order of delivery.
public class LaiYang extends SnapshotAlgorithm<LaiYangNode, LaiYangMessage> {

  public LaiYang(List<GraphNode> graph, RandomGenerator rng, SimulationConfig config, List<String> log) {
    super(SelectedAlgorithm.LAI_YANG,
        graph,
        factory(graph),
        LaiYangMessage.DISCIPLINE,
        rng,
        config,
        log);
  }

  /// Each node needs to know who sends to it so that it can tell when every incoming channel is accounted for.
  static Function<GraphNode, LaiYangNode> factory(List<GraphNode> graph) {
    final Map<String, Set<String>> incoming = new HashMap<>();
    for (var from : graph) {
      for (var connection : from.connections()) {
        incoming.computeIfAbsent(connection.other(), k -> new HashSet<>()).add(from.name());
      }
    }
    return node -> new LaiYangNode(node, incoming.getOrDefault(node.name(), Set.of()));
  }
}
