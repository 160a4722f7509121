// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid.snapshot;

import com.github.nodegrid.GraphNode;
import com.github.nodegrid.SelectedAlgorithm;
import com.github.nodegrid.SimulationConfig;

import java.util.List;
import java.util.random.RandomGenerator;

/// The Chandy-Lamport global snapshot from the paper Distributed Snapshots: Determining Global States of Distributed
/// Systems. Markers flow over FIFO channels so a node sees the marker of a channel before anything sent after it.
public class ChandyLamport extends SnapshotAlgorithm<ChandyLamportNode, ChandyLamportMessage> {

  public ChandyLamport(List<GraphNode> graph, RandomGenerator rng, SimulationConfig config, List<String> log) {
    super(SelectedAlgorithm.CHANDY_LAMPORT,
        graph,
        ChandyLamportNode::new,
        ChandyLamportMessage.DISCIPLINE,
        rng,
        config,
        log);
  }
}
