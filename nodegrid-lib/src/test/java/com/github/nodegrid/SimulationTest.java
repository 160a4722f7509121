// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SimulationTest {

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  /// A message that is passed on until its hops run out.
  record Hop(String sender, String destination, int hops) implements SimMessage {
  }

  /// Passes each hop on to its first connection and counts what it handled.
  static class HopNode implements SimNode<Hop> {
    final GraphNode node;
    int handled = 0;

    HopNode(GraphNode node) {
      this.node = node;
    }

    @Override
    public GraphNode node() {
      return node;
    }

    @Override
    public List<Hop> handle(Hop message, List<String> log) {
      handled++;
      log.add(name() + " received " + message.hops());
      if (message.hops() == 0) {
        return List.of();
      }
      return List.of(new Hop(name(), node.connections().get(0).other(), message.hops() - 1));
    }
  }

  static Simulation<HopNode, Hop> simulation(List<GraphNode> graph, List<String> log) {
    return new Simulation<>(graph, HopNode::new, ChannelDiscipline.FIFO, NodeGrid.repeatableRandomGenerator(1234), log);
  }

  @Test
  public void wrapKeepsNamesAndConnectionsInGraphOrder() {
    final var graph = Graphs.ring(1, 2, 3);
    final var sim = simulation(graph, new ArrayList<>());
    assertThat(sim.nodes()).extracting(SimNode::name).containsExactly("a", "b", "c");
    assertThat(sim.findByName("b").node().connections()).containsExactly(new Connection("c"));
  }

  @Test
  public void wrapRejectsDuplicateNames() {
    final var graph = List.of(new GraphNode("a", 1), new GraphNode("a", 2));
    assertThatThrownBy(() -> simulation(graph, new ArrayList<>()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("a");
  }

  @Test
  public void dispatchDeliversUntilTheQueueIsEmpty() {
    final var log = new ArrayList<String>();
    final var sim = simulation(Graphs.ring(1, 2, 3), log);
    sim.send(new Hop("a", "b", 5));
    sim.dispatchLoop();
    assertThat(sim.hasMessages()).isFalse();
    assertThat(log).containsExactly(
        "b received 5", "c received 4", "a received 3", "b received 2", "c received 1", "a received 0");
  }

  @Test
  public void dispatchStopsWhenTheConditionHolds() {
    final var sim = simulation(Graphs.ring(1, 2, 3), new ArrayList<>());
    sim.send(new Hop("a", "b", 100));
    final var sentBatches = new ArrayList<List<Hop>>();
    sim.dispatchLoop(() -> sim.findByName("a").handled >= 2, sentBatches::add);
    assertThat(sim.findByName("a").handled).isEqualTo(2);
    assertThat(sim.hasMessages()).isTrue();
    assertThat(sentBatches).hasSize(6);
  }

  @Test
  public void dispatchToAMissingNodeIsAnInvariantViolation() {
    final var log = new ArrayList<String>();
    final var sim = simulation(Graphs.ring(1, 2), log);
    sim.send(new Hop("a", "zz", 1));
    assertThatThrownBy(sim::dispatchLoop)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("zz");
  }

  @Test
  public void pickRandomNodesChoosesWithoutReplacement() {
    final var sim = simulation(Graphs.ring(IntStream.range(0, 10).mapToLong(i -> i).toArray()), new ArrayList<>());
    final var chosen = sim.pickRandomNodes(4);
    assertThat(chosen).hasSize(4);
    assertThat(new HashSet<>(chosen)).hasSize(4);
    assertThat(sim.pickRandomNodes(50)).hasSize(10);
    assertThat(sim.pickRandomNodes(0)).isEmpty();
  }

  @Test
  public void pickRandomNodeReachesEveryNode() {
    final var sim = simulation(Graphs.ring(1, 2, 3, 4), new ArrayList<>());
    final var seen = new HashSet<String>();
    IntStream.range(0, 200).forEach(i -> seen.add(sim.pickRandomNode().name()));
    assertThat(seen).containsExactlyInAnyOrder("a", "b", "c", "d");
    assertThat(sim.pickRandomNode(n -> n.name().equals("c"))).map(SimNode::name).contains("c");
    assertThat(sim.pickRandomNode(n -> false)).isEmpty();
  }

  @Test
  public void initiatorChoicesAreLogged() {
    final var log = new ArrayList<String>();
    final var sim = simulation(Graphs.ring(1, 2, 3), log);
    final var initiator = sim.chooseInitiator();
    final var initiators = sim.chooseInitiators(2);
    assertThat(log.get(0)).isEqualTo("Choose " + initiator.name() + " as initiator.");
    assertThat(log.get(1))
        .startsWith("Choose [")
        .endsWith("] as initiators.")
        .contains(initiators.get(0).name(), initiators.get(1).name());
  }

  @Test
  public void sameSeedGivesTheSameChoices() {
    final var graph = Graphs.ring(1, 2, 3, 4, 5, 6);
    final var first = simulation(graph, new ArrayList<>()).pickRandomNodes(6);
    final var second = simulation(graph, new ArrayList<>()).pickRandomNodes(6);
    assertThat(first).extracting(SimNode::name)
        .containsExactlyElementsOf(second.stream().map(SimNode::name).toList());
  }
}
