// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid.election;

import com.github.nodegrid.Connection;
import com.github.nodegrid.GraphNode;
import com.github.nodegrid.Graphs;
import com.github.nodegrid.LoggerConfig;
import com.github.nodegrid.NodeGrid;
import com.github.nodegrid.RunResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;
import java.util.stream.IntStream;

import static com.github.nodegrid.NodeGridLogger.LOGGER;
import static com.github.nodegrid.election.ChangRobertsNode.NodeState.ACTIVE;
import static com.github.nodegrid.election.ChangRobertsNode.NodeState.LEADER;
import static com.github.nodegrid.election.ChangRobertsNode.NodeState.PASSIVE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ChangRobertsTests {

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  static ChangRobertsNode node(String name, long id, String successor) {
    return new ChangRobertsNode(new GraphNode(name, id, List.of(new Connection(successor))));
  }

  @Test
  public void threeNodeRingElectsTheLargestId() {
    final var log = new ArrayList<String>();
    final var changRoberts = new ChangRoberts(Graphs.ring(1, 2, 3), NodeGrid.repeatableRandomGenerator(1234), log);

    final var result = changRoberts.run();

    assertThat(result.outcome()).isEqualTo(RunResult.Outcome.COMPLETED);
    assertThat(changRoberts.leader()).map(ChangRobertsNode::name).contains("c");
    assertThat(log).contains("3=3 so c declares itself the leader.");
    assertThat(log).last().isEqualTo("Node c was chosen as leader.");
  }

  @Test
  public void ringOfOneElectsItself() {
    final var changRoberts = new ChangRoberts(Graphs.ring(7), NodeGrid.repeatableRandomGenerator(1234),
        new ArrayList<>());
    assertThat(changRoberts.run().isCompleted()).isTrue();
    assertThat(changRoberts.leader()).map(ChangRobertsNode::name).contains("a");
  }

  @Test
  public void activeNodeDismissesSmallerIdsAndRelaysLargerOnes() {
    final var log = new ArrayList<String>();
    final var b = node("b", 2, "c");

    assertThat(b.handle(new ChangRobertsMessage("a", "b", 1), log)).isEmpty();
    assertThat(b.state()).isEqualTo(ACTIVE);
    assertThat(log).contains("1<2 so the message is dismissed.");

    assertThat(b.handle(new ChangRobertsMessage("a", "b", 5), log))
        .containsExactly(new ChangRobertsMessage("b", "c", 5));
    assertThat(b.state()).isEqualTo(PASSIVE);
    assertThat(log).contains("5>2 so b is now passive.");

    // a passive node relays everything including its own id
    assertThat(b.handle(new ChangRobertsMessage("a", "b", 2), log))
        .containsExactly(new ChangRobertsMessage("b", "c", 2));
    assertThat(log).contains("b=passive received <leader=2> a->b");
  }

  @Test
  public void ownIdReturningMakesTheNodeLeader() {
    final var log = new ArrayList<String>();
    final var a = node("a", 9, "b");
    assertThat(a.initiate()).isEqualTo(new ChangRobertsMessage("a", "b", 9));
    assertThat(a.handle(new ChangRobertsMessage("c", "a", 9), log)).isEmpty();
    assertThat(a.state()).isEqualTo(LEADER);
    assertThat(a.isLeader()).isTrue();
    // a leader drops anything that is still in flight
    assertThat(a.handle(new ChangRobertsMessage("c", "a", 12), log)).isEmpty();
    assertThat(a.state()).isEqualTo(LEADER);
  }

  @Test
  public void aCandidacyIsOnlyRelayedOnce() {
    final var log = new ArrayList<String>();
    final var b = node("b", 1, "c");
    assertThat(b.handle(new ChangRobertsMessage("a", "b", 4), log)).hasSize(1);
    assertThat(b.handle(new ChangRobertsMessage("c", "b", 4), log)).isEmpty();
    assertThat(log).contains("b has already relayed 4 so the ring is malformed and it is dropped.");
  }

  @Test
  public void nodeWithoutASuccessorIsRejected() {
    assertThatThrownBy(() -> new ChangRobertsNode(new GraphNode("x", 1)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("x");
  }

  @Test
  public void cycleThatMissesTheLargestIdStillTerminates() {
    // a feeds into the cycle b -> c -> b so the candidacy of a can never come back to it
    final var graph = List.of(
        new GraphNode("a", 5, List.of(new Connection("b"))),
        new GraphNode("b", 1, List.of(new Connection("c"))),
        new GraphNode("c", 2, List.of(new Connection("b")))
    );
    final var rng = NodeGrid.repeatableRandomGenerator(1234);
    IntStream.range(0, 100).forEach(i -> {
      final var changRoberts = new ChangRoberts(graph, rng, new ArrayList<>());
      final var result = changRoberts.run();
      assertThat(result.isSuccess()).isTrue();
      assertThat(changRoberts.leader()).map(ChangRobertsNode::name).isNotEqualTo(Optional.of("a"));
      assertThat(changRoberts.simulation().nodes().stream().filter(ChangRobertsNode::isLeader).count())
          .isLessThanOrEqualTo(1);
    });
  }

  @Test
  public void randomRingsElectTheLargestId1000() {
    final RandomGenerator rng = NodeGrid.repeatableRandomGenerator(5678);
    IntStream.range(0, 1000).forEach(i -> {
      LOGGER.fine(() -> "starting iteration: " + i);
      final int size = 1 + rng.nextInt(12);
      final var graph = Graphs.randomRing(size, rng);
      final var changRoberts = new ChangRoberts(graph, rng, new ArrayList<>());

      assertThat(changRoberts.run().isCompleted()).isTrue();
      final var leader = changRoberts.leader().orElseThrow();
      assertThat(leader.node().id()).isEqualTo((long) size);
      assertThat(changRoberts.simulation().nodes().stream().filter(ChangRobertsNode::isLeader).count())
          .isEqualTo(1);
    });
  }
}
