// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.random.RandomGenerator;
import java.util.stream.IntStream;

/// Graph builders shared by the tests.
public final class Graphs {
  private Graphs() {
  }

  public static String name(int index) {
    return index < 26 ? String.valueOf((char) ('a' + index)) : "n" + index;
  }

  /// A ring `a -> b -> ... -> a` where the i-th node has the i-th id.
  public static List<GraphNode> ring(long... ids) {
    return IntStream.range(0, ids.length)
        .mapToObj(i -> new GraphNode(name(i), ids[i], List.of(new Connection(name((i + 1) % ids.length)))))
        .toList();
  }

  /// A ring of the given size visiting the nodes in a random order with shuffled unique ids.
  public static List<GraphNode> randomRing(int size, RandomGenerator rng) {
    final var order = shuffled(size, rng);
    final var ids = shuffled(size, rng);
    final var nodes = new ArrayList<GraphNode>();
    for (int i = 0; i < size; i++) {
      final var successor = name(order.get((order.indexOf(i) + 1) % size));
      nodes.add(new GraphNode(name(i), ids.get(i) + 1L, List.of(new Connection(successor))));
    }
    return nodes;
  }

  /// Every node has between zero and three connections to random nodes which may include itself.
  public static List<GraphNode> randomTopology(int size, RandomGenerator rng) {
    return IntStream.range(0, size)
        .mapToObj(i -> {
          final var connections = IntStream.range(0, rng.nextInt(4))
              .mapToObj(c -> new Connection(name(rng.nextInt(size)), rng.nextDouble()))
              .toList();
          return new GraphNode(name(i), i, connections);
        })
        .toList();
  }

  /// Like [#randomTopology(int, RandomGenerator)] but every node has at least one connection.
  public static List<GraphNode> randomTopologyWithSuccessors(int size, RandomGenerator rng) {
    return IntStream.range(0, size)
        .mapToObj(i -> {
          final var connections = IntStream.range(0, 1 + rng.nextInt(3))
              .mapToObj(c -> new Connection(name(rng.nextInt(size)), rng.nextDouble()))
              .toList();
          return new GraphNode(name(i), rng.nextInt(size * 2), connections);
        })
        .toList();
  }

  /// A random ring with random extra chords so that every node can reach every other node.
  public static List<GraphNode> randomStronglyConnected(int size, RandomGenerator rng) {
    var graph = randomRing(size, rng);
    final int chords = rng.nextInt(size + 1);
    for (int i = 0; i < chords; i++) {
      graph = NodeGrid.connect(graph, name(rng.nextInt(size)), name(rng.nextInt(size)), 1.0);
    }
    return graph;
  }

  private static List<Integer> shuffled(int size, RandomGenerator rng) {
    final var list = new ArrayList<Integer>();
    IntStream.range(0, size).forEach(list::add);
    for (int i = size - 1; i > 0; i--) {
      Collections.swap(list, i, rng.nextInt(i + 1));
    }
    return list;
  }
}
