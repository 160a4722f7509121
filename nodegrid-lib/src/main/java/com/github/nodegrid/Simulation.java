// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.random.RandomGenerator;
import java.util.stream.Collectors;

import static com.github.nodegrid.NodeGridLogger.LOGGER;

/// The sequential event loop shared by every algorithm. It owns the wrapped nodes and the pending message queue of
/// exactly one run. Messages are popped from the front of the queue and handed to the handler of their destination
/// node. Whatever the handler returns is sent with the channel discipline of the message type.
///
/// This class is not thread safe. A run is a bounded computation that the caller drives to completion; there is no
/// timeout so an algorithm whose handlers never stop sending will loop forever.
///
/// @param <N> the per-algorithm node state.
/// @param <M> the per-algorithm message type.
public class Simulation<N extends SimNode<M>, M extends SimMessage> {
  /// Wrapped nodes by name in the order of the graph.
  private final Map<String, N> nodes;

  private final MessageQueue<M> messages;

  private final RandomGenerator rng;

  private final List<String> log;

  public Simulation(List<GraphNode> graph,
                    Function<GraphNode, N> factory,
                    ChannelDiscipline discipline,
                    RandomGenerator rng,
                    List<String> log) {
    this.rng = Objects.requireNonNull(rng, "rng");
    this.log = Objects.requireNonNull(log, "log");
    this.nodes = wrap(graph, factory);
    this.messages = new MessageQueue<>(discipline, rng);
  }

  /// Build one algorithm node per graph node. The factory must keep the name and the full connection list.
  public static <N extends SimNode<?>> Map<String, N> wrap(List<GraphNode> graph, Function<GraphNode, N> factory) {
    final var wrapped = new LinkedHashMap<String, N>();
    for (var graphNode : graph) {
      final var node = factory.apply(graphNode);
      if (wrapped.put(node.name(), node) != null) {
        throw new IllegalArgumentException(ErrorStrings.DUPLICATE_NAME + node.name());
      }
    }
    return wrapped;
  }

  public Collection<N> nodes() {
    return Collections.unmodifiableCollection(nodes.values());
  }

  public int size() {
    return nodes.size();
  }

  public RandomGenerator random() {
    return rng;
  }

  public List<String> log() {
    return log;
  }

  /// Look up the destination of a message. Destinations are always taken from existing connections or node names so
  /// a miss means the engine itself is broken.
  ///
  /// @throws IllegalStateException if there is no node with that name.
  public N findByName(String name) {
    final var node = nodes.get(name);
    if (node == null) {
      LOGGER.severe(ErrorStrings.NO_SUCH_NODE + name);
      throw new IllegalStateException(ErrorStrings.NO_SUCH_NODE + name);
    }
    return node;
  }

  /// Choose a single node uniformly at random.
  public N pickRandomNode() {
    return pickRandomNode(n -> true)
        .orElseThrow(() -> new IllegalStateException(ErrorStrings.EMPTY_GRID));
  }

  /// Choose a node uniformly at random from those matching the filter.
  public Optional<N> pickRandomNode(Predicate<N> filter) {
    final var candidates = nodes.values().stream().filter(filter).toList();
    if (candidates.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(candidates.get(rng.nextInt(candidates.size())));
  }

  /// Choose up to `amount` distinct nodes uniformly at random without replacement using a partial Fisher-Yates
  /// shuffle.
  public List<N> pickRandomNodes(int amount) {
    final var pool = new ArrayList<>(nodes.values());
    final var chosen = Math.min(Math.max(amount, 0), pool.size());
    for (int i = 0; i < chosen; i++) {
      Collections.swap(pool, i, i + rng.nextInt(pool.size() - i));
    }
    return List.copyOf(pool.subList(0, chosen));
  }

  /// Choose the initiator of a centralized algorithm and write the choice to the trace.
  public N chooseInitiator() {
    final var initiator = pickRandomNode();
    log.add("Choose " + initiator.name() + " as initiator.");
    return initiator;
  }

  /// Choose several initiators and write the choice to the trace.
  public List<N> chooseInitiators(int amount) {
    final var initiators = pickRandomNodes(amount);
    log.add("Choose " + initiators.stream().map(SimNode::name).collect(Collectors.toList()) + " as initiators.");
    return initiators;
  }

  public void send(M message) {
    messages.enqueue(message);
  }

  public void sendAll(List<M> outbound) {
    messages.enqueueAll(outbound);
  }

  public boolean hasMessages() {
    return !messages.isEmpty();
  }

  /// @return the queue of messages in flight.
  public MessageQueue<M> pending() {
    return messages;
  }

  /// Deliver until the queue is empty.
  public void dispatchLoop() {
    dispatchLoop(() -> false, sent -> {
    });
  }

  /// Deliver messages until the queue is empty or `stop` is true. The stop condition is checked before each delivery.
  ///
  /// @param stop          an algorithm specific termination condition such as a leader having been elected.
  /// @param afterDispatch called with the messages that a handler sent, after they have been queued.
  public void dispatchLoop(BooleanSupplier stop, Consumer<List<M>> afterDispatch) {
    while (!stop.getAsBoolean()) {
      final var next = messages.poll();
      if (next.isEmpty()) {
        break;
      }
      final var message = next.get();
      final var node = findByName(message.destination());
      LOGGER.finer(() -> node.name() + " <~ " + message);
      final var outbound = node.handle(message, log);
      messages.enqueueAll(outbound);
      afterDispatch.accept(outbound);
    }
    LOGGER.fine(() -> "dispatch loop finished with " + messages.size() + " messages pending");
  }
}
