// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.random.RandomGenerator;
import java.util.stream.Stream;

/// The pending messages of a run. Every message is owned by the queue from the moment it is sent until it is polled
/// for delivery. Insertion follows the [ChannelDiscipline] of the message type; delivery is always from the front.
public class MessageQueue<M extends SimMessage> {
  private final ChannelDiscipline discipline;
  private final RandomGenerator rng;
  private final List<M> pending = new ArrayList<>();

  public MessageQueue(ChannelDiscipline discipline, RandomGenerator rng) {
    this.discipline = Objects.requireNonNull(discipline, "discipline");
    this.rng = Objects.requireNonNull(rng, "rng");
  }

  public void enqueue(M message) {
    pending.add(discipline.insertionIndex(pending.size(), rng), message);
  }

  /// FIFO keeps the relative order of the batch. Non-FIFO places each message independently so the batch order is
  /// not kept either.
  public void enqueueAll(Collection<? extends M> messages) {
    messages.forEach(this::enqueue);
  }

  public Optional<M> poll() {
    return pending.isEmpty() ? Optional.empty() : Optional.of(pending.remove(0));
  }

  public boolean isEmpty() {
    return pending.isEmpty();
  }

  public int size() {
    return pending.size();
  }

  /// @return the messages still in flight from front to back.
  public Stream<M> stream() {
    return pending.stream();
  }

  public ChannelDiscipline discipline() {
    return discipline;
  }
}
