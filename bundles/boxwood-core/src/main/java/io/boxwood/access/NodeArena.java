/*
 * Copyright (c) 2023, Boxwood Contributors
 *
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *     * Redistributions of source code must retain the above copyright
 *       notice, this list of conditions and the following disclaimer.
 *     * Redistributions in binary form must reproduce the above copyright
 *       notice, this list of conditions and the following disclaimer in the
 *       documentation and/or other materials provided with the distribution.
 *     * Neither the name of the <organization> nor the
 *       names of its contributors may be used to endorse or promote products
 *       derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.boxwood.access;

import com.google.common.base.MoreObjects;
import io.boxwood.node.BoxNode;
import io.boxwood.node.ElementData;
import io.boxwood.node.NodeKind;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.function.Consumer;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Index-stable slab storage of the nodes of one document. Keys of removed nodes are reused by
 * later insertions, most recently freed first.
 */
public final class NodeArena {

  /** Slots indexed by node key, {@code null} for free slots. */
  private final ObjectArrayList<@Nullable BoxNode> slots = new ObjectArrayList<>();

  /** Free keys, the next one to reuse on top. */
  private final LongArrayList freeKeys = new LongArrayList();

  /** Number of live nodes. */
  private int size;

  /**
   * Create a node in the next free slot.
   *
   * @param kind the node kind
   * @param elementData element data for elements and anonymous blocks
   * @param value character data for text and comments
   * @return the new node
   */
  public BoxNode create(final NodeKind kind, final @Nullable ElementData elementData, final @Nullable String value) {
    final long key = freeKeys.isEmpty() ? slots.size() : freeKeys.popLong();
    final BoxNode node = new BoxNode(key, kind, elementData, value);
    if (key == slots.size()) {
      slots.add(node);
    } else {
      slots.set((int) key, node);
    }
    size++;
    return node;
  }

  /**
   * Get a live node.
   *
   * @param key the node key
   * @return the node
   * @throws IllegalArgumentException if no live node has the key
   */
  public BoxNode get(final long key) {
    final BoxNode node = getOrNull(key);
    checkArgument(node != null, "No node with key %s.", key);
    return node;
  }

  /**
   * Get a live node.
   *
   * @param key the node key
   * @return the node or {@code null} if no live node has the key
   */
  public @Nullable BoxNode getOrNull(final long key) {
    if (key < 0 || key >= slots.size()) {
      return null;
    }
    return slots.get((int) key);
  }

  public boolean contains(final long key) {
    return getOrNull(key) != null;
  }

  /**
   * Remove a single node. Relations to and from the node are left to the caller.
   *
   * @param key the node key
   * @return the removed node
   * @throws IllegalArgumentException if no live node has the key
   */
  public BoxNode remove(final long key) {
    final BoxNode node = get(key);
    slots.set((int) key, null);
    freeKeys.add(key);
    size--;
    return node;
  }

  /**
   * Get the number of live nodes.
   *
   * @return the number of live nodes
   */
  public int size() {
    return size;
  }

  /**
   * Apply an action to every live node in key order.
   *
   * @param action the action
   */
  public void forEach(final Consumer<BoxNode> action) {
    for (final BoxNode node : slots) {
      if (node != null) {
        action.accept(node);
      }
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("size", size).add("capacity", slots.size()).toString();
  }
}
