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

import io.boxwood.node.BoxNode;
import io.boxwood.node.Damage;
import io.boxwood.node.NodeFlag;
import io.boxwood.settings.Fixed;
import it.unimi.dsi.fastutil.longs.LongList;
import org.checkerframework.checker.index.qual.Positive;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Inserts construction damage and escalates it to the ancestors of the damaged node, so the next
 * traversal reaches it.
 *
 * <p>
 * Ancestors are found along the layout parent chain, falling back to the DOM parent for nodes
 * which have not been laid out yet. Every ancestor gets {@link Damage#DESCENDANT}. An ancestor
 * which flattened the walked node into its own content (the node is not one of its layout
 * children, as for text in a paragraph) also gets {@link Damage#FORMATTING_CONTEXT}.
 * </p>
 */
public final class DamageTracker {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(DamageTracker.class);

  private final NodeArena arena;

  private final int maxTreeDepth;

  /**
   * Constructor.
   *
   * @param arena the node arena
   * @param maxTreeDepth bound of the ancestor walk
   */
  public DamageTracker(final NodeArena arena, final @Positive int maxTreeDepth) {
    this.arena = requireNonNull(arena);
    this.maxTreeDepth = maxTreeDepth;
  }

  /**
   * Insert damage on a node and escalate it.
   *
   * @param nodeKey the node key
   * @param damage the damage to insert
   */
  public void markDamaged(final long nodeKey, final Damage damage) {
    arena.get(nodeKey).insertDamage(damage);
    escalate(nodeKey);
  }

  /**
   * Damage the nearest table root above a node with {@link Damage#FORMATTING_CONTEXT}, for changes
   * which affect the table grid without changing any box.
   *
   * @param nodeKey the node key
   * @return {@code true} if a table root has been found
   */
  public boolean markTableDamaged(final long nodeKey) {
    long key = arena.get(nodeKey).getParentKey();
    for (int depth = 0; key != Fixed.NULL_NODE_KEY.getStandardProperty(); depth++) {
      if (depth >= maxTreeDepth) {
        LOGGER.warn("Maximum tree depth {} reached searching the table of node {}.", maxTreeDepth, nodeKey);
        return false;
      }
      final BoxNode node = arena.get(key);
      if (node.hasFlag(NodeFlag.IS_TABLE_ROOT)) {
        markDamaged(key, Damage.FORMATTING_CONTEXT);
        return true;
      }
      key = node.getParentKey();
    }
    return false;
  }

  /**
   * Escalate the damage of a node to its ancestors. Ancestors which flattened the walked node get
   * {@link Damage#FORMATTING_CONTEXT}, owners of a damaged anonymous wrapper get {@link Damage#BOX}.
   *
   * @param nodeKey the node key
   */
  public void escalate(final long nodeKey) {
    BoxNode walked = arena.get(nodeKey);
    BoxNode ancestor = damageParent(walked);
    int depth = 0;
    while (ancestor != null) {
      if (++depth > maxTreeDepth) {
        LOGGER.warn("Maximum tree depth {} reached escalating damage of node {}.", maxTreeDepth, nodeKey);
        return;
      }
      Damage damage = Damage.DESCENDANT;
      final LongList layoutChildren = ancestor.getLayoutChildren();
      if (layoutChildren != null && !layoutChildren.contains(walked.getNodeKey())) {
        damage = damage.union(Damage.FORMATTING_CONTEXT);
      }
      // Owners regroup the children of their wrappers.
      if (walked.isAnonymousWrapper() && walked.getAnonymousOwnerKey() == ancestor.getNodeKey()) {
        damage = damage.union(Damage.BOX);
      }
      ancestor.insertDamage(damage);
      walked = ancestor;
      ancestor = damageParent(walked);
    }
  }

  private @Nullable BoxNode damageParent(final BoxNode node) {
    final BoxNode layoutParent = arena.getOrNull(node.getLayoutParentKey());
    if (layoutParent != null) {
      return layoutParent;
    }
    return arena.getOrNull(node.getParentKey());
  }
}
