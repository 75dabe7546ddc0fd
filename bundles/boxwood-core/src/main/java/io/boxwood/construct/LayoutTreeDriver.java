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

package io.boxwood.construct;

import com.google.common.base.MoreObjects;
import io.boxwood.access.Document;
import io.boxwood.access.NodeArena;
import io.boxwood.api.ShapingContext;
import io.boxwood.node.BoxNode;
import io.boxwood.node.Damage;
import io.boxwood.settings.Fixed;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Incremental, damage-driven traversal which brings the box tree of a document up to date.
 *
 * <p>
 * A node whose damage intersects {@link Damage#BOX} or {@link Damage#FORMATTING_CONTEXT}, or which
 * has never been laid out, is rebuilt: its pseudo-elements are synchronized, its layout children
 * recomputed and every new member is visited. A clean node without {@link Damage#DESCENDANT} is
 * skipped together with its subtree. A clean node with {@link Damage#DESCENDANT} reuses its cached
 * layout children and visits them. Every visited member gets the current node as layout parent.
 * </p>
 *
 * <p>
 * The text shaping context is acquired at the start of a pass and released at its end.
 * </p>
 */
public final class LayoutTreeDriver {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(LayoutTreeDriver.class);

  /** Damage which forces a node to be rebuilt. */
  private static final Damage STALE = Damage.BOX.union(Damage.FORMATTING_CONTEXT);

  private final Document document;

  private final NodeArena arena;

  private final int maxTreeDepth;

  /**
   * Constructor.
   *
   * @param document the document to lay out
   */
  public LayoutTreeDriver(final Document document) {
    this.document = requireNonNull(document);
    arena = document.getArena();
    maxTreeDepth = document.getConfiguration().maxTreeDepth;
  }

  /**
   * Counters of a single pass.
   *
   * @param visited number of nodes visited
   * @param rebuilt number of nodes whose layout children were recomputed
   * @param reused number of nodes whose cached layout children were reused
   * @param skipped number of clean subtrees which were not descended into
   */
  public record PassStatistics(int visited, int rebuilt, int reused, int skipped) {
    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
                        .add("visited", visited)
                        .add("rebuilt", rebuilt)
                        .add("reused", reused)
                        .add("skipped", skipped)
                        .toString();
    }
  }

  /**
   * Run one pass starting at the document node.
   *
   * @return the statistics of the pass
   */
  public PassStatistics resolve() {
    final Pass pass;
    try (final ShapingContext shapingContext =
        document.getTextShaper().openContext(document.getConfiguration().viewportScale)) {
      final PseudoElementSynchronizer synchronizer = new PseudoElementSynchronizer(document);
      pass = new Pass(synchronizer, new LayoutChildrenCollector(document, synchronizer, shapingContext));
      pass.visit(Fixed.DOCUMENT_NODE_KEY.getStandardProperty(), 0);
    }
    final PassStatistics statistics = new PassStatistics(pass.visited, pass.rebuilt, pass.reused, pass.skipped);
    LOGGER.debug("Box tree pass finished: {}", statistics);
    return statistics;
  }

  /** State of a single pass. */
  private final class Pass {
    private final PseudoElementSynchronizer synchronizer;

    private final LayoutChildrenCollector collector;

    private int visited;

    private int rebuilt;

    private int reused;

    private int skipped;

    Pass(final PseudoElementSynchronizer synchronizer, final LayoutChildrenCollector collector) {
      this.synchronizer = synchronizer;
      this.collector = collector;
    }

    void visit(final long nodeKey, final int depth) {
      if (depth > maxTreeDepth) {
        LOGGER.warn("Maximum tree depth {} reached at node {}.", maxTreeDepth, nodeKey);
        return;
      }
      final BoxNode node = arena.get(nodeKey);
      visited++;

      if (node.hasDamage(STALE) || !node.hasLayoutChildren()) {
        synchronizer.synchronize(nodeKey);
        final LongList members = collector.collect(nodeKey);
        rebuilt++;
        visitMembers(nodeKey, members, depth);
        node.removeDamage(Damage.CONSTRUCTION);
      } else if (!node.hasDamage(Damage.DESCENDANT)) {
        skipped++;
      } else {
        reused++;
        visitMembers(nodeKey, requireNonNull(node.getLayoutChildren()), depth);
        node.removeDamage(Damage.DESCENDANT);
      }
    }

    private void visitMembers(final long nodeKey, final LongList members, final int depth) {
      for (final long memberKey : new LongArrayList(members)) {
        arena.get(memberKey).setLayoutParentKey(nodeKey);
        visit(memberKey, depth + 1);
      }
    }
  }
}
