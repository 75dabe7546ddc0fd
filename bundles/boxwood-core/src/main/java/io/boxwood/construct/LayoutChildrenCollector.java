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

import io.boxwood.access.Document;
import io.boxwood.access.NodeArena;
import io.boxwood.api.ShapingContext;
import io.boxwood.node.BoxNode;
import io.boxwood.node.Damage;
import io.boxwood.node.ElementData;
import io.boxwood.node.NodeFlag;
import io.boxwood.node.ReplacedElementData;
import io.boxwood.style.ComputedStyle;
import io.boxwood.style.Display;
import io.boxwood.style.StyleAdapter;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Box-tree fixup: turns the DOM children of a node into its ordered layout children.
 *
 * <p>
 * Depending on the node's display the children are passed through, wrapped into anonymous block
 * boxes, delegated to an inline formatting context (the node becomes an inline root) or to a table
 * context (the node becomes a table root). {@code display: contents} children are replaced by
 * their own content before classification. Anonymous blocks created by an earlier run for the same
 * node are discarded first, so no synthesized box outlives the run which stopped needing it.
 * </p>
 */
public final class LayoutChildrenCollector {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(LayoutChildrenCollector.class);

  /** Tag name of anonymous block wrappers. */
  private static final String ANONYMOUS_TAG_NAME = "div";

  private final Document document;

  private final NodeArena arena;

  private final StyleAdapter styleAdapter;

  private final PseudoElementSynchronizer synchronizer;

  private final InlineLayoutBuilder inlineLayoutBuilder;

  private final TableContextBuilder tableContextBuilder;

  /**
   * Constructor.
   *
   * @param document the document
   * @param synchronizer synchronizer for pseudo-elements of flattened nodes
   * @param shapingContext the shaping context of the current traversal
   */
  public LayoutChildrenCollector(final Document document, final PseudoElementSynchronizer synchronizer,
      final ShapingContext shapingContext) {
    this.document = requireNonNull(document);
    this.synchronizer = requireNonNull(synchronizer);
    arena = document.getArena();
    styleAdapter = document.getStyleAdapter();
    inlineLayoutBuilder = new InlineLayoutBuilder(document, synchronizer, shapingContext);
    tableContextBuilder = new TableContextBuilder(document);
  }

  /**
   * Recompute the layout children of a node and cache them on the node.
   *
   * @param nodeKey the node key
   * @return the new layout children
   */
  public LongList collect(final long nodeKey) {
    final BoxNode node = arena.get(nodeKey);
    final int discarded = document.resetLayout(nodeKey);
    if (discarded > 0) {
      LOGGER.debug("Discarded {} anonymous blocks of {}.", discarded, nodeKey);
    }
    final ElementData elementData = node.getElementData();

    final LongArrayList layoutChildren = new LongArrayList();
    compute(node, layoutChildren);

    if (elementData != null && elementData.getSpecialData() == null && node.isElement()
        && document.getConfiguration().isReplacedElement(elementData.getTagName())) {
      elementData.setSpecialData(ReplacedElementData.fromAttributes(elementData.getAttributes()));
    }
    node.setLayoutChildren(layoutChildren);
    return layoutChildren;
  }

  private void compute(final BoxNode node, final LongArrayList layoutChildren) {
    if (node.isText() || node.isComment()) {
      return;
    }
    if (node.getChildren().isEmpty() && !node.hasBefore() && !node.hasAfter()) {
      return;
    }

    final Display display = styleAdapter.getDisplay(node);
    if (display.isNone()) {
      document.resetDescendantLayouts(node.getNodeKey());
      return;
    }
    if (display.isContents()) {
      pushNonWhitespace(effectiveChildren(node), layoutChildren);
      return;
    }

    switch (display.inside()) {
      case FLOW, FLOW_ROOT, TABLE_CELL -> collectBlockContainer(node, layoutChildren);
      case FLEX, GRID -> collectFlexOrGridContainer(node, layoutChildren);
      case TABLE -> collectTable(node, layoutChildren);
      default -> pushNonWhitespace(effectiveChildren(node), layoutChildren);
    }
  }

  private void collectBlockContainer(final BoxNode node, final LongArrayList layoutChildren) {
    final LongList children = effectiveChildren(node);

    boolean allBlock = true;
    boolean allInline = true;
    boolean allOutOfFlow = true;
    for (final long childKey : children) {
      final BoxNode child = arena.get(childKey);
      if (styleAdapter.isWhitespaceNode(child) || styleAdapter.isOutOfFlow(child)) {
        continue;
      }
      allOutOfFlow = false;
      final Display display = styleAdapter.getDisplay(child);
      if (display.isNone()) {
        continue;
      }
      if (display.isBlockLevel()) {
        allInline = false;
      } else {
        allBlock = false;
        if (styleAdapter.isOrContainsBlock(child)) {
          allInline = false;
        }
      }
    }

    if (allOutOfFlow) {
      pushNonWhitespace(children, layoutChildren);
    } else if (allInline && node.getKind().hasElementData()) {
      layoutChildren.addAll(inlineLayoutBuilder.build(node.getNodeKey()));
    } else if (allBlock) {
      pushNonWhitespace(children, layoutChildren);
    } else {
      wrapInlineRuns(node, children, layoutChildren, true);
    }
  }

  private void collectFlexOrGridContainer(final BoxNode node, final LongArrayList layoutChildren) {
    final LongList children = effectiveChildren(node);
    boolean hasText = false;
    for (final long childKey : children) {
      if (arena.get(childKey).isText()) {
        hasText = true;
        break;
      }
    }
    if (hasText) {
      wrapInlineRuns(node, children, layoutChildren, false);
    } else {
      pushNonWhitespace(children, layoutChildren);
    }
  }

  private void collectTable(final BoxNode node, final LongArrayList layoutChildren) {
    final TableContextBuilder.Result result = tableContextBuilder.build(node.getNodeKey());
    node.elementData().setSpecialData(result.tableContext());
    node.setFlag(NodeFlag.IS_TABLE_ROOT, true);
    if (node.hasBefore()) {
      layoutChildren.add(node.getBeforeKey());
    }
    layoutChildren.addAll(result.cells());
    if (node.hasAfter()) {
      layoutChildren.add(node.getAfterKey());
    }
  }

  /**
   * Single left-to-right pass wrapping runs of inline-level children into anonymous blocks.
   *
   * @param container the container
   * @param children the effective children
   * @param layoutChildren the target list
   * @param blockContainer {@code true} for block containers, where text and inline-level boxes are
   *        wrapped, {@code false} for flex and grid containers, where only text is wrapped
   */
  private void wrapInlineRuns(final BoxNode container, final LongList children, final LongArrayList layoutChildren,
      final boolean blockContainer) {
    BoxNode anonymousBlock = null;
    for (final long childKey : children) {
      final BoxNode child = arena.get(childKey);
      final boolean needsWrap;
      if (blockContainer) {
        final Display display = styleAdapter.getDisplay(child);
        if (child.getKind().hasElementData() && (styleAdapter.isOutOfFlow(child) || display.isNone())) {
          layoutChildren.add(childKey);
          continue;
        }
        needsWrap = child.isText() || (display.isInlineLevel() && !styleAdapter.isOrContainsBlock(child));
      } else {
        needsWrap = child.isText();
        if (needsWrap && anonymousBlock == null && styleAdapter.isWhitespaceNode(child)) {
          continue;
        }
      }

      if (needsWrap) {
        if (anonymousBlock == null) {
          anonymousBlock = createAnonymousBlock(container);
          layoutChildren.add(anonymousBlock.getNodeKey());
        }
        anonymousBlock.getChildren().add(childKey);
      } else {
        closeAnonymousBlock(anonymousBlock, layoutChildren);
        anonymousBlock = null;
        layoutChildren.add(childKey);
      }
    }
    closeAnonymousBlock(anonymousBlock, layoutChildren);
  }

  private BoxNode createAnonymousBlock(final BoxNode container) {
    final ComputedStyle style = document.getStyleResolver().resolveAnonymousBlockStyle(container.getPrimaryStyle());
    final BoxNode anonymousBlock = document.createAnonymousBlock(ANONYMOUS_TAG_NAME, container.getNodeKey(), style);
    anonymousBlock.setAnonymousOwnerKey(container.getNodeKey());
    LOGGER.debug("Created anonymous block {} in {}.", anonymousBlock.getNodeKey(), container.getNodeKey());
    return anonymousBlock;
  }

  private void closeAnonymousBlock(final @Nullable BoxNode anonymousBlock, final LongArrayList layoutChildren) {
    if (anonymousBlock == null) {
      return;
    }
    for (final long childKey : anonymousBlock.getChildren()) {
      if (!styleAdapter.isWhitespaceNode(arena.get(childKey))) {
        return;
      }
    }
    layoutChildren.rem(anonymousBlock.getNodeKey());
    document.dropAnonymousWrapper(anonymousBlock.getNodeKey());
    LOGGER.debug("Dropped white space anonymous block {}.", anonymousBlock.getNodeKey());
  }

  /**
   * Get the children a container classifies: {@code ::before}, DOM children and {@code ::after},
   * with comments and internal table boxes dropped and {@code display: contents} elements replaced
   * by their own effective children. Every effective child is stamped with the container as its
   * layout parent.
   *
   * @param container the container
   * @return the effective children in order
   */
  LongList effectiveChildren(final BoxNode container) {
    final LongArrayList children = new LongArrayList();
    appendEffectiveChildren(container, container.getNodeKey(), children, 1);
    return children;
  }

  private void appendEffectiveChildren(final BoxNode source, final long containerKey, final LongArrayList target,
      final int depth) {
    if (source.hasBefore()) {
      appendEffectiveChild(source.getBeforeKey(), containerKey, target, depth);
    }
    for (final long childKey : source.getChildren()) {
      appendEffectiveChild(childKey, containerKey, target, depth);
    }
    if (source.hasAfter()) {
      appendEffectiveChild(source.getAfterKey(), containerKey, target, depth);
    }
  }

  private void appendEffectiveChild(final long childKey, final long containerKey, final LongArrayList target,
      final int depth) {
    final BoxNode child = arena.get(childKey);
    if (child.isComment()) {
      return;
    }
    child.setLayoutParentKey(containerKey);
    final Display display = styleAdapter.getDisplay(child);
    if (child.getKind().hasElementData() && display.isContents()) {
      if (depth > document.getConfiguration().maxTreeDepth) {
        LOGGER.warn("Maximum tree depth {} reached flattening contents of {}.",
            document.getConfiguration().maxTreeDepth, containerKey);
        return;
      }
      synchronizer.synchronize(childKey);
      child.removeDamage(Damage.CONSTRUCTION);
      document.resetLayout(childKey);
      appendEffectiveChildren(child, containerKey, target, depth + 1);
    } else if (display.isInternalTable()) {
      LOGGER.debug("Dropping internal table box {} outside of a table.", childKey);
    } else {
      target.add(childKey);
    }
  }

  private void pushNonWhitespace(final LongList children, final LongArrayList layoutChildren) {
    for (final long childKey : children) {
      if (!styleAdapter.isWhitespaceNode(arena.get(childKey))) {
        layoutChildren.add(childKey);
      }
    }
  }
}
