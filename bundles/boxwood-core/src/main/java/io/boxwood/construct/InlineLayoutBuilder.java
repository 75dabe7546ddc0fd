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
import io.boxwood.api.ParagraphBuilder;
import io.boxwood.api.ShapingContext;
import io.boxwood.layout.inline.InlineBoxKind;
import io.boxwood.layout.inline.InlineLayout;
import io.boxwood.node.BoxNode;
import io.boxwood.node.Damage;
import io.boxwood.node.NodeFlag;
import io.boxwood.style.ComputedStyle;
import io.boxwood.style.Display;
import io.boxwood.style.StyleAdapter;
import io.boxwood.style.WhiteSpaceCollapse;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Builds the paragraph of an inline formatting context root.
 *
 * <p>
 * The walk spans the root's {@code ::before}, children and {@code ::after}. Inline elements open a
 * style span and are descended into, {@code display: contents} elements are descended into without
 * a span, line breaks force a break, and replaced elements and every box which establishes its own
 * formatting context are embedded as atomic boxes. Nodes flattened into the paragraph get their
 * construction damage cleared, since the paragraph is their box.
 * </p>
 */
public final class InlineLayoutBuilder {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(InlineLayoutBuilder.class);

  private final Document document;

  private final StyleAdapter styleAdapter;

  private final PseudoElementSynchronizer synchronizer;

  private final ShapingContext shapingContext;

  /**
   * Constructor.
   *
   * @param document the document
   * @param synchronizer synchronizer for pseudo-elements of inline descendants
   * @param shapingContext the shaping context of the current traversal
   */
  public InlineLayoutBuilder(final Document document, final PseudoElementSynchronizer synchronizer,
      final ShapingContext shapingContext) {
    this.document = requireNonNull(document);
    this.styleAdapter = document.getStyleAdapter();
    this.synchronizer = requireNonNull(synchronizer);
    this.shapingContext = requireNonNull(shapingContext);
  }

  /**
   * Build the paragraph of a root, install it on the root and flag the root as inline root.
   *
   * @param rootKey the key of the root, an element or anonymous block
   * @return the keys of the embedded atomic boxes in paragraph order
   */
  public LongList build(final long rootKey) {
    final BoxNode root = document.getNode(rootKey);
    checkArgument(root.getKind().hasElementData(), "Node %s can not be an inline root.", rootKey);

    synchronizeInlinePseudos(root, 1);

    ComputedStyle rootStyle = root.getPrimaryStyle();
    if (rootStyle == null && root.hasParent()) {
      rootStyle = document.getNode(root.getParentKey()).getPrimaryStyle();
    }
    final WhiteSpaceCollapse mode = rootStyle == null ? WhiteSpaceCollapse.COLLAPSE : rootStyle.getWhiteSpaceCollapse();

    final ParagraphBuilder builder = shapingContext.newParagraph(rootKey, rootStyle);
    builder.setWhiteSpaceMode(mode);
    final LongArrayList inlineBoxes = new LongArrayList();
    walkContent(builder, root, rootKey, mode, inlineBoxes, 1);

    final InlineLayout layout = builder.build();
    root.elementData().setSpecialData(layout);
    root.setFlag(NodeFlag.IS_INLINE_ROOT, true);
    LOGGER.debug("Built paragraph of {} with {} characters and {} inline boxes.", rootKey, layout.getText().length(),
        inlineBoxes.size());
    return inlineBoxes;
  }

  private void synchronizeInlinePseudos(final BoxNode node, final int depth) {
    if (depth > document.getConfiguration().maxTreeDepth) {
      LOGGER.warn("Maximum tree depth {} reached synchronizing pseudo-elements below {}.",
          document.getConfiguration().maxTreeDepth, node.getNodeKey());
      return;
    }
    for (final long childKey : node.getChildren()) {
      synchronizer.synchronize(childKey);
      final BoxNode child = document.getNode(childKey);
      final Display display = styleAdapter.getDisplay(child);
      if (child.getKind().hasElementData() && (display.isInlineFlow() || display.isContents())) {
        synchronizeInlinePseudos(child, depth + 1);
      }
    }
  }

  private void walkContent(final ParagraphBuilder builder, final BoxNode node, final long parentKey,
      final WhiteSpaceCollapse mode, final LongArrayList inlineBoxes, final int depth) {
    if (node.hasBefore()) {
      walk(builder, parentKey, node.getBeforeKey(), mode, inlineBoxes, depth);
    }
    for (final long childKey : node.getChildren()) {
      walk(builder, parentKey, childKey, mode, inlineBoxes, depth);
    }
    if (node.hasAfter()) {
      walk(builder, parentKey, node.getAfterKey(), mode, inlineBoxes, depth);
    }
  }

  private void walk(final ParagraphBuilder builder, final long parentKey, final long nodeKey,
      final WhiteSpaceCollapse inheritedMode, final LongArrayList inlineBoxes, final int depth) {
    final BoxNode node = document.getNode(nodeKey);
    node.setLayoutParentKey(parentKey);
    if (depth > document.getConfiguration().maxTreeDepth) {
      LOGGER.warn("Maximum tree depth {} reached in paragraph at node {}.", document.getConfiguration().maxTreeDepth,
          nodeKey);
      return;
    }

    final WhiteSpaceCollapse mode = styleAdapter.getWhiteSpaceCollapse(node, inheritedMode);
    builder.setWhiteSpaceMode(mode);

    switch (node.getKind()) {
      case TEXT -> {
        node.removeDamage(Damage.CONSTRUCTION);
        builder.pushText(requireNonNull(node.getValue()));
      }
      case COMMENT -> node.removeDamage(Damage.CONSTRUCTION);
      case ELEMENT, ANONYMOUS_BLOCK -> walkElement(builder, node, parentKey, mode, inlineBoxes, depth);
      default -> LOGGER.debug("Ignoring node {} of kind {} in paragraph.", nodeKey, node.getKind());
    }
  }

  private void walkElement(final ParagraphBuilder builder, final BoxNode node, final long parentKey,
      final WhiteSpaceCollapse mode, final LongArrayList inlineBoxes, final int depth) {
    final long nodeKey = node.getNodeKey();
    if (isHiddenInput(node)) {
      flatten(node);
      return;
    }

    final Display display = styleAdapter.getDisplay(node);
    if (display.isNone()) {
      flatten(node);
      document.resetDescendantLayouts(nodeKey);
    } else if (display.isContents()) {
      flatten(node);
      walkContent(builder, node, parentKey, mode, inlineBoxes, depth + 1);
    } else if (display.isInternalTable()) {
      LOGGER.debug("Dropping internal table box {} outside of a table.", nodeKey);
    } else if (display.isInlineFlow()) {
      if (node.isElement() && document.getConfiguration().isReplacedElement(node.getTagName())) {
        pushInlineBox(builder, node, inlineBoxes);
      } else if (node.isElement() && "br".equals(node.getTagName())) {
        flatten(node);
        builder.pushLineBreak();
      } else {
        flatten(node);
        builder.pushStyleSpan(nodeKey, node.getPrimaryStyle());
        walkContent(builder, node, nodeKey, mode, inlineBoxes, depth + 1);
        builder.popStyleSpan();
      }
    } else {
      pushInlineBox(builder, node, inlineBoxes);
    }
  }

  /**
   * Mark a node which generates no box of its own as built, dropping what a previous pass built
   * for it.
   */
  private void flatten(final BoxNode node) {
    node.removeDamage(Damage.CONSTRUCTION);
    final int discarded = document.resetLayout(node.getNodeKey());
    if (discarded > 0) {
      LOGGER.debug("Discarded {} anonymous blocks of flattened node {}.", discarded, node.getNodeKey());
    }
  }

  private void pushInlineBox(final ParagraphBuilder builder, final BoxNode node, final LongArrayList inlineBoxes) {
    final InlineBoxKind kind;
    if (styleAdapter.getPosition(node).isAbsolutelyPositioned()) {
      kind = InlineBoxKind.OUT_OF_FLOW;
    } else if (styleAdapter.getFloat(node).isFloating()) {
      kind = InlineBoxKind.CUSTOM_OUT_OF_FLOW;
    } else {
      kind = InlineBoxKind.IN_FLOW;
    }
    builder.pushInlineBox(node.getNodeKey(), kind);
    inlineBoxes.add(node.getNodeKey());
  }

  private static boolean isHiddenInput(final BoxNode node) {
    return node.isElement() && "input".equals(node.getTagName()) && "hidden".equalsIgnoreCase(
        node.getAttribute("type"));
  }
}
