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

package io.boxwood.style;

import io.boxwood.access.NodeArena;
import io.boxwood.node.BoxNode;
import io.boxwood.node.NodeKind;
import io.boxwood.node.NodeStyleData;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Read-only access to the cascade output of the nodes of an arena, with the defaults box
 * construction relies on for unstyled nodes.
 */
public final class StyleAdapter {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(StyleAdapter.class);

  private final NodeArena arena;

  private final int maxTreeDepth;

  /**
   * Constructor.
   *
   * @param arena the node arena
   * @param maxTreeDepth bound for recursive probes
   */
  public StyleAdapter(final NodeArena arena, final @NonNegative int maxTreeDepth) {
    this.arena = requireNonNull(arena);
    checkArgument(maxTreeDepth > 0, "maxTreeDepth must be > 0!");
    this.maxTreeDepth = maxTreeDepth;
  }

  public @Nullable ComputedStyle getPrimaryStyle(final BoxNode node) {
    return node.getPrimaryStyle();
  }

  public @Nullable ComputedStyle getBeforeStyle(final BoxNode node) {
    final NodeStyleData styleData = node.getStyleData();
    return styleData == null ? null : styleData.before();
  }

  public @Nullable ComputedStyle getAfterStyle(final BoxNode node) {
    final NodeStyleData styleData = node.getStyleData();
    return styleData == null ? null : styleData.after();
  }

  /**
   * Get the display of a node. Unstyled anonymous blocks and the document default to block, text
   * and every other unstyled node to inline.
   *
   * @param node the node
   * @return the display
   */
  public Display getDisplay(final BoxNode node) {
    if (node.getKind() == NodeKind.COMMENT) {
      return Display.NONE;
    }
    final ComputedStyle style = node.getPrimaryStyle();
    if (style != null && node.getKind().hasElementData()) {
      return style.getDisplay();
    }
    return switch (node.getKind()) {
      case DOCUMENT, ANONYMOUS_BLOCK -> Display.BLOCK;
      default -> Display.INLINE;
    };
  }

  public FloatMode getFloat(final BoxNode node) {
    final ComputedStyle style = node.getPrimaryStyle();
    return style == null || !node.getKind().hasElementData() ? FloatMode.NONE : style.getFloat();
  }

  public Position getPosition(final BoxNode node) {
    final ComputedStyle style = node.getPrimaryStyle();
    return style == null || !node.getKind().hasElementData() ? Position.STATIC : style.getPosition();
  }

  /**
   * Determines if a node is taken out of the normal flow, by absolute positioning or floating.
   *
   * @param node the node
   * @return {@code true} if the node is out-of-flow
   */
  public boolean isOutOfFlow(final BoxNode node) {
    return getPosition(node).isAbsolutelyPositioned() || getFloat(node).isFloating();
  }

  /**
   * Get the white space collapse mode of a node.
   *
   * @param node the node
   * @param inherited the mode to use if the node is not styled
   * @return the mode
   */
  public WhiteSpaceCollapse getWhiteSpaceCollapse(final BoxNode node, final WhiteSpaceCollapse inherited) {
    final ComputedStyle style = node.getPrimaryStyle();
    return style == null ? inherited : style.getWhiteSpaceCollapse();
  }

  /**
   * Determines if a node is a text node consisting of white space only.
   *
   * @param node the node
   * @return {@code true} for white space text
   */
  public boolean isWhitespaceNode(final BoxNode node) {
    return node.isText() && isWhitespace(requireNonNull(node.getValue()));
  }

  /**
   * Determines if every character is a space, tab or newline. The empty string qualifies.
   *
   * @param text the text
   * @return {@code true} if the text is white space only
   */
  public static boolean isWhitespace(final CharSequence text) {
    for (int i = 0, length = text.length(); i < length; i++) {
      final char c = text.charAt(i);
      if (c != ' ' && c != '\t' && c != '\n') {
        return false;
      }
    }
    return true;
  }

  /**
   * Determines if a node is an in-flow block-level box, or an inline box or {@code contents}
   * element which contains one.
   *
   * @param node the node
   * @return {@code true} if the node has to be treated as block-level
   */
  public boolean isOrContainsBlock(final BoxNode node) {
    return isOrContainsBlock(node, 0);
  }

  private boolean isOrContainsBlock(final BoxNode node, final int depth) {
    if (!node.getKind().hasElementData() || isOutOfFlow(node)) {
      return false;
    }
    final Display display = getDisplay(node);
    if (display.isBlockLevel()) {
      return true;
    }
    if (!display.isInlineFlow() && !display.isContents()) {
      return false;
    }
    if (depth >= maxTreeDepth) {
      LOGGER.warn("Maximum tree depth {} reached probing node {} for block content.", maxTreeDepth,
          node.getNodeKey());
      return false;
    }
    if (node.hasBefore() && isOrContainsBlock(arena.get(node.getBeforeKey()), depth + 1)) {
      return true;
    }
    for (final long childKey : node.getChildren()) {
      if (isOrContainsBlock(arena.get(childKey), depth + 1)) {
        return true;
      }
    }
    return node.hasAfter() && isOrContainsBlock(arena.get(node.getAfterKey()), depth + 1);
  }

  /**
   * Resolve the generated text of a pseudo-element. Strings are taken literally, {@code attr()}
   * items are looked up on the originating element, other items generate no text.
   *
   * @param pseudoStyle the pseudo-element's style
   * @param originatingElement the element the pseudo-element belongs to
   * @return the generated text, possibly empty
   */
  public String resolveContent(final ComputedStyle pseudoStyle, final BoxNode originatingElement) {
    final StringBuilder text = new StringBuilder();
    for (final ContentItem item : pseudoStyle.getContent()) {
      switch (item.kind()) {
        case STRING -> text.append(item.value());
        case ATTR -> {
          final String value = originatingElement.getAttribute(item.value());
          if (value != null) {
            text.append(value);
          }
        }
        default -> {
        }
      }
    }
    return text.toString();
  }
}
