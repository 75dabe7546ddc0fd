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

import io.boxwood.BoxTreeTestHelper;
import io.boxwood.BoxTreeTestHelper.TreeBuilder;
import io.boxwood.access.Document;
import io.boxwood.node.BoxNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static io.boxwood.BoxTreeTestHelper.ABSOLUTE_BLOCK;
import static io.boxwood.BoxTreeTestHelper.BLOCK;
import static io.boxwood.BoxTreeTestHelper.CONTENTS;
import static io.boxwood.BoxTreeTestHelper.DOCUMENT_KEY;
import static io.boxwood.BoxTreeTestHelper.FLOATED_BLOCK;
import static io.boxwood.BoxTreeTestHelper.INLINE;
import static io.boxwood.BoxTreeTestHelper.INLINE_BLOCK;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Test {@link StyleAdapter}.
 */
public final class StyleAdapterTest {

  private TreeBuilder tree;

  private Document document;

  private StyleAdapter adapter;

  @BeforeEach
  public void setUp() {
    tree = BoxTreeTestHelper.newTree();
    document = tree.document();
    adapter = document.getStyleAdapter();
  }

  private BoxNode node(final long nodeKey) {
    return document.getNode(nodeKey);
  }

  @Test
  public void testDisplayDefaults() {
    final long unstyled = document.createElement("span");
    document.appendChild(DOCUMENT_KEY, unstyled);
    final long div = tree.element(DOCUMENT_KEY, "div", BLOCK);

    assertEquals(Display.BLOCK, adapter.getDisplay(document.getDocumentNode()));
    assertEquals(Display.INLINE, adapter.getDisplay(node(unstyled)));
    assertEquals(Display.BLOCK, adapter.getDisplay(node(div)));
    assertEquals(Display.INLINE, adapter.getDisplay(node(tree.text(div, "a"))));
    assertEquals(Display.NONE, adapter.getDisplay(node(tree.comment(div, "c"))));
    assertNull(adapter.getBeforeStyle(node(unstyled)));
    assertNull(adapter.getAfterStyle(node(div)));
  }

  @Test
  public void testOutOfFlow() {
    final long absolute = tree.element(DOCUMENT_KEY, "div", ABSOLUTE_BLOCK);
    final long floated = tree.element(DOCUMENT_KEY, "div", FLOATED_BLOCK);
    final long div = tree.element(DOCUMENT_KEY, "div", BLOCK);

    assertTrue(adapter.isOutOfFlow(node(absolute)));
    assertTrue(adapter.isOutOfFlow(node(floated)));
    assertFalse(adapter.isOutOfFlow(node(div)));
    assertEquals(Position.STATIC, adapter.getPosition(node(tree.text(div, "a"))));
    assertEquals(FloatMode.NONE, adapter.getFloat(node(div)));
  }

  @Test
  public void testIsOrContainsBlock() {
    final long div = tree.element(DOCUMENT_KEY, "div", BLOCK);
    final long span = tree.element(div, "span", INLINE);
    final long inner = tree.element(span, "em", INLINE);
    tree.element(inner, "p", BLOCK);
    final long positioned = tree.element(div, "span", INLINE);
    tree.element(positioned, "div", ABSOLUTE_BLOCK);
    final long contents = tree.element(div, "section", CONTENTS);
    tree.element(contents, "div", BLOCK);
    final long inlineBlock = tree.element(div, "span", INLINE_BLOCK);
    tree.element(inlineBlock, "div", BLOCK);

    assertTrue(adapter.isOrContainsBlock(node(div)));
    assertTrue(adapter.isOrContainsBlock(node(span)));
    assertFalse(adapter.isOrContainsBlock(node(positioned)));
    assertTrue(adapter.isOrContainsBlock(node(contents)));
    assertFalse(adapter.isOrContainsBlock(node(inlineBlock)));
    assertFalse(adapter.isOrContainsBlock(node(tree.text(div, "a"))));
    assertFalse(adapter.isOrContainsBlock(node(tree.element(div, "div", FLOATED_BLOCK))));
  }

  @Test
  public void testWhitespace() {
    assertTrue(StyleAdapter.isWhitespace(""));
    assertTrue(StyleAdapter.isWhitespace(" \t\n"));
    assertFalse(StyleAdapter.isWhitespace("\u00a0"));
    assertFalse(StyleAdapter.isWhitespace(" a "));

    final long div = tree.element(DOCUMENT_KEY, "div", BLOCK);
    assertTrue(adapter.isWhitespaceNode(node(tree.text(div, "\n  "))));
    assertFalse(adapter.isWhitespaceNode(node(tree.text(div, "x"))));
    assertFalse(adapter.isWhitespaceNode(node(tree.comment(div, " "))));
  }

  @Test
  public void testWhiteSpaceCollapse() {
    final long pre = tree.element(DOCUMENT_KEY, "pre",
        ComputedValues.newBuilder().display(Display.BLOCK).whiteSpaceCollapse(WhiteSpaceCollapse.PRESERVE).build());
    final long text = tree.text(pre, " ");

    assertEquals(WhiteSpaceCollapse.PRESERVE, adapter.getWhiteSpaceCollapse(node(pre), WhiteSpaceCollapse.COLLAPSE));
    assertEquals(WhiteSpaceCollapse.PRESERVE_BREAKS,
        adapter.getWhiteSpaceCollapse(node(text), WhiteSpaceCollapse.PRESERVE_BREAKS));
  }

  @Test
  public void testResolveContent() {
    final long element = tree.element(DOCUMENT_KEY, "q", INLINE, Map.of("data-note", "1"));
    final ComputedStyle pseudoStyle = ComputedValues.newBuilder()
                                                    .display(Display.INLINE)
                                                    .addContent(ContentItem.string("["))
                                                    .addContent(ContentItem.attr("data-note"))
                                                    .addContent(ContentItem.attr("data-missing"))
                                                    .addContent(ContentItem.counter("item"))
                                                    .addContent(ContentItem.string("]"))
                                                    .build();

    assertEquals("[1]", adapter.resolveContent(pseudoStyle, node(element)));
    assertEquals("", adapter.resolveContent(INLINE, node(element)));
  }

  @Test
  public void testInvalidDepth() {
    assertThrows(IllegalArgumentException.class, () -> new StyleAdapter(document.getArena(), 0));
  }
}
