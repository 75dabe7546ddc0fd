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

import io.boxwood.BoxTreeTestHelper;
import io.boxwood.BoxTreeTestHelper.TreeBuilder;
import io.boxwood.access.Document;
import io.boxwood.api.ShapingContext;
import io.boxwood.layout.inline.InlineBox;
import io.boxwood.layout.inline.InlineBoxKind;
import io.boxwood.layout.inline.InlineLayout;
import io.boxwood.layout.inline.StyleSpan;
import io.boxwood.node.Damage;
import io.boxwood.node.NodeFlag;
import io.boxwood.style.ComputedValues;
import io.boxwood.style.Display;
import io.boxwood.style.WhiteSpaceCollapse;
import it.unimi.dsi.fastutil.longs.LongList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.boxwood.BoxTreeTestHelper.BLOCK;
import static io.boxwood.BoxTreeTestHelper.CONTENTS;
import static io.boxwood.BoxTreeTestHelper.DOCUMENT_KEY;
import static io.boxwood.BoxTreeTestHelper.INLINE;
import static io.boxwood.BoxTreeTestHelper.INLINE_BLOCK;
import static io.boxwood.BoxTreeTestHelper.NONE;
import static io.boxwood.BoxTreeTestHelper.keys;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Test {@link InlineLayoutBuilder}.
 */
public final class InlineLayoutBuilderTest {

  private TreeBuilder tree;

  private Document document;

  @BeforeEach
  public void setUp() {
    tree = BoxTreeTestHelper.newTree();
    document = tree.document();
  }

  private LongList build(final long rootKey) {
    try (final ShapingContext shapingContext = document.getTextShaper().openContext(2f)) {
      return new InlineLayoutBuilder(document, new PseudoElementSynchronizer(document), shapingContext).build(rootKey);
    }
  }

  private InlineLayout layout(final long rootKey) {
    return document.getInlineLayout(rootKey).orElseThrow();
  }

  @Test
  public void testParagraphStructure() {
    final long paragraph = tree.element(DOCUMENT_KEY, "p", BLOCK);
    tree.text(paragraph, "Hello ");
    final long span = tree.element(paragraph, "span", INLINE);
    final long world = tree.text(span, "world");
    final long image = tree.element(paragraph, "img", INLINE);
    tree.element(paragraph, "br", INLINE);
    tree.text(paragraph, "  next  ");

    final LongList inlineBoxes = build(paragraph);

    assertEquals(keys(image), inlineBoxes);
    assertTrue(document.isInlineRoot(paragraph));
    final InlineLayout layout = layout(paragraph);
    assertEquals(paragraph, layout.getRootKey());
    assertEquals("Hello world\nnext", layout.getText());
    assertEquals(2f, layout.getScale());
    assertEquals(List.of(new StyleSpan(span, 6, 11, 0)), layout.getStyleSpans());
    assertEquals(List.of(new InlineBox(image, InlineBoxKind.IN_FLOW, 11)), layout.getInlineBoxes());
    assertEquals(keys(image), layout.getInlineBoxKeys());

    assertEquals(span, document.getLayoutParentKey(world));
    assertEquals(paragraph, document.getLayoutParentKey(span));
    assertFalse(document.getNode(span).hasDamage(Damage.CONSTRUCTION));
    assertFalse(document.getNode(world).hasDamage(Damage.CONSTRUCTION));
  }

  @Test
  public void testNestedSpans() {
    final long paragraph = tree.element(DOCUMENT_KEY, "p", BLOCK);
    final long outer = tree.element(paragraph, "b", INLINE);
    tree.text(outer, "a");
    final long inner = tree.element(outer, "i", INLINE);
    tree.text(inner, "b");

    build(paragraph);

    assertEquals(List.of(new StyleSpan(outer, 0, 2, 0), new StyleSpan(inner, 1, 2, 1)),
        layout(paragraph).getStyleSpans());
  }

  @Test
  public void testAtomicAndSkippedDescendants() {
    final long paragraph = tree.element(DOCUMENT_KEY, "p", BLOCK);
    tree.text(paragraph, "a");
    final long inlineBlock = tree.element(paragraph, "span", INLINE_BLOCK);
    tree.text(inlineBlock, "inside");
    final long hidden = tree.element(paragraph, "input", INLINE, Map.of("type", "hidden"));
    final long button = tree.element(paragraph, "button", INLINE);
    tree.text(button, "press");
    final long invisible = tree.element(paragraph, "span", NONE);
    tree.text(invisible, "gone");
    final long contents = tree.element(paragraph, "span", CONTENTS);
    tree.text(contents, "c");
    tree.comment(paragraph, "ignored");

    final LongList inlineBoxes = build(paragraph);

    assertEquals(keys(inlineBlock, button), inlineBoxes);
    assertEquals("ac", layout(paragraph).getText());
    assertTrue(layout(paragraph).getStyleSpans().isEmpty());
    assertFalse(document.getNode(hidden).hasDamage(Damage.CONSTRUCTION));
    assertTrue(document.getNode(inlineBlock).hasDamage(Damage.BOX));
  }

  @Test
  public void testPreservedWhiteSpace() {
    final long pre = tree.element(DOCUMENT_KEY, "pre", ComputedValues.newBuilder()
                                                                      .display(Display.BLOCK)
                                                                      .whiteSpaceCollapse(WhiteSpaceCollapse.PRESERVE)
                                                                      .build());
    tree.text(pre, "a  b\nc ");

    build(pre);

    assertEquals("a  b\nc ", layout(pre).getText());
    assertEquals(WhiteSpaceCollapse.PRESERVE, layout(pre).getRootWhiteSpaceMode());
  }

  @Test
  public void testTextNodeCanNotBeRoot() {
    final long text = tree.text(DOCUMENT_KEY, "x");
    assertThrows(IllegalArgumentException.class, () -> build(text));
    assertFalse(document.getNode(text).hasFlag(NodeFlag.IS_INLINE_ROOT));
  }
}
