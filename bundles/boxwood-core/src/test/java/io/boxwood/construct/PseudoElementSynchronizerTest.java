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
import io.boxwood.node.BoxNode;
import io.boxwood.node.Damage;
import io.boxwood.node.NodeStyleData;
import io.boxwood.style.ComputedStyle;
import io.boxwood.style.ComputedValues;
import io.boxwood.style.ContentItem;
import io.boxwood.style.Display;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static io.boxwood.BoxTreeTestHelper.BLOCK;
import static io.boxwood.BoxTreeTestHelper.DOCUMENT_KEY;
import static io.boxwood.BoxTreeTestHelper.INLINE;
import static io.boxwood.BoxTreeTestHelper.keys;
import static io.boxwood.BoxTreeTestHelper.pseudo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Test {@link PseudoElementSynchronizer}.
 */
public final class PseudoElementSynchronizerTest {

  private TreeBuilder tree;

  private Document document;

  @BeforeEach
  public void setUp() {
    tree = BoxTreeTestHelper.newTree();
    document = tree.document();
  }

  private void resolve() {
    new LayoutTreeDriver(document).resolve();
  }

  @Test
  public void testPseudoLifecycle() {
    final long div = tree.element(DOCUMENT_KEY, "div", BLOCK);
    tree.text(div, "x");
    resolve();
    final int size = document.size();

    document.restyle(div, new NodeStyleData(BLOCK, pseudo("> "), null));
    resolve();

    final BoxNode node = document.getNode(div);
    assertTrue(node.hasBefore());
    final BoxNode before = document.getNode(node.getBeforeKey());
    assertTrue(before.isAnonymousBlock());
    assertEquals("::before", before.getTagName());
    assertEquals(div, before.getParentKey());
    assertEquals(size + 2, document.size());
    assertEquals("> x", document.getInlineLayout(div).orElseThrow().getText());

    document.restyle(div, NodeStyleData.of(BLOCK));
    resolve();

    assertFalse(document.getNode(div).hasBefore());
    assertEquals(size, document.size());
    assertEquals("x", document.getInlineLayout(div).orElseThrow().getText());
  }

  @Test
  public void testStyleChangeRematerializesContent() {
    final long div = tree.element(DOCUMENT_KEY, "div", BLOCK);
    document.restyle(div, new NodeStyleData(BLOCK, null, pseudo("a")));
    resolve();
    final long afterKey = document.getNode(div).getAfterKey();
    final int size = document.size();

    final ComputedStyle changed = pseudo("b");
    document.restyle(div, new NodeStyleData(BLOCK, null, changed));
    resolve();

    assertEquals(afterKey, document.getNode(div).getAfterKey());
    final BoxNode after = document.getNode(afterKey);
    assertSame(changed, after.getPrimaryStyle());
    assertEquals(1, after.getChildren().size());
    assertEquals("b", document.getNode(after.getChildren().getLong(0)).getValue());
    assertEquals(size, document.size());
    assertEquals("b", document.getInlineLayout(div).orElseThrow().getText());
  }

  @Test
  public void testIdenticalStyleIsNoOp() {
    final long div = tree.element(DOCUMENT_KEY, "div", BLOCK);
    final ComputedStyle before = pseudo("a");
    document.restyle(div, new NodeStyleData(BLOCK, before, null));
    final PseudoElementSynchronizer synchronizer = new PseudoElementSynchronizer(document);
    synchronizer.synchronize(div);
    final long beforeKey = document.getNode(div).getBeforeKey();
    document.getNode(div).setDamage(Damage.NONE);
    document.getNode(beforeKey).setDamage(Damage.NONE);

    synchronizer.synchronize(div);

    assertEquals(beforeKey, document.getNode(div).getBeforeKey());
    assertEquals(Damage.NONE, document.getNode(div).getDamage());
    assertEquals(Damage.NONE, document.getNode(beforeKey).getDamage());
  }

  @Test
  public void testCreationDamagesOriginatingElement() {
    final long div = tree.element(DOCUMENT_KEY, "div", BLOCK);
    document.restyle(div, new NodeStyleData(BLOCK, pseudo("a"), null));
    document.getNode(div).setDamage(Damage.NONE);

    new PseudoElementSynchronizer(document).synchronize(div);

    assertEquals(Damage.ALL, document.getNode(div).getDamage());
    assertEquals(Damage.ALL, document.getNode(document.getNode(div).getBeforeKey()).getDamage());
  }

  @Test
  public void testContentResolution() {
    final long div = tree.element(DOCUMENT_KEY, "div", BLOCK, Map.of("title", "T"));
    final ComputedStyle after = ComputedValues.newBuilder()
                                              .display(Display.INLINE)
                                              .addContent(ContentItem.string("["))
                                              .addContent(ContentItem.attr("title"))
                                              .addContent(ContentItem.counter("section"))
                                              .addContent(ContentItem.attr("missing"))
                                              .addContent(ContentItem.string("]"))
                                              .build();
    document.restyle(div, new NodeStyleData(BLOCK, null, after));
    resolve();

    final BoxNode pseudo = document.getNode(document.getNode(div).getAfterKey());
    assertEquals("[T]", document.getNode(pseudo.getChildren().getLong(0)).getValue());
  }

  @Test
  public void testEmptyContentCreatesBoxWithoutText() {
    final long div = tree.element(DOCUMENT_KEY, "div", BLOCK);
    final ComputedStyle before = ComputedValues.newBuilder()
                                               .display(Display.BLOCK)
                                               .addContent(ContentItem.counter("c"))
                                               .build();
    document.restyle(div, new NodeStyleData(BLOCK, before, null));
    resolve();

    final long beforeKey = document.getNode(div).getBeforeKey();
    assertTrue(document.getNode(beforeKey).getChildren().isEmpty());
    assertEquals(keys(beforeKey), document.getLayoutChildren(div));
  }

  @Test
  public void testPseudoOfInlineDescendantFlowsIntoParagraph() {
    final long paragraph = tree.element(DOCUMENT_KEY, "p", BLOCK);
    final long span = tree.element(paragraph, "span", INLINE);
    tree.text(span, "hi");
    document.restyle(span, new NodeStyleData(INLINE, null, pseudo("!")));
    resolve();

    assertTrue(document.getNode(span).hasAfter());
    assertEquals("hi!", document.getInlineLayout(paragraph).orElseThrow().getText());
  }
}
