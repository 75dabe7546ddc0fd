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

import io.boxwood.BoxTreeTestHelper;
import io.boxwood.BoxTreeTestHelper.TreeBuilder;
import io.boxwood.construct.LayoutTreeDriver;
import io.boxwood.exception.BoxTreeCorruptionException;
import io.boxwood.node.BoxNode;
import io.boxwood.node.Damage;
import io.boxwood.node.NodeFlag;
import io.boxwood.node.NodeStyleData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.boxwood.BoxTreeTestHelper.BLOCK;
import static io.boxwood.BoxTreeTestHelper.DOCUMENT_KEY;
import static io.boxwood.BoxTreeTestHelper.INLINE;
import static io.boxwood.BoxTreeTestHelper.keys;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Test the DOM mutation API of {@link Document}.
 */
public final class DocumentTest {

  private TreeBuilder tree;

  private Document document;

  @BeforeEach
  public void setUp() {
    tree = BoxTreeTestHelper.newTree();
    document = tree.document();
  }

  @Test
  public void testDocumentNode() {
    final BoxNode documentNode = document.getDocumentNode();
    assertEquals(DOCUMENT_KEY, documentNode.getNodeKey());
    assertTrue(documentNode.hasFlag(NodeFlag.IS_IN_DOCUMENT));
    assertEquals(Damage.ALL, documentNode.getDamage());
    assertEquals(1, document.size());
  }

  @Test
  public void testAttachMaintainsDocumentMembership() {
    final long div = document.createElement("div");
    final long text = document.createText("x");
    document.appendChild(div, text);
    assertFalse(document.getNode(text).hasFlag(NodeFlag.IS_IN_DOCUMENT));

    document.appendChild(DOCUMENT_KEY, div);

    assertTrue(document.getNode(div).hasFlag(NodeFlag.IS_IN_DOCUMENT));
    assertTrue(document.getNode(text).hasFlag(NodeFlag.IS_IN_DOCUMENT));
    assertEquals(div, document.getNode(text).getParentKey());
  }

  @Test
  public void testInsertBefore() {
    final long div = tree.element(DOCUMENT_KEY, "div", BLOCK);
    final long second = tree.text(div, "b");
    final long first = document.createText("a");

    document.insertBefore(div, first, second);

    assertEquals(keys(first, second), document.getNode(div).getChildren());
    final long stranger = document.createText("c");
    assertThrows(IllegalArgumentException.class, () -> document.insertBefore(div, stranger, DOCUMENT_KEY));
  }

  @Test
  public void testInvalidInsertions() {
    final long a = document.createElement("a");
    final long b = document.createElement("b");
    final long text = document.createText("x");
    document.appendChild(a, b);

    assertThrows(IllegalArgumentException.class, () -> document.appendChild(b, a));
    assertThrows(IllegalArgumentException.class, () -> document.appendChild(DOCUMENT_KEY, b));
    assertThrows(IllegalArgumentException.class, () -> document.appendChild(text, document.createText("y")));
    assertThrows(IllegalArgumentException.class, () -> document.appendChild(a, DOCUMENT_KEY));
  }

  @Test
  public void testRemoveChildDropsSubtree() {
    final long div = tree.element(DOCUMENT_KEY, "div", BLOCK);
    final long span = tree.element(div, "span", INLINE);
    tree.text(span, "x");
    tree.comment(span, "y");
    assertEquals(5, document.size());
    new LayoutTreeDriver(document).resolve();

    document.removeChild(DOCUMENT_KEY, div);

    assertEquals(1, document.size());
    assertTrue(document.getDocumentNode().getChildren().isEmpty());
    assertTrue(document.getDocumentNode().hasDamage(Damage.BOX));
    assertFalse(document.getArena().contains(span));
  }

  @Test
  public void testSetTextDamagesNodeAndParent() {
    final long div = tree.element(DOCUMENT_KEY, "div", BLOCK);
    final long text = tree.text(div, "x");
    new LayoutTreeDriver(document).resolve();

    document.setText(text, "y");

    assertEquals("y", document.getNode(text).getValue());
    assertTrue(document.getNode(text).hasDamage(Damage.BOX));
    assertTrue(document.getNode(div).hasDamage(Damage.BOX));
  }

  @Test
  public void testRestyleWithIdenticalHandles() {
    final long div = tree.element(DOCUMENT_KEY, "div", BLOCK);
    new LayoutTreeDriver(document).resolve();

    assertFalse(document.restyle(div, NodeStyleData.of(BLOCK)));
    assertFalse(document.getNode(div).hasDamage(Damage.BOX));

    assertTrue(document.restyle(div, NodeStyleData.of(BoxTreeTestHelper.INLINE_BLOCK)));
    assertEquals(Damage.ALL, document.getNode(div).getDamage());
    assertTrue(document.getDocumentNode().hasDamage(Damage.BOX));
  }

  @Test
  public void testInvalidateInlineContexts() {
    final long div = tree.element(DOCUMENT_KEY, "div", BLOCK);
    tree.text(div, "x");
    final long block = tree.element(DOCUMENT_KEY, "div", BLOCK);
    new LayoutTreeDriver(document).resolve();
    assertTrue(document.isInlineRoot(div));

    document.invalidateInlineContexts();

    assertEquals(Damage.ALL, document.getNode(div).getDamage());
    assertFalse(document.getNode(block).hasDamage(Damage.BOX));
    assertTrue(document.getDocumentNode().hasDamage(Damage.DESCENDANT));
  }

  @Test
  public void testTableRootWithoutContext() {
    final long div = tree.element(DOCUMENT_KEY, "div", BLOCK);
    document.getNode(div).setFlag(NodeFlag.IS_TABLE_ROOT, true);

    assertThrows(BoxTreeCorruptionException.class, () -> document.getTableContext(div));
  }

  @Test
  public void testTableRootWithoutContextLenient() {
    final Document lenient = Document.create(DocumentConfiguration.newBuilder().assertInvariants(false).build());
    final long div = BoxTreeTestHelper.newTree(lenient).element(DOCUMENT_KEY, "div", BLOCK);
    lenient.getNode(div).setFlag(NodeFlag.IS_TABLE_ROOT, true);

    assertTrue(lenient.getTableContext(div).isEmpty());
    assertTrue(lenient.getTableContext(DOCUMENT_KEY).isEmpty());
  }
}
