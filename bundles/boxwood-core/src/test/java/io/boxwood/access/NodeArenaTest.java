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
import io.boxwood.node.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class NodeArenaTest {

  @Test
  public void testKeysAreDense() {
    final NodeArena arena = new NodeArena();
    assertEquals(0L, arena.create(NodeKind.DOCUMENT, null, null).getNodeKey());
    assertEquals(1L, arena.create(NodeKind.TEXT, null, "a").getNodeKey());
    assertEquals(2L, arena.create(NodeKind.COMMENT, null, "b").getNodeKey());
    assertEquals(3, arena.size());
  }

  @Test
  public void testRemovedKeysAreReused() {
    final NodeArena arena = new NodeArena();
    arena.create(NodeKind.DOCUMENT, null, null);
    final BoxNode first = arena.create(NodeKind.TEXT, null, "a");
    arena.create(NodeKind.TEXT, null, "b");

    assertSame(first, arena.remove(1L));
    assertFalse(arena.contains(1L));
    assertNull(arena.getOrNull(1L));
    assertEquals(2, arena.size());

    final BoxNode reused = arena.create(NodeKind.TEXT, null, "c");
    assertEquals(1L, reused.getNodeKey());
    assertSame(reused, arena.get(1L));
    assertEquals(3, arena.size());
  }

  @Test
  public void testUnknownKeys() {
    final NodeArena arena = new NodeArena();
    assertThrows(IllegalArgumentException.class, () -> arena.get(0L));
    assertThrows(IllegalArgumentException.class, () -> arena.remove(7L));
    assertNull(arena.getOrNull(-1L));
  }

  @Test
  public void testForEachSkipsRemovedNodes() {
    final NodeArena arena = new NodeArena();
    arena.create(NodeKind.DOCUMENT, null, null);
    arena.create(NodeKind.TEXT, null, "a");
    arena.create(NodeKind.TEXT, null, "b");
    arena.remove(1L);

    final List<Long> keys = new ArrayList<>();
    arena.forEach(node -> keys.add(node.getNodeKey()));
    assertEquals(List.of(0L, 2L), keys);
    assertTrue(arena.contains(2L));
  }
}
