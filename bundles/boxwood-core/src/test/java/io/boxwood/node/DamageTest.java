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

package io.boxwood.node;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class DamageTest {

  @Test
  public void testConstructionCoversRebuildBits() {
    assertTrue(Damage.CONSTRUCTION.contains(Damage.BOX));
    assertTrue(Damage.CONSTRUCTION.contains(Damage.FORMATTING_CONTEXT));
    assertTrue(Damage.CONSTRUCTION.contains(Damage.DESCENDANT));
    assertSame(Damage.ALL, Damage.CONSTRUCTION);
    assertSame(Damage.ALL,
        Damage.fromBits(Damage.BOX.union(Damage.FORMATTING_CONTEXT).union(Damage.DESCENDANT).bits()));
  }

  @Test
  public void testUnionAndRemove() {
    final Damage damage = Damage.BOX.union(Damage.DESCENDANT);
    assertTrue(damage.intersects(Damage.BOX.union(Damage.FORMATTING_CONTEXT)));
    assertFalse(damage.contains(Damage.BOX.union(Damage.FORMATTING_CONTEXT)));
    assertEquals(Damage.DESCENDANT, damage.remove(Damage.BOX));
    assertSame(Damage.NONE, damage.remove(Damage.CONSTRUCTION));
    assertTrue(Damage.NONE.isEmpty());
  }

  @Test
  public void testFromBitsDropsUnknownBits() {
    assertSame(Damage.NONE, Damage.fromBits(1 << 20));
    assertSame(Damage.ALL, Damage.fromBits(-1));
    assertEquals(Damage.BOX, Damage.fromBits(Damage.BOX.bits()));
    assertEquals(Damage.BOX.hashCode(), Damage.fromBits(Damage.BOX.bits()).hashCode());
  }
}
