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

import com.google.common.base.MoreObjects;

/**
 * Immutable bit-set describing which downstream computations of a node are stale.
 *
 * <ul>
 * <li>{@link #BOX}: the classification of the node itself (its layout children) is stale</li>
 * <li>{@link #FORMATTING_CONTEXT}: inline or table content owned by the node must be rebuilt</li>
 * <li>{@link #DESCENDANT}: some node in the subtree needs revisiting</li>
 * </ul>
 */
public final class Damage {

  private static final int BOX_BIT = 0b0001_0000;

  private static final int FORMATTING_CONTEXT_BIT = 0b0010_0000;

  private static final int DESCENDANT_BIT = 0b0100_0000;

  /** No damage. */
  public static final Damage NONE = new Damage(0);

  /** Box construction damage. */
  public static final Damage BOX = new Damage(BOX_BIT);

  /** Formatting context construction damage. */
  public static final Damage FORMATTING_CONTEXT = new Damage(FORMATTING_CONTEXT_BIT);

  /** Descendant construction damage. */
  public static final Damage DESCENDANT = new Damage(DESCENDANT_BIT);

  /** All construction damage bits. */
  public static final Damage CONSTRUCTION = new Damage(BOX_BIT | FORMATTING_CONTEXT_BIT | DESCENDANT_BIT);

  /** Union of all damage bits, the damage of a new or restyled node. */
  public static final Damage ALL = CONSTRUCTION;

  private final int bits;

  private Damage(final int bits) {
    this.bits = bits;
  }

  /**
   * Get the damage value for raw bits.
   *
   * @param bits the bits, unknown bits are dropped
   * @return the damage value
   */
  public static Damage fromBits(final int bits) {
    final int masked = bits & ALL.bits;
    if (masked == 0) {
      return NONE;
    }
    if (masked == ALL.bits) {
      return ALL;
    }
    return new Damage(masked);
  }

  public int bits() {
    return bits;
  }

  public boolean isEmpty() {
    return bits == 0;
  }

  /**
   * Determines if all bits of {@code other} are set.
   *
   * @param other the damage to test
   * @return {@code true} if contained
   */
  public boolean contains(final Damage other) {
    return (bits & other.bits) == other.bits;
  }

  /**
   * Determines if any bit of {@code other} is set.
   *
   * @param other the damage to test
   * @return {@code true} if at least one bit is shared
   */
  public boolean intersects(final Damage other) {
    return (bits & other.bits) != 0;
  }

  public Damage union(final Damage other) {
    return fromBits(bits | other.bits);
  }

  public Damage remove(final Damage other) {
    return fromBits(bits & ~other.bits);
  }

  @Override
  public boolean equals(final Object obj) {
    return obj instanceof Damage other && other.bits == bits;
  }

  @Override
  public int hashCode() {
    return bits;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("box", contains(BOX))
                      .add("formattingContext", contains(FORMATTING_CONTEXT))
                      .add("descendant", contains(DESCENDANT))
                      .toString();
  }
}
