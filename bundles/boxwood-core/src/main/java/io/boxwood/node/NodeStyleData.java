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
import io.boxwood.style.ComputedStyle;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The style slot of a node as written by the cascade: the primary computed style and the styles of
 * the {@code ::before} and {@code ::after} pseudo-elements. Handles are externally owned and compared
 * by identity.
 *
 * @param primary the primary style, {@code null} if not styled
 * @param before the {@code ::before} style, {@code null} if the pseudo-element does not exist
 * @param after the {@code ::after} style, {@code null} if the pseudo-element does not exist
 */
public record NodeStyleData(@Nullable ComputedStyle primary, @Nullable ComputedStyle before,
    @Nullable ComputedStyle after) {

  /**
   * Style data without pseudo-elements.
   *
   * @param primary the primary style
   * @return the style data
   */
  public static NodeStyleData of(final ComputedStyle primary) {
    return new NodeStyleData(primary, null, null);
  }

  /**
   * Determines if any handle differs by identity.
   *
   * @param other the other style data, may be {@code null}
   * @return {@code true} if the style data changed
   */
  public boolean differsFrom(final @Nullable NodeStyleData other) {
    return other == null || primary != other.primary || before != other.before || after != other.after;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("primary", primary)
                      .add("before", before)
                      .add("after", after)
                      .toString();
  }
}
