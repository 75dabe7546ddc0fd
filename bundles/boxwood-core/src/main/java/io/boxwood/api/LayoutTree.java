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

package io.boxwood.api;

import io.boxwood.layout.inline.InlineLayout;
import io.boxwood.layout.table.TableContext;
import io.boxwood.style.ComputedStyle;
import it.unimi.dsi.fastutil.longs.LongList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Optional;

/**
 * The box tree as pulled by the numeric layout engine and the paint layer.
 */
public interface LayoutTree {

  /**
   * Get the ordered layout children of a node. The order is also the paint order.
   *
   * @param nodeKey the node key
   * @return the layout children, empty if none have been computed
   */
  LongList getLayoutChildren(long nodeKey);

  /**
   * Get the paragraph of an inline formatting context root.
   *
   * @param nodeKey the node key
   * @return the paragraph, empty if the node is no inline root
   */
  Optional<InlineLayout> getInlineLayout(long nodeKey);

  /**
   * Get the grid-sizing context of a table root.
   *
   * @param nodeKey the node key
   * @return the table context, empty if the node is no table root
   * @throws io.boxwood.exception.BoxTreeCorruptionException if the node is flagged as a table root
   *         but carries no context and invariant assertions are enabled
   */
  Optional<TableContext> getTableContext(long nodeKey);

  /**
   * Get the key of the layout parent, the containing box in the box tree.
   *
   * @param nodeKey the node key
   * @return the layout parent key or the null key
   */
  long getLayoutParentKey(long nodeKey);

  boolean isInlineRoot(long nodeKey);

  boolean isTableRoot(long nodeKey);

  /**
   * Get the style a box is laid out with; for anonymous boxes the synthesized inherited style.
   *
   * @param nodeKey the node key
   * @return the style, {@code null} if the node is not styled
   */
  @Nullable ComputedStyle getStyle(long nodeKey);
}
