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

import static java.util.Objects.requireNonNull;

/**
 * A computed {@code display} value as a pair of outer and inner display type.
 *
 * @param outside the outer display type
 * @param inside the inner display type
 */
public record Display(DisplayOutside outside, DisplayInside inside) {

  public static final Display NONE = new Display(DisplayOutside.NONE, DisplayInside.NONE);

  public static final Display CONTENTS = new Display(DisplayOutside.NONE, DisplayInside.CONTENTS);

  public static final Display BLOCK = new Display(DisplayOutside.BLOCK, DisplayInside.FLOW);

  public static final Display FLOW_ROOT = new Display(DisplayOutside.BLOCK, DisplayInside.FLOW_ROOT);

  public static final Display INLINE = new Display(DisplayOutside.INLINE, DisplayInside.FLOW);

  public static final Display INLINE_BLOCK = new Display(DisplayOutside.INLINE, DisplayInside.FLOW_ROOT);

  public static final Display FLEX = new Display(DisplayOutside.BLOCK, DisplayInside.FLEX);

  public static final Display INLINE_FLEX = new Display(DisplayOutside.INLINE, DisplayInside.FLEX);

  public static final Display GRID = new Display(DisplayOutside.BLOCK, DisplayInside.GRID);

  public static final Display TABLE = new Display(DisplayOutside.BLOCK, DisplayInside.TABLE);

  public static final Display INLINE_TABLE = new Display(DisplayOutside.INLINE, DisplayInside.TABLE);

  public static final Display TABLE_CAPTION = new Display(DisplayOutside.TABLE_CAPTION, DisplayInside.FLOW_ROOT);

  public static final Display TABLE_ROW_GROUP =
      new Display(DisplayOutside.INTERNAL_TABLE, DisplayInside.TABLE_ROW_GROUP);

  public static final Display TABLE_HEADER_GROUP =
      new Display(DisplayOutside.INTERNAL_TABLE, DisplayInside.TABLE_HEADER_GROUP);

  public static final Display TABLE_FOOTER_GROUP =
      new Display(DisplayOutside.INTERNAL_TABLE, DisplayInside.TABLE_FOOTER_GROUP);

  public static final Display TABLE_ROW = new Display(DisplayOutside.INTERNAL_TABLE, DisplayInside.TABLE_ROW);

  public static final Display TABLE_CELL = new Display(DisplayOutside.INTERNAL_TABLE, DisplayInside.TABLE_CELL);

  public static final Display TABLE_COLUMN = new Display(DisplayOutside.INTERNAL_TABLE, DisplayInside.TABLE_COLUMN);

  public static final Display TABLE_COLUMN_GROUP =
      new Display(DisplayOutside.INTERNAL_TABLE, DisplayInside.TABLE_COLUMN_GROUP);

  public Display {
    requireNonNull(outside);
    requireNonNull(inside);
  }

  /**
   * Determines if the box is not generated at all ({@code display: none}).
   *
   * @return {@code true} for {@code none}
   */
  public boolean isNone() {
    return outside == DisplayOutside.NONE && inside == DisplayInside.NONE;
  }

  /**
   * Determines if the element generates no box of its own but its children do.
   *
   * @return {@code true} for {@code contents}
   */
  public boolean isContents() {
    return inside == DisplayInside.CONTENTS;
  }

  /**
   * Determines if the box is block-level in its parent's formatting context.
   *
   * @return {@code true} for block, table caption and internal table boxes
   */
  public boolean isBlockLevel() {
    return outside == DisplayOutside.BLOCK || outside == DisplayOutside.TABLE_CAPTION
        || outside == DisplayOutside.INTERNAL_TABLE;
  }

  public boolean isInlineLevel() {
    return outside == DisplayOutside.INLINE;
  }

  /**
   * Determines if the box is an inline box whose content flows into the surrounding paragraph.
   *
   * @return {@code true} for {@code display: inline}
   */
  public boolean isInlineFlow() {
    return outside == DisplayOutside.INLINE && inside == DisplayInside.FLOW;
  }

  public boolean isInternalTable() {
    return outside == DisplayOutside.INTERNAL_TABLE;
  }
}
