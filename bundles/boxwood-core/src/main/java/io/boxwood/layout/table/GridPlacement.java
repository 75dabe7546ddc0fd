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

package io.boxwood.layout.table;

import org.checkerframework.checker.index.qual.Positive;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Placement of a table item in the table grid. Lines are 1-based.
 *
 * @param row the row line
 * @param column the start column line
 * @param columnSpan number of spanned columns, or {@link #ALL_COLUMNS}
 */
public record GridPlacement(@Positive int row, @Positive int column, int columnSpan) {

  /** Column span of rows, which stretch across the whole grid. */
  public static final int ALL_COLUMNS = -1;

  public GridPlacement {
    checkArgument(row >= 1, "row must be >= 1!");
    checkArgument(column >= 1, "column must be >= 1!");
    checkArgument(columnSpan >= 1 || columnSpan == ALL_COLUMNS, "invalid column span: %s", columnSpan);
  }

  /**
   * Placement of a row.
   *
   * @param row the row line
   * @return the placement
   */
  public static GridPlacement row(final int row) {
    return new GridPlacement(row, 1, ALL_COLUMNS);
  }

  /**
   * Placement of a cell.
   *
   * @param row the row line
   * @param column the start column line
   * @param columnSpan number of spanned columns
   * @return the placement
   */
  public static GridPlacement cell(final int row, final int column, final int columnSpan) {
    return new GridPlacement(row, column, columnSpan);
  }

  public boolean spansAllColumns() {
    return columnSpan == ALL_COLUMNS;
  }
}
