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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import io.boxwood.node.SpecialData;
import io.boxwood.style.BorderCollapse;
import io.boxwood.style.Dimension;
import io.boxwood.style.Edges;
import io.boxwood.style.Size;
import io.boxwood.style.TableLayout;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Grid-sizing context of a table root, shared with the numeric layout engine. Immutable once
 * published: a rebuild replaces the instance on the table root.
 */
public final class TableContext implements SpecialData {

  private final long tableKey;

  private final TableLayout tableLayout;

  private final BorderCollapse borderCollapse;

  private final ImmutableList<Dimension> columns;

  private final int rowCount;

  private final Size gap;

  private final Edges tableBorder;

  private final ImmutableList<TableItem> items;

  private final @Nullable Edges firstCellBorder;

  /**
   * Constructor.
   *
   * @param tableKey key of the table root
   * @param tableLayout the table layout algorithm
   * @param borderCollapse the border model
   * @param columns column width hints, one per column
   * @param rowCount number of rows
   * @param gap spacing between cells
   * @param tableBorder border widths of the table box
   * @param items rows and cells in encounter order
   * @param firstCellBorder border widths of the first cell, {@code null} if there is no cell
   */
  public TableContext(final long tableKey, final TableLayout tableLayout, final BorderCollapse borderCollapse,
      final List<Dimension> columns, final @NonNegative int rowCount, final Size gap, final Edges tableBorder,
      final List<TableItem> items, final @Nullable Edges firstCellBorder) {
    this.tableKey = tableKey;
    this.tableLayout = requireNonNull(tableLayout);
    this.borderCollapse = requireNonNull(borderCollapse);
    this.columns = ImmutableList.copyOf(columns);
    this.rowCount = rowCount;
    this.gap = requireNonNull(gap);
    this.tableBorder = requireNonNull(tableBorder);
    this.items = ImmutableList.copyOf(items);
    this.firstCellBorder = firstCellBorder;
  }

  public long getTableKey() {
    return tableKey;
  }

  public TableLayout getTableLayout() {
    return tableLayout;
  }

  public BorderCollapse getBorderCollapse() {
    return borderCollapse;
  }

  /**
   * Get the column width hints. Auto columns are sized by their content.
   *
   * @return the hints, one per column
   */
  public List<Dimension> getColumns() {
    return columns;
  }

  public int getColumnCount() {
    return columns.size();
  }

  public int getRowCount() {
    return rowCount;
  }

  public Size getGap() {
    return gap;
  }

  public Edges getTableBorder() {
    return tableBorder;
  }

  public List<TableItem> getItems() {
    return items;
  }

  /**
   * Get the cells only, in encounter order.
   *
   * @return the cells
   */
  public List<TableItem> getCells() {
    return items.stream().filter(TableItem::isCell).collect(ImmutableList.toImmutableList());
  }

  public @Nullable Edges getFirstCellBorder() {
    return firstCellBorder;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("tableKey", tableKey)
                      .add("tableLayout", tableLayout)
                      .add("borderCollapse", borderCollapse)
                      .add("columns", columns)
                      .add("rowCount", rowCount)
                      .add("gap", gap)
                      .add("items", items.size())
                      .toString();
  }
}
