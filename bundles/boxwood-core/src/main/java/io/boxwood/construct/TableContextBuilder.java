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

import io.boxwood.access.Document;
import io.boxwood.layout.table.GridPlacement;
import io.boxwood.layout.table.TableContext;
import io.boxwood.layout.table.TableItem;
import io.boxwood.layout.table.TableItemKind;
import io.boxwood.node.BoxNode;
import io.boxwood.node.Damage;
import io.boxwood.style.BorderCollapse;
import io.boxwood.style.ComputedStyle;
import io.boxwood.style.ComputedValues;
import io.boxwood.style.Dimension;
import io.boxwood.style.Display;
import io.boxwood.style.DisplayInside;
import io.boxwood.style.Edges;
import io.boxwood.style.Size;
import io.boxwood.style.TableLayout;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Builds the grid-sizing context of a table root: walks the table's descendants, skipping row
 * groups transparently, places every cell at its 1-based row and column and derives column width
 * hints and the cell spacing.
 */
public final class TableContextBuilder {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(TableContextBuilder.class);

  /** Style of tables the cascade left unstyled. */
  private static final ComputedStyle UNSTYLED_TABLE = ComputedValues.newBuilder().display(Display.TABLE).build();

  private final Document document;

  /**
   * Constructor.
   *
   * @param document the document
   */
  public TableContextBuilder(final Document document) {
    this.document = requireNonNull(document);
  }

  /**
   * The product of a table build.
   *
   * @param tableContext the new table context
   * @param cells the cell keys in depth-first encounter order
   */
  public record Result(TableContext tableContext, LongList cells) {
  }

  /**
   * Mutable state of one table walk.
   */
  private static final class Walk {
    final long tableKey;
    final boolean fixed;
    final BorderCollapse borderCollapse;
    final List<TableItem> items = new ArrayList<>();
    final LongArrayList cells = new LongArrayList();
    final List<Dimension> columns = new ArrayList<>();
    int row;
    int column;
    int columnCount;
    @Nullable Edges firstCellBorder;

    Walk(final long tableKey, final boolean fixed, final BorderCollapse borderCollapse) {
      this.tableKey = tableKey;
      this.fixed = fixed;
      this.borderCollapse = borderCollapse;
    }
  }

  /**
   * Build the table context of a table root.
   *
   * @param tableKey the key of the table root
   * @return the table context and the flattened cells
   */
  public Result build(final long tableKey) {
    final BoxNode table = document.getNode(tableKey);
    ComputedStyle style = table.getPrimaryStyle();
    if (style == null) {
      LOGGER.debug("Table {} has no style, using initial values.", tableKey);
      style = UNSTYLED_TABLE;
    }

    final Walk walk = new Walk(tableKey, style.getTableLayout() == TableLayout.FIXED, style.getBorderCollapse());
    for (final long childKey : table.getChildren()) {
      collect(walk, childKey, false, 1);
    }
    while (walk.columns.size() < walk.columnCount) {
      walk.columns.add(Dimension.AUTO);
    }

    final Size gap;
    final Edges tableBorder;
    if (walk.borderCollapse == BorderCollapse.COLLAPSE) {
      final Edges first = walk.firstCellBorder;
      gap = first == null ? Size.ZERO : new Size(first.maxHorizontal(), first.maxVertical());
      tableBorder = Edges.symmetric(gap.height(), gap.width());
    } else {
      gap = style.getBorderSpacing();
      tableBorder = style.getBorderWidths();
    }

    final TableContext tableContext =
        new TableContext(tableKey, style.getTableLayout(), walk.borderCollapse, walk.columns, walk.row, gap,
            tableBorder, walk.items, walk.firstCellBorder);
    LOGGER.debug("Built table context of {}: {} rows, {} columns, {} cells.", tableKey, walk.row,
        walk.columns.size(), walk.cells.size());
    return new Result(tableContext, LongLists.unmodifiable(walk.cells));
  }

  private void collect(final Walk walk, final long nodeKey, final boolean inRow, final int depth) {
    final BoxNode node = document.getNode(nodeKey);
    if (!node.isElement()) {
      return;
    }
    if (depth > document.getConfiguration().maxTreeDepth) {
      LOGGER.warn("Maximum tree depth {} reached in table {}.", document.getConfiguration().maxTreeDepth,
          walk.tableKey);
      return;
    }
    final ComputedStyle style = node.getPrimaryStyle();
    if (style == null) {
      LOGGER.debug("Ignoring table descendant {} because it has no style.", nodeKey);
      return;
    }

    final Display display = style.getDisplay();
    if (display.isNone()) {
      node.removeDamage(Damage.CONSTRUCTION);
      document.resetLayout(nodeKey);
      document.resetDescendantLayouts(nodeKey);
      return;
    }

    final DisplayInside inside = display.inside();
    if (inside.isRowGroup() || display.isContents()) {
      node.removeDamage(Damage.CONSTRUCTION);
      document.resetLayout(nodeKey);
      node.setLayoutParentKey(walk.tableKey);
      for (final long childKey : node.getChildren()) {
        collect(walk, childKey, inRow, depth + 1);
      }
    } else if (inside == DisplayInside.TABLE_ROW) {
      node.removeDamage(Damage.CONSTRUCTION);
      document.resetLayout(nodeKey);
      node.setLayoutParentKey(walk.tableKey);
      walk.row++;
      walk.column = 0;
      walk.items.add(new TableItem(TableItemKind.ROW, nodeKey, style, GridPlacement.row(walk.row),
          style.getBorderWidths()));
      for (final long childKey : node.getChildren()) {
        collect(walk, childKey, true, depth + 1);
      }
    } else if (inside == DisplayInside.TABLE_CELL) {
      if (!inRow) {
        LOGGER.debug("Dropping table cell {} outside of a row.", nodeKey);
        return;
      }
      addCell(walk, node, style);
    } else {
      LOGGER.debug("Ignoring table descendant {} with display {}.", nodeKey, display);
    }
  }

  private void addCell(final Walk walk, final BoxNode cell, final ComputedStyle style) {
    final int colspan = parseColspan(cell.getAttribute("colspan"));
    if (walk.firstCellBorder == null) {
      walk.firstCellBorder = style.getBorderWidths();
    }

    final Dimension width = style.getWidth();
    if (walk.row == 1) {
      final Dimension hint = switch (width.unit()) {
        case LENGTH -> Dimension.length(width.value() + style.getPadding().horizontal());
        case PERCENT -> walk.fixed ? width : Dimension.AUTO;
        case AUTO -> Dimension.AUTO;
      };
      while (walk.columns.size() <= walk.column) {
        walk.columns.add(Dimension.AUTO);
      }
      walk.columns.set(walk.column, hint);
    } else if (!walk.fixed && walk.column < walk.columns.size() && width.isLength()) {
      final Dimension existing = walk.columns.get(walk.column);
      walk.columns.set(walk.column, switch (existing.unit()) {
        case LENGTH -> Dimension.length(Math.max(existing.value(), width.value()));
        case AUTO -> width;
        case PERCENT -> existing;
      });
    }

    final Edges border = walk.borderCollapse == BorderCollapse.COLLAPSE ? Edges.ZERO : style.getBorderWidths();
    walk.items.add(new TableItem(TableItemKind.CELL, cell.getNodeKey(), style,
        GridPlacement.cell(walk.row, walk.column + 1, colspan), border));
    walk.cells.add(cell.getNodeKey());
    walk.column += colspan;
    walk.columnCount = Math.max(walk.columnCount, walk.column);
  }

  /**
   * Parse a {@code colspan} attribute. Absent, unparseable or non-positive values yield 1, values
   * above the configured maximum are clamped.
   *
   * @param value the attribute value
   * @return the column span
   */
  int parseColspan(final @Nullable String value) {
    if (value == null) {
      return 1;
    }
    try {
      final int colspan = Integer.parseInt(value.trim());
      return colspan < 1 ? 1 : Math.min(colspan, document.getConfiguration().maxColspan);
    } catch (final NumberFormatException e) {
      LOGGER.debug("Unparseable colspan '{}', using 1.", value);
      return 1;
    }
  }
}
