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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Immutable {@link ComputedStyle} implementation, used by embedders which do not plug in their own
 * cascade output and for synthesized anonymous boxes. Identity semantics are kept: {@code equals}
 * is not overridden.
 */
public final class ComputedValues implements ComputedStyle {

  private final Display display;

  private final FloatMode floatMode;

  private final Position position;

  private final WhiteSpaceCollapse whiteSpaceCollapse;

  private final TableLayout tableLayout;

  private final BorderCollapse borderCollapse;

  private final Size borderSpacing;

  private final Dimension width;

  private final Edges padding;

  private final Edges borderWidths;

  private final ImmutableList<ContentItem> content;

  private ComputedValues(final Builder builder) {
    display = builder.display;
    floatMode = builder.floatMode;
    position = builder.position;
    whiteSpaceCollapse = builder.whiteSpaceCollapse;
    tableLayout = builder.tableLayout;
    borderCollapse = builder.borderCollapse;
    borderSpacing = builder.borderSpacing;
    width = builder.width;
    padding = builder.padding;
    borderWidths = builder.borderWidths;
    content = builder.content.build();
  }

  /**
   * Get a new builder with initial values.
   *
   * @return a new {@link Builder}
   */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Get a new builder carrying the inherited properties of {@code parent} and initial values for
   * all other properties.
   *
   * @param parent the parent style
   * @return a new {@link Builder}
   */
  public static Builder inheritFrom(final ComputedStyle parent) {
    requireNonNull(parent);
    return new Builder().whiteSpaceCollapse(parent.getWhiteSpaceCollapse())
                        .borderCollapse(parent.getBorderCollapse())
                        .borderSpacing(parent.getBorderSpacing());
  }

  /**
   * Get a builder initialized with all values of this style.
   *
   * @return a new {@link Builder}
   */
  public Builder toBuilder() {
    final Builder builder = new Builder().display(display)
                                         .floatMode(floatMode)
                                         .position(position)
                                         .whiteSpaceCollapse(whiteSpaceCollapse)
                                         .tableLayout(tableLayout)
                                         .borderCollapse(borderCollapse)
                                         .borderSpacing(borderSpacing)
                                         .width(width)
                                         .padding(padding)
                                         .borderWidths(borderWidths);
    content.forEach(builder::addContent);
    return builder;
  }

  @Override
  public Display getDisplay() {
    return display;
  }

  @Override
  public FloatMode getFloat() {
    return floatMode;
  }

  @Override
  public Position getPosition() {
    return position;
  }

  @Override
  public WhiteSpaceCollapse getWhiteSpaceCollapse() {
    return whiteSpaceCollapse;
  }

  @Override
  public TableLayout getTableLayout() {
    return tableLayout;
  }

  @Override
  public BorderCollapse getBorderCollapse() {
    return borderCollapse;
  }

  @Override
  public Size getBorderSpacing() {
    return borderSpacing;
  }

  @Override
  public Dimension getWidth() {
    return width;
  }

  @Override
  public Edges getPadding() {
    return padding;
  }

  @Override
  public Edges getBorderWidths() {
    return borderWidths;
  }

  @Override
  public List<ContentItem> getContent() {
    return content;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("display", display)
                      .add("float", floatMode)
                      .add("position", position)
                      .add("whiteSpaceCollapse", whiteSpaceCollapse)
                      .add("width", width)
                      .add("content", content)
                      .toString();
  }

  /**
   * Builder for {@link ComputedValues}. Defaults are the CSS initial values.
   */
  public static final class Builder {

    private Display display = Display.INLINE;

    private FloatMode floatMode = FloatMode.NONE;

    private Position position = Position.STATIC;

    private WhiteSpaceCollapse whiteSpaceCollapse = WhiteSpaceCollapse.COLLAPSE;

    private TableLayout tableLayout = TableLayout.AUTO;

    private BorderCollapse borderCollapse = BorderCollapse.SEPARATE;

    private Size borderSpacing = Size.ZERO;

    private Dimension width = Dimension.AUTO;

    private Edges padding = Edges.ZERO;

    private Edges borderWidths = Edges.ZERO;

    private final ImmutableList.Builder<ContentItem> content = ImmutableList.builder();

    private Builder() {
    }

    public Builder display(final Display display) {
      this.display = requireNonNull(display);
      return this;
    }

    public Builder floatMode(final FloatMode floatMode) {
      this.floatMode = requireNonNull(floatMode);
      return this;
    }

    public Builder position(final Position position) {
      this.position = requireNonNull(position);
      return this;
    }

    public Builder whiteSpaceCollapse(final WhiteSpaceCollapse whiteSpaceCollapse) {
      this.whiteSpaceCollapse = requireNonNull(whiteSpaceCollapse);
      return this;
    }

    public Builder tableLayout(final TableLayout tableLayout) {
      this.tableLayout = requireNonNull(tableLayout);
      return this;
    }

    public Builder borderCollapse(final BorderCollapse borderCollapse) {
      this.borderCollapse = requireNonNull(borderCollapse);
      return this;
    }

    public Builder borderSpacing(final Size borderSpacing) {
      this.borderSpacing = requireNonNull(borderSpacing);
      return this;
    }

    public Builder width(final Dimension width) {
      this.width = requireNonNull(width);
      return this;
    }

    public Builder padding(final Edges padding) {
      this.padding = requireNonNull(padding);
      return this;
    }

    public Builder borderWidths(final Edges borderWidths) {
      this.borderWidths = requireNonNull(borderWidths);
      return this;
    }

    /**
     * Append an item to the {@code content} list.
     *
     * @param item the item
     * @return reference to the builder object
     */
    public Builder addContent(final ContentItem item) {
      content.add(requireNonNull(item));
      return this;
    }

    /**
     * Build the style.
     *
     * @return a new, distinct {@link ComputedValues} instance
     */
    public ComputedValues build() {
      return new ComputedValues(this);
    }
  }
}
