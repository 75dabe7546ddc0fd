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

package io.boxwood;

import io.boxwood.access.Document;
import io.boxwood.node.NodeStyleData;
import io.boxwood.settings.Fixed;
import io.boxwood.style.ComputedStyle;
import io.boxwood.style.ComputedValues;
import io.boxwood.style.ContentItem;
import io.boxwood.style.Display;
import io.boxwood.style.FloatMode;
import io.boxwood.style.Position;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;

import java.util.Map;

/**
 * Helper class for box tree tests: style factories and a fluent builder for styled DOM trees.
 */
public final class BoxTreeTestHelper {

  /** Key of the document node. */
  public static final long DOCUMENT_KEY = Fixed.DOCUMENT_NODE_KEY.getStandardProperty();

  public static final ComputedStyle BLOCK = style(Display.BLOCK);

  public static final ComputedStyle INLINE = style(Display.INLINE);

  public static final ComputedStyle INLINE_BLOCK = style(Display.INLINE_BLOCK);

  public static final ComputedStyle CONTENTS = style(Display.CONTENTS);

  public static final ComputedStyle NONE = style(Display.NONE);

  public static final ComputedStyle FLEX = style(Display.FLEX);

  public static final ComputedStyle TABLE = style(Display.TABLE);

  public static final ComputedStyle TABLE_ROW_GROUP = style(Display.TABLE_ROW_GROUP);

  public static final ComputedStyle TABLE_ROW = style(Display.TABLE_ROW);

  public static final ComputedStyle TABLE_CELL = style(Display.TABLE_CELL);

  public static final ComputedStyle ABSOLUTE_BLOCK =
      ComputedValues.newBuilder().display(Display.BLOCK).position(Position.ABSOLUTE).build();

  public static final ComputedStyle FLOATED_BLOCK =
      ComputedValues.newBuilder().display(Display.BLOCK).floatMode(FloatMode.LEFT).build();

  private BoxTreeTestHelper() {
    throw new AssertionError("May not be instantiated!");
  }

  public static ComputedStyle style(final Display display) {
    return ComputedValues.newBuilder().display(display).build();
  }

  /**
   * Style of a pseudo-element generating the given string.
   *
   * @param content the generated text
   * @return the style
   */
  public static ComputedStyle pseudo(final String content) {
    return ComputedValues.newBuilder().display(Display.INLINE).addContent(ContentItem.string(content)).build();
  }

  public static LongList keys(final long... keys) {
    return LongArrayList.wrap(keys);
  }

  public static TreeBuilder newTree() {
    return new TreeBuilder(Document.create());
  }

  public static TreeBuilder newTree(final Document document) {
    return new TreeBuilder(document);
  }

  /**
   * Builds styled DOM trees below the document node.
   */
  public static final class TreeBuilder {

    private final Document document;

    private TreeBuilder(final Document document) {
      this.document = document;
    }

    public Document document() {
      return document;
    }

    /**
     * Append a styled element.
     *
     * @param parentKey the parent
     * @param tagName the tag name
     * @param style the primary style
     * @return the key of the new element
     */
    public long element(final long parentKey, final String tagName, final ComputedStyle style) {
      return element(parentKey, tagName, style, Map.of());
    }

    public long element(final long parentKey, final String tagName, final ComputedStyle style,
        final Map<String, String> attributes) {
      final long key = document.createElement(tagName, attributes);
      document.appendChild(parentKey, key);
      document.restyle(key, NodeStyleData.of(style));
      return key;
    }

    public long text(final long parentKey, final String text) {
      final long key = document.createText(text);
      document.appendChild(parentKey, key);
      return key;
    }

    public long comment(final long parentKey, final String text) {
      final long key = document.createComment(text);
      document.appendChild(parentKey, key);
      return key;
    }
  }
}
