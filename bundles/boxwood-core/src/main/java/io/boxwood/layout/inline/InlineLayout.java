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

package io.boxwood.layout.inline;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import io.boxwood.node.SpecialData;
import io.boxwood.style.WhiteSpaceCollapse;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The paragraph of an inline formatting context root: the flattened text of all inline
 * descendants, the style spans over it and the atomic boxes embedded into it. Owned exclusively
 * by the root.
 */
public final class InlineLayout implements SpecialData {

  private final long rootKey;

  private final String text;

  private final WhiteSpaceCollapse rootWhiteSpaceMode;

  private final ImmutableList<StyleSpan> styleSpans;

  private final ImmutableList<InlineBox> inlineBoxes;

  private final float scale;

  /**
   * Constructor.
   *
   * @param rootKey key of the inline root
   * @param text the shaped text
   * @param rootWhiteSpaceMode white space mode of the root
   * @param styleSpans style spans in the order they were opened
   * @param inlineBoxes embedded atomic boxes in paragraph order
   * @param scale the scale the paragraph was built for
   */
  public InlineLayout(final long rootKey, final String text, final WhiteSpaceCollapse rootWhiteSpaceMode,
      final List<StyleSpan> styleSpans, final List<InlineBox> inlineBoxes, final float scale) {
    this.rootKey = rootKey;
    this.text = requireNonNull(text);
    this.rootWhiteSpaceMode = requireNonNull(rootWhiteSpaceMode);
    this.styleSpans = ImmutableList.copyOf(styleSpans);
    this.inlineBoxes = ImmutableList.copyOf(inlineBoxes);
    this.scale = scale;
  }

  public long getRootKey() {
    return rootKey;
  }

  public String getText() {
    return text;
  }

  public WhiteSpaceCollapse getRootWhiteSpaceMode() {
    return rootWhiteSpaceMode;
  }

  public List<StyleSpan> getStyleSpans() {
    return styleSpans;
  }

  public List<InlineBox> getInlineBoxes() {
    return inlineBoxes;
  }

  /**
   * Get the keys of the embedded boxes in paragraph order.
   *
   * @return the keys
   */
  public LongList getInlineBoxKeys() {
    final LongArrayList keys = new LongArrayList(inlineBoxes.size());
    inlineBoxes.forEach(box -> keys.add(box.nodeKey()));
    return LongLists.unmodifiable(keys);
  }

  public float getScale() {
    return scale;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("rootKey", rootKey)
                      .add("text", text)
                      .add("styleSpans", styleSpans)
                      .add("inlineBoxes", inlineBoxes)
                      .toString();
  }
}
