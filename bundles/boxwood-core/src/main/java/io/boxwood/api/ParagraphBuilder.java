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

import io.boxwood.layout.inline.InlineBoxKind;
import io.boxwood.layout.inline.InlineLayout;
import io.boxwood.style.ComputedStyle;
import io.boxwood.style.WhiteSpaceCollapse;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builder of one paragraph. Calls follow document order of the flattened inline content.
 */
public interface ParagraphBuilder {

  /**
   * Open a style span for an inline element. Spans nest.
   *
   * @param nodeKey key of the inline element
   * @param style the element's style
   */
  void pushStyleSpan(long nodeKey, @Nullable ComputedStyle style);

  /**
   * Close the innermost open style span.
   *
   * @throws IllegalStateException if no span is open
   */
  void popStyleSpan();

  void setWhiteSpaceMode(WhiteSpaceCollapse mode);

  void pushText(String text);

  /**
   * Embed an atomic box at the current position.
   *
   * @param nodeKey key of the embedded node
   * @param kind how the box participates in line layout
   */
  void pushInlineBox(long nodeKey, InlineBoxKind kind);

  /**
   * Force a line break at the current position.
   */
  void pushLineBreak();

  /**
   * Finish the paragraph.
   *
   * @return the paragraph
   * @throws IllegalStateException if style spans are still open
   */
  InlineLayout build();
}
