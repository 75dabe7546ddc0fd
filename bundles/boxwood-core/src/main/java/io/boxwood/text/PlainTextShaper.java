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

package io.boxwood.text;

import io.boxwood.api.ParagraphBuilder;
import io.boxwood.api.ShapingContext;
import io.boxwood.api.TextShaper;
import io.boxwood.layout.inline.InlineBox;
import io.boxwood.layout.inline.InlineBoxKind;
import io.boxwood.layout.inline.InlineLayout;
import io.boxwood.layout.inline.StyleSpan;
import io.boxwood.style.ComputedStyle;
import io.boxwood.style.WhiteSpaceCollapse;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * {@link TextShaper} which performs no glyph shaping. It records the paragraph structure (text,
 * style spans, embedded boxes) and applies white space processing, which is all box construction
 * needs.
 */
public final class PlainTextShaper implements TextShaper {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(PlainTextShaper.class);

  @Override
  public ShapingContext openContext(final float scale) {
    checkArgument(scale > 0f, "scale must be > 0!");
    return new PlainShapingContext(scale);
  }

  /**
   * Shaping context, valid until closed.
   */
  private static final class PlainShapingContext implements ShapingContext {

    private final float scale;

    private boolean closed;

    private int paragraphs;

    PlainShapingContext(final float scale) {
      this.scale = scale;
    }

    @Override
    public ParagraphBuilder newParagraph(final long rootKey, final @Nullable ComputedStyle rootStyle) {
      checkState(!closed, "Shaping context is closed.");
      paragraphs++;
      final WhiteSpaceCollapse mode = rootStyle == null ? WhiteSpaceCollapse.COLLAPSE : rootStyle.getWhiteSpaceCollapse();
      return new PlainParagraphBuilder(rootKey, mode, scale);
    }

    @Override
    public void close() {
      if (!closed) {
        closed = true;
        LOGGER.debug("Shaping context closed after {} paragraphs.", paragraphs);
      }
    }
  }

  /**
   * Paragraph builder applying white space processing per pushed run.
   */
  static final class PlainParagraphBuilder implements ParagraphBuilder {

    private final long rootKey;

    private final WhiteSpaceCollapse rootMode;

    private final float scale;

    private final StringBuilder text = new StringBuilder();

    private final List<StyleSpan> styleSpans = new ArrayList<>();

    private final Deque<OpenSpan> openSpans = new ArrayDeque<>();

    private final List<InlineBox> inlineBoxes = new ArrayList<>();

    private WhiteSpaceCollapse mode;

    /** Set at line start and after collapsible white space, where further white space collapses away. */
    private boolean collapseBoundary = true;

    private record OpenSpan(long nodeKey, int start, int index) {
    }

    PlainParagraphBuilder(final long rootKey, final WhiteSpaceCollapse rootMode, final float scale) {
      this.rootKey = rootKey;
      this.rootMode = requireNonNull(rootMode);
      this.scale = scale;
      mode = rootMode;
    }

    @Override
    public void pushStyleSpan(final long nodeKey, final @Nullable ComputedStyle style) {
      openSpans.push(new OpenSpan(nodeKey, text.length(), styleSpans.size()));
      styleSpans.add(new StyleSpan(nodeKey, text.length(), text.length(), openSpans.size() - 1));
    }

    @Override
    public void popStyleSpan() {
      checkState(!openSpans.isEmpty(), "No open style span.");
      final OpenSpan span = openSpans.pop();
      styleSpans.set(span.index(), new StyleSpan(span.nodeKey(), span.start(), text.length(), openSpans.size()));
    }

    @Override
    public void setWhiteSpaceMode(final WhiteSpaceCollapse mode) {
      this.mode = requireNonNull(mode);
    }

    @Override
    public void pushText(final String run) {
      for (int i = 0, length = run.length(); i < length; i++) {
        final char c = run.charAt(i);
        final boolean isSpace = c == ' ' || c == '\t';
        final boolean isBreak = c == '\n';
        if (mode.collapsesSpaces() && (isSpace || (isBreak && !mode.preservesBreaks()))) {
          if (!collapseBoundary) {
            text.append(' ');
            collapseBoundary = true;
          }
        } else if (isBreak && mode.preservesBreaks()) {
          appendBreak();
        } else if (isBreak) {
          // Spaces are preserved but segment breaks are not.
          text.append(' ');
          collapseBoundary = false;
        } else {
          text.append(c);
          collapseBoundary = false;
        }
      }
    }

    @Override
    public void pushInlineBox(final long nodeKey, final InlineBoxKind kind) {
      inlineBoxes.add(new InlineBox(nodeKey, kind, text.length()));
      if (kind == InlineBoxKind.IN_FLOW) {
        collapseBoundary = false;
      }
    }

    @Override
    public void pushLineBreak() {
      appendBreak();
    }

    private void appendBreak() {
      trimTrailingCollapsibleSpace();
      text.append('\n');
      collapseBoundary = true;
    }

    private void trimTrailingCollapsibleSpace() {
      if (mode.collapsesSpaces() && text.length() > 0 && text.charAt(text.length() - 1) == ' ') {
        text.setLength(text.length() - 1);
      }
    }

    @Override
    public InlineLayout build() {
      checkState(openSpans.isEmpty(), "%s style spans are still open.", openSpans.size());
      trimTrailingCollapsibleSpace();
      final int length = text.length();
      final List<StyleSpan> spans = new ArrayList<>(styleSpans.size());
      for (final StyleSpan span : styleSpans) {
        spans.add(new StyleSpan(span.nodeKey(), Math.min(span.start(), length), Math.min(span.end(), length),
            span.depth()));
      }
      final List<InlineBox> boxes = new ArrayList<>(inlineBoxes.size());
      for (final InlineBox box : inlineBoxes) {
        boxes.add(new InlineBox(box.nodeKey(), box.kind(), Math.min(box.textIndex(), length)));
      }
      return new InlineLayout(rootKey, text.toString(), rootMode, spans, boxes, scale);
    }
  }
}
