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
import io.boxwood.layout.inline.InlineBox;
import io.boxwood.layout.inline.InlineBoxKind;
import io.boxwood.layout.inline.InlineLayout;
import io.boxwood.layout.inline.StyleSpan;
import io.boxwood.style.ComputedValues;
import io.boxwood.style.WhiteSpaceCollapse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Test {@link PlainTextShaper}.
 */
public final class PlainTextShaperTest {

  private ShapingContext context;

  @BeforeEach
  public void setUp() {
    context = new PlainTextShaper().openContext(1.25f);
  }

  @AfterEach
  public void tearDown() {
    context.close();
  }

  private ParagraphBuilder paragraph(final WhiteSpaceCollapse mode) {
    return context.newParagraph(1, ComputedValues.newBuilder().whiteSpaceCollapse(mode).build());
  }

  @Test
  public void testCollapse() {
    final ParagraphBuilder builder = context.newParagraph(1, null);
    builder.pushText("  a \t b\n\nc  ");
    final InlineLayout layout = builder.build();

    assertEquals("a b c", layout.getText());
    assertEquals(WhiteSpaceCollapse.COLLAPSE, layout.getRootWhiteSpaceMode());
    assertEquals(1.25f, layout.getScale());
  }

  @Test
  public void testCollapseAcrossRuns() {
    final ParagraphBuilder builder = context.newParagraph(1, null);
    builder.pushText("a ");
    builder.pushText(" b");
    assertEquals("a b", builder.build().getText());
  }

  @Test
  public void testPreserveSpaces() {
    final ParagraphBuilder builder = paragraph(WhiteSpaceCollapse.PRESERVE_SPACES);
    builder.pushText("a  b\nc ");
    assertEquals("a  b c ", builder.build().getText());
  }

  @Test
  public void testPreserveBreaks() {
    final ParagraphBuilder builder = paragraph(WhiteSpaceCollapse.PRESERVE_BREAKS);
    builder.pushText("a  \n  b");
    assertEquals("a\nb", builder.build().getText());
  }

  @Test
  public void testModeSwitchWithinParagraph() {
    final ParagraphBuilder builder = context.newParagraph(1, null);
    builder.pushText("a  ");
    builder.setWhiteSpaceMode(WhiteSpaceCollapse.PRESERVE);
    builder.pushText("  b");
    builder.setWhiteSpaceMode(WhiteSpaceCollapse.COLLAPSE);
    builder.pushText(" c");

    final InlineLayout layout = builder.build();
    assertEquals("a   b c", layout.getText());
    assertEquals(WhiteSpaceCollapse.COLLAPSE, layout.getRootWhiteSpaceMode());
  }

  @Test
  public void testLineBreakTrimsTrailingSpace() {
    final ParagraphBuilder builder = context.newParagraph(1, null);
    builder.pushText("a ");
    builder.pushLineBreak();
    builder.pushText(" b");
    assertEquals("a\nb", builder.build().getText());
  }

  @Test
  public void testSpansAreClampedToTrimmedText() {
    final ParagraphBuilder builder = context.newParagraph(1, null);
    builder.pushStyleSpan(2, null);
    builder.pushText("a ");
    builder.popStyleSpan();

    assertEquals(List.of(new StyleSpan(2, 0, 1, 0)), builder.build().getStyleSpans());
  }

  @Test
  public void testInlineBoxes() {
    final ParagraphBuilder builder = context.newParagraph(1, null);
    builder.pushText("a ");
    builder.pushInlineBox(3, InlineBoxKind.OUT_OF_FLOW);
    builder.pushText(" b");
    builder.pushInlineBox(4, InlineBoxKind.IN_FLOW);
    builder.pushText(" c");

    final InlineLayout layout = builder.build();
    assertEquals("a b c", layout.getText());
    assertEquals(List.of(new InlineBox(3, InlineBoxKind.OUT_OF_FLOW, 2), new InlineBox(4, InlineBoxKind.IN_FLOW, 3)),
        layout.getInlineBoxes());
  }

  @Test
  public void testUnbalancedSpans() {
    final ParagraphBuilder builder = context.newParagraph(1, null);
    assertThrows(IllegalStateException.class, builder::popStyleSpan);
    builder.pushStyleSpan(2, null);
    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  public void testClosedContext() {
    context.close();
    assertThrows(IllegalStateException.class, () -> context.newParagraph(1, null));
  }

  @Test
  public void testInvalidScale() {
    final PlainTextShaper shaper = new PlainTextShaper();
    assertThrows(IllegalArgumentException.class, () -> shaper.openContext(0f));
    assertThrows(IllegalArgumentException.class, () -> shaper.openContext(-1f));
  }
}
