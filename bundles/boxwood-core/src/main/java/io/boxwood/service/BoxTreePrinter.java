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

package io.boxwood.service;

import io.boxwood.access.Document;
import io.boxwood.exception.BoxwoodIOException;
import io.boxwood.layout.inline.InlineLayout;
import io.boxwood.layout.table.TableContext;
import io.boxwood.node.BoxNode;
import io.boxwood.settings.Fixed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Prints the box tree of a document as indented text, one box per line. Inline formatting
 * context roots show their paragraph text, table roots their grid dimensions.
 *
 * <pre>
 * #document [0]
 *   div [1]
 *     (div) [7] inline "x"
 * </pre>
 */
public final class BoxTreePrinter {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(BoxTreePrinter.class);

  /** Indentation per level. */
  private static final String INDENT = "  ";

  private final Document document;

  private final Appendable out;

  /**
   * Constructor.
   *
   * @param document the document whose box tree to print
   * @param out the target
   */
  public BoxTreePrinter(final Document document, final Appendable out) {
    this.document = requireNonNull(document);
    this.out = requireNonNull(out);
  }

  /**
   * Print the box tree of a document into a string.
   *
   * @param document the document
   * @return the box tree as text
   */
  public static String toString(final Document document) {
    final StringBuilder builder = new StringBuilder();
    new BoxTreePrinter(document, builder).print();
    return builder.toString();
  }

  /**
   * Print the box tree below the document node.
   *
   * @throws BoxwoodIOException if writing to the target fails
   */
  public void print() {
    print(Fixed.DOCUMENT_NODE_KEY.getStandardProperty());
  }

  /**
   * Print the box tree below a node.
   *
   * @param nodeKey key of the node to start at
   * @throws BoxwoodIOException if writing to the target fails
   */
  public void print(final long nodeKey) {
    try {
      print(nodeKey, 0);
    } catch (final IOException e) {
      throw new BoxwoodIOException("Failed to print box tree.", e);
    }
  }

  private void print(final long nodeKey, final int level) throws IOException {
    if (level > document.getConfiguration().maxTreeDepth) {
      LOGGER.warn("Maximum tree depth {} reached printing node {}.", document.getConfiguration().maxTreeDepth, nodeKey);
      return;
    }
    final BoxNode node = document.getNode(nodeKey);
    for (int i = 0; i < level; i++) {
      out.append(INDENT);
    }
    out.append(label(node)).append(" [").append(String.valueOf(nodeKey)).append(']');

    final Optional<InlineLayout> inlineLayout = document.getInlineLayout(nodeKey);
    if (document.isInlineRoot(nodeKey) && inlineLayout.isPresent()) {
      out.append(" inline \"").append(escape(inlineLayout.get().getText())).append('"');
    }
    if (document.isTableRoot(nodeKey)) {
      final Optional<TableContext> tableContext = document.getTableContext(nodeKey);
      if (tableContext.isPresent()) {
        out.append(" table ")
           .append(String.valueOf(tableContext.get().getRowCount()))
           .append('x')
           .append(String.valueOf(tableContext.get().getColumnCount()));
      }
    }
    out.append('\n');

    for (final long childKey : document.getLayoutChildren(nodeKey)) {
      print(childKey, level + 1);
    }
  }

  private static String label(final BoxNode node) {
    return switch (node.getKind()) {
      case DOCUMENT -> "#document";
      case TEXT -> "#text \"" + escape(requireNonNull(node.getValue())) + '"';
      case COMMENT -> "#comment";
      case ANONYMOUS_BLOCK -> "(" + node.getTagName() + ")";
      case ELEMENT -> requireNonNull(node.getTagName());
    };
  }

  private static String escape(final String text) {
    return text.replace("\\", "\\\\").replace("\n", "\\n").replace("\"", "\\\"");
  }
}
