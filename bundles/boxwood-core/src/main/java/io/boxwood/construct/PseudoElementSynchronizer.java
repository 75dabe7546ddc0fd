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
import io.boxwood.node.BoxNode;
import io.boxwood.node.Damage;
import io.boxwood.node.NodeStyleData;
import io.boxwood.settings.Fixed;
import io.boxwood.style.ComputedStyle;
import io.boxwood.style.StyleAdapter;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Creates, updates and destroys the {@code ::before} and {@code ::after} boxes of a node by
 * diffing the cached pseudo-element nodes against the current pseudo styles. Runs before box
 * construction of the node, so pseudo-elements are seen as ordinary children.
 */
public final class PseudoElementSynchronizer {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(PseudoElementSynchronizer.class);

  /** The two pseudo-element slots of a node. */
  enum Slot {
    BEFORE("::before"),
    AFTER("::after");

    private final String tagName;

    Slot(final String tagName) {
      this.tagName = tagName;
    }

    long get(final BoxNode node) {
      return this == BEFORE ? node.getBeforeKey() : node.getAfterKey();
    }

    void set(final BoxNode node, final long key) {
      if (this == BEFORE) {
        node.setBeforeKey(key);
      } else {
        node.setAfterKey(key);
      }
    }

    @Nullable ComputedStyle style(final StyleAdapter styleAdapter, final BoxNode node) {
      return this == BEFORE ? styleAdapter.getBeforeStyle(node) : styleAdapter.getAfterStyle(node);
    }
  }

  private final Document document;

  /**
   * Constructor.
   *
   * @param document the document
   */
  public PseudoElementSynchronizer(final Document document) {
    this.document = requireNonNull(document);
  }

  /**
   * Synchronize both pseudo-elements of a node with its current style.
   *
   * @param nodeKey the node key
   */
  public void synchronize(final long nodeKey) {
    final BoxNode node = document.getNode(nodeKey);
    if (!node.getKind().hasElementData()) {
      return;
    }
    for (final Slot slot : Slot.values()) {
      synchronize(node, slot);
    }
  }

  private void synchronize(final BoxNode node, final Slot slot) {
    final ComputedStyle style = slot.style(document.getStyleAdapter(), node);
    final long pseudoKey = slot.get(node);
    final boolean exists = pseudoKey != Fixed.NULL_NODE_KEY.getStandardProperty();

    if (exists && style == null) {
      document.dropSubtree(pseudoKey);
      slot.set(node, Fixed.NULL_NODE_KEY.getStandardProperty());
      node.insertDamage(Damage.ALL);
      LOGGER.debug("Removed {} of node {}.", slot.tagName, node.getNodeKey());
    } else if (!exists && style != null) {
      final BoxNode pseudo = document.createAnonymousBlock(slot.tagName, node.getNodeKey(), style);
      materializeContent(pseudo, style, node);
      slot.set(node, pseudo.getNodeKey());
      node.insertDamage(Damage.ALL);
      LOGGER.debug("Created {} {} of node {}.", slot.tagName, pseudo.getNodeKey(), node.getNodeKey());
    } else if (exists) {
      final BoxNode pseudo = document.getNode(pseudoKey);
      if (pseudo.getPrimaryStyle() != style) {
        pseudo.setStyleData(NodeStyleData.of(style));
        pseudo.insertDamage(Damage.ALL);
        final LongArrayList oldText = new LongArrayList(pseudo.getChildren());
        pseudo.getChildren().clear();
        for (final long textKey : oldText) {
          document.dropSubtree(textKey);
        }
        materializeContent(pseudo, style, node);
      }
    }
  }

  private void materializeContent(final BoxNode pseudo, final ComputedStyle style, final BoxNode originatingElement) {
    final String content = document.getStyleAdapter().resolveContent(style, originatingElement);
    if (!content.isEmpty()) {
      document.createGeneratedText(pseudo.getNodeKey(), content);
    }
  }
}
