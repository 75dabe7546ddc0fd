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

package io.boxwood.access;

import com.google.common.base.MoreObjects;
import io.boxwood.api.LayoutTree;
import io.boxwood.api.TextShaper;
import io.boxwood.exception.BoxTreeCorruptionException;
import io.boxwood.layout.inline.InlineLayout;
import io.boxwood.layout.table.TableContext;
import io.boxwood.node.BoxNode;
import io.boxwood.node.Damage;
import io.boxwood.node.ElementData;
import io.boxwood.node.NodeFlag;
import io.boxwood.node.NodeKind;
import io.boxwood.node.NodeStyleData;
import io.boxwood.settings.Fixed;
import io.boxwood.style.ComputedStyle;
import io.boxwood.style.InheritingStyleResolver;
import io.boxwood.style.StyleAdapter;
import io.boxwood.style.StyleResolver;
import io.boxwood.text.PlainTextShaper;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * A document: the owner of the node arena, the DOM mutation entry point and the box tree view
 * handed to the numeric layout engine.
 *
 * <p>
 * Every mutation inserts construction damage on the mutated node (structural mutations on the
 * parent) and escalates it through the {@link DamageTracker}, so the next traversal of the
 * {@code LayoutTreeDriver} picks it up.
 * </p>
 */
public final class Document implements LayoutTree {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(Document.class);

  private final DocumentConfiguration configuration;

  private final NodeArena arena;

  private final StyleResolver styleResolver;

  private final TextShaper textShaper;

  private final StyleAdapter styleAdapter;

  private final DamageTracker damageTracker;

  /**
   * Constructor.
   *
   * @param configuration the configuration
   * @param styleResolver source of anonymous box styles
   * @param textShaper the text shaper
   */
  public Document(final DocumentConfiguration configuration, final StyleResolver styleResolver,
      final TextShaper textShaper) {
    this.configuration = requireNonNull(configuration);
    this.styleResolver = requireNonNull(styleResolver);
    this.textShaper = requireNonNull(textShaper);
    arena = new NodeArena();
    styleAdapter = new StyleAdapter(arena, configuration.maxTreeDepth);
    damageTracker = new DamageTracker(arena, configuration.maxTreeDepth);

    final BoxNode documentNode = arena.create(NodeKind.DOCUMENT, null, null);
    checkState(documentNode.getNodeKey() == Fixed.DOCUMENT_NODE_KEY.getStandardProperty());
    documentNode.setFlag(NodeFlag.IS_IN_DOCUMENT, true);
    documentNode.setDamage(Damage.ALL);
  }

  /**
   * Create a document with the standard configuration, inheriting anonymous styles and the plain
   * text shaper.
   *
   * @return a new, empty document
   */
  public static Document create() {
    return create(DocumentConfiguration.defaults());
  }

  /**
   * Create a document with inheriting anonymous styles and the plain text shaper.
   *
   * @param configuration the configuration
   * @return a new, empty document
   */
  public static Document create(final DocumentConfiguration configuration) {
    return new Document(configuration, new InheritingStyleResolver(), new PlainTextShaper());
  }

  public DocumentConfiguration getConfiguration() {
    return configuration;
  }

  public NodeArena getArena() {
    return arena;
  }

  public StyleResolver getStyleResolver() {
    return styleResolver;
  }

  public TextShaper getTextShaper() {
    return textShaper;
  }

  public StyleAdapter getStyleAdapter() {
    return styleAdapter;
  }

  public DamageTracker getDamageTracker() {
    return damageTracker;
  }

  public BoxNode getDocumentNode() {
    return arena.get(Fixed.DOCUMENT_NODE_KEY.getStandardProperty());
  }

  /**
   * Get a live node.
   *
   * @param nodeKey the node key
   * @return the node
   * @throws IllegalArgumentException if no live node has the key
   */
  public BoxNode getNode(final long nodeKey) {
    return arena.get(nodeKey);
  }

  /**
   * Get the number of live nodes, including the document node and synthesized boxes.
   *
   * @return the number of nodes
   */
  public int size() {
    return arena.size();
  }

  // ---------------------------------------------------------------------------------------------
  // DOM construction and mutation
  // ---------------------------------------------------------------------------------------------

  public long createElement(final String tagName) {
    return createElement(tagName, Map.of());
  }

  /**
   * Create a detached element.
   *
   * @param tagName the tag name
   * @param attributes the attributes
   * @return the key of the new element
   */
  public long createElement(final String tagName, final Map<String, String> attributes) {
    final BoxNode node = arena.create(NodeKind.ELEMENT, new ElementData(tagName, attributes), null);
    node.setDamage(Damage.ALL);
    return node.getNodeKey();
  }

  public long createText(final String text) {
    final BoxNode node = arena.create(NodeKind.TEXT, null, requireNonNull(text));
    node.setDamage(Damage.ALL);
    return node.getNodeKey();
  }

  public long createComment(final String text) {
    final BoxNode node = arena.create(NodeKind.COMMENT, null, requireNonNull(text));
    node.setDamage(Damage.ALL);
    return node.getNodeKey();
  }

  /**
   * Append a detached node to the children of a parent.
   *
   * @param parentKey the parent key
   * @param childKey the child key
   * @throws IllegalArgumentException if the child is attached or the insertion would create a cycle
   */
  public void appendChild(final long parentKey, final long childKey) {
    final BoxNode parent = arena.get(parentKey);
    insertChild(parent, childKey, parent.getChildren().size());
  }

  /**
   * Insert a detached node before a child of a parent.
   *
   * @param parentKey the parent key
   * @param childKey the child key
   * @param referenceKey the key of the child to insert before
   * @throws IllegalArgumentException if the reference is no child of the parent, the child is
   *         attached or the insertion would create a cycle
   */
  public void insertBefore(final long parentKey, final long childKey, final long referenceKey) {
    final BoxNode parent = arena.get(parentKey);
    final int index = parent.getChildren().indexOf(referenceKey);
    checkArgument(index >= 0, "Node %s is no child of %s.", referenceKey, parentKey);
    insertChild(parent, childKey, index);
  }

  private void insertChild(final BoxNode parent, final long childKey, final int index) {
    final BoxNode child = arena.get(childKey);
    checkArgument(parent.getKind() == NodeKind.DOCUMENT || parent.isElement(), "Node %s can not have children.",
        parent.getNodeKey());
    checkArgument(child.getKind() != NodeKind.DOCUMENT && !child.isAnonymousBlock(), "Node %s can not be inserted.",
        childKey);
    checkArgument(!child.hasParent(), "Node %s is already attached.", childKey);
    for (long key = parent.getNodeKey(); key != Fixed.NULL_NODE_KEY.getStandardProperty();
        key = arena.get(key).getParentKey()) {
      checkArgument(key != childKey, "Inserting node %s would create a cycle.", childKey);
    }

    parent.getChildren().add(index, childKey);
    child.setParentKey(parent.getNodeKey());
    if (parent.hasFlag(NodeFlag.IS_IN_DOCUMENT)) {
      setInDocument(childKey, true);
    }
    damageTracker.markDamaged(parent.getNodeKey(), Damage.BOX);
  }

  /**
   * Remove a child from its parent and drop the detached subtree, including its pseudo-elements
   * and synthesized boxes, from the arena.
   *
   * @param parentKey the parent key
   * @param childKey the child key
   * @throws IllegalArgumentException if the node is no child of the parent
   */
  public void removeChild(final long parentKey, final long childKey) {
    final BoxNode parent = arena.get(parentKey);
    final BoxNode child = arena.get(childKey);
    checkArgument(child.getParentKey() == parentKey, "Node %s is no child of %s.", childKey, parentKey);
    parent.getChildren().rem(childKey);
    child.setParentKey(Fixed.NULL_NODE_KEY.getStandardProperty());
    damageTracker.markDamaged(parentKey, Damage.BOX);
    dropSubtree(childKey);
  }

  /**
   * Replace the character data of a text or comment node.
   *
   * @param nodeKey the node key
   * @param text the new text
   */
  public void setText(final long nodeKey, final String text) {
    final BoxNode node = arena.get(nodeKey);
    node.setValue(text);
    damageTracker.markDamaged(nodeKey, Damage.BOX);
    if (node.hasParent()) {
      damageTracker.markDamaged(node.getParentKey(), Damage.BOX);
    }
  }

  /**
   * Set an attribute. A {@code colspan} change additionally rebuilds the enclosing table.
   *
   * @param nodeKey the element key
   * @param name the attribute name
   * @param value the attribute value
   */
  public void setAttribute(final long nodeKey, final String name, final String value) {
    final BoxNode node = arena.get(nodeKey);
    checkArgument(node.isElement(), "Node %s is no element.", nodeKey);
    node.elementData().setAttribute(name, value);
    damageTracker.markDamaged(nodeKey, Damage.BOX);
    if ("colspan".equals(name)) {
      damageTracker.markTableDamaged(nodeKey);
    }
  }

  /**
   * Install the cascade output of a node. Nothing is damaged if all style handles are identical to
   * the installed ones.
   *
   * @param nodeKey the node key
   * @param styleData the new style data
   * @return {@code true} if a style handle changed
   */
  public boolean restyle(final long nodeKey, final NodeStyleData styleData) {
    requireNonNull(styleData);
    final BoxNode node = arena.get(nodeKey);
    if (!styleData.differsFrom(node.getStyleData())) {
      return false;
    }
    node.setStyleData(styleData);
    damageTracker.markDamaged(nodeKey, Damage.ALL);
    if (node.hasParent()) {
      damageTracker.markDamaged(node.getParentKey(), Damage.BOX);
    }
    return true;
  }

  /**
   * Damage every inline formatting context of the document, for instance after a font has been
   * loaded. Anonymous inline roots damage their layout parent instead.
   */
  public void invalidateInlineContexts() {
    final LongArrayList damaged = new LongArrayList();
    arena.forEach(node -> {
      if (!node.hasFlag(NodeFlag.IS_IN_DOCUMENT) || node.getElementData() == null
          || node.elementData().getSpecialData(InlineLayout.class) == null) {
        return;
      }
      if (node.isAnonymousBlock() && arena.contains(node.getLayoutParentKey())) {
        damaged.add(node.getLayoutParentKey());
      } else {
        damaged.add(node.getNodeKey());
      }
    });
    LOGGER.debug("Invalidating {} inline formatting contexts.", damaged.size());
    for (final long key : damaged) {
      damageTracker.markDamaged(key, Damage.ALL);
    }
  }

  private void setInDocument(final long rootKey, final boolean inDocument) {
    final LongArrayList stack = LongArrayList.of(rootKey);
    while (!stack.isEmpty()) {
      final BoxNode node = arena.get(stack.popLong());
      node.setFlag(NodeFlag.IS_IN_DOCUMENT, inDocument);
      pushDomChildren(node, stack);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Synthesized boxes
  // ---------------------------------------------------------------------------------------------

  /**
   * Create an anonymous block box. The caller parents it.
   *
   * @param tagName the debug tag name of the box
   * @param parentKey the key of the creating node
   * @param style the box's style
   * @return the new box, fully damaged
   */
  public BoxNode createAnonymousBlock(final String tagName, final long parentKey, final ComputedStyle style) {
    final BoxNode parent = arena.get(parentKey);
    final BoxNode node = arena.create(NodeKind.ANONYMOUS_BLOCK, new ElementData(tagName, Map.of()), null);
    node.setParentKey(parentKey);
    node.setLayoutParentKey(parentKey);
    node.setStyleData(NodeStyleData.of(style));
    node.setDamage(Damage.ALL);
    node.setFlag(NodeFlag.IS_IN_DOCUMENT, parent.hasFlag(NodeFlag.IS_IN_DOCUMENT));
    return node;
  }

  /**
   * Create a text node owned by a synthesized box.
   *
   * @param parentKey the owning box
   * @param text the text
   * @return the new text node, appended to the owner's children
   */
  public BoxNode createGeneratedText(final long parentKey, final String text) {
    final BoxNode parent = arena.get(parentKey);
    final BoxNode node = arena.create(NodeKind.TEXT, null, text);
    node.setParentKey(parentKey);
    node.setDamage(Damage.ALL);
    node.setFlag(NodeFlag.IS_IN_DOCUMENT, parent.hasFlag(NodeFlag.IS_IN_DOCUMENT));
    parent.getChildren().add(node.getNodeKey());
    return node;
  }

  /**
   * Remove a node with its DOM subtree, its pseudo-elements and the anonymous wrappers owned by
   * any of them from the arena.
   *
   * @param rootKey the subtree root
   */
  public void dropSubtree(final long rootKey) {
    final LongSet dropped = new LongOpenHashSet();
    final LongArrayList stack = LongArrayList.of(rootKey);
    while (!stack.isEmpty()) {
      final long key = stack.popLong();
      if (!dropped.add(key)) {
        continue;
      }
      final BoxNode node = arena.get(key);
      pushDomChildren(node, stack);
      pushOwnedWrappers(node, stack);
    }
    for (final long key : dropped) {
      arena.remove(key);
    }
  }

  /**
   * Remove an anonymous wrapper, and the wrappers it owns, from the arena. The wrapped nodes stay,
   * they are DOM children of the wrapper's owner.
   *
   * @param wrapperKey the wrapper key
   */
  public void dropAnonymousWrapper(final long wrapperKey) {
    final BoxNode wrapper = arena.get(wrapperKey);
    checkArgument(wrapper.isAnonymousWrapper(), "Node %s is no anonymous wrapper.", wrapperKey);
    final LongArrayList owned = new LongArrayList();
    pushOwnedWrappers(wrapper, owned);
    for (final long key : owned) {
      dropAnonymousWrapper(key);
    }
    arena.remove(wrapperKey);
  }

  /**
   * Forget the box-tree state of a node: its construction flags, its special data, its cached
   * layout children and the anonymous wrappers it owns. Used when a node is rebuilt and when it is
   * flattened into its container.
   *
   * @param nodeKey the node key
   * @return the number of dropped anonymous wrappers
   */
  public int resetLayout(final long nodeKey) {
    final BoxNode node = arena.get(nodeKey);
    node.resetConstructionFlags();
    final ElementData elementData = node.getElementData();
    if (elementData != null) {
      elementData.setSpecialData(null);
    }
    final LongArrayList owned = new LongArrayList();
    pushOwnedWrappers(node, owned);
    for (final long key : owned) {
      dropAnonymousWrapper(key);
    }
    node.setLayoutChildren(null);
    return owned.size();
  }

  /**
   * {@link #resetLayout(long) Reset} the box-tree state of every DOM descendant and pseudo-element
   * below a node, for subtrees which no longer generate boxes.
   *
   * @param rootKey the subtree root, which is not reset itself
   */
  public void resetDescendantLayouts(final long rootKey) {
    final LongArrayList stack = new LongArrayList();
    pushDomChildren(arena.get(rootKey), stack);
    while (!stack.isEmpty()) {
      final long key = stack.popLong();
      resetLayout(key);
      pushDomChildren(arena.get(key), stack);
    }
  }

  private static void pushDomChildren(final BoxNode node, final LongArrayList target) {
    target.addAll(node.getChildren());
    if (node.hasBefore()) {
      target.add(node.getBeforeKey());
    }
    if (node.hasAfter()) {
      target.add(node.getAfterKey());
    }
  }

  private void pushOwnedWrappers(final BoxNode owner, final LongArrayList target) {
    final LongList layoutChildren = owner.getLayoutChildren();
    if (layoutChildren == null) {
      return;
    }
    for (final long key : layoutChildren) {
      final BoxNode candidate = arena.getOrNull(key);
      if (candidate != null && candidate.isAnonymousWrapper() && candidate.getAnonymousOwnerKey() == owner.getNodeKey()) {
        target.add(key);
      }
    }
  }

  // ---------------------------------------------------------------------------------------------
  // LayoutTree
  // ---------------------------------------------------------------------------------------------

  @Override
  public LongList getLayoutChildren(final long nodeKey) {
    final LongList layoutChildren = arena.get(nodeKey).getLayoutChildren();
    return layoutChildren == null ? LongLists.EMPTY_LIST : layoutChildren;
  }

  @Override
  public Optional<InlineLayout> getInlineLayout(final long nodeKey) {
    final ElementData elementData = arena.get(nodeKey).getElementData();
    return elementData == null ? Optional.empty() : Optional.ofNullable(elementData.getSpecialData(InlineLayout.class));
  }

  @Override
  public Optional<TableContext> getTableContext(final long nodeKey) {
    final BoxNode node = arena.get(nodeKey);
    if (!node.hasFlag(NodeFlag.IS_TABLE_ROOT)) {
      return Optional.empty();
    }
    final ElementData elementData = node.getElementData();
    final TableContext tableContext = elementData == null ? null : elementData.getSpecialData(TableContext.class);
    if (tableContext == null) {
      if (configuration.assertInvariants) {
        throw new BoxTreeCorruptionException(nodeKey, "table root without table context");
      }
      LOGGER.error("Table root {} carries no table context.", nodeKey);
      return Optional.empty();
    }
    return Optional.of(tableContext);
  }

  @Override
  public long getLayoutParentKey(final long nodeKey) {
    return arena.get(nodeKey).getLayoutParentKey();
  }

  @Override
  public boolean isInlineRoot(final long nodeKey) {
    return arena.get(nodeKey).hasFlag(NodeFlag.IS_INLINE_ROOT);
  }

  @Override
  public boolean isTableRoot(final long nodeKey) {
    return arena.get(nodeKey).hasFlag(NodeFlag.IS_TABLE_ROOT);
  }

  @Override
  public @Nullable ComputedStyle getStyle(final long nodeKey) {
    return arena.get(nodeKey).getPrimaryStyle();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("configuration", configuration).add("arena", arena).toString();
  }
}
