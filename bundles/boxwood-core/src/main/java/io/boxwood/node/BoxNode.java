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

package io.boxwood.node;

import com.google.common.base.MoreObjects;
import io.boxwood.settings.Fixed;
import io.boxwood.style.ComputedStyle;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.EnumSet;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * A node of the document arena: a DOM node, a pseudo-element or a synthesized anonymous box.
 *
 * <p>
 * The DOM relation ({@code parent}/{@code children}) is kept apart from the box-tree relation
 * ({@code layoutParent}/{@code layoutChildren}). Nodes reference each other by key only.
 * </p>
 */
public final class BoxNode {

  /** Key of the node in its arena. */
  private final long nodeKey;

  /** Kind of the node. */
  private final NodeKind kind;

  /** Key of the DOM parent. */
  private long parentKey = Fixed.NULL_NODE_KEY.getStandardProperty();

  /** DOM children in order. */
  private final LongArrayList children = new LongArrayList();

  /** Element data for elements and anonymous blocks. */
  private final @Nullable ElementData elementData;

  /** Character data for text and comment nodes. */
  private @Nullable String value;

  /** Style slot. */
  private @Nullable NodeStyleData styleData;

  /** Key of the {@code ::before} pseudo-element. */
  private long beforeKey = Fixed.NULL_NODE_KEY.getStandardProperty();

  /** Key of the {@code ::after} pseudo-element. */
  private long afterKey = Fixed.NULL_NODE_KEY.getStandardProperty();

  /** Construction damage. */
  private Damage damage = Damage.NONE;

  /** Structural flags. */
  private final EnumSet<NodeFlag> flags = EnumSet.noneOf(NodeFlag.class);

  /** Cached layout children, {@code null} if never computed or reset. */
  private @Nullable LongArrayList layoutChildren;

  /** Key of the layout parent, stamped by every traversal. */
  private long layoutParentKey = Fixed.NULL_NODE_KEY.getStandardProperty();

  /** Key of the node which synthesized this anonymous box, or the null key. */
  private long anonymousOwnerKey = Fixed.NULL_NODE_KEY.getStandardProperty();

  /**
   * Constructor.
   *
   * @param nodeKey the key of the node
   * @param kind the kind of the node
   * @param elementData element data, required iff the kind has element data
   * @param value character data, required iff the kind has a value
   */
  public BoxNode(final long nodeKey, final NodeKind kind, final @Nullable ElementData elementData,
      final @Nullable String value) {
    checkArgument(nodeKey >= 0, "nodeKey must be >= 0!");
    this.nodeKey = nodeKey;
    this.kind = requireNonNull(kind);
    checkArgument(kind.hasElementData() == (elementData != null), "element data does not match kind %s", kind);
    checkArgument(kind.hasValue() == (value != null), "value does not match kind %s", kind);
    this.elementData = elementData;
    this.value = value;
  }

  public long getNodeKey() {
    return nodeKey;
  }

  public NodeKind getKind() {
    return kind;
  }

  public boolean isElement() {
    return kind == NodeKind.ELEMENT;
  }

  public boolean isAnonymousBlock() {
    return kind == NodeKind.ANONYMOUS_BLOCK;
  }

  public boolean isText() {
    return kind == NodeKind.TEXT;
  }

  public boolean isComment() {
    return kind == NodeKind.COMMENT;
  }

  public long getParentKey() {
    return parentKey;
  }

  public boolean hasParent() {
    return parentKey != Fixed.NULL_NODE_KEY.getStandardProperty();
  }

  public void setParentKey(final long parentKey) {
    this.parentKey = parentKey;
  }

  /**
   * Get the mutable list of DOM children.
   *
   * @return DOM children
   */
  public LongArrayList getChildren() {
    return children;
  }

  public @Nullable ElementData getElementData() {
    return elementData;
  }

  /**
   * Get the element data of an element or anonymous block.
   *
   * @return the element data
   * @throws IllegalStateException if the node has no element data
   */
  public ElementData elementData() {
    checkState(elementData != null, "node %s has no element data", nodeKey);
    return elementData;
  }

  /**
   * Get the tag name, if any.
   *
   * @return the tag name or {@code null} for non-element nodes
   */
  public @Nullable String getTagName() {
    return elementData == null ? null : elementData.getTagName();
  }

  public @Nullable String getAttribute(final String name) {
    return elementData == null ? null : elementData.getAttribute(name);
  }

  public @Nullable String getValue() {
    return value;
  }

  public void setValue(final String value) {
    checkState(kind.hasValue(), "node %s has no character data", nodeKey);
    this.value = requireNonNull(value);
  }

  public @Nullable NodeStyleData getStyleData() {
    return styleData;
  }

  public void setStyleData(final @Nullable NodeStyleData styleData) {
    this.styleData = styleData;
  }

  /**
   * Get the primary computed style.
   *
   * @return the primary style or {@code null} if the node is not styled
   */
  public @Nullable ComputedStyle getPrimaryStyle() {
    return styleData == null ? null : styleData.primary();
  }

  public long getBeforeKey() {
    return beforeKey;
  }

  public long getAfterKey() {
    return afterKey;
  }

  public boolean hasBefore() {
    return beforeKey != Fixed.NULL_NODE_KEY.getStandardProperty();
  }

  public boolean hasAfter() {
    return afterKey != Fixed.NULL_NODE_KEY.getStandardProperty();
  }

  public void setBeforeKey(final long beforeKey) {
    this.beforeKey = beforeKey;
  }

  public void setAfterKey(final long afterKey) {
    this.afterKey = afterKey;
  }

  public Damage getDamage() {
    return damage;
  }

  public void setDamage(final Damage damage) {
    this.damage = requireNonNull(damage);
  }

  public void insertDamage(final Damage other) {
    damage = damage.union(other);
  }

  public void removeDamage(final Damage other) {
    damage = damage.remove(other);
  }

  public boolean hasDamage(final Damage other) {
    return damage.intersects(other);
  }

  public boolean hasFlag(final NodeFlag flag) {
    return flags.contains(flag);
  }

  public void setFlag(final NodeFlag flag, final boolean set) {
    if (set) {
      flags.add(flag);
    } else {
      flags.remove(flag);
    }
  }

  /**
   * Clear the flags which every box construction run recomputes.
   */
  public void resetConstructionFlags() {
    flags.removeIf(NodeFlag::isReconstructionFlag);
  }

  public Set<NodeFlag> getFlags() {
    return EnumSet.copyOf(flags);
  }

  /**
   * Get the cached layout children.
   *
   * @return an unmodifiable view of the layout children, or {@code null} if none are cached
   */
  public @Nullable LongList getLayoutChildren() {
    return layoutChildren == null ? null : LongLists.unmodifiable(layoutChildren);
  }

  public boolean hasLayoutChildren() {
    return layoutChildren != null;
  }

  /**
   * Replace the cached layout children wholesale.
   *
   * @param layoutChildren the new list, {@code null} to reset the cache
   */
  public void setLayoutChildren(final @Nullable LongList layoutChildren) {
    this.layoutChildren = layoutChildren == null ? null : new LongArrayList(layoutChildren);
  }

  public long getLayoutParentKey() {
    return layoutParentKey;
  }

  public void setLayoutParentKey(final long layoutParentKey) {
    this.layoutParentKey = layoutParentKey;
  }

  public long getAnonymousOwnerKey() {
    return anonymousOwnerKey;
  }

  public void setAnonymousOwnerKey(final long anonymousOwnerKey) {
    this.anonymousOwnerKey = anonymousOwnerKey;
  }

  /**
   * Determines if the node is an anonymous wrapper synthesized by box construction.
   *
   * @return {@code true} if the node has an owner
   */
  public boolean isAnonymousWrapper() {
    return anonymousOwnerKey != Fixed.NULL_NODE_KEY.getStandardProperty();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("nodeKey", nodeKey)
                      .add("kind", kind)
                      .add("parentKey", parentKey)
                      .add("children", children)
                      .add("tagName", getTagName())
                      .add("value", value)
                      .add("damage", damage)
                      .add("flags", flags)
                      .add("layoutChildren", layoutChildren)
                      .add("layoutParentKey", layoutParentKey)
                      .toString();
  }
}
