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
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Data specific to element and anonymous block nodes.
 */
public final class ElementData {

  /** Lower-case tag name. */
  private final String tagName;

  /** Attributes in insertion order. */
  private final Map<String, String> attributes;

  /** Variant payload, {@code null} if none. */
  private @Nullable SpecialData specialData;

  /**
   * Constructor.
   *
   * @param tagName the tag name, lower-cased
   * @param attributes the initial attributes
   */
  public ElementData(final String tagName, final Map<String, String> attributes) {
    this.tagName = requireNonNull(tagName).toLowerCase(Locale.ROOT);
    this.attributes = new LinkedHashMap<>(attributes);
  }

  public String getTagName() {
    return tagName;
  }

  public boolean hasTagName(final String name) {
    return tagName.equals(name);
  }

  public @Nullable String getAttribute(final String name) {
    return attributes.get(name);
  }

  public Map<String, String> getAttributes() {
    return Collections.unmodifiableMap(attributes);
  }

  public void setAttribute(final String name, final String value) {
    attributes.put(requireNonNull(name), requireNonNull(value));
  }

  public @Nullable SpecialData getSpecialData() {
    return specialData;
  }

  public void setSpecialData(final @Nullable SpecialData specialData) {
    this.specialData = specialData;
  }

  /**
   * Get the payload if it is of the given type.
   *
   * @param type the payload type
   * @param <T> the payload type
   * @return the payload or {@code null}
   */
  public <T extends SpecialData> @Nullable T getSpecialData(final Class<T> type) {
    return type.isInstance(specialData) ? type.cast(specialData) : null;
  }

  /**
   * Remove the payload if it is of the given type.
   *
   * @param type the payload type
   * @param <T> the payload type
   * @return the removed payload or {@code null}
   */
  public <T extends SpecialData> @Nullable T takeSpecialData(final Class<T> type) {
    final T data = getSpecialData(type);
    if (data != null) {
      specialData = null;
    }
    return data;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("tagName", tagName)
                      .add("attributes", attributes)
                      .add("specialData", specialData)
                      .toString();
  }
}
