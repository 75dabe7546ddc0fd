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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Payload of a replaced element (image, form control, ...): intrinsic size hints taken from the
 * {@code width} and {@code height} attributes.
 *
 * @param width intrinsic width hint in CSS pixels, or a negative value if unknown
 * @param height intrinsic height hint in CSS pixels, or a negative value if unknown
 */
public record ReplacedElementData(int width, int height) implements SpecialData {

  /**
   * Create the payload from an attribute map. Absent or unparseable values are unknown.
   *
   * @param attributes the element attributes
   * @return the payload
   */
  public static ReplacedElementData fromAttributes(final Map<String, String> attributes) {
    return new ReplacedElementData(parseDimension(attributes.get("width")), parseDimension(attributes.get("height")));
  }

  public OptionalInt intrinsicWidth() {
    return width < 0 ? OptionalInt.empty() : OptionalInt.of(width);
  }

  public OptionalInt intrinsicHeight() {
    return height < 0 ? OptionalInt.empty() : OptionalInt.of(height);
  }

  private static int parseDimension(final @Nullable String value) {
    if (value == null) {
      return -1;
    }
    String trimmed = value.trim();
    if (trimmed.endsWith("px")) {
      trimmed = trimmed.substring(0, trimmed.length() - 2).trim();
    }
    try {
      final int parsed = Integer.parseInt(trimmed);
      return parsed < 0 ? -1 : parsed;
    } catch (final NumberFormatException e) {
      return -1;
    }
  }
}
