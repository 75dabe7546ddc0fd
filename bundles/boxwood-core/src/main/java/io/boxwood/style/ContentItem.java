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

package io.boxwood.style;

import static java.util.Objects.requireNonNull;

/**
 * One item of a resolved {@code content} list of a pseudo-element.
 *
 * @param kind the kind of the item
 * @param value literal text for {@link Kind#STRING}, attribute name for {@link Kind#ATTR}, the
 *        counter or image reference otherwise
 */
public record ContentItem(Kind kind, String value) {

  /** The kind of a content item. */
  public enum Kind {
    STRING,
    ATTR,
    COUNTER,
    QUOTE,
    IMAGE
  }

  public ContentItem {
    requireNonNull(kind);
    requireNonNull(value);
  }

  public static ContentItem string(final String text) {
    return new ContentItem(Kind.STRING, text);
  }

  public static ContentItem attr(final String attributeName) {
    return new ContentItem(Kind.ATTR, attributeName);
  }

  public static ContentItem counter(final String counterName) {
    return new ContentItem(Kind.COUNTER, counterName);
  }
}
