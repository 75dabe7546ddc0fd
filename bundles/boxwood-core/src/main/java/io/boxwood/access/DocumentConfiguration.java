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
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableSet;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.boxwood.exception.BoxwoodIOException;
import org.checkerframework.checker.index.qual.Positive;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Holds the settings of box construction for one document.
 */
public final class DocumentConfiguration {

  /** {@link Logger} instance. */
  private static final Logger LOGGER = LoggerFactory.getLogger(DocumentConfiguration.class);

  /** Standard scale factor handed to the text shaper. */
  private static final float VIEWPORT_SCALE = 1.0f;

  /** Standard bound of recursive walks. */
  private static final int MAX_TREE_DEPTH = 1024;

  /** Standard replaced elements, embedded as atomic boxes into paragraphs. */
  private static final ImmutableSet<String> REPLACED_ELEMENTS =
      ImmutableSet.of("img", "svg", "input", "textarea", "button");

  /** Standard upper bound of {@code colspan}. */
  private static final int MAX_COLSPAN = 1000;

  /**
   * JSON names.
   */
  private static final String[] JSONNAMES =
      { "viewportScale", "maxTreeDepth", "replacedElements", "maxColspan", "assertInvariants" };

  /** Scale factor handed to the text shaper. */
  public final float viewportScale;

  /** Bound of recursive walks. */
  public final int maxTreeDepth;

  /** Lower-case tag names of replaced elements. */
  public final ImmutableSet<String> replacedElements;

  /** Upper bound of {@code colspan}. */
  public final int maxColspan;

  /** Determines if violated invariants throw. */
  public final boolean assertInvariants;

  private DocumentConfiguration(final Builder builder) {
    viewportScale = builder.viewportScale;
    maxTreeDepth = builder.maxTreeDepth;
    replacedElements = builder.replacedElements;
    maxColspan = builder.maxColspan;
    assertInvariants = builder.assertInvariants;
  }

  /**
   * Get a new builder instance.
   *
   * @return {@link Builder} instance
   */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Get the standard configuration.
   *
   * @return the configuration with all defaults
   */
  public static DocumentConfiguration defaults() {
    return new Builder().build();
  }

  public float getViewportScale() {
    return viewportScale;
  }

  public int getMaxTreeDepth() {
    return maxTreeDepth;
  }

  public Set<String> getReplacedElements() {
    return replacedElements;
  }

  public boolean isReplacedElement(final @Nullable String tagName) {
    return tagName != null && replacedElements.contains(tagName);
  }

  public int getMaxColspan() {
    return maxColspan;
  }

  public boolean isAssertInvariants() {
    return assertInvariants;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(viewportScale, maxTreeDepth, replacedElements, maxColspan, assertInvariants);
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (!(obj instanceof DocumentConfiguration other)) {
      return false;
    }
    return viewportScale == other.viewportScale && maxTreeDepth == other.maxTreeDepth
        && Objects.equal(replacedElements, other.replacedElements) && maxColspan == other.maxColspan
        && assertInvariants == other.assertInvariants;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("viewportScale", viewportScale)
                      .add("maxTreeDepth", maxTreeDepth)
                      .add("replacedElements", replacedElements)
                      .add("maxColspan", maxColspan)
                      .add("assertInvariants", assertInvariants)
                      .toString();
  }

  /**
   * Serialize the configuration as JSON.
   *
   * @param config configuration to serialize
   * @param writer the writer, not closed
   * @throws BoxwoodIOException if an I/O error occurs
   */
  public static void serialize(final DocumentConfiguration config, final Writer writer) {
    try {
      final JsonWriter jsonWriter = new JsonWriter(writer);
      jsonWriter.setIndent("  ");
      jsonWriter.beginObject();
      jsonWriter.name(JSONNAMES[0]).value(config.viewportScale);
      jsonWriter.name(JSONNAMES[1]).value(config.maxTreeDepth);
      jsonWriter.name(JSONNAMES[2]);
      jsonWriter.beginArray();
      for (final String tagName : config.replacedElements) {
        jsonWriter.value(tagName);
      }
      jsonWriter.endArray();
      jsonWriter.name(JSONNAMES[3]).value(config.maxColspan);
      jsonWriter.name(JSONNAMES[4]).value(config.assertInvariants);
      jsonWriter.endObject();
      jsonWriter.flush();
    } catch (final IOException e) {
      throw new BoxwoodIOException(e);
    }
  }

  /**
   * Serialize the configuration to a JSON file.
   *
   * @param config configuration to serialize
   * @param file the file to write
   * @throws BoxwoodIOException if an I/O error occurs
   */
  public static void serialize(final DocumentConfiguration config, final Path file) {
    try (final Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      serialize(config, writer);
    } catch (final IOException e) {
      throw new BoxwoodIOException("Failed to write configuration " + file, e);
    }
  }

  /**
   * Deserialize a configuration from JSON. Absent names keep their defaults, unknown names are
   * skipped.
   *
   * @param reader the reader, not closed
   * @return the configuration
   * @throws BoxwoodIOException if an I/O error occurs or the input is malformed
   */
  public static DocumentConfiguration deserialize(final Reader reader) {
    final Builder builder = newBuilder();
    try {
      final JsonReader jsonReader = new JsonReader(reader);
      jsonReader.beginObject();
      while (jsonReader.hasNext()) {
        final String name = jsonReader.nextName();
        switch (name) {
          case "viewportScale" -> builder.viewportScale((float) jsonReader.nextDouble());
          case "maxTreeDepth" -> builder.maxTreeDepth(jsonReader.nextInt());
          case "replacedElements" -> {
            final ImmutableSet.Builder<String> tagNames = ImmutableSet.builder();
            jsonReader.beginArray();
            while (jsonReader.hasNext()) {
              tagNames.add(jsonReader.nextString());
            }
            jsonReader.endArray();
            builder.replacedElements(tagNames.build());
          }
          case "maxColspan" -> builder.maxColspan(jsonReader.nextInt());
          case "assertInvariants" -> builder.assertInvariants(jsonReader.nextBoolean());
          default -> {
            LOGGER.debug("Skipping unknown configuration name {}.", name);
            jsonReader.skipValue();
          }
        }
      }
      jsonReader.endObject();
    } catch (final IOException e) {
      throw new BoxwoodIOException(e);
    } catch (final IllegalStateException | NumberFormatException e) {
      throw new BoxwoodIOException("Malformed configuration", new IOException(e));
    }
    return builder.build();
  }

  /**
   * Deserialize a configuration from a JSON file.
   *
   * @param file the file to read
   * @return the configuration
   * @throws BoxwoodIOException if an I/O error occurs
   */
  public static DocumentConfiguration deserialize(final Path file) {
    try (final Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return deserialize(reader);
    } catch (final IOException e) {
      throw new BoxwoodIOException("Failed to read configuration " + file, e);
    }
  }

  /**
   * Builder class for generating new {@link DocumentConfiguration} instances.
   */
  public static final class Builder {

    private float viewportScale = VIEWPORT_SCALE;

    private int maxTreeDepth = MAX_TREE_DEPTH;

    private ImmutableSet<String> replacedElements = REPLACED_ELEMENTS;

    private int maxColspan = MAX_COLSPAN;

    private boolean assertInvariants = true;

    private Builder() {
    }

    /**
     * Set the scale factor handed to the text shaper.
     *
     * @param viewportScale the scale, must be positive
     * @return reference to the builder object
     */
    public Builder viewportScale(final float viewportScale) {
      checkArgument(viewportScale > 0f, "viewportScale must be > 0!");
      this.viewportScale = viewportScale;
      return this;
    }

    /**
     * Set the bound of recursive walks.
     *
     * @param maxTreeDepth the bound
     * @return reference to the builder object
     */
    public Builder maxTreeDepth(final @Positive int maxTreeDepth) {
      checkArgument(maxTreeDepth > 0, "maxTreeDepth must be > 0!");
      this.maxTreeDepth = maxTreeDepth;
      return this;
    }

    /**
     * Set the tag names of replaced elements. Names are lower-cased.
     *
     * @param tagNames the tag names
     * @return reference to the builder object
     */
    public Builder replacedElements(final Set<String> tagNames) {
      requireNonNull(tagNames);
      final ImmutableSet.Builder<String> lowerCased = ImmutableSet.builder();
      tagNames.forEach(tagName -> lowerCased.add(tagName.toLowerCase(Locale.ROOT)));
      replacedElements = lowerCased.build();
      return this;
    }

    public Builder maxColspan(final @Positive int maxColspan) {
      checkArgument(maxColspan > 0, "maxColspan must be > 0!");
      this.maxColspan = maxColspan;
      return this;
    }

    public Builder assertInvariants(final boolean assertInvariants) {
      this.assertInvariants = assertInvariants;
      return this;
    }

    /**
     * Get a new instance of {@link DocumentConfiguration}.
     *
     * @return a new {@link DocumentConfiguration} instance
     */
    public DocumentConfiguration build() {
      return new DocumentConfiguration(this);
    }
  }
}
