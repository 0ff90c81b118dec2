// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.core.exc.StreamConstraintsException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

import static com.github.corridor_chain.CanonicalizationException.Reason.*;

/// Turns structured values into [CanonicalBytes]. The rules are applied recursively:
///
/// 1. Floating point numbers are rejected. Integers of any size pass, as do decimals without a fractional part.
/// 2. Object keys are sorted by their UTF-8 bytes, never by any numeric reading of the key.
/// 3. Arrays keep their order.
/// 4. Strings pass unchanged unless they are date-times, which become UTC, whole seconds, with a `Z` suffix.
///    `java.time` values are rendered the same way.
/// 5. No whitespace is emitted. String escaping follows RFC 8785.
///
/// Input can be anything Jackson can map to a tree: maps, lists, arrays, records, beans and [JsonNode]s.
/// The class holds no mutable state and is safe to call from any thread.
public final class Canonicalizer {

  public static final int MAX_DEPTH = 128;

  /// Jackson stops just past our own limit so that cyclic input fails fast instead of recursing unbounded.
  static final ObjectMapper MAPPER = new ObjectMapper(JsonFactory.builder()
      .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(MAX_DEPTH + 2).build())
      .build())
      .registerModule(new SimpleModule("canonical-time")
          .addSerializer(Instant.class, Canonicalizer.<Instant>timeSerializer(Timestamps::format))
          .addSerializer(OffsetDateTime.class, Canonicalizer.<OffsetDateTime>timeSerializer(Timestamps::format))
          .addSerializer(ZonedDateTime.class, Canonicalizer.<ZonedDateTime>timeSerializer(Timestamps::format))
          .addSerializer(LocalDateTime.class, Canonicalizer.<LocalDateTime>timeSerializer(Timestamps::format)));

  private static final Comparator<String> UTF8_ORDER = (a, b) -> Arrays.compareUnsigned(
      a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));

  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private Canonicalizer() {
  }

  /// @param value any value Jackson can map to a JSON tree, including `null`
  /// @return the canonical bytes of the value
  /// @throws CanonicalizationException if the value holds a float or a cycle, or nests too deep
  public static CanonicalBytes canonicalize(Object value) {
    final JsonNode tree;
    if (value instanceof JsonNode node) {
      tree = node;
    } else {
      try {
        tree = MAPPER.valueToTree(value);
      } catch (IllegalArgumentException e) {
        if (hasCause(e, StreamConstraintsException.class)) {
          throw new CanonicalizationException(DEPTH_EXCEEDED,
              value.getClass().getName() + " nests deeper than " + MAX_DEPTH + " or is cyclic", e);
        }
        throw new CanonicalizationException(SERIALIZATION_FAILED,
            "cannot map " + value.getClass().getName() + " to a JSON tree: " + e.getMessage(), e);
      } catch (StackOverflowError e) {
        throw new CanonicalizationException(SERIALIZATION_FAILED,
            "cannot map " + value.getClass().getName() + " to a JSON tree: the object graph is cyclic", e);
      }
    }
    final var out = new StringBuilder();
    write(tree, out, 0);
    return new CanonicalBytes(out.toString().getBytes(StandardCharsets.UTF_8));
  }

  /// Canonicalizes JSON text. Floating point literals such as `1.5` or `1.0` are rejected.
  public static CanonicalBytes canonicalizeJson(String json) {
    final JsonNode tree;
    try {
      tree = MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new CanonicalizationException(SERIALIZATION_FAILED, "invalid JSON text: " + e.getOriginalMessage(), e);
    }
    return canonicalize(tree);
  }

  private static boolean hasCause(Throwable thrown, Class<? extends Throwable> type) {
    for (Throwable t = thrown; t != null; t = t.getCause()) {
      if (type.isInstance(t)) {
        return true;
      }
    }
    return false;
  }

  private static void write(JsonNode node, StringBuilder out, int depth) {
    if (depth > MAX_DEPTH) {
      throw new CanonicalizationException(DEPTH_EXCEEDED, "nesting deeper than " + MAX_DEPTH);
    }
    if (node == null || node.isNull() || node.isMissingNode()) {
      out.append("null");
    } else if (node.isBoolean()) {
      out.append(node.booleanValue());
    } else if (node.isIntegralNumber()) {
      out.append(node.bigIntegerValue());
    } else if (node.isBigDecimal()) {
      out.append(integralDecimal(node.decimalValue()));
    } else if (node.isNumber()) {
      throw new CanonicalizationException(FLOAT_REJECTED,
          "floating point value rejected: " + node.asText() + "; use an integer or a string");
    } else if (node.isTextual()) {
      writeString(Timestamps.normalize(node.textValue()), out);
    } else if (node.isBinary()) {
      writeString(node.asText(), out);
    } else if (node.isArray()) {
      out.append('[');
      for (int i = 0; i < node.size(); i++) {
        if (i > 0) {
          out.append(',');
        }
        write(node.get(i), out, depth + 1);
      }
      out.append(']');
    } else if (node.isObject()) {
      final List<String> keys = new ArrayList<>(node.size());
      node.fieldNames().forEachRemaining(keys::add);
      keys.sort(UTF8_ORDER);
      out.append('{');
      boolean first = true;
      for (String key : keys) {
        if (!first) {
          out.append(',');
        }
        first = false;
        writeString(key, out);
        out.append(':');
        write(node.get(key), out, depth + 1);
      }
      out.append('}');
    } else {
      throw new CanonicalizationException(SERIALIZATION_FAILED, "unsupported JSON node type " + node.getNodeType());
    }
  }

  private static String integralDecimal(BigDecimal decimal) {
    final var stripped = decimal.stripTrailingZeros();
    if (stripped.scale() > 0) {
      throw new CanonicalizationException(FLOAT_REJECTED,
          "decimal with a fractional part rejected: " + decimal.toPlainString() + "; use a string");
    }
    return stripped.toBigIntegerExact().toString();
  }

  static void writeString(String s, StringBuilder out) {
    out.append('"');
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '"' -> out.append("\\\"");
        case '\\' -> out.append("\\\\");
        case '\b' -> out.append("\\b");
        case '\f' -> out.append("\\f");
        case '\n' -> out.append("\\n");
        case '\r' -> out.append("\\r");
        case '\t' -> out.append("\\t");
        default -> {
          if (c < 0x20) {
            out.append("\\u00").append(HEX[c >> 4]).append(HEX[c & 0xF]);
          } else if (Character.isHighSurrogate(c) && i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))) {
            out.append(c).append(s.charAt(++i));
          } else if (Character.isSurrogate(c)) {
            throw new CanonicalizationException(SERIALIZATION_FAILED, "unpaired surrogate at index " + i);
          } else {
            out.append(c);
          }
        }
      }
    }
    out.append('"');
  }

  private static <T> JsonSerializer<T> timeSerializer(Function<T, String> formatter) {
    return new JsonSerializer<>() {
      @Override
      public void serialize(T value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeString(formatter.apply(value));
      }
    };
  }
}
