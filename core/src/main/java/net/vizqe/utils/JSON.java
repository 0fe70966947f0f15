// This file is part of VizQE.
// Copyright (C) 2026  The VizQE Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.vizqe.utils;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;

/**
 * This class simply provides a static initialization and configuration of 
 * the Jackson ObjectMapper for use throughout the engine. Query clauses
 * arrive as JSON fragments and are walked as trees.
 */
public final class JSON {

  /**
   * Jackson de/serializer initialized, configured and shared
   */
  private static final ObjectMapper jsonMapper = new ObjectMapper();
  static {
    // match values may be written as bare NaN or Infinity
    jsonMapper.enable(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS);
  }

  private JSON() { }

  /**
   * Parses a JSON formatted string into a tree.
   * @param json The string to parse
   * @return The root node of the tree
   * @throws IllegalArgumentException if the data was null or parsing failed
   */
  public static JsonNode parseToNode(final String json) {
    if (Strings.isNullOrEmpty(json)) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    try {
      final JsonNode node = jsonMapper.readTree(json);
      if (node == null || node.isMissingNode()) {
        throw new IllegalArgumentException("No JSON content in: " + json);
      }
      return node;
    } catch (IOException e) {
      throw new IllegalArgumentException(e);
    }
  }
}
