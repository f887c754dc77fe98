/**
 *    Copyright 2024-2026 the original author or authors.
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */
package org.mydbd.parsing;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class GenericTokenParserTest {

  private static GenericTokenParser parser(Map<String, String> variables) {
    return new GenericTokenParser("${", "}", content -> variables.getOrDefault(content, "?" + content));
  }

  @Test
  void shouldReplaceTokens() {
    Map<String, String> variables = new HashMap<>();
    variables.put("host", "localhost");
    variables.put("port", "3306");
    GenericTokenParser parser = parser(variables);

    Assertions.assertEquals("localhost:3306", parser.parse("${host}:${port}"));
    Assertions.assertEquals("jdbc:mysql://localhost/shop", parser.parse("jdbc:mysql://${host}/shop"));
    Assertions.assertEquals("?user", parser.parse("${user}"));
    Assertions.assertEquals("no tokens", parser.parse("no tokens"));
    Assertions.assertEquals("", parser.parse(null));
  }

  @Test
  void shouldKeepEscapedAndUnclosedTokens() {
    Map<String, String> variables = new HashMap<>();
    variables.put("host", "localhost");
    variables.put("a}b", "brace");
    GenericTokenParser parser = parser(variables);

    Assertions.assertEquals("${host} is localhost", parser.parse("\\${host} is ${host}"));
    Assertions.assertEquals("brace", parser.parse("${a\\}b}"));
    Assertions.assertEquals("localhost ${port", parser.parse("${host} ${port"));
  }

}
