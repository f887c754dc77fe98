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

/**
 * Replaces every {@code open ... close} token of a text with the value given by a {@link TokenHandler}.
 * A backslash right before an open or close token escapes it. An open token without a matching close
 * token is kept as is.
 */
public class GenericTokenParser {

  private final String openToken;
  private final String closeToken;
  private final TokenHandler handler;

  public GenericTokenParser(String openToken, String closeToken, TokenHandler handler) {
    this.openToken = openToken;
    this.closeToken = closeToken;
    this.handler = handler;
  }

  public String parse(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    int start = text.indexOf(openToken);
    if (start == -1) {
      return text;
    }
    StringBuilder builder = new StringBuilder(text.length());
    int offset = 0;
    while (start > -1) {
      if (start > 0 && text.charAt(start - 1) == '\\') {
        // escaped open token, drop the backslash
        builder.append(text, offset, start - 1).append(openToken);
        offset = start + openToken.length();
      } else {
        builder.append(text, offset, start);
        int contentStart = start + openToken.length();
        StringBuilder expression = new StringBuilder();
        int end = findClose(text, contentStart, expression);
        if (end == -1) {
          builder.append(text, start, text.length());
          offset = text.length();
        } else {
          builder.append(handler.handleToken(expression.toString()));
          offset = end + closeToken.length();
        }
      }
      start = text.indexOf(openToken, offset);
    }
    if (offset < text.length()) {
      builder.append(text, offset, text.length());
    }
    return builder.toString();
  }

  /**
   * Collects the expression up to the first unescaped close token.
   *
   * @return index of the close token, -1 when there is none
   */
  private int findClose(String text, int from, StringBuilder expression) {
    int offset = from;
    int end = text.indexOf(closeToken, offset);
    while (end > -1 && end > offset && text.charAt(end - 1) == '\\') {
      expression.append(text, offset, end - 1).append(closeToken);
      offset = end + closeToken.length();
      end = text.indexOf(closeToken, offset);
    }
    if (end > -1) {
      expression.append(text, offset, end);
    }
    return end;
  }

}
