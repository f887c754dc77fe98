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

import java.util.Properties;

/**
 * Resolves {@code ${name}} and {@code ${name:default}} placeholders against a set of variables, then
 * against the system properties. Unresolved placeholders without a default are left untouched.
 */
public class PropertyParser {

  private static final String DEFAULT_VALUE_SEPARATOR = ":";

  private PropertyParser() {
    // Prevent Instantiation
  }

  public static String parse(String string, Properties variables) {
    GenericTokenParser parser = new GenericTokenParser("${", "}", new VariableTokenHandler(variables));
    return parser.parse(string);
  }

  private static class VariableTokenHandler implements TokenHandler {

    private final Properties variables;

    private VariableTokenHandler(Properties variables) {
      this.variables = variables;
    }

    @Override
    public String handleToken(String content) {
      String key = content;
      String defaultValue = null;
      int separatorIndex = content.indexOf(DEFAULT_VALUE_SEPARATOR);
      if (separatorIndex >= 0) {
        key = content.substring(0, separatorIndex);
        defaultValue = content.substring(separatorIndex + DEFAULT_VALUE_SEPARATOR.length());
      }
      if (variables != null && variables.containsKey(key)) {
        return variables.getProperty(key);
      }
      String systemValue = System.getProperty(key);
      if (systemValue != null) {
        return systemValue;
      }
      return defaultValue != null ? defaultValue : "${" + content + "}";
    }
  }

}
