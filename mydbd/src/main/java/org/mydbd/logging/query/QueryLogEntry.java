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
package org.mydbd.logging.query;

import java.util.Collections;
import java.util.List;

/**
 * One logged command. Immutable.
 */
public final class QueryLogEntry {

  private final QueryCommand command;
  private final String query;
  private final double duration;
  private final List<String> callPath;

  public QueryLogEntry(QueryCommand command, String query, double duration, List<String> callPath) {
    this.command = command;
    this.query = query;
    this.duration = duration;
    this.callPath = Collections.unmodifiableList(callPath);
  }

  public QueryCommand getCommand() {
    return command;
  }

  /**
   * @return the query with its markers replaced by the parameter values, for display only
   */
  public String getQuery() {
    return query;
  }

  /**
   * @return the time taken by the command, in milliseconds
   */
  public double getDuration() {
    return duration;
  }

  /**
   * @return the "class:line" frames of the caller, outermost first
   */
  public List<String> getCallPath() {
    return callPath;
  }

  @Override
  public String toString() {
    return command + " " + query + " (" + duration + " ms)";
  }

}
