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

/**
 * Aggregates computed over every logged command.
 */
public final class QueryStats {

  private final double totalTime;
  private final int totalQueries;
  private final double maxTime;

  public QueryStats(double totalTime, int totalQueries, double maxTime) {
    this.totalTime = totalTime;
    this.totalQueries = totalQueries;
    this.maxTime = maxTime;
  }

  /**
   * @return milliseconds spent by all commands
   */
  public double getTotalTime() {
    return totalTime;
  }

  /**
   * @return number of commands other than {@link QueryCommand#PREPARE}
   */
  public int getTotalQueries() {
    return totalQueries;
  }

  /**
   * @return duration of the slowest command, in milliseconds
   */
  public double getMaxTime() {
    return maxTime;
  }

  @Override
  public String toString() {
    return "QueryStats{totalTime=" + totalTime + ", totalQueries=" + totalQueries + ", maxTime=" + maxTime + "}";
  }

}
