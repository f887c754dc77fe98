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

import java.security.CodeSource;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.mydbd.logging.Log;
import org.mydbd.logging.LogFactory;

/**
 * Process wide log of the commands sent to the database, enabled per connection by the
 * {@code queryLog} option.
 *
 * <p>Entries are only appended; {@link #clear()} empties the log.
 */
public final class QueryLogger {

  private static final Log log = LogFactory.getLog(QueryLogger.class);

  private static final Pattern MARKER = Pattern.compile("\\?");

  private static final String LIBRARY_PACKAGE = "org.mydbd.";

  private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

  private static final List<QueryLogEntry> logs = new ArrayList<>();

  private QueryLogger() {
    // Prevent Instantiation of Static Class
  }

  /**
   * Records a command.
   *
   * @param command the command sent to the driver
   * @param query the SQL text
   * @param params values of the query markers, may be null. They replace the markers in the recorded
   *        text only.
   * @param duration time taken by the command, in milliseconds
   */
  public static void log(QueryCommand command, String query, List<?> params, double duration) {
    String resolved = params == null ? query : resolveMarkers(query, params);
    List<String> callPath = callPath();
    if (log.isDebugEnabled()) {
      log.debug(command + " " + resolved);
    }
    QueryLogEntry entry = new QueryLogEntry(command, resolved, duration, callPath);
    synchronized (logs) {
      logs.add(entry);
    }
  }

  static String resolveMarkers(String query, List<?> params) {
    Matcher matcher = MARKER.matcher(query);
    StringBuffer resolved = new StringBuffer();
    int index = 0;
    while (matcher.find()) {
      if (index >= params.size()) {
        break;
      }
      matcher.appendReplacement(resolved, Matcher.quoteReplacement(String.valueOf(params.get(index++))));
    }
    matcher.appendTail(resolved);
    return resolved.toString();
  }

  private static List<String> callPath() {
    List<String> frames = WALKER.walk(stream -> stream
        .filter(frame -> !isInternal(frame.getDeclaringClass()))
        .map(frame -> frame.getClassName() + ":" + frame.getLineNumber())
        .collect(Collectors.toList()));
    // 调用链按由外到内排列
    Collections.reverse(frames);
    return frames;
  }

  private static boolean isInternal(Class<?> frameClass) {
    String name = frameClass.getName();
    if (name.startsWith("java.") || name.startsWith("jdk.") || name.startsWith("sun.")) {
      return true;
    }
    return name.startsWith(LIBRARY_PACKAGE) && sameCodeSource(frameClass, QueryLogger.class);
  }

  private static boolean sameCodeSource(Class<?> a, Class<?> b) {
    CodeSource first = a.getProtectionDomain().getCodeSource();
    CodeSource second = b.getProtectionDomain().getCodeSource();
    if (first == null || second == null) {
      return first == second;
    }
    return Objects.equals(first.getLocation(), second.getLocation());
  }

  /**
   * @return milliseconds elapsed since {@code startNanos}, a {@link System#nanoTime()} reading
   */
  public static double millisSince(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000.0;
  }

  public static List<QueryLogEntry> getLogs() {
    return getLogs(false);
  }

  /**
   * @param sortByDuration true to get the slowest commands first; commands of equal duration keep their
   *        logging order
   */
  public static List<QueryLogEntry> getLogs(boolean sortByDuration) {
    List<QueryLogEntry> copy;
    synchronized (logs) {
      copy = new ArrayList<>(logs);
    }
    if (sortByDuration) {
      copy.sort(Comparator.comparingDouble(QueryLogEntry::getDuration).reversed());
    }
    return copy;
  }

  public static QueryStats getGlobalStats() {
    double totalTime = 0;
    int totalQueries = 0;
    double maxTime = 0;
    for (QueryLogEntry entry : getLogs()) {
      if (entry.getCommand() != QueryCommand.PREPARE) {
        totalQueries++;
      }
      totalTime += entry.getDuration();
      maxTime = Math.max(maxTime, entry.getDuration());
    }
    return new QueryStats(totalTime, totalQueries, maxTime);
  }

  public static void clear() {
    synchronized (logs) {
      logs.clear();
    }
  }

}
