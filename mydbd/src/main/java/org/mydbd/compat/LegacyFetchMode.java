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
package org.mydbd.compat;

import org.mydbd.cursor.FetchMode;

/**
 * Fetch modes of the PEAR::DB API.
 */
public enum LegacyFetchMode {

  /**
   * Resolves to the connection wide mode set with {@link PearCompatConnection#setFetchMode(LegacyFetchMode)},
   * or {@link #ORDERED} when none was set. On a cursor it means the cursor's own mode.
   */
  DEFAULT(null),
  ORDERED(FetchMode.ORDERED),
  ASSOC(FetchMode.ASSOC),
  OBJECT(FetchMode.OBJECT);

  private final FetchMode fetchMode;

  LegacyFetchMode(FetchMode fetchMode) {
    this.fetchMode = fetchMode;
  }

  /**
   * @return the matching cursor mode, null for {@link #DEFAULT}
   */
  public FetchMode toFetchMode() {
    return fetchMode;
  }

}
