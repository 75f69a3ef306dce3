// Copyright 2012 Benjamin Kalman
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.lman.docmerge.context;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Context entries that don't come from the primary record: {{Today}}, {{Now}},
 * {{CurrentUser.*}} and {{ORG.*}}.
 */
public class SystemVariables {

  public static final String TODAY = "Today";
  public static final String NOW = "Now";
  public static final String CURRENT_USER = "CurrentUser";
  public static final String ORGANIZATION = "ORG";

  private final Clock clock;
  private Map<String, ?> currentUser = Collections.emptyMap();
  private Map<String, ?> organization = Collections.emptyMap();

  public SystemVariables(Clock clock) {
    this.clock = clock;
  }

  public SystemVariables setCurrentUser(Map<String, ?> currentUser) {
    this.currentUser = currentUser;
    return this;
  }

  public SystemVariables setOrganization(Map<String, ?> organization) {
    this.organization = organization;
    return this;
  }

  /** Snapshot of the variables at the clock's current instant. */
  public Map<String, Object> toMap() {
    ZonedDateTime now = ZonedDateTime.now(clock);
    Map<String, Object> variables = new LinkedHashMap<String, Object>();
    variables.put(TODAY, LocalDate.from(now));
    variables.put(NOW, now);
    variables.put(CURRENT_USER, new LinkedHashMap<String, Object>(currentUser));
    variables.put(ORGANIZATION, new LinkedHashMap<String, Object>(organization));
    return variables;
  }
}
