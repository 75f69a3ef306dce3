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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

public class SystemVariablesTest {

  private final Clock clock =
      Clock.fixed(Instant.parse("2024-03-15T18:30:00Z"), ZoneId.of("America/New_York"));

  @Test
  public void dates() {
    Map<String, Object> variables = new SystemVariables(clock).toMap();
    assertEquals(LocalDate.of(2024, 3, 15), variables.get(SystemVariables.TODAY));
    assertEquals(
        ZonedDateTime.of(2024, 3, 15, 14, 30, 0, 0, ZoneId.of("America/New_York")),
        variables.get(SystemVariables.NOW));
  }

  @Test
  public void userAndOrganization() {
    Map<String, Object> user = new HashMap<String, Object>();
    user.put("Name", "Pat");
    Map<String, Object> org = new HashMap<String, Object>();
    org.put("Phone", null);

    MergeContext context = new MergeContext.Builder()
        .addSystemVariables(new SystemVariables(clock)
            .setCurrentUser(user)
            .setOrganization(org)
            .toMap())
        .build();
    assertEquals("Pat", context.resolve("CurrentUser.Name").asString());
    assertTrue(context.resolve("ORG.Phone").isNull());
    assertEquals(LocalDate.of(2024, 3, 15),
        context.resolve("Today").asInstance(LocalDate.class));
  }
}
