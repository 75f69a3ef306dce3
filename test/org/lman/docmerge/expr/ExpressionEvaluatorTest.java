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

package org.lman.docmerge.expr;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;
import org.lman.docmerge.context.MergeContext;
import org.lman.docmerge.expr.ExpressionEvaluator.ErrorPolicy;

public class ExpressionEvaluatorTest {

  private MergeContext context;
  private List<String> warnings;
  private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

  @Before
  public void setUp() {
    Map<String, Object> account = new LinkedHashMap<String, Object>();
    account.put("Name", "Acme Corp");
    account.put("Type", "Customer");

    Map<String, Object> data = new LinkedHashMap<String, Object>();
    data.put("GrandTotal", 93150.00);
    data.put("DiscountPercent", 5.0);
    data.put("Quantity", "12");
    data.put("Zero", 0);
    data.put("Empty", "");
    data.put("Blank", "   ");
    data.put("Nothing", null);
    data.put("ShowSection", false);
    data.put("Approved", true);
    data.put("Status", "Closed Won");
    data.put("Account", account);
    data.put("Tags", Arrays.asList("a", "b"));
    context = MergeContext.of(data);
    warnings = new ArrayList<String>();
  }

  private boolean eval(String condition) {
    return evaluator.evaluate(condition, context, warnings);
  }

  @Test
  public void comparisons() {
    assertTrue(eval("GrandTotal > 50000"));
    assertFalse(eval("GrandTotal < 50000"));
    assertTrue(eval("GrandTotal >= 93150"));
    assertTrue(eval("GrandTotal <= 93150.00"));
    assertTrue(eval("DiscountPercent > 0"));
    assertTrue(eval("DiscountPercent == 5"));
    assertTrue(eval("DiscountPercent != 6"));
    assertTrue(eval("Account.Type == 'Customer'"));
    assertTrue(eval("Account.Type == \"Customer\""));
    assertTrue(eval("Account.Type != 'Partner'"));
    assertTrue(eval("-1 < Zero"));
    assertTrue(eval("-.5 < Zero"));
    assertTrue(eval("Zero > -0.5"));
    assertFalse(eval(".5 < -.5"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  public void looseEquality() {
    assertTrue(eval("Quantity == 12"));
    assertTrue(eval("Quantity > 10"));
    assertTrue(eval("Zero == FALSE"));
    assertTrue(eval("Approved == 1"));
    assertTrue(eval("Nothing == NULL"));
    assertTrue(eval("Missing == NULL"));
    assertFalse(eval("Zero == NULL"));
    assertFalse(eval("Empty == NULL"));
    assertTrue(eval("Empty == 0"));
  }

  @Test
  public void orderingWithNonNumbers() {
    assertFalse(eval("Status > 0"));
    assertFalse(eval("Status < 0"));
    assertFalse(eval("Missing > 0"));
    assertFalse(eval("Missing <= 0"));
    assertTrue(eval("Nothing >= 0"));
  }

  @Test
  public void fieldOnTheRight() {
    assertTrue(eval("GrandTotal > DiscountPercent"));
    assertTrue(eval("Account.Name != Account.Type"));
    assertFalse(eval("Zero == Missing"));
  }

  @Test
  public void stringOperators() {
    assertTrue(eval("Status CONTAINS 'Won'"));
    assertFalse(eval("Status CONTAINS 'won'"));
    assertTrue(eval("Status STARTSWITH 'Closed'"));
    assertTrue(eval("Status ENDSWITH 'Won'"));
    assertTrue(eval("Status IEQUALS 'closed won'"));
    assertTrue(eval("Account.Name contains 'Acme'"));
    assertFalse(eval("Missing CONTAINS 'x'"));
    assertTrue(eval("Missing STARTSWITH ''"));
    assertTrue(eval("Tags CONTAINS 'b'"));
  }

  @Test
  public void isBlank() {
    assertTrue(eval("ISBLANK Missing"));
    assertTrue(eval("ISBLANK Nothing"));
    assertTrue(eval("ISBLANK Empty"));
    assertTrue(eval("ISBLANK Blank"));
    assertTrue(eval("ISBLANK(Blank)"));
    assertFalse(eval("ISBLANK Status"));
    assertFalse(eval("ISBLANK Zero"));
    assertTrue(eval("NOT ISBLANK Status"));
  }

  @Test
  public void truthiness() {
    assertTrue(eval("Approved"));
    assertFalse(eval("ShowSection"));
    assertFalse(eval("Empty"));
    assertFalse(eval("Nothing"));
    assertFalse(eval("Missing"));
    assertTrue(eval("Zero"));
    assertTrue(eval("Blank"));
    assertTrue(eval("Account"));
    assertTrue(eval("TRUE"));
    assertFalse(eval("FALSE"));
    assertFalse(eval("NULL"));
  }

  @Test
  public void booleanLogic() {
    assertTrue(eval("Approved AND GrandTotal > 50000"));
    assertFalse(eval("Approved AND ShowSection"));
    assertTrue(eval("ShowSection OR Approved"));
    assertTrue(eval("NOT ShowSection"));
    assertTrue(eval("NOT NOT Approved"));
    assertTrue(eval("Approved and not ShowSection"));
    // Keywords are case-insensitive, field names aren't.
    assertFalse(eval("approved"));
  }

  @Test
  public void precedence() {
    // AND binds tighter than OR.
    assertTrue(eval("Approved OR ShowSection AND FALSE"));
    assertFalse(eval("(Approved OR ShowSection) AND FALSE"));
    // NOT binds tighter than AND.
    assertFalse(eval("NOT Approved AND Approved"));
    assertTrue(eval("NOT (Approved AND ShowSection)"));
    assertTrue(eval("((GrandTotal > 1))"));
  }

  @Test
  public void malformedIsFalseWithWarning() {
    String[] malformed = {
      "",
      "GrandTotal >",
      "GrandTotal > 1 AND",
      "(Approved",
      "Approved)",
      "Status CONTAINS",
      "'unterminated",
      "Approved && ShowSection",
      "12abc > 1",
      "Account..Name",
      "== 1",
      "ISBLANK 'x'",
    };
    for (String condition : malformed) {
      warnings.clear();
      assertFalse(condition, eval(condition));
      assertEquals(condition, 1, warnings.size());
    }
  }

  @Test
  public void throwPolicy() {
    ExpressionEvaluator strict = new ExpressionEvaluator(ErrorPolicy.THROW);
    assertEquals(ErrorPolicy.THROW, strict.getErrorPolicy());
    assertTrue(strict.evaluate("Approved", context, null));
    try {
      strict.evaluate("GrandTotal >", context, warnings);
      fail();
    } catch (ExpressionException e) {
      assertEquals("GrandTotal >", e.getExpression());
      assertTrue(e.getMessage(), e.getMessage().contains("'GrandTotal >'"));
    }
    assertTrue(warnings.isEmpty());
  }

  @Test
  public void parse() {
    assertEquals("((a > 1) OR (b AND NOT c))",
        ExpressionEvaluator.parse("a > 1 OR b AND NOT c").toString());
    assertEquals("(x CONTAINS 'y')", ExpressionEvaluator.parse("x contains 'y'").toString());
    assertEquals("ISBLANK(x.y)", ExpressionEvaluator.parse("ISBLANK(x.y)").toString());
    assertEquals("(a == NULL)", ExpressionEvaluator.parse("a == null").toString());
    assertEquals("(a != 2.5)", ExpressionEvaluator.parse("a != 2.50").toString());
  }

  @Test(expected = ExpressionException.class)
  public void parseAlwaysThrows() {
    ExpressionEvaluator.parse("a >");
  }
}
