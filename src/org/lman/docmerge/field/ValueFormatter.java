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

package org.lman.docmerge.field;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.lman.docmerge.MergeOptions;
import org.lman.docmerge.expr.Values;
import org.lman.docmerge.json.JsonConverter;
import org.lman.docmerge.json.JsonView;
import org.lman.docmerge.json.JsonView.ArrayVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders resolved field values as text, either through a named format from the catalog
 * below or through a generic, type-driven stringification.
 *
 * <ul>
 *   <li>{@code currency}: symbol, grouping and two decimals. Strings already carrying a currency
 *       symbol keep it; only their grouping and decimals are normalized.
 *   <li>{@code number}: grouping, up to three decimals.
 *   <li>{@code percent}: one decimal and a '%'. A non-zero magnitude below 1 is taken to be a
 *       fraction and multiplied by 100, so 0.5 renders as "50.0%"; this is ambiguous for
 *       genuinely sub-1% values, which can't be expressed.
 *   <li>{@code date}, {@code datetime}, {@code time}: long form. ISO dates and date-times,
 *       MM/DD/YYYY, epoch milliseconds and java.time / java.util.Date values are accepted.
 *   <li>{@code phone}: 10 digits, or 1 and 10 digits, become "(AAA) BBB-CCCC".
 *   <li>{@code uppercase}, {@code lowercase}, {@code capitalize}.
 *   <li>A digit string N of one or two digits: fixed N decimals.
 * </ul>
 *
 * Values a format can't interpret are rendered generically, with a warning.
 */
public class ValueFormatter {

  private static final Logger logger = LoggerFactory.getLogger(ValueFormatter.class);

  public static final String CURRENCY = "currency";
  public static final String NUMBER = "number";
  public static final String PERCENT = "percent";
  public static final String DATE = "date";
  public static final String DATETIME = "datetime";
  public static final String TIME = "time";
  public static final String PHONE = "phone";
  public static final String UPPERCASE = "uppercase";
  public static final String LOWERCASE = "lowercase";
  public static final String CAPITALIZE = "capitalize";
  /** Not rendered here: image markers are left for the deferred image pass. */
  public static final String IMAGE = "image";

  private static final Pattern DECIMAL_PLACES = Pattern.compile("\\d+");
  private static final Pattern CURRENCY_SYMBOL = Pattern.compile("\\p{Sc}");
  private static final Pattern PHONE_CHARACTERS = Pattern.compile("[\\d\\s().+\\-]+");
  private static final Pattern DECIMAL = Pattern.compile("-?(\\d+\\.?\\d*|\\.\\d+)");

  private static final DateTimeFormatter US_DATE = DateTimeFormatter.ofPattern("M/d/uuuu");

  private final Locale locale;
  private final ZoneId zone;
  private final String currencySymbol;
  private final DateTimeFormatter dateFormat;
  private final DateTimeFormatter dateTimeFormat;
  private final DateTimeFormatter timeFormat;

  public ValueFormatter(MergeOptions options) {
    this.locale = options.getLocale();
    this.zone = options.getZoneId();
    this.currencySymbol = options.currencySymbol;
    this.dateFormat = DateTimeFormatter.ofPattern("MMMM d, yyyy", locale);
    this.dateTimeFormat = DateTimeFormatter.ofPattern("MMMM d, yyyy h:mm a", locale);
    this.timeFormat = DateTimeFormatter.ofPattern("h:mm a", locale);
  }

  public ValueFormatter() {
    this(new MergeOptions());
  }

  /**
   * Renders |value| with the named |format| (case-insensitive). |value| must be resolved and
   * not a present null. Warnings go to |warnings| if it's non-null.
   */
  public String format(JsonView value, String format, List<String> warnings) {
    String name = format.trim().toLowerCase(Locale.ROOT);

    if (DECIMAL_PLACES.matcher(name).matches()) {
      int places = decimalPlaces(name);
      return orGeneric(places < 0 ? null : fixed(value, places), value, format, warnings);
    }

    if (name.equals(CURRENCY))
      return orGeneric(currency(value), value, format, warnings);
    if (name.equals(NUMBER))
      return orGeneric(number(value), value, format, warnings);
    if (name.equals(PERCENT))
      return orGeneric(percent(value), value, format, warnings);
    if (name.equals(DATE))
      return orGeneric(temporal(value, dateFormat), value, format, warnings);
    if (name.equals(DATETIME))
      return orGeneric(temporal(value, dateTimeFormat), value, format, warnings);
    if (name.equals(TIME))
      return orGeneric(temporal(value, timeFormat), value, format, warnings);
    if (name.equals(PHONE))
      return phone(stringify(value));
    if (name.equals(UPPERCASE))
      return stringify(value).toUpperCase(locale);
    if (name.equals(LOWERCASE))
      return stringify(value).toLowerCase(locale);
    if (name.equals(CAPITALIZE))
      return capitalize(stringify(value));
    if (name.equals(IMAGE))
      return stringify(value);

    warn(warnings, "Unknown format '" + format + "'; rendering the value as is");
    return stringify(value);
  }

  /**
   * Type-driven rendering: booleans as Yes/No, arrays joined with ", ", dates in long form,
   * numbers in their shortest plain form, other objects as JSON.
   */
  public String stringify(JsonView value) {
    switch (value.getType()) {
      case NULL:
        return "";
      case BOOLEAN:
        return value.asBoolean() ? "Yes" : "No";
      case NUMBER:
        return Values.numberText(value.asNumber());
      case STRING:
        return value.asString();
      case ARRAY: {
        final StringBuilder buf = new StringBuilder();
        value.asArrayForeach(new ArrayVisitor() {
          @Override
          public void visit(JsonView item, int index) {
            if (index > 0)
              buf.append(", ");
            buf.append(stringify(item));
          }
        });
        return buf.toString();
      }
      default: {
        ZonedDateTime date = fromJavaDate(value);
        if (date != null)
          return dateFormat.format(date);
        return JsonConverter.toJson(value);
      }
    }
  }

  private String orGeneric(String formatted, JsonView value, String format, List<String> warnings) {
    if (formatted != null)
      return formatted;
    String generic = stringify(value);
    warn(warnings, "Cannot format '" + generic + "' as " + format + "; rendering it as is");
    return generic;
  }

  private static void warn(List<String> warnings, String warning) {
    logger.warn(warning);
    if (warnings != null)
      warnings.add(warning);
  }

  private String currency(JsonView value) {
    BigDecimal amount = toDecimal(value);
    if (amount == null)
      return null;
    String symbol = currencySymbol;
    if (value.getType() == JsonView.Type.STRING) {
      Matcher carried = CURRENCY_SYMBOL.matcher(value.asString());
      if (carried.find())
        symbol = carried.group();
    }
    String digits = newDecimalFormat("#,##0.00").format(amount.abs());
    return (amount.signum() < 0 ? "-" : "") + symbol + digits;
  }

  private String number(JsonView value) {
    BigDecimal amount = toDecimal(value);
    return amount == null ? null : newDecimalFormat("#,##0.###").format(amount);
  }

  private String percent(JsonView value) {
    BigDecimal amount = toDecimal(value);
    if (amount == null)
      return null;
    if (amount.signum() != 0 && amount.abs().compareTo(BigDecimal.ONE) < 0)
      amount = amount.movePointRight(2);
    return newDecimalFormat("#,##0.0").format(amount) + "%";
  }

  /** The places a digit-string format asks for, or -1 if there are too many to count. */
  private static int decimalPlaces(String format) {
    String digits = format.replaceFirst("^0+(?=\\d)", "");
    return digits.length() > 2 ? -1 : Integer.parseInt(digits);
  }

  private static String fixed(JsonView value, int places) {
    BigDecimal amount = toDecimal(value);
    return amount == null ? null : amount.setScale(places, RoundingMode.HALF_UP).toPlainString();
  }

  private DecimalFormat newDecimalFormat(String pattern) {
    DecimalFormat format = new DecimalFormat(pattern, DecimalFormatSymbols.getInstance(locale));
    format.setRoundingMode(RoundingMode.HALF_UP);
    return format;
  }

  /** Numbers as-is; strings with grouping separators or a currency symbol stripped. */
  private static BigDecimal toDecimal(JsonView value) {
    if (value.getType() == JsonView.Type.NUMBER) {
      double d = value.asNumber().doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d))
        return null;
      return new BigDecimal(Values.numberText(value.asNumber()));
    }
    if (value.getType() != JsonView.Type.STRING)
      return null;
    String text = value.asString().replaceAll("[\\s,]", "").replaceAll("\\p{Sc}", "");
    if (!DECIMAL.matcher(text).matches())
      return null;
    return new BigDecimal(text);
  }

  private String temporal(JsonView value, DateTimeFormatter formatter) {
    ZonedDateTime date = toDateTime(value);
    return date == null ? null : formatter.format(date);
  }

  private ZonedDateTime toDateTime(JsonView value) {
    switch (value.getType()) {
      case NUMBER:
        return Instant.ofEpochMilli(value.asNumber().longValue()).atZone(zone);
      case STRING:
        return parseDateTime(value.asString().trim());
      case OBJECT:
        return fromJavaDate(value);
      default:
        return null;
    }
  }

  private ZonedDateTime fromJavaDate(JsonView value) {
    Date date = value.asInstance(Date.class);
    if (date != null)
      return date.toInstant().atZone(zone);
    TemporalAccessor temporal = value.asInstance(TemporalAccessor.class);
    if (temporal == null)
      return null;
    if (temporal instanceof ZonedDateTime)
      return ((ZonedDateTime) temporal).withZoneSameInstant(zone);
    if (temporal instanceof OffsetDateTime)
      return ((OffsetDateTime) temporal).atZoneSameInstant(zone);
    if (temporal instanceof Instant)
      return ((Instant) temporal).atZone(zone);
    if (temporal instanceof LocalDateTime)
      return ((LocalDateTime) temporal).atZone(zone);
    if (temporal instanceof LocalDate)
      return ((LocalDate) temporal).atStartOfDay(zone);
    if (temporal instanceof LocalTime)
      return ((LocalTime) temporal).atDate(LocalDate.of(1970, 1, 1)).atZone(zone);
    return null;
  }

  private ZonedDateTime parseDateTime(String text) {
    if (text.isEmpty())
      return null;
    if (text.matches("-?\\d{9,}"))
      return Instant.ofEpochMilli(Long.parseLong(text)).atZone(zone);

    TemporalAccessor parsed = tryParse(text, DateTimeFormatter.ISO_LOCAL_DATE);
    if (parsed == null)
      parsed = tryParse(text, US_DATE);
    if (parsed != null)
      return LocalDate.from(parsed).atStartOfDay(zone);

    parsed = tryParse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    if (parsed != null)
      return LocalDateTime.from(parsed).atZone(zone);

    parsed = tryParse(text, DateTimeFormatter.ISO_ZONED_DATE_TIME);
    if (parsed != null)
      return ZonedDateTime.from(parsed).withZoneSameInstant(zone);

    parsed = tryParse(text, DateTimeFormatter.ISO_LOCAL_TIME);
    if (parsed != null)
      return LocalTime.from(parsed).atDate(LocalDate.of(1970, 1, 1)).atZone(zone);
    return null;
  }

  private static TemporalAccessor tryParse(String text, DateTimeFormatter formatter) {
    try {
      return formatter.parse(text);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static String phone(String text) {
    if (!PHONE_CHARACTERS.matcher(text).matches())
      return text;
    String digits = text.replaceAll("\\D", "");
    if (digits.length() == 11 && digits.charAt(0) == '1')
      digits = digits.substring(1);
    else if (digits.length() != 10)
      return text;
    return "(" + digits.substring(0, 3) + ") " + digits.substring(3, 6) + "-" + digits.substring(6);
  }

  private String capitalize(String text) {
    if (text.isEmpty())
      return text;
    return text.substring(0, 1).toUpperCase(locale) + text.substring(1).toLowerCase(locale);
  }
}
