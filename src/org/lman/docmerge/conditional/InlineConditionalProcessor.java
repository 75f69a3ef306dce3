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

package org.lman.docmerge.conditional;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.lman.docmerge.context.MergeContext;
import org.lman.docmerge.expr.ExpressionEvaluator;
import org.lman.docmerge.template.Tag;
import org.lman.docmerge.template.TagScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves {{IF}} / {{ELSEIF}} / {{ELSE}} / {{/IF}} markers within one text.
 *
 * Each pass resolves every innermost complete span (an IF and its /IF with no other IF in
 * between), so nested conditionals take one pass per level. Replacements are spliced in from
 * right to left using the markers' exact bounds; text around a span is never touched.
 */
public class InlineConditionalProcessor {

  private static final Logger logger = LoggerFactory.getLogger(InlineConditionalProcessor.class);

  /** Indices into a marker list: the IF, each ELSEIF/ELSE of its own, then the /IF. */
  private static class Span {
    final List<Integer> markers = new ArrayList<Integer>();

    int first() {
      return markers.get(0);
    }

    int last() {
      return markers.get(markers.size() - 1);
    }
  }

  private final ExpressionEvaluator evaluator;
  private final int maxIterations;

  public InlineConditionalProcessor(ExpressionEvaluator evaluator, int maxIterations) {
    this.evaluator = evaluator;
    this.maxIterations = maxIterations;
  }

  /**
   * Returns |text| with all of its conditionals resolved. Markers that don't form complete
   * spans are left in place with a warning.
   *
   * @throws IterationLimitException if resolving needs more passes than allowed
   */
  public String process(String text, MergeContext context, List<String> warnings) {
    String current = text;
    for (int pass = 0; ; pass++) {
      List<Tag> markers = conditionalMarkers(current, null);
      if (markers.isEmpty())
        return current;

      List<Span> spans = innermostSpans(markers);
      if (spans.isEmpty()) {
        String warning = "Unmatched " + markers.get(0) + " in '" + current + "'";
        logger.warn(warning);
        if (warnings != null)
          warnings.add(warning);
        return current;
      }

      if (pass >= maxIterations)
        throw new IterationLimitException(maxIterations, text);
      current = replace(current, markers, spans, context, warnings);
    }
  }

  /**
   * Resolves only the conditionals that guard a section: those outside every section span of
   * |text| whose content holds a section opener. They must be resolved before the section is
   * bound, so that a false guard can hide a section with no data. Everything else is left for
   * {@link #process}, without warnings.
   *
   * @throws IterationLimitException if resolving needs more passes than allowed
   */
  public String resolveSectionGuards(String text, MergeContext context, List<String> warnings) {
    String current = text;
    for (int pass = 0; ; pass++) {
      if (current.indexOf("{{") == -1)
        return current;
      List<Tag> tags = TagScanner.scan(current);
      List<Tag> markers = conditionalMarkers(current, tags);

      List<Span> guards = new ArrayList<Span>();
      for (Span span : outermostSpans(markers)) {
        if (containsOpener(tags, markers.get(span.first()), markers.get(span.last())))
          guards.add(span);
      }
      if (guards.isEmpty())
        return current;

      if (pass >= maxIterations)
        throw new IterationLimitException(maxIterations, text);
      current = replace(current, markers, guards, context, warnings);
    }
  }

  private String replace(
      String text,
      List<Tag> markers,
      List<Span> spans,
      MergeContext context,
      List<String> warnings) {
    StringBuilder buf = new StringBuilder(text);
    for (int i = spans.size() - 1; i >= 0; i--) {
      Span span = spans.get(i);
      Tag open = markers.get(span.first());
      Tag close = markers.get(span.last());
      buf.replace(open.start, close.end, select(text, markers, span, context, warnings));
    }
    return buf.toString();
  }

  /**
   * The conditional markers of |text|. If |sectionTags| (all tags of the text) is given, markers
   * inside a section span are left out.
   */
  private static List<Tag> conditionalMarkers(String text, List<Tag> sectionTags) {
    List<Tag> markers = new ArrayList<Tag>();
    if (text.indexOf("{{") == -1)
      return markers;
    List<Tag> tags = (sectionTags == null) ? TagScanner.scan(text) : sectionTags;
    boolean[] inSection =
        (sectionTags == null) ? new boolean[tags.size()] : sectionMembership(tags);
    for (int i = 0; i < tags.size(); i++) {
      if (tags.get(i).isConditional() && !inSection[i])
        markers.add(tags.get(i));
    }
    return markers;
  }

  /**
   * Which of |tags| fall inside a section span. An opener without a closer reaches the end of
   * the text, a closer without an opener reaches back to its start.
   */
  private static boolean[] sectionMembership(List<Tag> tags) {
    boolean[] inSection = new boolean[tags.size()];
    int i = 0;
    while (i < tags.size()) {
      Tag tag = tags.get(i);
      if (tag.isSectionCloser()) {
        for (int j = 0; j <= i; j++)
          inSection[j] = true;
        i++;
      } else if (tag.isSectionOpener()) {
        int close = TagScanner.findCloser(tags, i);
        int last = (close == -1) ? tags.size() - 1 : close;
        for (int j = i; j <= last; j++)
          inSection[j] = true;
        i = last + 1;
      } else {
        i++;
      }
    }
    return inSection;
  }

  private static boolean containsOpener(List<Tag> tags, Tag open, Tag close) {
    for (Tag tag : tags) {
      if (tag.isSectionOpener() && tag.start >= open.end && tag.end <= close.start)
        return true;
    }
    return false;
  }

  /** Spans whose bodies contain no IF, in text order. */
  private static List<Span> innermostSpans(List<Tag> markers) {
    List<Span> spans = new ArrayList<Span>();
    Deque<Integer> open = new ArrayDeque<Integer>();
    int lastIf = -1;
    for (int i = 0; i < markers.size(); i++) {
      Tag.Kind kind = markers.get(i).kind;
      if (kind == Tag.Kind.IF) {
        open.push(i);
        lastIf = i;
      } else if (kind == Tag.Kind.END_IF && !open.isEmpty()) {
        int first = open.pop();
        if (first == lastIf) {
          Span span = new Span();
          for (int j = first; j <= i; j++)
            span.markers.add(j);
          spans.add(span);
        }
      }
    }
    return spans;
  }

  /** Complete spans not nested in any other, in text order. */
  private static List<Span> outermostSpans(List<Tag> markers) {
    List<Span> spans = new ArrayList<Span>();
    Span current = null;
    int depth = 0;
    for (int i = 0; i < markers.size(); i++) {
      Tag.Kind kind = markers.get(i).kind;
      if (kind == Tag.Kind.IF) {
        if (depth++ == 0) {
          current = new Span();
          current.markers.add(i);
        }
      } else if (depth == 0) {
        // A stray branch or closer.
        continue;
      } else if (kind == Tag.Kind.END_IF) {
        if (--depth == 0) {
          current.markers.add(i);
          spans.add(current);
        }
      } else if (depth == 1) {
        current.markers.add(i);
      }
    }
    return spans;
  }

  private String select(
      String text, List<Tag> markers, Span span, MergeContext context, List<String> warnings) {
    ConditionalBlock<String> block = new ConditionalBlock<String>();
    for (int m = 0; m < span.markers.size() - 1; m++) {
      Tag marker = markers.get(span.markers.get(m));
      Tag next = markers.get(span.markers.get(m + 1));
      String body = text.substring(marker.end, next.start);
      block.addBranch(marker.kind == Tag.Kind.ELSE ? null : marker.argument, body);
    }
    ConditionalBlock.Branch<String> selected = block.select(evaluator, context, warnings);
    return selected == null ? "" : selected.content;
  }
}
