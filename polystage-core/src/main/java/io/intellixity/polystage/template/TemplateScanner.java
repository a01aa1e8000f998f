package io.intellixity.polystage.template;

import io.intellixity.polystage.error.InvalidPlanException;
import io.intellixity.polystage.model.AggregationPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical placeholder scanner.\n
 *
 * Grammar: {@code {{ [previous_stage]N.field[.sub]* [|policy] [@[Entity.]property] }}}, optionally wrapped
 * in a matching pair of single or double quotes, in which case the quotes belong to the token.\n
 *
 * The single-brace form {@code {previous_stageN.field}} is read as {@code {{N.field|list}}}.\n
 *
 * A placeholder may not start inside a quoted literal ({@code '%{{0.name}}%'}): the bound marker
 * would stay literal text.\n
 */
public final class TemplateScanner {
  private static final String IDENT = "[A-Za-z_$][A-Za-z0-9_$]*";
  private static final String PATH = IDENT + "(?:\\." + IDENT + ")*";
  private static final Pattern TOKEN = Pattern.compile(
      "(['\"]?)(?:\\{\\{\\s*(?:previous_stage)?(\\d+)\\.(" + PATH + ")\\s*"
          + "(?:\\|\\s*([A-Za-z-]+)\\s*)?"
          + "(?:@\\s*(" + IDENT + ")(?:\\.(" + IDENT + "))?\\s*)?"
          + "}}"
          + "|(?<!\\{)\\{\\s*previous_stage(\\d+)\\.(" + PATH + ")\\s*}(?!}))\\1");
  private static final Pattern LOOSE = Pattern.compile(
      "\\{\\{\\s*(?:previous_stage)?\\d[^{}]*}}|\\{\\s*previous_stage[^{}]*}");

  private TemplateScanner() {}

  public static List<Placeholder> scan(String template) {
    if (template == null || template.isEmpty()) return List.of();
    List<Placeholder> out = new ArrayList<>();
    Matcher m = TOKEN.matcher(template);
    while (m.find()) {
      out.add(m.group(7) != null ? alias(m) : placeholder(m));
    }
    rejectMalformed(template, out);
    rejectInsideLiterals(template, out);
    return List.copyOf(out);
  }

  private static Placeholder placeholder(Matcher m) {
    AggregationPolicy policy = null;
    if (m.group(4) != null) {
      try {
        policy = AggregationPolicy.fromToken(m.group(4));
      } catch (IllegalArgumentException e) {
        throw new InvalidPlanException("Placeholder " + m.group() + ": " + e.getMessage(), e);
      }
    }
    String entity = null;
    String field = null;
    if (m.group(5) != null) {
      if (m.group(6) != null) {
        entity = m.group(5);
        field = m.group(6);
      } else {
        field = m.group(5);
      }
    }
    return new Placeholder(m.group(), m.start(), m.end(), stageIndex(m, 2), m.group(3), policy, entity, field,
        !m.group(1).isEmpty());
  }

  // {previous_stageN.key} always carried the whole column
  private static Placeholder alias(Matcher m) {
    return new Placeholder(m.group(), m.start(), m.end(), stageIndex(m, 7), m.group(8), AggregationPolicy.LIST,
        null, null, !m.group(1).isEmpty());
  }

  private static int stageIndex(Matcher m, int group) {
    try {
      return Integer.parseInt(m.group(group));
    } catch (NumberFormatException e) {
      throw new InvalidPlanException("Placeholder " + m.group() + ": stage index out of range", e);
    }
  }

  /** Rebuild the template with every placeholder replaced. */
  public static String substitute(String template, List<Placeholder> placeholders, Function<Placeholder, String> replacement) {
    StringBuilder sb = new StringBuilder(template.length() + 16);
    int pos = 0;
    for (Placeholder p : placeholders) {
      sb.append(template, pos, p.start());
      sb.append(replacement.apply(p));
      pos = p.end();
    }
    sb.append(template, pos, template.length());
    return sb.toString();
  }

  private static void rejectMalformed(String template, List<Placeholder> matched) {
    Matcher loose = LOOSE.matcher(template);
    while (loose.find()) {
      boolean covered = false;
      for (Placeholder p : matched) {
        if (loose.start() >= p.start() && loose.end() <= p.end()) {
          covered = true;
          break;
        }
      }
      if (!covered) throw new InvalidPlanException("Malformed placeholder: " + loose.group());
    }
  }

  /** Same quoting rules as the backends: '' and "" escape by doubling, backslash escapes one character. */
  private static void rejectInsideLiterals(String template, List<Placeholder> matched) {
    char quote = 0;
    int next = 0;
    for (int i = 0; i < template.length(); i++) {
      if (next < matched.size() && i >= matched.get(next).start()) {
        Placeholder p = matched.get(next++);
        if (quote != 0) {
          throw new InvalidPlanException("Placeholder " + p.raw().trim() + " is inside a quoted literal and cannot be"
              + " bound; quote the whole placeholder or concatenate it with the literal");
        }
        i = p.end() - 1;
        continue;
      }
      char ch = template.charAt(i);
      if (quote != 0) {
        if (ch == '\\') i++;
        else if (ch == quote) quote = 0;
      } else if (ch == '\'' || ch == '"') {
        quote = ch;
      }
    }
  }
}
