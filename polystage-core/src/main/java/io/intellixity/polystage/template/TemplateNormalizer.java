package io.intellixity.polystage.template;

/**
 * Whitespace normalization used for plan fingerprints.\n
 *
 * Outside quoted literals ('...', "...", `...`): whitespace next to a non-word character is removed and
 * other whitespace runs collapse to one space. Literal content is untouched.\n
 *
 * Case folding is opt-in: it lower-cases unquoted text but keeps placeholders ({@code {...}}) and
 * {@code :named} parameters as written, since both are case-sensitive lookups.\n
 */
public final class TemplateNormalizer {
  private TemplateNormalizer() {}

  public static String normalize(String template) {
    return normalize(template, false);
  }

  public static String normalize(String template, boolean foldCase) {
    if (template == null) return "";
    String s = template.strip();
    StringBuilder out = new StringBuilder(s.length());
    char quote = 0;
    int braces = 0;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (quote != 0) {
        out.append(c);
        if (c == '\\' && i + 1 < s.length()) {
          out.append(s.charAt(++i));
        } else if (c == quote) {
          quote = 0;
        }
        continue;
      }
      if (c == '\'' || c == '"' || c == '`') {
        quote = c;
        out.append(c);
        continue;
      }
      if (Character.isWhitespace(c)) {
        int j = i;
        while (j < s.length() && Character.isWhitespace(s.charAt(j))) j++;
        char prev = out.length() == 0 ? ' ' : out.charAt(out.length() - 1);
        char next = j < s.length() ? s.charAt(j) : ' ';
        if (isWord(prev) && isWord(next)) out.append(' ');
        i = j - 1;
        continue;
      }
      if (c == '{') braces++;
      else if (c == '}' && braces > 0) braces--;
      if (foldCase && isNamedParam(s, i)) {
        int j = i + 1;
        while (j < s.length() && isWord(s.charAt(j))) j++;
        out.append(s, i, j);
        i = j - 1;
        continue;
      }
      out.append(foldCase && braces == 0 ? Character.toLowerCase(c) : c);
    }
    return out.toString();
  }

  // ":name" but not the second colon of a "::" cast
  private static boolean isNamedParam(String s, int i) {
    if (s.charAt(i) != ':' || i + 1 >= s.length() || (i > 0 && s.charAt(i - 1) == ':')) return false;
    char n = s.charAt(i + 1);
    return Character.isLetter(n) || n == '_';
  }

  private static boolean isWord(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '$';
  }
}
