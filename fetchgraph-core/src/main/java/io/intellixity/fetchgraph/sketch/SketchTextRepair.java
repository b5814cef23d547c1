package io.intellixity.fetchgraph.sketch;

import java.math.BigDecimal;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort rewrite of almost-JSON sketch text into JSON.
 * <p>
 * Handles missing outer braces, bare keys, bare word and operator values, single-quoted strings and trailing
 * commas. Text inside double-quoted strings is copied unchanged.
 */
final class SketchTextRepair {
  private static final Pattern FENCED = Pattern.compile("```(?:json|JSON)?\\s*(.*?)```", Pattern.DOTALL);
  private static final Set<String> LITERALS = Set.of("true", "false", "null");

  private SketchTextRepair() {}

  /** The JSON-looking block inside prose or a fenced code block, or null when there is none. */
  static String extractBlock(String text) {
    Matcher m = FENCED.matcher(text);
    if (m.find()) return m.group(1).trim();
    int open = text.indexOf('{');
    int close = text.lastIndexOf('}');
    if (open >= 0 && close > open) return text.substring(open, close + 1);
    return null;
  }

  static String repair(String text) {
    String s = text.trim();
    if (!s.startsWith("{") && !s.startsWith("[")) s = "{" + s + "}";
    return stripTrailingCommas(quoteBareTokens(s));
  }

  private static String quoteBareTokens(String s) {
    StringBuilder out = new StringBuilder(s.length() + 16);
    int i = 0;
    int n = s.length();
    while (i < n) {
      char c = s.charAt(i);
      if (c == '"') {
        int end = skipString(s, i, '"');
        out.append(s, i, end);
        i = end;
      } else if (c == '\'') {
        int end = skipString(s, i, '\'');
        String body = s.substring(i + 1, Math.max(i + 1, end - 1));
        out.append('"').append(body.replace("\\'", "'").replace("\"", "\\\"")).append('"');
        i = end;
      } else if (isOperatorChar(c)) {
        int end = i;
        while (end < n && isOperatorChar(s.charAt(end))) end++;
        out.append('"').append(s, i, end).append('"');
        i = end;
      } else if (isWordChar(c)) {
        int end = i;
        while (end < n && isWordChar(s.charAt(end))) end++;
        String word = s.substring(i, end);
        if (LITERALS.contains(word) || isNumber(word)) out.append(word);
        else out.append('"').append(word).append('"');
        i = end;
      } else {
        out.append(c);
        i++;
      }
    }
    return out.toString();
  }

  private static String stripTrailingCommas(String s) {
    StringBuilder out = new StringBuilder(s.length());
    int i = 0;
    int n = s.length();
    while (i < n) {
      char c = s.charAt(i);
      if (c == '"') {
        int end = skipString(s, i, '"');
        out.append(s, i, end);
        i = end;
        continue;
      }
      if (c == ',') {
        int j = i + 1;
        while (j < n && Character.isWhitespace(s.charAt(j))) j++;
        if (j < n && (s.charAt(j) == '}' || s.charAt(j) == ']')) {
          i++;
          continue;
        }
      }
      out.append(c);
      i++;
    }
    return out.toString();
  }

  /** Index just past the closing quote (or end of text when unterminated). */
  private static int skipString(String s, int start, char quote) {
    int i = start + 1;
    while (i < s.length()) {
      char c = s.charAt(i);
      if (c == '\\') {
        i += 2;
        continue;
      }
      if (c == quote) return i + 1;
      i++;
    }
    return s.length();
  }

  private static boolean isOperatorChar(char c) {
    return c == '<' || c == '>' || c == '=' || c == '!';
  }

  private static boolean isWordChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-' || c == '+' || c == '*' || c == '$';
  }

  private static boolean isNumber(String word) {
    try {
      new BigDecimal(word);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
