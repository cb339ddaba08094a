package exm.sdfg.common.lang;

/**
 * Recursive descent parser for symbolic integer expressions.
 *
 * expr    := term (('+' | '-') term)*
 * term    := unary ('*' unary)*
 * unary   := '-' unary | primary
 * primary := INTEGER | IDENTIFIER | '(' expr ')'
 */
class SymParser {
  private final String input;
  private int pos;

  SymParser(String input) {
    this.input = input;
    this.pos = 0;
  }

  SymExpr parse() {
    SymExpr result = parseExpr();
    skipWhiteSpace();
    if (pos != input.length()) {
      throw syntaxError("unexpected trailing input");
    }
    return result;
  }

  private SymExpr parseExpr() {
    SymExpr result = parseTerm();
    while (true) {
      skipWhiteSpace();
      if (match('+')) {
        result = result.plus(parseTerm());
      } else if (match('-')) {
        result = result.minus(parseTerm());
      } else {
        return result;
      }
    }
  }

  private SymExpr parseTerm() {
    SymExpr result = parseUnary();
    while (true) {
      skipWhiteSpace();
      if (match('*')) {
        result = result.times(parseUnary());
      } else {
        return result;
      }
    }
  }

  private SymExpr parseUnary() {
    skipWhiteSpace();
    if (match('-')) {
      return parseUnary().negate();
    }
    return parsePrimary();
  }

  private SymExpr parsePrimary() {
    skipWhiteSpace();
    if (pos >= input.length()) {
      throw syntaxError("unexpected end of input");
    }
    char c = input.charAt(pos);
    if (match('(')) {
      SymExpr inner = parseExpr();
      skipWhiteSpace();
      if (!match(')')) {
        throw syntaxError("expected ')'");
      }
      return inner;
    } else if (Character.isDigit(c)) {
      int start = pos;
      while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
        pos++;
      }
      try {
        return SymExpr.of(Long.parseLong(input.substring(start, pos)));
      } catch (NumberFormatException e) {
        throw syntaxError("integer out of range");
      }
    } else if (Character.isJavaIdentifierStart(c)) {
      int start = pos;
      while (pos < input.length() &&
             Character.isJavaIdentifierPart(input.charAt(pos))) {
        pos++;
      }
      return SymExpr.symbol(input.substring(start, pos));
    }
    throw syntaxError("unexpected character '" + c + "'");
  }

  private boolean match(char c) {
    if (pos < input.length() && input.charAt(pos) == c) {
      pos++;
      return true;
    }
    return false;
  }

  private void skipWhiteSpace() {
    while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
      pos++;
    }
  }

  private IllegalArgumentException syntaxError(String msg) {
    return new IllegalArgumentException("Invalid symbolic expression \""
                              + input + "\" at position " + pos + ": " + msg);
  }
}
