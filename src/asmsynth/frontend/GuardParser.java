package asmsynth.frontend;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for guard and output expressions.
 * <p>
 * Grammar, lowest precedence first:
 * <pre>
 * or      := and (('or' | '|' | '+') and)*
 * and     := unary (('and' | '&amp;' | '*') unary)*
 * unary   := ('not' | '!' | '~') unary | primary
 * primary := '(' or ')' | '0' | '1' | 'true' | 'false' | ident ('[' digits ']')?
 * </pre>
 * Keywords are case-insensitive. An unindexed identifier yields a {@link BoolExpr.Literal} with bit -1.
 */
public class GuardParser {

  private final String text;
  private int pos = -1;
  private char ch;

  private GuardParser(String text) { this.text = text; }

  /**
   * Parses {@code text}. Null or blank text is the constant true, the guard of an unconditional transition.
   */
  public static BoolExpr parse(String text) throws GuardParseException {
    if (text == null || text.isBlank())
      return BoolExpr.TRUE;
    GuardParser parser = new GuardParser(text);
    parser.nextChar();
    BoolExpr ret = parser.parseOr();
    parser.skipSpace();
    if (parser.pos < text.length())
      throw new GuardParseException("Unexpected '" + parser.ch + "'", text, parser.pos);
    return ret;
  }

  private void nextChar() { ch = (++pos < text.length()) ? text.charAt(pos) : (char)-1; }

  private void skipSpace() {
    while (pos < text.length() && Character.isWhitespace(ch))
      nextChar();
  }

  private boolean atEnd() { return pos >= text.length(); }

  /** Consumes {@code symbol} if it is next. */
  private boolean eatSymbol(char symbol) {
    skipSpace();
    if (!atEnd() && ch == symbol) {
      nextChar();
      return true;
    }
    return false;
  }

  /** Consumes the keyword if it is next and not just the prefix of a longer identifier. */
  private boolean eatKeyword(String keyword) {
    skipSpace();
    int end = pos + keyword.length();
    if (end > text.length() || !text.regionMatches(true, pos, keyword, 0, keyword.length()))
      return false;
    if (end < text.length() && isIdentPart(text.charAt(end)))
      return false;
    while (pos < end)
      nextChar();
    return true;
  }

  private BoolExpr parseOr() throws GuardParseException {
    List<BoolExpr> operands = new ArrayList<>();
    operands.add(parseAnd());
    while (eatKeyword("or") || eatSymbol('|') || eatSymbol('+'))
      operands.add(parseAnd());
    return operands.size() == 1 ? operands.get(0) : new BoolExpr.Or(operands);
  }

  private BoolExpr parseAnd() throws GuardParseException {
    List<BoolExpr> operands = new ArrayList<>();
    operands.add(parseUnary());
    while (eatKeyword("and") || eatSymbol('&') || eatSymbol('*'))
      operands.add(parseUnary());
    return operands.size() == 1 ? operands.get(0) : new BoolExpr.And(operands);
  }

  private BoolExpr parseUnary() throws GuardParseException {
    if (eatKeyword("not") || eatSymbol('!') || eatSymbol('~'))
      return new BoolExpr.Not(parseUnary());
    return parsePrimary();
  }

  private BoolExpr parsePrimary() throws GuardParseException {
    skipSpace();
    if (atEnd())
      throw new GuardParseException("Unexpected end of expression", text, pos);
    if (eatSymbol('(')) {
      BoolExpr inner = parseOr();
      if (!eatSymbol(')'))
        throw new GuardParseException("Expected ')'", text, pos);
      return inner;
    }
    if (eatKeyword("true") || eatKeyword("1"))
      return BoolExpr.TRUE;
    if (eatKeyword("false") || eatKeyword("0"))
      return BoolExpr.FALSE;
    if (!isIdentStart(ch))
      throw new GuardParseException("Unexpected '" + ch + "'", text, pos);
    int start = pos;
    while (!atEnd() && isIdentPart(ch))
      nextChar();
    String name = text.substring(start, pos);
    if (name.equalsIgnoreCase("and") || name.equalsIgnoreCase("or") || name.equalsIgnoreCase("not"))
      throw new GuardParseException("Operator '" + name + "' where a signal was expected", text, start);
    int bit = -1;
    if (eatSymbol('[')) {
      skipSpace();
      int digitsStart = pos;
      while (!atEnd() && Character.isDigit(ch))
        nextChar();
      if (digitsStart == pos)
        throw new GuardParseException("Expected bit index", text, pos);
      try {
        bit = Integer.parseInt(text.substring(digitsStart, pos));
      } catch (NumberFormatException e) {
        throw new GuardParseException("Bit index out of range", text, digitsStart);
      }
      if (!eatSymbol(']'))
        throw new GuardParseException("Expected ']'", text, pos);
    }
    return new BoolExpr.Literal(name, bit);
  }

  private static boolean isIdentStart(char c) { return Character.isLetter(c) || c == '_'; }
  private static boolean isIdentPart(char c) { return Character.isLetterOrDigit(c) || c == '_'; }
}
