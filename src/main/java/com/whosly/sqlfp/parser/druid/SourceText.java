package com.whosly.sqlfp.parser.druid;

import com.alibaba.druid.DbType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lexical view of the input text, used to recover what Druid's AST no
 * longer holds: the spelling of numeric and string literals and the
 * position of top level keywords.
 *
 * Druid keeps a parsed {@link Number} for numeric literals and the
 * unescaped value for strings. The translator hands those values back here
 * and gets the source token of equal value, so {@code 00010} stays
 * {@code 00010} and a MySQL {@code "bob"} keeps its double quotes.
 */
public final class SourceText {

    private static final class Token {
        private final String text;
        private final BigDecimal number;
        private final String value;
        private final boolean national;
        private boolean taken;

        private Token(String text, BigDecimal number, String value, boolean national) {
            this.text = text;
            this.number = number;
            this.value = value;
            this.national = national;
        }
    }

    private final String sql;
    private final List<Token> numbers = new ArrayList<>();
    private final List<Token> strings = new ArrayList<>();
    private final List<String> topLevelWords = new ArrayList<>();
    private final List<Integer> topLevelWordStarts = new ArrayList<>();
    private int statementEnd;

    private SourceText(String sql) {
        this.sql = sql;
        this.statementEnd = sql.length();
    }

    public static SourceText scan(String sql, DbType dbType) {
        SourceText source = new SourceText(sql);
        source.tokenize(dbType);
        return source;
    }

    private void tokenize(DbType dbType) {
        boolean mysql = dbType == DbType.mysql || dbType == DbType.mariadb;
        boolean brackets = dbType == DbType.sqlserver;
        int n = sql.length();
        int depth = 0;
        boolean firstStatement = true;
        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);
            char next = i + 1 < n ? sql.charAt(i + 1) : '\0';

            if ((c == '-' && next == '-') || (mysql && c == '#')) {
                int end = sql.indexOf('\n', i);
                i = end < 0 ? n : end + 1;
            } else if (c == '/' && next == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? n : end + 2;
            } else if (c == '\'') {
                i = quoted(i, '\'', mysql, firstStatement);
            } else if (c == '"') {
                i = mysql ? quoted(i, '"', true, firstStatement) : closing(i, '"');
            } else if (c == '`') {
                i = closing(i, '`');
            } else if (c == '[' && brackets) {
                i = closing(i, ']');
            } else if (isDigit(c) || (c == '.' && isDigit(next))) {
                i = number(i, firstStatement);
            } else if (isWordChar(c)) {
                int end = i;
                while (end < n && isWordChar(sql.charAt(end))) {
                    end++;
                }
                if (depth == 0 && firstStatement) {
                    topLevelWords.add(sql.substring(i, end).toUpperCase(Locale.ROOT));
                    topLevelWordStarts.add(i);
                }
                i = end;
            } else {
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                } else if (c == ';' && depth <= 0 && firstStatement) {
                    firstStatement = false;
                    statementEnd = i;
                }
                i++;
            }
        }
    }

    /**
     * Scan a quoted string starting at {@code start} and record it.
     *
     * @return the index after the closing quote
     */
    private int quoted(int start, char quote, boolean backslashEscapes, boolean record) {
        int n = sql.length();
        StringBuilder value = new StringBuilder();
        int i = start + 1;
        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\\' && backslashEscapes && i + 1 < n) {
                value.append(unescape(sql.charAt(i + 1)));
                i += 2;
            } else if (c == quote && i + 1 < n && sql.charAt(i + 1) == quote) {
                value.append(quote);
                i += 2;
            } else if (c == quote) {
                break;
            } else {
                value.append(c);
                i++;
            }
        }
        int end = Math.min(i + 1, n);
        if (!record) {
            return end;
        }

        int tokenStart = start;
        boolean national = false;
        if (start > 0 && isWordChar(sql.charAt(start - 1))) {
            boolean standalonePrefix = start < 2 || !isWordChar(sql.charAt(start - 2));
            char prefix = Character.toUpperCase(sql.charAt(start - 1));
            if (!standalonePrefix || prefix != 'N') {
                // X'..', B'..', E'..' and charset introducers are rendered by Druid
                return end;
            }
            national = true;
            tokenStart = start - 1;
        }
        strings.add(new Token(sql.substring(tokenStart, end), null, value.toString(), national));
        return end;
    }

    private static String unescape(char escaped) {
        switch (escaped) {
            case '0':
                return "\0";
            case 'b':
                return "\b";
            case 'n':
                return "\n";
            case 'r':
                return "\r";
            case 't':
                return "\t";
            case 'Z':
                return "\u001A";
            case '%':
                return "\\%";
            case '_':
                return "\\_";
            default:
                return String.valueOf(escaped);
        }
    }

    private int closing(int start, char close) {
        int i = start + 1;
        int n = sql.length();
        while (i < n) {
            if (sql.charAt(i) == close) {
                if (i + 1 < n && sql.charAt(i + 1) == close) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return n;
    }

    private int number(int start, boolean record) {
        int n = sql.length();
        int i = start;
        while (i < n && isDigit(sql.charAt(i))) {
            i++;
        }
        if (i < n && sql.charAt(i) == '.') {
            i++;
            while (i < n && isDigit(sql.charAt(i))) {
                i++;
            }
        }
        if (i < n && (sql.charAt(i) == 'e' || sql.charAt(i) == 'E')) {
            int exponent = i + 1;
            if (exponent < n && (sql.charAt(exponent) == '+' || sql.charAt(exponent) == '-')) {
                exponent++;
            }
            if (exponent < n && isDigit(sql.charAt(exponent))) {
                i = exponent;
                while (i < n && isDigit(sql.charAt(i))) {
                    i++;
                }
            }
        }
        boolean partOfWord = start > 0 && isWordChar(sql.charAt(start - 1));
        if (partOfWord || (i < n && isWordChar(sql.charAt(i)))) {
            // 0x1F, 1abc and t1 are not numbers
            while (i < n && isWordChar(sql.charAt(i))) {
                i++;
            }
            return i;
        }
        String text = sql.substring(start, i);
        if (record) {
            numbers.add(new Token(text, new BigDecimal(text), null, false));
        }
        return i;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    /**
     * Take the first unused numeric token equal to {@code value}. A negative
     * value matches its absolute value and gets the sign prepended, because
     * Druid folds a leading minus into the literal.
     *
     * @return the source spelling, or {@code null} if no token matches
     */
    public String takeNumber(Number value) {
        BigDecimal decimal = toBigDecimal(value);
        if (decimal == null) {
            return null;
        }
        boolean negative = decimal.signum() < 0;
        BigDecimal magnitude = decimal.abs();
        for (Token token : numbers) {
            if (!token.taken && token.number.compareTo(magnitude) == 0) {
                token.taken = true;
                return negative ? "-" + token.text : token.text;
            }
        }
        return null;
    }

    private static BigDecimal toBigDecimal(Number value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(value.longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            return Double.isNaN(d) || Double.isInfinite(d) ? null : BigDecimal.valueOf(d);
        }
        return null;
    }

    /**
     * Take the first unused string token with the given unescaped value.
     *
     * @return the quoted source spelling, or {@code null} if no token matches
     */
    public String takeString(String value, boolean national) {
        for (Token token : strings) {
            if (!token.taken && token.national == national && token.value.equals(value)) {
                token.taken = true;
                return token.text;
            }
        }
        return null;
    }

    /**
     * @return the first top level keyword of the first statement, upper case, or {@code null}
     */
    public String firstWord() {
        return topLevelWords.isEmpty() ? null : topLevelWords.get(0);
    }

    /**
     * @return the offset of the first top level occurrence of {@code word} in the
     *         first statement, or -1
     */
    public int indexOfTopLevelWord(String word) {
        int index = topLevelWords.indexOf(word.toUpperCase(Locale.ROOT));
        return index < 0 ? -1 : topLevelWordStarts.get(index);
    }

    /**
     * @return the offset of the semicolon ending the first statement, or the input length
     */
    public int getStatementEnd() {
        return statementEnd;
    }

    public String getSql() {
        return sql;
    }
}
