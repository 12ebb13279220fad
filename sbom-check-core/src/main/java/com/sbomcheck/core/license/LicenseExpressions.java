package com.sbomcheck.core.license;

import com.sbomcheck.parser.SpdxLicenseLexer;
import com.sbomcheck.parser.SpdxLicenseParser;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import java.util.Locale;

/**
 * Parses SPDX license expressions with the ANTLR-generated {@code SpdxLicense} grammar.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * LicenseExpression expression = LicenseExpressions.parse("(MIT OR Apache-2.0) AND LicenseRef-Foo");
 * expression.licenseIds();   // [MIT, Apache-2.0]
 * expression.licenseRefs();  // [LicenseRef-Foo]
 * }</pre>
 *
 * <p>Identifiers are checked for grammar only, not against the SPDX license list.
 */
public final class LicenseExpressions {

    public static final String NONE = "NONE";
    public static final String NOASSERTION = "NOASSERTION";

    /** Deepest parenthesis nesting accepted. */
    public static final int MAX_NESTING = 100;

    private LicenseExpressions() {
    }

    /**
     * Parses an expression.
     *
     * @param text expression text, {@code NONE} or {@code NOASSERTION}
     * @return identifiers mentioned by the expression
     * @throws LicenseExpressionException if the text is not a valid expression
     */
    public static LicenseExpression parse(String text) {
        if (text == null) {
            throw new LicenseExpressionException("", 0, "expression is missing");
        }
        if (isPlaceholder(text)) {
            return LicenseExpression.placeholder(text);
        }

        checkNesting(text);

        IdentifierCollector collector = new IdentifierCollector();
        try {
            ThrowingErrorListener errorListener = new ThrowingErrorListener(text);

            SpdxLicenseLexer lexer = new SpdxLicenseLexer(CharStreams.fromString(text));
            lexer.removeErrorListeners();
            lexer.addErrorListener(errorListener);

            SpdxLicenseParser parser = new SpdxLicenseParser(new CommonTokenStream(lexer));
            parser.removeErrorListeners();
            parser.addErrorListener(errorListener);

            collector.visit(parser.licenseExpression());
        } catch (StackOverflowError e) {
            throw new LicenseExpressionException(text, 0, "expression is nested too deeply");
        }

        return new LicenseExpression(
            text,
            collector.licenseIds,
            collector.licenseRefs,
            collector.externalLicenseRefs,
            collector.exceptionIds,
            false
        );
    }

    /**
     * Returns true if the value is {@code NONE} or {@code NOASSERTION}, ignoring surrounding blanks.
     *
     * @param value value to test
     * @return true for a placeholder value
     */
    public static boolean isPlaceholder(String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        return NONE.equals(trimmed) || NOASSERTION.equals(trimmed);
    }

    /**
     * Returns true if the value is {@code NONE} or {@code NOASSERTION} in any letter case.
     *
     * @param value value to test
     * @return true for a placeholder value regardless of case
     */
    public static boolean isPlaceholderIgnoreCase(String value) {
        return value != null && isPlaceholder(value.toUpperCase(Locale.ROOT));
    }

    private static void checkNesting(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
                if (depth > MAX_NESTING) {
                    throw new LicenseExpressionException(text, i,
                        "parentheses nested deeper than " + MAX_NESTING + " levels");
                }
            } else if (c == ')') {
                depth--;
            }
        }
    }

    private static final class ThrowingErrorListener extends BaseErrorListener {

        private final String text;

        private ThrowingErrorListener(String text) {
            this.text = text;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new LicenseExpressionException(text, charPositionInLine, msg);
        }
    }
}
