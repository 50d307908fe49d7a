package io.github.cyfko.hoaql.core.parsing;

import io.github.cyfko.hoaql.core.exception.HoaSyntaxException;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * ANTLR error listener that aborts on the first lexer or parser error.
 * <p>
 * Replaces the default console listener so that grammar errors surface as
 * {@link HoaSyntaxException} carrying the offending position.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ThrowingErrorListener extends BaseErrorListener {

    public static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    private ThrowingErrorListener() {}

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg, RecognitionException e) {
        throw new HoaSyntaxException(line, charPositionInLine, msg);
    }
}
