package io.github.cyfko.hoaql.core.impl;

import io.github.cyfko.hoaql.core.api.HoaParser;
import io.github.cyfko.hoaql.core.config.HoaPolicy;
import io.github.cyfko.hoaql.core.exception.HoaParseException;
import io.github.cyfko.hoaql.core.exception.HoaSyntaxException;
import io.github.cyfko.hoaql.core.exception.InvalidTokenException;
import io.github.cyfko.hoaql.core.grammar.HoafLexer;
import io.github.cyfko.hoaql.core.grammar.HoafParser;
import io.github.cyfko.hoaql.core.model.Automaton;
import io.github.cyfko.hoaql.core.parsing.HoaTreeBuilder;
import io.github.cyfko.hoaql.core.parsing.ThrowingErrorListener;
import io.github.cyfko.hoaql.core.utils.ReferenceValidationUtils;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;

import java.util.logging.Logger;

/**
 * Grammar-driven implementation of {@link HoaParser}.
 * <p>
 * Parsing runs in three phases:
 * </p>
 * <ol>
 *   <li><strong>Input checks</strong>: rejects null, blank and over-long documents according
 *       to the {@link HoaPolicy}</li>
 *   <li><strong>Grammar</strong>: the generated {@link HoafLexer} and {@link HoafParser} build a
 *       parse tree; the first lexer or parser error aborts with a {@link HoaSyntaxException}</li>
 *   <li><strong>Reduction</strong>: a fresh {@link HoaTreeBuilder} turns the tree into an
 *       {@link Automaton}, enforcing the semantic rules of the format, then the optional
 *       reference checks of {@link ReferenceValidationUtils} run</li>
 * </ol>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * // Default configuration
 * HoaParser parser = new BasicHoaParser();
 * Automaton automaton = parser.parse(text);
 *
 * // Strict configuration (index bounds are checked)
 * HoaParser strictParser = new BasicHoaParser(HoaPolicy.strict());
 * }</pre>
 *
 * <p>Instances hold no per-document state and can be shared between threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicHoaParser implements HoaParser {

    private static final Logger log = Logger.getLogger(BasicHoaParser.class.getName());

    private final HoaPolicy policy;

    /**
     * Default constructor using {@link HoaPolicy#defaults()}.
     */
    public BasicHoaParser() {
        this(HoaPolicy.defaults());
    }

    /**
     * Constructor with custom configuration.
     *
     * @param policy the parser configuration
     * @throws IllegalArgumentException if policy is null
     */
    public BasicHoaParser(HoaPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("HOA policy is required");
        }
        this.policy = policy;
    }

    public HoaPolicy getPolicy() {
        return policy;
    }

    /**
     * {@inheritDoc}
     *
     * @throws HoaSyntaxException     if the text is null, blank, longer than
     *                                {@link HoaPolicy#maxDocumentLength()} or not grammatical
     * @throws HoaParseException      for any semantic violation
     */
    @Override
    public Automaton parse(String text) throws HoaParseException {
        if (text == null || text.isBlank()) {
            throw new HoaSyntaxException("HOA document cannot be null or blank");
        }
        if (text.length() > policy.maxDocumentLength()) {
            throw new HoaSyntaxException(String.format(
                    "HOA document exceeds maximum length of %d characters (got %d) under policy %s",
                    policy.maxDocumentLength(), text.length(), policy.policyName()));
        }

        log.fine(() -> String.format("Parsing HOA document of %d characters", text.length()));

        HoafLexer lexer = new HoafLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        HoafParser parser = new HoafParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        Automaton automaton = reduce(parser.automaton());
        if (policy.validateReferences()) {
            ReferenceValidationUtils.validateReferences(automaton);
        }

        log.fine(() -> String.format("Parsed automaton with %d states and %d propositions",
                automaton.body().edges().size(), automaton.header().propositions().size()));
        return automaton;
    }

    private static Automaton reduce(HoafParser.AutomatonContext tree) {
        try {
            return new HoaTreeBuilder().build(tree);
        } catch (InvalidTokenException e) {
            throw new HoaSyntaxException(e.getMessage(), e);
        }
    }
}
