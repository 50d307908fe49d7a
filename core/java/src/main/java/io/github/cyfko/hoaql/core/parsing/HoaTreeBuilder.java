package io.github.cyfko.hoaql.core.parsing;

import io.github.cyfko.hoaql.core.exception.AcceptanceSetMismatchException;
import io.github.cyfko.hoaql.core.exception.DuplicateAliasException;
import io.github.cyfko.hoaql.core.exception.DuplicateHeaderException;
import io.github.cyfko.hoaql.core.exception.DuplicatePropositionException;
import io.github.cyfko.hoaql.core.exception.DuplicateStateException;
import io.github.cyfko.hoaql.core.exception.HoaSyntaxException;
import io.github.cyfko.hoaql.core.exception.MissingHeaderException;
import io.github.cyfko.hoaql.core.exception.PropositionCountException;
import io.github.cyfko.hoaql.core.exception.UndefinedAliasException;
import io.github.cyfko.hoaql.core.formula.AcceptanceAtom;
import io.github.cyfko.hoaql.core.formula.AcceptanceCondition;
import io.github.cyfko.hoaql.core.formula.AcceptanceConditions;
import io.github.cyfko.hoaql.core.formula.AtomType;
import io.github.cyfko.hoaql.core.formula.BooleanConstant;
import io.github.cyfko.hoaql.core.formula.LabelAlias;
import io.github.cyfko.hoaql.core.formula.LabelExpression;
import io.github.cyfko.hoaql.core.formula.LabelExpressions;
import io.github.cyfko.hoaql.core.grammar.HoafBaseVisitor;
import io.github.cyfko.hoaql.core.grammar.HoafParser;
import io.github.cyfko.hoaql.core.model.Acceptance;
import io.github.cyfko.hoaql.core.model.AliasName;
import io.github.cyfko.hoaql.core.model.Automaton;
import io.github.cyfko.hoaql.core.model.Body;
import io.github.cyfko.hoaql.core.model.Edge;
import io.github.cyfko.hoaql.core.model.Header;
import io.github.cyfko.hoaql.core.model.HeaderValue;
import io.github.cyfko.hoaql.core.model.Identifier;
import io.github.cyfko.hoaql.core.model.State;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.logging.Logger;

/**
 * Reduces an HOA parse tree into an {@link Automaton}, enforcing the semantic rules the
 * grammar cannot express.
 *
 * <h2>Rules Enforced</h2>
 * <ul>
 *   <li>{@code States:}, {@code Acceptance:}, {@code acc-name:}, {@code tool:}, {@code name:} and
 *       every custom header appear at most once</li>
 *   <li>{@code Acceptance:} is present and its count matches the sets used by its condition</li>
 *   <li>{@code AP:} lists as many distinct names as it announces</li>
 *   <li>aliases are defined once, before any reference to them</li>
 *   <li>every body state is declared once and edges follow a {@code State:} line</li>
 * </ul>
 *
 * <p>
 * A builder holds the alias table and the current-state cursor of one document, so a new
 * instance is required for every parse. Instances are not thread-safe.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class HoaTreeBuilder {

    private static final Logger log = Logger.getLogger(HoaTreeBuilder.class.getName());

    private final Map<AliasName, LabelAlias> aliases = new LinkedHashMap<>();
    private final Set<String> singularHeaders = new HashSet<>();
    private final Header.Builder header = Header.builder();
    private final LabelBuilder labelBuilder = new LabelBuilder();
    private final AcceptanceBuilder acceptanceBuilder = new AcceptanceBuilder();

    private boolean used;

    /**
     * Builds the automaton described by {@code tree}.
     *
     * @param tree the root of a successful parse
     * @return the automaton
     * @throws IllegalStateException if this builder was already used
     */
    public Automaton build(HoafParser.AutomatonContext tree) {
        if (used) {
            throw new IllegalStateException("HoaTreeBuilder instances are single-use");
        }
        used = true;

        return new Automaton(buildHeader(tree.header()), buildBody(tree.body()));
    }

    // ------------------------------------------------------------------ header

    private Header buildHeader(HoafParser.HeaderContext ctx) {
        header.formatVersion(new Identifier(ctx.formatVersion().IDENTIFIER().getText()));

        HeaderItemReducer reducer = new HeaderItemReducer();
        for (HoafParser.HeaderItemContext item : ctx.headerItem()) {
            reducer.visit(item);
        }

        if (reducer.acceptanceCondition == null) {
            throw new MissingHeaderException("Acceptance:");
        }
        header.acceptance(new Acceptance(reducer.acceptanceCondition, reducer.accName, reducer.accNameParameters));
        return header.build();
    }

    /**
     * Records a header that may appear only once.
     */
    private void once(String headerName) {
        if (!singularHeaders.add(headerName)) {
            throw new DuplicateHeaderException(headerName);
        }
    }

    private final class HeaderItemReducer extends HoafBaseVisitor<Void> {

        private AcceptanceCondition acceptanceCondition;
        private Identifier accName;
        private final List<HeaderValue> accNameParameters = new ArrayList<>();

        @Override
        public Void visitStatesHeader(HoafParser.StatesHeaderContext ctx) {
            once(ctx.STATES().getText());
            header.states(toInt(ctx.INT()));
            return null;
        }

        @Override
        public Void visitStartHeader(HoafParser.StartHeaderContext ctx) {
            header.startStates(stateConjunction(ctx.stateConj()));
            return null;
        }

        @Override
        public Void visitApHeader(HoafParser.ApHeaderContext ctx) {
            once(ctx.AP().getText());
            int declared = toInt(ctx.INT());
            List<String> names = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (TerminalNode string : ctx.STRING()) {
                String name = unquote(string);
                if (!seen.add(name)) {
                    throw new DuplicatePropositionException(name);
                }
                names.add(name);
            }
            if (declared != names.size()) {
                throw new PropositionCountException(declared, names.size());
            }
            header.propositions(names);
            return null;
        }

        @Override
        public Void visitAliasHeader(HoafParser.AliasHeaderContext ctx) {
            AliasName name = new AliasName(ctx.ANAME().getText());
            if (aliases.containsKey(name)) {
                throw new DuplicateAliasException(name.value());
            }
            LabelAlias alias = LabelAlias.of(name, labelBuilder.visit(ctx.labelExpr()));
            aliases.put(name, alias);
            header.alias(alias);
            log.fine(() -> String.format("Bound alias %s to %s", name, alias.expression()));
            return null;
        }

        @Override
        public Void visitAcceptanceHeader(HoafParser.AcceptanceHeaderContext ctx) {
            once(ctx.ACCEPTANCE().getText());
            int declared = toInt(ctx.INT());
            AcceptanceCondition condition = acceptanceBuilder.visit(ctx.acceptanceCond());
            SortedSet<Integer> sets = AcceptanceConditions.acceptingSets(condition);
            if (sets.size() != declared || (declared > 0 && sets.last() != declared - 1)) {
                throw new AcceptanceSetMismatchException(declared, sets);
            }
            acceptanceCondition = condition;
            return null;
        }

        @Override
        public Void visitAccNameHeader(HoafParser.AccNameHeaderContext ctx) {
            once(ctx.ACC_NAME().getText());
            accName = new Identifier(ctx.IDENTIFIER().getText());
            for (HoafParser.AccNameParameterContext parameter : ctx.accNameParameter()) {
                accNameParameters.add(toHeaderValue(parameter.BOOLEAN(), parameter.INT(), null, parameter.IDENTIFIER()));
            }
            return null;
        }

        @Override
        public Void visitToolHeader(HoafParser.ToolHeaderContext ctx) {
            once(ctx.TOOL().getText());
            List<TerminalNode> strings = ctx.STRING();
            if (strings.size() == 1) {
                header.tool(unquote(strings.get(0)));
            } else {
                header.tool(unquote(strings.get(0)), unquote(strings.get(1)));
            }
            return null;
        }

        @Override
        public Void visitNameHeader(HoafParser.NameHeaderContext ctx) {
            once(ctx.NAME().getText());
            header.name(unquote(ctx.STRING()));
            return null;
        }

        @Override
        public Void visitPropertiesHeader(HoafParser.PropertiesHeaderContext ctx) {
            for (TerminalNode property : ctx.IDENTIFIER()) {
                header.property(new Identifier(property.getText()));
            }
            return null;
        }

        @Override
        public Void visitCustomHeader(HoafParser.CustomHeaderContext ctx) {
            String headerName = ctx.HEADERNAME().getText();
            once(headerName);
            if (Character.isUpperCase(headerName.charAt(0))) {
                log.warning(() -> String.format(
                        "Unsupported header '%s' at line %d may change the semantics of the automaton",
                        headerName, ctx.getStart().getLine()));
            }
            List<HeaderValue> values = new ArrayList<>();
            for (HoafParser.HeaderValueContext value : ctx.headerValue()) {
                values.add(toHeaderValue(value.BOOLEAN(), value.INT(), value.STRING(), value.IDENTIFIER()));
            }
            header.customHeader(headerName.substring(0, headerName.length() - 1), values);
            return null;
        }
    }

    // ------------------------------------------------------------------ body

    private Body buildBody(HoafParser.BodyContext ctx) {
        Map<State, List<Edge>> edges = new LinkedHashMap<>();
        Set<Integer> declared = new HashSet<>();
        List<Edge> current = null;

        for (HoafParser.BodyItemContext item : ctx.bodyItem()) {
            if (item.stateName() != null) {
                State state = state(item.stateName());
                if (!declared.add(state.index())) {
                    throw new DuplicateStateException(state.index());
                }
                current = new ArrayList<>();
                edges.put(state, current);
            } else {
                if (current == null) {
                    Token start = item.getStart();
                    throw new HoaSyntaxException(start.getLine(), start.getCharPositionInLine(),
                            "edge found before any 'State:' line");
                }
                current.add(edge(item.edge()));
            }
        }

        log.fine(() -> String.format("Read %d states", edges.size()));
        return new Body(edges);
    }

    private State state(HoafParser.StateNameContext ctx) {
        return new State(
                toInt(ctx.INT()),
                ctx.label() == null ? null : labelBuilder.visit(ctx.label().labelExpr()),
                ctx.STRING() == null ? null : unquote(ctx.STRING()),
                ctx.accSig() == null ? null : accSig(ctx.accSig()));
    }

    private Edge edge(HoafParser.EdgeContext ctx) {
        return new Edge(
                stateConjunction(ctx.stateConj()),
                ctx.label() == null ? null : labelBuilder.visit(ctx.label().labelExpr()),
                ctx.accSig() == null ? null : accSig(ctx.accSig()));
    }

    private Set<Integer> accSig(HoafParser.AccSigContext ctx) {
        Set<Integer> sets = new LinkedHashSet<>();
        ctx.INT().forEach(set -> sets.add(toInt(set)));
        return sets;
    }

    /**
     * Flattens {@code 0 & 1 & 2} into one sequence, in file order.
     */
    private List<Integer> stateConjunction(HoafParser.StateConjContext ctx) {
        List<Integer> states = new ArrayList<>();
        ctx.INT().forEach(state -> states.add(toInt(state)));
        return states;
    }

    // ------------------------------------------------------------------ formulas

    private final class LabelBuilder extends HoafBaseVisitor<LabelExpression> {

        @Override
        public LabelExpression visitBooleanLabelExpr(HoafParser.BooleanLabelExprContext ctx) {
            return toConstant(ctx.BOOLEAN());
        }

        @Override
        public LabelExpression visitAtomLabelExpr(HoafParser.AtomLabelExprContext ctx) {
            return LabelExpressions.atom(toInt(ctx.INT()));
        }

        @Override
        public LabelExpression visitAliasLabelExpr(HoafParser.AliasLabelExprContext ctx) {
            AliasName name = new AliasName(ctx.ANAME().getText());
            LabelAlias alias = aliases.get(name);
            if (alias == null) {
                throw new UndefinedAliasException(name.value());
            }
            return alias;
        }

        @Override
        public LabelExpression visitNotLabelExpr(HoafParser.NotLabelExprContext ctx) {
            return LabelExpressions.not(visit(ctx.labelExpr()));
        }

        @Override
        public LabelExpression visitParenLabelExpr(HoafParser.ParenLabelExprContext ctx) {
            return visit(ctx.labelExpr());
        }

        @Override
        public LabelExpression visitAndLabelExpr(HoafParser.AndLabelExprContext ctx) {
            return LabelExpressions.and(visit(ctx.labelExpr(0)), visit(ctx.labelExpr(1)));
        }

        @Override
        public LabelExpression visitOrLabelExpr(HoafParser.OrLabelExprContext ctx) {
            return LabelExpressions.or(visit(ctx.labelExpr(0)), visit(ctx.labelExpr(1)));
        }
    }

    private final class AcceptanceBuilder extends HoafBaseVisitor<AcceptanceCondition> {

        @Override
        public AcceptanceCondition visitAtomAcceptanceCond(HoafParser.AtomAcceptanceCondContext ctx) {
            String keyword = ctx.IDENTIFIER().getText();
            AtomType type = AtomType.fromKeyword(keyword).orElseThrow(() -> syntaxError(ctx,
                    "unknown acceptance atom '" + keyword + "', expected Fin or Inf"));
            return new AcceptanceAtom(type, toInt(ctx.INT()), ctx.NOT() != null);
        }

        @Override
        public AcceptanceCondition visitBooleanAcceptanceCond(HoafParser.BooleanAcceptanceCondContext ctx) {
            return toConstant(ctx.BOOLEAN());
        }

        @Override
        public AcceptanceCondition visitParenAcceptanceCond(HoafParser.ParenAcceptanceCondContext ctx) {
            return visit(ctx.acceptanceCond());
        }

        @Override
        public AcceptanceCondition visitAndAcceptanceCond(HoafParser.AndAcceptanceCondContext ctx) {
            return AcceptanceConditions.and(visit(ctx.acceptanceCond(0)), visit(ctx.acceptanceCond(1)));
        }

        @Override
        public AcceptanceCondition visitOrAcceptanceCond(HoafParser.OrAcceptanceCondContext ctx) {
            return AcceptanceConditions.or(visit(ctx.acceptanceCond(0)), visit(ctx.acceptanceCond(1)));
        }
    }

    // ------------------------------------------------------------------ tokens

    private static HeaderValue toHeaderValue(TerminalNode bool, TerminalNode integer,
                                             TerminalNode string, TerminalNode identifier) {
        if (bool != null) {
            return HeaderValue.of(toConstant(bool) == BooleanConstant.TRUE);
        }
        if (integer != null) {
            return HeaderValue.of(toInt(integer));
        }
        if (string != null) {
            return HeaderValue.string(unquote(string));
        }
        return HeaderValue.identifier(identifier.getText());
    }

    private static BooleanConstant toConstant(TerminalNode bool) {
        return BooleanConstant.of(BooleanConstant.TRUE.symbol().equals(bool.getText()));
    }

    private static int toInt(TerminalNode node) {
        try {
            return Integer.parseInt(node.getText());
        } catch (NumberFormatException e) {
            Token token = node.getSymbol();
            throw new HoaSyntaxException(token.getLine(), token.getCharPositionInLine(),
                    "integer out of range: " + node.getText());
        }
    }

    private static String unquote(TerminalNode string) {
        String text = string.getText();
        return text.substring(1, text.length() - 1);
    }

    private static HoaSyntaxException syntaxError(ParserRuleContext ctx, String message) {
        Token start = ctx.getStart();
        return new HoaSyntaxException(start.getLine(), start.getCharPositionInLine(), message);
    }
}
