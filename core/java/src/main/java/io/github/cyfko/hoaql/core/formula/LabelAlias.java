package io.github.cyfko.hoaql.core.formula;

import io.github.cyfko.hoaql.core.exception.UnresolvedAliasException;
import io.github.cyfko.hoaql.core.model.AliasName;

import java.util.Objects;
import java.util.Optional;

/**
 * A named label sub-expression ({@code @name}).
 * <p>
 * The same value represents both the {@code Alias:} header declaration and every reference to
 * it inside labels: a reference carries the alias name together with the expression it was
 * bound to when the document was parsed. Printing a reference only emits the name.
 * </p>
 *
 * <p>
 * An alias built with {@link #unresolved(AliasName)} has no expression; folds that need to look
 * through it, such as {@link LabelExpressions#propositions(LabelExpression)}, fail with
 * {@link UnresolvedAliasException}. The parser never produces such a value.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class LabelAlias implements LabelExpression {

    private final AliasName name;
    private final LabelExpression expression;

    private LabelAlias(AliasName name, LabelExpression expression) {
        this.name = Objects.requireNonNull(name, "Alias name is required");
        this.expression = expression;
    }

    /**
     * Binds {@code name} to {@code expression}.
     *
     * @param name       the alias name, including its {@code @}
     * @param expression the resolved expression
     * @return the bound alias
     */
    public static LabelAlias of(AliasName name, LabelExpression expression) {
        return new LabelAlias(name, Objects.requireNonNull(expression, "Alias expression is required"));
    }

    /**
     * Creates a dangling reference to {@code name}.
     */
    public static LabelAlias unresolved(AliasName name) {
        return new LabelAlias(name, null);
    }

    public AliasName name() {
        return name;
    }

    /**
     * Returns the bound expression.
     *
     * @return the expression this alias stands for
     * @throws UnresolvedAliasException if the alias was never bound
     */
    public LabelExpression expression() {
        if (expression == null) {
            throw new UnresolvedAliasException(name.value());
        }
        return expression;
    }

    /**
     * Returns the bound expression, or empty for a dangling reference.
     */
    public Optional<LabelExpression> resolved() {
        return Optional.ofNullable(expression);
    }

    public boolean isResolved() {
        return expression != null;
    }

    @Override
    public <R> R accept(LabelVisitor<R> visitor) {
        return visitor.visitAlias(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LabelAlias)) return false;
        LabelAlias other = (LabelAlias) o;
        return name.equals(other.name) && Objects.equals(expression, other.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, expression);
    }

    @Override
    public String toString() {
        return FormulaRenderer.renderLabel(this);
    }
}
