package io.github.cyfko.proplogic.core.parsing;

import io.github.cyfko.proplogic.core.api.And;
import io.github.cyfko.proplogic.core.api.Atomic;
import io.github.cyfko.proplogic.core.api.Formula;
import io.github.cyfko.proplogic.core.api.Iff;
import io.github.cyfko.proplogic.core.api.Implies;
import io.github.cyfko.proplogic.core.api.Not;
import io.github.cyfko.proplogic.core.api.Or;
import io.github.cyfko.proplogic.core.config.ParserPolicy;
import io.github.cyfko.proplogic.core.exception.FormulaLexException;
import io.github.cyfko.proplogic.core.exception.FormulaParseException;
import io.github.cyfko.proplogic.core.exception.FormulaSyntaxException;

import java.util.Objects;

/**
 * LL(1) recursive-descent parser turning formula text into a {@link Formula} tree.
 * <p>
 * One method per grammar rule, one token of lookahead held in {@link #current}:
 * </p>
 * <pre>
 * bic  := cond ("&lt;-&gt;" bic)?      right-associative
 * cond := disj ("-&gt;" cond)?       right-associative
 * disj := conj ("|" conj)*         left-associative
 * conj := neg ("&amp;" neg)*          left-associative
 * neg  := "~" neg | unit
 * unit := IDENT | "(" bic ")"
 * </pre>
 *
 * <p><strong>Examples:</strong></p>
 * <pre>
 * p &amp; q | r       →  Or(And(p, q), r)
 * p | q | r       →  Or(Or(p, q), r)
 * p -&gt; q -&gt; r     →  Implies(p, Implies(q, r))
 * ~~p &amp; q         →  And(Not(Not(p)), q)
 * </pre>
 *
 * <p>
 * Recursion depth (parentheses, negations and chains of {@code ->}/{@code <->}) is bounded by
 * {@link ParserPolicy#maxNestingDepth()}. A parser instance is single-use and not thread-safe.
 * </p>
 *
 * @author PropLogic Team
 * @since 1.0.0
 */
public final class RecursiveDescentParser {

    private final String text;
    private final FormulaLexer lexer;
    private final ParserPolicy policy;

    private Token current;
    private int depth;

    public RecursiveDescentParser(String text, ParserPolicy policy) {
        this.text = Objects.requireNonNull(text, "Formula text cannot be null");
        this.policy = Objects.requireNonNull(policy, "Parser policy is required");
        this.lexer = new FormulaLexer(text);
    }

    /**
     * Parses the whole input as a single formula.
     *
     * @return the formula tree
     * @throws FormulaLexException   if the text cannot be tokenized
     * @throws FormulaParseException if the tokens do not form exactly one formula
     * @throws FormulaSyntaxException if the policy limits are exceeded
     */
    public Formula parseFormula() {
        if (text.length() > policy.maxExpressionLength()) {
            throw new FormulaSyntaxException(String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    text.length(), policy.maxExpressionLength(), policy.policyName()
            ));
        }

        advance();
        Formula formula = bic();
        if (current != null) {
            throw FormulaParseException.unexpectedToken(current.lexeme(), current.position());
        }
        return formula;
    }

    private Formula bic() {
        Formula left = cond();
        if (at(TokenType.IFF)) {
            advance();
            enter();
            Formula right = bic();
            depth--;
            return new Iff(left, right);
        }
        return left;
    }

    private Formula cond() {
        Formula left = disj();
        if (at(TokenType.IMPLIES)) {
            advance();
            enter();
            Formula right = cond();
            depth--;
            return new Implies(left, right);
        }
        return left;
    }

    private Formula disj() {
        Formula result = conj();
        while (at(TokenType.OR)) {
            advance();
            result = new Or(result, conj());
        }
        return result;
    }

    private Formula conj() {
        Formula result = neg();
        while (at(TokenType.AND)) {
            advance();
            result = new And(result, neg());
        }
        return result;
    }

    private Formula neg() {
        if (at(TokenType.NOT)) {
            advance();
            enter();
            Formula operand = neg();
            depth--;
            return new Not(operand);
        }
        return unit();
    }

    private Formula unit() {
        if (at(TokenType.IDENT)) {
            Formula atomic = new Atomic(current.lexeme());
            advance();
            return atomic;
        }

        if (at(TokenType.LPAREN)) {
            advance();
            enter();
            Formula inner = bic();
            depth--;
            if (at(TokenType.RPAREN)) {
                advance();
                return inner;
            }
            // missing ')': fall through to report what was found instead
        }

        if (current == null) {
            throw FormulaParseException.unexpectedEndOfInput(text.length());
        }
        throw FormulaParseException.unexpectedToken(current.lexeme(), current.position());
    }

    private boolean at(TokenType type) {
        return current != null && current.type() == type;
    }

    private void advance() {
        current = lexer.next();
    }

    private void enter() {
        if (++depth > policy.maxNestingDepth()) {
            throw new FormulaSyntaxException(String.format(
                    "Expression nested too deeply (max depth: %d). Policy applied: %s",
                    policy.maxNestingDepth(), policy.policyName()
            ), current == null ? text.length() : current.position());
        }
    }
}
