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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link RecursiveDescentParser}: grammar, precedence, associativity and errors.
 */
@DisplayName("RecursiveDescentParser Tests")
class RecursiveDescentParserTest {

    private static final Atomic P = new Atomic("p");
    private static final Atomic Q = new Atomic("q");
    private static final Atomic R = new Atomic("r");

    private static Formula parse(String text) {
        return new RecursiveDescentParser(text, ParserPolicy.defaults()).parseFormula();
    }

    @Nested
    @DisplayName("Valid Expressions")
    class ValidExpressions {

        @Test
        @DisplayName("Single identifier")
        void testIdentifier() {
            assertEquals(P, parse("p"));
            assertEquals(new Atomic("Some_Var2"), parse("  Some_Var2\n"));
        }

        @Test
        @DisplayName("Each connective")
        void testConnectives() {
            assertEquals(new Not(P), parse("~p"));
            assertEquals(new And(P, Q), parse("p & q"));
            assertEquals(new Or(P, Q), parse("p | q"));
            assertEquals(new Implies(P, Q), parse("p -> q"));
            assertEquals(new Iff(P, Q), parse("p <-> q"));
        }

        @Test
        @DisplayName("Whitespace is optional")
        void testCompact() {
            assertEquals(parse("p & q -> ~r"), parse("p&q->~r"));
        }

        @Test
        @DisplayName("Redundant parentheses disappear")
        void testParentheses() {
            assertEquals(P, parse("(p)"));
            assertEquals(P, parse("((((p))))"));
            assertEquals(new And(P, Q), parse("((p) & (q))"));
        }

        @Test
        @DisplayName("Negation applies to the tightest unit")
        void testNegation() {
            assertEquals(new Not(new Not(P)), parse("~~p"));
            assertEquals(new And(new Not(P), Q), parse("~p & q"));
            assertEquals(new Not(new And(P, Q)), parse("~(p & q)"));
        }
    }

    @Nested
    @DisplayName("Precedence and associativity")
    class Precedence {

        @Test
        @DisplayName("& binds tighter than |")
        void testAndOverOr() {
            Formula formula = parse("p & q | r");
            assertEquals(new Or(new And(P, Q), R), formula);
            assertEquals("((p & q) | r)", formula.toString());
            assertEquals(new Or(P, new And(Q, R)), parse("p | q & r"));
        }

        @Test
        @DisplayName("| binds tighter than ->")
        void testOrOverImplies() {
            assertEquals(new Implies(new Or(P, Q), R), parse("p | q -> r"));
        }

        @Test
        @DisplayName("-> binds tighter than <->")
        void testImpliesOverIff() {
            assertEquals(new Iff(new Implies(P, Q), R), parse("p -> q <-> r"));
            assertEquals(new Iff(P, new Implies(Q, R)), parse("p <-> q -> r"));
        }

        @Test
        @DisplayName("& and | are left-associative")
        void testLeftAssociative() {
            assertEquals(new And(new And(P, Q), R), parse("p & q & r"));
            assertEquals(new Or(new Or(P, Q), R), parse("p | q | r"));
        }

        @Test
        @DisplayName("-> and <-> are right-associative")
        void testRightAssociative() {
            assertEquals(new Implies(P, new Implies(Q, R)), parse("p -> q -> r"));
            assertEquals(new Iff(P, new Iff(Q, R)), parse("p <-> q <-> r"));
        }

        @Test
        @DisplayName("Parentheses override precedence")
        void testOverride() {
            assertEquals(new And(P, new Or(Q, R)), parse("p & (q | r)"));
            assertEquals(new Implies(new Implies(P, Q), R), parse("(p -> q) -> r"));
        }
    }

    @Nested
    @DisplayName("Invalid Expressions")
    class InvalidExpressions {

        @ParameterizedTest
        @ValueSource(strings = {"", " ", " \t\f\r\n", "p &", "~", "(p", "(p & q", "p ->", "p <-> ", "((p)"})
        @DisplayName("Premature end fails with UNEXPECTED_END_OF_INPUT")
        void testUnexpectedEnd(String text) {
            FormulaParseException e = assertThrows(FormulaParseException.class, () -> parse(text));
            assertEquals(FormulaParseException.Reason.UNEXPECTED_END_OF_INPUT, e.getReason());
            assertNull(e.getLexeme());
            assertEquals(text.length(), e.getPosition());
        }

        @ParameterizedTest
        @CsvSource({
                "'p)',       ')', 1",
                "')',        ')', 0",
                "'& p',      '&', 0",
                "'p & & q',  '&', 4",
                "'p q',      'q', 2",
                "'(p q)',    'q', 3",
                "'()',       ')', 1",
                "'~)',       ')', 1",
                "'p -> <-> q', '<->', 5",
                "'(p))',     ')', 3"
        })
        @DisplayName("Misplaced tokens fail with UNEXPECTED_TOKEN")
        void testUnexpectedToken(String text, String lexeme, int position) {
            FormulaParseException e = assertThrows(FormulaParseException.class, () -> parse(text));
            assertEquals(FormulaParseException.Reason.UNEXPECTED_TOKEN, e.getReason());
            assertEquals(lexeme, e.getLexeme());
            assertEquals(position, e.getPosition());
            assertTrue(e.getMessage().contains("unexpected token '" + lexeme + "'"));
        }

        @Test
        @DisplayName("Lexical errors surface through the parser")
        void testLexErrors() {
            FormulaLexException e = assertThrows(FormulaLexException.class, () -> parse("p & -x"));
            assertEquals(FormulaLexException.Reason.UNEXPECTED_CHARACTER, e.getReason());
            assertEquals("x", e.getCharacter());
        }

        @Test
        @DisplayName("A grammar error before a bad character is reported first")
        void testGrammarErrorFirst() {
            FormulaParseException e = assertThrows(FormulaParseException.class, () -> parse("p ) $"));
            assertEquals(")", e.getLexeme());
        }

        @Test
        @DisplayName("All syntax errors share FormulaSyntaxException")
        void testCommonSupertype() {
            assertThrows(FormulaSyntaxException.class, () -> parse("p $"));
            assertThrows(FormulaSyntaxException.class, () -> parse("p )"));
        }
    }

    @Nested
    @DisplayName("Policy limits")
    class Limits {

        @Test
        @DisplayName("Nesting beyond maxNestingDepth is rejected")
        void testNestingDepth() {
            ParserPolicy policy = ParserPolicy.builder().maxNestingDepth(3).build();

            assertDoesNotThrow(() -> new RecursiveDescentParser("(((p)))", policy).parseFormula());
            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                    () -> new RecursiveDescentParser("((((p))))", policy).parseFormula());
            assertTrue(e.getMessage().contains("nested too deeply"));
            assertTrue(e.getMessage().contains("max depth: 3"));
        }

        @Test
        @DisplayName("Negation chains and implication chains count toward depth")
        void testChainDepth() {
            ParserPolicy policy = ParserPolicy.builder().maxNestingDepth(2).build();

            assertThrows(FormulaSyntaxException.class,
                    () -> new RecursiveDescentParser("~~~p", policy).parseFormula());
            assertThrows(FormulaSyntaxException.class,
                    () -> new RecursiveDescentParser("p -> q -> r -> s", policy).parseFormula());
            assertDoesNotThrow(() -> new RecursiveDescentParser("p & q & r & s | t", policy).parseFormula());
        }

        @Test
        @DisplayName("Deep but allowed nesting parses without stack overflow")
        void testDeepNesting() {
            String text = "(".repeat(400) + "p" + ")".repeat(400);
            assertEquals(P, parse(text));
        }

        @Test
        @DisplayName("Text longer than maxExpressionLength is rejected")
        void testLength() {
            ParserPolicy policy = ParserPolicy.builder().maxExpressionLength(5).build();

            assertDoesNotThrow(() -> new RecursiveDescentParser("p & q", policy).parseFormula());
            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                    () -> new RecursiveDescentParser("p & qq", policy).parseFormula());
            assertTrue(e.getMessage().contains("Expression too long (6 characters, max: 5)"));
            assertTrue(e.getMessage().contains("CUSTOM_POLICY"));
        }
    }
}
