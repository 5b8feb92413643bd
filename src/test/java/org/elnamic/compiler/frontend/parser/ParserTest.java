package org.elnamic.compiler.frontend.parser;

import org.elnamic.api.ParseException;
import org.elnamic.compiler.diagnostics.DiagnosticsEngine;
import org.elnamic.compiler.frontend.lexer.Lexer;
import org.elnamic.compiler.frontend.lexer.TokenType;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.BinaryNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.elnamic.compiler.frontend.parser.ast.IndexAssignmentNode;
import org.elnamic.compiler.frontend.parser.ast.ProgramNode;
import org.elnamic.compiler.frontend.parser.features.control.IfNode;
import org.elnamic.compiler.frontend.parser.features.decl.VariableDeclarationNode;
import org.elnamic.compiler.frontend.parser.features.function.FunctionDeclarationNode;
import org.elnamic.compiler.frontend.parser.features.loop.ForEachNode;
import org.elnamic.compiler.frontend.parser.features.loop.ForNode;
import org.elnamic.compiler.frontend.parser.features.proof.HypothesisNode;
import org.elnamic.compiler.frontend.parser.features.proof.ProofNode;
import org.elnamic.compiler.frontend.parser.features.proof.ProofTestNode;
import org.elnamic.compiler.frontend.parser.features.proof.QedNode;
import org.elnamic.compiler.frontend.parser.features.switchcase.SwitchNode;
import org.elnamic.runtime.model.Boolean3;
import org.elnamic.runtime.model.TypeName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the {@link Parser}: statement dispatch through the handler registry,
 * expression precedence and error reporting.
 */
public class ParserTest {

    private DiagnosticsEngine diagnostics;

    private List<AstNode> parse(String source) {
        return parseProgram(source).statements();
    }

    private ProgramNode parseProgram(String source) {
        diagnostics = new DiagnosticsEngine();
        return new Parser(new Lexer(source, diagnostics, "test.el").scanTokens(), diagnostics).parse();
    }

    /**
     * Verifies that the optional program header provides the program name.
     */
    @Test
    @Tag("unit")
    void testProgramHeader() {
        // Act
        ProgramNode named = parseProgram("program demo { show 1; }");
        ProgramNode anonymous = parseProgram("show 1;");

        // Assert
        assertThat(named.programName()).isEqualTo("demo");
        assertThat(named.statements()).hasSize(1);
        assertThat(anonymous.programName()).isEqualTo("main");
    }

    /**
     * Verifies multi-name typed declarations with an advisory array size.
     */
    @Test
    @Tag("unit")
    void testDeclaration() {
        // Act
        List<AstNode> ast = parse("var a, b: int[3] = [1, 2, 3];");

        // Assert
        assertThat(ast).hasSize(1);
        VariableDeclarationNode decl = (VariableDeclarationNode) ast.get(0);
        assertThat(decl.names()).extracting(t -> t.text()).containsExactly("a", "b");
        assertThat(decl.type().type()).isEqualTo(TypeName.INTEGER);
        assertThat(decl.type().size()).isEqualTo(3L);
        assertThat(decl.isConstant()).isFalse();
    }

    /**
     * Verifies that multiplication binds tighter than addition, and comparison tighter than 'and'.
     */
    @Test
    @Tag("unit")
    void testPrecedence() {
        // Act
        ExpressionStatementNode stmt = (ExpressionStatementNode) parse("1 + 2 * 3 < 10 and true;").get(0);

        // Assert
        BinaryNode and = (BinaryNode) stmt.expression();
        assertThat(and.operator().type()).isEqualTo(TokenType.AND);
        BinaryNode less = (BinaryNode) and.left();
        assertThat(less.operator().type()).isEqualTo(TokenType.LESS);
        BinaryNode plus = (BinaryNode) less.left();
        assertThat(plus.operator().type()).isEqualTo(TokenType.PLUS);
        assertThat(((BinaryNode) plus.right()).operator().type()).isEqualTo(TokenType.STAR);
    }

    /**
     * Verifies both spellings of an else-if chain.
     */
    @Test
    @Tag("unit")
    void testIfChain() {
        // Act
        IfNode node = (IfNode) parse("if a { } elif b { } else if c { } else { }").get(0);

        // Assert
        assertThat(node.branches()).hasSize(3);
        assertThat(node.elseBranch()).isNotNull();
    }

    /**
     * Verifies that both for-loop forms are recognized, with and without parentheses.
     */
    @Test
    @Tag("unit")
    void testForForms() {
        // Act
        List<AstNode> ast = parse(String.join("\n",
                "for x in [1, 2] { }",
                "for (var i = 0; i < 3; i = i + 1) { }",
                "for ; ; { break; }"));

        // Assert
        assertThat(ast.get(0)).isInstanceOf(ForEachNode.class);
        ForNode counted = (ForNode) ast.get(1);
        assertThat(counted.initializer()).isInstanceOf(VariableDeclarationNode.class);
        assertThat(counted.condition()).isNotNull();
        assertThat(counted.step()).isNotNull();
        ForNode endless = (ForNode) ast.get(2);
        assertThat(endless.initializer()).isNull();
        assertThat(endless.condition()).isNull();
    }

    /**
     * Verifies that consecutive case labels are stacked into one clause.
     */
    @Test
    @Tag("unit")
    void testStackedCaseLabels() {
        // Act
        SwitchNode node = (SwitchNode) parse("switch g { case \"A\": case \"B\": show 1; default: show 2; }").get(0);

        // Assert
        assertThat(node.cases()).hasSize(2);
        assertThat(node.cases().get(0).labels()).hasSize(2);
        assertThat(node.cases().get(0).body()).hasSize(1);
        assertThat(node.cases().get(1).isDefault()).isTrue();
    }

    /**
     * Verifies that parameters may be separated by commas or semicolons.
     */
    @Test
    @Tag("unit")
    void testFunctionParameters() {
        // Act
        FunctionDeclarationNode fn = (FunctionDeclarationNode) parse("function f(a: int; b, c: str) { return a; }").get(0);

        // Assert
        assertThat(fn.parameters()).extracting(p -> p.name().text()).containsExactly("a", "b", "c");
        assertThat(fn.parameters().get(1).type()).isNull();
        assertThat(fn.parameters().get(2).type().type()).isEqualTo(TypeName.STRING);
    }

    /**
     * Verifies the proof block statement kinds.
     */
    @Test
    @Tag("unit")
    void testProofBlock() {
        // Act
        ProofNode proof = (ProofNode) parse("proof t { hypothesis h: true; test c: h: true; h and true; QED }").get(0);

        // Assert
        assertThat(proof.theoremName().text()).isEqualTo("t");
        assertThat(proof.body()).hasSize(4);
        assertThat(proof.body().get(0)).isInstanceOf(HypothesisNode.class);
        assertThat(((ProofTestNode) proof.body().get(1)).expectedValue()).isEqualTo(Boolean3.TRUE);
        assertThat(proof.body().get(2)).isInstanceOf(ExpressionStatementNode.class);
        assertThat(proof.body().get(3)).isInstanceOf(QedNode.class);
        assertThat(proof.hasCompletionMarker()).isTrue();
    }

    /**
     * Verifies element assignment on a postfix target.
     */
    @Test
    @Tag("unit")
    void testIndexAssignment() {
        // Act
        AstNode node = parse("grid[1][2] = 5;").get(0);

        // Assert
        assertThat(node).isInstanceOf(IndexAssignmentNode.class);
    }

    /**
     * Verifies that a missing semicolon reports what was expected and what was found.
     */
    @Test
    @Tag("unit")
    void testMissingSemicolon() {
        assertThatThrownBy(() -> parse("show 1\nshow 2;"))
                .isInstanceOf(ParseException.class)
                .satisfies(e -> {
                    ParseException pe = (ParseException) e;
                    assertThat(pe.getFound()).isEqualTo("show");
                    assertThat(pe.getSourceInfo().lineNumber()).isEqualTo(2);
                });
        assertThat(diagnostics.hasErrors()).isTrue();
    }

    /**
     * Verifies that a constant without an initializer is rejected.
     */
    @Test
    @Tag("unit")
    void testConstRequiresInitializer() {
        assertThatThrownBy(() -> parse("const limit: int;"))
                .isInstanceOf(ParseException.class);
    }

    /**
     * Verifies that a proof test needs a truth literal as expected value.
     */
    @Test
    @Tag("unit")
    void testProofTestNeedsTruthLiteral() {
        assertThatThrownBy(() -> parse("proof t { test a: true: 1; QED }"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("'1'");
    }

    /**
     * Verifies that running out of input is reported as such.
     */
    @Test
    @Tag("unit")
    void testEndOfInput() {
        assertThatThrownBy(() -> parse("while true {"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("end of input");
    }
}
