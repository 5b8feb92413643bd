package org.elnamic.runtime.model;

import org.elnamic.api.ConstantAssignmentException;
import org.elnamic.api.RedeclarationException;
import org.elnamic.api.SourceInfo;
import org.elnamic.api.TypeMismatchException;
import org.elnamic.api.UnboundNameException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for scope chain lookups, declarations and typed bindings in {@link Environment}.
 */
public class EnvironmentTest {

    private static final SourceInfo AT = new SourceInfo("test.el", 1, 1);

    /**
     * Verifies that lookups walk outward and that assignment updates the binding where it lives.
     */
    @Test
    @Tag("unit")
    void testLookupAndAssignThroughChain() {
        // Arrange
        Environment global = Environment.global();
        global.define("x", new IntegerValue(1), AT);
        Environment inner = new Environment(global);

        // Act
        inner.assign("x", new IntegerValue(2), AT);

        // Assert
        assertThat(global.get("x", AT)).isEqualTo(new IntegerValue(2));
        assertThat(inner.isDeclaredLocally("x")).isFalse();
    }

    /**
     * Verifies that shadowing in a child scope leaves the outer binding untouched.
     */
    @Test
    @Tag("unit")
    void testShadowing() {
        // Arrange
        Environment global = Environment.global();
        global.define("x", new IntegerValue(1), AT);
        Environment inner = new Environment(global);

        // Act
        inner.define("x", new StringValue("inner"), AT);

        // Assert
        assertThat(inner.get("x", AT)).isEqualTo(new StringValue("inner"));
        assertThat(global.get("x", AT)).isEqualTo(new IntegerValue(1));
    }

    /**
     * Verifies the failure modes: unbound names, redeclaration, constants.
     */
    @Test
    @Tag("unit")
    void testErrors() {
        // Arrange
        Environment env = Environment.global();
        env.define("pi", new RealValue(3.14), TypeName.REAL, true, AT);

        // Act & Assert
        assertThatThrownBy(() -> env.get("missing", AT)).isInstanceOf(UnboundNameException.class)
                .hasMessageContaining("missing");
        assertThatThrownBy(() -> env.assign("missing", UnitValue.INSTANCE, AT)).isInstanceOf(UnboundNameException.class);
        assertThatThrownBy(() -> env.define("pi", new RealValue(3.0), AT)).isInstanceOf(RedeclarationException.class);
        assertThatThrownBy(() -> env.assign("pi", new RealValue(3.0), AT)).isInstanceOf(ConstantAssignmentException.class);
    }

    /**
     * Verifies that declared types are enforced and that integers widen to real.
     */
    @Test
    @Tag("unit")
    void testTypedBindings() {
        // Arrange
        Environment env = Environment.global();
        env.define("r", new IntegerValue(2), TypeName.REAL, false, AT);
        env.define("n", UnitValue.INSTANCE, TypeName.INTEGER, false, AT);

        // Act & Assert
        assertThat(env.get("r", AT)).isEqualTo(new RealValue(2.0));
        assertThatThrownBy(() -> env.assign("n", new StringValue("x"), AT)).isInstanceOf(TypeMismatchException.class);
        env.assign("n", new IntegerValue(7), AT);
        assertThat(env.get("n", AT)).isEqualTo(new IntegerValue(7));
    }
}
