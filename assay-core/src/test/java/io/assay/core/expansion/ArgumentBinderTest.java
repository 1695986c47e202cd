package io.assay.core.expansion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ArgumentBinder")
class ArgumentBinderTest {

    @Nested
    @DisplayName("accepted values")
    class Accepted {

        @Test
        @DisplayName("unboxes values for primitive parameters")
        void shouldUnboxForPrimitives() throws Exception {
            Object[] arguments = ArgumentBinder.bind(method("primitives"), List.of(3, true));

            assertThat(arguments).containsExactly(3, true);
        }

        @Test
        @DisplayName("widens integral values to wider numeric parameters")
        void shouldWidenNumbers() throws Exception {
            Object[] arguments =
                    ArgumentBinder.bind(method("wide"), List.of((byte) 1, 2, 'c'));

            assertThat(arguments).containsExactly(1L, 2.0d, 99);
        }

        @Test
        @DisplayName("passes nulls to reference parameters")
        void shouldAcceptNullForReferences() throws Exception {
            Object[] arguments = ArgumentBinder.bind(method("reference"), Arrays.asList(null, "x"));

            assertThat(arguments).containsExactly(null, "x");
        }

        @Test
        @DisplayName("accepts subtypes of the declared type")
        void shouldAcceptSubtypes() throws Exception {
            Object[] arguments = ArgumentBinder.bind(method("number"), List.of(5));

            assertThat(arguments).containsExactly(5);
        }
    }

    @Nested
    @DisplayName("rejected values")
    class Rejected {

        @Test
        @DisplayName("rejects a row with the wrong arity")
        void shouldRejectArityMismatch() {
            assertThatThrownBy(() -> ArgumentBinder.bind(method("primitives"), List.of(1)))
                    .isInstanceOf(ArgumentMismatchException.class)
                    .hasMessageContaining("declares 2 parameter(s) but the row supplies 1");
        }

        @Test
        @DisplayName("rejects null for a primitive parameter")
        void shouldRejectNullForPrimitive() {
            assertThatThrownBy(
                            () ->
                                    ArgumentBinder.bind(
                                            method("primitives"), Arrays.asList(null, true)))
                    .isInstanceOf(ArgumentMismatchException.class)
                    .hasMessageContaining("expects int");
        }

        @Test
        @DisplayName("rejects narrowing and unrelated types")
        void shouldRejectNarrowing() {
            assertThatThrownBy(() -> ArgumentBinder.bind(method("narrow"), List.of(300L)))
                    .isInstanceOf(ArgumentMismatchException.class);
            assertThatThrownBy(() -> ArgumentBinder.bind(method("narrow"), List.of("3")))
                    .isInstanceOf(ArgumentMismatchException.class)
                    .hasMessageContaining("java.lang.String");
        }

        @Test
        @DisplayName("never widens into char")
        void shouldNotWidenIntoChar() {
            assertThatThrownBy(() -> ArgumentBinder.bind(method("character"), List.of((byte) 65)))
                    .isInstanceOf(ArgumentMismatchException.class);
        }
    }

    // --- Helpers ---

    private static Method method(String name) {
        return Arrays.stream(Signatures.class.getDeclaredMethods())
                .filter(m -> m.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }

    @SuppressWarnings("unused")
    static class Signatures {
        void primitives(int count, boolean flag) {}

        void wide(long fromByte, double fromInt, int fromChar) {}

        void reference(String first, String second) {}

        void number(Number value) {}

        void narrow(int value) {}

        void character(char value) {}
    }
}
