package io.typecheck.core.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.typecheck.core.engine.MessageComposer;
import io.typecheck.core.engine.TypeChecker;
import io.typecheck.core.engine.Values;
import io.typecheck.core.error.ConditionDefinitionException;
import io.typecheck.core.error.ValueMismatchException;
import io.typecheck.core.model.Condition;
import io.typecheck.core.model.ConditionList;
import io.typecheck.core.model.Descriptor;
import io.typecheck.core.model.IsData;
import io.typecheck.core.model.MessagePart;
import io.typecheck.core.model.ValueType;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Conditions")
class ConditionsTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final TypeChecker checker = TypeChecker.standard();

    private String failure(Object value, ConditionList... alternatives) {
        try {
            checker.assertAndThrow(value, alternatives);
        } catch (ValueMismatchException e) {
            return e.getMessage();
        }
        throw new AssertionError("expected " + value + " to fail");
    }

    @Nested
    @DisplayName("types")
    class Types {

        @Test
        void string() {
            assertThat(checker.check("foobar", Conditions.STRING)).isTrue();
            assertThat(checker.check(null, Conditions.STRING)).isFalse();
        }

        @Test
        void number() {
            assertThat(checker.check(3, Conditions.NUMBER)).isTrue();
            assertThat(checker.check(false, Conditions.NUMBER)).isFalse();
        }

        @Test
        void bool() {
            assertThat(checker.check(false, Conditions.BOOLEAN)).isTrue();
            assertThat(checker.check(true, Conditions.BOOLEAN)).isTrue();
            assertThat(checker.check(JSON.missingNode(), Conditions.BOOLEAN)).isFalse();
            assertThat(checker.check(List.of(), Conditions.BOOLEAN)).isFalse();
        }

        @Test
        void trueAndFalse() {
            Supplier<Integer> three = () -> 3;

            assertThat(checker.check(true, Conditions.TRUE)).isTrue();
            assertThat(checker.check(three, Conditions.TRUE)).isFalse();
            assertThat(checker.check(false, Conditions.FALSE)).isTrue();
            assertThat(checker.check("foo", Conditions.FALSE)).isFalse();
        }

        @Test
        void function() {
            Supplier<Integer> three = () -> 3;

            assertThat(checker.check(three, Conditions.FUNCTION)).isTrue();
            assertThat(checker.check(3, Conditions.FUNCTION)).isFalse();
        }

        @Test
        void typeConditionsAreShared() {
            assertThat(Conditions.typeOf(ValueType.NUMBER)).isSameAs(Conditions.NUMBER);
            assertThat(Conditions.typeOf(ValueType.NULL).name()).isEqualTo("null");
        }

        @Test
        void typeMismatchNamesActualType() {
            assertThat(failure(null, Conditions.STRING)).isEqualTo("Expected string, got null");
            assertThat(failure(Map.of(), Conditions.ARRAY)).isEqualTo("Expected array, got object");
            assertThat(failure(true, Conditions.FALSE)).isEqualTo("Expected false, got true");
        }
    }

    @Nested
    @DisplayName("nested conditions")
    class NestedConditions {

        private Condition lengthOne(boolean checkLength) {
            return Condition.builder()
                    .prerequisites(Conditions.ARRAY, Conditions.STRING)
                    .assertion(value -> !checkLength || Values.length(value) == 1)
                    .shouldBe(MessagePart.ofAfter("of length 1"))
                    .is((IsData data) -> data.article() + " " + data.type() + " of a different length")
                    .build();
        }

        @Test
        void onlyPrerequisites() {
            Condition condition = lengthOne(false);

            assertThat(checker.check(List.of(1), condition)).isTrue();
            assertThat(checker.check("", condition)).isTrue();
            assertThat(checker.check(true, condition)).isFalse();
            assertThat(checker.check(null, condition)).isFalse();
            assertThat(checker.check(JSON.missingNode(), condition)).isFalse();
            assertThat(checker.check((Supplier<Integer>) () -> 0, condition)).isFalse();
        }

        @Test
        void lengthOfArraysAndStrings() {
            Condition condition = lengthOne(true);

            assertThat(checker.check(List.of(1), condition)).isTrue();
            assertThat(checker.check(List.of(1, 2), condition)).isFalse();
            assertThat(checker.check(List.of(), condition)).isFalse();
            assertThat(checker.check("a", condition)).isTrue();
            assertThat(checker.check("ab", condition)).isFalse();
            assertThat(checker.check("", condition)).isFalse();
        }

        @Test
        void expectedListsEveryPrerequisiteBranch() {
            assertThat(MessageComposer.getMessageExpected(Descriptor.anyOf(lengthOne(true))))
                    .isEqualTo("array of length 1 OR string of length 1");
            assertThat(failure("ab", lengthOne(true)))
                    .isEqualTo("Expected array of length 1 OR string of length 1, got a string of a different length");
        }
    }

    @Nested
    @DisplayName("refinements")
    class Refinements {

        @Test
        void integer() {
            assertThat(checker.check(3, Conditions.INTEGER)).isTrue();
            assertThat(checker.check(3.0, Conditions.INTEGER)).isTrue();
            assertThat(failure(2.5, Conditions.INTEGER)).isEqualTo("Expected integer, got a floating point number");
        }

        @Test
        void nonNegative() {
            assertThat(checker.check(0, Conditions.NONNEGATIVE)).isTrue();
            assertThat(failure(-1, Conditions.NONNEGATIVE))
                    .isEqualTo("Expected non-negative number, got a negative number");
        }

        @Test
        void nonEmpty() {
            assertThat(checker.check("x", Conditions.NONEMPTY)).isTrue();
            assertThat(failure("", Conditions.NONEMPTY))
                    .isEqualTo("Expected non-empty array OR non-empty string, got an empty string");
            assertThat(failure(List.of(), Conditions.NONEMPTY))
                    .isEqualTo("Expected non-empty array OR non-empty string, got an empty array");
        }

        @Test
        void nonEmptyBlamesTypeForOtherValues() {
            assertThat(failure(5, Conditions.NONEMPTY))
                    .isEqualTo("Expected non-empty array OR non-empty string, got number");
        }
    }

    @Nested
    @DisplayName("factories")
    class Factories {

        @Test
        void arrayOf() throws Exception {
            Condition strings = Conditions.arrayOf(Conditions.STRING);

            assertThat(checker.check(List.of("a", "b"), strings)).isTrue();
            assertThat(checker.check(JSON.readTree("[\"a\"]"), strings)).isTrue();
            assertThat(failure(List.of("a", 1), strings)).isEqualTo("Expected Array<string>, got Array<number>");
            assertThat(failure("a", strings)).isEqualTo("Expected Array<string>, got string");
        }

        @Test
        void arrayOfWithoutAlternativesIsAnyArray() {
            assertThat(Conditions.arrayOf()).isSameAs(Conditions.ARRAY);
        }

        @Test
        void objectOf() {
            Condition numbers = Conditions.objectOf("string", Conditions.NUMBER);

            assertThat(checker.check(Map.of("a", 1, "b", 2.5), numbers)).isTrue();
            assertThat(failure(Map.of("a", "x"), numbers)).isEqualTo("Expected Object<string, number>, got Object<string>");
            assertThat(Conditions.objectOf("string")).isSameAs(Conditions.OBJECT);
        }

        @Test
        void objectOfRequiresKeyName() {
            assertThatThrownBy(() -> Conditions.objectOf(" ", Conditions.NUMBER))
                    .isInstanceOfSatisfying(ConditionDefinitionException.class,
                            e -> assertThat(e.conditionName()).isEqualTo("objectOf"))
                    .hasMessageContaining("key name");
        }

        @Test
        void keywords() {
            Condition modes = Conditions.keywords("on", "off", "auto");

            assertThat(checker.check("auto", modes)).isTrue();
            assertThat(failure("maybe", modes))
                    .isEqualTo("Expected one of the keywords \"on\", \"off\" or \"auto\", got a different string");
            assertThat(failure("maybe", Conditions.keywords("on")))
                    .isEqualTo("Expected the keyword \"on\", got a different string");
            assertThat(failure(1, modes)).endsWith("got number");
        }

        @Test
        void keywordsRequiresAtLeastOne() {
            assertThatThrownBy(Conditions::keywords).isInstanceOf(ConditionDefinitionException.class);
        }

        @Test
        void length() {
            Condition pair = Conditions.length(2);

            assertThat(checker.check(List.of(1, 2), pair)).isTrue();
            assertThat(checker.check("ab", pair)).isTrue();
            assertThat(failure("abc", pair))
                    .isEqualTo("Expected array of length 2 OR string of length 2, got a string of a different length");
            assertThatThrownBy(() -> Conditions.length(-1)).isInstanceOf(ConditionDefinitionException.class);
        }

        @Test
        void range() {
            Condition percent = Conditions.range(0, 100);

            assertThat(checker.check(50, percent)).isTrue();
            assertThat(checker.check(100, percent)).isTrue();
            assertThat(failure(101, percent))
                    .isEqualTo("Expected number of the interval [0, 100], got a number outside of the required range");
            assertThat(MessageComposer.getMessageExpected(Descriptor.anyOf(Conditions.range(0.5, 2))))
                    .isEqualTo("number of the interval [0.5, 2]");
            assertThatThrownBy(() -> Conditions.range(2, 1)).isInstanceOf(ConditionDefinitionException.class);
        }

        @Test
        void combinedWithRefinements() {
            assertThat(failure(-3, ConditionList.allOf(Conditions.POSITIVE, Conditions.INTEGER), Conditions.STRING))
                    .isEqualTo("Expected positive integer OR string, got a negative number or 0");
        }
    }
}
