package dev.fumaz.locus.type;

import dev.fumaz.locus.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TypeKeyTest {

    static void consume(List<String> names, Map<String, Integer> counts) {
    }

    @Test
    void literalMatchesParameterTypeOfMethod() throws NoSuchMethodException {
        Method method = TypeKeyTest.class.getDeclaredMethod("consume", List.class, Map.class);

        TypeKey fromParameter = TypeKey.of(method.getGenericParameterTypes()[0]);
        TypeKey fromLiteral = TypeKey.of(new TypeLiteral<List<String>>() {});

        assertEquals(fromLiteral, fromParameter);
        assertEquals(fromLiteral.hashCode(), fromParameter.hashCode());
        assertSame(List.class, fromLiteral.getRawType());
    }

    @Test
    void parameterizedTypesWithDifferentArgumentsDiffer() {
        TypeKey strings = TypeKey.of(new TypeLiteral<List<String>>() {});
        TypeKey integers = TypeKey.of(new TypeLiteral<List<Integer>>() {});

        assertNotEquals(strings, integers);
        assertNotEquals(strings, TypeKey.of(List.class));
    }

    @Test
    void primitiveSharesKeyWithWrapper() {
        assertEquals(TypeKey.of(Integer.class), TypeKey.of(int.class));
        assertSame(Integer.class, TypeKey.of(int.class).getRawType());
    }

    @Test
    void noSubtypingBetweenKeys() {
        assertNotEquals(TypeKey.of(CharSequence.class), TypeKey.of(String.class));
    }

    @Test
    void rejectsWildcardsAndTypeVariables() {
        assertThrows(ValidationException.class, () -> TypeKey.of(new TypeLiteral<List<?>>() {}));
        assertThrows(ValidationException.class, () -> TypeKey.of(List.class.getTypeParameters()[0]));
    }

    @Test
    @SuppressWarnings("rawtypes")
    void literalWithoutTypeArgumentIsRejected() {
        assertThrows(ValidationException.class, () -> new TypeLiteral() {});
    }

    @Test
    void acceptsInstancesOfRawTypeAndNull() {
        TypeKey key = TypeKey.of(CharSequence.class);

        assertTrue(key.accepts("text"));
        assertTrue(key.accepts(null));
        assertFalse(key.accepts(42));
    }

    @Test
    void nameIsCanonicalTypeName() {
        assertEquals("java.util.Map<java.lang.String, java.lang.Integer>",
                TypeKey.of(new TypeLiteral<Map<String, Integer>>() {}).getName());
    }
}
