package tupi.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import org.junit.jupiter.api.Test;

public class ValueTest {

    @Test
    void integerAndFloatAreDistinct() {
        assertNotEquals(Value.of(1), Value.of(1.0));
    }

    @Test
    void render() {
        assertEquals("42", Value.of(42).render());
        assertEquals("-3", Value.of(-3).render());
        assertEquals("3", Value.of(3.0).render());
        assertEquals("0.1", Value.of(0.1).render());
        assertEquals("199", Value.of(199.00).render());
        assertEquals("0.0000001", Value.of(1e-7).render());
        assertEquals("0", Value.of(0.0).render());
        assertEquals("inf", Value.of(Double.POSITIVE_INFINITY).render());
        assertEquals("NaN", Value.of(Double.NaN).render());
        assertEquals("Olá", Value.of("Olá").render());
        assertEquals("true", Value.of(true).render());
        assertEquals("Vazio", Value.none().render());
    }

    @Test
    void typeNames() {
        assertEquals("inteiro", Value.typeName(Value.of(1)));
        assertEquals("real", Value.typeName(Value.of(1.5)));
        assertEquals("texto", Value.typeName(Value.of("")));
        assertEquals("logico", Value.typeName(Value.of(false)));
        assertEquals("Vazio", Value.typeName(Value.none()));
    }
}
