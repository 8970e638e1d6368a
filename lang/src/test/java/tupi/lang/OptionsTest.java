package tupi.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Properties;

import org.junit.jupiter.api.Test;

public class OptionsTest {

    @Test
    void defaults() {
        var options = Options.defaults();
        assertEquals(200, options.getMaxParseDepth());
        assertEquals(1000, options.getMaxEvalDepth());
    }

    @Test
    void fromProperties() {
        var properties = new Properties();
        properties.setProperty(Options.MAX_EVAL_DEPTH, " 50 ");

        var options = Options.fromProperties(properties);
        assertEquals(200, options.getMaxParseDepth());
        assertEquals(50, options.getMaxEvalDepth());
    }

    @Test
    void rejectsInvalidValues() {
        var notNumber = new Properties();
        notNumber.setProperty(Options.MAX_PARSE_DEPTH, "muito");
        assertThrows(IllegalArgumentException.class, () -> Options.fromProperties(notNumber));

        var negative = new Properties();
        negative.setProperty(Options.MAX_PARSE_DEPTH, "-1");
        var ex = assertThrows(IllegalArgumentException.class, () -> Options.fromProperties(negative));
        assertEquals("tupi.maxParseDepth must be positive, got -1", ex.getMessage());
    }
}
