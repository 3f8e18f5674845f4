package io.papertrail.validate;

import io.papertrail.Fixtures;
import io.papertrail.config.ColumnType;
import io.papertrail.config.SchemaField;
import io.papertrail.error.SchemaValidationException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SchemaValidatorTest {
    private final SchemaValidator validator = new SchemaValidator();

    private static List<SchemaField> strings(String... names) {
        return Arrays.stream(names).map(n -> new SchemaField(n, ColumnType.STRING)).toList();
    }

    @Test
    void order_is_not_significant() {
        assertDoesNotThrow(() -> validator.validate("s", strings("amount", "id", "name"), Fixtures.amounts()));
    }

    @Test
    void reports_missing_and_extra_columns() {
        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> validator.validate("s", strings("id", "amount", "surprise"), Fixtures.amounts()));
        assertEquals(List.of("name"), e.missing());
        assertEquals(List.of("surprise"), e.extra());
    }
}
