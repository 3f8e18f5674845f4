package io.papertrail.config;

import java.util.Objects;

public record SchemaField(String name, ColumnType type) {
    public SchemaField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    @Override
    public String toString() { return name + ":" + type; }
}
