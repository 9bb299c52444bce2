package io.github.manjago.talos.ir;

import java.util.Locale;

/**
 * Operand type tag carried by IR nodes.
 */
public enum ValueType {
    FIELD,
    U32,
    BOOL;

    public String text() {
        return name().toLowerCase(Locale.ROOT);
    }
}
