package com.geotool.parameters;

/**
 * Yes/no flag. Strings convert only from {@code "true"} or {@code "false"}, ignoring case.
 */
public class BooleanParameter extends ValueParameter<Boolean> {

    @Override
    public ParameterKind getKind() {
        return ParameterKind.BOOLEAN;
    }

    @Override
    public <R> R accept(ParameterVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }

    @Override
    protected Boolean convert(Object raw) {
        if (raw instanceof Boolean) return (Boolean) raw;
        if (raw instanceof String) {
            String s = ((String) raw).trim();
            if ("true".equalsIgnoreCase(s)) return Boolean.TRUE;
            if ("false".equalsIgnoreCase(s)) return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Not a boolean: " + raw);
    }
}
