package com.hdltree.extract;

import java.util.List;
import java.util.stream.Collectors;

/**
 * @param kind       {@code function} or {@code procedure}
 * @param returnType null for procedures
 */
public record SubprogramRecord(String kind, String name, List<ParameterRecord> parameters, String returnType) {

    public SubprogramRecord {
        parameters = List.copyOf(parameters);
    }

    public boolean isFunction() {
        return "function".equals(kind);
    }

    /**
     * Canonical one-line declaration, e.g.
     * {@code function f(a : in bit; b : in bit) return bit;}
     */
    public String prototype() {
        String list = parameters.stream().map(ParameterRecord::toString).collect(Collectors.joining("; "));
        if (isFunction()) {
            return parameters.isEmpty()
                ? "function " + name + " return " + returnType + ";"
                : "function " + name + "(" + list + ") return " + returnType + ";";
        }
        return parameters.isEmpty()
            ? "procedure " + name + ";"
            : "procedure " + name + "(" + list + ");";
    }

    /**
     * Signature as used in attribute specifications and aliases, e.g. {@code f[bit, bit return bit]}.
     */
    public String signature() {
        String types = parameters.stream().map(ParameterRecord::type).collect(Collectors.joining(", "));
        return isFunction() ? name + "[" + types + " return " + returnType + "]" : name + "[" + types + "]";
    }
}
