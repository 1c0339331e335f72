package com.spectra.ast;

import com.spectra.Location;

import java.util.List;

/**
 * Root of a parsed source file: the top-level statements, with no enclosing braces.
 * The location covers the whole source.
 *
 * <p>The simple name is shared with {@link java.lang.Module}, which every compilation unit
 * imports implicitly. Callers outside this package need the single-type import
 * {@code import com.spectra.ast.Module;}: with only {@code import com.spectra.ast.*;} the
 * name {@code Module} is ambiguous and does not compile.</p>
 */
public record Module(
    Location location,
    List<Statement> statements
) implements Node {

    public Module {
        statements = List.copyOf(statements);
    }

    @Override
    public String type() {
        return "Module";
    }
}
