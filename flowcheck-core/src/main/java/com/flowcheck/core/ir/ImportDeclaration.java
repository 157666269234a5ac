package com.flowcheck.core.ir;

import java.util.Objects;

/**
 * One imported name.
 *
 * <p>{@code import a.b as c} yields module {@code a.b}, name {@code a.b}, bound name {@code c};
 * {@code from ..x import Y} yields module {@code x}, name {@code Y}, level 2.</p>
 *
 * @param module module path without leading dots; empty for {@code from . import x}
 * @param name imported name as written
 * @param boundName name brought into scope
 * @param level number of leading dots, 0 for absolute imports
 * @param fromImport true for {@code from ... import ...}
 * @param topLevel true when the statement is at module level
 * @param line statement line
 */
public record ImportDeclaration(
    String module,
    String name,
    String boundName,
    int level,
    boolean fromImport,
    boolean topLevel,
    int line
) {
    public ImportDeclaration {
        module = module != null ? module : "";
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(boundName, "boundName must not be null");
    }

    public boolean isRelative() {
        return level > 0;
    }

    public boolean isStar() {
        return "*".equals(name);
    }

    /**
     * The module used for grouping and path checks: the {@code from} module for
     * from-imports, the imported module otherwise.
     *
     * @return module path
     */
    public String effectiveModule() {
        return fromImport ? module : name;
    }

    /**
     * Renders the import statement as written, for messages.
     *
     * @return statement text
     */
    public String statement() {
        if (!fromImport) {
            return boundName.equals(name) || name.startsWith(boundName + ".")
                ? "import " + name
                : "import " + name + " as " + boundName;
        }
        String dots = ".".repeat(level);
        String alias = boundName.equals(name) || isStar() ? "" : " as " + boundName;
        return "from " + dots + module + " import " + name + alias;
    }
}
