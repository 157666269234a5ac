package com.flowcheck.core.ir;

import java.util.List;
import java.util.Objects;

/**
 * A node class defined in the analyzed source.
 *
 * @param name class name
 * @param baseClasses base class names as written
 * @param declaresParameters true when the class defines {@code get_parameters}
 * @param parameters declared parameters
 * @param usages parameters read by the run method
 * @param line class definition line
 */
public record CustomNodeClass(
    String name,
    List<String> baseClasses,
    boolean declaresParameters,
    List<ParameterDeclaration> parameters,
    List<ParameterUsage> usages,
    int line
) {
    public CustomNodeClass {
        Objects.requireNonNull(name, "name must not be null");
        baseClasses = baseClasses != null ? List.copyOf(baseClasses) : List.of();
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        usages = usages != null ? List.copyOf(usages) : List.of();
    }

    /**
     * Checks whether a parameter with the given name is declared.
     *
     * @param parameterName parameter name
     * @return true when declared
     */
    public boolean declares(String parameterName) {
        return parameters.stream().anyMatch(parameter -> parameterName.equals(parameter.name()));
    }
}
