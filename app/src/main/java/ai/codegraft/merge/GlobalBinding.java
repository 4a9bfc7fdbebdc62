package ai.codegraft.merge;

import java.util.List;

/**
 * A module-level assignment of a value to a plain name.
 *
 * @param name the bound name
 * @param assignmentText source text of the whole assignment, e.g. {@code TIMEOUT = 30}
 * @param valueText source text of the right-hand side, e.g. {@code 30}
 * @param boundNames every name the assignment binds (more than one for {@code a = b = 0})
 */
public record GlobalBinding(String name, String assignmentText, String valueText, List<String> boundNames) {

    public GlobalBinding {
        boundNames = List.copyOf(boundNames);
    }
}
