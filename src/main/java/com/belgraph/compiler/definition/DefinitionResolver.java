package com.belgraph.compiler.definition;

import java.util.Set;

public interface DefinitionResolver {
    /**
     * @throws DefinitionResolutionException when the location cannot be read
     */
    Set<String> resolve(String location);
}
