package com.belgraph.compiler.definition;

public class DefinitionResolutionException extends RuntimeException {
    private final String location;

    public DefinitionResolutionException(String location, String message) {
        super(message);
        this.location = location;
    }

    public DefinitionResolutionException(String location, String message, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    public String location() {
        return location;
    }
}
