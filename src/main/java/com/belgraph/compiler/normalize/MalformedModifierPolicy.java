package com.belgraph.compiler.normalize;

import java.util.EnumMap;
import java.util.Map;

/** {@link Action#ERROR} excludes the statement; {@link Action#WARN} drops the modifier and keeps it. */
public class MalformedModifierPolicy {
    public enum Modifier { PMOD, SUBSTITUTION, TRUNCATION, FRAGMENT, ACTIVITY }

    public enum Action { ERROR, WARN }

    private final Map<Modifier, Action> actions;

    public MalformedModifierPolicy(Map<Modifier, Action> actions) {
        this.actions = new EnumMap<>(Modifier.class);
        for (Modifier modifier : Modifier.values()) {
            this.actions.put(modifier, actions.getOrDefault(modifier, Action.ERROR));
        }
    }

    public static MalformedModifierPolicy strict() {
        return new MalformedModifierPolicy(Map.of());
    }

    public Action actionFor(Modifier modifier) {
        return actions.get(modifier);
    }
}
