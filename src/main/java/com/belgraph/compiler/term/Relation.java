package com.belgraph.compiler.term;

import java.util.*;

public enum Relation {
    INCREASES("increases", Category.CAUSAL, "->", "→"),
    DIRECTLY_INCREASES("directlyIncreases", Category.CAUSAL, "=>", "⇒"),
    DECREASES("decreases", Category.CAUSAL, "-|"),
    DIRECTLY_DECREASES("directlyDecreases", Category.CAUSAL, "=|"),
    CAUSES_NO_CHANGE("causesNoChange", Category.CAUSAL, "cnc"),
    REGULATES("regulates", Category.CAUSAL, "reg"),
    RATE_LIMITING_STEP_OF("rateLimitingStepOf", Category.CAUSAL),
    POSITIVE_CORRELATION("positiveCorrelation", Category.CORRELATIVE, "pos"),
    NEGATIVE_CORRELATION("negativeCorrelation", Category.CORRELATIVE, "neg"),
    CORRELATION("correlation", Category.CORRELATIVE, "cor"),
    NO_CORRELATION("noCorrelation", Category.CORRELATIVE),
    ASSOCIATION("association", Category.ASSOCIATIVE, "--"),
    ORTHOLOGOUS("orthologous", Category.GENOMIC),
    TRANSCRIBED_TO("transcribedTo", Category.GENOMIC, ":>"),
    TRANSLATED_TO("translatedTo", Category.GENOMIC, ">>"),
    HAS_MEMBER("hasMember", Category.MEMBERSHIP),
    HAS_MEMBERS("hasMembers", Category.MEMBERSHIP),
    HAS_COMPONENT("hasComponent", Category.MEMBERSHIP),
    HAS_COMPONENTS("hasComponents", Category.MEMBERSHIP),
    HAS_VARIANT("hasVariant", Category.MEMBERSHIP),
    HAS_REACTANT("hasReactant", Category.MEMBERSHIP),
    HAS_PRODUCT("hasProduct", Category.MEMBERSHIP),
    IS_A("isA", Category.HIERARCHICAL),
    SUB_PROCESS_OF("subProcessOf", Category.HIERARCHICAL),
    PART_OF("partOf", Category.HIERARCHICAL),
    EQUIVALENT_TO("equivalentTo", Category.HIERARCHICAL),
    ANALOGOUS_TO("analogousTo", Category.DEPRECATED),
    BIOMARKER_FOR("biomarkerFor", Category.DEPRECATED),
    PROGNOSTIC_BIOMARKER_FOR("prognosticBiomarkerFor", Category.DEPRECATED);

    public enum Category { CAUSAL, CORRELATIVE, ASSOCIATIVE, GENOMIC, HIERARCHICAL, MEMBERSHIP, DEPRECATED }

    /** Relations created by the graph builder itself, never written in a document. */
    private static final Set<Relation> STRUCTURAL = EnumSet.of(HAS_VARIANT, HAS_REACTANT, HAS_PRODUCT);

    private static final Map<String, Relation> BY_KEYWORD = new HashMap<>();
    /** Symbolic aliases, longest first so {@code =>} wins over {@code =}. */
    private static final List<String> SYMBOLS = new ArrayList<>();

    static {
        for (Relation relation : values()) {
            if (relation.isStructural()) continue;
            BY_KEYWORD.put(relation.keyword, relation);
            for (String alias : relation.aliases) {
                BY_KEYWORD.put(alias, relation);
                if (!Character.isLetter(alias.charAt(0))) SYMBOLS.add(alias);
            }
        }
        SYMBOLS.sort(Comparator.comparingInt(String::length).reversed());
    }

    private final String keyword;
    private final Category category;
    private final List<String> aliases;

    Relation(String keyword, Category category, String... aliases) {
        this.keyword = keyword;
        this.category = category;
        this.aliases = List.of(aliases);
    }

    public String keyword() {
        return keyword;
    }

    public Category category() {
        return category;
    }

    public boolean isStructural() {
        return STRUCTURAL.contains(this);
    }

    /** Relations whose object is a {@code list(...)} expanded into one edge per element. */
    public boolean isListRelation() {
        return this == HAS_MEMBERS || this == HAS_COMPONENTS;
    }

    /** Single-edge form of a list relation; other relations map to themselves. */
    public Relation singular() {
        return switch (this) {
            case HAS_MEMBERS -> HAS_MEMBER;
            case HAS_COMPONENTS -> HAS_COMPONENT;
            default -> this;
        };
    }

    public static Optional<Relation> fromKeyword(String word) {
        return Optional.ofNullable(BY_KEYWORD.get(word));
    }

    public static List<String> symbols() {
        return Collections.unmodifiableList(SYMBOLS);
    }
}
