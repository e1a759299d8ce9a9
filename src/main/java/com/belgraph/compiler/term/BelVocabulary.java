package com.belgraph.compiler.term;

import com.belgraph.compiler.term.TermModels.TermKind;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class BelVocabulary {
    public static final Map<String, TermKind> FUNCTIONS;
    public static final Map<TermKind, String> SHORT_NAMES = new EnumMap<>(TermKind.class);

    /** Long and short BEL 1.0 activity function names mapped to their molecular activity label. */
    public static final Map<String, String> ACTIVITIES;
    /** Molecular activity label mapped back to the short name used when writing {@code ma(...)}. */
    public static final Map<String, String> ACTIVITY_SHORT_NAMES = new HashMap<>();

    public static final Map<String, String> AMINO_ACIDS = Map.ofEntries(
            Map.entry("A", "Ala"), Map.entry("R", "Arg"), Map.entry("N", "Asn"), Map.entry("D", "Asp"),
            Map.entry("C", "Cys"), Map.entry("E", "Glu"), Map.entry("Q", "Gln"), Map.entry("G", "Gly"),
            Map.entry("H", "His"), Map.entry("I", "Ile"), Map.entry("L", "Leu"), Map.entry("K", "Lys"),
            Map.entry("M", "Met"), Map.entry("F", "Phe"), Map.entry("P", "Pro"), Map.entry("S", "Ser"),
            Map.entry("T", "Thr"), Map.entry("W", "Trp"), Map.entry("Y", "Tyr"), Map.entry("V", "Val"));

    public static final Set<String> AMINO_ACID_CODES = Set.copyOf(AMINO_ACIDS.values());

    public static final Set<String> NUCLEOTIDES = Set.of("A", "C", "G", "T");

    public static final Set<String> PMOD_TYPES = Set.of(
            "Ac", "ADPRib", "Farn", "Gerger", "Glyco", "Hy", "ISG", "Me", "Me1", "Me2", "Me3", "Myr",
            "Nedd", "NGlyco", "NO", "OGlyco", "Palm", "Ph", "Sulf", "sulfo", "Sumo", "Ub", "UbK48", "UbK63",
            "UbMono", "UbPoly");

    public static final Map<String, String> LEGACY_PMOD_TYPES = Map.of(
            "P", "Ph", "A", "Ac", "F", "Farn", "G", "Glyco", "H", "Hy",
            "M", "Me", "R", "ADPRib", "S", "Sumo", "U", "Ub");

    static {
        Map<String, TermKind> functions = new LinkedHashMap<>();
        register(functions, TermKind.ABUNDANCE, "a", "abundance");
        register(functions, TermKind.GENE, "g", "geneAbundance");
        register(functions, TermKind.RNA, "r", "rnaAbundance");
        register(functions, TermKind.MIRNA, "m", "microRNAAbundance");
        register(functions, TermKind.PROTEIN, "p", "proteinAbundance");
        register(functions, TermKind.COMPLEX, "complex", "complexAbundance");
        register(functions, TermKind.COMPOSITE, "composite", "compositeAbundance");
        register(functions, TermKind.BIOLOGICAL_PROCESS, "bp", "biologicalProcess");
        register(functions, TermKind.PATHOLOGY, "path", "pathology");
        register(functions, TermKind.REACTION, "rxn", "reaction");
        register(functions, TermKind.ACTIVITY, "act", "activity");
        register(functions, TermKind.TRANSLOCATION, "tloc", "translocation");
        register(functions, TermKind.DEGRADATION, "deg", "degradation");
        register(functions, TermKind.CELL_SECRETION, "sec", "cellSecretion");
        register(functions, TermKind.CELL_SURFACE_EXPRESSION, "surf", "cellSurfaceExpression");
        register(functions, TermKind.LIST, "list", "list");
        FUNCTIONS = Map.copyOf(functions);

        Map<String, String> activities = new HashMap<>();
        activity(activities, "cat", "catalyticActivity", "CatalyticActivity");
        activity(activities, "chap", "chaperoneActivity", "ChaperoneActivity");
        activity(activities, "gtp", "gtpBoundActivity", "GtpBoundActivity");
        activity(activities, "kin", "kinaseActivity", "KinaseActivity");
        activity(activities, "pep", "peptidaseActivity", "PeptidaseActivity");
        activity(activities, "phos", "phosphataseActivity", "PhosphataseActivity");
        activity(activities, "ribo", "ribosylationActivity", "RibosylationActivity");
        activity(activities, "tscript", "transcriptionalActivity", "TranscriptionalActivity");
        activity(activities, "tport", "transportActivity", "TransportActivity");
        ACTIVITIES = Map.copyOf(activities);
    }

    private BelVocabulary() {}

    private static void register(Map<String, TermKind> functions, TermKind kind, String shortName, String longName) {
        functions.put(shortName, kind);
        functions.put(longName, kind);
        SHORT_NAMES.put(kind, shortName);
    }

    private static void activity(Map<String, String> activities, String shortName, String longName, String label) {
        activities.put(shortName, label);
        activities.put(longName, label);
        ACTIVITY_SHORT_NAMES.put(label, shortName);
    }

    public static boolean isLegacyActivityFunction(String name) {
        return ACTIVITIES.containsKey(name);
    }

    /** Resolves a default-namespace {@code ma(...)} argument: short name, long name or label. */
    public static String activityLabel(String value) {
        if (ACTIVITY_SHORT_NAMES.containsKey(value)) return value;
        return ACTIVITIES.get(value);
    }

    /** Three-letter code for a one- or three-letter amino acid, or null. */
    public static String aminoAcid(String code) {
        if (code == null) return null;
        if (AMINO_ACID_CODES.contains(code)) return code;
        return AMINO_ACIDS.get(code);
    }
}
