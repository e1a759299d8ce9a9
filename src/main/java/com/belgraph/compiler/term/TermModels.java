package com.belgraph.compiler.term;

import java.util.List;
import java.util.Set;

/** Raw trees may hold legacy shapes; a canonical tree never does. */
public class TermModels {

    public enum TermKind {
        ABUNDANCE, GENE, RNA, MIRNA, PROTEIN, COMPLEX, COMPOSITE,
        BIOLOGICAL_PROCESS, PATHOLOGY, REACTION, ACTIVITY,
        TRANSLOCATION, DEGRADATION, CELL_SECRETION, CELL_SURFACE_EXPRESSION,
        LIST;

        private static final Set<TermKind> ABUNDANCES = Set.of(ABUNDANCE, GENE, RNA, MIRNA, PROTEIN, COMPLEX, COMPOSITE);
        private static final Set<TermKind> PROCESSES = Set.of(BIOLOGICAL_PROCESS, PATHOLOGY, ACTIVITY);
        private static final Set<TermKind> TRANSFORMATIONS = Set.of(TRANSLOCATION, DEGRADATION, CELL_SECRETION, CELL_SURFACE_EXPRESSION, REACTION);

        public boolean isAbundance() {
            return ABUNDANCES.contains(this);
        }

        public boolean isProcess() {
            return PROCESSES.contains(this);
        }

        public boolean isTransformation() {
            return TRANSFORMATIONS.contains(this);
        }
    }

    /**
     * A namespace/name pair. A {@code null} namespace stands for the built-in BEL namespace
     * (modification types, molecular activities).
     */
    public record Identifier(String namespace, String name) {
        public static Identifier ofDefault(String name) {
            return new Identifier(null, name);
        }

        public boolean isDefaultNamespace() {
            return namespace == null;
        }
    }

    public sealed interface Term permits EntityTerm, ListTerm, FusionTerm, ReactionTerm, ActivityTerm,
            LegacyActivityTerm, TransformationTerm, LegacyTranslocationTerm, MemberList {
        TermKind kind();
    }

    public record EntityTerm(TermKind kind, Identifier identifier, List<Variant> variants, Identifier location) implements Term {
        public EntityTerm {
            variants = List.copyOf(variants);
        }

        public EntityTerm withoutLocation() {
            return location == null ? this : new EntityTerm(kind, identifier, variants, null);
        }

        public EntityTerm withoutVariants() {
            return new EntityTerm(kind, identifier, List.of(), null);
        }
    }

    public record ListTerm(TermKind kind, List<Term> members, Identifier location) implements Term {
        public ListTerm {
            members = List.copyOf(members);
        }
    }

    public record FusionTerm(TermKind kind, Identifier partner5p, String range5p,
                             Identifier partner3p, String range3p, Identifier location) implements Term {}

    public record ReactionTerm(List<Term> reactants, List<Term> products) implements Term {
        public ReactionTerm {
            reactants = List.copyOf(reactants);
            products = List.copyOf(products);
        }

        @Override
        public TermKind kind() {
            return TermKind.REACTION;
        }
    }

    /** {@code act(target, ma(activity))}; {@code molecularActivity} is null when unspecified. */
    public record ActivityTerm(Term target, Identifier molecularActivity) implements Term {
        @Override
        public TermKind kind() {
            return TermKind.ACTIVITY;
        }
    }

    public record LegacyActivityTerm(String function, Term target) implements Term {
        @Override
        public TermKind kind() {
            return TermKind.ACTIVITY;
        }
    }

    public record TransformationTerm(TermKind kind, Term target, Identifier fromLocation, Identifier toLocation) implements Term {}

    /** BEL 1.0 {@code tloc(target, NS:from, NS:to)} without {@code fromLoc()/toLoc()}. */
    public record LegacyTranslocationTerm(Term target, Identifier fromLocation, Identifier toLocation) implements Term {
        @Override
        public TermKind kind() {
            return TermKind.TRANSLOCATION;
        }
    }

    /** {@code list(...)}, only valid as the object of hasMembers/hasComponents. */
    public record MemberList(List<Term> members) implements Term {
        public MemberList {
            members = List.copyOf(members);
        }

        @Override
        public TermKind kind() {
            return TermKind.LIST;
        }
    }

    public sealed interface Variant permits ProteinModification, HgvsVariant, Fragment, LegacySubstitution, LegacyTruncation {}

    public record ProteinModification(Identifier type, String aminoAcid, Integer position) implements Variant {}

    public record HgvsVariant(String description) implements Variant {}

    /** {@code frag(range[, description])}; range is {@code start_stop} or {@code ?}. */
    public record Fragment(String range, String description) implements Variant {}

    public record LegacySubstitution(String reference, int position, String variant) implements Variant {}

    public record LegacyTruncation(int position) implements Variant {}
}
