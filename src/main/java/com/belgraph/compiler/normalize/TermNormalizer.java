package com.belgraph.compiler.normalize;

import com.belgraph.compiler.normalize.MalformedModifierPolicy.Modifier;
import com.belgraph.compiler.problem.ProblemCode;
import com.belgraph.compiler.problem.UnrecognizedLegacyShapeException;
import com.belgraph.compiler.term.BelVocabulary;
import com.belgraph.compiler.term.BelWriter;
import com.belgraph.compiler.term.TermModels.*;

import java.util.*;
import java.util.regex.Pattern;

public class TermNormalizer {
    private static final Pattern FRAGMENT_RANGE = Pattern.compile("\\?|(\\d+|\\?)_(\\d+|\\?|\\*)");
    private static final Comparator<Term> TERM_ORDER = Comparator.comparing(BelWriter::write);
    private static final Comparator<Variant> VARIANT_ORDER = Comparator.comparing(BelWriter::variant);

    private final MalformedModifierPolicy policy;

    public TermNormalizer(MalformedModifierPolicy policy) {
        this.policy = policy;
    }

    public NormalizedTerm normalize(Term term) {
        List<Correction> corrections = new ArrayList<>();
        Term canonical = normalize(term, corrections);
        return new NormalizedTerm(canonical, corrections);
    }

    private Term normalize(Term term, List<Correction> out) {
        if (term instanceof EntityTerm e) {
            List<Variant> variants = new ArrayList<>();
            for (Variant variant : e.variants()) {
                normalizeVariant(e, variant, out).ifPresent(variants::add);
            }
            return new EntityTerm(e.kind(), e.identifier(), sortedDistinct(variants, VARIANT_ORDER), e.location());
        }
        if (term instanceof ListTerm l) {
            return new ListTerm(l.kind(), sortedDistinct(normalizeAll(l.members(), out), TERM_ORDER), l.location());
        }
        if (term instanceof FusionTerm) {
            return term;
        }
        if (term instanceof ReactionTerm r) {
            return new ReactionTerm(sortedDistinct(normalizeAll(r.reactants(), out), TERM_ORDER),
                    sortedDistinct(normalizeAll(r.products(), out), TERM_ORDER));
        }
        if (term instanceof ActivityTerm a) {
            return new ActivityTerm(normalize(a.target(), out), molecularActivity(a, out));
        }
        if (term instanceof LegacyActivityTerm a) {
            Term target = normalize(a.target(), out);
            ActivityTerm rewritten = new ActivityTerm(target, Identifier.ofDefault(BelVocabulary.ACTIVITIES.get(a.function())));
            out.add(new Correction(ProblemCode.LEGACY_MOLECULAR_ACTIVITY,
                    BelWriter.write(a) + " -> " + BelWriter.write(rewritten)));
            return rewritten;
        }
        if (term instanceof TransformationTerm t) {
            return new TransformationTerm(t.kind(), normalize(t.target(), out), t.fromLocation(), t.toLocation());
        }
        if (term instanceof LegacyTranslocationTerm t) {
            TransformationTerm rewritten = new TransformationTerm(TermKind.TRANSLOCATION, normalize(t.target(), out),
                    t.fromLocation(), t.toLocation());
            out.add(new Correction(ProblemCode.LEGACY_TRANSLOCATION,
                    BelWriter.write(t) + " -> " + BelWriter.write(rewritten)));
            return rewritten;
        }
        if (term instanceof MemberList m) {
            return new MemberList(normalizeAll(m.members(), out));
        }
        throw new IllegalArgumentException("Unknown term: " + term);
    }

    private List<Term> normalizeAll(List<Term> terms, List<Correction> out) {
        return terms.stream().map(t -> normalize(t, out)).toList();
    }

    private Identifier molecularActivity(ActivityTerm term, List<Correction> out) {
        Identifier activity = term.molecularActivity();
        if (activity == null || !activity.isDefaultNamespace()) return activity;
        if (BelVocabulary.ACTIVITY_SHORT_NAMES.containsKey(activity.name())) return activity;
        malformed(Modifier.ACTIVITY, "ma(" + activity.name() + ") in " + BelWriter.write(term), out);
        return null;
    }

    private Optional<Variant> normalizeVariant(EntityTerm owner, Variant variant, List<Correction> out) {
        if (variant instanceof ProteinModification pmod) {
            return normalizeModification(owner, pmod, out);
        }
        if (variant instanceof Fragment f) {
            if (FRAGMENT_RANGE.matcher(f.range()).matches()) return Optional.of(f);
            malformed(Modifier.FRAGMENT, BelWriter.variant(f) + " in " + BelWriter.write(owner), out);
            return Optional.empty();
        }
        if (variant instanceof LegacySubstitution sub) {
            return normalizeSubstitution(owner, sub, out);
        }
        if (variant instanceof LegacyTruncation trunc) {
            if (trunc.position() <= 0) {
                malformed(Modifier.TRUNCATION, BelWriter.variant(trunc) + " in " + BelWriter.write(owner), out);
                return Optional.empty();
            }
            HgvsVariant rewritten = new HgvsVariant("p." + trunc.position() + "*");
            out.add(new Correction(ProblemCode.LEGACY_TRUNCATION,
                    BelWriter.variant(trunc) + " -> " + BelWriter.variant(rewritten)));
            return Optional.of(rewritten);
        }
        return Optional.of(variant);
    }

    private Optional<Variant> normalizeModification(EntityTerm owner, ProteinModification pmod, List<Correction> out) {
        Identifier type = pmod.type();
        boolean legacy = false;
        if (type.isDefaultNamespace() && !BelVocabulary.PMOD_TYPES.contains(type.name())) {
            String upgraded = BelVocabulary.LEGACY_PMOD_TYPES.get(type.name());
            if (upgraded == null) {
                malformed(Modifier.PMOD, BelWriter.variant(pmod) + " in " + BelWriter.write(owner), out);
                return Optional.empty();
            }
            type = Identifier.ofDefault(upgraded);
            legacy = true;
        }
        String aminoAcid = pmod.aminoAcid();
        if (aminoAcid != null && !BelVocabulary.AMINO_ACID_CODES.contains(aminoAcid)) {
            aminoAcid = BelVocabulary.aminoAcid(aminoAcid);
            if (aminoAcid == null) {
                malformed(Modifier.PMOD, BelWriter.variant(pmod) + " in " + BelWriter.write(owner), out);
                return Optional.empty();
            }
            legacy = true;
        }
        ProteinModification canonical = new ProteinModification(type, aminoAcid, pmod.position());
        if (legacy) {
            out.add(new Correction(ProblemCode.LEGACY_PROTEIN_MODIFICATION,
                    BelWriter.variant(pmod) + " -> " + BelWriter.variant(canonical)));
        }
        return Optional.of(canonical);
    }

    private Optional<Variant> normalizeSubstitution(EntityTerm owner, LegacySubstitution sub, List<Correction> out) {
        HgvsVariant rewritten = null;
        ProblemCode code;
        if (owner.kind() == TermKind.GENE) {
            code = ProblemCode.LEGACY_GENE_SUBSTITUTION;
            if (sub.position() > 0 && BelVocabulary.NUCLEOTIDES.contains(sub.reference())
                    && BelVocabulary.NUCLEOTIDES.contains(sub.variant())) {
                rewritten = new HgvsVariant("c." + sub.position() + sub.reference() + ">" + sub.variant());
            }
        } else {
            code = ProblemCode.LEGACY_PROTEIN_SUBSTITUTION;
            String reference = BelVocabulary.aminoAcid(sub.reference());
            String variant = BelVocabulary.aminoAcid(sub.variant());
            if (sub.position() > 0 && reference != null && variant != null) {
                rewritten = new HgvsVariant("p." + reference + sub.position() + variant);
            }
        }
        if (rewritten == null) {
            malformed(Modifier.SUBSTITUTION, BelWriter.variant(sub) + " in " + BelWriter.write(owner), out);
            return Optional.empty();
        }
        out.add(new Correction(code, BelWriter.variant(sub) + " -> " + BelWriter.variant(rewritten)));
        return Optional.of(rewritten);
    }

    private void malformed(Modifier modifier, String detail, List<Correction> out) {
        if (policy.actionFor(modifier) == MalformedModifierPolicy.Action.ERROR) {
            throw new UnrecognizedLegacyShapeException(detail);
        }
        out.add(new Correction(ProblemCode.MALFORMED_MODIFIER_DROPPED, detail));
    }

    private static <T> List<T> sortedDistinct(List<T> items, Comparator<T> order) {
        List<T> sorted = new ArrayList<>(new LinkedHashSet<>(items));
        sorted.sort(order);
        return sorted;
    }

    /** A warning produced while rewriting; {@code detail} shows the original and the rewritten shape. */
    public record Correction(ProblemCode code, String detail) {}

    public record NormalizedTerm(Term term, List<Correction> corrections) {
        public NormalizedTerm {
            corrections = List.copyOf(corrections);
        }
    }
}
