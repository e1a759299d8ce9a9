package com.belgraph.compiler.term;

import com.belgraph.compiler.term.TermModels.*;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public final class BelWriter {
    private static final Pattern BARE_WORD = Pattern.compile("[A-Za-z0-9_.]+");

    private BelWriter() {}

    public static String write(Term term) {
        if (term instanceof EntityTerm e) {
            return call(BelVocabulary.SHORT_NAMES.get(e.kind()), join(
                    List.of(identifier(e.identifier())),
                    e.variants().stream().map(BelWriter::variant).toList(),
                    location(e.location())));
        }
        if (term instanceof ListTerm l) {
            return call(BelVocabulary.SHORT_NAMES.get(l.kind()), join(
                    l.members().stream().map(BelWriter::write).toList(),
                    List.of(),
                    location(l.location())));
        }
        if (term instanceof FusionTerm f) {
            String fusion = call("fus", List.of(identifier(f.partner5p()), quote(f.range5p()),
                    identifier(f.partner3p()), quote(f.range3p())));
            return call(BelVocabulary.SHORT_NAMES.get(f.kind()), join(List.of(fusion), List.of(), location(f.location())));
        }
        if (term instanceof ReactionTerm r) {
            return call("rxn", List.of(
                    call("reactants", r.reactants().stream().map(BelWriter::write).toList()),
                    call("products", r.products().stream().map(BelWriter::write).toList())));
        }
        if (term instanceof ActivityTerm a) {
            if (a.molecularActivity() == null) return call("act", List.of(write(a.target())));
            return call("act", List.of(write(a.target()), call("ma", List.of(activity(a.molecularActivity())))));
        }
        if (term instanceof LegacyActivityTerm a) {
            return call(a.function(), List.of(write(a.target())));
        }
        if (term instanceof TransformationTerm t) {
            String name = BelVocabulary.SHORT_NAMES.get(t.kind());
            if (t.fromLocation() == null && t.toLocation() == null) return call(name, List.of(write(t.target())));
            return call(name, List.of(write(t.target()),
                    call("fromLoc", List.of(identifier(t.fromLocation()))),
                    call("toLoc", List.of(identifier(t.toLocation())))));
        }
        if (term instanceof LegacyTranslocationTerm t) {
            return call("tloc", List.of(write(t.target()), identifier(t.fromLocation()), identifier(t.toLocation())));
        }
        if (term instanceof MemberList m) {
            return call("list", m.members().stream().map(BelWriter::write).toList());
        }
        throw new IllegalArgumentException("Unknown term: " + term);
    }

    public static String variant(Variant variant) {
        if (variant instanceof ProteinModification pmod) {
            List<String> args = new ArrayList<>();
            args.add(identifier(pmod.type()));
            if (pmod.aminoAcid() != null) args.add(pmod.aminoAcid());
            if (pmod.position() != null) args.add(String.valueOf(pmod.position()));
            return call("pmod", args);
        }
        if (variant instanceof HgvsVariant v) {
            return call("var", List.of(quote(v.description())));
        }
        if (variant instanceof Fragment f) {
            if (f.description() == null) return call("frag", List.of(quote(f.range())));
            return call("frag", List.of(quote(f.range()), quote(f.description())));
        }
        if (variant instanceof LegacySubstitution s) {
            return call("sub", List.of(s.reference(), String.valueOf(s.position()), s.variant()));
        }
        if (variant instanceof LegacyTruncation t) {
            return call("trunc", List.of(String.valueOf(t.position())));
        }
        throw new IllegalArgumentException("Unknown variant: " + variant);
    }

    public static String identifier(Identifier identifier) {
        if (identifier == null) return "";
        String name = BARE_WORD.matcher(identifier.name()).matches() ? identifier.name() : quote(identifier.name());
        return identifier.isDefaultNamespace() ? name : identifier.namespace() + ":" + name;
    }

    public static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static String activity(Identifier activity) {
        if (activity.isDefaultNamespace()) {
            String shortName = BelVocabulary.ACTIVITY_SHORT_NAMES.get(activity.name());
            if (shortName != null) return shortName;
        }
        return identifier(activity);
    }

    private static List<String> location(Identifier location) {
        return location == null ? List.of() : List.of(call("loc", List.of(identifier(location))));
    }

    private static List<String> join(List<String> head, List<String> middle, List<String> tail) {
        List<String> all = new ArrayList<>(head);
        all.addAll(middle);
        all.addAll(tail);
        return all;
    }

    private static String call(String function, List<String> args) {
        return args.stream().collect(Collectors.joining(", ", function + "(", ")"));
    }
}
