package com.belgraph.compiler.parser;

import com.belgraph.compiler.problem.MalformedTermException;
import com.belgraph.compiler.term.BelVocabulary;
import com.belgraph.compiler.term.TermModels.*;

import java.util.*;

public class BelTermParser {
    private final String text;
    private int pos;

    public BelTermParser(String text, int offset) {
        this.text = text;
        this.pos = offset;
    }

    /** Parses a whole string as exactly one term. */
    public static Term parse(String text) {
        BelTermParser parser = new BelTermParser(text, 0);
        Term term = parser.parseTerm();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw new MalformedTermException("unexpected text after term: " + text.substring(parser.pos));
        }
        return term;
    }

    /** Parses one term starting at the current position and leaves the cursor right after it. */
    public Term parseTerm() {
        skipWhitespace();
        Arg arg = readArg();
        if (!(arg instanceof Call call)) {
            throw new MalformedTermException("expected a function call at: " + snippet(arg.start()));
        }
        return build(call);
    }

    public int position() {
        return pos;
    }

    // ---- call tree reading

    sealed interface Arg permits Call, Atom {
        int start();
    }

    record Call(String name, List<Arg> args, int start, int end) implements Arg {}

    /** {@code value} or {@code namespace:value}; {@code quoted} tells whether the value was a string literal. */
    record Atom(String namespace, String value, boolean quoted, int start) implements Arg {}

    private Arg readArg() {
        skipWhitespace();
        int start = pos;
        if (check('"')) {
            return new Atom(null, readQuoted(), true, start);
        }
        String word = readWord(false);
        if (word.isEmpty()) {
            throw new MalformedTermException("expected an argument at: " + snippet(start));
        }
        int afterWord = pos;
        skipWhitespace();
        if (check('(')) {
            return readCall(word, start);
        }
        pos = afterWord;
        if (check(':')) {
            advance();
            if (check('"')) return new Atom(word, readQuoted(), true, start);
            String value = readWord(true);
            if (value.isEmpty()) throw new MalformedTermException("missing value after namespace " + word + ":");
            return new Atom(word, value, false, start);
        }
        return new Atom(null, word, false, start);
    }

    private Call readCall(String name, int start) {
        consume('(');
        List<Arg> args = new ArrayList<>();
        skipWhitespace();
        if (check(')')) {
            advance();
            return new Call(name, args, start, pos);
        }
        while (true) {
            args.add(readArg());
            skipWhitespace();
            if (check(',')) {
                advance();
            } else if (check(')')) {
                advance();
                return new Call(name, args, start, pos);
            } else {
                throw new MalformedTermException("unbalanced parentheses in: " + text.substring(start));
            }
        }
    }

    private String readWord(boolean allowColon) {
        int start = pos;
        while (!atEnd()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c) || c == '(' || c == ')' || c == ',' || c == '"') break;
            if (c == ':' && !allowColon) break;
            pos++;
        }
        return text.substring(start, pos);
    }

    private String readQuoted() {
        int start = pos;
        consume('"');
        StringBuilder sb = new StringBuilder();
        while (!atEnd()) {
            char c = text.charAt(pos++);
            if (c == '\\' && !atEnd()) {
                sb.append(text.charAt(pos++));
            } else if (c == '"') {
                return sb.toString();
            } else {
                sb.append(c);
            }
        }
        throw new MalformedTermException("unterminated string: " + text.substring(start));
    }

    void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(text.charAt(pos))) pos++;
    }

    boolean atEnd() {
        return pos >= text.length();
    }

    private boolean check(char c) {
        return !atEnd() && text.charAt(pos) == c;
    }

    private void advance() {
        pos++;
    }

    private void consume(char c) {
        if (!check(c)) throw new MalformedTermException("expected '" + c + "' at: " + snippet(pos));
        advance();
    }

    private String snippet(int from) {
        return from >= text.length() ? "<end of line>" : text.substring(from);
    }

    private String source(Call call) {
        return text.substring(call.start(), call.end());
    }

    // ---- term building

    private Term build(Call call) {
        String name = call.name();
        if (BelVocabulary.isLegacyActivityFunction(name)) {
            requireArity(call, 1, 1);
            return new LegacyActivityTerm(name, buildAbundance(call.args().get(0), call));
        }
        TermKind kind = BelVocabulary.FUNCTIONS.get(name);
        if (kind == null) {
            throw new MalformedTermException("unknown function " + name + " in " + source(call));
        }
        return switch (kind) {
            case ABUNDANCE, GENE, RNA, MIRNA, PROTEIN, BIOLOGICAL_PROCESS, PATHOLOGY -> buildEntity(kind, call);
            case COMPLEX, COMPOSITE -> buildListAbundance(kind, call);
            case REACTION -> buildReaction(call);
            case ACTIVITY -> buildActivity(call);
            case TRANSLOCATION -> buildTranslocation(call);
            case DEGRADATION, CELL_SECRETION, CELL_SURFACE_EXPRESSION -> {
                requireArity(call, 1, 1);
                yield new TransformationTerm(kind, buildAbundance(call.args().get(0), call), null, null);
            }
            case LIST -> new MemberList(buildTerms(call.args(), call));
        };
    }

    private Term buildEntity(TermKind kind, Call call) {
        requireArity(call, 1, Integer.MAX_VALUE);
        Arg first = call.args().get(0);
        if (first instanceof Call fus && isFusion(fus.name())) {
            return buildFusion(kind, fus, call);
        }
        Identifier identifier = namespaced(first, call);
        List<Variant> variants = new ArrayList<>();
        Identifier location = null;
        for (Arg arg : call.args().subList(1, call.args().size())) {
            Call modifier = modifierCall(arg, call);
            String name = modifier.name();
            if (isLocation(name)) {
                if (location != null) throw new MalformedTermException("more than one loc() in " + source(call));
                location = buildLocation(kind, modifier, call);
            } else {
                variants.add(buildVariant(kind, modifier, call));
            }
        }
        return new EntityTerm(kind, identifier, variants, location);
    }

    private Term buildFusion(TermKind kind, Call fus, Call call) {
        if (kind != TermKind.GENE && kind != TermKind.RNA && kind != TermKind.PROTEIN) {
            throw new MalformedTermException("fus() is not valid in " + source(call));
        }
        Identifier location = null;
        for (Arg arg : call.args().subList(1, call.args().size())) {
            Call modifier = modifierCall(arg, call);
            if (!isLocation(modifier.name()) || location != null) {
                throw new MalformedTermException("a fusion only takes one loc() in " + source(call));
            }
            location = buildLocation(kind, modifier, call);
        }
        List<Arg> args = fus.args();
        if (args.size() == 2) {
            return new FusionTerm(kind, namespaced(args.get(0), call), "?", namespaced(args.get(1), call), "?", location);
        }
        requireArity(fus, 4, 4);
        return new FusionTerm(kind, namespaced(args.get(0), call), atom(args.get(1), call).value(),
                namespaced(args.get(2), call), atom(args.get(3), call).value(), location);
    }

    private Variant buildVariant(TermKind kind, Call modifier, Call call) {
        String name = modifier.name();
        List<Arg> args = modifier.args();
        switch (name) {
            case "pmod", "proteinModification" -> {
                requireKind(kind, call, name, TermKind.PROTEIN);
                requireArity(modifier, 1, 3);
                Atom type = atom(args.get(0), call);
                String aminoAcid = args.size() > 1 ? atom(args.get(1), call).value() : null;
                Integer position = args.size() > 2 ? integer(args.get(2), call) : null;
                return new ProteinModification(new Identifier(type.namespace(), type.value()), aminoAcid, position);
            }
            case "var", "variant" -> {
                requireKind(kind, call, name, TermKind.GENE, TermKind.RNA, TermKind.MIRNA, TermKind.PROTEIN);
                requireArity(modifier, 1, 1);
                return new HgvsVariant(atom(args.get(0), call).value());
            }
            case "frag", "fragment" -> {
                requireKind(kind, call, name, TermKind.PROTEIN);
                requireArity(modifier, 1, 2);
                String description = args.size() > 1 ? atom(args.get(1), call).value() : null;
                return new Fragment(atom(args.get(0), call).value(), description);
            }
            case "sub", "substitution" -> {
                requireKind(kind, call, name, TermKind.GENE, TermKind.PROTEIN);
                requireArity(modifier, 3, 3);
                return new LegacySubstitution(atom(args.get(0), call).value(), integer(args.get(1), call), atom(args.get(2), call).value());
            }
            case "trunc", "truncation" -> {
                requireKind(kind, call, name, TermKind.PROTEIN);
                requireArity(modifier, 1, 1);
                return new LegacyTruncation(integer(args.get(0), call));
            }
            default -> throw new MalformedTermException(name + "() is not a modifier in " + source(call));
        }
    }

    private Identifier buildLocation(TermKind kind, Call modifier, Call call) {
        if (!kind.isAbundance()) throw new MalformedTermException("loc() is not valid in " + source(call));
        requireArity(modifier, 1, 1);
        return namespaced(modifier.args().get(0), call);
    }

    private Term buildListAbundance(TermKind kind, Call call) {
        requireArity(call, 1, Integer.MAX_VALUE);
        List<Arg> args = new ArrayList<>(call.args());
        Identifier location = null;
        Arg last = args.get(args.size() - 1);
        if (last instanceof Call c && isLocation(c.name())) {
            location = buildLocation(kind, c, call);
            args.remove(args.size() - 1);
        }
        if (kind == TermKind.COMPLEX && args.size() == 1 && args.get(0) instanceof Atom) {
            return new EntityTerm(kind, namespaced(args.get(0), call), List.of(), location);
        }
        if (args.isEmpty()) throw new MalformedTermException("no members in " + source(call));
        return new ListTerm(kind, buildAbundances(args, call), location);
    }

    private Term buildReaction(Call call) {
        requireArity(call, 2, 2);
        Call reactants = expectCall(call.args().get(0), "reactants", call);
        Call products = expectCall(call.args().get(1), "products", call);
        return new ReactionTerm(buildAbundances(reactants.args(), call), buildAbundances(products.args(), call));
    }

    private Term buildActivity(Call call) {
        requireArity(call, 1, 2);
        Term target = buildAbundance(call.args().get(0), call);
        if (call.args().size() == 1) return new ActivityTerm(target, null);
        Call ma = call.args().get(1) instanceof Call c && (c.name().equals("ma") || c.name().equals("molecularActivity"))
                ? c : null;
        if (ma == null) throw new MalformedTermException("expected ma() in " + source(call));
        requireArity(ma, 1, 1);
        Atom activity = atom(ma.args().get(0), call);
        if (activity.namespace() == null) {
            String label = BelVocabulary.activityLabel(activity.value());
            return new ActivityTerm(target, Identifier.ofDefault(label == null ? activity.value() : label));
        }
        return new ActivityTerm(target, new Identifier(activity.namespace(), activity.value()));
    }

    private Term buildTranslocation(Call call) {
        if (call.args().size() < 3) {
            throw new MalformedTermException("tloc() needs a source and a destination in " + source(call));
        }
        requireArity(call, 3, 3);
        Term target = buildAbundance(call.args().get(0), call);
        Arg from = call.args().get(1);
        Arg to = call.args().get(2);
        if (from instanceof Atom && to instanceof Atom) {
            return new LegacyTranslocationTerm(target, namespaced(from, call), namespaced(to, call));
        }
        Call fromLoc = expectCall(from, "fromLoc", call);
        Call toLoc = expectCall(to, "toLoc", call);
        requireArity(fromLoc, 1, 1);
        requireArity(toLoc, 1, 1);
        return new TransformationTerm(TermKind.TRANSLOCATION, target,
                namespaced(fromLoc.args().get(0), call), namespaced(toLoc.args().get(0), call));
    }

    private List<Term> buildTerms(List<Arg> args, Call parent) {
        return args.stream().map(arg -> buildTerm(arg, parent)).toList();
    }

    private Term buildTerm(Arg arg, Call parent) {
        if (arg instanceof Call call) return build(call);
        throw new MalformedTermException("expected a term in " + source(parent));
    }

    private List<Term> buildAbundances(List<Arg> args, Call parent) {
        return args.stream().map(arg -> buildAbundance(arg, parent)).toList();
    }

    /** Members, reactants, products and the targets of act/tloc/deg/sec/surf must be abundances. */
    private Term buildAbundance(Arg arg, Call parent) {
        Term term = buildTerm(arg, parent);
        if (!term.kind().isAbundance()) {
            throw new MalformedTermException("expected an abundance, found " + source((Call) arg) + " in " + source(parent));
        }
        return term;
    }

    // ---- argument helpers

    private Call modifierCall(Arg arg, Call parent) {
        if (arg instanceof Call call) return call;
        throw new MalformedTermException("unexpected argument in " + source(parent));
    }

    private Call expectCall(Arg arg, String name, Call parent) {
        if (arg instanceof Call call && call.name().equals(name)) return call;
        throw new MalformedTermException("expected " + name + "() in " + source(parent));
    }

    private Atom atom(Arg arg, Call parent) {
        if (arg instanceof Atom atom) return atom;
        throw new MalformedTermException("expected a value, found a function in " + source(parent));
    }

    private Identifier namespaced(Arg arg, Call parent) {
        Atom atom = atom(arg, parent);
        if (atom.namespace() == null) {
            throw new MalformedTermException("missing namespace for " + atom.value() + " in " + source(parent));
        }
        return new Identifier(atom.namespace(), atom.value());
    }

    private int integer(Arg arg, Call parent) {
        Atom atom = atom(arg, parent);
        try {
            return Integer.parseInt(atom.value());
        } catch (NumberFormatException e) {
            throw new MalformedTermException("expected a position, found " + atom.value() + " in " + source(parent));
        }
    }

    private void requireArity(Call call, int min, int max) {
        int n = call.args().size();
        if (n < min || n > max) {
            throw new MalformedTermException("wrong number of arguments for " + call.name() + "() in " + source(call));
        }
    }

    private void requireKind(TermKind kind, Call call, String modifier, TermKind... allowed) {
        if (!Arrays.asList(allowed).contains(kind)) {
            throw new MalformedTermException(modifier + "() is not valid in " + source(call));
        }
    }

    private static boolean isLocation(String name) {
        return name.equals("loc") || name.equals("location");
    }

    private static boolean isFusion(String name) {
        return name.equals("fus") || name.equals("fusion");
    }
}
