package com.belgraph.compiler.validation;

import com.belgraph.compiler.definition.DefinitionRegistry;
import com.belgraph.compiler.parser.StatementModels.DefinitionType;
import com.belgraph.compiler.problem.InvalidIdentifierException;
import com.belgraph.compiler.problem.ProblemCode;
import com.belgraph.compiler.term.BelWriter;
import com.belgraph.compiler.term.TermModels.*;

import java.util.ArrayList;
import java.util.List;

public class IdentifierValidator {
    private final DefinitionRegistry registry;
    private final boolean strictNamespaces;

    public IdentifierValidator(DefinitionRegistry registry, boolean strictNamespaces) {
        this.registry = registry;
        this.strictNamespaces = strictNamespaces;
    }

    public void validate(Term term) {
        List<Identifier> identifiers = new ArrayList<>();
        collect(term, identifiers);
        for (Identifier identifier : identifiers) {
            if (identifier == null || identifier.isDefaultNamespace()) continue;
            if (!registry.isDefined(DefinitionType.NAMESPACE, identifier.namespace())) {
                if (strictNamespaces) {
                    throw new InvalidIdentifierException(ProblemCode.UNDEFINED_NAMESPACE, identifier.namespace());
                }
                continue;
            }
            boolean valid = registry.valueSet(DefinitionType.NAMESPACE, identifier.namespace())
                    .map(values -> values.contains(identifier.name()))
                    .orElse(false);
            if (!valid) {
                throw new InvalidIdentifierException(ProblemCode.INVALID_NAMESPACE_VALUE, BelWriter.identifier(identifier));
            }
        }
    }

    private static void collect(Term term, List<Identifier> out) {
        if (term instanceof EntityTerm e) {
            out.add(e.identifier());
            out.add(e.location());
            for (Variant variant : e.variants()) {
                if (variant instanceof ProteinModification pmod) out.add(pmod.type());
            }
        } else if (term instanceof ListTerm l) {
            l.members().forEach(m -> collect(m, out));
            out.add(l.location());
        } else if (term instanceof FusionTerm f) {
            out.add(f.partner5p());
            out.add(f.partner3p());
            out.add(f.location());
        } else if (term instanceof ReactionTerm r) {
            r.reactants().forEach(m -> collect(m, out));
            r.products().forEach(m -> collect(m, out));
        } else if (term instanceof ActivityTerm a) {
            collect(a.target(), out);
            out.add(a.molecularActivity());
        } else if (term instanceof LegacyActivityTerm a) {
            collect(a.target(), out);
        } else if (term instanceof TransformationTerm t) {
            collect(t.target(), out);
            out.add(t.fromLocation());
            out.add(t.toLocation());
        } else if (term instanceof LegacyTranslocationTerm t) {
            collect(t.target(), out);
            out.add(t.fromLocation());
            out.add(t.toLocation());
        } else if (term instanceof MemberList m) {
            m.members().forEach(member -> collect(member, out));
        }
    }
}
