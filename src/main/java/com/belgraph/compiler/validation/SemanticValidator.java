package com.belgraph.compiler.validation;

import com.belgraph.compiler.problem.SemanticMismatchException;
import com.belgraph.compiler.term.Relation;
import com.belgraph.compiler.term.TermModels.MemberList;
import com.belgraph.compiler.term.TermModels.Term;
import com.belgraph.compiler.term.TermModels.TermKind;

import java.util.Optional;
import java.util.Set;

public class SemanticValidator {
    private static final Set<TermKind> ORTHOLOGOUS_KINDS = Set.of(TermKind.GENE, TermKind.RNA, TermKind.PROTEIN);

    public void validate(Term subject, Relation relation, Term object) {
        if (relation.isListRelation()) {
            if (!(object instanceof MemberList list)) {
                throw new SemanticMismatchException(relation.keyword() + " needs a list(...) object, found " + object.kind());
            }
            for (Term member : list.members()) {
                check(subject.kind(), relation.singular(), member.kind())
                        .ifPresent(m -> { throw new SemanticMismatchException(m); });
            }
            return;
        }
        check(subject.kind(), relation, object.kind())
                .ifPresent(m -> { throw new SemanticMismatchException(m); });
    }

    /** Description of the incompatible combination, or empty when it is allowed. */
    public Optional<String> check(TermKind subject, Relation relation, TermKind object) {
        if (subject == TermKind.LIST || object == TermKind.LIST) {
            return mismatch(subject, relation, object);
        }
        boolean allowed = switch (relation) {
            case TRANSCRIBED_TO -> subject == TermKind.GENE && (object == TermKind.RNA || object == TermKind.MIRNA);
            case TRANSLATED_TO -> subject == TermKind.RNA && object == TermKind.PROTEIN;
            case RATE_LIMITING_STEP_OF -> (subject == TermKind.BIOLOGICAL_PROCESS || subject == TermKind.ACTIVITY
                    || subject.isTransformation()) && object == TermKind.BIOLOGICAL_PROCESS;
            case SUB_PROCESS_OF -> (subject.isProcess() || subject.isTransformation()) && object.isProcess();
            case HAS_COMPONENT, HAS_COMPONENTS -> (subject == TermKind.COMPLEX || subject == TermKind.COMPOSITE)
                    && object.isAbundance();
            case HAS_MEMBER, HAS_MEMBERS -> subject.isAbundance() && object.isAbundance();
            case BIOMARKER_FOR, PROGNOSTIC_BIOMARKER_FOR -> object.isProcess();
            case ORTHOLOGOUS -> ORTHOLOGOUS_KINDS.contains(subject) && subject == object;
            default -> true;
        };
        return allowed ? Optional.empty() : mismatch(subject, relation, object);
    }

    private static Optional<String> mismatch(TermKind subject, Relation relation, TermKind object) {
        return Optional.of(subject + " " + relation.keyword() + " " + object + " is not allowed");
    }
}
