package com.belgraph.compiler;

import com.belgraph.compiler.parser.BelTermParser;
import com.belgraph.compiler.problem.SemanticMismatchException;
import com.belgraph.compiler.term.Relation;
import com.belgraph.compiler.term.TermModels.MemberList;
import com.belgraph.compiler.term.TermModels.Term;
import com.belgraph.compiler.validation.SemanticValidator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.belgraph.compiler.term.TermModels.TermKind.*;
import static org.junit.jupiter.api.Assertions.*;

class SemanticValidatorTest {
    private final SemanticValidator validator = new SemanticValidator();

    @Test
    void causalRelationsAcceptAnyKinds() {
        assertTrue(validator.check(PROTEIN, Relation.INCREASES, BIOLOGICAL_PROCESS).isEmpty());
        assertTrue(validator.check(ACTIVITY, Relation.DIRECTLY_DECREASES, DEGRADATION).isEmpty());
        assertTrue(validator.check(PATHOLOGY, Relation.POSITIVE_CORRELATION, ABUNDANCE).isEmpty());
    }

    @Test
    void genomicRelationsFollowTheCentralDogma() {
        assertTrue(validator.check(GENE, Relation.TRANSCRIBED_TO, RNA).isEmpty());
        assertTrue(validator.check(GENE, Relation.TRANSCRIBED_TO, MIRNA).isEmpty());
        assertTrue(validator.check(RNA, Relation.TRANSLATED_TO, PROTEIN).isEmpty());

        assertTrue(validator.check(PROTEIN, Relation.TRANSCRIBED_TO, RNA).isPresent());
        assertTrue(validator.check(GENE, Relation.TRANSLATED_TO, PROTEIN).isPresent());
    }

    @Test
    void hierarchicalAndMembershipRules() {
        assertTrue(validator.check(BIOLOGICAL_PROCESS, Relation.SUB_PROCESS_OF, PATHOLOGY).isEmpty());
        assertTrue(validator.check(PROTEIN, Relation.SUB_PROCESS_OF, BIOLOGICAL_PROCESS).isPresent());
        assertTrue(validator.check(COMPLEX, Relation.HAS_COMPONENT, PROTEIN).isEmpty());
        assertTrue(validator.check(PROTEIN, Relation.HAS_COMPONENT, PROTEIN).isPresent());
        assertTrue(validator.check(REACTION, Relation.RATE_LIMITING_STEP_OF, BIOLOGICAL_PROCESS).isEmpty());
        assertTrue(validator.check(PROTEIN, Relation.RATE_LIMITING_STEP_OF, BIOLOGICAL_PROCESS).isPresent());
        assertTrue(validator.check(PROTEIN, Relation.ORTHOLOGOUS, PROTEIN).isEmpty());
        assertTrue(validator.check(PROTEIN, Relation.ORTHOLOGOUS, GENE).isPresent());
    }

    @Test
    void listRelationChecksEveryMember() {
        Term family = BelTermParser.parse("p(SFAM:\"AKT Family\")");
        MemberList members = (MemberList) BelTermParser.parse("list(p(HGNC:AKT1), p(HGNC:AKT2))");
        assertDoesNotThrow(() -> validator.validate(family, Relation.HAS_MEMBERS, members));

        MemberList mixed = (MemberList) BelTermParser.parse("list(p(HGNC:AKT1), bp(GOBP:apoptosis))");
        var ex = assertThrows(SemanticMismatchException.class, () -> validator.validate(family, Relation.HAS_MEMBERS, mixed));
        assertTrue(ex.detail().contains("hasMember"));
    }

    @Test
    void listObjectOnlyWithListRelations() {
        Term subject = BelTermParser.parse("p(HGNC:AKT1)");
        MemberList members = new MemberList(List.of(BelTermParser.parse("p(HGNC:JUN)")));
        assertThrows(SemanticMismatchException.class, () -> validator.validate(subject, Relation.INCREASES, members));
        assertThrows(SemanticMismatchException.class,
                () -> validator.validate(subject, Relation.HAS_COMPONENTS, BelTermParser.parse("p(HGNC:JUN)")));
    }
}
