package com.belgraph.compiler;

import com.belgraph.compiler.parser.BelStatementParser;
import com.belgraph.compiler.parser.BelTermParser;
import com.belgraph.compiler.problem.BelStatementException;
import com.belgraph.compiler.problem.MalformedTermException;
import com.belgraph.compiler.problem.ProblemCode;
import com.belgraph.compiler.term.Relation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.belgraph.compiler.parser.StatementModels.*;
import static org.junit.jupiter.api.Assertions.*;

class BelStatementParserTest {
    private final BelStatementParser parser = new BelStatementParser();

    @Test
    void parsesRelationByKeywordAndSymbol() {
        RelationStatement word = (RelationStatement) parser.parse("p(HGNC:AKT1) increases p(HGNC:JUN)");
        assertEquals(Relation.INCREASES, word.relation());
        assertEquals(BelTermParser.parse("p(HGNC:AKT1)"), word.subject());
        assertEquals(BelTermParser.parse("p(HGNC:JUN)"), word.object());

        assertEquals(word, parser.parse("p(HGNC:AKT1) -> p(HGNC:JUN)"));
        assertEquals(Relation.DIRECTLY_DECREASES, ((RelationStatement) parser.parse("p(HGNC:AKT1) =| p(HGNC:JUN)")).relation());
        assertEquals(Relation.ASSOCIATION, ((RelationStatement) parser.parse("p(HGNC:AKT1) -- p(HGNC:JUN)")).relation());
        assertEquals(Relation.CAUSES_NO_CHANGE, ((RelationStatement) parser.parse("p(HGNC:AKT1) cnc p(HGNC:JUN)")).relation());
        assertEquals(Relation.TRANSCRIBED_TO, ((RelationStatement) parser.parse("g(HGNC:AKT1) :> r(HGNC:AKT1)")).relation());
    }

    @Test
    void parsesBareTermStatement() {
        TermStatement statement = (TermStatement) parser.parse("p(HGNC:AKT1, pmod(Ph))");
        assertEquals(BelTermParser.parse("p(HGNC:AKT1, pmod(Ph))"), statement.term());
    }

    @Test
    void parsesHeaderStatements() {
        assertEquals(new DocumentStatement("Name", "Test Document"), parser.parse("SET DOCUMENT Name = \"Test Document\""));
        assertEquals(new DocumentStatement("Version", "1.0"), parser.parse("SET DOCUMENT Version = 1.0"));

        DefineStatement url = (DefineStatement) parser.parse("DEFINE NAMESPACE HGNC AS URL \"classpath:definitions/hgnc.belns\"");
        assertEquals(DefinitionType.NAMESPACE, url.type());
        assertEquals(DefinitionSource.URL, url.source());
        assertEquals("classpath:definitions/hgnc.belns", url.location());

        DefineStatement list = (DefineStatement) parser.parse("DEFINE ANNOTATION Species AS LIST {\"9606\", \"10090\"}");
        assertEquals(List.of("9606", "10090"), list.values());

        DefineStatement pattern = (DefineStatement) parser.parse("DEFINE ANNOTATION Dose AS PATTERN \"[0-9]+mg\"");
        assertEquals("[0-9]+mg", pattern.location());
    }

    @Test
    void parsesAnnotationControlStatements() {
        SetStatement citation = (SetStatement) parser.parse("SET Citation = {\"PubMed\", \"Some Journal\", \"12345\"}");
        assertTrue(citation.braced());
        assertEquals(List.of("PubMed", "Some Journal", "12345"), citation.values());

        SetStatement evidence = (SetStatement) parser.parse("SET Evidence = \"AKT1 activates \\\"JUN\\\"\"");
        assertFalse(evidence.braced());
        assertEquals(List.of("AKT1 activates \"JUN\""), evidence.values());

        assertEquals(new UnsetStatement(List.of("Species", "CellLine")), parser.parse("UNSET {Species, CellLine}"));
        assertEquals(new UnsetStatement(List.of("Evidence")), parser.parse("UNSET Evidence"));
        assertEquals(new UnsetAllStatement(), parser.parse("UNSET ALL"));
    }

    @Test
    void lineMatchingNoPatternIsGeneralParserFailure() {
        var garbage = assertThrows(BelStatementException.class, () -> parser.parse("this is not BEL at all"));
        assertEquals(ProblemCode.GENERAL_PARSER_FAILURE, garbage.code());

        var relation = assertThrows(BelStatementException.class, () -> parser.parse("p(HGNC:AKT1) activates p(HGNC:JUN)"));
        assertEquals(ProblemCode.GENERAL_PARSER_FAILURE, relation.code());

        var set = assertThrows(BelStatementException.class, () -> parser.parse("SET Evidence \"missing equals\""));
        assertEquals(ProblemCode.GENERAL_PARSER_FAILURE, set.code());

        assertThrows(BelStatementException.class, () -> parser.parse("p(HGNC:AKT1) increases p(HGNC:JUN) p(HGNC:TP53)"));
    }

    @Test
    void rejectsNestedRelations() {
        var ex = assertThrows(BelStatementException.class,
                () -> parser.parse("p(HGNC:AKT1) -> (p(HGNC:JUN) -> bp(GOBP:apoptosis))"));
        assertEquals(ProblemCode.NESTED_RELATION, ex.code());
    }

    @Test
    void malformedTermsKeepTheirOwnCode() {
        var ex = assertThrows(MalformedTermException.class, () -> parser.parse("p(HGNC:AKT1) -> q(HGNC:JUN)"));
        assertEquals(ProblemCode.MALFORMED_TERM, ex.code());
    }
}
