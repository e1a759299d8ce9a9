package com.belgraph.compiler;

import com.belgraph.compiler.parser.BelTermParser;
import com.belgraph.compiler.problem.MalformedTermException;
import com.belgraph.compiler.term.BelWriter;
import com.belgraph.compiler.term.TermModels.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BelTermParserTest {

    @Test
    void parsesProteinWithModification() {
        Term term = BelTermParser.parse("p(HGNC:YFG, pmod(Ph, Ser, 9))");

        EntityTerm protein = assertInstanceOf(EntityTerm.class, term);
        assertEquals(TermKind.PROTEIN, protein.kind());
        assertEquals(new Identifier("HGNC", "YFG"), protein.identifier());
        assertEquals(List.of(new ProteinModification(Identifier.ofDefault("Ph"), "Ser", 9)), protein.variants());
        assertNull(protein.location());
    }

    @Test
    void longAndShortFunctionNamesAreEquivalent() {
        assertEquals(BelTermParser.parse("p(HGNC:AKT1)"), BelTermParser.parse("proteinAbundance(HGNC:AKT1)"));
        assertEquals(BelTermParser.parse("complex(p(HGNC:AKT1), p(HGNC:JUN))"),
                BelTermParser.parse("complexAbundance(proteinAbundance(HGNC:AKT1), p(HGNC:JUN))"));
    }

    @Test
    void ignoresWhitespaceBetweenArguments() {
        assertEquals(BelTermParser.parse("p(HGNC:AKT1, pmod(Ph, Ser, 473))"),
                BelTermParser.parse("p( HGNC:AKT1 ,pmod( Ph,Ser , 473 ) )"));
    }

    @Test
    void readsQuotedNamesWithEscapes() {
        EntityTerm term = (EntityTerm) BelTermParser.parse("a(CHEBI:\"nitric \\\"oxide\\\"\")");
        assertEquals("nitric \"oxide\"", term.identifier().name());
        assertEquals("a(CHEBI:\"nitric \\\"oxide\\\"\")", BelWriter.write(term));
    }

    @Test
    void rejectsUnknownFunctionNames() {
        var ex = assertThrows(MalformedTermException.class, () -> BelTermParser.parse("protein(HGNC:AKT1)"));
        assertTrue(ex.getMessage().contains("protein"));
        assertThrows(MalformedTermException.class, () -> BelTermParser.parse("P(HGNC:AKT1)"));
    }

    @Test
    void rejectsModifiersOutsideTheirFunctions() {
        assertThrows(MalformedTermException.class, () -> BelTermParser.parse("g(HGNC:AKT1, pmod(Ph))"));
        assertThrows(MalformedTermException.class, () -> BelTermParser.parse("bp(GOBP:apoptosis, loc(GOCC:nucleus))"));
        assertThrows(MalformedTermException.class, () -> BelTermParser.parse("p(HGNC:AKT1, pmod(Ph, Ser, x))"));
    }

    @Test
    void rejectsBrokenShapes() {
        assertThrows(MalformedTermException.class, () -> BelTermParser.parse("p(HGNC:AKT1"));
        assertThrows(MalformedTermException.class, () -> BelTermParser.parse("p(AKT1)"));
        assertThrows(MalformedTermException.class, () -> BelTermParser.parse("tloc(p(HGNC:AKT1))"));
        assertThrows(MalformedTermException.class, () -> BelTermParser.parse("p(HGNC:AKT1) trailing"));
    }

    @Test
    void onlyAbundancesNestInsideOtherTerms() {
        assertThrows(MalformedTermException.class, () -> BelTermParser.parse("complex(act(p(HGNC:A)), p(HGNC:B))"));
        assertThrows(MalformedTermException.class, () -> BelTermParser.parse("complex(p(HGNC:A), list(p(HGNC:B)))"));
        assertThrows(MalformedTermException.class, () -> BelTermParser.parse("composite(p(HGNC:A), bp(GOBP:apoptosis))"));
        assertThrows(MalformedTermException.class, () -> BelTermParser.parse("act(bp(GOBP:apoptosis))"));
        assertThrows(MalformedTermException.class, () -> BelTermParser.parse("kin(path(MESH:Cancer))"));
        assertThrows(MalformedTermException.class, () -> BelTermParser.parse("deg(act(p(HGNC:A)))"));
        assertThrows(MalformedTermException.class, () -> BelTermParser.parse("sec(bp(GOBP:apoptosis))"));
        assertThrows(MalformedTermException.class, () -> BelTermParser.parse("surf(deg(p(HGNC:A)))"));
        assertThrows(MalformedTermException.class,
                () -> BelTermParser.parse("tloc(act(p(HGNC:A)), fromLoc(GOCC:cytoplasm), toLoc(GOCC:nucleus))"));
        assertThrows(MalformedTermException.class,
                () -> BelTermParser.parse("rxn(reactants(tloc(p(HGNC:A), fromLoc(GOCC:cytoplasm), toLoc(GOCC:nucleus))), products(a(CHEBI:B)))"));
        assertThrows(MalformedTermException.class,
                () -> BelTermParser.parse("rxn(reactants(a(CHEBI:A)), products(bp(GOBP:apoptosis)))"));

        assertInstanceOf(ListTerm.class, BelTermParser.parse("complex(complex(p(HGNC:A), p(HGNC:B)), a(CHEBI:C))"));
        assertInstanceOf(ActivityTerm.class, BelTermParser.parse("act(complex(SCOMP:\"AP-1 Complex\"))"));
    }

    @Test
    void parsesNestedAbundancesReactionsAndFusions() {
        ListTerm complex = (ListTerm) BelTermParser.parse("complex(p(HGNC:AKT1), a(CHEBI:ATP), loc(GOCC:cytoplasm))");
        assertEquals(2, complex.members().size());
        assertEquals(new Identifier("GOCC", "cytoplasm"), complex.location());

        EntityTerm named = (EntityTerm) BelTermParser.parse("complex(SCOMP:\"AP-1 Complex\")");
        assertEquals(TermKind.COMPLEX, named.kind());

        ReactionTerm reaction = (ReactionTerm) BelTermParser.parse("rxn(reactants(a(CHEBI:A), a(CHEBI:B)), products(a(CHEBI:C)))");
        assertEquals(2, reaction.reactants().size());
        assertEquals(1, reaction.products().size());

        FusionTerm fusion = (FusionTerm) BelTermParser.parse("r(fus(HGNC:TMPRSS2, r.1_79, HGNC:ERG, r.312_5034))");
        assertEquals(TermKind.RNA, fusion.kind());
        assertEquals("r.1_79", fusion.range5p());
        assertEquals("r(fus(HGNC:TMPRSS2, \"r.1_79\", HGNC:ERG, \"r.312_5034\"))", BelWriter.write(fusion));
    }

    @Test
    void keepsLegacyShapesForTheNormalizer() {
        assertInstanceOf(LegacyActivityTerm.class, BelTermParser.parse("kin(p(HGNC:YFG))"));
        assertInstanceOf(LegacyTranslocationTerm.class, BelTermParser.parse("tloc(p(HGNC:YFG), GOCC:cytoplasm, GOCC:nucleus)"));

        EntityTerm substituted = (EntityTerm) BelTermParser.parse("p(HGNC:YFG, sub(A, 127, Y), trunc(40))");
        assertEquals(List.of(new LegacySubstitution("A", 127, "Y"), new LegacyTruncation(40)), substituted.variants());
    }

    @Test
    void resolvesDefaultMolecularActivityNames() {
        assertEquals(BelTermParser.parse("act(p(HGNC:YFG), ma(KinaseActivity))"),
                BelTermParser.parse("activity(p(HGNC:YFG), molecularActivity(kin))"));
        assertEquals("act(p(HGNC:YFG), ma(kin))", BelWriter.write(BelTermParser.parse("act(p(HGNC:YFG), ma(kinaseActivity))")));
    }

    @Test
    void writesShortCanonicalForm() {
        Term term = BelTermParser.parse("proteinAbundance(HGNC:AKT1, proteinModification(Ph, Ser, 473), location(GOCC:nucleus))");
        assertEquals("p(HGNC:AKT1, pmod(Ph, Ser, 473), loc(GOCC:nucleus))", BelWriter.write(term));
        assertEquals("tloc(p(HGNC:AKT1), fromLoc(GOCC:cytoplasm), toLoc(GOCC:nucleus))",
                BelWriter.write(BelTermParser.parse("translocation(p(HGNC:AKT1), fromLoc(GOCC:cytoplasm), toLoc(GOCC:nucleus))")));
    }
}
