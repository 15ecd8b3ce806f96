package com.solstice.formulac.compiler.analysis;

import com.solstice.formulac.compiler.config.CompilerConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FormulaAnalyzerTest {

    private FormulaAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new FormulaAnalyzer(CompilerConfig.defaults());
    }

    @Test
    @DisplayName("Should find direct and chained entity calls")
    void testEntityCalls() {
        ReferenceSet refs = analyzer.analyze("""
                def formula(person, period, parameters):
                    rent = person.household("rent", period)
                    ages = household.members("age", period)
                    return person("income", period) - rent
                """);

        assertThat(refs.structural()).isTrue();
        assertThat(refs.variables()).containsExactly("rent", "age", "income");
        assertThat(refs.entityCalls()).extracting(ReferenceSet.EntityCall::accessor)
                .containsExactly("household", "members", "person");
    }

    @Test
    @DisplayName("Should ignore member calls without an entity receiver and unknown keywords")
    void testNonEntityCalls() {
        ReferenceSet refs = analyzer.analyze("members(\"x\", period) + company(\"y\", period)");

        assertThat(refs.variables()).isEmpty();
    }

    @Test
    @DisplayName("Should record each name listed in add()")
    void testAggregationHelper() {
        ReferenceSet refs = analyzer.analyze(
                "def formula(person, period, parameters):\n"
                        + "    return add(person, period, [\"employment_income\", \"pension_income\"])\n");

        assertThat(refs.variables()).containsExactly("employment_income", "pension_income");
        assertThat(refs.aggregationVariables()).containsExactly("employment_income", "pension_income");
        assertThat(refs.listCandidates()).isEmpty();
    }

    @Test
    @DisplayName("Should keep other literal name lists as candidates only")
    void testListCandidates() {
        ReferenceSet refs = analyzer.analyze("""
                def formula(person, period, parameters):
                    sources = ["dividend_income", "savings_interest"]
                    labels = ["Not A Name", "x"]
                    return 0
                """);

        assertThat(refs.variables()).isEmpty();
        assertThat(refs.listCandidates()).containsExactly("dividend_income", "savings_interest");
    }

    @Test
    @DisplayName("Should record maximal direct parameter chains")
    void testDirectParameters() {
        ReferenceSet refs = analyzer.analyze(
                "person(\"income\", period) * parameters(period).gov.tax.basic_rate");

        assertThat(refs.parameters()).containsExactly("gov.tax.basic_rate");
    }

    @Test
    @DisplayName("Should resolve alias chains through the alias table")
    void testAliasResolution() {
        ReferenceSet refs = analyzer.analyze("""
                def formula(person, period, parameters):
                    p = parameters(period).gov.tax
                    allowances = p.allowances
                    root = parameters(period)
                    return p.basic_rate + allowances.personal + root.gov.benefits.amount
                """);

        assertThat(refs.aliases())
                .containsEntry("p", "gov.tax")
                .containsEntry("allowances", "gov.tax.allowances")
                .containsEntry("root", "");
        assertThat(refs.parameters()).containsExactlyInAnyOrder(
                "gov.tax.basic_rate", "gov.tax.allowances.personal", "gov.benefits.amount");
    }

    @Test
    @DisplayName("Should treat a bare leaf alias as a reference to its path")
    void testLeafAlias() {
        ReferenceSet refs = analyzer.analyze("""
                def formula(person, period, parameters):
                    rate = parameters(period).gov.tax.basic_rate
                    return person("taxable_income", period) * rate
                """);

        assertThat(refs.parameters()).containsExactly("gov.tax.basic_rate");
    }

    @Test
    @DisplayName("Should stop a parameter chain before a called segment")
    void testCalledSegment() {
        ReferenceSet refs = analyzer.analyze("""
                def formula(person, period, parameters):
                    p = parameters(period).gov.tax
                    return p.scale.calc(person("income", period))
                """);

        assertThat(refs.parameters()).containsExactly("gov.tax.scale");
    }

    @Test
    @DisplayName("Should collect conditional call sites verbatim")
    void testConditionalCalls() {
        ReferenceSet refs = analyzer.analyze("where(a > 0, np.where(b, 1, 2), 3)");

        assertThat(refs.conditionalCalls()).containsExactly(
                "where(a > 0, np.where(b, 1, 2), 3)", "np.where(b, 1, 2)");
    }

    @Test
    @DisplayName("Should detect the entity type from the signature")
    void testEntityType() {
        assertThat(analyzer.analyze("def formula(household, period, parameters):\n    return 1\n").entityType())
                .isEqualTo("household");
        assertThat(analyzer.analyze("person(\"x\", period)").entityType()).isEqualTo("person");
    }

    @Test
    @DisplayName("Should return an empty set for blank formulas")
    void testBlankFormula() {
        ReferenceSet refs = analyzer.analyze("   ");

        assertThat(refs.isEmpty()).isTrue();
        assertThat(refs.structural()).isTrue();
    }

    @Test
    @DisplayName("Should fall back to the pattern scan when the formula cannot be tokenized")
    void testPatternFallback() {
        ReferenceSet refs = analyzer.analyze("""
                def formula(tax_unit, period, parameters):
                    p = parameters(period).gov.credits
                    bonus = tax_unit("bonus", period) $ 2
                    return add(tax_unit, period, ["earnings"]) + p.amount
                """);

        assertThat(refs.structural()).isFalse();
        assertThat(refs.variables()).contains("bonus", "earnings");
        assertThat(refs.parameters()).containsExactly("gov.credits.amount");
        assertThat(refs.entityType()).isEqualTo("tax_unit");
    }

    @Test
    @DisplayName("Should never throw, even on unbalanced input")
    void testNeverThrows() {
        assertThatCode(() -> analyzer.analyze("where(person(\"a\", period), 1")).doesNotThrowAnyException();
        assertThat(analyzer.analyze("where(person(\"a\", period), 1").variables()).containsExactly("a");
    }
}
