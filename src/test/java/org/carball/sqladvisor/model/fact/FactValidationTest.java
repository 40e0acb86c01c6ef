package org.carball.sqladvisor.model.fact;

import org.carball.sqladvisor.error.InvalidFactException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThatCode;

class FactValidationTest {

    @Test
    void shouldExposeQueryShapeAttributesByRuleName() {
        QueryShapeFact fact = QueryShapeFact.builder()
                .correlated(true)
                .reuseCount(2)
                .resultCardinalityHint(CardinalityHint.SET)
                .build();

        assertThat(fact.attribute("isCorrelated")).isEqualTo(true);
        assertThat(fact.attribute("reuseCount")).isEqualTo(2);
        assertThat(fact.attribute("resultCardinalityHint")).isEqualTo("SET");
        assertThat(fact.attribute("relationOptional")).isEqualTo(false);
        assertThatThrownBy(() -> fact.attribute("pageCount")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldDeclareEveryExposedAttributeInSchema() {
        QueryShapeFact shape = QueryShapeFact.builder().resultCardinalityHint(CardinalityHint.SCALAR).build();
        MergeDecisionFact merge = MergeDecisionFact.builder().build();
        FragmentationFact fragmentation = FragmentationFact.of(1);

        FactType.QUERY_SHAPE.getAttributes().keySet().forEach(name -> assertThat(shape.attribute(name)).isNotNull());
        FactType.MERGE_DECISION.getAttributes().keySet().forEach(name -> assertThat(merge.attribute(name)).isNotNull());
        FactType.FRAGMENTATION.getAttributes().keySet()
                .forEach(name -> assertThat(fragmentation.attribute(name)).isNotNull());
    }

    @Test
    void shouldAcceptFragmentationBounds() {
        assertThatCode(() -> FragmentationFact.of(0.0).validate()).doesNotThrowAnyException();
        assertThatCode(() -> FragmentationFact.of(100.0).validate()).doesNotThrowAnyException();
    }

    @Test
    void shouldCarryOffendingFact() {
        FragmentationFact fact = FragmentationFact.of(-3.0);

        assertThatThrownBy(fact::validate)
                .isInstanceOfSatisfying(InvalidFactException.class, e -> assertThat(e.getFact()).isSameAs(fact));
    }

    @Test
    void shouldDefaultMergeRowEstimateToSmall() {
        MergeDecisionFact fact = MergeDecisionFact.builder().conditionalBranchCount(2).build();

        assertThat(fact.getEstimatedRowCount()).isEqualTo(RowCountEstimate.SMALL);
        assertThatThrownBy(() -> fact.toBuilder().estimatedRowCount(null).build().validate())
                .isInstanceOf(InvalidFactException.class)
                .hasMessageContaining("estimatedRowCount");
    }
}
