package org.archipel.evolution;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.archipel.evolution.IntListRepresentation.IDENTITY;
import static org.archipel.evolution.IntListRepresentation.OTHER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ModelTest {

    @Test
    void addPopulation_expandsDuplicatesInOrder() {
        Operation first = IntListRepresentation.init(1);
        Operation second = IntListRepresentation.init(2);

        Model model = Model.builder(IDENTITY)
            .addPopulation(first, Pipeline.of(), 2)
            .addPopulation(second, Pipeline.of())
            .build();

        assertThat(model.numPopulations()).isEqualTo(3);
        assertThat(model.populations()).extracting(Lineage::initializer).containsExactly(first, first, second);
        assertThat(model.objective()).isSameAs(IDENTITY);
    }

    @Test
    void addPopulation_rejectsInitializerWithoutOutputRepresentation() {
        assertThatThrownBy(() -> Model.builder(IDENTITY).addPopulation(IntListRepresentation.identity("not an init"), Pipeline.of()))
            .isInstanceOf(InvalidInitializerException.class)
            .hasMessage("expected an initializer operation, got: \"not an init\"");
    }

    @Test
    void addPopulation_validatesPipelineAgainstInitializer() {
        Operation otherOnly = Operation.builder("other only").inRepresentations(OTHER).impl((p, c) -> p).build();

        assertThatThrownBy(() -> Model.builder(IDENTITY).addPopulation(IntListRepresentation.init(1), Pipeline.of(otherOnly)))
            .isInstanceOf(RepresentationMismatchException.class);
    }

    @Test
    void build_requiresAtLeastOnePopulation() {
        assertThatThrownBy(() -> Model.builder(IDENTITY).build()).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> Model.builder(IDENTITY).addPopulation(IntListRepresentation.init(1), Pipeline.of(), 0))
            .isInstanceOf(ConfigurationException.class);
    }
}
