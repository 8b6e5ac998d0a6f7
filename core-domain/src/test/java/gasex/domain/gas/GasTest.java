package gasex.domain.gas;

import gasex.domain.exception.UnsupportedGasException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class GasTest {

    @Test
    @DisplayName("Resolución de símbolos: insensible a mayúsculas y espacios")
    void fromSymbol_shouldIgnoreCaseAndWhitespace() {
        assertEquals(Gas.O2, Gas.fromSymbol("O2"));
        assertEquals(Gas.CO2, Gas.fromSymbol("co2"));
        assertEquals(Gas.HE, Gas.fromSymbol(" He "));
        assertEquals(Gas.CH4, Gas.fromSymbol("ch4"));
    }

    @Test
    @DisplayName("Símbolo desconocido: debe lanzar UnsupportedGasException con el símbolo original")
    void fromSymbol_unknownSymbol_shouldThrow() {
        assertThatThrownBy(() -> Gas.fromSymbol("SF6"))
                .isInstanceOf(UnsupportedGasException.class)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("SF6");

        assertThatThrownBy(() -> Gas.fromSymbol(null))
                .isInstanceOf(UnsupportedGasException.class);
    }

    @Test
    @DisplayName("Cobertura: ocho gases con solubilidad y diez con difusividad")
    void supportedSets_shouldMatchPublishedFits() {
        assertThat(Gas.solubilityGases())
                .containsExactlyInAnyOrder(Gas.HE, Gas.NE, Gas.AR, Gas.KR, Gas.N2, Gas.N2O, Gas.CO2, Gas.O2);

        assertThat(Gas.diffusivityGases())
                .containsExactlyInAnyOrder(Gas.O2, Gas.HE, Gas.NE, Gas.AR, Gas.KR, Gas.XE, Gas.N2, Gas.CH4, Gas.CO2, Gas.H2)
                .doesNotContain(Gas.N2O);
    }
}
