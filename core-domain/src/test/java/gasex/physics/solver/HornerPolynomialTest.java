package gasex.physics.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HornerPolynomialTest {

    @Test
    @DisplayName("Horner: coeficientes en orden ascendente")
    void evaluate_shouldUseAscendingCoefficients() {
        // 1 + 2x + 3x² en x = 2 -> 1 + 4 + 12 = 17
        assertEquals(17.0, HornerPolynomial.evaluate(new double[]{1.0, 2.0, 3.0}, 2.0), 1e-12);
    }

    @Test
    @DisplayName("Horner: un polinomio vacío vale 0 y uno constante vale su término independiente")
    void evaluate_degenerateCases() {
        assertEquals(0.0, HornerPolynomial.evaluate(new double[0], 5.0));
        assertEquals(-3.5, HornerPolynomial.evaluate(new double[]{-3.5}, 100.0));
    }
}
