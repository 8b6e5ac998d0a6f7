package gasex.physics.solver;

/**
 * Evaluación de polinomios por el esquema de Horner.
 * Los coeficientes van en orden ascendente: {@code c[0] + c[1]·x + c[2]·x² + ...}
 */
public final class HornerPolynomial {

    /**
     * Prohibido construir esta clase utilidad
     */
    private HornerPolynomial() {
    }

    public static double evaluate(double[] coefficients, double x) {
        double result = 0.0;
        for (int i = coefficients.length - 1; i >= 0; i--) {
            result = result * x + coefficients[i];
        }
        return result;
    }
}
