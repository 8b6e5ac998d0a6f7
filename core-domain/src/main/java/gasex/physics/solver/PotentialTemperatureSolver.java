package gasex.physics.solver;

import lombok.extern.slf4j.Slf4j;

import java.util.function.DoubleUnaryOperator;

/**
 * Invierte la relación pt -> CT para obtener la temperatura potencial a partir de la
 * Temperatura Conservativa. Utiliza el method de Newton-Raphson con derivada numérica
 * centrada; dCT/dpt es muy próxima a 1, así que CT es un buen valor inicial.
 * Esta clase es Thread safe.
 */
@Slf4j
public final class PotentialTemperatureSolver {

    private static final int MAX_ITERATIONS = 20;
    private static final double TOLERANCE = 1e-10; // °C
    private static final double DERIVATIVE_STEP = 1e-4; // °C

    /**
     * Prohibido construir esta clase utilidad
     */
    private PotentialTemperatureSolver() {
    }

    /**
     * Encuentra pt tal que {@code ctFromPt(pt) == conservativeTemperature}.
     *
     * @param conservativeTemperature CT objetivo [°C].
     * @param ctFromPt                Relación directa pt -> CT (para una salinidad fija).
     * @return La temperatura potencial [°C]. Si CT no es finita se devuelve tal cual (NaN se propaga).
     */
    public static double findPotentialTemperature(double conservativeTemperature, DoubleUnaryOperator ctFromPt) {
        if (!Double.isFinite(conservativeTemperature)) {
            return conservativeTemperature;
        }

        double pt = conservativeTemperature;

        for (int i = 0; i < MAX_ITERATIONS; i++) {
            // f(pt) = CT(pt) - CT_objetivo
            double f = ctFromPt.applyAsDouble(pt) - conservativeTemperature;
            double derivative = (ctFromPt.applyAsDouble(pt + DERIVATIVE_STEP)
                    - ctFromPt.applyAsDouble(pt - DERIVATIVE_STEP)) / (2.0 * DERIVATIVE_STEP);

            // Salinidades fuera de dominio (SA < 0) producen NaN; no hay nada que iterar.
            if (!Double.isFinite(f) || !Double.isFinite(derivative) || derivative == 0.0) {
                return Double.NaN;
            }

            double next = pt - f / derivative;
            if (Math.abs(next - pt) < TOLERANCE) {
                return next;
            }
            pt = next;
        }

        log.warn("Newton-Raphson no convergió en {} iteraciones para CT={}. Se devuelve la última estimación {}.",
                MAX_ITERATIONS, conservativeTemperature, pt);
        return pt;
    }
}
