package gasex.physics.model;

import gasex.physics.solver.HornerPolynomial;

/**
 * Número de Schmidt del CO2 (Wanninkhof, 1992).
 * <p>
 * El artículo da dos cúbicas en temperatura, una para agua de mar (S = 35) y otra para
 * agua dulce (S = 0). Para salinidades intermedias se interpola linealmente en SP:
 * <pre>{@code
 *    Sc = Sc_dulce(t) + (Sc_mar(t) - Sc_dulce(t)) · SP / 35
 * }</pre>
 * Válido en 0-30 °C; fuera de ese rango es una extrapolación de la cúbica.
 */
public final class Co2SchmidtNumberModel {

    static final double[] SEAWATER = {2073.1, -125.62, 3.6276, -0.043219};
    static final double[] FRESHWATER = {1911.1, -118.11, 3.4527, -0.04132};

    static final double SEAWATER_SALINITY = 35.0;

    public double schmidtNumber(double practicalSalinity, double temperature) {
        double freshwater = HornerPolynomial.evaluate(FRESHWATER, temperature);
        double seawater = HornerPolynomial.evaluate(SEAWATER, temperature);
        return freshwater + (seawater - freshwater) * practicalSalinity / SEAWATER_SALINITY;
    }
}
