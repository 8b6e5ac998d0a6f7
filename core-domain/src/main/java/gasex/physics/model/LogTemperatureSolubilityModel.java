package gasex.physics.model;

import gasex.domain.gas.SolubilityUnit;
import gasex.physics.solver.HornerPolynomial;
import gasex.physics.thermo.TemperatureScale;
import lombok.Builder;
import lombok.Getter;

/**
 * Familia de ajustes en temperatura escalada logarítmica (Benson &amp; Krause / Garcia &amp; Gordon,
 * Hamme &amp; Emerson).
 * <pre>{@code
 *    y    = ln((298.15 - T) / (273.15 + T))
 *    ln C = A(y) + SP·(B(y) + c·SP)
 *    C    = scale · exp(ln C)
 * }</pre>
 * donde A y B son polinomios en y de grado arbitrario. T es ITS-90 salvo que el ajuste
 * original esté referido a IPTS-68 ({@code ipts68 = true}).
 */
public final class LogTemperatureSolubilityModel implements SolubilityModel {

    private final double[] a;
    private final double[] b;
    private final double c;
    private final boolean ipts68;
    private final double scale;
    @Getter
    private final SolubilityUnit unit;

    /**
     * @param a      Coeficientes de temperatura, orden ascendente en y.
     * @param b      Coeficientes de salinidad, orden ascendente en y.
     * @param c      Coeficiente del término cuadrático en salinidad (0 si el ajuste no lo tiene).
     * @param ipts68 Si la temperatura debe pasarse a IPTS-68 antes de formar y.
     * @param scale  Factor multiplicativo final (1 si el ajuste ya da la unidad de salida).
     * @param unit   Unidad del resultado.
     */
    @Builder
    private LogTemperatureSolubilityModel(double[] a, double[] b, double c, boolean ipts68, double scale, SolubilityUnit unit) {
        this.a = a.clone();
        this.b = b.clone();
        this.c = c;
        this.ipts68 = ipts68;
        this.scale = (scale == 0.0) ? 1.0 : scale;
        this.unit = unit;
    }

    @Override
    public double solubility(double practicalSalinity, double potentialTemperature) {
        double t = ipts68 ? TemperatureScale.toIpts68(potentialTemperature) : potentialTemperature;
        double y = Math.log((298.15 - t) / (273.15 + t));

        double lnC = HornerPolynomial.evaluate(a, y)
                + practicalSalinity * (HornerPolynomial.evaluate(b, y) + c * practicalSalinity);

        return scale * Math.exp(lnC);
    }
}
