package gasex.physics.model;

import gasex.domain.gas.SolubilityUnit;
import gasex.physics.solver.HornerPolynomial;
import gasex.physics.thermo.TemperatureScale;
import lombok.Builder;
import lombok.Getter;

/**
 * Familia de ajustes en temperatura absoluta de Weiss (He, Kr, N2O, CO2).
 * <pre>{@code
 *    T    = 1.00024·pt + 273.15          (kelvin, IPTS-68)
 *    ln C = a0 + a1·(100/T) + a2·ln(T/100) + a3·(T/100)^k + SP·(b0 + b1·(T/100) + b2·(T/100)²)
 * }</pre>
 * El exponente {@code k} del último término de temperatura depende de la publicación
 * (1 para He y Kr, 2 para N2O y CO2). Opcionalmente se divide por {@code 1 - pH2O/P}
 * ({@link WaterVaporCorrection}) y se multiplica por un factor de conversión de unidades
 * (volumen molar para pasar de mL/kg a µmol/kg).
 */
public final class WeissSolubilityModel implements SolubilityModel {

    private final double[] a;
    private final double[] b;
    private final int temperatureExponent;
    private final boolean moistAirCorrection;
    private final double scale;
    @Getter
    private final SolubilityUnit unit;

    /**
     * @param a                   Coeficientes a0..a3.
     * @param b                   Coeficientes de salinidad b0..b2, orden ascendente en T/100.
     * @param temperatureExponent Exponente k del término a3.
     * @param moistAirCorrection  Si se aplica la corrección por vapor de agua.
     * @param scale               Factor multiplicativo final (1 si el ajuste ya da la unidad de salida).
     * @param unit                Unidad del resultado.
     */
    @Builder
    private WeissSolubilityModel(double[] a, double[] b, int temperatureExponent, boolean moistAirCorrection,
                                 double scale, SolubilityUnit unit) {
        if (a.length != 4) {
            throw new IllegalArgumentException("El ajuste de Weiss requiere exactamente 4 coeficientes de temperatura.");
        }
        this.a = a.clone();
        this.b = b.clone();
        this.temperatureExponent = temperatureExponent;
        this.moistAirCorrection = moistAirCorrection;
        this.scale = (scale == 0.0) ? 1.0 : scale;
        this.unit = unit;
    }

    @Override
    public double solubility(double practicalSalinity, double potentialTemperature) {
        double kelvin = TemperatureScale.toKelvin(TemperatureScale.toIpts68(potentialTemperature));
        double t100 = kelvin / 100.0;

        double lnC = a[0]
                + a[1] * 100.0 / kelvin
                + a[2] * Math.log(t100)
                + a[3] * Math.pow(t100, temperatureExponent)
                + practicalSalinity * HornerPolynomial.evaluate(b, t100);

        double concentration = Math.exp(lnC);
        if (moistAirCorrection) {
            concentration /= (1.0 - WaterVaporCorrection.vaporPressureFraction(practicalSalinity, kelvin));
        }
        return scale * concentration;
    }
}
