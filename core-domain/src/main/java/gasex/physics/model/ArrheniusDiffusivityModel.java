package gasex.physics.model;

import gasex.physics.thermo.TemperatureScale;

/**
 * Difusividad molecular según la ecuación de Eyring con corrección lineal por salinidad.
 * <pre>{@code
 *    D0 = A · exp(-Ea / (R · T))          T en kelvin
 *    D  = D0 · (1 - 0.049 · SP / 35.5)
 * }</pre>
 * La corrección reproduce el descenso medio del 4.9% observado por Jähne et al. (1987)
 * para H2 y He en disolución de NaCl de 35.5 ppt.
 *
 * @param preExponentialFactor A [m² s⁻¹].
 * @param activationEnergy     Ea [J mol⁻¹].
 */
public record ArrheniusDiffusivityModel(double preExponentialFactor, double activationEnergy) {

    /** Constante universal de los gases [J mol⁻¹ K⁻¹]. */
    public static final double GAS_CONSTANT = 8.314510;

    static final double SALINITY_ATTENUATION = 0.049;
    static final double REFERENCE_NACL_SALINITY = 35.5;

    /** Difusividad en agua dulce [m² s⁻¹]. */
    public double freshwaterDiffusivity(double temperature) {
        return preExponentialFactor * Math.exp(-activationEnergy / (GAS_CONSTANT * TemperatureScale.toKelvin(temperature)));
    }

    /**
     * @param practicalSalinity SP [PSS-78].
     * @param temperature       Temperatura [°C].
     * @return Coeficiente de difusión [m² s⁻¹].
     */
    public double diffusivity(double practicalSalinity, double temperature) {
        return freshwaterDiffusivity(temperature) * (1.0 - SALINITY_ATTENUATION * practicalSalinity / REFERENCE_NACL_SALINITY);
    }
}
