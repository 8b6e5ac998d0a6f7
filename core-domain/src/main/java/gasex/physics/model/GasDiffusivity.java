package gasex.physics.model;

import gasex.domain.exception.UnsupportedGasException;
import gasex.domain.gas.Gas;

/**
 * Coeficientes de difusión molecular y números de Schmidt en agua dulce y de mar.
 * <p>
 * Fuentes de los coeficientes de Eyring en agua dulce:
 * <ul>
 * <li><b>He, Ne, Kr, Xe, CH4, CO2, H2:</b> Jähne et al. (1987).</li>
 * <li><b>Ar:</b> extrapolado de Jähne et al. (1987) ajustando D frente a masa^-0.5 con He, Ne, Kr y Xe.</li>
 * <li><b>O2, N2:</b> Ferrell &amp; Himmelblau (1967).</li>
 * </ul>
 * El CO2 no usa su fila de Eyring: su difusividad se obtiene invirtiendo el número de
 * Schmidt de Wanninkhof (1992), {@code D = ν / Sc}.
 */
public class GasDiffusivity {

    static final ArrheniusDiffusivityModel O2_EYRING = new ArrheniusDiffusivityModel(4.286e-6, 18700);
    static final ArrheniusDiffusivityModel HE_EYRING = new ArrheniusDiffusivityModel(0.8180e-6, 11700);
    static final ArrheniusDiffusivityModel NE_EYRING = new ArrheniusDiffusivityModel(1.6080e-6, 14840);
    static final ArrheniusDiffusivityModel AR_EYRING = new ArrheniusDiffusivityModel(2.227e-6, 16680);
    static final ArrheniusDiffusivityModel KR_EYRING = new ArrheniusDiffusivityModel(6.3930e-6, 20200);
    static final ArrheniusDiffusivityModel XE_EYRING = new ArrheniusDiffusivityModel(9.0070e-6, 21610);
    static final ArrheniusDiffusivityModel N2_EYRING = new ArrheniusDiffusivityModel(3.4120e-6, 18500);
    static final ArrheniusDiffusivityModel CH4_EYRING = new ArrheniusDiffusivityModel(3.0470e-6, 18360);
    static final ArrheniusDiffusivityModel CO2_EYRING = new ArrheniusDiffusivityModel(5.0190e-6, 19510);
    static final ArrheniusDiffusivityModel H2_EYRING = new ArrheniusDiffusivityModel(3.3380e-6, 16060);

    private final KinematicViscosityModel viscosityModel;
    private final Co2SchmidtNumberModel co2SchmidtModel;

    public GasDiffusivity(KinematicViscosityModel viscosityModel) {
        this(viscosityModel, new Co2SchmidtNumberModel());
    }

    public GasDiffusivity(KinematicViscosityModel viscosityModel, Co2SchmidtNumberModel co2SchmidtModel) {
        this.viscosityModel = viscosityModel;
        this.co2SchmidtModel = co2SchmidtModel;
    }

    /**
     * Tabla de coeficientes de Eyring (A, Ea) por gas, incluida la fila del CO2 aunque
     * {@link #diffusionCoefficient} nunca la evalúe.
     *
     * @throws UnsupportedGasException para N2O, que no tiene medidas de difusividad.
     */
    public static ArrheniusDiffusivityModel eyringCoefficients(Gas gas) {
        return switch (gas) {
            case O2 -> O2_EYRING;
            case HE -> HE_EYRING;
            case NE -> NE_EYRING;
            case AR -> AR_EYRING;
            case KR -> KR_EYRING;
            case XE -> XE_EYRING;
            case N2 -> N2_EYRING;
            case CH4 -> CH4_EYRING;
            case CO2 -> CO2_EYRING;
            case H2 -> H2_EYRING;
            case N2O -> throw new UnsupportedGasException(gas.getSymbol(), "difusividad");
        };
    }

    /**
     * Coeficiente de difusión molecular.
     *
     * @param practicalSalinity    SP [PSS-78].
     * @param potentialTemperature pt [°C].
     * @param gas                  Gas a evaluar.
     * @return D [m² s⁻¹].
     */
    public double diffusionCoefficient(double practicalSalinity, double potentialTemperature, Gas gas) {
        return switch (gas) {
            // TODO: confirmar con los autores del ajuste si la fila CO2 de Jähne et al. (1987) debería sustituir a la inversión de Wanninkhof.
            case CO2 -> viscosityModel.kinematicViscosity(practicalSalinity, potentialTemperature)
                    / co2SchmidtModel.schmidtNumber(practicalSalinity, potentialTemperature);
            case O2, HE, NE, AR, KR, XE, N2, CH4, H2 ->
                    eyringCoefficients(gas).diffusivity(practicalSalinity, potentialTemperature);
            case N2O -> throw new UnsupportedGasException(gas.getSymbol(), "difusividad");
        };
    }

    /**
     * Número de Schmidt {@code Sc = ν / D}. Para el CO2 se usa directamente la correlación de
     * Wanninkhof, ya que su difusividad se define a partir de ella.
     *
     * @return Sc (adimensional).
     */
    public double schmidtNumber(double practicalSalinity, double potentialTemperature, Gas gas) {
        if (gas == Gas.CO2) {
            return co2SchmidtModel.schmidtNumber(practicalSalinity, potentialTemperature);
        }
        double diffusivity = diffusionCoefficient(practicalSalinity, potentialTemperature, gas);
        return viscosityModel.kinematicViscosity(practicalSalinity, potentialTemperature) / diffusivity;
    }

    public double kinematicViscosity(double practicalSalinity, double potentialTemperature) {
        return viscosityModel.kinematicViscosity(practicalSalinity, potentialTemperature);
    }
}
