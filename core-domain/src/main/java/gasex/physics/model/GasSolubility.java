package gasex.physics.model;

import gasex.domain.exception.UnsupportedGasException;
import gasex.domain.gas.Gas;
import gasex.domain.gas.SolubilityUnit;
import gasex.physics.thermo.SeawaterThermodynamics;

/**
 * Catálogo de solubilidades de equilibrio por gas.
 * <p>
 * Cada gas tiene su propio ajuste publicado, con su escala de temperatura y su unidad.
 * Las asimetrías entre gases (IPTS-68 frente a ITS-90, exponente de T/100, mL/kg frente
 * a nmol/kg o mol/(kg·atm)) son intencionadas y reproducen cada fuente:
 * <ul>
 * <li><b>O2:</b> Garcia &amp; Gordon (1992), datos de Benson &amp; Krause (1984). µmol/kg.</li>
 * <li><b>Ne, Ar, N2:</b> Hamme &amp; Emerson (2004), Tabla 4. Ne en nmol/kg, Ar y N2 en µmol/kg.</li>
 * <li><b>He:</b> Weiss (1971), Tabla 3. mL/kg convertidos a µmol/kg.</li>
 * <li><b>Kr:</b> Weiss &amp; Kyser (1978), Tabla 2. mL/kg convertidos a µmol/kg.</li>
 * <li><b>N2O:</b> Weiss &amp; Price (1980), Tabla 2, con corrección por aire húmedo. mol/(kg·atm).</li>
 * <li><b>CO2:</b> Weiss &amp; Price (1980), Tabla 6. mol/(kg·atm).</li>
 * </ul>
 */
public class GasSolubility {

    static final SolubilityModel O2_GARCIA_GORDON = LogTemperatureSolubilityModel.builder()
            .a(new double[]{5.80871, 3.20291, 4.17887, 5.10006, -9.86643e-2, 3.80369})
            .b(new double[]{-7.01577e-3, -7.70028e-3, -1.13864e-2, -9.51519e-3})
            .c(-2.75915e-7)
            .ipts68(true)
            .unit(SolubilityUnit.UMOL_PER_KG)
            .build();

    static final SolubilityModel NE_HAMME_EMERSON = LogTemperatureSolubilityModel.builder()
            .a(new double[]{2.18156, 1.29108, 2.12504})
            .b(new double[]{-5.94737e-3, -5.13896e-3})
            .unit(SolubilityUnit.NMOL_PER_KG)
            .build();

    static final SolubilityModel AR_HAMME_EMERSON = LogTemperatureSolubilityModel.builder()
            .a(new double[]{2.79150, 3.17609, 4.13116, 4.90379})
            .b(new double[]{-6.96233e-3, -7.66670e-3, -1.16888e-2})
            .unit(SolubilityUnit.UMOL_PER_KG)
            .build();

    static final SolubilityModel N2_HAMME_EMERSON = LogTemperatureSolubilityModel.builder()
            .a(new double[]{6.42931, 2.92704, 4.32531, 4.69149})
            .b(new double[]{-7.44129e-3, -8.02566e-3, -1.46775e-2})
            .unit(SolubilityUnit.UMOL_PER_KG)
            .build();

    // 1/22.44257e-3: volumen molar del He en condiciones estándar (Dymond & Smith, 1980)
    static final double HE_ML_TO_UMOL = 44.55817671505537;
    // 1/22.3511e-3: volumen molar del Kr en condiciones estándar (Dymond & Smith, 1980)
    static final double KR_ML_TO_UMOL = 44.74052731185490;

    static final SolubilityModel HE_WEISS = WeissSolubilityModel.builder()
            .a(new double[]{-167.2178, 216.3442, 139.2032, -22.6202})
            .b(new double[]{-0.044781, 0.023541, -0.0034266})
            .temperatureExponent(1)
            .scale(HE_ML_TO_UMOL)
            .unit(SolubilityUnit.UMOL_PER_KG)
            .build();

    static final SolubilityModel KR_WEISS_KYSER = WeissSolubilityModel.builder()
            .a(new double[]{-112.6840, 153.5817, 74.4690, -10.0189})
            .b(new double[]{-0.011213, -0.001844, 0.0011201})
            .temperatureExponent(1)
            .scale(KR_ML_TO_UMOL)
            .unit(SolubilityUnit.UMOL_PER_KG)
            .build();

    // Coeficientes en mol kg-1 atm-1 (no los de mol L-1 atm-1 de la misma tabla)
    static final SolubilityModel N2O_WEISS_PRICE = WeissSolubilityModel.builder()
            .a(new double[]{-168.2459, 226.0894, 93.2817, -1.48693})
            .b(new double[]{-0.060361, 0.033765, -0.0051862})
            .temperatureExponent(2)
            .moistAirCorrection(true)
            .unit(SolubilityUnit.MOL_PER_KG_ATM)
            .build();

    static final SolubilityModel CO2_WEISS_PRICE = WeissSolubilityModel.builder()
            .a(new double[]{-162.8301, 218.2968, 90.9241, -1.47696})
            .b(new double[]{0.025695, -0.025225, 0.0049867})
            .temperatureExponent(2)
            .unit(SolubilityUnit.MOL_PER_KG_ATM)
            .build();

    private final SeawaterThermodynamics thermodynamics;

    public GasSolubility(SeawaterThermodynamics thermodynamics) {
        this.thermodynamics = thermodynamics;
    }

    /**
     * Devuelve el ajuste de solubilidad del gas.
     *
     * @throws UnsupportedGasException si el gas no tiene ajuste de solubilidad (Xe, CH4, H2).
     */
    public static SolubilityModel modelFor(Gas gas) {
        return switch (gas) {
            case O2 -> O2_GARCIA_GORDON;
            case NE -> NE_HAMME_EMERSON;
            case AR -> AR_HAMME_EMERSON;
            case N2 -> N2_HAMME_EMERSON;
            case HE -> HE_WEISS;
            case KR -> KR_WEISS_KYSER;
            case N2O -> N2O_WEISS_PRICE;
            case CO2 -> CO2_WEISS_PRICE;
            case XE, CH4, H2 -> throw new UnsupportedGasException(gas.getSymbol(), "solubilidad");
        };
    }

    public static SolubilityUnit unitOf(Gas gas) {
        return modelFor(gas).getUnit();
    }

    /**
     * Solubilidad de equilibrio a partir de Salinidad Práctica y temperatura potencial.
     *
     * @param practicalSalinity    SP [PSS-78].
     * @param potentialTemperature pt [°C, ITS-90], referida a 0 dbar.
     * @param gas                  Gas a evaluar.
     * @return Concentración en la unidad de {@link #unitOf(Gas)}.
     */
    public double solubility(double practicalSalinity, double potentialTemperature, Gas gas) {
        return modelFor(gas).solubility(practicalSalinity, potentialTemperature);
    }

    /**
     * Variante TEOS-10: convierte SA/CT a SP/pt con el proveedor termodinámico y delega en
     * {@link #solubility(double, double, Gas)}.
     *
     * @param absoluteSalinity        SA [g/kg].
     * @param conservativeTemperature CT [°C].
     * @param seaPressure             p [dbar].
     * @param longitude               Longitud [grados E].
     * @param latitude                Latitud [grados N].
     * @param gas                     Gas a evaluar.
     */
    public double solubility(double absoluteSalinity, double conservativeTemperature, double seaPressure,
                             double longitude, double latitude, Gas gas) {
        // El gas se resuelve primero: un gas no soportado no debe llegar al proveedor.
        SolubilityModel model = modelFor(gas);
        double practicalSalinity = thermodynamics.practicalSalinityFromAbsolute(absoluteSalinity, seaPressure, longitude, latitude);
        double potentialTemperature = thermodynamics.potentialTemperatureFromConservative(absoluteSalinity, conservativeTemperature);
        return model.solubility(practicalSalinity, potentialTemperature);
    }
}
