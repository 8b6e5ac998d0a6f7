package gasex.physics.model;

import gasex.physics.thermo.ReferenceSeawaterThermodynamics;
import gasex.physics.thermo.SeawaterThermodynamics;

/**
 * Viscosidad cinemática del agua de mar.
 * <p>
 * Ajuste de Dan Kelley a la Tabla II-8 de Knauss (viscosidad dinámica en g cm⁻¹ s⁻¹),
 * dividido por la densidad in situ a presión de mar nula:
 * <pre>{@code
 *    ν = 1e-4 · (17.91 - 0.5381·pt + 0.00694·pt² + 0.02305·SP) / ρ(SA, CT, 0)
 * }</pre>
 * La densidad la calcula el proveedor termodinámico; sus excepciones se propagan sin tocar.
 */
public class KinematicViscosityModel {

    private final SeawaterThermodynamics thermodynamics;

    public KinematicViscosityModel(SeawaterThermodynamics thermodynamics) {
        this.thermodynamics = thermodynamics;
    }

    /**
     * @param practicalSalinity    SP [PSS-78].
     * @param potentialTemperature pt [°C].
     * @return Viscosidad cinemática [m² s⁻¹].
     */
    public double kinematicViscosity(double practicalSalinity, double potentialTemperature) {
        double absoluteSalinity = practicalSalinity * ReferenceSeawaterThermodynamics.REFERENCE_SALINITY_FACTOR;
        double conservativeTemperature = thermodynamics.conservativeTemperature(absoluteSalinity, potentialTemperature);
        double density = thermodynamics.density(absoluteSalinity, conservativeTemperature, 0.0);

        double pt = potentialTemperature;
        return 1e-4 * (17.91 - 0.5381 * pt + 0.00694 * pt * pt + 0.02305 * practicalSalinity) / density;
    }
}
