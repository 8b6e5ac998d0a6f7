package gasex.physics.thermo;

import gasex.physics.solver.PotentialTemperatureSolver;

/**
 * Proveedor termodinámico por defecto, autocontenido.
 * <p>
 * Combina dos fuentes:
 * <ul>
 * <li><b>TEOS-10:</b> Temperatura Conservativa a partir de la entalpía potencial
 * (polinomio de McDougall et al., 2003, tal y como lo usa la GSW Toolbox).</li>
 * <li><b>EOS-80:</b> densidad in situ de UNESCO (Millero &amp; Poisson, 1981) con módulo de
 * compresibilidad secante, y la temperatura in situ obtenida integrando el gradiente
 * adiabático de Bryden (1973) con el Runge-Kutta de Fofonoff (1977).</li>
 * </ul>
 * La conversión SA -> SP supone composición de referencia (anomalía de Salinidad Absoluta nula),
 * por lo que la posición geográfica solo se valida, no interviene en el cálculo.
 */
public class ReferenceSeawaterThermodynamics implements SeawaterThermodynamics {

    /** Salinidad Absoluta del agua de mar estándar [g/kg]. */
    public static final double STANDARD_OCEAN_SALINITY = 35.16504;

    /** Factor SP -> SA para composición de referencia: 35.16504/35 [g/kg]. */
    public static final double REFERENCE_SALINITY_FACTOR = STANDARD_OCEAN_SALINITY / 35.0;

    // Capacidad calorífica "estándar" de TEOS-10 [J kg⁻¹ K⁻¹]
    private static final double CP0 = 3991.86795711963;
    // 1/(40·uPS)
    private static final double SALINITY_SCALE = 0.0248826675584615;

    @Override
    public double conservativeTemperature(double absoluteSalinity, double potentialTemperature) {
        double x2 = SALINITY_SCALE * absoluteSalinity;
        double x = Math.sqrt(x2);
        double y = potentialTemperature * 0.025; // normalizado para el ajuste

        double potentialEnthalpy = 61.01362420681071 + y * (168776.46138048015
                + y * (-2735.2785605119625 + y * (2574.2164453821433
                + y * (-1536.6644434977543 + y * (545.7340497931629
                + (-50.91091728474331 - 18.30489878927802 * y) * y)))))
                + x2 * (268.5520265845071 + y * (-12019.028203559312
                + y * (3734.858026725145 + y * (-2046.7671145057618
                + y * (465.28655623826234 + (-0.6370820302376359
                - 10.650848542359153 * y) * y))))
                + x * (937.2099110620707 + y * (588.1802812170108
                + y * (248.39476522971285 + (-3.871557904936333
                - 2.6268019854268356 * y) * y))
                + x * (-1687.914374187449 + x * (246.9598888781377
                + x * (123.59576582457964 - 48.5891069025409 * x))
                + y * (936.3206544460336
                + y * (-942.7827304544439 + y * (369.4389437509002
                + (-33.83664947895248 - 9.987880382780322 * y) * y))))));

        return potentialEnthalpy / CP0;
    }

    @Override
    public double potentialTemperatureFromConservative(double absoluteSalinity, double conservativeTemperature) {
        return PotentialTemperatureSolver.findPotentialTemperature(conservativeTemperature,
                pt -> conservativeTemperature(absoluteSalinity, pt));
    }

    @Override
    public double practicalSalinityFromAbsolute(double absoluteSalinity, double seaPressure, double longitude, double latitude) {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException(String.format("Latitud fuera de rango [-90, 90]: %s", latitude));
        }
        if (!Double.isFinite(longitude)) {
            throw new IllegalArgumentException(String.format("Longitud no válida: %s", longitude));
        }
        return absoluteSalinity / REFERENCE_SALINITY_FACTOR;
    }

    @Override
    public double density(double absoluteSalinity, double conservativeTemperature, double seaPressure) {
        double practicalSalinity = absoluteSalinity / REFERENCE_SALINITY_FACTOR;
        double potentialTemperature = potentialTemperatureFromConservative(absoluteSalinity, conservativeTemperature);

        // EOS-80 trabaja en IPTS-68
        double pt68 = TemperatureScale.toIpts68(potentialTemperature);
        double insituT68 = adiabaticTemperature(practicalSalinity, pt68, 0.0, seaPressure);

        return Eos80.density(practicalSalinity, insituT68, seaPressure);
    }

    /**
     * Temperatura de una parcela llevada adiabáticamente desde {@code pressure} hasta
     * {@code referencePressure} (Fofonoff, 1977). Temperaturas en IPTS-68, presiones en dbar.
     */
    static double adiabaticTemperature(double salinity, double t68, double pressure, double referencePressure) {
        double h = referencePressure - pressure;
        if (h == 0.0) {
            return t68;
        }

        double p = pressure;
        double t = t68;

        double xk = h * Eos80.adiabaticLapseRate(salinity, t, p);
        t = t + 0.5 * xk;
        double q = xk;

        p = p + 0.5 * h;
        xk = h * Eos80.adiabaticLapseRate(salinity, t, p);
        t = t + 0.29289322 * (xk - q);
        q = 0.58578644 * xk + 0.121320344 * q;

        xk = h * Eos80.adiabaticLapseRate(salinity, t, p);
        t = t + 1.707106781 * (xk - q);
        q = 3.414213562 * xk - 4.121320344 * q;

        p = p + 0.5 * h;
        xk = h * Eos80.adiabaticLapseRate(salinity, t, p);
        return t + (xk - 2.0 * q) / 6.0;
    }

    /**
     * Polinomios UNESCO de la ecuación de estado EOS-80.
     * Salinidad práctica, temperatura IPTS-68 [°C], presión de mar [dbar].
     */
    static final class Eos80 {

        private Eos80() {
        }

        static double density(double s, double t, double seaPressure) {
            double rho0 = densityAtSurface(s, t);
            if (seaPressure == 0.0) {
                return rho0;
            }
            double pBar = seaPressure / 10.0;
            return rho0 / (1.0 - pBar / secantBulkModulus(s, t, pBar));
        }

        static double densityAtSurface(double s, double t) {
            // Agua oceánica media estándar (SMOW)
            double rhoW = 999.842594 + t * (6.793952e-2 + t * (-9.095290e-3
                    + t * (1.001685e-4 + t * (-1.120083e-6 + t * 6.536332e-9))));

            double s15 = s * Math.sqrt(s);
            return rhoW
                    + s * (0.824493 + t * (-4.0899e-3 + t * (7.6438e-5 + t * (-8.2467e-7 + t * 5.3875e-9))))
                    + s15 * (-5.72466e-3 + t * (1.0227e-4 - 1.6546e-6 * t))
                    + 4.8314e-4 * s * s;
        }

        static double secantBulkModulus(double s, double t, double pBar) {
            double kw = 19652.21 + t * (148.4206 + t * (-2.327105 + t * (1.360477e-2 - 5.155288e-5 * t)));
            double aw = 3.239908 + t * (1.43713e-3 + t * (1.16092e-4 - 5.77905e-7 * t));
            double bw = 8.50935e-5 + t * (-6.12293e-6 + 5.2787e-8 * t);

            double s15 = s * Math.sqrt(s);
            double k0 = kw + s * (54.6746 + t * (-0.603459 + t * (1.09987e-2 - 6.1670e-5 * t)))
                    + s15 * (7.944e-2 + t * (1.6483e-2 - 5.3009e-4 * t));
            double a = aw + s * (2.2838e-3 + t * (-1.0981e-5 - 1.6078e-6 * t)) + 1.91075e-4 * s15;
            double b = bw + s * (-9.9348e-7 + t * (2.0816e-8 + 9.1697e-10 * t));

            return k0 + pBar * (a + b * pBar);
        }

        /** Gradiente adiabático [°C/dbar] (Bryden, 1973). */
        static double adiabaticLapseRate(double s, double t, double p) {
            double ds = s - 35.0;
            return 3.5803e-5 + t * (8.5258e-6 + t * (-6.836e-8 + t * 6.6228e-10))
                    + (1.8932e-6 - 4.2393e-8 * t) * ds
                    + (1.8741e-8 + t * (-6.7795e-10 + t * (8.733e-12 - 5.4481e-14 * t))
                    + (-1.1351e-10 + 2.7759e-12 * t) * ds) * p
                    + (-4.6206e-13 + t * (1.8676e-14 - 2.1687e-16 * t)) * p * p;
        }
    }
}
