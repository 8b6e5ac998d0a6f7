package gasex.physics.thermo;

/**
 * Conversiones entre escalas de temperatura.
 * <p>
 * Los ajustes publicados antes de 1990 (Weiss, Garcia & Gordon, UNESCO EOS-80) están
 * referidos a la escala IPTS-68; las temperaturas de entrada de la librería son ITS-90.
 */
public final class TemperatureScale {

    /** Factor ITS-90 -> IPTS-68 (Saunders, 1990). */
    public static final double IPTS68_FACTOR = 1.00024;

    public static final double ZERO_CELSIUS_IN_KELVIN = 273.15;

    /**
     * Prohibido construir esta clase utilidad
     */
    private TemperatureScale() {
    }

    public static double toIpts68(double t90) {
        return t90 * IPTS68_FACTOR;
    }

    public static double toIts90(double t68) {
        return t68 / IPTS68_FACTOR;
    }

    public static double toKelvin(double celsius) {
        return celsius + ZERO_CELSIUS_IN_KELVIN;
    }
}
