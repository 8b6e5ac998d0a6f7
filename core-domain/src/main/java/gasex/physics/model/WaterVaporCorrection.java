package gasex.physics.model;

/**
 * Corrección por aire húmedo a 1 atm (Weiss &amp; Price, 1980).
 * <p>
 * Ajuste de la presión de vapor del agua de Goff &amp; Gratch (1946) con el descenso por sal
 * marina de Robinson (1954):
 * <pre>{@code
 *    pH2O/P = exp(24.4543 - 67.4509·(100/T) - 4.8489·ln(T/100) - 0.000544·SP)
 * }</pre>
 * con T en kelvin (IPTS-68).
 */
public final class WaterVaporCorrection {

    private static final double M0 = 24.4543;
    private static final double M1 = 67.4509;
    private static final double M2 = 4.8489;
    private static final double M3 = 0.000544;

    /**
     * Prohibido construir esta clase utilidad
     */
    private WaterVaporCorrection() {
    }

    /**
     * @param practicalSalinity Salinidad Práctica.
     * @param kelvin68          Temperatura absoluta IPTS-68 [K].
     * @return Fracción de la presión total debida al vapor de agua (adimensional).
     */
    public static double vaporPressureFraction(double practicalSalinity, double kelvin68) {
        return Math.exp(M0 - M1 * 100.0 / kelvin68 - M2 * Math.log(kelvin68 / 100.0) - M3 * practicalSalinity);
    }
}
