package gasex.physics.thermo;

/**
 * Contrato con el proveedor de propiedades termodinámicas del agua de mar.
 * <p>
 * Los modelos de gases no conocen la ecuación de estado: delegan aquí las conversiones
 * entre representaciones de salinidad/temperatura y el cálculo de la densidad.
 * Cualquier excepción lanzada por una implementación se propaga sin transformar.
 */
public interface SeawaterThermodynamics {

    /**
     * @param absoluteSalinity     Salinidad Absoluta SA [g/kg].
     * @param potentialTemperature Temperatura potencial referida a 0 dbar [°C, ITS-90].
     * @return Temperatura Conservativa CT [°C].
     */
    double conservativeTemperature(double absoluteSalinity, double potentialTemperature);

    /**
     * @param absoluteSalinity        Salinidad Absoluta SA [g/kg].
     * @param conservativeTemperature Temperatura Conservativa CT [°C].
     * @param seaPressure             Presión de mar (absoluta menos 10.1325 dbar) [dbar].
     * @return Densidad in situ [kg/m³].
     */
    double density(double absoluteSalinity, double conservativeTemperature, double seaPressure);

    /**
     * @param absoluteSalinity Salinidad Absoluta SA [g/kg].
     * @param seaPressure      Presión de mar [dbar].
     * @param longitude        Longitud [grados E].
     * @param latitude         Latitud [grados N].
     * @return Salinidad Práctica SP [PSS-78].
     */
    double practicalSalinityFromAbsolute(double absoluteSalinity, double seaPressure, double longitude, double latitude);

    /**
     * @param absoluteSalinity        Salinidad Absoluta SA [g/kg].
     * @param conservativeTemperature Temperatura Conservativa CT [°C].
     * @return Temperatura potencial referida a 0 dbar [°C, ITS-90].
     */
    double potentialTemperatureFromConservative(double absoluteSalinity, double conservativeTemperature);
}
