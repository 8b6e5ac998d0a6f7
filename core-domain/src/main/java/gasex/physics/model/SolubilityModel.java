package gasex.physics.model;

import gasex.domain.gas.SolubilityUnit;

/**
 * Define el contrato para los ajustes empíricos de solubilidad de equilibrio de un gas
 * con una atmósfera estándar (1 atm de presión total incluyendo vapor de agua saturado).
 * <p>
 * Las implementaciones son inmutables y no validan el dominio: fuera del rango físico
 * (p. ej. temperaturas que anulan el argumento de un logaritmo) el resultado es NaN o infinito.
 */
public interface SolubilityModel {

    /**
     * @param practicalSalinity    Salinidad Práctica SP [PSS-78].
     * @param potentialTemperature Temperatura potencial [°C, ITS-90].
     * @return Concentración de equilibrio, en {@link #getUnit()}.
     */
    double solubility(double practicalSalinity, double potentialTemperature);

    SolubilityUnit getUnit();
}
