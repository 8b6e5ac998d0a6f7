package gasex.domain.exception;

import lombok.Getter;

/**
 * Se lanza cuando se pide una magnitud para un gas que no tiene ajuste empírico
 * (p. ej. solubilidad de Xe o difusividad de N2O) o cuando el símbolo no se reconoce.
 */
@Getter
public class UnsupportedGasException extends IllegalArgumentException {

    private final String gas;
    private final String operation;

    public UnsupportedGasException(String gas, String operation) {
        super(String.format("Gas no soportado para %s: '%s'", operation, gas));
        this.gas = gas;
        this.operation = operation;
    }
}
