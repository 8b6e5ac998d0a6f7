package gasex.domain.gas;

import gasex.domain.exception.UnsupportedGasException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Conjunto cerrado de gases atmosféricos disueltos que conoce la librería.
 * <p>
 * No todos los gases tienen ajuste para todas las magnitudes:
 * <ul>
 * <li><b>Solubilidad:</b> He, Ne, Ar, Kr, N2, N2O, CO2, O2.</li>
 * <li><b>Difusividad / Schmidt:</b> O2, He, Ne, Ar, Kr, Xe, N2, CH4, H2 y CO2 (este último por inversión de Schmidt).</li>
 * </ul>
 * Los catálogos de modelos hacen un {@code switch} exhaustivo sobre este enum, de modo que
 * añadir un gas nuevo sin coeficientes no compila.
 */
@Getter
@RequiredArgsConstructor
public enum Gas {

    HE("He", true, true),
    NE("Ne", true, true),
    AR("Ar", true, true),
    KR("Kr", true, true),
    XE("Xe", false, true),
    N2("N2", true, true),
    N2O("N2O", true, false),
    O2("O2", true, true),
    CO2("CO2", true, true),
    CH4("CH4", false, true),
    H2("H2", false, true);

    private final String symbol;
    private final boolean solubilitySupported;
    private final boolean diffusivitySupported;

    // Clave: SÍMBOLO normalizado -> Valor: ENUM
    private static final Map<String, Gas> BY_SYMBOL = Collections.unmodifiableMap(
            Arrays.stream(values())
                    .collect(Collectors.toMap(gas -> gas.symbol.toUpperCase(), Function.identity()))
    );

    /**
     * Resuelve un gas a partir de su símbolo químico ("O2", "co2", " Ar ").
     *
     * @throws UnsupportedGasException si el símbolo no pertenece al conjunto conocido.
     */
    public static Gas fromSymbol(String symbol) {
        if (symbol == null) {
            throw new UnsupportedGasException("null", "resolución de símbolo");
        }
        Gas gas = BY_SYMBOL.get(symbol.trim().toUpperCase());
        if (gas == null) {
            throw new UnsupportedGasException(symbol, "resolución de símbolo");
        }
        return gas;
    }

    public static List<Gas> solubilityGases() {
        return Arrays.stream(values())
                .filter(Gas::isSolubilitySupported)
                .collect(Collectors.toList());
    }

    public static List<Gas> diffusivityGases() {
        return Arrays.stream(values())
                .filter(Gas::isDiffusivitySupported)
                .collect(Collectors.toList());
    }
}
