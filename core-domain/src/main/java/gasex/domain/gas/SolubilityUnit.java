package gasex.domain.gas;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Unidades en las que se expresa la solubilidad de cada gas.
 * No se unifican: cada una corresponde a la publicación de origen del ajuste.
 */
@Getter
@RequiredArgsConstructor
public enum SolubilityUnit {

    UMOL_PER_KG("µmol/kg"),
    NMOL_PER_KG("nmol/kg"),
    MOL_PER_KG_ATM("mol/(kg·atm)");

    private final String symbol;
}
