package gasex.compute.field;

/**
 * Función escalar evaluada elemento a elemento sobre operandos con broadcasting.
 * El array de argumentos se reutiliza entre llamadas: no debe retenerse.
 */
@FunctionalInterface
public interface ElementwiseFunction {
    double apply(double[] arguments);
}
