package gasex.config;

import lombok.Builder;
import lombok.With;

/**
 * Parámetros de ejecución para la evaluación de campos (arrays) de salinidad y temperatura.
 * <p>
 * No afecta a ningún resultado numérico: solo decide cómo se reparte el trabajo.
 *
 * @param cpuProcessorCount Número de hilos usados para evaluar campos grandes. Valores {@code <= 0} se sustituyen por 1.
 * @param parallelThreshold Número mínimo de elementos a partir del cual se trocea el campo y se evalúa en paralelo.
 *                          Valores {@code <= 0} se sustituyen por {@value #DEFAULT_PARALLEL_THRESHOLD}.
 */
@Builder
@With
public record EvaluationConfig(
        int cpuProcessorCount,
        int parallelThreshold
) {

    public static final int DEFAULT_PARALLEL_THRESHOLD = 8192;

    public EvaluationConfig {
        // Un JSON incompleto deja los campos a 0; se interpretan como "usar el valor por defecto".
        if (cpuProcessorCount <= 0) {
            cpuProcessorCount = 1;
        }
        if (parallelThreshold <= 0) {
            parallelThreshold = DEFAULT_PARALLEL_THRESHOLD;
        }
    }

    public static EvaluationConfig defaults() {
        return EvaluationConfig.builder()
                .cpuProcessorCount(1)
                .parallelThreshold(DEFAULT_PARALLEL_THRESHOLD)
                .build();
    }

    public boolean isParallel() {
        return cpuProcessorCount > 1;
    }
}
