package gasex.compute.field;

import gasex.config.EvaluationConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Evaluador elemento a elemento de campos con broadcasting.
 * <p>
 * Los elementos no interactúan entre sí, de modo que los campos grandes se trocean en
 * bloques contiguos y se reparten en el pool de hilos recibido. Los campos pequeños
 * (por debajo de {@link EvaluationConfig#parallelThreshold()}) se evalúan en el hilo llamante.
 * <p>
 * Cualquier {@link RuntimeException} lanzada por la función (p. ej. un fallo del proveedor
 * termodinámico) se propaga sin envolver.
 */
@Slf4j
public class FieldEvaluator {

    private final EvaluationConfig config;
    private final ExecutorService threadPool;

    /**
     * @param config     Configuración de reparto.
     * @param threadPool Pool de hilos para campos grandes; puede ser {@code null} si la configuración no es paralela.
     */
    public FieldEvaluator(EvaluationConfig config, ExecutorService threadPool) {
        this.config = config;
        this.threadPool = threadPool;
    }

    /**
     * Evalúa {@code function} sobre la forma resultante del broadcasting de los operandos.
     * <p>
     * El resultado conserva las etiquetas del primer operando cuando su forma coincide
     * con la forma resultante.
     */
    public Field evaluate(ElementwiseFunction function, Field... operands) {
        Broadcast broadcast = Broadcast.of(operands);
        int size = broadcast.resultSize();
        double[] result = new double[size];

        if (threadPool != null && config.isParallel() && size >= config.parallelThreshold()) {
            evaluateInParallel(function, operands, broadcast, result);
        } else {
            evaluateRange(function, operands, broadcast, result, 0, size);
        }

        Field first = operands[0];
        boolean keepsLabels = first.isLabelled() && Arrays.equals(first.shape(), broadcast.resultShape());
        return Field.ofShape(broadcast.resultShape(), result, keepsLabels ? first.labels() : null);
    }

    private void evaluateInParallel(ElementwiseFunction function, Field[] operands, Broadcast broadcast, double[] result) {
        int size = result.length;
        int chunkCount = config.cpuProcessorCount();
        int chunkSize = (size + chunkCount - 1) / chunkCount;
        log.debug("Evaluando campo de {} elementos en {} bloques de hasta {} elementos.", size, chunkCount, chunkSize);

        List<Future<?>> futures = new ArrayList<>();
        for (int start = 0; start < size; start += chunkSize) {
            final int from = start;
            final int to = Math.min(size, start + chunkSize);
            futures.add(threadPool.submit(() -> evaluateRange(function, operands, broadcast, result, from, to)));
        }

        try {
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Evaluación de campo interrumpida.", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Fallo en la evaluación de un bloque del campo.", cause);
        }
    }

    private static void evaluateRange(ElementwiseFunction function, Field[] operands, Broadcast broadcast,
                                      double[] result, int from, int to) {
        double[] arguments = new double[operands.length];
        for (int i = from; i < to; i++) {
            for (int k = 0; k < operands.length; k++) {
                arguments[k] = operands[k].get(broadcast.sourceIndex(k, i));
            }
            result[i] = function.apply(arguments);
        }
    }
}
