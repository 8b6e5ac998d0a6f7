package gasex.compute.field;

import java.util.Arrays;

/**
 * Reglas de broadcasting al estilo numpy.
 * <p>
 * Las formas se alinean por la derecha; en cada dimensión los tamaños deben coincidir o ser 1.
 * Un escalar es compatible con cualquier forma. Las instancias precalculan los strides de
 * cada operando para traducir un índice plano del resultado al índice plano de cada operando.
 */
public final class Broadcast {

    private final int[] resultShape;
    private final int resultSize;
    // strides[operando][dimensión del resultado]; 0 si el operando se repite en esa dimensión
    private final int[][] strides;

    private Broadcast(int[] resultShape, int resultSize, int[][] strides) {
        this.resultShape = resultShape;
        this.resultSize = resultSize;
        this.strides = strides;
    }

    /**
     * @throws IllegalArgumentException si alguna pareja de dimensiones no es compatible o si el
     *                                  número de elementos del resultado no cabe en un {@code int}.
     */
    public static Broadcast of(Field... operands) {
        int rank = 0;
        for (Field operand : operands) {
            rank = Math.max(rank, operand.rank());
        }

        int[] resultShape = new int[rank];
        Arrays.fill(resultShape, 1);
        for (Field operand : operands) {
            int[] shape = operand.shape();
            int offset = rank - shape.length;
            for (int d = 0; d < shape.length; d++) {
                int current = resultShape[offset + d];
                int candidate = shape[d];
                if (current == 1) {
                    resultShape[offset + d] = candidate;
                } else if (candidate != 1 && candidate != current) {
                    throw new IllegalArgumentException(String.format(
                            "Formas incompatibles para broadcasting: %s", describe(operands)));
                }
            }
        }

        int resultSize = sizeOf(resultShape, operands);

        int[][] strides = new int[operands.length][rank];
        for (int k = 0; k < operands.length; k++) {
            int[] shape = operands[k].shape();
            int offset = rank - shape.length;
            int stride = 1;
            for (int d = shape.length - 1; d >= 0; d--) {
                strides[k][offset + d] = (shape[d] == 1) ? 0 : stride;
                stride *= shape[d];
            }
        }
        return new Broadcast(resultShape, resultSize, strides);
    }

    public int[] resultShape() {
        return resultShape.clone();
    }

    public int resultSize() {
        return resultSize;
    }

    /** Índice plano dentro del operando {@code operand} que corresponde al índice plano {@code flatIndex} del resultado. */
    public int sourceIndex(int operand, int flatIndex) {
        int[] operandStrides = strides[operand];
        int remainder = flatIndex;
        int index = 0;
        for (int d = resultShape.length - 1; d >= 0; d--) {
            int coordinate = remainder % resultShape[d];
            remainder /= resultShape[d];
            index += coordinate * operandStrides[d];
        }
        return index;
    }

    private static int sizeOf(int[] shape, Field[] operands) {
        int size = 1;
        try {
            for (int dimension : shape) {
                size = Math.multiplyExact(size, dimension);
            }
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(String.format(
                    "El resultado del broadcasting %s excede el máximo de elementos de un campo: %s",
                    Arrays.toString(shape), describe(operands)), e);
        }
        return size;
    }

    private static String describe(Field[] operands) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < operands.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(Arrays.toString(operands[i].shape()));
        }
        return sb.toString();
    }
}
