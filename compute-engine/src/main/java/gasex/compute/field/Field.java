package gasex.compute.field;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Contenedor inmutable de valores con forma: escalar, vector, matriz o serie etiquetada.
 * <p>
 * Los datos se guardan aplanados en orden de filas. La forma de un escalar es el array vacío.
 * Las etiquetas solo existen en series unidimensionales (una etiqueta por elemento).
 */
public final class Field {

    private static final int[] SCALAR_SHAPE = new int[0];

    private final int[] shape;
    private final double[] data;
    private final List<String> labels;

    private Field(int[] shape, double[] data, List<String> labels) {
        this.shape = shape;
        this.data = data;
        this.labels = labels;
    }

    public static Field scalar(double value) {
        return new Field(SCALAR_SHAPE, new double[]{value}, null);
    }

    public static Field of(double[] values) {
        return new Field(new int[]{values.length}, values.clone(), null);
    }

    /**
     * @throws IllegalArgumentException si la matriz no es rectangular.
     */
    public static Field of(double[][] values) {
        int rows = values.length;
        int cols = (rows == 0) ? 0 : values[0].length;
        double[] flat = new double[rows * cols];
        for (int i = 0; i < rows; i++) {
            if (values[i].length != cols) {
                throw new IllegalArgumentException(String.format(
                        "Matriz no rectangular: la fila %d tiene %d columnas y se esperaban %d.", i, values[i].length, cols));
            }
            System.arraycopy(values[i], 0, flat, i * cols, cols);
        }
        return new Field(new int[]{rows, cols}, flat, null);
    }

    /**
     * @throws IllegalArgumentException si el número de etiquetas no coincide con el de valores.
     */
    public static Field labelled(List<String> labels, double[] values) {
        if (labels.size() != values.length) {
            throw new IllegalArgumentException(String.format(
                    "Serie etiquetada inconsistente: %d etiquetas para %d valores.", labels.size(), values.length));
        }
        return new Field(new int[]{values.length}, values.clone(), List.copyOf(labels));
    }

    /**
     * Construye un campo con la forma dada a partir de datos ya aplanados. Uso interno del evaluador:
     * el array no se copia.
     */
    static Field ofShape(int[] shape, double[] flatData, List<String> labels) {
        return new Field(shape.clone(), flatData, labels);
    }

    public boolean isScalar() {
        return shape.length == 0;
    }

    public boolean isLabelled() {
        return labels != null;
    }

    public int rank() {
        return shape.length;
    }

    public int[] shape() {
        return shape.clone();
    }

    public int size() {
        return data.length;
    }

    /** Valor en una posición del array aplanado. */
    public double get(int flatIndex) {
        return data[flatIndex];
    }

    /**
     * @throws IllegalStateException si el campo no es escalar.
     */
    public double scalarValue() {
        if (!isScalar()) {
            throw new IllegalStateException("El campo no es escalar: forma " + Arrays.toString(shape));
        }
        return data[0];
    }

    /**
     * @throws IllegalStateException si el campo no es unidimensional.
     */
    public double[] toArray() {
        if (rank() != 1) {
            throw new IllegalStateException("El campo no es unidimensional: forma " + Arrays.toString(shape));
        }
        return data.clone();
    }

    /**
     * @throws IllegalStateException si el campo no es bidimensional.
     */
    public double[][] toMatrix() {
        if (rank() != 2) {
            throw new IllegalStateException("El campo no es bidimensional: forma " + Arrays.toString(shape));
        }
        double[][] matrix = new double[shape[0]][shape[1]];
        for (int i = 0; i < shape[0]; i++) {
            System.arraycopy(data, i * shape[1], matrix[i], 0, shape[1]);
        }
        return matrix;
    }

    public List<String> labels() {
        return (labels == null) ? Collections.emptyList() : labels;
    }

    @Override
    public String toString() {
        return "Field{shape=" + Arrays.toString(shape) + ", labels=" + labels() + "}";
    }
}
