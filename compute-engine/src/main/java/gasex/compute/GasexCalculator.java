package gasex.compute;

import gasex.compute.field.Field;
import gasex.compute.field.FieldEvaluator;
import gasex.config.EvaluationConfig;
import gasex.domain.gas.Gas;
import gasex.domain.gas.SolubilityUnit;
import gasex.physics.model.GasDiffusivity;
import gasex.physics.model.GasSolubility;
import gasex.physics.model.KinematicViscosityModel;
import gasex.physics.model.SolubilityModel;
import gasex.physics.thermo.ReferenceSeawaterThermodynamics;
import gasex.physics.thermo.SeawaterThermodynamics;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Fachada pública de la librería.
 * <p>
 * Responsabilidades:
 * 1. Construir los catálogos de modelos sobre un único proveedor termodinámico.
 * 2. Adaptar la forma de las entradas: escalar -> escalar, {@code double[]} -> {@code double[]},
 * {@link Field} -> {@link Field} (con broadcasting y conservación de etiquetas).
 * 3. Gestionar el pool de hilos para campos grandes (se libera en {@link #close()}).
 * <p>
 * Los gases no soportados se detectan antes de recorrer el campo, así que un campo vacío
 * con un gas inválido también falla.
 */
@Slf4j
public class GasexCalculator implements AutoCloseable {

    private final GasSolubility solubility;
    private final GasDiffusivity diffusivity;
    private final KinematicViscosityModel viscosity;
    private final ExecutorService threadPool;
    private final FieldEvaluator evaluator;

    public GasexCalculator() {
        this(EvaluationConfig.defaults(), new ReferenceSeawaterThermodynamics());
    }

    public GasexCalculator(EvaluationConfig config) {
        this(config, new ReferenceSeawaterThermodynamics());
    }

    public GasexCalculator(EvaluationConfig config, SeawaterThermodynamics thermodynamics) {
        this.viscosity = new KinematicViscosityModel(thermodynamics);
        this.solubility = new GasSolubility(thermodynamics);
        this.diffusivity = new GasDiffusivity(viscosity);
        this.threadPool = config.isParallel() ? Executors.newFixedThreadPool(config.cpuProcessorCount()) : null;
        this.evaluator = new FieldEvaluator(config, threadPool);
        log.info("GasexCalculator inicializado. (Proveedor: {}, Hilos: {}, Umbral paralelo: {})",
                thermodynamics.getClass().getSimpleName(), config.cpuProcessorCount(), config.parallelThreshold());
    }

    // --- SOLUBILIDAD ---

    public SolubilityUnit solubilityUnit(Gas gas) {
        return GasSolubility.unitOf(gas);
    }

    public double solubility(double practicalSalinity, double potentialTemperature, Gas gas) {
        return solubility.solubility(practicalSalinity, potentialTemperature, gas);
    }

    public double solubility(double practicalSalinity, double potentialTemperature, String gasSymbol) {
        return solubility(practicalSalinity, potentialTemperature, Gas.fromSymbol(gasSymbol));
    }

    public double[] solubility(double[] practicalSalinity, double[] potentialTemperature, Gas gas) {
        return solubility(Field.of(practicalSalinity), Field.of(potentialTemperature), gas).toArray();
    }

    public Field solubility(Field practicalSalinity, Field potentialTemperature, Gas gas) {
        SolubilityModel model = GasSolubility.modelFor(gas);
        return evaluator.evaluate(args -> model.solubility(args[0], args[1]), practicalSalinity, potentialTemperature);
    }

    public double solubilityFromAbsolute(double absoluteSalinity, double conservativeTemperature, double seaPressure,
                                         double longitude, double latitude, Gas gas) {
        return solubility.solubility(absoluteSalinity, conservativeTemperature, seaPressure, longitude, latitude, gas);
    }

    public double[] solubilityFromAbsolute(double[] absoluteSalinity, double[] conservativeTemperature, double[] seaPressure,
                                           double[] longitude, double[] latitude, Gas gas) {
        return solubilityFromAbsolute(Field.of(absoluteSalinity), Field.of(conservativeTemperature), Field.of(seaPressure),
                Field.of(longitude), Field.of(latitude), gas).toArray();
    }

    public Field solubilityFromAbsolute(Field absoluteSalinity, Field conservativeTemperature, Field seaPressure,
                                        Field longitude, Field latitude, Gas gas) {
        requireSolubility(gas);
        return evaluator.evaluate(args -> solubility.solubility(args[0], args[1], args[2], args[3], args[4], gas),
                absoluteSalinity, conservativeTemperature, seaPressure, longitude, latitude);
    }

    // --- DIFUSIVIDAD Y SCHMIDT ---

    public double diffusionCoefficient(double practicalSalinity, double potentialTemperature, Gas gas) {
        return diffusivity.diffusionCoefficient(practicalSalinity, potentialTemperature, gas);
    }

    public double diffusionCoefficient(double practicalSalinity, double potentialTemperature, String gasSymbol) {
        return diffusionCoefficient(practicalSalinity, potentialTemperature, Gas.fromSymbol(gasSymbol));
    }

    public double[] diffusionCoefficient(double[] practicalSalinity, double[] potentialTemperature, Gas gas) {
        return diffusionCoefficient(Field.of(practicalSalinity), Field.of(potentialTemperature), gas).toArray();
    }

    public Field diffusionCoefficient(Field practicalSalinity, Field potentialTemperature, Gas gas) {
        requireDiffusivity(gas);
        return evaluator.evaluate(args -> diffusivity.diffusionCoefficient(args[0], args[1], gas),
                practicalSalinity, potentialTemperature);
    }

    public double schmidtNumber(double practicalSalinity, double potentialTemperature, Gas gas) {
        return diffusivity.schmidtNumber(practicalSalinity, potentialTemperature, gas);
    }

    public double schmidtNumber(double practicalSalinity, double potentialTemperature, String gasSymbol) {
        return schmidtNumber(practicalSalinity, potentialTemperature, Gas.fromSymbol(gasSymbol));
    }

    public double[] schmidtNumber(double[] practicalSalinity, double[] potentialTemperature, Gas gas) {
        return schmidtNumber(Field.of(practicalSalinity), Field.of(potentialTemperature), gas).toArray();
    }

    public Field schmidtNumber(Field practicalSalinity, Field potentialTemperature, Gas gas) {
        requireDiffusivity(gas);
        return evaluator.evaluate(args -> diffusivity.schmidtNumber(args[0], args[1], gas),
                practicalSalinity, potentialTemperature);
    }

    // --- VISCOSIDAD ---

    public double kinematicViscosity(double practicalSalinity, double potentialTemperature) {
        return viscosity.kinematicViscosity(practicalSalinity, potentialTemperature);
    }

    public double[] kinematicViscosity(double[] practicalSalinity, double[] potentialTemperature) {
        return kinematicViscosity(Field.of(practicalSalinity), Field.of(potentialTemperature)).toArray();
    }

    public Field kinematicViscosity(Field practicalSalinity, Field potentialTemperature) {
        return evaluator.evaluate(args -> viscosity.kinematicViscosity(args[0], args[1]),
                practicalSalinity, potentialTemperature);
    }

    private static void requireSolubility(Gas gas) {
        // Lanza UnsupportedGasException para gases sin ajuste de solubilidad
        GasSolubility.modelFor(gas);
    }

    private static void requireDiffusivity(Gas gas) {
        // Lanza UnsupportedGasException para gases sin datos de difusividad
        GasDiffusivity.eyringCoefficients(gas);
    }

    @Override
    public void close() {
        if (threadPool != null) {
            threadPool.shutdownNow();
            log.debug("Pool de evaluación de GasexCalculator cerrado.");
        }
    }
}
