package gasex.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import gasex.config.EvaluationConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Carga la {@link EvaluationConfig} desde JSON, bien desde un archivo, bien desde el
 * recurso de classpath {@value #DEFAULT_RESOURCE}.
 * <pre>{@code
 *    { "cpuProcessorCount": 4, "parallelThreshold": 8192 }
 * }</pre>
 * Los campos ausentes toman el valor por defecto de {@link EvaluationConfig}.
 */
@Slf4j
public class JsonConfigLoader {

    public static final String DEFAULT_RESOURCE = "gasex-evaluation.json";

    // Es costoso de crear y thread-safe: se reutiliza.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * @param path Ruta del archivo JSON.
     * @throws IOException Si el archivo no existe o no es un JSON válido.
     */
    public EvaluationConfig load(Path path) throws IOException {
        log.info("Cargando configuración de evaluación desde {}", path.toAbsolutePath());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }

        try {
            return objectMapper.readValue(path.toFile(), EvaluationConfig.class);
        } catch (IOException e) {
            log.error("Error al leer o parsear la configuración JSON desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Lee {@value #DEFAULT_RESOURCE} del classpath. Si el recurso no existe se usan los
     * valores por defecto.
     *
     * @throws IOException Si el recurso existe pero no es un JSON válido.
     */
    public EvaluationConfig loadDefault() throws IOException {
        try (InputStream in = JsonConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.info("Recurso {} no encontrado en el classpath. Se usa la configuración por defecto.", DEFAULT_RESOURCE);
                return EvaluationConfig.defaults();
            }
            EvaluationConfig config = objectMapper.readValue(in, EvaluationConfig.class);
            log.info("Configuración de evaluación cargada desde el classpath: {}", config);
            return config;
        }
    }
}
