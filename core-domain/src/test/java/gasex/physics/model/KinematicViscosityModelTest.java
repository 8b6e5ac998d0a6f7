package gasex.physics.model;

import gasex.physics.thermo.ReferenceSeawaterThermodynamics;
import gasex.physics.thermo.SeawaterThermodynamics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KinematicViscosityModelTest {

    @Mock
    private SeawaterThermodynamics mockThermodynamics;

    private KinematicViscosityModel model;

    @BeforeEach
    void setUp() {
        model = new KinematicViscosityModel(mockThermodynamics);
    }

    @Test
    @DisplayName("Ajuste de Knauss dividido por la densidad a presión nula que da el proveedor")
    void kinematicViscosity_shouldDivideDynamicViscosityByDensity() {
        // ARRANGE
        double sa = 35.0 * ReferenceSeawaterThermodynamics.REFERENCE_SALINITY_FACTOR;
        when(mockThermodynamics.conservativeTemperature(sa, 20.0)).thenReturn(20.01);
        when(mockThermodynamics.density(sa, 20.01, 0.0)).thenReturn(1000.0);

        // ACT
        double nu = model.kinematicViscosity(35.0, 20.0);

        // ASSERT
        double dynamic = 1e-4 * (17.91 - 0.5381 * 20.0 + 0.00694 * 400.0 + 0.02305 * 35.0);
        assertThat(nu).isCloseTo(dynamic / 1000.0, within(1e-18));
        verify(mockThermodynamics).density(eq(sa), eq(20.01), eq(0.0));
    }

    @Test
    @DisplayName("Las excepciones del proveedor se propagan sin envolver")
    void kinematicViscosity_shouldPropagateProviderFailure() {
        IllegalStateException upstream = new IllegalStateException("Proveedor no disponible");
        when(mockThermodynamics.conservativeTemperature(anyDouble(), anyDouble())).thenThrow(upstream);

        assertThatThrownBy(() -> model.kinematicViscosity(35.0, 10.0)).isSameAs(upstream);
    }

    @Test
    @DisplayName("NaN en la densidad se propaga al resultado")
    void kinematicViscosity_shouldPropagateNaN() {
        when(mockThermodynamics.conservativeTemperature(anyDouble(), anyDouble())).thenReturn(Double.NaN);
        when(mockThermodynamics.density(anyDouble(), anyDouble(), anyDouble())).thenReturn(Double.NaN);

        assertThat(model.kinematicViscosity(35.0, Double.NaN)).isNaN();
    }

    @Test
    @DisplayName("Con el proveedor de referencia: ν(35, 20 °C) ≈ 1.047e-6 m²/s y el agua dulce es menos viscosa")
    void kinematicViscosity_withReferenceProvider_shouldMatchKnownValues() {
        KinematicViscosityModel real = new KinematicViscosityModel(new ReferenceSeawaterThermodynamics());

        double seawater = real.kinematicViscosity(35.0, 20.0);
        double freshwater = real.kinematicViscosity(0.0, 20.0);

        assertThat(seawater).isCloseTo(1.0471458469e-6, within(1e-13));
        assertThat(freshwater).isCloseTo(9.941842335e-7, within(1e-13));
        assertThat(real.kinematicViscosity(35.0, 0.0)).isGreaterThan(seawater);
    }
}
