package io.github.jakubt4.kepler.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PlanetTest {

    @Test
    void geostationaryRadiusOfEarth() {
        final var earth = new Planet("Earth", 398600.4415, 6378.137, 86164.10);

        assertThat(earth.geostationaryRadius()).isCloseTo(42164.17, within(0.1));
    }

    @Test
    void earthUsesWgs84Constants() {
        final var earth = Planet.earth();

        assertThat(earth.getName()).isEqualTo("Earth");
        assertThat(earth.getMu()).isCloseTo(398600.4418, within(1e-6));
        assertThat(earth.getRadius()).isCloseTo(6378.137, within(1e-9));
        assertThat(earth.getSiderealDay()).isCloseTo(86164.09, within(0.01));
    }

    @Test
    void rejectsNonPositiveParameters() {
        assertThatThrownBy(() -> new Planet("Mars", 0.0, 3389.5, 88642.66))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Planet mu");

        final var mars = new Planet("Mars", 42828.37, 3389.5, 88642.66);
        assertThatThrownBy(() -> mars.setRadius(-1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> mars.setSiderealDay(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> mars.setMu(Double.POSITIVE_INFINITY)).isInstanceOf(IllegalArgumentException.class);

        assertThat(mars.getRadius()).isEqualTo(3389.5);
    }

    @Test
    void texturesAreCarriedUntouched() {
        final var earth = Planet.earth();
        earth.setDayTexture("assets/earth_day.jpg");
        earth.setNightTexture("assets/earth_night.jpg");

        assertThat(earth.toString())
                .contains("Name: Earth")
                .contains("DayTexture: assets/earth_day.jpg")
                .contains("NightTexture: assets/earth_night.jpg");
    }
}
