package com.kensa.inspection.config;

import com.kensa.common.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InspectionPropertiesTest {

    @Test
    void defaultsAreValid() {
        assertDoesNotThrow(() -> new InspectionProperties().validate());
    }

    @Test
    void rejectsInvertedUncertaintyBand() {
        InspectionProperties config = new InspectionProperties();
        config.setUncertaintyLower(0.6);
        config.setUncertaintyUpper(0.4);

        assertThrows(InvalidConfigurationException.class, config::validate);
    }

    @Test
    void rejectsEvenGaussianKernel() {
        InspectionProperties config = new InspectionProperties();
        config.getOpencv().setGaussianKernelSize(4);

        assertThrows(InvalidConfigurationException.class, config::validate);
    }

    @Test
    void rejectsHealthBandOutsideHundred() {
        InspectionProperties config = new InspectionProperties();
        config.setHealthCeiling(120);

        assertThrows(InvalidConfigurationException.class, config::validate);
    }

    @Test
    void rejectsZeroDefectFraction() {
        InspectionProperties config = new InspectionProperties();
        config.setMaxDefectFraction(0);

        assertThrows(InvalidConfigurationException.class, config::validate);
    }
}
