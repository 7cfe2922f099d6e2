package com.kensa.inspection.service;

import com.kensa.classifier.provider.ClassifierRegistry;
import com.kensa.classifier.provider.ClassifierStage;
import com.kensa.classifier.provider.SurfaceClassifier;
import com.kensa.common.exception.ClassifierException;
import com.kensa.common.exception.DecodeException;
import com.kensa.common.exception.FeatureExtractionException;
import com.kensa.common.exception.InvalidConfigurationException;
import com.kensa.image.model.ClassifierInput;
import com.kensa.image.service.ClassifierInputPreparer;
import com.kensa.image.service.FeatureExtractor;
import com.kensa.image.service.ImageDecoder;
import com.kensa.image.service.RegionAnalyzer;
import com.kensa.inspection.config.InspectionProperties;
import com.kensa.inspection.decision.DecisionPolicy;
import com.kensa.inspection.model.ExplanationKey;
import com.kensa.inspection.model.ScoringMode;
import com.kensa.inspection.model.Verdict;
import com.kensa.inspection.model.VerdictStatus;
import com.kensa.inspection.score.ClassifierScoringStrategy;
import com.kensa.inspection.score.EdgeDensityScoringStrategy;
import com.kensa.inspection.score.GeometricScoringStrategy;
import com.kensa.inspection.score.ScoreEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalDouble;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class InspectionPipelineTest {

    private final ScoreEngine scoreEngine = new ScoreEngine(List.of(
            new GeometricScoringStrategy(), new EdgeDensityScoringStrategy(), new ClassifierScoringStrategy()));

    private InspectionProperties config;

    @BeforeEach
    void setUp() {
        config = new InspectionProperties();
    }

    private InspectionPipeline pipeline(ClassifierStage gatekeeper, ClassifierStage defect) {
        return new InspectionPipeline(new ImageDecoder(), new FeatureExtractor(), new RegionAnalyzer(),
                new ClassifierInputPreparer(), scoreEngine, new DecisionPolicy(scoreEngine),
                gatekeeper, defect, config);
    }

    private InspectionPipeline geometricOnly() {
        return pipeline(ClassifierStage.unbound(ClassifierRegistry.GATEKEEPER),
                ClassifierStage.unbound(ClassifierRegistry.DEFECT));
    }

    @Nested
    class Geometric {

        @Test
        @DisplayName("九处亮斑：缺陷数与健康分同时超限，判 FAIL")
        void manySpotsFail() {
            Verdict verdict = geometricOnly().inspect(SurfaceImages.plateWithSpots(9), OptionalDouble.empty());

            assertEquals(VerdictStatus.FAIL, verdict.getStatus());
            assertEquals(ExplanationKey.DEFECTS_EXCEED_LIMIT, verdict.getExplanationKey());
            assertEquals(9, verdict.getDefectCount());
            assertThat(verdict.getScores().getHealthScore()).isLessThan(90.0);
            assertNull(verdict.getScores().getGatekeeperScore());
            assertEquals(ScoringMode.GEOMETRIC, verdict.getMode());
        }

        @Test
        void singleSpotPasses() {
            Verdict verdict = geometricOnly().inspect(SurfaceImages.plateWithSpots(1), OptionalDouble.empty());

            assertEquals(VerdictStatus.PASS, verdict.getStatus());
            assertEquals(ExplanationKey.SURFACE_CLEAN, verdict.getExplanationKey());
            assertEquals(1, verdict.getDefectCount());
            assertTrue(verdict.isConclusive());
        }

        @Test
        void sameBytesGiveSameVerdict() {
            byte[] image = SurfaceImages.plateWithSpots(4);
            InspectionPipeline pipeline = geometricOnly();

            assertEquals(pipeline.inspect(image, OptionalDouble.empty()),
                    pipeline.inspect(image, OptionalDouble.empty()));
        }

        @Test
        @DisplayName("亮斑越多，缺陷分不降、健康分不升")
        void moreSpotsNeverLookHealthier() {
            InspectionPipeline pipeline = geometricOnly();
            double previousDefect = -1;
            double previousHealth = 101;
            for (int spots : new int[]{1, 2, 4, 8}) {
                Verdict verdict = pipeline.inspect(SurfaceImages.plateWithSpots(spots), OptionalDouble.empty());
                assertEquals(spots, verdict.getDefectCount());
                assertThat(verdict.getScores().getDefectScore()).isGreaterThanOrEqualTo(previousDefect);
                assertThat(verdict.getScores().getHealthScore()).isLessThanOrEqualTo(previousHealth);
                previousDefect = verdict.getScores().getDefectScore();
                previousHealth = verdict.getScores().getHealthScore();
            }
        }

        @Test
        void externalProbabilityIsIgnored() {
            byte[] image = SurfaceImages.plateWithSpots(9);
            InspectionPipeline pipeline = geometricOnly();

            assertEquals(pipeline.inspect(image, OptionalDouble.empty()),
                    pipeline.inspect(image, OptionalDouble.of(0.01)));
        }

        @Test
        void flatPlateHasNoFeatures() {
            assertThrows(FeatureExtractionException.class,
                    () -> geometricOnly().inspect(SurfaceImages.flatPlate(128), OptionalDouble.empty()));
        }

        @Test
        void undecodableBytesAreRejected() {
            byte[] garbage = "definitely not an image".getBytes();

            assertThrows(DecodeException.class, () -> geometricOnly().inspect(garbage, OptionalDouble.empty()));
            assertThrows(DecodeException.class, () -> geometricOnly().inspect(new byte[0], OptionalDouble.empty()));
        }

        @Test
        void invalidConfigurationFailsBeforeDecoding() {
            config.setMaxDefectFraction(-1);

            assertThrows(InvalidConfigurationException.class,
                    () -> geometricOnly().inspect(new byte[0], OptionalDouble.empty()));
        }
    }

    @Test
    @DisplayName("随机噪声图：分数始终落在各自区间内")
    void scoresStayInRangeOnRandomInput() {
        Random random = new Random(7);
        InspectionPipeline pipeline = geometricOnly();
        InspectionProperties edgeDensity = new InspectionProperties();
        edgeDensity.setMode(ScoringMode.EDGE_DENSITY);

        for (int i = 0; i < 25; i++) {
            byte[] image = SurfaceImages.randomPlate(random);

            Verdict geometric = pipeline.inspect(image, OptionalDouble.empty());
            assertThat(geometric.getScores().getHealthScore()).isBetween(0.0, 100.0);
            assertThat(geometric.getScores().getDefectScore()).isBetween(0.0, 1.0);
            assertTrue(geometric.isConclusive());

            Verdict edges = pipeline.inspect(image, edgeDensity, OptionalDouble.empty());
            assertThat(edges.getScores().getHealthScore()).isBetween(10.0, 99.0);
            assertThat(edges.getScores().getDefectScore()).isBetween(0.0, 1.0);
        }
    }

    @Nested
    class WithModels {

        private SurfaceClassifier gatekeeperModel;
        private SurfaceClassifier defectModel;

        @BeforeEach
        void mockModels() {
            gatekeeperModel = mock(SurfaceClassifier.class);
            defectModel = mock(SurfaceClassifier.class);
        }

        private InspectionPipeline bound() {
            return pipeline(ClassifierStage.bound(ClassifierRegistry.GATEKEEPER, gatekeeperModel),
                    ClassifierStage.bound(ClassifierRegistry.DEFECT, defectModel));
        }

        @Test
        void uncertainGatekeeperSkipsDefectModel() {
            config.setMode(ScoringMode.CLASSIFIER);
            when(gatekeeperModel.probability(any(ClassifierInput.class))).thenReturn(0.5);

            Verdict verdict = bound().inspect(SurfaceImages.plateWithSpots(9), OptionalDouble.empty());

            assertEquals(VerdictStatus.UNCERTAIN, verdict.getStatus());
            assertEquals(ExplanationKey.SURFACE_UNCLEAR, verdict.getExplanationKey());
            assertEquals(0.5, verdict.getScores().getGatekeeperScore());
            assertEquals(0.0, verdict.getScores().getHealthScore());
            verify(gatekeeperModel, times(1)).probability(any());
            verifyNoInteractions(defectModel);
        }

        @Test
        void lowGatekeeperMeansNotMetal() {
            when(gatekeeperModel.probability(any(ClassifierInput.class))).thenReturn(0.1);

            Verdict verdict = bound().inspect(SurfaceImages.plateWithSpots(9), OptionalDouble.empty());

            assertEquals(VerdictStatus.INVALID_INPUT, verdict.getStatus());
            assertEquals(0, verdict.getDefectCount());
            verifyNoInteractions(defectModel);
        }

        @Test
        void classifierModeUsesDefectModelOnce() {
            config.setMode(ScoringMode.CLASSIFIER);
            when(gatekeeperModel.probability(any(ClassifierInput.class))).thenReturn(0.95);
            when(defectModel.probability(any(ClassifierInput.class))).thenReturn(0.50001);

            Verdict verdict = bound().inspect(SurfaceImages.plateWithSpots(1), OptionalDouble.empty());

            assertEquals(VerdictStatus.FAIL, verdict.getStatus());
            assertEquals(39.9992, verdict.getScores().getHealthScore(), 1e-9);
            assertEquals(0.95, verdict.getScores().getGatekeeperScore());
            verify(gatekeeperModel, times(1)).probability(any());
            verify(defectModel, times(1)).probability(any());
        }

        @Test
        void externalProbabilityReplacesDefectModel() {
            config.setMode(ScoringMode.CLASSIFIER);
            InspectionPipeline pipeline = pipeline(ClassifierStage.unbound(ClassifierRegistry.GATEKEEPER),
                    ClassifierStage.bound(ClassifierRegistry.DEFECT, defectModel));

            Verdict verdict = pipeline.inspect(SurfaceImages.plateWithSpots(9), OptionalDouble.of(0.5));

            assertEquals(VerdictStatus.PASS, verdict.getStatus());
            assertEquals(90.0, verdict.getScores().getHealthScore(), 1e-12);
            verifyNoInteractions(defectModel);
        }

        @Test
        void classifierModeWithoutAnyProbabilityFails() {
            config.setMode(ScoringMode.CLASSIFIER);
            InspectionPipeline pipeline = geometricOnly();

            assertThrows(ClassifierException.class,
                    () -> pipeline.inspect(SurfaceImages.plateWithSpots(1), OptionalDouble.empty()));
        }

        @Test
        void modelFailurePropagates() {
            when(gatekeeperModel.probability(any(ClassifierInput.class)))
                    .thenThrow(new ClassifierException("模型服务不可用"));

            assertThrows(ClassifierException.class,
                    () -> bound().inspect(SurfaceImages.plateWithSpots(1), OptionalDouble.empty()));
            verifyNoInteractions(defectModel);
        }

        @Test
        void gatekeeperAboveBandProceedsToGeometry() {
            when(gatekeeperModel.probability(any(ClassifierInput.class))).thenReturn(0.9);

            Verdict verdict = bound().inspect(SurfaceImages.plateWithSpots(9), OptionalDouble.empty());

            assertEquals(VerdictStatus.FAIL, verdict.getStatus());
            assertEquals(0.9, verdict.getScores().getGatekeeperScore());
            verifyNoInteractions(defectModel);
        }
    }
}
