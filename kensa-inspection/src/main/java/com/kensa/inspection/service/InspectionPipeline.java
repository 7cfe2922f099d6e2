package com.kensa.inspection.service;

import com.kensa.classifier.provider.ClassifierRegistry;
import com.kensa.classifier.provider.ClassifierStage;
import com.kensa.image.model.ClassifierInput;
import com.kensa.image.model.FeatureExtraction;
import com.kensa.image.model.PixelGrid;
import com.kensa.image.model.RegionSet;
import com.kensa.image.service.ClassifierInputPreparer;
import com.kensa.image.service.FeatureExtractor;
import com.kensa.image.service.ImageDecoder;
import com.kensa.image.service.RegionAnalyzer;
import com.kensa.inspection.config.InspectionProperties;
import com.kensa.inspection.decision.DecisionPolicy;
import com.kensa.inspection.decision.DefectAssessment;
import com.kensa.inspection.model.DefectEvidence;
import com.kensa.inspection.model.ScoreResult;
import com.kensa.inspection.model.Verdict;
import com.kensa.inspection.score.ScoreEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.OptionalDouble;

/**
 * 检测流水线：字节 -> 像素网格 -> (门控) -> 特征 / 区域 或 模型概率 -> 评分 -> 判定。
 * <p>
 * 无状态，每次调用拥有自己的中间产物，可任意并发。解码、特征提取、模型调用的失败都以
 * 类型化异常抛出，不会替调用方兜底成“安全”的结论。
 */
@Slf4j
@Service
public class InspectionPipeline {

    private final ImageDecoder decoder;
    private final FeatureExtractor featureExtractor;
    private final RegionAnalyzer regionAnalyzer;
    private final ClassifierInputPreparer inputPreparer;
    private final ScoreEngine scoreEngine;
    private final DecisionPolicy decisionPolicy;
    private final ClassifierStage gatekeeper;
    private final ClassifierStage defectClassifier;
    private final InspectionProperties defaultConfig;

    @Autowired
    public InspectionPipeline(ImageDecoder decoder, FeatureExtractor featureExtractor,
                              RegionAnalyzer regionAnalyzer, ClassifierInputPreparer inputPreparer,
                              ScoreEngine scoreEngine, DecisionPolicy decisionPolicy,
                              ClassifierRegistry classifierRegistry, InspectionProperties defaultConfig) {
        this(decoder, featureExtractor, regionAnalyzer, inputPreparer, scoreEngine, decisionPolicy,
                classifierRegistry.gatekeeper(), classifierRegistry.defect(), defaultConfig);
    }

    public InspectionPipeline(ImageDecoder decoder, FeatureExtractor featureExtractor,
                              RegionAnalyzer regionAnalyzer, ClassifierInputPreparer inputPreparer,
                              ScoreEngine scoreEngine, DecisionPolicy decisionPolicy,
                              ClassifierStage gatekeeper, ClassifierStage defectClassifier,
                              InspectionProperties defaultConfig) {
        this.decoder = decoder;
        this.featureExtractor = featureExtractor;
        this.regionAnalyzer = regionAnalyzer;
        this.inputPreparer = inputPreparer;
        this.scoreEngine = scoreEngine;
        this.decisionPolicy = decisionPolicy;
        this.gatekeeper = gatekeeper;
        this.defectClassifier = defectClassifier;
        this.defaultConfig = defaultConfig;
    }

    /**
     * 使用启动时加载的配置执行检测。
     */
    public Verdict inspect(byte[] imageBytes, OptionalDouble externalProbability) {
        return inspect(imageBytes, defaultConfig, externalProbability);
    }

    /**
     * 执行一次完整检测。
     *
     * @param imageBytes          原始图片字节
     * @param config              判定配置
     * @param externalProbability 调用方已持有的缺陷概率（仅分类模式使用，给出时不再调用缺陷模型）
     */
    public Verdict inspect(byte[] imageBytes, InspectionProperties config, OptionalDouble externalProbability) {
        config.validate();
        long start = System.currentTimeMillis();

        PixelGrid grid = decoder.decode(imageBytes);
        ModelInput modelInput = new ModelInput(grid, config.getOpencv().getClassifierInputSize());

        Double gatekeeperScore = null;
        if (gatekeeper.isBound()) {
            gatekeeperScore = gatekeeper.probability(modelInput.get());
            log.info("{}模型分数: {}", gatekeeper.getRole(), String.format("%.4f", gatekeeperScore));
        }

        final Double gate = gatekeeperScore;
        Verdict verdict = decisionPolicy.decide(gatekeeperScore,
                () -> assessDefects(grid, modelInput, gate, config, externalProbability), config);

        ScoreResult scores = verdict.getScores();
        log.info("检测完成: {} | 健康分 {} | 缺陷分 {} | 缺陷数 {} | 模式 {} | 耗时 {}ms",
                verdict.getStatus(), String.format("%.2f", scores.getHealthScore()),
                String.format("%.4f", scores.getDefectScore()), verdict.getDefectCount(),
                verdict.getMode(), System.currentTimeMillis() - start);
        return verdict;
    }

    private DefectAssessment assessDefects(PixelGrid grid, ModelInput modelInput, Double gatekeeperScore,
                                           InspectionProperties config, OptionalDouble externalProbability) {
        if (!config.getMode().isGeometric()) {
            double probability = externalProbability.isPresent()
                    ? externalProbability.getAsDouble()
                    : defectClassifier.probability(modelInput.get());
            ScoreResult scores = scoreEngine.score(DefectEvidence.probability(probability), gatekeeperScore, config);
            return new DefectAssessment(scores, 0, config.getMode());
        }

        if (externalProbability.isPresent()) {
            log.debug("几何评分模式忽略外部概率 {}", externalProbability.getAsDouble());
        }
        FeatureExtraction extraction = featureExtractor.extract(grid, config.getOpencv());
        RegionSet regions = regionAnalyzer.analyze(extraction.getMask(), config.getOpencv().getMinRegionArea());
        DefectEvidence evidence = DefectEvidence.geometric(regions, grid.area(),
                extraction.getMask().foregroundCount());
        ScoreResult scores = scoreEngine.score(evidence, gatekeeperScore, config);
        return new DefectAssessment(scores, regions.count(), config.getMode());
    }

    /**
     * 模型输入只在第一次需要时生成，门控与缺陷模型共用。
     */
    private final class ModelInput {

        private final PixelGrid grid;
        private final int size;
        private ClassifierInput prepared;

        private ModelInput(PixelGrid grid, int size) {
            this.grid = grid;
            this.size = size;
        }

        private ClassifierInput get() {
            if (prepared == null) {
                prepared = inputPreparer.prepare(grid, size);
            }
            return prepared;
        }
    }
}
