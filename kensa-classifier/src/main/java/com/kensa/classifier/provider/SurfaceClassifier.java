package com.kensa.classifier.provider;

import com.kensa.image.model.ClassifierInput;

/**
 * 预训练分类模型的抽象：输入预处理后的图片，输出一个 0-1 概率。
 * <p>
 * 检测流程只依赖这一个能力，不关心模型运行时是什么。
 */
public interface SurfaceClassifier {

    /**
     * @param input 预处理后的模型输入
     * @return 概率，取值 [0, 1]
     * @throws com.kensa.common.exception.ClassifierException 模型调用失败或返回非法值
     */
    double probability(ClassifierInput input);

    /**
     * 获取模型名称。
     */
    String getName();
}
