package com.kensa.classifier.provider;

import com.kensa.common.exception.ClassifierException;
import com.kensa.image.model.ClassifierInput;

/**
 * 检测流程中的一个模型环节：要么绑定了分类器，要么明确为“未配置”。
 */
public final class ClassifierStage {

    private final String role;
    private final SurfaceClassifier classifier;

    private ClassifierStage(String role, SurfaceClassifier classifier) {
        this.role = role;
        this.classifier = classifier;
    }

    public static ClassifierStage bound(String role, SurfaceClassifier classifier) {
        if (classifier == null) {
            throw new IllegalArgumentException("分类器不能为空: " + role);
        }
        return new ClassifierStage(role, classifier);
    }

    public static ClassifierStage unbound(String role) {
        return new ClassifierStage(role, null);
    }

    public boolean isBound() {
        return classifier != null;
    }

    public String getRole() {
        return role;
    }

    public String describe() {
        return isBound() ? role + "=" + classifier.getName() : role + "=未配置";
    }

    public double probability(ClassifierInput input) {
        if (classifier == null) {
            throw new ClassifierException("未配置" + role + "模型");
        }
        return classifier.probability(input);
    }
}
