package org.imbalance.classification;

import org.imbalance.config.SamplingConfig;
import weka.classifiers.Classifier;
import weka.classifiers.bayes.NaiveBayes;
import weka.classifiers.lazy.IBk;
import weka.classifiers.meta.FilteredClassifier;
import weka.classifiers.trees.RandomForest;
import weka.core.SelectedTag;
import weka.filters.unsupervised.attribute.Normalize;

import java.util.function.Supplier;

public class ClassifierFactory {

    private ClassifierFactory() {
        throw new AssertionError("Utility class");
    }

    public static Classifier build(String name, int seed, int estimators) {
        return switch (name) {
            case "RandomForest" -> {
                RandomForest rf = new RandomForest();
                rf.setSeed(seed);
                rf.setNumIterations(estimators);
                rf.setNumExecutionSlots(1);
                yield rf;
            }
            case "NaiveBayes" -> new NaiveBayes();
            case "IBk" -> {
                IBk ibk = new IBk(5);
                ibk.setDistanceWeighting(new SelectedTag(IBk.WEIGHT_INVERSE, IBk.TAGS_WEIGHTING));

                FilteredClassifier fc = new FilteredClassifier();
                fc.setFilter(new Normalize());
                fc.setClassifier(ibk);
                yield fc;
            }
            default -> throw new IllegalArgumentException("Unsupported classifier: " + name);
        };
    }

    /**
     * A factory of fresh, identically configured classifiers, one per scored iteration.
     */
    public static Supplier<ClassifierCapability> capabilities(SamplingConfig config) {
        String name = config.getClassifierName();
        // fail on an unknown name at startup rather than at the first iteration
        build(name, config.getRandomState(), config.getEstimators());
        return () -> new WekaClassifierCapability(name,
                build(name, config.getRandomState(), config.getEstimators()),
                config.getFolds(), config.getRandomState());
    }
}
