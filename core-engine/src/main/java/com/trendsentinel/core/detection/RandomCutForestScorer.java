package com.trendsentinel.core.detection;

import com.amazon.randomcutforest.RandomCutForest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link OutlierScorer} backed by an Amazon Random Cut Forest.
 *
 * <p>
 * A fresh one-dimensional forest is built per call. Every value is first
 * added to the forest, then every value is scored against the finished
 * forest, so each score reflects the whole series rather than only the
 * points seen before it. Time decay is zero, so once a series outgrows the
 * sample size each tree keeps a uniform sample of all of it and early and
 * late observations are judged alike.
 * </p>
 *
 * <p>
 * The forest is seeded and runs sequentially, which makes the scores
 * reproducible across runs.
 * </p>
 *
 * @since 1.0.0
 */
public class RandomCutForestScorer implements OutlierScorer {

    private static final Logger LOG = LoggerFactory.getLogger(RandomCutForestScorer.class);

    private final int numberOfTrees;
    private final int sampleSize;
    private final long randomSeed;

    /**
     * @param numberOfTrees trees in the forest; must be &gt; 0
     * @param sampleSize    points kept per tree; must be &gt; 0
     * @param randomSeed    seed for tree construction
     * @throws IllegalArgumentException if a size is not positive
     */
    public RandomCutForestScorer(int numberOfTrees, int sampleSize, long randomSeed) {
        if (numberOfTrees < 1) {
            throw new IllegalArgumentException("numberOfTrees must be >= 1, got: " + numberOfTrees);
        }
        if (sampleSize < 1) {
            throw new IllegalArgumentException("sampleSize must be >= 1, got: " + sampleSize);
        }
        this.numberOfTrees = numberOfTrees;
        this.sampleSize = sampleSize;
        this.randomSeed = randomSeed;
    }

    @Override
    public double[] score(double[] values) {
        double[] scores = new double[values.length];
        if (values.length == 0) {
            return scores;
        }

        RandomCutForest forest = RandomCutForest.builder()
                .dimensions(1)
                .numberOfTrees(numberOfTrees)
                .sampleSize(sampleSize)
                .outputAfter(1)
                .timeDecay(0)
                .randomSeed(randomSeed)
                .parallelExecutionEnabled(false)
                .build();

        for (double value : values) {
            forest.update(new double[] { value });
        }
        for (int i = 0; i < values.length; i++) {
            scores[i] = forest.getAnomalyScore(new double[] { values[i] });
        }

        LOG.trace("Scored {} point(s) with {} tree(s), sampleSize={}", values.length, numberOfTrees, sampleSize);
        return scores;
    }

    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public long getRandomSeed() {
        return randomSeed;
    }
}
