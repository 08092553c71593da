package com.glyphforge.classification;

import com.glyphforge.api.exceptions.FitException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecisionTreeClassifierTest {

    @Test
    @DisplayName("Should pick the threshold with the highest information gain")
    void testBestThreshold() {
        DecisionTreeClassifier tree = new DecisionTreeClassifier(5);
        tree.fit(new double[][]{{0}, {1}, {2}, {3}}, new int[]{0, 0, 1, 1});

        assertThat(tree.root().featureIndex()).isZero();
        assertThat(tree.root().threshold()).isEqualTo(1.0);
        assertThat(tree.predict(new double[]{1.0})).isZero();
        assertThat(tree.predict(new double[]{1.5})).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep the first feature when gains tie")
    void testTieKeepsFirstFeature() {
        DecisionTreeClassifier tree = new DecisionTreeClassifier(5);
        tree.fit(new double[][]{{0, 0}, {1, 1}}, new int[]{0, 1});

        assertThat(tree.root().featureIndex()).isZero();
        assertThat(tree.root().threshold()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should break majority ties toward the smallest label")
    void testMajorityTie() {
        DecisionTreeClassifier tree = new DecisionTreeClassifier(0);
        tree.fit(new double[][]{{5}, {6}}, new int[]{2, 1});

        assertThat(tree.root().isLeaf()).isTrue();
        assertThat(tree.predict(new double[]{100})).isEqualTo(1);
    }

    @Test
    @DisplayName("Should make a leaf when every feature is constant")
    void testNoUsableSplit() {
        DecisionTreeClassifier tree = new DecisionTreeClassifier(5);
        tree.fit(new double[][]{{1}, {1}, {1}}, new int[]{0, 1, 1});

        assertThat(tree.root().isLeaf()).isTrue();
        assertThat(tree.predict(new double[]{1})).isEqualTo(1);
    }

    @Test
    @DisplayName("Should never grow beyond the maximum depth")
    void testDepthLimit() {
        Random random = new Random(7);
        double[][] x = new double[60][3];
        int[] y = new int[60];
        for (int i = 0; i < x.length; i++) {
            for (int f = 0; f < 3; f++) {
                x[i][f] = random.nextInt(10);
            }
            y[i] = random.nextInt(4);
        }

        DecisionTreeClassifier tree = new DecisionTreeClassifier(3);
        tree.fit(x, y);

        assertThat(tree.root().depth()).isLessThanOrEqualTo(3);
    }

    @Test
    @DisplayName("Should give identical predictions when refitted on the same data")
    void testRefitIdempotence() {
        Random random = new Random(42);
        double[][] x = new double[40][4];
        int[] y = new int[40];
        for (int i = 0; i < x.length; i++) {
            for (int f = 0; f < 4; f++) {
                x[i][f] = random.nextDouble();
            }
            y[i] = random.nextInt(3);
        }

        DecisionTreeClassifier tree = new DecisionTreeClassifier(4);
        tree.fit(x, y);
        int[] first = tree.predict(x);
        String firstShape = tree.root().toString();
        tree.fit(x, y);

        assertThat(tree.predict(x)).containsExactly(first);
        assertThat(tree.root().toString()).isEqualTo(firstShape);
    }

    @Test
    @DisplayName("Should fail to predict before fitting")
    void testPredictBeforeFit() {
        DecisionTreeClassifier tree = new DecisionTreeClassifier(3);

        assertThat(tree.isFitted()).isFalse();
        assertThatThrownBy(() -> tree.predict(new double[]{1.0}))
            .isInstanceOf(FitException.class)
            .hasMessageContaining("not been fitted");
    }

    @Test
    @DisplayName("Should reject empty and inconsistent training data")
    void testInvalidTrainingData() {
        DecisionTreeClassifier tree = new DecisionTreeClassifier(3);

        assertThatThrownBy(() -> tree.fit(new double[0][], new int[0]))
            .isInstanceOf(FitException.class);
        assertThatThrownBy(() -> tree.fit(new double[][]{{1}, {2}}, new int[]{0}))
            .isInstanceOf(FitException.class)
            .hasMessageContaining("does not match");
        assertThatThrownBy(() -> tree.fit(new double[][]{{1}, {2, 3}}, new int[]{0, 1}))
            .isInstanceOf(FitException.class);
        assertThatThrownBy(() -> tree.fit(new double[][]{{1}}, new int[]{-1}))
            .isInstanceOf(FitException.class);
    }
}
