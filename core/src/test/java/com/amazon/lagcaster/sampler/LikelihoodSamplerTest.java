/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.lagcaster.sampler;

import static com.amazon.lagcaster.TestUtils.EPSILON;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.StatUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.lagcaster.config.Likelihood;

public class LikelihoodSamplerTest {

    @ParameterizedTest
    @ValueSource(ints = { 1, 10, 1000 })
    public void testPoissonZeroRate(int numSamples) {
        LikelihoodSampler sampler = new LikelihoodSampler(Likelihood.poisson());
        double[][][] samples = sampler.sample(new double[][][] { { { 0.0 } }, { { -0.5 } } }, numSamples,
                new Well19937c(0));
        for (double[][] step : samples) {
            assertArrayEquals(new double[numSamples], step[0]);
        }
    }

    @Test
    public void testPoissonMean() {
        LikelihoodSampler sampler = new LikelihoodSampler(Likelihood.poisson());
        double[] draws = sampler.sample(new double[][][] { { { 4.0 } } }, 20000, new Well19937c(1))[0][0];
        assertEquals(4.0, StatUtils.mean(draws), 0.1);
        for (double draw : draws) {
            assertEquals(Math.rint(draw), draw);
        }
    }

    @Test
    public void testGaussianVarianceIsClamped() {
        LikelihoodSampler sampler = new LikelihoodSampler(Likelihood.gaussian());
        double[] draws = sampler.sample(new double[][][] { { { 3.0, -2.0 } } }, 100, new Well19937c(2))[0][0];
        for (double draw : draws) {
            assertFalse(Double.isNaN(draw));
            assertEquals(3.0, draw, 1e-3);
        }
        assertEquals(LikelihoodSampler.MIN_VARIANCE, LikelihoodSampler.clampVariance(0.0));
        assertThrows(IllegalArgumentException.class, () -> LikelihoodSampler.clampVariance(Double.NaN));
        assertArrayEquals(new double[] { 3.0, Math.sqrt(LikelihoodSampler.MIN_VARIANCE) },
                sampler.reportedParameters(new double[] { 3.0, -2.0 }));
        assertArrayEquals(new double[] { 3.0, 2.0 }, sampler.reportedParameters(new double[] { 3.0, 4.0 }));
    }

    @Test
    public void testGaussianMoments() {
        LikelihoodSampler sampler = new LikelihoodSampler(Likelihood.gaussian());
        double[] draws = sampler.sample(new double[][][] { { { -1.0, 4.0 } } }, 20000, new Well19937c(3))[0][0];
        assertEquals(-1.0, StatUtils.mean(draws), 0.05);
        assertEquals(4.0, StatUtils.variance(draws), 0.2);
    }

    @Test
    public void testInverseCdf() {
        double[] levels = { 0.1, 0.5, 0.9 };
        double[] values = { 1.0, 2.0, 4.0 };
        assertEquals(1.0, LikelihoodSampler.inverseCdf(levels, values, 0.05), EPSILON);
        assertEquals(1.0, LikelihoodSampler.inverseCdf(levels, values, 0.1), EPSILON);
        assertEquals(1.5, LikelihoodSampler.inverseCdf(levels, values, 0.3), EPSILON);
        assertEquals(3.0, LikelihoodSampler.inverseCdf(levels, values, 0.7), EPSILON);
        assertEquals(4.0, LikelihoodSampler.inverseCdf(levels, values, 0.99), EPSILON);
        // crossing predictions are sorted
        assertEquals(1.5, LikelihoodSampler.inverseCdf(levels, new double[] { 2.0, 1.0, 4.0 }, 0.3), EPSILON);
        assertEquals(7.0, LikelihoodSampler.inverseCdf(new double[] { 0.5 }, new double[] { 7.0 }, 0.3), EPSILON);
    }

    @Test
    public void testQuantileSamplesUseGenerator() {
        LikelihoodSampler sampler = new LikelihoodSampler(Likelihood.quantile(0.1, 0.5, 0.9));
        RandomGenerator random = mock(RandomGenerator.class);
        when(random.nextDouble()).thenReturn(0.3, 0.7);
        double[] draws = sampler.sample(new double[][][] { { { 1.0, 2.0, 4.0 } } }, 2, random)[0][0];
        assertArrayEquals(new double[] { 1.5, 3.0 }, draws, EPSILON);
    }

    @Test
    public void testQuantileSamplesStayInRange() {
        LikelihoodSampler sampler = new LikelihoodSampler(Likelihood.quantile());
        double[] values = { -3, -2, -1, 0, 1, 2, 3, 4, 5 };
        List<Double> draws = Arrays
                .stream(sampler.sample(new double[][][] { { values } }, 500, new Well19937c(4))[0][0]).boxed()
                .collect(Collectors.toList());
        assertThat(draws, everyItem(greaterThanOrEqualTo(-3.0)));
        assertThat(draws, everyItem(lessThanOrEqualTo(5.0)));
    }

    @Test
    public void testPointValues() {
        assertEquals(2.0, new LikelihoodSampler(Likelihood.quantile(0.1, 0.5, 0.9))
                .pointValue(new double[] { 1.0, 2.0, 4.0 }));
        assertEquals(0.0, new LikelihoodSampler(Likelihood.poisson()).pointValue(new double[] { -1.0 }));
        assertEquals(3.0, new LikelihoodSampler(Likelihood.gaussian()).pointValue(new double[] { 3.0, 1.0 }));
        assertThat(new LikelihoodSampler(Likelihood.none()).drawOne(new double[] { 1.25 }, new Well19937c(5)),
                closeTo(1.25, EPSILON));
        assertThrows(IllegalArgumentException.class,
                () -> new LikelihoodSampler(Likelihood.gaussian()).drawOne(new double[] { 1.0 }, new Well19937c()));
    }

    @Test
    public void testReproducibility() {
        LikelihoodSampler sampler = new LikelihoodSampler(Likelihood.poisson());
        double[][][] parameters = { { { 3.0 } }, { { 8.0 } } };
        double[][][] first = sampler.sample(parameters, 50, new Well19937c(9));
        double[][][] second = sampler.sample(parameters, 50, new Well19937c(9));
        for (int t = 0; t < 2; t++) {
            assertArrayEquals(first[t][0], second[t][0]);
        }
    }
}
