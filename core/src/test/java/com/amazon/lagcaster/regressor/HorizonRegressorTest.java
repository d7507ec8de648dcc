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

package com.amazon.lagcaster.regressor;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.amazon.lagcaster.lags.LaggedDataset;

@ExtendWith(MockitoExtension.class)
public class HorizonRegressorTest {

    @Mock
    private IRegressorFactory factory;

    @Mock
    private IRegressor first;

    @Mock
    private IRegressor second;

    private final LaggedDataset data = new LaggedDataset(new double[][] { { 1 }, { 2 } },
            new double[][] { { 10, 11 }, { 20, 21 } }, new int[] { 2 });

    @Test
    public void testOneRegressorPerColumn() {
        RegressorConfig config = RegressorConfig.defaults();
        when(factory.create(config)).thenReturn(first, second);
        when(first.getNumberOfOutputs()).thenReturn(1);
        when(second.getNumberOfOutputs()).thenReturn(1);

        HorizonRegressor model = HorizonRegressor.train(factory, config, data, null, 2, 1);
        verify(factory, times(2)).create(config);
        verify(first).fit(eq(data.getFeatures()), eq(new double[] { 10, 20 }), isNull());
        verify(second).fit(eq(data.getFeatures()), eq(new double[] { 11, 21 }), isNull());
        assertSame(first, model.getRegressor(0, 0));
        assertSame(second, model.getRegressor(1, 0));
        assertEquals(2, model.getSteps());
        assertEquals(1, model.getComponents());
        assertThrows(IllegalArgumentException.class, () -> model.getRegressor(2, 0));
    }

    @Test
    public void testEvaluationDataIsForwarded() {
        RegressorConfig config = RegressorConfig.defaults();
        when(factory.create(config)).thenReturn(first);
        when(first.getNumberOfOutputs()).thenReturn(1);
        LaggedDataset evaluation = new LaggedDataset(new double[][] { { 3 } }, new double[][] { { 30, 31 } },
                new int[] { 1 });

        HorizonRegressor.train(factory, config, data, evaluation, 1, 1);
        ArgumentCaptor<EvalSet> captor = ArgumentCaptor.forClass(EvalSet.class);
        verify(first).fit(any(), any(), captor.capture());
        assertArrayEquals(new double[] { 30 }, captor.getValue().getTargets());
        assertArrayEquals(new double[] { 3 }, captor.getValue().getFeatures()[0]);
    }

    @Test
    public void testTrainingFromLaterStep() {
        RegressorConfig config = RegressorConfig.defaults();
        when(factory.create(config)).thenReturn(first);
        when(first.getNumberOfOutputs()).thenReturn(1);
        LaggedDataset evaluation = new LaggedDataset(new double[][] { { 3 } }, new double[][] { { 30, 31 } },
                new int[] { 1 });

        HorizonRegressor model = HorizonRegressor.train(factory, config, data, evaluation, 1, 1, 1);
        ArgumentCaptor<EvalSet> captor = ArgumentCaptor.forClass(EvalSet.class);
        verify(first).fit(eq(data.getFeatures()), eq(new double[] { 11, 21 }), captor.capture());
        assertArrayEquals(new double[] { 31 }, captor.getValue().getTargets());
        assertEquals(1, model.getSteps());
        assertSame(first, model.getRegressor(0, 0));

        assertThrows(IllegalArgumentException.class,
                () -> HorizonRegressor.train(factory, config, data, null, -1, 1, 1));
    }

    @Test
    public void testPredictShape() {
        when(first.getNumberOfOutputs()).thenReturn(2);
        when(second.getNumberOfOutputs()).thenReturn(2);
        double[][] features = { { 1 }, { 2 }, { 3 } };
        when(first.predict(features)).thenReturn(new double[][] { { 1, 0.1 }, { 2, 0.2 }, { 3, 0.3 } });
        when(second.predict(features)).thenReturn(new double[][] { { 4, 0.4 }, { 5, 0.5 }, { 6, 0.6 } });

        // one step, two components
        HorizonRegressor model = new HorizonRegressor(1, 2, new IRegressor[] { first, second });
        double[][][][] predictions = model.predict(features);
        assertEquals(3, predictions.length);
        assertArrayEquals(new double[] { 2, 0.2 }, predictions[1][0][0]);
        assertArrayEquals(new double[] { 5, 0.5 }, predictions[1][0][1]);
        assertEquals(2, model.getNumberOfOutputs());
    }

    @Test
    public void testInconsistentRegressors() {
        when(first.getNumberOfOutputs()).thenReturn(1);
        when(second.getNumberOfOutputs()).thenReturn(2);
        assertThrows(IllegalArgumentException.class, () -> new HorizonRegressor(1, 2, new IRegressor[] { first,
                second }));
        assertThrows(IllegalArgumentException.class, () -> new HorizonRegressor(2, 2, new IRegressor[] { first }));
    }

    @Test
    public void testFactoryMustReturnRegressor() {
        assertThrows(NullPointerException.class,
                () -> HorizonRegressor.train(factory, RegressorConfig.defaults(), data, null, 1, 1));
    }
}
